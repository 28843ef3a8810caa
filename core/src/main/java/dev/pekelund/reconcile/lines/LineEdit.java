package dev.pekelund.reconcile.lines;

import dev.pekelund.reconcile.units.MeasurementUnit;
import java.math.BigDecimal;

/**
 * Manual corrections to a line's parsed values. Null fields are left unchanged.
 */
public record LineEdit(
    String description,
    BigDecimal quantity,
    BigDecimal weight,
    MeasurementUnit weightUnit,
    BigDecimal unitPrice,
    BigDecimal totalPrice,
    String notes
) {

    public static LineEdit notes(String notes) {
        return new LineEdit(null, null, null, null, null, null, notes);
    }

    public boolean changesValues() {
        return description != null || quantity != null || weight != null || weightUnit != null
            || unitPrice != null || totalPrice != null;
    }

    public boolean changesAmounts() {
        return quantity != null || weight != null || weightUnit != null || unitPrice != null || totalPrice != null;
    }
}
