package dev.pekelund.reconcile.classification;

import dev.pekelund.reconcile.units.MeasurementUnit;
import java.math.BigDecimal;

/**
 * Values a human fixed on a sample line. Null fields were left as extracted.
 */
public record LineCorrection(
    String description,
    BigDecimal quantity,
    BigDecimal weight,
    MeasurementUnit weightUnit,
    BigDecimal unitPrice
) {

    public boolean isEmpty() {
        return description == null && quantity == null && weight == null && unitPrice == null;
    }
}
