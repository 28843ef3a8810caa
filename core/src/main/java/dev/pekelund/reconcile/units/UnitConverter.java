package dev.pekelund.reconcile.units;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Converts invoice quantities to and from canonical base units.
 */
public final class UnitConverter {

    static final int SCALE = 10;

    private UnitConverter() {
        // Utility class
    }

    public static BaseQuantity convert(BigDecimal value, String unit) {
        return convert(value, MeasurementUnit.of(unit));
    }

    public static BaseQuantity convert(BigDecimal value, MeasurementUnit unit) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(unit, "unit");
        return new BaseQuantity(value.multiply(unit.factor()), unit.baseUnit());
    }

    /**
     * Expresses a base quantity in the given unit. The unit must share the quantity's base unit.
     */
    public static BigDecimal fromBase(BaseQuantity quantity, MeasurementUnit unit) {
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(unit, "unit");
        if (quantity.unit() != unit.baseUnit()) {
            throw new IllegalArgumentException(String.format("Cannot express %s as %s", quantity.unit(), unit));
        }
        return quantity.value().divide(unit.factor(), SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal convert(BigDecimal value, MeasurementUnit from, MeasurementUnit to) {
        return fromBase(convert(value, from), to);
    }
}
