package dev.pekelund.reconcile.units;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A quantity expressed in one of the canonical {@link BaseUnit}s.
 */
public record BaseQuantity(BigDecimal value, BaseUnit unit) {

    public BaseQuantity {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(unit, "unit");
    }

    public BaseQuantity multiply(BigDecimal factor) {
        return new BaseQuantity(value.multiply(factor), unit);
    }

    public static BaseQuantity count(long value) {
        return new BaseQuantity(BigDecimal.valueOf(value), BaseUnit.COUNT);
    }
}
