package dev.pekelund.reconcile.pricing;

import dev.pekelund.reconcile.units.BaseUnit;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * A line price expressed per canonical base unit.
 *
 * @param baseUnit gram, milliliter or count
 * @param pricePerBaseUnit the price of one base unit
 * @param totalBaseUnits base units delivered on the line
 */
public record NormalizedPrice(BaseUnit baseUnit, BigDecimal pricePerBaseUnit, BigDecimal totalBaseUnits) {

    public NormalizedPrice {
        Objects.requireNonNull(baseUnit, "baseUnit");
        Objects.requireNonNull(pricePerBaseUnit, "pricePerBaseUnit");
    }

    public BigDecimal pricePerG() {
        return baseUnit == BaseUnit.GRAM ? pricePerBaseUnit : null;
    }

    public BigDecimal pricePerMl() {
        return baseUnit == BaseUnit.MILLILITER ? pricePerBaseUnit : null;
    }

    public BigDecimal pricePerUnit() {
        return baseUnit == BaseUnit.COUNT ? pricePerBaseUnit : null;
    }
}
