package dev.pekelund.reconcile.pricing;

import dev.pekelund.reconcile.units.BaseQuantity;
import dev.pekelund.reconcile.units.BaseUnit;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Expresses a classified line's unit price per gram, milliliter or count.
 *
 * <p>Weight-based lines divide by the weight unit's factor. Quantity-based lines resolve the base
 * quantity per case from the pack notation, then from a measurable quantity unit, and otherwise price
 * per count. Undetermined lines and lines whose pack notation needs review produce no price.
 */
public class LinePriceNormalizer {

    static final int PRICE_SCALE = 8;

    public Optional<NormalizedPrice> normalize(PricingDetection detection, LineAmounts amounts, LineUnits units) {
        if (detection == null || !detection.isDetermined() || amounts.unitPrice() == null) {
            return Optional.empty();
        }
        LineUnits resolvedUnits = units != null ? units : LineUnits.NONE;
        if (detection.isWeightBased()) {
            return normalizeWeight(amounts, resolvedUnits);
        }
        return normalizeQuantity(amounts, resolvedUnits);
    }

    private Optional<NormalizedPrice> normalizeWeight(LineAmounts amounts, LineUnits units) {
        if (units.weightUnit() == null) {
            return Optional.empty();
        }
        BigDecimal factor = units.weightUnit().factor();
        BigDecimal pricePerBase = divide(amounts.unitPrice(), factor);
        BigDecimal total = amounts.weight().multiply(factor);
        return Optional.of(new NormalizedPrice(units.weightUnit().baseUnit(), pricePerBase, total));
    }

    private Optional<NormalizedPrice> normalizeQuantity(LineAmounts amounts, LineUnits units) {
        BigDecimal quantity = amounts.quantity() != null ? amounts.quantity() : BigDecimal.ONE;
        if (units.packFormat() != null) {
            if (units.packFormat().requiresReview()) {
                return Optional.empty();
            }
            Optional<BaseQuantity> perCase = units.packFormat().quantityPerCase();
            if (perCase.isPresent() && perCase.get().value().signum() > 0) {
                BaseQuantity basePerCase = perCase.get();
                return Optional.of(new NormalizedPrice(basePerCase.unit(),
                    divide(amounts.unitPrice(), basePerCase.value()),
                    quantity.multiply(basePerCase.value())));
            }
        }
        if (units.quantityUnit() != null && units.quantityUnit().isMeasurable()) {
            BigDecimal factor = units.quantityUnit().factor();
            return Optional.of(new NormalizedPrice(units.quantityUnit().baseUnit(),
                divide(amounts.unitPrice(), factor), quantity.multiply(factor)));
        }
        return Optional.of(new NormalizedPrice(BaseUnit.COUNT, amounts.unitPrice(), quantity));
    }

    private static BigDecimal divide(BigDecimal value, BigDecimal divisor) {
        return value.divide(divisor, PRICE_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
    }
}
