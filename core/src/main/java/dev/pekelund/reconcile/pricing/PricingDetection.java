package dev.pekelund.reconcile.pricing;

import java.math.BigDecimal;

/**
 * Outcome of classifying a single line.
 *
 * @param model the detected pricing model
 * @param quantityTotal quantity multiplied by unit price, when both are known
 * @param weightTotal weight multiplied by unit price, when both are known
 * @param discrepancy true when neither computed total matches the printed total
 * @param note explanation of an ambiguous or failed detection
 * @param confidence confidence in the classification between 0 and 1
 */
public record PricingDetection(
    PricingModel model,
    BigDecimal quantityTotal,
    BigDecimal weightTotal,
    boolean discrepancy,
    String note,
    BigDecimal confidence
) {

    public boolean isWeightBased() {
        return model == PricingModel.WEIGHT;
    }

    public boolean isQuantityBased() {
        return model == PricingModel.QUANTITY;
    }

    public boolean isDetermined() {
        return model != PricingModel.UNDETERMINED;
    }
}
