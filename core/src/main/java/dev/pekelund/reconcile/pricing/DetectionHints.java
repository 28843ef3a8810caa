package dev.pekelund.reconcile.pricing;

import java.math.BigDecimal;

/**
 * Vendor-specific knowledge that biases the confidence of a detection without changing it.
 *
 * @param confidenceAdjustment the vendor profile's adjustment, zero or negative
 * @param learnedModel the model a human previously confirmed for this recurring item, or null
 */
public record DetectionHints(BigDecimal confidenceAdjustment, PricingModel learnedModel) {

    public static final DetectionHints NONE = new DetectionHints(BigDecimal.ZERO, null);

    public DetectionHints {
        confidenceAdjustment = confidenceAdjustment != null ? confidenceAdjustment : BigDecimal.ZERO;
    }
}
