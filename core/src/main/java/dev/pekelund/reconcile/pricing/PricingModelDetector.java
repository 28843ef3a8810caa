package dev.pekelund.reconcile.pricing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Decides per line whether the vendor priced by weight or by quantity, using only arithmetic on the
 * printed values. A line whose total matches neither computation is left undetermined and flagged as
 * a discrepancy.
 */
public class PricingModelDetector {

    private static final BigDecimal FULL_CONFIDENCE = BigDecimal.ONE;
    private static final BigDecimal AMBIGUOUS_CONFIDENCE = new BigDecimal("0.75");
    private static final BigDecimal LEARNED_BONUS = new BigDecimal("0.10");

    private final PricingTolerance tolerance;

    public PricingModelDetector() {
        this(PricingTolerance.DEFAULT);
    }

    public PricingModelDetector(PricingTolerance tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public PricingTolerance tolerance() {
        return tolerance;
    }

    public PricingDetection detect(LineAmounts amounts) {
        return detect(amounts, DetectionHints.NONE);
    }

    public PricingDetection detect(LineAmounts amounts, DetectionHints hints) {
        Objects.requireNonNull(amounts, "amounts");
        DetectionHints resolvedHints = hints != null ? hints : DetectionHints.NONE;

        if (amounts.unitPrice() == null || amounts.totalPrice() == null) {
            return new PricingDetection(PricingModel.UNDETERMINED, null, null, true,
                "Unit price and line total are both required to verify pricing", BigDecimal.ZERO);
        }

        BigDecimal quantityTotal = amounts.quantity() != null ? amounts.quantity().multiply(amounts.unitPrice()) : null;
        BigDecimal weightTotal = amounts.hasWeight() ? amounts.weight().multiply(amounts.unitPrice()) : null;
        boolean quantityMatches = tolerance.matches(quantityTotal, amounts.totalPrice());
        boolean weightMatches = tolerance.matches(weightTotal, amounts.totalPrice());

        if (weightMatches && !quantityMatches) {
            return determined(PricingModel.WEIGHT, quantityTotal, weightTotal, null, FULL_CONFIDENCE, resolvedHints);
        }
        if (quantityMatches && !weightMatches) {
            return determined(PricingModel.QUANTITY, quantityTotal, weightTotal, null, FULL_CONFIDENCE, resolvedHints);
        }
        if (quantityMatches) {
            return determined(PricingModel.QUANTITY, quantityTotal, weightTotal,
                "Quantity and weight totals both match the line total; treated as quantity-based",
                AMBIGUOUS_CONFIDENCE, resolvedHints);
        }

        return new PricingDetection(PricingModel.UNDETERMINED, quantityTotal, weightTotal, true,
            mismatchNote(amounts.totalPrice(), quantityTotal, weightTotal), BigDecimal.ZERO);
    }

    private PricingDetection determined(PricingModel model, BigDecimal quantityTotal, BigDecimal weightTotal,
        String note, BigDecimal baseConfidence, DetectionHints hints) {

        BigDecimal confidence = baseConfidence.add(hints.confidenceAdjustment());
        if (hints.learnedModel() == model) {
            confidence = confidence.add(LEARNED_BONUS);
        }
        confidence = confidence.max(BigDecimal.ZERO).min(BigDecimal.ONE);
        return new PricingDetection(model, quantityTotal, weightTotal, false, note, confidence);
    }

    private static String mismatchNote(BigDecimal total, BigDecimal quantityTotal, BigDecimal weightTotal) {
        StringBuilder note = new StringBuilder("Line total ").append(money(total)).append(" does not match");
        if (quantityTotal != null) {
            note.append(" quantity x unit price (").append(money(quantityTotal)).append(')');
        } else {
            note.append(" a quantity-based total (no quantity)");
        }
        if (weightTotal != null) {
            note.append(" or weight x unit price (").append(money(weightTotal)).append(')');
        }
        return note.append(" within tolerance").toString();
    }

    private static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
