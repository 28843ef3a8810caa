package dev.pekelund.reconcile.profile;

import dev.pekelund.reconcile.pricing.PricingModel;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * A value a human corrected on a recurring item. The pricing model it implies biases detection
 * confidence the next time the same item is seen.
 *
 * @param key item code, or description when the vendor prints no code, as produced by {@link #keyFor}
 * @param pricingModel {@code WEIGHT} for a weight correction, {@code QUANTITY} for a count correction
 * @param value the corrected weight or quantity
 * @param unit unit of the corrected value
 * @param correctedAt when the correction was made
 */
public record ItemCorrection(String key, PricingModel pricingModel, BigDecimal value, String unit,
    Instant correctedAt) {

    public ItemCorrection {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(pricingModel, "pricingModel");
    }

    public static String keyFor(String itemCode, String description) {
        if (StringUtils.hasText(itemCode)) {
            return itemCode.trim().toLowerCase(Locale.ROOT);
        }
        if (StringUtils.hasText(description)) {
            return description.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        }
        return null;
    }
}
