package dev.pekelund.reconcile.lines;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Flags confirmed prices that moved more than a relative threshold away from the inventory price.
 */
public class PriceChangePolicy {

    public static final BigDecimal DEFAULT_THRESHOLD = new BigDecimal("0.10");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal threshold;

    public PriceChangePolicy() {
        this(DEFAULT_THRESHOLD);
    }

    public PriceChangePolicy(BigDecimal threshold) {
        if (threshold == null || threshold.signum() < 0) {
            throw new IllegalArgumentException("threshold must be zero or positive");
        }
        this.threshold = threshold;
    }

    public BigDecimal threshold() {
        return threshold;
    }

    /**
     * @return a note describing the change when it exceeds the threshold
     */
    public Optional<String> evaluate(BigDecimal previousPrice, BigDecimal newPrice) {
        if (previousPrice == null || previousPrice.signum() <= 0 || newPrice == null) {
            return Optional.empty();
        }
        BigDecimal change = newPrice.subtract(previousPrice).abs().divide(previousPrice, 6, RoundingMode.HALF_UP);
        if (change.compareTo(threshold) <= 0) {
            return Optional.empty();
        }
        return Optional.of(String.format("Price changed %s%% from $%s to $%s",
            change.multiply(HUNDRED).setScale(1, RoundingMode.HALF_UP).toPlainString(),
            previousPrice.setScale(2, RoundingMode.HALF_UP).toPlainString(),
            newPrice.setScale(2, RoundingMode.HALF_UP).toPlainString()));
    }
}
