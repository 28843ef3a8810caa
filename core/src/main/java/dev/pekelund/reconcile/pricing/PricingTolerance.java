package dev.pekelund.reconcile.pricing;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Tolerance used when checking a computed line total against the total printed by the vendor. A
 * candidate matches when {@code |candidate - total| <= max(absolute, relative * |total|)}.
 *
 * @param relative fraction of the printed total, 0.01 by default
 * @param absolute currency amount, 0.02 by default, covering per-line rounding
 */
public record PricingTolerance(BigDecimal relative, BigDecimal absolute) {

    public static final BigDecimal DEFAULT_RELATIVE = new BigDecimal("0.01");
    public static final BigDecimal DEFAULT_ABSOLUTE = new BigDecimal("0.02");
    public static final PricingTolerance DEFAULT = new PricingTolerance(DEFAULT_RELATIVE, DEFAULT_ABSOLUTE);

    public PricingTolerance {
        Objects.requireNonNull(relative, "relative");
        Objects.requireNonNull(absolute, "absolute");
        if (relative.signum() < 0 || absolute.signum() < 0) {
            throw new IllegalArgumentException("Pricing tolerance must not be negative");
        }
    }

    public boolean matches(BigDecimal candidate, BigDecimal expected) {
        if (candidate == null || expected == null) {
            return false;
        }
        BigDecimal allowed = relative.multiply(expected.abs()).max(absolute);
        return candidate.subtract(expected).abs().compareTo(allowed) <= 0;
    }
}
