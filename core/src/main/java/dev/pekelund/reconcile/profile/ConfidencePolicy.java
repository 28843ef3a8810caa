package dev.pekelund.reconcile.profile;

import java.math.BigDecimal;

/**
 * Derives a vendor's confidence adjustment from its correction history. The first correction costs
 * 0.10, each further one another 0.02 down to a floor of -0.30, and every successful use since the most
 * recent correction earns back 0.01 until the adjustment returns to zero.
 */
public final class ConfidencePolicy {

    static final BigDecimal FIRST_CORRECTION_PENALTY = new BigDecimal("-0.10");
    static final BigDecimal ADDITIONAL_CORRECTION_PENALTY = new BigDecimal("-0.02");
    static final BigDecimal PENALTY_FLOOR = new BigDecimal("-0.30");
    static final BigDecimal RECOVERY_PER_SUCCESS = new BigDecimal("0.01");

    private ConfidencePolicy() {
        // Utility class
    }

    public static BigDecimal adjustment(int corrections, int successesSinceCorrection) {
        if (corrections <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal penalty = FIRST_CORRECTION_PENALTY
            .add(ADDITIONAL_CORRECTION_PENALTY.multiply(BigDecimal.valueOf(corrections - 1L)))
            .max(PENALTY_FLOOR);
        BigDecimal recovered = RECOVERY_PER_SUCCESS.multiply(BigDecimal.valueOf(Math.max(0, successesSinceCorrection)));
        return penalty.add(recovered).min(BigDecimal.ZERO);
    }
}
