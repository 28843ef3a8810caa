package dev.pekelund.reconcile.profile;

import java.time.Instant;

/**
 * Usage and correction counters for a vendor profile.
 *
 * @param timesUsed number of invoices parsed with the profile
 * @param lastUsed when the profile was last used
 * @param successRate moving success percentage, 100 for a new profile
 * @param columnCorrections column corrections recorded so far
 * @param lineCorrections line corrections recorded so far
 * @param successesSinceCorrection successful uses since the most recent correction
 */
public record ProfileStats(
    int timesUsed,
    Instant lastUsed,
    double successRate,
    int columnCorrections,
    int lineCorrections,
    int successesSinceCorrection
) {

    private static final double INITIAL_SUCCESS_RATE = 100.0;

    public static ProfileStats initial() {
        return new ProfileStats(0, null, INITIAL_SUCCESS_RATE, 0, 0, 0);
    }

    public int totalCorrections() {
        return columnCorrections + lineCorrections;
    }

    /**
     * Records one use of the profile. A success closes 10% of the gap to 100, a failure drops the rate by
     * 20%. Line corrections made on the invoice count as corrections and restart the recovery window.
     */
    public ProfileStats recordUsage(boolean success, int correctedLines, Instant usedAt) {
        double rate = success
            ? successRate + (100.0 - successRate) * 0.1
            : successRate - successRate * 0.2;
        rate = Math.round(rate * 10.0) / 10.0;
        int lines = lineCorrections + Math.max(0, correctedLines);
        int successes;
        if (correctedLines > 0) {
            successes = 0;
        } else {
            successes = success ? successesSinceCorrection + 1 : successesSinceCorrection;
        }
        return new ProfileStats(timesUsed + 1, usedAt, rate, columnCorrections, lines, successes);
    }

    public ProfileStats recordColumnCorrections(int count) {
        if (count <= 0) {
            return this;
        }
        return new ProfileStats(timesUsed, lastUsed, successRate, columnCorrections + count, lineCorrections, 0);
    }

    public ProfileStats recordLineCorrections(int count) {
        if (count <= 0) {
            return this;
        }
        return new ProfileStats(timesUsed, lastUsed, successRate, columnCorrections, lineCorrections + count, 0);
    }
}
