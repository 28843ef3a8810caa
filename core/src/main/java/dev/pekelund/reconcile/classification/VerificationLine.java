package dev.pekelund.reconcile.classification;

import dev.pekelund.reconcile.profile.SampleLine;

/**
 * A sample line under verification.
 *
 * @param sample the extracted values
 * @param correction what a human changed, or null
 * @param verified whether the line has been reviewed
 */
public record VerificationLine(SampleLine sample, LineCorrection correction, boolean verified) {

    public boolean isCorrected() {
        return correction != null && !correction.isEmpty();
    }

    VerificationLine markCorrect() {
        return new VerificationLine(sample, null, true);
    }

    VerificationLine correct(LineCorrection lineCorrection) {
        return new VerificationLine(sample, lineCorrection, true);
    }
}
