package dev.pekelund.reconcile.profile;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a vendor's append-only correction log.
 *
 * @param field the column or field the correction applies to
 * @param index zero-based column position, or null when the correction was not made on a column
 * @param aiDetected what the extractor proposed
 * @param userCorrected what a human replaced it with
 * @param sampleValue the value that was on screen when the correction was made
 * @param correctedAt when the correction was recorded
 */
public record ColumnCorrection(
    String field,
    Integer index,
    String aiDetected,
    String userCorrected,
    String sampleValue,
    Instant correctedAt
) {

    public ColumnCorrection {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(correctedAt, "correctedAt");
    }

    /**
     * Whether both entries record the same change on the same column, regardless of when.
     */
    public boolean sameChangeAs(ColumnCorrection other) {
        return other != null
            && Objects.equals(index, other.index)
            && Objects.equals(aiDetected, other.aiDetected)
            && Objects.equals(userCorrected, other.userCorrected);
    }
}
