package dev.pekelund.reconcile.classification;

import dev.pekelund.reconcile.profile.ColumnCorrection;
import dev.pekelund.reconcile.profile.ParsingProfile;
import java.math.BigDecimal;
import java.util.List;

/**
 * Output of a completed wizard.
 *
 * @param profile the profile built from the wizard, not yet persisted and without prompt hints
 * @param newCorrections column corrections made in this session
 * @param correctedLines number of sample lines a human corrected
 * @param correctnessRatio share of verified sample lines that needed no correction
 */
public record ClassificationResult(
    ParsingProfile profile,
    List<ColumnCorrection> newCorrections,
    int correctedLines,
    BigDecimal correctnessRatio
) {
}
