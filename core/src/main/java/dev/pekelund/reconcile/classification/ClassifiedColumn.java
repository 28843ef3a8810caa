package dev.pekelund.reconcile.classification;

import dev.pekelund.reconcile.profile.SemanticField;
import java.util.Objects;

/**
 * A column as shown in the classification wizard.
 *
 * @param aiLabel the type the extractor proposed
 * @param assigned the type currently assigned
 * @param sampleValue a value read from the column
 * @param wasChanged whether {@code assigned} differs from {@code aiLabel}
 * @param wasReordered whether the column was moved
 */
public record ClassifiedColumn(
    SemanticField aiLabel,
    SemanticField assigned,
    String sampleValue,
    boolean wasChanged,
    boolean wasReordered
) {

    public ClassifiedColumn {
        Objects.requireNonNull(aiLabel, "aiLabel");
        Objects.requireNonNull(assigned, "assigned");
    }

    public static ClassifiedColumn detected(SemanticField aiLabel, String sampleValue) {
        return new ClassifiedColumn(aiLabel, aiLabel, sampleValue, false, false);
    }

    ClassifiedColumn assign(SemanticField type) {
        return new ClassifiedColumn(aiLabel, type, sampleValue, type != aiLabel, wasReordered);
    }

    ClassifiedColumn reordered() {
        return new ClassifiedColumn(aiLabel, assigned, sampleValue, wasChanged, true);
    }
}
