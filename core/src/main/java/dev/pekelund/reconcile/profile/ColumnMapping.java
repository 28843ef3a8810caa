package dev.pekelund.reconcile.profile;

/**
 * Where a semantic field sits in a vendor's line table.
 *
 * @param index zero-based column position
 * @param aiOriginal the type the extractor proposed for the column
 * @param wasChanged whether a human assigned a different type
 * @param sampleValue a value seen in the column, kept for reference
 */
public record ColumnMapping(int index, SemanticField aiOriginal, boolean wasChanged, String sampleValue) {
}
