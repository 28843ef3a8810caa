package dev.pekelund.reconcile.lines;

/**
 * An inventory item scored against a line description.
 *
 * @param score match confidence out of 100
 */
public record MatchCandidate(String inventoryItemId, String name, String sku, int score) {
}
