package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.lines.MatchCandidate;
import java.util.List;

/**
 * Lines of an invoice that an automatic match linked, and the ones left for review.
 */
public record InvoiceAutoMatchResult(List<MatchedLine> matched, List<UnmatchedLine> unmatched) {

    public record MatchedLine(String lineId, int lineNumber, String inventoryItemId, String itemName,
        int confidence) {
    }

    /**
     * @param candidates the best few candidates for a reviewer to pick from
     */
    public record UnmatchedLine(String lineId, int lineNumber, String description, int bestConfidence,
        List<MatchCandidate> candidates) {
    }
}
