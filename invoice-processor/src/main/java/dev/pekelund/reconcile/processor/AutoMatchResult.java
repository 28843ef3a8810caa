package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.MatchCandidate;
import java.util.List;

/**
 * Outcome of matching one line against inventory.
 *
 * @param line the stored line, linked to the best candidate when {@code matched}
 * @param candidates ranked candidates, best first
 */
public record AutoMatchResult(InvoiceLineItem line, boolean matched, List<MatchCandidate> candidates) {

    public int bestScore() {
        return candidates.isEmpty() ? 0 : candidates.get(0).score();
    }
}
