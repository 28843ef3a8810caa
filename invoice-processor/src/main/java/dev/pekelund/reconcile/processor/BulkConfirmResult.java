package dev.pekelund.reconcile.processor;

import java.util.List;

/**
 * What confirming every line of an invoice did to each line.
 */
public record BulkConfirmResult(List<LineOutcome> applied, List<LineOutcome> skipped, List<LineOutcome> errors) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param message why the line was skipped or failed, null for applied lines
     */
    public record LineOutcome(String lineId, int lineNumber, String inventoryItemId, String message) {
    }
}
