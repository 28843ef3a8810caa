package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.invoices.Invoice;
import dev.pekelund.reconcile.lines.InvoiceLineItem;
import java.util.List;

/**
 * @param duplicateWarning set when an invoice with the same vendor and number was already on file
 */
public record IngestionResult(Invoice invoice, List<InvoiceLineItem> lines, DuplicateInvoiceWarning duplicateWarning) {

    public IngestionResult {
        lines = lines != null ? List.copyOf(lines) : List.of();
    }

    public boolean isDuplicate() {
        return duplicateWarning != null;
    }
}
