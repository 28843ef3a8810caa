package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.invoices.DuplicateCheck;
import dev.pekelund.reconcile.invoices.ExistingInvoiceSummary;

/**
 * Returned alongside an ingested invoice that has the same vendor and number as one already on file.
 * Ingestion is never blocked by it.
 */
public record DuplicateInvoiceWarning(String message, ExistingInvoiceSummary existingInvoice) {

    static DuplicateInvoiceWarning from(DuplicateCheck check) {
        if (check == null || !check.isDuplicate()) {
            return null;
        }
        ExistingInvoiceSummary existing = check.existingInvoice();
        return new DuplicateInvoiceWarning(String.format("Invoice %s from %s was already uploaded on %s",
            existing.invoiceNumber(), existing.vendorName(), existing.createdAt()), existing);
    }
}
