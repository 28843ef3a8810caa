package dev.pekelund.reconcile.processor.extraction;

import dev.pekelund.reconcile.errors.ReconciliationException;

/**
 * Raised when a document cannot be turned into candidate lines.
 */
public class InvoiceExtractionException extends ReconciliationException {

    public InvoiceExtractionException(String message) {
        super(message);
    }

    public InvoiceExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
