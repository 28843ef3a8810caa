package dev.pekelund.reconcile.errors;

/**
 * Base type for failures raised by the reconciliation engine.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
