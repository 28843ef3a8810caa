package dev.pekelund.reconcile.errors;

/**
 * Wraps failures reported by the persistence layer.
 */
public class ReconciliationStorageException extends ReconciliationException {

    public ReconciliationStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
