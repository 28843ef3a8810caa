package dev.pekelund.reconcile.errors;

/**
 * Signals input that cannot be accepted, such as a missing vendor name, an unknown enum value or an
 * illegal state transition. The write that triggered it is aborted.
 */
public class ValidationException extends ReconciliationException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
