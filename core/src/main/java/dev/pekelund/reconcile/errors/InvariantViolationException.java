package dev.pekelund.reconcile.errors;

/**
 * Signals an operation that would break a data invariant, for example confirming a line that has no
 * linked inventory item. Unlike {@link ValidationException} this indicates a programming or data
 * integrity problem rather than bad user input.
 */
public class InvariantViolationException extends ReconciliationException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
