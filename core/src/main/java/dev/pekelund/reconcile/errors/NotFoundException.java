package dev.pekelund.reconcile.errors;

/**
 * Signals that a referenced invoice, line item, profile or inventory item does not exist.
 */
public class NotFoundException extends ReconciliationException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String type, String id) {
        return new NotFoundException(type + " not found: " + id);
    }
}
