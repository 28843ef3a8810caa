package dev.pekelund.reconcile.lines;

/**
 * Persists a confirmation so that the line, the inventory item and the price history change together
 * or not at all.
 */
public interface ConfirmationUnitOfWork {

    /**
     * @return the saved line
     */
    InvoiceLineItem commit(LineConfirmation confirmation);
}
