package dev.pekelund.reconcile.invoices;

/**
 * Result of a duplicate invoice check. A duplicate is a warning for the user to decide on, never a
 * reason to block ingestion.
 */
public record DuplicateCheck(boolean isDuplicate, ExistingInvoiceSummary existingInvoice) {

    private static final DuplicateCheck NOT_DUPLICATE = new DuplicateCheck(false, null);

    public static DuplicateCheck notDuplicate() {
        return NOT_DUPLICATE;
    }

    public static DuplicateCheck duplicateOf(Invoice existing) {
        return new DuplicateCheck(true, existing.summary());
    }
}
