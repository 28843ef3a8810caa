package dev.pekelund.reconcile.invoices;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Storage for invoices.
 */
public interface InvoiceRepository {

    Optional<Invoice> findById(String id);

    /**
     * Saves the invoice, assigning an id when it has none.
     */
    Invoice save(Invoice invoice);

    void delete(String id);

    /**
     * Indexed lookup by invoice number, ignoring case.
     */
    List<Invoice> findByInvoiceNumberIgnoreCase(String invoiceNumber);

    List<Invoice> findByStatus(InvoiceStatus status);

    List<Invoice> findByPaymentStatus(PaymentStatus paymentStatus);

    /**
     * Invoices dated within the inclusive range.
     */
    List<Invoice> findByInvoiceDateBetween(LocalDate from, LocalDate to);
}
