package dev.pekelund.reconcile.processor.local;

import dev.pekelund.reconcile.invoices.Invoice;
import dev.pekelund.reconcile.invoices.InvoiceRepository;
import dev.pekelund.reconcile.invoices.InvoiceStatus;
import dev.pekelund.reconcile.invoices.PaymentStatus;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.springframework.util.StringUtils;

/**
 * Invoice storage used by the {@code local} profile and by tests.
 */
public class InMemoryInvoiceRepository implements InvoiceRepository {

    private final Map<String, Invoice> invoices = new ConcurrentHashMap<>();

    @Override
    public Optional<Invoice> findById(String id) {
        return id != null ? Optional.ofNullable(invoices.get(id)) : Optional.empty();
    }

    @Override
    public Invoice save(Invoice invoice) {
        Objects.requireNonNull(invoice, "invoice");
        Invoice stored = StringUtils.hasText(invoice.id())
            ? invoice
            : invoice.toBuilder().id(UUID.randomUUID().toString()).build();
        invoices.put(stored.id(), stored);
        return stored;
    }

    @Override
    public void delete(String id) {
        invoices.remove(id);
    }

    @Override
    public List<Invoice> findByInvoiceNumberIgnoreCase(String invoiceNumber) {
        if (!StringUtils.hasText(invoiceNumber)) {
            return List.of();
        }
        String key = invoiceNumber.trim().toLowerCase(Locale.ROOT);
        return filter(invoice -> invoice.invoiceNumber() != null
            && invoice.invoiceNumber().trim().toLowerCase(Locale.ROOT).equals(key));
    }

    @Override
    public List<Invoice> findByStatus(InvoiceStatus status) {
        return filter(invoice -> invoice.status() == status);
    }

    @Override
    public List<Invoice> findByPaymentStatus(PaymentStatus paymentStatus) {
        return filter(invoice -> invoice.paymentStatus() == paymentStatus);
    }

    @Override
    public List<Invoice> findByInvoiceDateBetween(LocalDate from, LocalDate to) {
        return filter(invoice -> invoice.invoiceDate() != null
            && !invoice.invoiceDate().isBefore(from)
            && !invoice.invoiceDate().isAfter(to)).stream()
            .sorted(Comparator.comparing(Invoice::invoiceDate))
            .toList();
    }

    private List<Invoice> filter(Predicate<Invoice> predicate) {
        return invoices.values().stream()
            .filter(predicate)
            .sorted(Comparator.comparing(Invoice::id))
            .toList();
    }
}
