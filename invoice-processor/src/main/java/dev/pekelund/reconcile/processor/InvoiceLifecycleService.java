package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.errors.NotFoundException;
import dev.pekelund.reconcile.errors.ValidationException;
import dev.pekelund.reconcile.invoices.DuplicateCheck;
import dev.pekelund.reconcile.invoices.DuplicateInvoiceDetector;
import dev.pekelund.reconcile.invoices.Invoice;
import dev.pekelund.reconcile.invoices.InvoiceRepository;
import dev.pekelund.reconcile.invoices.InvoiceStatus;
import dev.pekelund.reconcile.invoices.Payment;
import dev.pekelund.reconcile.invoices.PaymentFlag;
import dev.pekelund.reconcile.invoices.PaymentStatus;
import dev.pekelund.reconcile.lines.InvoiceLineRepository;
import dev.pekelund.reconcile.lines.LineSummary;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Document status, payments and line aggregation for stored invoices.
 */
@Service
public class InvoiceLifecycleService {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceLifecycleService.class);

    private final InvoiceRepository invoiceRepository;
    private final InvoiceLineRepository lineRepository;
    private final DuplicateInvoiceDetector duplicateDetector;
    private final Clock clock;

    public InvoiceLifecycleService(InvoiceRepository invoiceRepository, InvoiceLineRepository lineRepository,
        DuplicateInvoiceDetector duplicateDetector, Clock clock) {
        this.invoiceRepository = Objects.requireNonNull(invoiceRepository, "invoiceRepository");
        this.lineRepository = Objects.requireNonNull(lineRepository, "lineRepository");
        this.duplicateDetector = Objects.requireNonNull(duplicateDetector, "duplicateDetector");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Invoice get(String invoiceId) {
        return invoiceRepository.findById(invoiceId).orElseThrow(() -> NotFoundException.of("Invoice", invoiceId));
    }

    public List<Invoice> findByStatus(InvoiceStatus status) {
        return invoiceRepository.findByStatus(Objects.requireNonNull(status, "status"));
    }

    public List<Invoice> findByPaymentStatus(PaymentStatus paymentStatus) {
        return invoiceRepository.findByPaymentStatus(Objects.requireNonNull(paymentStatus, "paymentStatus"));
    }

    public List<Invoice> findByInvoiceDate(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationException("Both ends of the date range are required");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("Date range starts after it ends: " + from + " > " + to);
        }
        return invoiceRepository.findByInvoiceDateBetween(from, to);
    }

    public Invoice transition(String invoiceId, InvoiceStatus target, String message) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forInvoice(invoiceId, null)) {
            Invoice invoice = get(invoiceId);
            Invoice moved = invoiceRepository.save(invoice.transitionTo(target, message, clock.instant()));
            LOGGER.info("Invoice {} moved from {} to {}", invoiceId, invoice.status().wireValue(),
                target.wireValue());
            return moved;
        }
    }

    /**
     * Moves the invoice to {@link InvoiceStatus#ERROR}, keeping the failure message for display.
     */
    public Invoice markError(String invoiceId, String message) {
        Invoice invoice = get(invoiceId);
        Invoice failed = invoiceRepository.save(invoice.transitionTo(InvoiceStatus.ERROR, message, clock.instant()));
        LOGGER.warn("Invoice {} marked as error in status {}: {}", invoiceId, invoice.status().wireValue(), message);
        return failed;
    }

    public Invoice archive(String invoiceId) {
        return transition(invoiceId, InvoiceStatus.ARCHIVED, null);
    }

    public Invoice recordPayment(String invoiceId, Payment payment) {
        Objects.requireNonNull(payment, "payment");
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forInvoice(invoiceId, null)) {
            Invoice updated = invoiceRepository.save(get(invoiceId).recordPayment(payment, clock.instant()));
            LOGGER.info("Recorded payment of {} on invoice {}, paid {} of {} ({})", payment.amount(), invoiceId,
                updated.amountPaid(), updated.total(), updated.paymentStatus().wireValue());
            return updated;
        }
    }

    public Invoice setFlag(String invoiceId, PaymentFlag flag, boolean enabled) {
        Objects.requireNonNull(flag, "flag");
        Invoice updated = invoiceRepository.save(get(invoiceId).withFlag(flag, enabled, clock.instant()));
        LOGGER.info("{} {} flag on invoice {}", enabled ? "Set" : "Cleared", flag.name(), invoiceId);
        return updated;
    }

    public LineSummary summarize(String invoiceId) {
        get(invoiceId);
        return LineSummary.of(lineRepository.findByInvoiceId(invoiceId));
    }

    /**
     * Moves a reviewed invoice to processed once every line is confirmed, skipped or rejected.
     *
     * @return the invoice, unchanged when it is not reviewed or still has open lines
     */
    public Invoice advanceIfResolved(String invoiceId) {
        Invoice invoice = get(invoiceId);
        if (invoice.status() != InvoiceStatus.REVIEWED) {
            return invoice;
        }
        LineSummary summary = LineSummary.of(lineRepository.findByInvoiceId(invoiceId));
        if (!summary.allResolved()) {
            LOGGER.debug("Invoice {} still has open lines: {}", invoiceId, summary.byStatus());
            return invoice;
        }
        return transition(invoiceId, InvoiceStatus.PROCESSED, null);
    }

    /**
     * Deletes the invoice together with its line items.
     */
    public void delete(String invoiceId) {
        get(invoiceId);
        int lines = lineRepository.deleteByInvoiceId(invoiceId);
        invoiceRepository.delete(invoiceId);
        LOGGER.info("Deleted invoice {} and {} line items", invoiceId, lines);
    }

    public DuplicateCheck checkDuplicate(String vendorName, String invoiceNumber, String excludeInvoiceId) {
        return duplicateDetector.check(vendorName, invoiceNumber, excludeInvoiceId);
    }
}
