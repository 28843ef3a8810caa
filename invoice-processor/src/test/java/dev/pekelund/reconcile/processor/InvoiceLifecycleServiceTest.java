package dev.pekelund.reconcile.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.reconcile.errors.NotFoundException;
import dev.pekelund.reconcile.errors.ValidationException;
import dev.pekelund.reconcile.invoices.DuplicateInvoiceDetector;
import dev.pekelund.reconcile.invoices.Invoice;
import dev.pekelund.reconcile.invoices.InvoiceStatus;
import dev.pekelund.reconcile.invoices.Payment;
import dev.pekelund.reconcile.invoices.PaymentFlag;
import dev.pekelund.reconcile.invoices.PaymentStatus;
import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.LineSummary;
import dev.pekelund.reconcile.lines.MatchStatus;
import dev.pekelund.reconcile.processor.local.InMemoryInvoiceLineRepository;
import dev.pekelund.reconcile.processor.local.InMemoryInvoiceRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InvoiceLifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:30:00Z");

    private InMemoryInvoiceRepository invoiceRepository;
    private InMemoryInvoiceLineRepository lineRepository;
    private InvoiceLifecycleService service;

    @BeforeEach
    void setUp() {
        invoiceRepository = new InMemoryInvoiceRepository();
        lineRepository = new InMemoryInvoiceLineRepository();
        service = new InvoiceLifecycleService(invoiceRepository, lineRepository,
            new DuplicateInvoiceDetector(invoiceRepository), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void transitionRecordsTimestampAndRejectsSkippedStates() {
        Invoice invoice = store(InvoiceStatus.EXTRACTED, new BigDecimal("100.00"));

        Invoice reviewed = service.transition(invoice.id(), InvoiceStatus.REVIEWED, null);

        assertThat(reviewed.status()).isEqualTo(InvoiceStatus.REVIEWED);
        assertThat(reviewed.reviewedAt()).isEqualTo(NOW);
        assertThatThrownBy(() -> service.transition(invoice.id(), InvoiceStatus.SENT_TO_ACCOUNTING, null))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void errorCanBeRetried() {
        Invoice invoice = store(InvoiceStatus.EXTRACTING, null);

        Invoice failed = service.markError(invoice.id(), "Extractor timed out");

        assertThat(failed.status()).isEqualTo(InvoiceStatus.ERROR);
        assertThat(failed.statusMessage()).isEqualTo("Extractor timed out");
        assertThat(service.transition(invoice.id(), InvoiceStatus.PENDING, null).status())
            .isEqualTo(InvoiceStatus.PENDING);
    }

    @Test
    void paymentsAccumulateUntilPaid() {
        Invoice invoice = store(InvoiceStatus.PROCESSED, new BigDecimal("100.00"));

        Invoice partial = service.recordPayment(invoice.id(),
            new Payment(new BigDecimal("40.00"), "cheque", "CHQ-1", LocalDate.of(2026, 3, 1)));
        assertThat(partial.paymentStatus()).isEqualTo(PaymentStatus.PARTIAL);
        assertThat(partial.balanceDue()).isEqualByComparingTo("60.00");

        Invoice paid = service.recordPayment(invoice.id(),
            new Payment(new BigDecimal("60.00"), "eft", "EFT-9", LocalDate.of(2026, 3, 2)));
        assertThat(paid.paymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(paid.paymentReference()).isEqualTo("EFT-9");
        assertThat(service.findByPaymentStatus(PaymentStatus.PAID))
            .extracting(Invoice::id)
            .containsExactly(invoice.id());
    }

    @Test
    void voidedInvoiceRejectsPayments() {
        Invoice invoice = store(InvoiceStatus.PROCESSED, new BigDecimal("100.00"));

        Invoice voided = service.setFlag(invoice.id(), PaymentFlag.VOIDED, true);

        assertThat(voided.paymentStatus()).isEqualTo(PaymentStatus.VOIDED);
        assertThatThrownBy(() -> service.recordPayment(invoice.id(),
            new Payment(BigDecimal.TEN, "cash", null, null)))
            .isInstanceOf(ValidationException.class);
        assertThat(service.setFlag(invoice.id(), PaymentFlag.VOIDED, false).paymentStatus())
            .isEqualTo(PaymentStatus.UNPAID);
    }

    @Test
    void advancesReviewedInvoiceOnlyWhenEveryLineIsResolved() {
        Invoice invoice = store(InvoiceStatus.REVIEWED, new BigDecimal("30.00"));
        InvoiceLineItem open = lineRepository.save(line(invoice.id(), 1, MatchStatus.UNMATCHED));
        lineRepository.save(line(invoice.id(), 2, MatchStatus.SKIPPED));

        assertThat(service.advanceIfResolved(invoice.id()).status()).isEqualTo(InvoiceStatus.REVIEWED);

        lineRepository.save(open.toBuilder().matchStatus(MatchStatus.REJECTED).build());
        Invoice processed = service.advanceIfResolved(invoice.id());

        assertThat(processed.status()).isEqualTo(InvoiceStatus.PROCESSED);
        assertThat(processed.processedAt()).isEqualTo(NOW);
    }

    @Test
    void summarizesLines() {
        Invoice invoice = store(InvoiceStatus.EXTRACTED, null);
        lineRepository.save(line(invoice.id(), 1, MatchStatus.UNMATCHED));
        lineRepository.save(line(invoice.id(), 2, MatchStatus.SKIPPED));

        LineSummary summary = service.summarize(invoice.id());

        assertThat(summary.totalLines()).isEqualTo(2);
        assertThat(summary.unmatchedCount()).isEqualTo(1);
        assertThat(summary.skippedCount()).isEqualTo(1);
        assertThat(summary.totalAmount()).isEqualByComparingTo("30.00");
    }

    @Test
    void deleteCascadesToLines() {
        Invoice invoice = store(InvoiceStatus.EXTRACTED, null);
        Invoice other = store(InvoiceStatus.EXTRACTED, null);
        lineRepository.save(line(invoice.id(), 1, MatchStatus.UNMATCHED));
        lineRepository.save(line(other.id(), 1, MatchStatus.UNMATCHED));

        service.delete(invoice.id());

        assertThat(invoiceRepository.findById(invoice.id())).isEmpty();
        assertThat(lineRepository.findByInvoiceId(invoice.id())).isEmpty();
        assertThat(lineRepository.findByInvoiceId(other.id())).hasSize(1);
        assertThatThrownBy(() -> service.get(invoice.id())).isInstanceOf(NotFoundException.class);
    }

    @Test
    void dateRangeMustBeOrdered() {
        assertThatThrownBy(() -> service.findByInvoiceDate(LocalDate.of(2026, 3, 2), LocalDate.of(2026, 3, 1)))
            .isInstanceOf(ValidationException.class);
    }

    private Invoice store(InvoiceStatus status, BigDecimal total) {
        return invoiceRepository.save(Invoice.builder()
            .vendorId("sysco")
            .vendorName("Sysco")
            .invoiceNumber("INV-" + status.wireValue())
            .invoiceDate(LocalDate.of(2026, 2, 27))
            .status(status)
            .total(total)
            .createdAt(NOW)
            .build());
    }

    private static InvoiceLineItem line(String invoiceId, int lineNumber, MatchStatus status) {
        return InvoiceLineItem.builder()
            .invoiceId(invoiceId)
            .lineNumber(lineNumber)
            .description("Line " + lineNumber)
            .totalPrice(new BigDecimal("15.00"))
            .matchStatus(status)
            .build();
    }
}
