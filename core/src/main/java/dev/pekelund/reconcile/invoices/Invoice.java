package dev.pekelund.reconcile.invoices;

import dev.pekelund.reconcile.errors.ValidationException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * An uploaded vendor invoice. Transitions return a new instance; payment status is derived from
 * {@code amountPaid} and {@code total} plus the policy flags.
 */
public record Invoice(
    String id,
    String vendorId,
    String vendorName,
    String invoiceNumber,
    LocalDate invoiceDate,
    InvoiceStatus status,
    String statusMessage,
    BigDecimal total,
    BigDecimal amountPaid,
    Set<PaymentFlag> paymentFlags,
    LocalDate paymentDate,
    String paymentMethod,
    String paymentReference,
    Instant extractedAt,
    Instant reviewedAt,
    Instant processedAt,
    Instant sentToAccountingAt,
    Instant archivedAt,
    Instant createdAt,
    Instant updatedAt
) {

    public Invoice {
        status = status != null ? status : InvoiceStatus.DRAFT;
        amountPaid = amountPaid != null ? amountPaid : BigDecimal.ZERO;
        paymentFlags = paymentFlags == null || paymentFlags.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(PaymentFlag.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(paymentFlags));
    }

    /**
     * Status derived from amounts only.
     */
    public PaymentStatus amountPaymentStatus() {
        return PaymentStatus.derive(amountPaid, total);
    }

    /**
     * Status shown to users: a set policy flag wins over the amount-derived status.
     */
    public PaymentStatus paymentStatus() {
        return PaymentStatus.effective(amountPaid, total, paymentFlags);
    }

    public BigDecimal balanceDue() {
        if (total == null) {
            return null;
        }
        return total.subtract(amountPaid).max(BigDecimal.ZERO);
    }

    public boolean hasFlag(PaymentFlag flag) {
        return paymentFlags.contains(flag);
    }

    public Invoice transitionTo(InvoiceStatus target, String message, Instant now) {
        status.requireTransitionTo(target);
        Builder builder = toBuilder()
            .status(target)
            .statusMessage(message)
            .updatedAt(now);
        switch (target) {
            case EXTRACTED -> builder.extractedAt(now);
            case REVIEWED -> builder.reviewedAt(now);
            case PROCESSED -> builder.processedAt(now);
            case SENT_TO_ACCOUNTING -> builder.sentToAccountingAt(now);
            case ARCHIVED -> builder.archivedAt(now);
            default -> {
            }
        }
        return builder.build();
    }

    public Invoice recordPayment(Payment payment, Instant now) {
        if (hasFlag(PaymentFlag.VOIDED)) {
            throw new ValidationException("Cannot record a payment on a voided invoice");
        }
        return toBuilder()
            .amountPaid(amountPaid.add(payment.amount()))
            .paymentDate(payment.paidOn())
            .paymentMethod(payment.method())
            .paymentReference(payment.reference())
            .updatedAt(now)
            .build();
    }

    public Invoice withFlag(PaymentFlag flag, boolean enabled, Instant now) {
        EnumSet<PaymentFlag> flags = EnumSet.noneOf(PaymentFlag.class);
        flags.addAll(paymentFlags);
        if (enabled) {
            flags.add(flag);
        } else {
            flags.remove(flag);
        }
        return toBuilder().paymentFlags(flags).updatedAt(now).build();
    }

    public ExistingInvoiceSummary summary() {
        return new ExistingInvoiceSummary(id, invoiceNumber, vendorName, invoiceDate, total, createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .vendorId(vendorId)
            .vendorName(vendorName)
            .invoiceNumber(invoiceNumber)
            .invoiceDate(invoiceDate)
            .status(status)
            .statusMessage(statusMessage)
            .total(total)
            .amountPaid(amountPaid)
            .paymentFlags(paymentFlags)
            .paymentDate(paymentDate)
            .paymentMethod(paymentMethod)
            .paymentReference(paymentReference)
            .extractedAt(extractedAt)
            .reviewedAt(reviewedAt)
            .processedAt(processedAt)
            .sentToAccountingAt(sentToAccountingAt)
            .archivedAt(archivedAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public static class Builder {
        private String id;
        private String vendorId;
        private String vendorName;
        private String invoiceNumber;
        private LocalDate invoiceDate;
        private InvoiceStatus status;
        private String statusMessage;
        private BigDecimal total;
        private BigDecimal amountPaid;
        private Set<PaymentFlag> paymentFlags;
        private LocalDate paymentDate;
        private String paymentMethod;
        private String paymentReference;
        private Instant extractedAt;
        private Instant reviewedAt;
        private Instant processedAt;
        private Instant sentToAccountingAt;
        private Instant archivedAt;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder vendorId(String vendorId) {
            this.vendorId = vendorId;
            return this;
        }

        public Builder vendorName(String vendorName) {
            this.vendorName = vendorName;
            return this;
        }

        public Builder invoiceNumber(String invoiceNumber) {
            this.invoiceNumber = invoiceNumber;
            return this;
        }

        public Builder invoiceDate(LocalDate invoiceDate) {
            this.invoiceDate = invoiceDate;
            return this;
        }

        public Builder status(InvoiceStatus status) {
            this.status = status;
            return this;
        }

        public Builder statusMessage(String statusMessage) {
            this.statusMessage = statusMessage;
            return this;
        }

        public Builder total(BigDecimal total) {
            this.total = total;
            return this;
        }

        public Builder amountPaid(BigDecimal amountPaid) {
            this.amountPaid = amountPaid;
            return this;
        }

        public Builder paymentFlags(Set<PaymentFlag> paymentFlags) {
            this.paymentFlags = paymentFlags;
            return this;
        }

        public Builder paymentDate(LocalDate paymentDate) {
            this.paymentDate = paymentDate;
            return this;
        }

        public Builder paymentMethod(String paymentMethod) {
            this.paymentMethod = paymentMethod;
            return this;
        }

        public Builder paymentReference(String paymentReference) {
            this.paymentReference = paymentReference;
            return this;
        }

        public Builder extractedAt(Instant extractedAt) {
            this.extractedAt = extractedAt;
            return this;
        }

        public Builder reviewedAt(Instant reviewedAt) {
            this.reviewedAt = reviewedAt;
            return this;
        }

        public Builder processedAt(Instant processedAt) {
            this.processedAt = processedAt;
            return this;
        }

        public Builder sentToAccountingAt(Instant sentToAccountingAt) {
            this.sentToAccountingAt = sentToAccountingAt;
            return this;
        }

        public Builder archivedAt(Instant archivedAt) {
            this.archivedAt = archivedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Invoice build() {
            return new Invoice(id, vendorId, vendorName, invoiceNumber, invoiceDate, status, statusMessage, total,
                amountPaid, paymentFlags, paymentDate, paymentMethod, paymentReference, extractedAt, reviewedAt,
                processedAt, sentToAccountingAt, archivedAt, createdAt, updatedAt);
        }
    }
}
