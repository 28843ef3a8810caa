package dev.pekelund.reconcile.invoices;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record ExistingInvoiceSummary(
    String id,
    String invoiceNumber,
    String vendorName,
    LocalDate invoiceDate,
    BigDecimal total,
    Instant createdAt
) {
}
