package dev.pekelund.reconcile.invoices;

import dev.pekelund.reconcile.errors.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A payment made against an invoice.
 */
public record Payment(BigDecimal amount, String method, String reference, LocalDate paidOn) {

    public Payment {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Payment amount must be positive");
        }
    }
}
