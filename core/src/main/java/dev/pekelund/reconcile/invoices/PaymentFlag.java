package dev.pekelund.reconcile.invoices;

import dev.pekelund.reconcile.errors.ValidationException;

/**
 * Payment states set by policy rather than derived from amounts. A flag takes precedence over the
 * amount-derived status, voided first, then disputed, then overdue.
 */
public enum PaymentFlag {
    VOIDED(PaymentStatus.VOIDED),
    DISPUTED(PaymentStatus.DISPUTED),
    OVERDUE(PaymentStatus.OVERDUE);

    private final PaymentStatus status;

    PaymentFlag(PaymentStatus status) {
        this.status = status;
    }

    public PaymentStatus status() {
        return status;
    }

    public static PaymentFlag fromWire(String value) {
        for (PaymentFlag flag : values()) {
            if (flag.status.wireValue().equalsIgnoreCase(value) || flag.name().equalsIgnoreCase(value)) {
                return flag;
            }
        }
        throw new ValidationException("Unknown payment flag: " + value);
    }
}
