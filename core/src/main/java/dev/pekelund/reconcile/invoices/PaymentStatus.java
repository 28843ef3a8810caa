package dev.pekelund.reconcile.invoices;

import dev.pekelund.reconcile.errors.ValidationException;
import java.math.BigDecimal;
import java.util.Set;

public enum PaymentStatus {
    UNPAID("unpaid"),
    PARTIAL("partial"),
    PAID("paid"),
    OVERDUE("overdue"),
    DISPUTED("disputed"),
    VOIDED("voided");

    private final String wireValue;

    PaymentStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Amount-driven status: unpaid while nothing is paid, paid once the total is covered, partial in
     * between.
     */
    public static PaymentStatus derive(BigDecimal amountPaid, BigDecimal total) {
        BigDecimal paid = amountPaid != null ? amountPaid : BigDecimal.ZERO;
        if (paid.signum() <= 0) {
            return UNPAID;
        }
        if (total != null && paid.compareTo(total) >= 0) {
            return PAID;
        }
        return PARTIAL;
    }

    public static PaymentStatus effective(BigDecimal amountPaid, BigDecimal total, Set<PaymentFlag> flags) {
        if (flags != null) {
            for (PaymentFlag flag : PaymentFlag.values()) {
                if (flags.contains(flag)) {
                    return flag.status();
                }
            }
        }
        return derive(amountPaid, total);
    }

    public static PaymentStatus fromWire(String value) {
        for (PaymentStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new ValidationException("Unknown payment status: " + value);
    }
}
