package dev.pekelund.reconcile.invoices;

import dev.pekelund.reconcile.errors.ValidationException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Document lifecycle of an invoice.
 */
public enum InvoiceStatus {
    DRAFT("draft"),
    PENDING("pending"),
    EXTRACTING("extracting"),
    EXTRACTED("extracted"),
    REVIEWED("reviewed"),
    PROCESSED("processed"),
    SENT_TO_ACCOUNTING("sent_to_qb"),
    ERROR("error"),
    ARCHIVED("archived");

    private static final Map<InvoiceStatus, Set<InvoiceStatus>> TRANSITIONS = Map.of(
        DRAFT, EnumSet.of(PENDING),
        PENDING, EnumSet.of(EXTRACTING, ERROR),
        EXTRACTING, EnumSet.of(EXTRACTED, ERROR),
        EXTRACTED, EnumSet.of(REVIEWED, ERROR),
        REVIEWED, EnumSet.of(PROCESSED, ERROR),
        PROCESSED, EnumSet.of(SENT_TO_ACCOUNTING, ARCHIVED, ERROR),
        SENT_TO_ACCOUNTING, EnumSet.of(ARCHIVED),
        ERROR, EnumSet.of(PENDING),
        ARCHIVED, EnumSet.noneOf(InvoiceStatus.class));

    private final String wireValue;

    InvoiceStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public Set<InvoiceStatus> allowedTransitions() {
        return TRANSITIONS.get(this);
    }

    public boolean canTransitionTo(InvoiceStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public void requireTransitionTo(InvoiceStatus target) {
        if (!canTransitionTo(target)) {
            throw new ValidationException(String.format("Invoice cannot move from %s to %s", wireValue,
                target != null ? target.wireValue : null));
        }
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public static InvoiceStatus fromWire(String value) {
        for (InvoiceStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new ValidationException("Unknown invoice status: " + value);
    }
}
