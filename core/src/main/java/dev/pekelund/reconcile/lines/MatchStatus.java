package dev.pekelund.reconcile.lines;

import dev.pekelund.reconcile.errors.ValidationException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of the link between an invoice line and an inventory item.
 *
 * <pre>
 * unmatched                    -> auto_matched | manual_matched | new_item
 * auto_matched, manual_matched -> auto_matched | manual_matched (re-match) | unmatched | confirmed
 * new_item                     -> confirmed
 * rejected                     -> auto_matched | manual_matched | new_item
 * any state but confirmed      -> skipped | rejected
 * skipped                      -> unmatched (reopen)
 * </pre>
 */
public enum MatchStatus {
    UNMATCHED("unmatched"),
    AUTO_MATCHED("auto_matched"),
    MANUAL_MATCHED("manual_matched"),
    NEW_ITEM("new_item"),
    SKIPPED("skipped"),
    REJECTED("rejected"),
    CONFIRMED("confirmed");

    private static final Map<MatchStatus, Set<MatchStatus>> TRANSITIONS = Map.of(
        UNMATCHED, EnumSet.of(AUTO_MATCHED, MANUAL_MATCHED, NEW_ITEM, SKIPPED, REJECTED),
        AUTO_MATCHED, EnumSet.of(UNMATCHED, AUTO_MATCHED, MANUAL_MATCHED, SKIPPED, REJECTED, CONFIRMED),
        MANUAL_MATCHED, EnumSet.of(UNMATCHED, AUTO_MATCHED, MANUAL_MATCHED, SKIPPED, REJECTED, CONFIRMED),
        NEW_ITEM, EnumSet.of(SKIPPED, REJECTED, CONFIRMED),
        REJECTED, EnumSet.of(AUTO_MATCHED, MANUAL_MATCHED, NEW_ITEM, SKIPPED, REJECTED),
        SKIPPED, EnumSet.of(UNMATCHED, SKIPPED, REJECTED),
        CONFIRMED, EnumSet.noneOf(MatchStatus.class));

    private final String wireValue;

    MatchStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean canTransitionTo(MatchStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public void requireTransitionTo(MatchStatus target) {
        if (!canTransitionTo(target)) {
            throw new ValidationException(String.format("Line cannot move from %s to %s", wireValue,
                target != null ? target.wireValue : null));
        }
    }

    public boolean isMatched() {
        return this == AUTO_MATCHED || this == MANUAL_MATCHED || this == NEW_ITEM;
    }

    /**
     * Whether the line needs no further work before its invoice can be processed.
     */
    public boolean isResolved() {
        return this == CONFIRMED || this == SKIPPED || this == REJECTED;
    }

    public static MatchStatus fromWire(String value) {
        for (MatchStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new ValidationException("Unknown match status: " + value);
    }
}
