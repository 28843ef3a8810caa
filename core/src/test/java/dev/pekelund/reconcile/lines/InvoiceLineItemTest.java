package dev.pekelund.reconcile.lines;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.reconcile.errors.InvariantViolationException;
import dev.pekelund.reconcile.errors.ValidationException;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InvoiceLineItemTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void matchesThenConfirms() {
        InvoiceLineItem confirmed = line()
            .match(MatchStatus.AUTO_MATCHED, "item-1", 92, "ai", null, NOW)
            .confirm("alice", NOW.plusSeconds(10));

        assertThat(confirmed.matchStatus()).isEqualTo(MatchStatus.CONFIRMED);
        assertThat(confirmed.inventoryItemId()).isEqualTo("item-1");
        assertThat(confirmed.matchedBy()).isEqualTo("alice");
        assertThat(confirmed.matchedAt()).isEqualTo(NOW.plusSeconds(10));
    }

    @Test
    void confirmingWithoutInventoryItemIsInvariantViolation() {
        InvoiceLineItem detached = line().toBuilder().matchStatus(MatchStatus.MANUAL_MATCHED).build();

        assertThatThrownBy(() -> detached.confirm("alice", NOW))
            .isInstanceOf(InvariantViolationException.class)
            .hasMessageContaining("no inventory item");
        assertThatThrownBy(() -> line().toBuilder().matchStatus(MatchStatus.CONFIRMED).build())
            .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void confirmingUnmatchedLineIsValidationError() {
        assertThatThrownBy(() -> line().confirm("alice", NOW)).isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectClearsInventoryLinkFromAnyState() {
        InvoiceLineItem matched = line().match(MatchStatus.MANUAL_MATCHED, "item-1", 100, "user", null, NOW);
        InvoiceLineItem newItem = line().match(MatchStatus.NEW_ITEM, "item-2", 100, "user", null, NOW);

        for (InvoiceLineItem candidate : new InvoiceLineItem[] {line(), matched, newItem, matched.skip("later", NOW)}) {
            InvoiceLineItem rejected = candidate.reject("wrong product", NOW);
            assertThat(rejected.matchStatus()).isEqualTo(MatchStatus.REJECTED);
            assertThat(rejected.inventoryItemId()).isNull();
            assertThat(rejected.matchNotes()).isEqualTo("wrong product");
        }
    }

    @Test
    void rejectResetsInventoryBookkeeping() {
        InvoiceLineItem added = line()
            .match(MatchStatus.NEW_ITEM, "item-2", 100, "user", null, NOW)
            .addedToInventory(new BigDecimal("9.00"), "user", NOW);

        InvoiceLineItem rejected = added.reject("duplicate item", NOW.plusSeconds(5));

        assertThat(rejected.addedToInventory()).isFalse();
        assertThat(rejected.addedToInventoryAt()).isNull();
        assertThat(rejected.addedToInventoryBy()).isNull();
        assertThat(rejected.previousPrice()).isNull();
        assertThat(rejected.newPrice()).isNull();
        assertThat(rejected.addedToInventory(new BigDecimal("10.00"), "user", NOW).previousPrice())
            .isEqualByComparingTo("10.00");
    }

    @Test
    void rejectedLineCanBeMatchedAgain() {
        InvoiceLineItem rematched = line()
            .match(MatchStatus.AUTO_MATCHED, "item-1", 85, "ai", null, NOW)
            .reject(null, NOW)
            .match(MatchStatus.MANUAL_MATCHED, "item-7", 100, "user", null, NOW);

        assertThat(rematched.inventoryItemId()).isEqualTo("item-7");
    }

    @Test
    void skippedLineNeedsReopenBeforeMatching() {
        InvoiceLineItem skipped = line().skip("not stocked", NOW);

        assertThatThrownBy(() -> skipped.match(MatchStatus.MANUAL_MATCHED, "item-1", 100, "user", null, NOW))
            .isInstanceOf(ValidationException.class);
        assertThat(skipped.reopen(NOW).matchStatus()).isEqualTo(MatchStatus.UNMATCHED);
        assertThatThrownBy(() -> line().reopen(NOW)).isInstanceOf(ValidationException.class);
    }

    @Test
    void recordsInventoryPriceChangeOnlyOnce() {
        InvoiceLineItem added = line()
            .match(MatchStatus.MANUAL_MATCHED, "item-1", 100, "user", null, NOW)
            .addedToInventory(new BigDecimal("11.00"), "alice", NOW);

        assertThat(added.previousPrice()).isEqualByComparingTo("11.00");
        assertThat(added.newPrice()).isEqualByComparingTo("12.50");
        assertThat(added.addedToInventory()).isTrue();
        assertThatThrownBy(() -> added.addedToInventory(new BigDecimal("12.50"), "alice", NOW))
            .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void onlyNotesAreEditableAfterInventoryUpdate() {
        InvoiceLineItem added = line()
            .match(MatchStatus.MANUAL_MATCHED, "item-1", 100, "user", null, NOW)
            .addedToInventory(null, "alice", NOW);

        assertThat(added.edit(LineEdit.notes("checked"), NOW).matchNotes()).isEqualTo("checked");
        assertThatThrownBy(() -> added.edit(new LineEdit(null, BigDecimal.TEN, null, null, null, null, null), NOW))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void lineTypeSetsRoutingFlags() {
        InvoiceLineItem deposit = line().toBuilder().lineType(LineType.DEPOSIT).build();

        assertThat(deposit.deposit()).isTrue();
        assertThat(deposit.forInventory()).isFalse();
        assertThat(deposit.forAccounting()).isFalse();
    }

    private static InvoiceLineItem line() {
        return InvoiceLineItem.builder()
            .id("line-1")
            .invoiceId("inv-1")
            .lineNumber(1)
            .description("Beef striploin")
            .quantity(BigDecimal.ONE)
            .unitPrice(new BigDecimal("12.50"))
            .totalPrice(new BigDecimal("35.50"))
            .createdAt(NOW)
            .build();
    }
}
