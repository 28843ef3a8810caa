package dev.pekelund.reconcile.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.reconcile.errors.InvariantViolationException;
import dev.pekelund.reconcile.errors.NotFoundException;
import dev.pekelund.reconcile.errors.ValidationException;
import dev.pekelund.reconcile.inventory.InventoryItem;
import dev.pekelund.reconcile.inventory.PriceHistoryEntry;
import dev.pekelund.reconcile.invoices.Invoice;
import dev.pekelund.reconcile.lines.InventoryMatcher;
import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.LineEdit;
import dev.pekelund.reconcile.lines.LineInterpreter;
import dev.pekelund.reconcile.lines.LineType;
import dev.pekelund.reconcile.lines.MatchCandidate;
import dev.pekelund.reconcile.lines.MatchStatus;
import dev.pekelund.reconcile.lines.PriceChangePolicy;
import dev.pekelund.reconcile.pricing.PricingModel;
import dev.pekelund.reconcile.processor.local.InMemoryConfirmationUnitOfWork;
import dev.pekelund.reconcile.processor.local.InMemoryInventoryStore;
import dev.pekelund.reconcile.processor.local.InMemoryInvoiceLineRepository;
import dev.pekelund.reconcile.processor.local.InMemoryInvoiceRepository;
import dev.pekelund.reconcile.processor.local.InMemoryParsingProfileRepository;
import dev.pekelund.reconcile.profile.PromptHintGenerator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LineMatchingServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:30:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private InMemoryInvoiceLineRepository lineRepository;
    private InMemoryInventoryStore inventory;
    private InMemoryInvoiceRepository invoiceRepository;
    private LineMatchingService service;
    private String invoiceId;
    private String itemId;

    @BeforeEach
    void setUp() {
        lineRepository = new InMemoryInvoiceLineRepository();
        inventory = new InMemoryInventoryStore(clock);
        invoiceRepository = new InMemoryInvoiceRepository();
        VendorProfileManager profileManager = new VendorProfileManager(new InMemoryParsingProfileRepository(),
            new PromptHintGenerator(), clock);
        service = new LineMatchingService(lineRepository, inventory,
            new InMemoryConfirmationUnitOfWork(inventory, lineRepository, clock), new PriceChangePolicy(),
            new LineInterpreter(), profileManager, invoiceRepository, new InventoryMatcher(), clock);

        invoiceId = invoiceRepository.save(Invoice.builder()
            .vendorId("sysco")
            .vendorName("Sysco")
            .invoiceNumber("INV-1")
            .createdAt(NOW)
            .build()).id();
        InventoryItem item = inventory.create(InventoryItem.newItem("Chicken breast", "CHK-1", "ea")
            .withPrice(new BigDecimal("10.00"), null, "previous-invoice", NOW));
        itemId = item.id();
    }

    @Test
    void autoMatchBelowThresholdLeavesLineUnmatched() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));

        InvoiceLineItem result = service.autoMatch(line.id(), itemId, 79);

        assertThat(result.matchStatus()).isEqualTo(MatchStatus.UNMATCHED);
        assertThat(result.inventoryItemId()).isNull();
    }

    @Test
    void autoMatchAtThresholdLinksItem() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));

        InvoiceLineItem result = service.autoMatch(line.id(), itemId, 80);

        assertThat(result.matchStatus()).isEqualTo(MatchStatus.AUTO_MATCHED);
        assertThat(result.inventoryItemId()).isEqualTo(itemId);
        assertThat(result.matchConfidence()).isEqualTo(80);
        assertThat(lineRepository.findById(line.id())).contains(result);
    }

    @Test
    void findMatchLinksBestCandidateAndKeepsTheRanking() {
        inventory.create(InventoryItem.newItem("Chicken thighs", "CHK-7", "ea"));
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));

        AutoMatchResult result = service.findMatch(line.id());

        assertThat(result.matched()).isTrue();
        assertThat(result.line().matchStatus()).isEqualTo(MatchStatus.AUTO_MATCHED);
        assertThat(result.line().inventoryItemId()).isEqualTo(itemId);
        assertThat(result.line().matchConfidence()).isEqualTo(90);
        assertThat(result.line().matchedBy()).isEqualTo("ai");
        assertThat(result.line().matchNotes()).isEqualTo("Auto-matched with 90% confidence");
        assertThat(result.candidates()).extracting(MatchCandidate::name)
            .containsExactly("Chicken breast", "Chicken thighs");
        assertThat(service.get(line.id()).matchCandidates()).hasSize(2);
    }

    @Test
    void findMatchBelowThresholdOnlyRecordsCandidates() {
        InvoiceLineItem line = lineRepository.save(baseLine(new BigDecimal("12.50"))
            .description("Breast fillet frozen")
            .sku(null)
            .build());

        AutoMatchResult result = service.findMatch(line.id());

        assertThat(result.matched()).isFalse();
        assertThat(result.bestScore()).isEqualTo(23);
        InvoiceLineItem stored = service.get(line.id());
        assertThat(stored.matchStatus()).isEqualTo(MatchStatus.UNMATCHED);
        assertThat(stored.inventoryItemId()).isNull();
        assertThat(stored.matchConfidence()).isEqualTo(23);
        assertThat(stored.matchCandidates()).singleElement()
            .satisfies(candidate -> assertThat(candidate.inventoryItemId()).isEqualTo(itemId));
    }

    @Test
    void findMatchUsesItemAliases() {
        String aliased = inventory.create(InventoryItem.newItem("Chicken thighs", null, "kg")
            .withAliases(List.of("Poulet cuisse"))).id();
        InvoiceLineItem line = lineRepository.save(baseLine(new BigDecimal("9.00"))
            .description("POULET CUISSE")
            .sku(null)
            .build());

        AutoMatchResult result = service.findMatch(line.id());

        assertThat(result.matched()).isTrue();
        assertThat(result.line().inventoryItemId()).isEqualTo(aliased);
        assertThat(result.line().matchConfidence()).isEqualTo(95);
    }

    @Test
    void findMatchWithoutInventoryHitsLeavesLineAlone() {
        InvoiceLineItem line = lineRepository.save(baseLine(new BigDecimal("3.00"))
            .description("Dish soap")
            .sku(null)
            .build());

        AutoMatchResult result = service.findMatch(line.id());

        assertThat(result.matched()).isFalse();
        assertThat(result.candidates()).isEmpty();
        assertThat(service.get(line.id()).matchConfidence()).isNull();
    }

    @Test
    void lineAddedToInventoryCannotBeMatchedAgain() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));
        service.markNewItem(line.id(), null, "chef");

        assertThatThrownBy(() -> service.findMatch(line.id())).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.unmatch(line.id()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("added to inventory");
    }

    @Test
    void unmatchClearsAutomaticMatch() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));
        service.findMatch(line.id());

        InvoiceLineItem unmatched = service.unmatch(line.id());

        assertThat(unmatched.matchStatus()).isEqualTo(MatchStatus.UNMATCHED);
        assertThat(unmatched.inventoryItemId()).isNull();
        assertThat(unmatched.matchedBy()).isNull();
        assertThat(unmatched.matchConfidence()).isNull();
    }

    @Test
    void autoMatchInvoiceOnlyTriesOpenLines() {
        InvoiceLineItem matchable = storeLine(new BigDecimal("12.50"));
        InvoiceLineItem unknown = lineRepository.save(baseLine(new BigDecimal("3.00"))
            .lineNumber(2)
            .description("Breast fillet frozen")
            .sku(null)
            .build());
        InvoiceLineItem skipped = lineRepository.save(baseLine(new BigDecimal("5.00")).lineNumber(3).build());
        service.skip(skipped.id(), "freight");
        InvoiceLineItem manual = lineRepository.save(baseLine(new BigDecimal("5.00")).lineNumber(4).build());
        service.manualMatch(manual.id(), itemId, "chef", null);

        InvoiceAutoMatchResult result = service.autoMatchInvoice(invoiceId);

        assertThat(result.matched()).singleElement().satisfies(matched -> {
            assertThat(matched.lineId()).isEqualTo(matchable.id());
            assertThat(matched.itemName()).isEqualTo("Chicken breast");
            assertThat(matched.confidence()).isEqualTo(90);
        });
        assertThat(result.unmatched()).singleElement().satisfies(open -> {
            assertThat(open.lineId()).isEqualTo(unknown.id());
            assertThat(open.bestConfidence()).isEqualTo(23);
            assertThat(open.candidates()).hasSize(1);
        });
        assertThat(service.get(skipped.id()).matchStatus()).isEqualTo(MatchStatus.SKIPPED);
        assertThat(service.get(manual.id()).matchedBy()).isEqualTo("chef");
    }

    @Test
    void confirmAllAppliesMatchedLinesAndReportsTheRest() {
        InvoiceLineItem matched = storeLine(new BigDecimal("12.50"));
        service.manualMatch(matched.id(), itemId, "chef", null);
        InvoiceLineItem open = lineRepository.save(baseLine(new BigDecimal("3.00")).lineNumber(2).build());
        InvoiceLineItem skipped = lineRepository.save(baseLine(new BigDecimal("5.00")).lineNumber(3).build());
        service.skip(skipped.id(), "freight");

        BulkConfirmResult result = service.confirmAll(invoiceId, "chef", false);

        assertThat(result.applied()).extracting(BulkConfirmResult.LineOutcome::lineId).containsExactly(matched.id());
        assertThat(result.skipped()).extracting(BulkConfirmResult.LineOutcome::lineId).containsExactly(skipped.id());
        assertThat(result.errors()).singleElement()
            .satisfies(error -> assertThat(error.lineId()).isEqualTo(open.id()));
        assertThat(inventory.findById(itemId).orElseThrow().currentStock()).isEqualByComparingTo("2");
        assertThat(service.get(matched.id()).matchStatus()).isEqualTo(MatchStatus.CONFIRMED);

        BulkConfirmResult again = service.confirmAll(invoiceId, "chef", true);

        assertThat(again.applied()).isEmpty();
        assertThat(again.errors()).isEmpty();
        assertThat(again.skipped()).hasSize(3);
        assertThat(inventory.findById(itemId).orElseThrow().currentStock()).isEqualByComparingTo("2");
    }

    @Test
    void manualMatchRequiresExistingItem() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));

        assertThatThrownBy(() -> service.manualMatch(line.id(), "missing", "chef", null))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void confirmAppliesPriceStockAndHistoryAndFlagsLargeChange() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));
        service.manualMatch(line.id(), itemId, "chef", null);

        InvoiceLineItem confirmed = service.confirm(line.id(), true, "chef");

        assertThat(confirmed.matchStatus()).isEqualTo(MatchStatus.CONFIRMED);
        assertThat(confirmed.addedToInventory()).isTrue();
        assertThat(confirmed.previousPrice()).isEqualByComparingTo("10.00");
        assertThat(confirmed.newPrice()).isEqualByComparingTo("12.50");
        assertThat(confirmed.discrepancy()).isTrue();
        assertThat(confirmed.discrepancyNotes()).isEqualTo("Price changed 25.0% from $10.00 to $12.50");

        InventoryItem item = inventory.findById(itemId).orElseThrow();
        assertThat(item.currentPrice()).isEqualByComparingTo("12.50");
        assertThat(item.previousPrice()).isEqualByComparingTo("10.00");
        assertThat(item.currentStock()).isEqualByComparingTo("2");

        List<PriceHistoryEntry> history = inventory.priceHistory(itemId);
        assertThat(history).singleElement().satisfies(entry -> {
            assertThat(entry.sourceInvoiceId()).isEqualTo(invoiceId);
            assertThat(entry.sourceLineId()).isEqualTo(line.id());
            assertThat(entry.previousPrice()).isEqualByComparingTo("10.00");
            assertThat(entry.newPrice()).isEqualByComparingTo("12.50");
        });
    }

    @Test
    void confirmWithinThresholdIsNotADiscrepancy() {
        InvoiceLineItem line = storeLine(new BigDecimal("10.50"));
        service.manualMatch(line.id(), itemId, "chef", null);

        InvoiceLineItem confirmed = service.confirm(line.id(), true, "chef");

        assertThat(confirmed.discrepancy()).isFalse();
        assertThat(inventory.findById(itemId).orElseThrow().currentPrice()).isEqualByComparingTo("10.50");
    }

    @Test
    void confirmWithoutInventoryUpdateLeavesItemAlone() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));
        service.manualMatch(line.id(), itemId, "chef", null);

        InvoiceLineItem confirmed = service.confirm(line.id(), false, null);

        assertThat(confirmed.matchStatus()).isEqualTo(MatchStatus.CONFIRMED);
        assertThat(confirmed.matchedBy()).isEqualTo("system");
        assertThat(confirmed.addedToInventory()).isFalse();
        assertThat(inventory.findById(itemId).orElseThrow().currentPrice()).isEqualByComparingTo("10.00");
        assertThat(inventory.priceHistory(itemId)).isEmpty();
    }

    @Test
    void confirmedLineCannotBeConfirmedAgain() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));
        service.manualMatch(line.id(), itemId, "chef", null);
        service.confirm(line.id(), true, "chef");

        assertThatThrownBy(() -> service.confirm(line.id(), true, "chef"))
            .isInstanceOf(ValidationException.class);
        assertThat(inventory.findById(itemId).orElseThrow().currentStock()).isEqualByComparingTo("2");
        assertThat(inventory.priceHistory(itemId)).hasSize(1);
    }

    @Test
    void confirmingUnmatchedLineIsRejected() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));

        assertThatThrownBy(() -> service.confirm(line.id(), true, "chef"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("unmatched");
    }

    @Test
    void depositLinesAreConfirmedWithoutTouchingInventory() {
        InvoiceLineItem line = lineRepository.save(baseLine(new BigDecimal("0.10"))
            .description("Bottle deposit")
            .lineType(LineType.DEPOSIT)
            .build());
        service.manualMatch(line.id(), itemId, "chef", null);

        InvoiceLineItem confirmed = service.confirm(line.id(), true, "chef");

        assertThat(confirmed.addedToInventory()).isFalse();
        assertThat(inventory.findById(itemId).orElseThrow().currentPrice()).isEqualByComparingTo("10.00");
    }

    @Test
    void markNewItemCreatesPricedItemAndIsNotAppliedAgainOnConfirm() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));

        InvoiceLineItem linked = service.markNewItem(line.id(), null, "chef");

        assertThat(linked.matchStatus()).isEqualTo(MatchStatus.NEW_ITEM);
        assertThat(linked.addedToInventory()).isTrue();
        InventoryItem created = inventory.findById(linked.inventoryItemId()).orElseThrow();
        assertThat(created.name()).isEqualTo("Chicken breast 2kg");
        assertThat(created.currentPrice()).isEqualByComparingTo("12.50");
        assertThat(created.currentStock()).isEqualByComparingTo("2");

        InvoiceLineItem confirmed = service.confirm(line.id(), true, "chef");

        assertThat(confirmed.matchStatus()).isEqualTo(MatchStatus.CONFIRMED);
        assertThat(inventory.findById(created.id()).orElseThrow().currentStock()).isEqualByComparingTo("2");
    }

    @Test
    void rejectClearsItemAndAllowsRematch() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));
        service.manualMatch(line.id(), itemId, "chef", null);

        InvoiceLineItem rejected = service.reject(line.id(), "wrong cut");

        assertThat(rejected.matchStatus()).isEqualTo(MatchStatus.REJECTED);
        assertThat(rejected.inventoryItemId()).isNull();
        assertThat(service.manualMatch(line.id(), itemId, "chef", "second try").matchStatus())
            .isEqualTo(MatchStatus.MANUAL_MATCHED);
    }

    @Test
    void rejectingNewItemTakesItsStockBackSoConfirmAppliesToTheRealItem() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));
        String createdId = service.markNewItem(line.id(), null, "chef").inventoryItemId();

        InvoiceLineItem rejected = service.reject(line.id(), "already stocked as Chicken breast");

        assertThat(rejected.addedToInventory()).isFalse();
        assertThat(rejected.newPrice()).isNull();
        assertThat(inventory.findById(createdId).orElseThrow().currentStock()).isEqualByComparingTo("0");

        service.manualMatch(line.id(), itemId, "chef", null);
        InvoiceLineItem confirmed = service.confirm(line.id(), true, "chef");

        assertThat(confirmed.addedToInventory()).isTrue();
        assertThat(confirmed.previousPrice()).isEqualByComparingTo("10.00");
        assertThat(confirmed.newPrice()).isEqualByComparingTo("12.50");
        InventoryItem target = inventory.findById(itemId).orElseThrow();
        assertThat(target.currentPrice()).isEqualByComparingTo("12.50");
        assertThat(target.currentStock()).isEqualByComparingTo("2");
    }

    @Test
    void rejectIsAllowedFromEveryOpenState() {
        InvoiceLineItem unmatched = storeLine(new BigDecimal("12.50"));
        InvoiceLineItem auto = storeLine(new BigDecimal("12.50"));
        service.autoMatch(auto.id(), itemId, 90);
        InvoiceLineItem manual = storeLine(new BigDecimal("12.50"));
        service.manualMatch(manual.id(), itemId, "chef", null);
        InvoiceLineItem newItem = storeLine(new BigDecimal("12.50"));
        service.markNewItem(newItem.id(), "Chicken breast, free range", "chef");
        InvoiceLineItem skipped = storeLine(new BigDecimal("12.50"));
        service.skip(skipped.id(), "not food");
        InvoiceLineItem rejectedBefore = storeLine(new BigDecimal("12.50"));
        service.reject(rejectedBefore.id(), "first look");

        for (InvoiceLineItem line : List.of(unmatched, auto, manual, newItem, skipped, rejectedBefore)) {
            InvoiceLineItem rejected = service.reject(line.id(), "wrong product");

            assertThat(rejected.matchStatus()).isEqualTo(MatchStatus.REJECTED);
            assertThat(rejected.inventoryItemId()).isNull();
            assertThat(rejected.addedToInventory()).isFalse();
        }
        assertThat(inventory.findById(itemId).orElseThrow().currentStock()).isEqualByComparingTo("0");
    }

    @Test
    void confirmedLineCannotBeRejected() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));
        service.manualMatch(line.id(), itemId, "chef", null);
        service.confirm(line.id(), true, "chef");

        assertThatThrownBy(() -> service.reject(line.id(), "too late")).isInstanceOf(ValidationException.class);
        assertThat(inventory.findById(itemId).orElseThrow().currentStock()).isEqualByComparingTo("2");
    }

    @Test
    void skippedLineOnlyReturnsThroughReopen() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));
        service.skip(line.id(), "not food");

        assertThatThrownBy(() -> service.manualMatch(line.id(), itemId, "chef", null))
            .isInstanceOf(ValidationException.class);

        assertThat(service.reopen(line.id()).matchStatus()).isEqualTo(MatchStatus.UNMATCHED);
    }

    @Test
    void editedAmountsAreDetectedAgain() {
        InvoiceLineItem line = lineRepository.save(baseLine(new BigDecimal("4.00"))
            .quantity(new BigDecimal("3"))
            .totalPrice(new BigDecimal("13.00"))
            .pricingModel(PricingModel.UNDETERMINED)
            .pricingNote("Line total 13.00 does not match")
            .discrepancy(true)
            .discrepancyNotes("Line total 13.00 does not match")
            .build());

        InvoiceLineItem edited = service.editLine(line.id(),
            new LineEdit(null, null, null, null, null, new BigDecimal("12.00"), "reprinted total"));

        assertThat(edited.pricingModel()).isEqualTo(PricingModel.QUANTITY);
        assertThat(edited.discrepancy()).isFalse();
        assertThat(edited.matchNotes()).isEqualTo("reprinted total");
    }

    @Test
    void manualDiscrepancyFlagIsStored() {
        InvoiceLineItem line = storeLine(new BigDecimal("12.50"));

        service.flagDiscrepancy(line.id(), "Short delivered");

        InvoiceLineItem stored = service.get(line.id());
        assertThat(stored.discrepancy()).isTrue();
        assertThat(stored.discrepancyNotes()).isEqualTo("Short delivered");
    }

    @Test
    void weightPricedLinesStockTheirWeight() {
        InvoiceLineItem line = baseLine(new BigDecimal("8.00"))
            .quantity(BigDecimal.ONE)
            .weight(new BigDecimal("2.5"))
            .pricingModel(PricingModel.WEIGHT)
            .build();

        assertThat(LineMatchingService.stockDelta(line)).isEqualByComparingTo("2.5");
        assertThat(LineMatchingService.stockDelta(line.toBuilder().pricingModel(PricingModel.QUANTITY).build()))
            .isEqualByComparingTo("1");
    }

    @Test
    void confirmationCannotBypassMissingItemInvariant() {
        InvoiceLineItem.Builder confirmedWithoutItem = baseLine(new BigDecimal("1.00"))
            .matchStatus(MatchStatus.CONFIRMED);

        assertThatThrownBy(confirmedWithoutItem::build).isInstanceOf(InvariantViolationException.class);
    }

    private InvoiceLineItem storeLine(BigDecimal unitPrice) {
        return lineRepository.save(baseLine(unitPrice).build());
    }

    private InvoiceLineItem.Builder baseLine(BigDecimal unitPrice) {
        return InvoiceLineItem.builder()
            .invoiceId(invoiceId)
            .lineNumber(1)
            .description("Chicken breast 2kg")
            .sku("CHK-1")
            .quantity(new BigDecimal("2"))
            .unit("ea")
            .unitPrice(unitPrice)
            .totalPrice(unitPrice.multiply(new BigDecimal("2")))
            .pricingModel(PricingModel.QUANTITY)
            .lineType(LineType.PRODUCT)
            .matchStatus(MatchStatus.UNMATCHED)
            .createdAt(NOW)
            .updatedAt(NOW);
    }
}
