package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.errors.NotFoundException;
import dev.pekelund.reconcile.errors.ReconciliationException;
import dev.pekelund.reconcile.errors.ValidationException;
import dev.pekelund.reconcile.inventory.InventoryGateway;
import dev.pekelund.reconcile.inventory.InventoryItem;
import dev.pekelund.reconcile.inventory.PriceHistoryEntry;
import dev.pekelund.reconcile.invoices.Invoice;
import dev.pekelund.reconcile.invoices.InvoiceRepository;
import dev.pekelund.reconcile.lines.ConfirmationUnitOfWork;
import dev.pekelund.reconcile.lines.InventoryMatcher;
import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.InvoiceLineRepository;
import dev.pekelund.reconcile.lines.LineConfirmation;
import dev.pekelund.reconcile.lines.LineConfirmation.InventoryUpdate;
import dev.pekelund.reconcile.lines.LineEdit;
import dev.pekelund.reconcile.lines.LineInterpreter;
import dev.pekelund.reconcile.lines.MatchCandidate;
import dev.pekelund.reconcile.lines.MatchStatus;
import dev.pekelund.reconcile.lines.PriceChangePolicy;
import dev.pekelund.reconcile.pricing.PricingModel;
import dev.pekelund.reconcile.processor.BulkConfirmResult.LineOutcome;
import dev.pekelund.reconcile.processor.InvoiceAutoMatchResult.MatchedLine;
import dev.pekelund.reconcile.processor.InvoiceAutoMatchResult.UnmatchedLine;
import dev.pekelund.reconcile.profile.ParsingProfile;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Moves invoice lines through their match lifecycle and writes confirmed prices to inventory.
 */
@Service
public class LineMatchingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineMatchingService.class);

    static final String SYSTEM_USER = "system";

    static final String MATCHER_USER = "ai";

    /**
     * Candidates reported per unmatched line in an invoice-wide run.
     */
    static final int REPORTED_CANDIDATES = 3;

    private final InvoiceLineRepository lineRepository;
    private final InventoryGateway inventory;
    private final ConfirmationUnitOfWork unitOfWork;
    private final PriceChangePolicy priceChangePolicy;
    private final LineInterpreter interpreter;
    private final VendorProfileManager profileManager;
    private final InvoiceRepository invoiceRepository;
    private final InventoryMatcher matcher;
    private final Clock clock;

    public LineMatchingService(InvoiceLineRepository lineRepository, InventoryGateway inventory,
        ConfirmationUnitOfWork unitOfWork, PriceChangePolicy priceChangePolicy, LineInterpreter interpreter,
        VendorProfileManager profileManager, InvoiceRepository invoiceRepository, InventoryMatcher matcher,
        Clock clock) {

        this.lineRepository = Objects.requireNonNull(lineRepository, "lineRepository");
        this.inventory = Objects.requireNonNull(inventory, "inventory");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.priceChangePolicy = Objects.requireNonNull(priceChangePolicy, "priceChangePolicy");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.profileManager = Objects.requireNonNull(profileManager, "profileManager");
        this.invoiceRepository = Objects.requireNonNull(invoiceRepository, "invoiceRepository");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public InvoiceLineItem get(String lineId) {
        return lineRepository.findById(lineId).orElseThrow(() -> NotFoundException.of("Invoice line", lineId));
    }

    public List<InvoiceLineItem> listForInvoice(String invoiceId) {
        return lineRepository.findByInvoiceId(invoiceId);
    }

    public List<InvoiceLineItem> listForInvoice(String invoiceId, MatchStatus status) {
        if (status == null) {
            return listForInvoice(invoiceId);
        }
        return lineRepository.findByInvoiceIdAndMatchStatus(invoiceId, status);
    }

    /**
     * Searches inventory for the line's description, stores the ranked candidates on the line and links
     * the best one when it reaches the auto match threshold.
     */
    public AutoMatchResult findMatch(String lineId) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forLine(lineId)) {
            ReconciliationMdc.setStage("auto-match");
            InvoiceLineItem line = get(lineId);
            if (line.addedToInventory() || !line.matchStatus().canTransitionTo(MatchStatus.AUTO_MATCHED)) {
                throw new ValidationException("Line " + lineId + " cannot be matched automatically while "
                    + line.matchStatus().wireValue() + (line.addedToInventory() ? " and added to inventory" : ""));
            }
            String query = matchQuery(line);
            if (!StringUtils.hasText(query)) {
                LOGGER.info("Line {} has no description to match", lineId);
                return new AutoMatchResult(line, false, List.of());
            }

            Instant now = clock.instant();
            List<MatchCandidate> ranked = matcher.rank(query, inventory.search(query, InventoryMatcher.SEARCH_LIMIT));
            InvoiceLineItem scored = line.withCandidates(ranked, now);
            Optional<MatchCandidate> chosen = matcher.choose(ranked);
            if (chosen.isEmpty()) {
                LOGGER.info("Line {} left for review: {} candidate(s), best score {}", lineId, ranked.size(),
                    ranked.isEmpty() ? 0 : ranked.get(0).score());
                return new AutoMatchResult(saved(scored, "scored"), false, ranked);
            }
            MatchCandidate best = chosen.get();
            InvoiceLineItem matched = scored.match(MatchStatus.AUTO_MATCHED, best.inventoryItemId(), best.score(),
                MATCHER_USER, "Auto-matched with " + best.score() + "% confidence", now);
            return new AutoMatchResult(saved(matched, "auto matched to " + best.inventoryItemId()), true, ranked);
        }
    }

    /**
     * Runs {@link #findMatch(String)} over the invoice's lines that are not linked to an item yet.
     */
    public InvoiceAutoMatchResult autoMatchInvoice(String invoiceId) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forInvoice(invoiceId, null)) {
            List<MatchedLine> matched = new ArrayList<>();
            List<UnmatchedLine> unmatched = new ArrayList<>();
            for (InvoiceLineItem line : listForInvoice(invoiceId)) {
                if (StringUtils.hasText(line.inventoryItemId()) || line.addedToInventory()
                    || !line.matchStatus().canTransitionTo(MatchStatus.AUTO_MATCHED)) {
                    continue;
                }
                AutoMatchResult result = findMatch(line.id());
                if (result.matched()) {
                    MatchCandidate best = result.candidates().get(0);
                    matched.add(new MatchedLine(line.id(), line.lineNumber(), best.inventoryItemId(), best.name(),
                        best.score()));
                } else {
                    unmatched.add(new UnmatchedLine(line.id(), line.lineNumber(), line.description(),
                        result.bestScore(),
                        result.candidates().subList(0, Math.min(REPORTED_CANDIDATES, result.candidates().size()))));
                }
            }
            LOGGER.info("Auto match of invoice {}: {} line(s) matched, {} left for review", invoiceId,
                matched.size(), unmatched.size());
            return new InvoiceAutoMatchResult(matched, unmatched);
        }
    }

    /**
     * Records a suggestion from an automatic matcher. Suggestions below the configured confidence leave
     * the line untouched.
     *
     * @return the line, matched only when the confidence reached the threshold
     */
    public InvoiceLineItem autoMatch(String lineId, String inventoryItemId, int confidence) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forLine(lineId)) {
            InvoiceLineItem line = get(lineId);
            int threshold = matcher.threshold();
            if (confidence < threshold) {
                LOGGER.info("Ignoring auto match of line {} to item {}: confidence {} below {}", lineId,
                    inventoryItemId, confidence, threshold);
                return line;
            }
            requireItem(inventoryItemId);
            InvoiceLineItem matched = line.match(MatchStatus.AUTO_MATCHED, inventoryItemId, confidence,
                SYSTEM_USER, null, clock.instant());
            return saved(matched, "auto matched to " + inventoryItemId);
        }
    }

    public InvoiceLineItem manualMatch(String lineId, String inventoryItemId, String matchedBy, String notes) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forLine(lineId)) {
            InvoiceLineItem line = get(lineId);
            requireItem(inventoryItemId);
            InvoiceLineItem matched = line.match(MatchStatus.MANUAL_MATCHED, inventoryItemId, 100, matchedBy, notes,
                clock.instant());
            return saved(matched, "manually matched to " + inventoryItemId);
        }
    }

    /**
     * Creates an inventory item from the line, priced at the line's unit price and stocked with its
     * amount, and links the line to it. The line counts as added to inventory, so a later confirmation
     * does not apply it again.
     */
    public InvoiceLineItem markNewItem(String lineId, String itemName, String createdBy) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forLine(lineId)) {
            InvoiceLineItem line = get(lineId);
            line.matchStatus().requireTransitionTo(MatchStatus.NEW_ITEM);
            String name = StringUtils.hasText(itemName) ? itemName.trim() : line.description();
            if (!StringUtils.hasText(name)) {
                throw new ValidationException("An item name is required to create an inventory item from line "
                    + lineId);
            }
            Instant now = clock.instant();
            InventoryItem draft = InventoryItem.newItem(name, line.sku(), line.unit());
            if (line.unitPrice() != null) {
                draft = draft.withPrice(line.unitPrice(), line.normalizedPrice(), line.invoiceId(), now);
            }
            draft = draft.withStockDelta(stockDelta(line));
            InventoryItem created = inventory.create(draft);
            LOGGER.info("Created inventory item {} ('{}') from line {}", created.id(), name, lineId);

            InvoiceLineItem linked = line.match(MatchStatus.NEW_ITEM, created.id(), 100, createdBy,
                "Created new inventory item", now);
            if (!linked.addedToInventory()) {
                linked = linked.addedToInventory(null, createdBy, now);
            }
            return saved(linked, "linked to new item " + created.id());
        }
    }

    /**
     * Removes an automatic or manual match that was not added to inventory.
     */
    public InvoiceLineItem unmatch(String lineId) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forLine(lineId)) {
            return saved(get(lineId).unmatch(clock.instant()), "unmatched");
        }
    }

    public InvoiceLineItem skip(String lineId, String reason) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forLine(lineId)) {
            return saved(get(lineId).skip(reason, clock.instant()), "skipped");
        }
    }

    public InvoiceLineItem reopen(String lineId) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forLine(lineId)) {
            return saved(get(lineId).reopen(clock.instant()), "reopened");
        }
    }

    /**
     * Rejects the line's match. When the line was already added to its item, the stock it added is
     * taken back and, if the item still carries the line's price, the price it replaced is restored.
     */
    public InvoiceLineItem reject(String lineId, String reason) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forLine(lineId)) {
            InvoiceLineItem line = get(lineId);
            Instant now = clock.instant();
            InvoiceLineItem rejected = line.reject(reason, now);
            if (!line.addedToInventory() || !StringUtils.hasText(line.inventoryItemId()) || !line.forInventory()) {
                return saved(rejected, "rejected");
            }

            InventoryItem item = requireItem(line.inventoryItemId());
            BigDecimal restoredPrice = null;
            PriceHistoryEntry history = null;
            if (line.previousPrice() != null && line.newPrice() != null && item.currentPrice() != null
                && item.currentPrice().compareTo(line.newPrice()) == 0
                && line.previousPrice().compareTo(line.newPrice()) != 0) {
                restoredPrice = line.previousPrice();
                history = new PriceHistoryEntry(item.id(), line.invoiceId(), line.id(), item.currentPrice(),
                    restoredPrice, null, null, null, now);
            }
            BigDecimal delta = stockDelta(line);
            InventoryUpdate reversal = new InventoryUpdate(item.id(), restoredPrice, null,
                delta != null ? delta.negate() : null, history);
            InvoiceLineItem committed = unitOfWork.commit(new LineConfirmation(rejected, reversal));
            LOGGER.info("Line {} rejected and taken back from item {}: stock {}, price restored to {}", lineId,
                item.id(), reversal.stockDelta(), restoredPrice);
            return committed;
        }
    }

    public InvoiceLineItem flagDiscrepancy(String lineId, String notes) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forLine(lineId)) {
            InvoiceLineItem flagged = lineRepository.save(get(lineId).flagDiscrepancy(notes, clock.instant()));
            LOGGER.warn("Line {} flagged with a discrepancy: {}", lineId, notes);
            return flagged;
        }
    }

    /**
     * Applies manual corrections. Changed amounts are run through pricing detection again, using the
     * vendor's profile when one exists.
     */
    public InvoiceLineItem editLine(String lineId, LineEdit edit) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forLine(lineId)) {
            InvoiceLineItem line = get(lineId);
            InvoiceLineItem edited = line.edit(edit, clock.instant());
            if (edit.changesAmounts()) {
                edited = interpreter.reevaluate(edited, vendorProfile(line.invoiceId()).orElse(null));
                LOGGER.info("Line {} re-evaluated after edit as {} pricing", lineId,
                    edited.pricingModel().wireValue());
            }
            return saved(edited, "edited");
        }
    }

    /**
     * Confirms a matched line. With {@code updateInventory} the line's unit price becomes the item's
     * current price, its amount is added to stock and the price change is recorded, all in one unit of
     * work. A line already added to inventory is never applied twice.
     */
    public InvoiceLineItem confirm(String lineId, boolean updateInventory, String confirmedBy) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forLine(lineId)) {
            ReconciliationMdc.setStage("confirm");
            InvoiceLineItem line = get(lineId);
            Instant now = clock.instant();
            String by = StringUtils.hasText(confirmedBy) ? confirmedBy : SYSTEM_USER;
            InvoiceLineItem confirmed = line.confirm(by, now);

            if (!updateInventory || line.addedToInventory() || !line.forInventory()) {
                if (updateInventory) {
                    LOGGER.info("Line {} confirmed without inventory update (added before: {}, inventory line: {})",
                        lineId, line.addedToInventory(), line.forInventory());
                }
                return saved(confirmed, "confirmed");
            }

            InventoryItem item = requireItem(line.inventoryItemId());
            BigDecimal priorPrice = item.currentPrice();
            confirmed = confirmed.addedToInventory(priorPrice, by, now);

            Optional<String> change = priceChangePolicy.evaluate(priorPrice, line.unitPrice());
            if (change.isPresent()) {
                LOGGER.warn("Line {} price discrepancy on item {}: {}", lineId, item.id(), change.get());
                confirmed = confirmed.flagDiscrepancy(change.get(), now);
            }

            PriceHistoryEntry history = null;
            if (line.unitPrice() != null && (priorPrice == null || priorPrice.compareTo(line.unitPrice()) != 0)) {
                history = new PriceHistoryEntry(item.id(), line.invoiceId(), line.id(), priorPrice, line.unitPrice(),
                    line.pricePerG(), line.pricePerMl(), line.pricePerUnit(), now);
            }
            InventoryUpdate update = new InventoryUpdate(item.id(), line.unitPrice(), line.normalizedPrice(),
                stockDelta(line), history);
            InvoiceLineItem committed = unitOfWork.commit(new LineConfirmation(confirmed, update));
            LOGGER.info("Line {} confirmed and applied to item {}: price {} -> {}, stock {}", lineId, item.id(),
                priorPrice, line.unitPrice(), update.stockDelta());
            return committed;
        }
    }

    /**
     * Confirms every matched line of the invoice with an inventory update. Each line is committed on
     * its own; a line that fails is reported and the rest carry on.
     *
     * @param skipUnmatched report lines without an item as skipped instead of as errors
     */
    public BulkConfirmResult confirmAll(String invoiceId, String confirmedBy, boolean skipUnmatched) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forInvoice(invoiceId, null)) {
            ReconciliationMdc.setStage("confirm");
            List<LineOutcome> applied = new ArrayList<>();
            List<LineOutcome> skipped = new ArrayList<>();
            List<LineOutcome> errors = new ArrayList<>();
            for (InvoiceLineItem line : listForInvoice(invoiceId)) {
                MatchStatus status = line.matchStatus();
                if (status == MatchStatus.CONFIRMED || status == MatchStatus.SKIPPED
                    || status == MatchStatus.REJECTED) {
                    skipped.add(outcome(line, "Already " + status.wireValue()));
                    continue;
                }
                if (!StringUtils.hasText(line.inventoryItemId())) {
                    if (skipUnmatched) {
                        skipped.add(outcome(line, "Not matched to an inventory item"));
                    } else {
                        errors.add(outcome(line, "Line must be matched before it is confirmed"));
                    }
                    continue;
                }
                try {
                    InvoiceLineItem confirmed = confirm(line.id(), true, confirmedBy);
                    applied.add(new LineOutcome(confirmed.id(), confirmed.lineNumber(), confirmed.inventoryItemId(),
                        null));
                } catch (ReconciliationException ex) {
                    LOGGER.warn("Line {} of invoice {} could not be confirmed: {}", line.id(), invoiceId,
                        ex.getMessage());
                    errors.add(outcome(line, ex.getMessage()));
                }
            }
            LOGGER.info("Confirmed invoice {}: {} applied, {} skipped, {} failed", invoiceId, applied.size(),
                skipped.size(), errors.size());
            return new BulkConfirmResult(applied, skipped, errors);
        }
    }

    private static LineOutcome outcome(InvoiceLineItem line, String message) {
        return new LineOutcome(line.id(), line.lineNumber(), line.inventoryItemId(), message);
    }

    private static String matchQuery(InvoiceLineItem line) {
        if (line.raw() != null && StringUtils.hasText(line.raw().description())) {
            return line.raw().description();
        }
        return line.description();
    }

    /**
     * Weight-priced lines add their weight to stock, everything else adds its quantity.
     */
    static BigDecimal stockDelta(InvoiceLineItem line) {
        if (line.pricingModel() == PricingModel.WEIGHT && line.weight() != null) {
            return line.weight();
        }
        return line.quantity();
    }

    private Optional<ParsingProfile> vendorProfile(String invoiceId) {
        return invoiceRepository.findById(invoiceId)
            .map(Invoice::vendorId)
            .filter(StringUtils::hasText)
            .flatMap(profileManager::load);
    }

    private InventoryItem requireItem(String inventoryItemId) {
        if (!StringUtils.hasText(inventoryItemId)) {
            throw new ValidationException("An inventory item id is required");
        }
        return inventory.findById(inventoryItemId)
            .orElseThrow(() -> NotFoundException.of("Inventory item", inventoryItemId));
    }

    private InvoiceLineItem saved(InvoiceLineItem line, String action) {
        InvoiceLineItem stored = lineRepository.save(line);
        LOGGER.info("Line {} of invoice {} {}, now {}", stored.id(), stored.invoiceId(), action,
            stored.matchStatus().wireValue());
        return stored;
    }
}
