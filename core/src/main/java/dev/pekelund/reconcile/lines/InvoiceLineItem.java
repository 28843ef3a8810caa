package dev.pekelund.reconcile.lines;

import dev.pekelund.reconcile.errors.InvariantViolationException;
import dev.pekelund.reconcile.errors.ValidationException;
import dev.pekelund.reconcile.pricing.NormalizedPrice;
import dev.pekelund.reconcile.pricing.PricingModel;
import dev.pekelund.reconcile.units.BaseUnit;
import dev.pekelund.reconcile.units.MeasurementUnit;
import dev.pekelund.reconcile.units.PackFormat;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * A single invoice line with its raw extractor values, the values parsed from them, the detected
 * pricing model and the state of its match against inventory.
 */
public record InvoiceLineItem(
    String id,
    String invoiceId,
    int lineNumber,
    RawLine raw,
    String description,
    String sku,
    BigDecimal quantity,
    String unit,
    BigDecimal weight,
    MeasurementUnit weightUnit,
    BigDecimal unitPrice,
    BigDecimal totalPrice,
    PackFormat.Kind packFormat,
    PricingModel pricingModel,
    BigDecimal pricingConfidence,
    String pricingNote,
    NormalizedPrice normalizedPrice,
    boolean needsReview,
    String reviewReason,
    MatchStatus matchStatus,
    Integer matchConfidence,
    String matchedBy,
    Instant matchedAt,
    String matchNotes,
    List<MatchCandidate> matchCandidates,
    String inventoryItemId,
    BigDecimal previousPrice,
    BigDecimal newPrice,
    boolean addedToInventory,
    Instant addedToInventoryAt,
    String addedToInventoryBy,
    boolean discrepancy,
    String discrepancyNotes,
    LineType lineType,
    boolean forInventory,
    boolean forAccounting,
    boolean deposit,
    Instant createdAt,
    Instant updatedAt
) {

    public InvoiceLineItem {
        Objects.requireNonNull(invoiceId, "invoiceId");
        matchStatus = matchStatus != null ? matchStatus : MatchStatus.UNMATCHED;
        pricingModel = pricingModel != null ? pricingModel : PricingModel.UNDETERMINED;
        lineType = lineType != null ? lineType : LineType.PRODUCT;
        matchCandidates = matchCandidates != null ? List.copyOf(matchCandidates) : List.of();
        if (matchStatus == MatchStatus.CONFIRMED && !StringUtils.hasText(inventoryItemId)) {
            throw new InvariantViolationException("Line " + id + " is confirmed without an inventory item");
        }
    }

    public BaseUnit baseUnit() {
        return normalizedPrice != null ? normalizedPrice.baseUnit() : null;
    }

    public BigDecimal totalBaseUnits() {
        return normalizedPrice != null ? normalizedPrice.totalBaseUnits() : null;
    }

    public BigDecimal pricePerG() {
        return normalizedPrice != null ? normalizedPrice.pricePerG() : null;
    }

    public BigDecimal pricePerMl() {
        return normalizedPrice != null ? normalizedPrice.pricePerMl() : null;
    }

    public BigDecimal pricePerUnit() {
        return normalizedPrice != null ? normalizedPrice.pricePerUnit() : null;
    }

    public InvoiceLineItem withId(String newId) {
        return toBuilder().id(newId).build();
    }

    /**
     * Links the line to an inventory item. Re-matching an already matched or rejected line replaces the link.
     */
    public InvoiceLineItem match(MatchStatus target, String itemId, Integer confidence, String by, String notes,
        Instant now) {

        if (target == null || !target.isMatched()) {
            throw new ValidationException("Not a match status: " + (target != null ? target.wireValue() : null));
        }
        if (!StringUtils.hasText(itemId)) {
            throw new ValidationException("An inventory item is required to match line " + id);
        }
        matchStatus.requireTransitionTo(target);
        return toBuilder()
            .matchStatus(target)
            .inventoryItemId(itemId)
            .matchConfidence(confidence)
            .matchedBy(by)
            .matchedAt(now)
            .matchNotes(notes)
            .updatedAt(now)
            .build();
    }

    /**
     * Stores the ranked inventory candidates from an automatic match attempt. When none was linked the
     * best score is kept as the line's match confidence.
     */
    public InvoiceLineItem withCandidates(List<MatchCandidate> candidates, Instant now) {
        Builder builder = toBuilder().matchCandidates(candidates).updatedAt(now);
        if (!matchStatus.isMatched() && candidates != null && !candidates.isEmpty()) {
            builder.matchConfidence(candidates.get(0).score());
        }
        return builder.build();
    }

    /**
     * Clears an automatic or manual match so the line can be matched from scratch.
     */
    public InvoiceLineItem unmatch(Instant now) {
        if (addedToInventory) {
            throw new ValidationException("Line " + id + " was added to inventory and cannot be unmatched");
        }
        matchStatus.requireTransitionTo(MatchStatus.UNMATCHED);
        return toBuilder()
            .matchStatus(MatchStatus.UNMATCHED)
            .inventoryItemId(null)
            .matchConfidence(null)
            .matchedBy(null)
            .matchedAt(null)
            .matchNotes(null)
            .updatedAt(now)
            .build();
    }

    public InvoiceLineItem skip(String reason, Instant now) {
        matchStatus.requireTransitionTo(MatchStatus.SKIPPED);
        return toBuilder()
            .matchStatus(MatchStatus.SKIPPED)
            .matchNotes(reason)
            .matchedAt(now)
            .updatedAt(now)
            .build();
    }

    public InvoiceLineItem reopen(Instant now) {
        if (matchStatus != MatchStatus.SKIPPED) {
            throw new ValidationException("Only skipped lines can be reopened, line " + id + " is "
                + matchStatus.wireValue());
        }
        return toBuilder()
            .matchStatus(MatchStatus.UNMATCHED)
            .matchedAt(null)
            .matchedBy(null)
            .updatedAt(now)
            .build();
    }

    /**
     * Rejects the current match and detaches the inventory item. The inventory bookkeeping is reset as
     * well; reversing what the line already added to the item is up to the caller.
     */
    public InvoiceLineItem reject(String reason, Instant now) {
        matchStatus.requireTransitionTo(MatchStatus.REJECTED);
        return toBuilder()
            .matchStatus(MatchStatus.REJECTED)
            .inventoryItemId(null)
            .matchConfidence(null)
            .previousPrice(null)
            .newPrice(null)
            .addedToInventory(false)
            .addedToInventoryAt(null)
            .addedToInventoryBy(null)
            .matchNotes(reason)
            .matchedAt(now)
            .updatedAt(now)
            .build();
    }

    public InvoiceLineItem confirm(String confirmedBy, Instant now) {
        matchStatus.requireTransitionTo(MatchStatus.CONFIRMED);
        if (!StringUtils.hasText(inventoryItemId)) {
            throw new InvariantViolationException("Cannot confirm line " + id + ": no inventory item linked");
        }
        return toBuilder()
            .matchStatus(MatchStatus.CONFIRMED)
            .matchedBy(StringUtils.hasText(confirmedBy) ? confirmedBy : matchedBy)
            .matchedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Records that the line's price was written to its inventory item.
     */
    public InvoiceLineItem addedToInventory(BigDecimal priorPrice, String by, Instant now) {
        if (addedToInventory) {
            throw new InvariantViolationException("Line " + id + " was already added to inventory");
        }
        return toBuilder()
            .previousPrice(priorPrice)
            .newPrice(unitPrice)
            .addedToInventory(true)
            .addedToInventoryAt(now)
            .addedToInventoryBy(by)
            .updatedAt(now)
            .build();
    }

    public InvoiceLineItem flagDiscrepancy(String notes, Instant now) {
        return toBuilder().discrepancy(true).discrepancyNotes(notes).updatedAt(now).build();
    }

    /**
     * Applies manual corrections to the parsed values. Once the line has been written to inventory only
     * the match notes may change.
     */
    public InvoiceLineItem edit(LineEdit edit, Instant now) {
        Objects.requireNonNull(edit, "edit");
        if (addedToInventory && edit.changesValues()) {
            throw new ValidationException("Line " + id + " was added to inventory; only notes can be edited");
        }
        Builder builder = toBuilder().updatedAt(now);
        if (edit.description() != null) {
            builder.description(edit.description());
        }
        if (edit.quantity() != null) {
            builder.quantity(edit.quantity());
        }
        if (edit.weight() != null) {
            builder.weight(edit.weight());
        }
        if (edit.weightUnit() != null) {
            builder.weightUnit(edit.weightUnit());
        }
        if (edit.unitPrice() != null) {
            builder.unitPrice(edit.unitPrice());
        }
        if (edit.totalPrice() != null) {
            builder.totalPrice(edit.totalPrice());
        }
        if (edit.notes() != null) {
            builder.matchNotes(edit.notes());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.id = id;
        builder.invoiceId = invoiceId;
        builder.lineNumber = lineNumber;
        builder.raw = raw;
        builder.description = description;
        builder.sku = sku;
        builder.quantity = quantity;
        builder.unit = unit;
        builder.weight = weight;
        builder.weightUnit = weightUnit;
        builder.unitPrice = unitPrice;
        builder.totalPrice = totalPrice;
        builder.packFormat = packFormat;
        builder.pricingModel = pricingModel;
        builder.pricingConfidence = pricingConfidence;
        builder.pricingNote = pricingNote;
        builder.normalizedPrice = normalizedPrice;
        builder.needsReview = needsReview;
        builder.reviewReason = reviewReason;
        builder.matchStatus = matchStatus;
        builder.matchConfidence = matchConfidence;
        builder.matchedBy = matchedBy;
        builder.matchedAt = matchedAt;
        builder.matchNotes = matchNotes;
        builder.matchCandidates = matchCandidates;
        builder.inventoryItemId = inventoryItemId;
        builder.previousPrice = previousPrice;
        builder.newPrice = newPrice;
        builder.addedToInventory = addedToInventory;
        builder.addedToInventoryAt = addedToInventoryAt;
        builder.addedToInventoryBy = addedToInventoryBy;
        builder.discrepancy = discrepancy;
        builder.discrepancyNotes = discrepancyNotes;
        builder.lineType = lineType;
        builder.forInventory = forInventory;
        builder.forAccounting = forAccounting;
        builder.deposit = deposit;
        builder.createdAt = createdAt;
        builder.updatedAt = updatedAt;
        return builder;
    }

    public static class Builder {

        private String id;
        private String invoiceId;
        private int lineNumber;
        private RawLine raw;
        private String description;
        private String sku;
        private BigDecimal quantity;
        private String unit;
        private BigDecimal weight;
        private MeasurementUnit weightUnit;
        private BigDecimal unitPrice;
        private BigDecimal totalPrice;
        private PackFormat.Kind packFormat;
        private PricingModel pricingModel;
        private BigDecimal pricingConfidence;
        private String pricingNote;
        private NormalizedPrice normalizedPrice;
        private boolean needsReview;
        private String reviewReason;
        private MatchStatus matchStatus;
        private Integer matchConfidence;
        private String matchedBy;
        private Instant matchedAt;
        private String matchNotes;
        private List<MatchCandidate> matchCandidates;
        private String inventoryItemId;
        private BigDecimal previousPrice;
        private BigDecimal newPrice;
        private boolean addedToInventory;
        private Instant addedToInventoryAt;
        private String addedToInventoryBy;
        private boolean discrepancy;
        private String discrepancyNotes;
        private LineType lineType = LineType.PRODUCT;
        private boolean forInventory = true;
        private boolean forAccounting = true;
        private boolean deposit;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder invoiceId(String invoiceId) {
            this.invoiceId = invoiceId;
            return this;
        }

        public Builder lineNumber(int lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder raw(RawLine raw) {
            this.raw = raw;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder sku(String sku) {
            this.sku = sku;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder weight(BigDecimal weight) {
            this.weight = weight;
            return this;
        }

        public Builder weightUnit(MeasurementUnit weightUnit) {
            this.weightUnit = weightUnit;
            return this;
        }

        public Builder unitPrice(BigDecimal unitPrice) {
            this.unitPrice = unitPrice;
            return this;
        }

        public Builder totalPrice(BigDecimal totalPrice) {
            this.totalPrice = totalPrice;
            return this;
        }

        public Builder packFormat(PackFormat.Kind packFormat) {
            this.packFormat = packFormat;
            return this;
        }

        public Builder pricingModel(PricingModel pricingModel) {
            this.pricingModel = pricingModel;
            return this;
        }

        public Builder pricingConfidence(BigDecimal pricingConfidence) {
            this.pricingConfidence = pricingConfidence;
            return this;
        }

        public Builder pricingNote(String pricingNote) {
            this.pricingNote = pricingNote;
            return this;
        }

        public Builder normalizedPrice(NormalizedPrice normalizedPrice) {
            this.normalizedPrice = normalizedPrice;
            return this;
        }

        public Builder needsReview(boolean needsReview) {
            this.needsReview = needsReview;
            return this;
        }

        public Builder reviewReason(String reviewReason) {
            this.reviewReason = reviewReason;
            return this;
        }

        public Builder matchStatus(MatchStatus matchStatus) {
            this.matchStatus = matchStatus;
            return this;
        }

        public Builder matchConfidence(Integer matchConfidence) {
            this.matchConfidence = matchConfidence;
            return this;
        }

        public Builder matchedBy(String matchedBy) {
            this.matchedBy = matchedBy;
            return this;
        }

        public Builder matchedAt(Instant matchedAt) {
            this.matchedAt = matchedAt;
            return this;
        }

        public Builder matchNotes(String matchNotes) {
            this.matchNotes = matchNotes;
            return this;
        }

        public Builder matchCandidates(List<MatchCandidate> matchCandidates) {
            this.matchCandidates = matchCandidates;
            return this;
        }

        public Builder inventoryItemId(String inventoryItemId) {
            this.inventoryItemId = inventoryItemId;
            return this;
        }

        public Builder previousPrice(BigDecimal previousPrice) {
            this.previousPrice = previousPrice;
            return this;
        }

        public Builder newPrice(BigDecimal newPrice) {
            this.newPrice = newPrice;
            return this;
        }

        public Builder addedToInventory(boolean addedToInventory) {
            this.addedToInventory = addedToInventory;
            return this;
        }

        public Builder addedToInventoryAt(Instant addedToInventoryAt) {
            this.addedToInventoryAt = addedToInventoryAt;
            return this;
        }

        public Builder addedToInventoryBy(String addedToInventoryBy) {
            this.addedToInventoryBy = addedToInventoryBy;
            return this;
        }

        public Builder discrepancy(boolean discrepancy) {
            this.discrepancy = discrepancy;
            return this;
        }

        public Builder discrepancyNotes(String discrepancyNotes) {
            this.discrepancyNotes = discrepancyNotes;
            return this;
        }

        /**
         * Sets the line type together with the routing flags it implies.
         */
        public Builder lineType(LineType lineType) {
            this.lineType = lineType;
            if (lineType != null) {
                this.forInventory = lineType.forInventory();
                this.forAccounting = lineType.forAccounting();
                this.deposit = lineType.isDeposit();
            }
            return this;
        }

        public Builder forInventory(boolean forInventory) {
            this.forInventory = forInventory;
            return this;
        }

        public Builder forAccounting(boolean forAccounting) {
            this.forAccounting = forAccounting;
            return this;
        }

        public Builder deposit(boolean deposit) {
            this.deposit = deposit;
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

        public InvoiceLineItem build() {
            return new InvoiceLineItem(id, invoiceId, lineNumber, raw, description, sku, quantity, unit, weight,
                weightUnit, unitPrice, totalPrice, packFormat, pricingModel, pricingConfidence, pricingNote,
                normalizedPrice, needsReview, reviewReason, matchStatus, matchConfidence, matchedBy, matchedAt,
                matchNotes, matchCandidates, inventoryItemId, previousPrice, newPrice, addedToInventory,
                addedToInventoryAt, addedToInventoryBy, discrepancy, discrepancyNotes, lineType, forInventory, forAccounting, deposit,
                createdAt, updatedAt);
        }
    }
}
