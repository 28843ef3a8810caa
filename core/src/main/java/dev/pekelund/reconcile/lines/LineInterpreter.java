package dev.pekelund.reconcile.lines;

import dev.pekelund.reconcile.pricing.DetectionHints;
import dev.pekelund.reconcile.pricing.LineAmounts;
import dev.pekelund.reconcile.pricing.LinePriceNormalizer;
import dev.pekelund.reconcile.pricing.LineUnits;
import dev.pekelund.reconcile.pricing.NormalizedPrice;
import dev.pekelund.reconcile.pricing.PricingDetection;
import dev.pekelund.reconcile.pricing.PricingModelDetector;
import dev.pekelund.reconcile.profile.ItemCorrection;
import dev.pekelund.reconcile.profile.ParsingProfile;
import dev.pekelund.reconcile.units.MeasurementUnit;
import dev.pekelund.reconcile.units.PackFormat;
import dev.pekelund.reconcile.units.PackFormatParser;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Turns extractor output into invoice lines: parses raw numbers and units, reads the pack notation,
 * classifies the line type, detects the pricing model and normalizes the price. Holds no state and
 * can be used from several threads.
 */
public class LineInterpreter {

    private final PricingModelDetector detector;
    private final LinePriceNormalizer normalizer;
    private final PackFormatParser packFormatParser;

    public LineInterpreter() {
        this(new PricingModelDetector(), new LinePriceNormalizer(), new PackFormatParser());
    }

    public LineInterpreter(PricingModelDetector detector, LinePriceNormalizer normalizer,
        PackFormatParser packFormatParser) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.packFormatParser = Objects.requireNonNull(packFormatParser, "packFormatParser");
    }

    public InvoiceLineItem interpret(String invoiceId, int lineNumber, CandidateLine candidate,
        ParsingProfile profile, Instant now) {

        Objects.requireNonNull(candidate, "candidate");
        RawLine raw = candidate.toRawLine();

        BigDecimal quantity = RawValueParser.parseDecimal(raw.quantity());
        String unit = trimToNull(raw.unit());
        String[] quantityWithUnit = RawValueParser.splitUnit(raw.quantity());
        if (quantity == null && quantityWithUnit != null) {
            quantity = RawValueParser.parseDecimal(quantityWithUnit[0]);
            unit = unit != null ? unit : quantityWithUnit[1];
        }

        BigDecimal weight = RawValueParser.parseDecimal(raw.weight());
        MeasurementUnit weightUnit = null;
        String[] weightWithUnit = RawValueParser.splitUnit(raw.weight());
        if (weightWithUnit != null) {
            weight = RawValueParser.parseDecimal(weightWithUnit[0]);
            weightUnit = measurable(weightWithUnit[1]).orElse(null);
        }
        if (weight != null && weightUnit == null) {
            weightUnit = profile != null ? profile.weightUnit() : null;
        }

        String description = trimToNull(raw.description());
        String sku = trimToNull(raw.sku());
        BigDecimal totalPrice = RawValueParser.parseDecimal(raw.total());

        InvoiceLineItem.Builder builder = InvoiceLineItem.builder()
            .invoiceId(invoiceId)
            .lineNumber(lineNumber)
            .raw(raw)
            .description(description)
            .sku(sku)
            .quantity(quantity)
            .unit(unit)
            .weight(weight)
            .weightUnit(weightUnit)
            .unitPrice(RawValueParser.parseDecimal(raw.unitPrice()))
            .totalPrice(totalPrice)
            .lineType(LineType.detect(description, quantity, totalPrice))
            .matchStatus(MatchStatus.UNMATCHED)
            .createdAt(now)
            .updatedAt(now);
        return applyPricing(builder, raw, profile);
    }

    /**
     * Detects pricing again from the line's current parsed values, e.g. after a manual edit. A discrepancy
     * raised by an earlier detection is cleared first; one flagged by a person is kept.
     */
    public InvoiceLineItem reevaluate(InvoiceLineItem line, ParsingProfile profile) {
        InvoiceLineItem.Builder builder = line.toBuilder()
            .needsReview(false)
            .reviewReason(null);
        if (line.discrepancy() && raisedByDetection(line)) {
            builder.discrepancy(false).discrepancyNotes(null);
        }
        return applyPricing(builder, line.raw(), profile);
    }

    private static boolean raisedByDetection(InvoiceLineItem line) {
        return line.discrepancyNotes() == null || line.discrepancyNotes().equals(line.pricingNote());
    }

    private InvoiceLineItem applyPricing(InvoiceLineItem.Builder builder, RawLine raw, ParsingProfile profile) {
        InvoiceLineItem draft = builder.build();
        PackFormat pack = parsePack(raw, draft.unit()).orElse(null);

        DetectionHints hints = profile != null
            ? profile.detectionHints(ItemCorrection.keyFor(draft.sku(), draft.description()))
            : DetectionHints.NONE;
        LineAmounts amounts = new LineAmounts(draft.quantity(), draft.weight(), draft.unitPrice(),
            draft.totalPrice());
        PricingDetection detection = detector.detect(amounts, hints);

        LineUnits units = new LineUnits(draft.weightUnit(), measurable(draft.unit()).orElse(null), pack);
        NormalizedPrice normalized = normalizer.normalize(detection, amounts, units).orElse(null);

        builder.packFormat(pack != null ? pack.kind() : null)
            .pricingModel(detection.model())
            .pricingConfidence(detection.confidence())
            .pricingNote(detection.note())
            .normalizedPrice(normalized);
        if (detection.discrepancy() && !(draft.discrepancy() && draft.discrepancyNotes() != null)) {
            builder.discrepancy(true).discrepancyNotes(detection.note());
        }
        if (pack instanceof PackFormat.NeedsReview review) {
            builder.needsReview(true).reviewReason(review.reason());
        }
        return builder.build();
    }

    private Optional<PackFormat> parsePack(RawLine raw, String unit) {
        if (raw != null && StringUtils.hasText(raw.format())) {
            return packFormatParser.parse(raw.format());
        }
        if (unit != null && unit.chars().anyMatch(Character::isDigit)) {
            return packFormatParser.parse(unit);
        }
        return Optional.empty();
    }

    private static Optional<MeasurementUnit> measurable(String unit) {
        return MeasurementUnit.find(unit).filter(MeasurementUnit::isMeasurable);
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
