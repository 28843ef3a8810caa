package dev.pekelund.reconcile.lines;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.reconcile.pricing.PricingModel;
import dev.pekelund.reconcile.profile.ColumnCorrection;
import dev.pekelund.reconcile.profile.ParsingProfile;
import dev.pekelund.reconcile.units.BaseUnit;
import dev.pekelund.reconcile.units.MeasurementUnit;
import dev.pekelund.reconcile.units.PackFormat;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class LineInterpreterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final LineInterpreter interpreter = new LineInterpreter();

    @Test
    void interpretsWeightPricedLine() {
        CandidateLine candidate = candidate("Beef striploin", "1", "$12.50", "35,50", null, "2.84 kg", null);

        InvoiceLineItem line = interpreter.interpret("inv-1", 1, candidate, null, NOW);

        assertThat(line.pricingModel()).isEqualTo(PricingModel.WEIGHT);
        assertThat(line.weight()).isEqualByComparingTo("2.84");
        assertThat(line.weightUnit()).isEqualTo(MeasurementUnit.KILOGRAM);
        assertThat(line.pricePerG()).isEqualByComparingTo("0.0125");
        assertThat(line.baseUnit()).isEqualTo(BaseUnit.GRAM);
        assertThat(line.discrepancy()).isFalse();
        assertThat(line.matchStatus()).isEqualTo(MatchStatus.UNMATCHED);
        assertThat(line.raw().total()).isEqualTo("35,50");
    }

    @Test
    void fallsBackToVendorWeightUnit() {
        ParsingProfile profile = ParsingProfile.newProfile("sysco", "Sysco", NOW).toBuilder()
            .weightUnit(MeasurementUnit.POUND)
            .build();

        InvoiceLineItem line = interpreter.interpret("inv-1", 1,
            candidate("Pork belly", "1", "4.00", "20.00", null, "5", null), profile, NOW);

        assertThat(line.weightUnit()).isEqualTo(MeasurementUnit.POUND);
        assertThat(line.pricingModel()).isEqualTo(PricingModel.WEIGHT);
        assertThat(line.totalBaseUnits()).isEqualByComparingTo("2267.96");
    }

    @Test
    void normalizesCasePriceThroughPackNotation() {
        InvoiceLineItem line = interpreter.interpret("inv-1", 2,
            candidate("Napkins", "2", "40.00", "80.00", "CS", null, "10/100"), null, NOW);

        assertThat(line.pricingModel()).isEqualTo(PricingModel.QUANTITY);
        assertThat(line.packFormat()).isEqualTo(PackFormat.Kind.NESTED_UNITS);
        assertThat(line.pricePerUnit()).isEqualByComparingTo("0.04");
    }

    @Test
    void flagsMismatchedTotalsAsDiscrepancy() {
        InvoiceLineItem line = interpreter.interpret("inv-1", 3,
            candidate("Salmon", "2", "10.00", "50.00", null, "3.1", null), null, NOW);

        assertThat(line.pricingModel()).isEqualTo(PricingModel.UNDETERMINED);
        assertThat(line.discrepancy()).isTrue();
        assertThat(line.discrepancyNotes()).contains("does not match");
        assertThat(line.normalizedPrice()).isNull();
    }

    @Test
    void leavesAmbiguousPackagesForReview() {
        InvoiceLineItem line = interpreter.interpret("inv-1", 4,
            candidate("Tomates", "1", "24.00", "24.00", null, null, "Caisse 24"), null, NOW);

        assertThat(line.needsReview()).isTrue();
        assertThat(line.reviewReason()).contains("Caisse 24");
        assertThat(line.normalizedPrice()).isNull();
    }

    @Test
    void oversizedPackNotationDoesNotFailTheLine() {
        InvoiceLineItem line = interpreter.interpret("inv-1", 6,
            candidate("Napkins", "1", "18.00", "18.00", null, null, "10/10000000000"), null, NOW);

        assertThat(line.packFormat()).isEqualTo(PackFormat.Kind.NEEDS_REVIEW);
        assertThat(line.needsReview()).isTrue();
        assertThat(line.normalizedPrice()).isNull();
    }

    @Test
    void classifiesDepositsAndLowersConfidenceForCorrectedVendors() {
        ParsingProfile corrected = ParsingProfile.newProfile("sysco", "Sysco", NOW)
            .withColumnCorrection(new ColumnCorrection("Column 3", 2, "quantity", "weight", null, NOW));

        InvoiceLineItem line = interpreter.interpret("inv-1", 5,
            candidate("Consigne", "24", "0.10", "2.40", null, null, null), corrected, NOW);

        assertThat(line.lineType()).isEqualTo(LineType.DEPOSIT);
        assertThat(line.deposit()).isTrue();
        assertThat(line.forInventory()).isFalse();
        assertThat(line.pricingConfidence()).isEqualByComparingTo("0.90");
    }

    @Test
    void reevaluatesAfterManualEdit() {
        InvoiceLineItem broken = interpreter.interpret("inv-1", 3,
            candidate("Salmon", "2", "10.00", "50.00", null, "3.1", null), null, NOW);

        InvoiceLineItem edited = broken.edit(new LineEdit(null, null, new BigDecimal("5"), MeasurementUnit.KILOGRAM,
            null, null, null), NOW);
        InvoiceLineItem reevaluated = interpreter.reevaluate(edited, null);

        assertThat(reevaluated.pricingModel()).isEqualTo(PricingModel.WEIGHT);
        assertThat(reevaluated.discrepancy()).isFalse();
        assertThat(reevaluated.pricePerG()).isEqualByComparingTo("0.01");
    }

    @Test
    void keepsManuallyFlaggedDiscrepancyOnReevaluation() {
        InvoiceLineItem line = interpreter.interpret("inv-1", 2,
            candidate("Chicken thighs", "3", "4.00", "12.00", null, null, null), null, NOW)
            .flagDiscrepancy("Short delivered by one case", NOW);

        InvoiceLineItem edited = line.edit(new LineEdit(null, new BigDecimal("2"), null, null, null,
            new BigDecimal("8.00"), null), NOW);
        InvoiceLineItem reevaluated = interpreter.reevaluate(edited, null);

        assertThat(reevaluated.pricingModel()).isEqualTo(PricingModel.QUANTITY);
        assertThat(reevaluated.discrepancy()).isTrue();
        assertThat(reevaluated.discrepancyNotes()).isEqualTo("Short delivered by one case");
    }

    @Test
    void manualFlagIsNotReplacedByDetectionNote() {
        InvoiceLineItem line = interpreter.interpret("inv-1", 2,
            candidate("Chicken thighs", "3", "4.00", "12.00", null, null, null), null, NOW)
            .flagDiscrepancy("Wrong vendor price list", NOW);

        InvoiceLineItem edited = line.edit(new LineEdit(null, null, null, null, null, new BigDecimal("20.00"), null),
            NOW);
        InvoiceLineItem reevaluated = interpreter.reevaluate(edited, null);

        assertThat(reevaluated.pricingModel()).isEqualTo(PricingModel.UNDETERMINED);
        assertThat(reevaluated.discrepancyNotes()).isEqualTo("Wrong vendor price list");
    }

    private static CandidateLine candidate(String description, String quantity, String unitPrice, String total,
        String unit, String weight, String format) {
        return new CandidateLine(description, quantity, unitPrice, total, unit, null, weight, format, List.of());
    }
}
