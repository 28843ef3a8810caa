package dev.pekelund.reconcile.profile;

import dev.pekelund.reconcile.units.MeasurementUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a vendor profile as text the extractor can follow on the vendor's next invoice. Hints are
 * emitted in a fixed order: table structure, weight column, billing quantity, package format, quirks,
 * container notation and previously corrected columns.
 */
public class PromptHintGenerator {

    private static final Map<MeasurementUnit, String> WEIGHT_UNIT_LABELS = Map.of(
        MeasurementUnit.POUND, "Pounds (lb)",
        MeasurementUnit.KILOGRAM, "Kilograms (kg)",
        MeasurementUnit.GRAM, "Grams (g)",
        MeasurementUnit.OUNCE, "Ounces (oz)");

    private static final String CONTAINER_HINTS = """
        CONTAINER/PACKAGING FORMAT PARSING: \
        "X/Y" means X inner packs of Y units per pack (10/100 = 1,000 units per case, 1/500 = 500 units per case); \
        the quantity column counts cases. "X/RL" means X rolls per case; roll length may be in the description.""";

    /**
     * @return the hint text, or {@code null} when the profile carries nothing worth telling the extractor
     */
    public String generate(ParsingProfile profile) {
        if (profile == null) {
            return null;
        }
        List<String> hints = new ArrayList<>();

        tableStructure(profile).ifPresent(hints::add);

        profile.column(SemanticField.WEIGHT).ifPresent(weight -> {
            if (profile.weightUnit() != null) {
                String label = WEIGHT_UNIT_LABELS.getOrDefault(profile.weightUnit(), profile.weightUnit().symbol());
                hints.add(String.format("WEIGHT: Column %d contains weight in %s. Set weightUnit=\"%s\".",
                    weight.index() + 1, label, profile.weightUnit().symbol()));
            }
        });

        profile.column(SemanticField.BILLING_QUANTITY).ifPresent(billing -> hints.add(String.format(
            "BILLING QTY: Column %d is the billing quantity; use it for pricing calculations, not the ordered quantity.",
            billing.index() + 1)));

        packageFormat(profile).ifPresent(hints::add);

        VendorQuirks quirks = profile.quirks();
        if (quirks.hasDeposits()) {
            hints.add("Watch for deposit/consigne lines; mark them as deposits, not products.");
        }
        if (quirks.weightInDescription()) {
            hints.add("Weight may be embedded in the description (e.g. \"Beef 5.2kg\"); extract it separately.");
        }
        if (quirks.weightInPackageFormat()) {
            hints.add("IMPORTANT: Weight is embedded in the package/format column. "
                + "Extract the weight value and unit from this column for each line.");
        }
        if (quirks.skuInDescription()) {
            hints.add("SKU/item code may be embedded in the description; extract it separately.");
        }
        if (quirks.multiplePages()) {
            hints.add("Invoices span multiple pages; continue the line table across page breaks.");
        }
        if (quirks.containerDistributor() || profile.column(SemanticField.CONTAINER_FORMAT).isPresent()) {
            hints.add(CONTAINER_HINTS);
        }

        correctedColumns(profile).ifPresent(hints::add);

        return hints.isEmpty() ? null : String.join(" ", hints);
    }

    private Optional<String> tableStructure(ParsingProfile profile) {
        String columns = profile.columns().entrySet().stream()
            .filter(entry -> entry.getKey().isMapped())
            .sorted(Comparator.comparingInt(entry -> entry.getValue().index()))
            .map(entry -> "Column " + (entry.getValue().index() + 1) + "=" + entry.getKey().label())
            .collect(Collectors.joining(", "));
        if (columns.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("TABLE STRUCTURE (by column position): " + columns + ".");
    }

    private Optional<String> packageFormat(ParsingProfile profile) {
        PackageFormatSetting setting = profile.packageFormat();
        if (!setting.enabled()) {
            return Optional.empty();
        }
        SemanticField field = switch (setting.kind()) {
            case DISTRIBUTOR -> SemanticField.PACK_FORMAT;
            case WEIGHT -> SemanticField.PACKAGE_FORMAT;
            case UNITS -> SemanticField.PACKAGE_UNITS;
            case CONTAINER -> SemanticField.CONTAINER_FORMAT;
        };
        Optional<ColumnMapping> column = profile.column(field);
        if (column.isEmpty()) {
            return Optional.empty();
        }
        int position = column.get().index() + 1;
        String hint = switch (setting.kind()) {
            case DISTRIBUTOR -> String.format("PACK FORMAT: Column %d contains distributor pack format like \"4/5LB\" "
                + "(4 bags x 5lb each) or \"12CT\" (12 count). Parse as packCount/unitValue+unit.", position);
            case WEIGHT -> String.format("PACKAGE FORMAT: Column %d contains package weight like "
                + "\"Caisse 25lbs\" or \"Sac 50kg\". Extract weight value and unit.", position);
            case UNITS -> String.format("PACKAGE UNITS: Column %d contains units per case like \"Caisse 24\" "
                + "(24 units). Treat numbers as count, not weight.", position);
            case CONTAINER -> String.format("CONTAINER FORMAT: Column %d contains nested container notation "
                + "like \"10/100\" or \"6/RL\".", position);
        };
        return Optional.of(hint);
    }

    private Optional<String> correctedColumns(ParsingProfile profile) {
        Set<String> corrected = new LinkedHashSet<>();
        for (ColumnCorrection correction : profile.columnCorrections()) {
            if (correction.aiDetected() != null && correction.userCorrected() != null) {
                corrected.add(String.format("\"%s\" is %s, not %s", correction.field(), correction.userCorrected(),
                    correction.aiDetected()));
            }
        }
        if (corrected.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("PREVIOUS CORRECTIONS: " + String.join("; ", corrected) + ".");
    }
}
