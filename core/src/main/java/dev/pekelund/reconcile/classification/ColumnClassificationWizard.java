package dev.pekelund.reconcile.classification;

import dev.pekelund.reconcile.errors.ValidationException;
import dev.pekelund.reconcile.pricing.PricingModel;
import dev.pekelund.reconcile.profile.ColumnCorrection;
import dev.pekelund.reconcile.profile.ColumnMapping;
import dev.pekelund.reconcile.profile.ItemCorrection;
import dev.pekelund.reconcile.profile.PackageFormatKind;
import dev.pekelund.reconcile.profile.PackageFormatSetting;
import dev.pekelund.reconcile.profile.ParsingProfile;
import dev.pekelund.reconcile.profile.ProfileStats;
import dev.pekelund.reconcile.profile.QuirkFlag;
import dev.pekelund.reconcile.profile.SampleLine;
import dev.pekelund.reconcile.profile.SemanticField;
import dev.pekelund.reconcile.profile.VendorQuirks;
import dev.pekelund.reconcile.units.MeasurementUnit;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Drives a human through confirming how a vendor's invoice columns should be read. The wizard moves
 * through {@link ClassificationStep}s in order, refusing to advance while the current step has
 * validation errors, and on {@link #complete(Instant)} produces the vendor's parsing profile.
 *
 * <p>Instances are not thread-safe; a session is owned by one caller at a time.
 */
public class ColumnClassificationWizard {

    static final int MAX_SAMPLE_LINES = 3;
    private static final MeasurementUnit DEFAULT_WEIGHT_UNIT = MeasurementUnit.POUND;

    private final String vendorId;
    private final ParsingProfile existingProfile;
    private final List<ClassifiedColumn> columns;
    private final List<VerificationLine> lines;
    private String vendorName;
    private VendorQuirks quirks;
    private MeasurementUnit weightUnit;
    private ClassificationStep step = ClassificationStep.VENDOR_IDENTITY;

    public ColumnClassificationWizard(String vendorId, String vendorName, List<ClassifiedColumn> columns,
        List<SampleLine> sampleLines, ParsingProfile existingProfile) {

        if (!StringUtils.hasText(vendorId)) {
            throw new ValidationException("Vendor id is required");
        }
        this.vendorId = vendorId;
        this.vendorName = vendorName;
        this.existingProfile = existingProfile;
        this.columns = new ArrayList<>(columns != null ? columns : List.of());
        this.lines = new ArrayList<>();
        if (sampleLines != null) {
            for (SampleLine sample : sampleLines) {
                lines.add(new VerificationLine(sample, null, false));
            }
        }
        this.quirks = existingProfile != null ? existingProfile.quirks() : VendorQuirks.none();
        this.weightUnit = existingProfile != null ? existingProfile.weightUnit() : null;
    }

    public String vendorId() {
        return vendorId;
    }

    public String vendorName() {
        return vendorName;
    }

    public VendorQuirks quirks() {
        return quirks;
    }

    public MeasurementUnit weightUnit() {
        return weightUnit;
    }

    public ClassificationStep currentStep() {
        return step;
    }

    public List<ClassifiedColumn> columns() {
        return Collections.unmodifiableList(columns);
    }

    public List<VerificationLine> lines() {
        return Collections.unmodifiableList(lines);
    }

    public void setVendorName(String vendorName) {
        this.vendorName = vendorName != null ? vendorName.trim() : null;
    }

    public void setQuirks(VendorQuirks quirks) {
        this.quirks = quirks != null ? quirks : VendorQuirks.none();
    }

    public void setQuirk(QuirkFlag flag, boolean enabled) {
        this.quirks = quirks.toggle(Objects.requireNonNull(flag, "flag"), enabled);
    }

    public void setWeightUnit(MeasurementUnit weightUnit) {
        this.weightUnit = weightUnit;
    }

    public boolean hasColumn(SemanticField field) {
        return columns.stream().anyMatch(column -> column.assigned() == field);
    }

    public List<String> validationErrors() {
        return step.validate(this);
    }

    /**
     * Advances to the next step.
     *
     * @throws ValidationException when the current step has validation errors
     */
    public ClassificationStep next() {
        List<String> errors = step.validate(this);
        if (!errors.isEmpty()) {
            throw new ValidationException(String.join("; ", errors));
        }
        step = step.next();
        return step;
    }

    public ClassificationStep back() {
        step = step.previous();
        return step;
    }

    public void assign(int position, SemanticField type) {
        requireStep(ClassificationStep.COLUMN_ASSIGNMENT, "assign column types");
        checkPosition(position, columns.size(), "column");
        columns.set(position, columns.get(position).assign(Objects.requireNonNull(type, "type")));
    }

    /**
     * Swaps the column with its left neighbour and marks both as reordered. Moving the first column up
     * has no effect.
     */
    public void moveUp(int position) {
        requireStep(ClassificationStep.COLUMN_ASSIGNMENT, "reorder columns");
        checkPosition(position, columns.size(), "column");
        if (position > 0) {
            swap(position - 1, position);
        }
    }

    public void moveDown(int position) {
        requireStep(ClassificationStep.COLUMN_ASSIGNMENT, "reorder columns");
        checkPosition(position, columns.size(), "column");
        if (position < columns.size() - 1) {
            swap(position, position + 1);
        }
    }

    public void correctLine(int lineIndex, LineCorrection correction) {
        requireStep(ClassificationStep.SAMPLE_VERIFICATION, "correct sample lines");
        checkPosition(lineIndex, lines.size(), "sample line");
        lines.set(lineIndex, lines.get(lineIndex).correct(Objects.requireNonNull(correction, "correction")));
    }

    public void markLineCorrect(int lineIndex) {
        requireStep(ClassificationStep.SAMPLE_VERIFICATION, "verify sample lines");
        checkPosition(lineIndex, lines.size(), "sample line");
        lines.set(lineIndex, lines.get(lineIndex).markCorrect());
    }

    /**
     * Share of verified sample lines that needed no correction, or one when nothing was verified yet.
     */
    public BigDecimal correctnessRatio() {
        long verified = lines.stream().filter(VerificationLine::verified).count();
        if (verified == 0) {
            return BigDecimal.ONE;
        }
        long correct = lines.stream().filter(line -> line.verified() && !line.isCorrected()).count();
        return BigDecimal.valueOf(correct).divide(BigDecimal.valueOf(verified), 4, RoundingMode.HALF_UP);
    }

    /**
     * Builds the vendor profile from the wizard state. Earlier corrections and item corrections of an
     * existing profile are kept and the new ones appended; a column change already in the log is not
     * recorded again.
     */
    public ClassificationResult complete(Instant now) {
        Objects.requireNonNull(now, "now");
        if (step != ClassificationStep.SAMPLE_VERIFICATION) {
            throw new ValidationException("Classification can only be completed from the sample verification step");
        }
        List<String> errors = new ArrayList<>();
        for (ClassificationStep gate : ClassificationStep.values()) {
            errors.addAll(gate.validate(this));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(String.join("; ", errors));
        }

        ParsingProfile base = existingProfile != null
            ? existingProfile.migrate()
            : ParsingProfile.newProfile(vendorId, vendorName, now);

        Map<SemanticField, ColumnMapping> columnMap = new EnumMap<>(SemanticField.class);
        List<ColumnCorrection> newCorrections = new ArrayList<>();
        for (int index = 0; index < columns.size(); index++) {
            ClassifiedColumn column = columns.get(index);
            if (column.assigned().isMapped()) {
                columnMap.putIfAbsent(column.assigned(),
                    new ColumnMapping(index, column.aiLabel(), column.wasChanged(), column.sampleValue()));
            }
            if (column.wasChanged()) {
                ColumnCorrection correction = new ColumnCorrection("Column " + (index + 1), index,
                    column.aiLabel().wireValue(), column.assigned().wireValue(), column.sampleValue(), now);
                if (base.columnCorrections().stream().noneMatch(correction::sameChangeAs)) {
                    newCorrections.add(correction);
                }
            }
        }

        MeasurementUnit resolvedWeightUnit = null;
        if (columnMap.containsKey(SemanticField.WEIGHT)) {
            resolvedWeightUnit = weightUnit != null ? weightUnit : DEFAULT_WEIGHT_UNIT;
        }

        VendorQuirks resolvedQuirks = quirks;
        if (columnMap.containsKey(SemanticField.CONTAINER_FORMAT)) {
            resolvedQuirks = resolvedQuirks.with(QuirkFlag.CONTAINER_DISTRIBUTOR);
        }

        Map<String, ItemCorrection> itemCorrections = new LinkedHashMap<>();
        int correctedLines = 0;
        for (VerificationLine line : lines) {
            if (!line.isCorrected()) {
                continue;
            }
            correctedLines++;
            ItemCorrection itemCorrection = toItemCorrection(line, resolvedWeightUnit, now);
            if (itemCorrection != null) {
                itemCorrections.put(itemCorrection.key(), itemCorrection);
            }
        }

        List<SampleLine> samples = lines.stream()
            .limit(MAX_SAMPLE_LINES)
            .map(VerificationLine::sample)
            .toList();

        List<ColumnCorrection> correctionLog = new ArrayList<>(base.columnCorrections());
        correctionLog.addAll(newCorrections);
        Map<String, ItemCorrection> mergedItems = new LinkedHashMap<>(base.itemCorrections());
        mergedItems.putAll(itemCorrections);
        ProfileStats stats = base.stats()
            .recordColumnCorrections(newCorrections.size())
            .recordLineCorrections(correctedLines);

        ParsingProfile profile = base.toBuilder()
            .vendorName(vendorName)
            .pricingModel(ParsingProfile.AUTO_PRICING)
            .columns(columnMap)
            .weightUnit(resolvedWeightUnit)
            .packageFormat(PackageFormatSetting.of(packageFormatKind(columnMap)))
            .quirks(resolvedQuirks)
            .columnCorrections(correctionLog)
            .itemCorrections(mergedItems)
            .sampleLines(samples)
            .stats(stats)
            .createdAt(base.createdAt() != null ? base.createdAt() : now)
            .updatedAt(now)
            .build();

        return new ClassificationResult(profile, List.copyOf(newCorrections), correctedLines, correctnessRatio());
    }

    private ItemCorrection toItemCorrection(VerificationLine line, MeasurementUnit profileWeightUnit, Instant now) {
        LineCorrection correction = line.correction();
        SampleLine sample = line.sample();
        String description = correction.description() != null ? correction.description()
            : sample != null ? sample.description() : null;
        String key = ItemCorrection.keyFor(sample != null ? sample.itemCode() : null, description);
        if (key == null) {
            return null;
        }
        if (correction.weight() != null) {
            MeasurementUnit unit = correction.weightUnit() != null ? correction.weightUnit()
                : profileWeightUnit != null ? profileWeightUnit : DEFAULT_WEIGHT_UNIT;
            return new ItemCorrection(key, PricingModel.WEIGHT, correction.weight(), unit.symbol(), now);
        }
        if (correction.quantity() != null) {
            return new ItemCorrection(key, PricingModel.QUANTITY, correction.quantity(),
                MeasurementUnit.EACH.symbol(), now);
        }
        return null;
    }

    private static PackageFormatKind packageFormatKind(Map<SemanticField, ColumnMapping> columnMap) {
        if (columnMap.containsKey(SemanticField.PACK_FORMAT)) {
            return PackageFormatKind.DISTRIBUTOR;
        }
        if (columnMap.containsKey(SemanticField.PACKAGE_UNITS)) {
            return PackageFormatKind.UNITS;
        }
        if (columnMap.containsKey(SemanticField.PACKAGE_FORMAT)) {
            return PackageFormatKind.WEIGHT;
        }
        if (columnMap.containsKey(SemanticField.CONTAINER_FORMAT)) {
            return PackageFormatKind.CONTAINER;
        }
        return null;
    }

    private void swap(int left, int right) {
        ClassifiedColumn leftColumn = columns.get(left);
        columns.set(left, columns.get(right).reordered());
        columns.set(right, leftColumn.reordered());
    }

    private void requireStep(ClassificationStep required, String action) {
        if (step != required) {
            throw new ValidationException(String.format("Cannot %s during step %s", action, step));
        }
    }

    private static void checkPosition(int position, int size, String what) {
        if (position < 0 || position >= size) {
            throw new ValidationException(String.format("No %s at position %d", what, position));
        }
    }
}
