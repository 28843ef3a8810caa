package dev.pekelund.reconcile.profile;

import dev.pekelund.reconcile.pricing.DetectionHints;
import dev.pekelund.reconcile.units.MeasurementUnit;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Learned template describing how one vendor lays out its invoice lines. The confidence adjustment is
 * derived from the correction counters and never stored independently.
 */
public record ParsingProfile(
    String vendorId,
    String vendorName,
    int version,
    String pricingModel,
    Map<SemanticField, ColumnMapping> columns,
    MeasurementUnit weightUnit,
    PackageFormatSetting packageFormat,
    VendorQuirks quirks,
    List<ColumnCorrection> columnCorrections,
    Map<String, ItemCorrection> itemCorrections,
    List<SampleLine> sampleLines,
    ProfileStats stats,
    String promptHints,
    Instant createdAt,
    Instant updatedAt
) {

    public static final int CURRENT_VERSION = 2;

    /**
     * Vendor-level pricing is informational only; every line is classified on its own.
     */
    public static final String AUTO_PRICING = "auto";

    public ParsingProfile {
        Objects.requireNonNull(vendorId, "vendorId");
        pricingModel = pricingModel != null ? pricingModel : AUTO_PRICING;
        columns = columns == null || columns.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(columns));
        packageFormat = packageFormat != null ? packageFormat : PackageFormatSetting.DISABLED;
        quirks = quirks != null ? quirks : VendorQuirks.none();
        columnCorrections = columnCorrections != null ? List.copyOf(columnCorrections) : List.of();
        itemCorrections = itemCorrections != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(itemCorrections))
            : Map.of();
        sampleLines = sampleLines != null ? List.copyOf(sampleLines) : List.of();
        stats = stats != null ? stats : ProfileStats.initial();
    }

    public static ParsingProfile newProfile(String vendorId, String vendorName, Instant now) {
        return builder()
            .vendorId(vendorId)
            .vendorName(vendorName)
            .version(CURRENT_VERSION)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public BigDecimal confidenceAdjustment() {
        return ConfidencePolicy.adjustment(stats.totalCorrections(), stats.successesSinceCorrection());
    }

    public boolean hasCorrections() {
        return stats.totalCorrections() > 0;
    }

    public Optional<ColumnMapping> column(SemanticField field) {
        return Optional.ofNullable(columns.get(field));
    }

    public Optional<ItemCorrection> itemCorrection(String key) {
        return key != null ? Optional.ofNullable(itemCorrections.get(key)) : Optional.empty();
    }

    public DetectionHints detectionHints(String itemKey) {
        return new DetectionHints(confidenceAdjustment(),
            itemCorrection(itemKey).map(ItemCorrection::pricingModel).orElse(null));
    }

    public ParsingProfile withColumnCorrection(ColumnCorrection correction) {
        List<ColumnCorrection> log = new ArrayList<>(columnCorrections);
        log.add(correction);
        return toBuilder()
            .columnCorrections(log)
            .stats(stats.recordColumnCorrections(1))
            .updatedAt(correction.correctedAt())
            .build();
    }

    public ParsingProfile withItemCorrection(ItemCorrection correction) {
        Map<String, ItemCorrection> corrections = new LinkedHashMap<>(itemCorrections);
        corrections.put(correction.key(), correction);
        return toBuilder()
            .itemCorrections(corrections)
            .stats(stats.recordLineCorrections(1))
            .updatedAt(correction.correctedAt())
            .build();
    }

    public ParsingProfile withUsage(boolean success, int correctedLines, Instant usedAt) {
        return toBuilder().stats(stats.recordUsage(success, correctedLines, usedAt)).build();
    }

    public ParsingProfile withPromptHints(String hints) {
        return toBuilder().promptHints(hints).build();
    }

    public boolean isOutdated() {
        return version < CURRENT_VERSION;
    }

    /**
     * Upgrades a profile written by an earlier release. Version 1 profiles could store a fixed
     * vendor-level pricing model; it is reset to {@link #AUTO_PRICING}.
     */
    public ParsingProfile migrate() {
        if (!isOutdated()) {
            return this;
        }
        return toBuilder()
            .version(CURRENT_VERSION)
            .pricingModel(AUTO_PRICING)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .vendorId(vendorId)
            .vendorName(vendorName)
            .version(version)
            .pricingModel(pricingModel)
            .columns(columns)
            .weightUnit(weightUnit)
            .packageFormat(packageFormat)
            .quirks(quirks)
            .columnCorrections(columnCorrections)
            .itemCorrections(itemCorrections)
            .sampleLines(sampleLines)
            .stats(stats)
            .promptHints(promptHints)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public static class Builder {
        private String vendorId;
        private String vendorName;
        private int version = CURRENT_VERSION;
        private String pricingModel = AUTO_PRICING;
        private Map<SemanticField, ColumnMapping> columns;
        private MeasurementUnit weightUnit;
        private PackageFormatSetting packageFormat;
        private VendorQuirks quirks;
        private List<ColumnCorrection> columnCorrections;
        private Map<String, ItemCorrection> itemCorrections;
        private List<SampleLine> sampleLines;
        private ProfileStats stats;
        private String promptHints;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder vendorId(String vendorId) {
            this.vendorId = vendorId;
            return this;
        }

        public Builder vendorName(String vendorName) {
            this.vendorName = vendorName;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder pricingModel(String pricingModel) {
            this.pricingModel = pricingModel;
            return this;
        }

        public Builder columns(Map<SemanticField, ColumnMapping> columns) {
            this.columns = columns;
            return this;
        }

        public Builder weightUnit(MeasurementUnit weightUnit) {
            this.weightUnit = weightUnit;
            return this;
        }

        public Builder packageFormat(PackageFormatSetting packageFormat) {
            this.packageFormat = packageFormat;
            return this;
        }

        public Builder quirks(VendorQuirks quirks) {
            this.quirks = quirks;
            return this;
        }

        public Builder columnCorrections(List<ColumnCorrection> columnCorrections) {
            this.columnCorrections = columnCorrections;
            return this;
        }

        public Builder itemCorrections(Map<String, ItemCorrection> itemCorrections) {
            this.itemCorrections = itemCorrections;
            return this;
        }

        public Builder sampleLines(List<SampleLine> sampleLines) {
            this.sampleLines = sampleLines;
            return this;
        }

        public Builder stats(ProfileStats stats) {
            this.stats = stats;
            return this;
        }

        public Builder promptHints(String promptHints) {
            this.promptHints = promptHints;
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

        public ParsingProfile build() {
            return new ParsingProfile(vendorId, vendorName, version, pricingModel, columns, weightUnit, packageFormat,
                quirks, columnCorrections, itemCorrections, sampleLines, stats, promptHints, createdAt, updatedAt);
        }
    }
}
