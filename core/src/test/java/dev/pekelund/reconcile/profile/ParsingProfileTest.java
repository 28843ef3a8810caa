package dev.pekelund.reconcile.profile;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.reconcile.pricing.DetectionHints;
import dev.pekelund.reconcile.pricing.PricingModel;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ParsingProfileTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void newProfileStartsWithoutPenalty() {
        ParsingProfile profile = ParsingProfile.newProfile("sysco", "Sysco", NOW);

        assertThat(profile.version()).isEqualTo(ParsingProfile.CURRENT_VERSION);
        assertThat(profile.pricingModel()).isEqualTo(ParsingProfile.AUTO_PRICING);
        assertThat(profile.confidenceAdjustment()).isEqualByComparingTo("0");
        assertThat(profile.quirks().flags()).isEmpty();
    }

    @Test
    void correctionLowersConfidenceUntilSuccessesAreRecorded() {
        ParsingProfile corrected = ParsingProfile.newProfile("sysco", "Sysco", NOW)
            .withColumnCorrection(new ColumnCorrection("Column 3", 2, "quantity", "weight", "2.84", NOW));

        assertThat(corrected.columnCorrections()).hasSize(1);
        assertThat(corrected.confidenceAdjustment()).isNegative();

        ParsingProfile used = corrected.withUsage(true, 0, NOW.plusSeconds(60));
        assertThat(used.confidenceAdjustment()).isEqualByComparingTo("-0.09");
        assertThat(used.stats().timesUsed()).isEqualTo(1);
        assertThat(used.stats().lastUsed()).isEqualTo(NOW.plusSeconds(60));
    }

    @Test
    void correctionLogIsAppendOnly() {
        ParsingProfile profile = ParsingProfile.newProfile("sysco", "Sysco", NOW)
            .withColumnCorrection(new ColumnCorrection("Column 3", 2, "quantity", "weight", null, NOW))
            .withColumnCorrection(new ColumnCorrection("Column 3", 2, "weight", "billingQuantity", null,
                NOW.plusSeconds(5)));

        assertThat(profile.columnCorrections())
            .extracting(ColumnCorrection::userCorrected)
            .containsExactly("weight", "billingQuantity");
        assertThat(profile.stats().columnCorrections()).isEqualTo(2);
    }

    @Test
    void itemCorrectionFeedsDetectionHints() {
        ParsingProfile profile = ParsingProfile.newProfile("sysco", "Sysco", NOW)
            .withItemCorrection(new ItemCorrection(ItemCorrection.keyFor("A-100", null), PricingModel.WEIGHT,
                new BigDecimal("2.84"), "kg", NOW));

        DetectionHints hints = profile.detectionHints(ItemCorrection.keyFor(" a-100 ", "Beef striploin"));

        assertThat(hints.learnedModel()).isEqualTo(PricingModel.WEIGHT);
        assertThat(hints.confidenceAdjustment()).isEqualByComparingTo("-0.10");
        assertThat(profile.detectionHints("unknown").learnedModel()).isNull();
    }

    @Test
    void migratesOutdatedProfilesToAutoPricing() {
        ParsingProfile legacy = ParsingProfile.newProfile("sysco", "Sysco", NOW).toBuilder()
            .version(1)
            .pricingModel("weight")
            .build();

        ParsingProfile migrated = legacy.migrate();

        assertThat(legacy.isOutdated()).isTrue();
        assertThat(migrated.version()).isEqualTo(ParsingProfile.CURRENT_VERSION);
        assertThat(migrated.pricingModel()).isEqualTo(ParsingProfile.AUTO_PRICING);
        assertThat(migrated.migrate()).isSameAs(migrated);
    }

    @Test
    void usageMovesSuccessRateTowardsOutcome() {
        ProfileStats stats = ProfileStats.initial().recordUsage(false, 0, NOW);
        assertThat(stats.successRate()).isEqualTo(80.0);

        stats = stats.recordUsage(true, 0, NOW);
        assertThat(stats.successRate()).isEqualTo(82.0);

        stats = stats.recordUsage(true, 2, NOW);
        assertThat(stats.lineCorrections()).isEqualTo(2);
        assertThat(stats.successesSinceCorrection()).isZero();
    }

    @Test
    void quirksBehaveAsTypedFlagSet() {
        VendorQuirks quirks = VendorQuirks.of(QuirkFlag.HAS_DEPOSITS)
            .toggle(QuirkFlag.MULTIPLE_PAGES, true)
            .toggle(QuirkFlag.HAS_DEPOSITS, false);

        assertThat(quirks.hasDeposits()).isFalse();
        assertThat(quirks.multiplePages()).isTrue();
        assertThat(quirks.flags()).containsExactly(QuirkFlag.MULTIPLE_PAGES);
    }
}
