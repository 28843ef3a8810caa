package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.classification.ClassificationResult;
import dev.pekelund.reconcile.errors.NotFoundException;
import dev.pekelund.reconcile.errors.ValidationException;
import dev.pekelund.reconcile.profile.ColumnCorrection;
import dev.pekelund.reconcile.profile.ItemCorrection;
import dev.pekelund.reconcile.profile.ParsingProfile;
import dev.pekelund.reconcile.profile.ParsingProfileRepository;
import dev.pekelund.reconcile.profile.PromptHintGenerator;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Loads, learns and stores vendor parsing profiles. Every change regenerates the profile's prompt hints
 * before it is saved.
 */
@Service
public class VendorProfileManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(VendorProfileManager.class);

    private final ParsingProfileRepository repository;
    private final PromptHintGenerator hintGenerator;
    private final Clock clock;

    public VendorProfileManager(ParsingProfileRepository repository, PromptHintGenerator hintGenerator,
        Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.hintGenerator = Objects.requireNonNull(hintGenerator, "hintGenerator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Loads a vendor's profile, upgrading and saving it back when it was written by an older release.
     */
    public Optional<ParsingProfile> load(String vendorId) {
        requireVendorId(vendorId);
        Optional<ParsingProfile> stored = repository.findByVendorId(vendorId);
        if (stored.isPresent() && stored.get().isOutdated()) {
            ParsingProfile profile = stored.get();
            LOGGER.info("Migrating parsing profile of vendor {} from version {} to {}", vendorId, profile.version(),
                ParsingProfile.CURRENT_VERSION);
            return Optional.of(save(profile.migrate()));
        }
        return stored;
    }

    public ParsingProfile require(String vendorId) {
        return load(vendorId).orElseThrow(() -> NotFoundException.of("Parsing profile", vendorId));
    }

    public ParsingProfile loadOrCreate(String vendorId, String vendorName) {
        return load(vendorId).orElseGet(() -> {
            LOGGER.info("Creating parsing profile for new vendor {} ('{}')", vendorId, vendorName);
            return save(ParsingProfile.newProfile(vendorId, vendorName, clock.instant()));
        });
    }

    public ParsingProfile save(ParsingProfile profile) {
        Objects.requireNonNull(profile, "profile");
        return repository.save(profile.withPromptHints(hintGenerator.generate(profile)));
    }

    public void delete(String vendorId) {
        requireVendorId(vendorId);
        repository.deleteByVendorId(vendorId);
        LOGGER.info("Deleted parsing profile of vendor {}", vendorId);
    }

    /**
     * Appends a correction to the vendor's log. The confidence adjustment drops until the profile is
     * used successfully again.
     */
    public ParsingProfile recordCorrection(String vendorId, String field, String from, String to,
        String sampleValue) {
        return recordCorrection(vendorId, field, null, from, to, sampleValue);
    }

    public ParsingProfile recordCorrection(String vendorId, String field, Integer columnIndex, String from,
        String to, String sampleValue) {

        if (!StringUtils.hasText(field)) {
            throw new ValidationException("The corrected field is required");
        }
        ParsingProfile profile = require(vendorId);
        ColumnCorrection correction = new ColumnCorrection(field, columnIndex, from, to, sampleValue,
            clock.instant());
        ParsingProfile updated = save(profile.withColumnCorrection(correction));
        LOGGER.info("Recorded correction of '{}' for vendor {}: '{}' -> '{}', confidence adjustment now {}", field,
            vendorId, from, to, updated.confidenceAdjustment());
        return updated;
    }

    public ParsingProfile recordItemCorrection(String vendorId, ItemCorrection correction) {
        Objects.requireNonNull(correction, "correction");
        ParsingProfile updated = save(require(vendorId).withItemCorrection(correction));
        LOGGER.info("Recorded {} correction for item '{}' of vendor {}", correction.pricingModel().wireValue(),
            correction.key(), vendorId);
        return updated;
    }

    public ParsingProfile recordUsage(String vendorId, boolean success, int lineCorrections) {
        Instant now = clock.instant();
        ParsingProfile updated = save(require(vendorId).withUsage(success, lineCorrections, now).toBuilder()
            .updatedAt(now)
            .build());
        LOGGER.info("Recorded {} use of vendor {} profile, success rate {}", success ? "successful" : "failed",
            vendorId, updated.stats().successRate());
        return updated;
    }

    public String generatePromptHints(String vendorId) {
        return hintGenerator.generate(require(vendorId));
    }

    /**
     * Stores the profile produced by a completed classification wizard.
     */
    public ParsingProfile applyClassification(ClassificationResult result) {
        Objects.requireNonNull(result, "result");
        ParsingProfile saved = save(result.profile());
        LOGGER.info("Applied classification for vendor {}: {} columns mapped, {} new corrections, {} lines corrected",
            saved.vendorId(), saved.columns().size(), result.newCorrections().size(), result.correctedLines());
        return saved;
    }

    private static void requireVendorId(String vendorId) {
        if (!StringUtils.hasText(vendorId)) {
            throw new ValidationException("Vendor id is required");
        }
    }
}
