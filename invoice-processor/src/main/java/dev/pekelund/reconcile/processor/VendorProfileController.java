package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.errors.ValidationException;
import dev.pekelund.reconcile.pricing.PricingModel;
import dev.pekelund.reconcile.profile.ItemCorrection;
import dev.pekelund.reconcile.profile.ParsingProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Clock;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API over a vendor's parsing profile: the learned layout, the correction log and the prompt
 * hints fed back to the extractor.
 */
@RestController
@RequestMapping(path = "/api/vendors/{vendorId}/profile", produces = MediaType.APPLICATION_JSON_VALUE)
public class VendorProfileController {

    private final VendorProfileManager profileManager;
    private final Clock clock;

    public VendorProfileController(VendorProfileManager profileManager, Clock clock) {
        this.profileManager = profileManager;
        this.clock = clock;
    }

    @GetMapping
    public ProfileView get(@PathVariable("vendorId") String vendorId) {
        return ProfileView.of(profileManager.require(vendorId));
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ProfileView create(@PathVariable("vendorId") String vendorId, @Valid @RequestBody CreateRequest request) {
        return ProfileView.of(profileManager.loadOrCreate(vendorId, request.vendorName()));
    }

    @DeleteMapping
    public ResponseEntity<Void> delete(@PathVariable("vendorId") String vendorId) {
        profileManager.delete(vendorId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping(path = "/corrections", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProfileView> recordCorrection(@PathVariable("vendorId") String vendorId,
        @Valid @RequestBody CorrectionRequest request) {
        ParsingProfile updated = profileManager.recordCorrection(vendorId, request.field(), request.columnIndex(),
            request.from(), request.to(), request.sampleValue());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProfileView.of(updated));
    }

    @PostMapping(path = "/item-corrections", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProfileView> recordItemCorrection(@PathVariable("vendorId") String vendorId,
        @Valid @RequestBody ItemCorrectionRequest request) {
        String key = ItemCorrection.keyFor(request.itemCode(), request.description());
        if (key == null) {
            throw new ValidationException("An item code or description is required");
        }
        ItemCorrection correction = new ItemCorrection(key, PricingModel.fromWire(request.pricingModel()),
            request.value(), request.unit(), clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ProfileView.of(profileManager.recordItemCorrection(vendorId, correction)));
    }

    @PostMapping(path = "/usage", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ProfileView recordUsage(@PathVariable("vendorId") String vendorId,
        @Valid @RequestBody UsageRequest request) {
        return ProfileView.of(profileManager.recordUsage(vendorId, request.success(), request.lineCorrections()));
    }

    @GetMapping(path = "/hints", produces = MediaType.TEXT_PLAIN_VALUE)
    public String hints(@PathVariable("vendorId") String vendorId) {
        return profileManager.generatePromptHints(vendorId);
    }

    /**
     * A profile with the confidence adjustment derived from its correction log.
     */
    public record ProfileView(ParsingProfile profile, BigDecimal confidenceAdjustment) {

        static ProfileView of(ParsingProfile profile) {
            return new ProfileView(profile, profile.confidenceAdjustment());
        }
    }

    public record CreateRequest(@NotBlank String vendorName) { }

    public record CorrectionRequest(@NotBlank String field, Integer columnIndex, String from, String to,
        String sampleValue) { }

    public record ItemCorrectionRequest(String itemCode, String description, @NotBlank String pricingModel,
        @NotNull BigDecimal value, String unit) { }

    public record UsageRequest(boolean success, @Min(0) int lineCorrections) { }
}
