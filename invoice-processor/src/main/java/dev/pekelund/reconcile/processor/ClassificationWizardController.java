package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.classification.ClassificationStep;
import dev.pekelund.reconcile.classification.ClassifiedColumn;
import dev.pekelund.reconcile.classification.ColumnClassificationWizard;
import dev.pekelund.reconcile.classification.LineCorrection;
import dev.pekelund.reconcile.classification.VerificationLine;
import dev.pekelund.reconcile.processor.ClassificationSessionService.ClassificationOutcome;
import dev.pekelund.reconcile.processor.VendorProfileController.ProfileView;
import dev.pekelund.reconcile.profile.QuirkFlag;
import dev.pekelund.reconcile.profile.SampleLine;
import dev.pekelund.reconcile.profile.SemanticField;
import dev.pekelund.reconcile.profile.VendorQuirks;
import dev.pekelund.reconcile.units.MeasurementUnit;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.math.BigDecimal;
import java.util.List;
import java.util.function.Consumer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API driving a column classification wizard session for a vendor.
 */
@RestController
@RequestMapping(path = "/api/vendors/{vendorId}/classification", produces = MediaType.APPLICATION_JSON_VALUE)
public class ClassificationWizardController {

    private final ClassificationSessionService sessionService;

    public ClassificationWizardController(ClassificationSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WizardView> start(@PathVariable("vendorId") String vendorId,
        @Valid @RequestBody StartRequest request) {

        List<ClassifiedColumn> columns = request.columns().stream()
            .map(column -> ClassifiedColumn.detected(SemanticField.fromWire(column.aiLabel()), column.sampleValue()))
            .toList();
        List<SampleLine> samples = request.sampleLines() != null ? request.sampleLines() : List.of();
        String sessionId = sessionService.start(vendorId, request.vendorName(), columns, samples);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(WizardView.of(sessionId, sessionService.get(vendorId, sessionId)));
    }

    @GetMapping("/{sessionId}")
    public WizardView get(@PathVariable("vendorId") String vendorId, @PathVariable("sessionId") String sessionId) {
        return WizardView.of(sessionId, sessionService.get(vendorId, sessionId));
    }

    @PostMapping("/{sessionId}/next")
    public WizardView next(@PathVariable("vendorId") String vendorId, @PathVariable("sessionId") String sessionId) {
        return update(vendorId, sessionId, ColumnClassificationWizard::next);
    }

    @PostMapping("/{sessionId}/back")
    public WizardView back(@PathVariable("vendorId") String vendorId, @PathVariable("sessionId") String sessionId) {
        return update(vendorId, sessionId, ColumnClassificationWizard::back);
    }

    @PutMapping(path = "/{sessionId}/vendor-name", consumes = MediaType.APPLICATION_JSON_VALUE)
    public WizardView vendorName(@PathVariable("vendorId") String vendorId,
        @PathVariable("sessionId") String sessionId, @RequestBody VendorNameRequest request) {
        return update(vendorId, sessionId, wizard -> wizard.setVendorName(request.vendorName()));
    }

    @PutMapping(path = "/{sessionId}/quirks", consumes = MediaType.APPLICATION_JSON_VALUE)
    public WizardView quirks(@PathVariable("vendorId") String vendorId, @PathVariable("sessionId") String sessionId,
        @RequestBody QuirksRequest request) {
        List<QuirkFlag> flags = request.quirks() != null
            ? request.quirks().stream().map(QuirkFlag::fromWire).toList()
            : List.of();
        return update(vendorId, sessionId, wizard -> wizard.setQuirks(VendorQuirks.of(flags)));
    }

    @PutMapping(path = "/{sessionId}/weight-unit", consumes = MediaType.APPLICATION_JSON_VALUE)
    public WizardView weightUnit(@PathVariable("vendorId") String vendorId,
        @PathVariable("sessionId") String sessionId, @RequestBody WeightUnitRequest request) {
        MeasurementUnit unit = StringUtils.hasText(request.weightUnit()) ? MeasurementUnit.of(request.weightUnit())
            : null;
        return update(vendorId, sessionId, wizard -> wizard.setWeightUnit(unit));
    }

    @PutMapping(path = "/{sessionId}/columns/{position}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public WizardView assign(@PathVariable("vendorId") String vendorId, @PathVariable("sessionId") String sessionId,
        @PathVariable("position") int position, @Valid @RequestBody AssignRequest request) {
        SemanticField type = SemanticField.fromWire(request.type());
        return update(vendorId, sessionId, wizard -> wizard.assign(position, type));
    }

    @PostMapping("/{sessionId}/columns/{position}/move-up")
    public WizardView moveUp(@PathVariable("vendorId") String vendorId, @PathVariable("sessionId") String sessionId,
        @PathVariable("position") int position) {
        return update(vendorId, sessionId, wizard -> wizard.moveUp(position));
    }

    @PostMapping("/{sessionId}/columns/{position}/move-down")
    public WizardView moveDown(@PathVariable("vendorId") String vendorId,
        @PathVariable("sessionId") String sessionId, @PathVariable("position") int position) {
        return update(vendorId, sessionId, wizard -> wizard.moveDown(position));
    }

    @PutMapping(path = "/{sessionId}/lines/{index}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public WizardView correctLine(@PathVariable("vendorId") String vendorId,
        @PathVariable("sessionId") String sessionId, @PathVariable("index") int index,
        @RequestBody LineCorrectionRequest request) {
        MeasurementUnit unit = StringUtils.hasText(request.weightUnit()) ? MeasurementUnit.of(request.weightUnit())
            : null;
        LineCorrection correction = new LineCorrection(request.description(), request.quantity(), request.weight(),
            unit, request.unitPrice());
        return update(vendorId, sessionId, wizard -> wizard.correctLine(index, correction));
    }

    @PostMapping("/{sessionId}/lines/{index}/verify")
    public WizardView verifyLine(@PathVariable("vendorId") String vendorId,
        @PathVariable("sessionId") String sessionId, @PathVariable("index") int index) {
        return update(vendorId, sessionId, wizard -> wizard.markLineCorrect(index));
    }

    @PostMapping("/{sessionId}/complete")
    public CompletionView complete(@PathVariable("vendorId") String vendorId,
        @PathVariable("sessionId") String sessionId) {
        ClassificationOutcome outcome = sessionService.complete(vendorId, sessionId);
        return new CompletionView(ProfileView.of(outcome.profile()), outcome.result().newCorrections().size(),
            outcome.result().correctedLines(), outcome.result().correctnessRatio());
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> cancel(@PathVariable("vendorId") String vendorId,
        @PathVariable("sessionId") String sessionId) {
        sessionService.cancel(vendorId, sessionId);
        return ResponseEntity.noContent().build();
    }

    private WizardView update(String vendorId, String sessionId, Consumer<ColumnClassificationWizard> change) {
        return WizardView.of(sessionId, sessionService.update(vendorId, sessionId, change));
    }

    /**
     * Wizard state as shown to the user, including what blocks the current step.
     */
    public record WizardView(
        String sessionId,
        String vendorId,
        String vendorName,
        ClassificationStep step,
        List<QuirkFlag> quirks,
        MeasurementUnit weightUnit,
        List<ClassifiedColumn> columns,
        List<VerificationLine> lines,
        List<String> validationErrors,
        BigDecimal correctnessRatio
    ) {

        static WizardView of(String sessionId, ColumnClassificationWizard wizard) {
            return new WizardView(sessionId, wizard.vendorId(), wizard.vendorName(), wizard.currentStep(),
                wizard.quirks().flags().stream().sorted().toList(), wizard.weightUnit(), wizard.columns(),
                wizard.lines(), wizard.validationErrors(), wizard.correctnessRatio());
        }
    }

    public record CompletionView(ProfileView profile, int newCorrections, int correctedLines,
        BigDecimal correctnessRatio) { }

    public record ColumnRequest(@NotBlank String aiLabel, String sampleValue) { }

    public record StartRequest(String vendorName, @NotEmpty List<@Valid ColumnRequest> columns,
        List<SampleLine> sampleLines) { }

    public record VendorNameRequest(String vendorName) { }

    public record QuirksRequest(List<String> quirks) { }

    public record WeightUnitRequest(String weightUnit) { }

    public record AssignRequest(@NotBlank String type) { }

    public record LineCorrectionRequest(String description, BigDecimal quantity, BigDecimal weight, String weightUnit,
        BigDecimal unitPrice) { }
}
