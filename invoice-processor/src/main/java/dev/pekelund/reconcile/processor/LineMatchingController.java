package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.LineEdit;
import dev.pekelund.reconcile.units.MeasurementUnit;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for matching invoice lines against inventory.
 */
@RestController
@RequestMapping(path = "/api/lines", produces = MediaType.APPLICATION_JSON_VALUE)
public class LineMatchingController {

    private final LineMatchingService lineMatchingService;

    public LineMatchingController(LineMatchingService lineMatchingService) {
        this.lineMatchingService = lineMatchingService;
    }

    @GetMapping("/{lineId}")
    public InvoiceLineItem get(@PathVariable("lineId") String lineId) {
        return lineMatchingService.get(lineId);
    }

    @PatchMapping(path = "/{lineId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public InvoiceLineItem edit(@PathVariable("lineId") String lineId, @RequestBody EditRequest request) {
        MeasurementUnit weightUnit = StringUtils.hasText(request.weightUnit())
            ? MeasurementUnit.of(request.weightUnit()) : null;
        LineEdit edit = new LineEdit(request.description(), request.quantity(), request.weight(), weightUnit,
            request.unitPrice(), request.totalPrice(), request.notes());
        return lineMatchingService.editLine(lineId, edit);
    }

    @PostMapping(path = "/{lineId}/match", consumes = MediaType.APPLICATION_JSON_VALUE)
    public InvoiceLineItem match(@PathVariable("lineId") String lineId, @Valid @RequestBody MatchRequest request) {
        return lineMatchingService.manualMatch(lineId, request.inventoryItemId(), request.matchedBy(),
            request.notes());
    }

    @PostMapping("/{lineId}/find-match")
    public AutoMatchResult findMatch(@PathVariable("lineId") String lineId) {
        return lineMatchingService.findMatch(lineId);
    }

    @PostMapping("/{lineId}/unmatch")
    public InvoiceLineItem unmatch(@PathVariable("lineId") String lineId) {
        return lineMatchingService.unmatch(lineId);
    }

    @PostMapping(path = "/{lineId}/auto-match", consumes = MediaType.APPLICATION_JSON_VALUE)
    public InvoiceLineItem autoMatch(@PathVariable("lineId") String lineId,
        @Valid @RequestBody AutoMatchRequest request) {
        return lineMatchingService.autoMatch(lineId, request.inventoryItemId(), request.confidence());
    }

    @PostMapping(path = "/{lineId}/new-item", consumes = MediaType.APPLICATION_JSON_VALUE)
    public InvoiceLineItem newItem(@PathVariable("lineId") String lineId, @RequestBody NewItemRequest request) {
        return lineMatchingService.markNewItem(lineId, request.name(), request.createdBy());
    }

    @PostMapping("/{lineId}/skip")
    public InvoiceLineItem skip(@PathVariable("lineId") String lineId,
        @RequestBody(required = false) ReasonRequest request) {
        return lineMatchingService.skip(lineId, request != null ? request.reason() : null);
    }

    @PostMapping("/{lineId}/reopen")
    public InvoiceLineItem reopen(@PathVariable("lineId") String lineId) {
        return lineMatchingService.reopen(lineId);
    }

    @PostMapping("/{lineId}/reject")
    public InvoiceLineItem reject(@PathVariable("lineId") String lineId,
        @RequestBody(required = false) ReasonRequest request) {
        return lineMatchingService.reject(lineId, request != null ? request.reason() : null);
    }

    @PostMapping("/{lineId}/confirm")
    public InvoiceLineItem confirm(@PathVariable("lineId") String lineId,
        @RequestBody(required = false) ConfirmRequest request) {
        boolean updateInventory = request == null || request.updateInventory() == null || request.updateInventory();
        return lineMatchingService.confirm(lineId, updateInventory, request != null ? request.confirmedBy() : null);
    }

    @PostMapping(path = "/{lineId}/discrepancy", consumes = MediaType.APPLICATION_JSON_VALUE)
    public InvoiceLineItem flagDiscrepancy(@PathVariable("lineId") String lineId,
        @Valid @RequestBody DiscrepancyRequest request) {
        return lineMatchingService.flagDiscrepancy(lineId, request.notes());
    }

    public record MatchRequest(@NotBlank String inventoryItemId, String matchedBy, String notes) { }

    public record AutoMatchRequest(@NotBlank String inventoryItemId, @Min(0) @Max(100) int confidence) { }

    public record NewItemRequest(String name, String createdBy) { }

    public record ReasonRequest(String reason) { }

    /**
     * @param updateInventory defaults to true when omitted
     */
    public record ConfirmRequest(Boolean updateInventory, String confirmedBy) { }

    public record DiscrepancyRequest(@NotBlank String notes) { }

    public record EditRequest(String description, BigDecimal quantity, BigDecimal weight, String weightUnit,
        BigDecimal unitPrice, BigDecimal totalPrice, String notes) { }
}
