package dev.pekelund.reconcile.processor;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import dev.pekelund.reconcile.invoices.DuplicateCheck;
import dev.pekelund.reconcile.invoices.Invoice;
import dev.pekelund.reconcile.invoices.InvoiceStatus;
import dev.pekelund.reconcile.invoices.Payment;
import dev.pekelund.reconcile.invoices.PaymentFlag;
import dev.pekelund.reconcile.invoices.PaymentStatus;
import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.LineSummary;
import dev.pekelund.reconcile.lines.MatchStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for ingesting invoices and driving their document and payment lifecycle.
 */
@RestController
@RequestMapping(path = "/api/invoices", produces = MediaType.APPLICATION_JSON_VALUE)
public class InvoiceController {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceController.class);

    private static final String PDF_MIME_TYPE = "application/pdf";

    private final InvoiceIngestionService ingestionService;
    private final InvoiceLifecycleService lifecycleService;
    private final LineMatchingService lineMatchingService;

    public InvoiceController(InvoiceIngestionService ingestionService, InvoiceLifecycleService lifecycleService,
        LineMatchingService lineMatchingService) {
        this.ingestionService = ingestionService;
        this.lifecycleService = lifecycleService;
        this.lineMatchingService = lineMatchingService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IngestionResponse> ingest(@Valid @RequestBody IngestionRequest request) {
        IngestionResult result = ingestionService.ingest(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(IngestionResponse.of(result));
    }

    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestionResponse> upload(@RequestPart("file") MultipartFile file,
        @RequestParam("vendorId") String vendorId,
        @RequestParam(name = "vendorName", required = false) String vendorName) throws IOException {

        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "A non-empty PDF must be provided as the 'file' part");
        }
        if (!isPdf(file)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Only PDF uploads are supported");
        }
        String fileName = StringUtils.hasText(file.getOriginalFilename()) ? file.getOriginalFilename()
            : "invoice.pdf";
        LOGGER.info("Extracting uploaded invoice '{}' for vendor {}", fileName, vendorId);
        IngestionResult result = ingestionService.extractAndIngest(file.getBytes(), fileName, vendorId, vendorName);
        return ResponseEntity.status(HttpStatus.CREATED).body(IngestionResponse.of(result));
    }

    @GetMapping
    public List<InvoiceView> list(@RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "paymentStatus", required = false) String paymentStatus,
        @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        List<Invoice> invoices;
        if (StringUtils.hasText(status)) {
            invoices = lifecycleService.findByStatus(InvoiceStatus.fromWire(status));
        } else if (StringUtils.hasText(paymentStatus)) {
            invoices = lifecycleService.findByPaymentStatus(PaymentStatus.fromWire(paymentStatus));
        } else if (from != null || to != null) {
            invoices = lifecycleService.findByInvoiceDate(from, to);
        } else {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Filter by status, paymentStatus or a from/to date range");
        }
        return invoices.stream().map(InvoiceView::of).toList();
    }

    @GetMapping("/{invoiceId}")
    public InvoiceView get(@PathVariable("invoiceId") String invoiceId) {
        return InvoiceView.of(lifecycleService.get(invoiceId));
    }

    @GetMapping("/{invoiceId}/lines")
    public List<InvoiceLineItem> lines(@PathVariable("invoiceId") String invoiceId,
        @RequestParam(name = "matchStatus", required = false) String matchStatus) {
        lifecycleService.get(invoiceId);
        MatchStatus status = StringUtils.hasText(matchStatus) ? MatchStatus.fromWire(matchStatus) : null;
        return lineMatchingService.listForInvoice(invoiceId, status);
    }

    @GetMapping("/{invoiceId}/summary")
    public LineSummary summary(@PathVariable("invoiceId") String invoiceId) {
        return lifecycleService.summarize(invoiceId);
    }

    @PostMapping(path = "/{invoiceId}/transitions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public InvoiceView transition(@PathVariable("invoiceId") String invoiceId,
        @Valid @RequestBody TransitionRequest request) {
        InvoiceStatus target = InvoiceStatus.fromWire(request.status());
        if (target == InvoiceStatus.ERROR) {
            return InvoiceView.of(lifecycleService.markError(invoiceId, request.message()));
        }
        return InvoiceView.of(lifecycleService.transition(invoiceId, target, request.message()));
    }

    @PostMapping("/{invoiceId}/advance")
    public InvoiceView advance(@PathVariable("invoiceId") String invoiceId) {
        return InvoiceView.of(lifecycleService.advanceIfResolved(invoiceId));
    }

    @PostMapping("/{invoiceId}/auto-match")
    public InvoiceAutoMatchResult autoMatch(@PathVariable("invoiceId") String invoiceId) {
        lifecycleService.get(invoiceId);
        return lineMatchingService.autoMatchInvoice(invoiceId);
    }

    /**
     * Confirms every matched line into inventory and, when none failed, advances a reviewed invoice.
     */
    @PostMapping("/{invoiceId}/confirm-lines")
    public ConfirmLinesResponse confirmLines(@PathVariable("invoiceId") String invoiceId,
        @RequestBody(required = false) ConfirmLinesRequest request) {
        lifecycleService.get(invoiceId);
        boolean skipUnmatched = request != null && Boolean.TRUE.equals(request.skipUnmatched());
        BulkConfirmResult result = lineMatchingService.confirmAll(invoiceId,
            request != null ? request.confirmedBy() : null, skipUnmatched);
        Invoice invoice = result.hasErrors() ? lifecycleService.get(invoiceId)
            : lifecycleService.advanceIfResolved(invoiceId);
        if (result.hasErrors()) {
            LOGGER.warn("Invoice {} kept at {}: {} line(s) could not be confirmed", invoiceId,
                invoice.status().wireValue(), result.errors().size());
        }
        return new ConfirmLinesResponse(InvoiceView.of(invoice), result);
    }

    @PostMapping(path = "/{invoiceId}/payments", consumes = MediaType.APPLICATION_JSON_VALUE)
    public InvoiceView recordPayment(@PathVariable("invoiceId") String invoiceId,
        @Valid @RequestBody PaymentRequest request) {
        Payment payment = new Payment(request.amount(), request.method(), request.reference(), request.paidOn());
        return InvoiceView.of(lifecycleService.recordPayment(invoiceId, payment));
    }

    @PutMapping("/{invoiceId}/flags/{flag}")
    public InvoiceView setFlag(@PathVariable("invoiceId") String invoiceId, @PathVariable("flag") String flag) {
        return InvoiceView.of(lifecycleService.setFlag(invoiceId, PaymentFlag.fromWire(flag), true));
    }

    @DeleteMapping("/{invoiceId}/flags/{flag}")
    public InvoiceView clearFlag(@PathVariable("invoiceId") String invoiceId, @PathVariable("flag") String flag) {
        return InvoiceView.of(lifecycleService.setFlag(invoiceId, PaymentFlag.fromWire(flag), false));
    }

    @DeleteMapping("/{invoiceId}")
    public ResponseEntity<Void> delete(@PathVariable("invoiceId") String invoiceId) {
        lifecycleService.delete(invoiceId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/duplicates")
    public DuplicateCheck checkDuplicate(@RequestParam("vendorName") String vendorName,
        @RequestParam("invoiceNumber") String invoiceNumber,
        @RequestParam(name = "excludeId", required = false) String excludeId) {
        return lifecycleService.checkDuplicate(vendorName, invoiceNumber, excludeId);
    }

    private boolean isPdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (StringUtils.hasText(contentType) && contentType.toLowerCase().startsWith(PDF_MIME_TYPE)) {
            return true;
        }
        String name = file.getOriginalFilename();
        return name != null && name.toLowerCase().endsWith(".pdf");
    }

    /**
     * An invoice together with the values derived from it.
     */
    public record InvoiceView(@JsonUnwrapped Invoice invoice, PaymentStatus paymentStatus, BigDecimal balanceDue) {

        static InvoiceView of(Invoice invoice) {
            return new InvoiceView(invoice, invoice.paymentStatus(), invoice.balanceDue());
        }
    }

    public record IngestionResponse(InvoiceView invoice, List<InvoiceLineItem> lines,
        DuplicateInvoiceWarning duplicateWarning) {

        static IngestionResponse of(IngestionResult result) {
            return new IngestionResponse(InvoiceView.of(result.invoice()), result.lines(), result.duplicateWarning());
        }
    }

    /**
     * @param skipUnmatched report lines without an item as skipped instead of as errors, false when omitted
     */
    public record ConfirmLinesRequest(String confirmedBy, Boolean skipUnmatched) { }

    public record ConfirmLinesResponse(InvoiceView invoice, BulkConfirmResult lines) { }

    public record TransitionRequest(@NotBlank String status, String message) { }

    public record PaymentRequest(@NotNull @Positive BigDecimal amount, String method, String reference,
        LocalDate paidOn) { }
}
