package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.errors.ValidationException;
import dev.pekelund.reconcile.invoices.DuplicateCheck;
import dev.pekelund.reconcile.invoices.DuplicateInvoiceDetector;
import dev.pekelund.reconcile.invoices.Invoice;
import dev.pekelund.reconcile.invoices.InvoiceRepository;
import dev.pekelund.reconcile.invoices.InvoiceStatus;
import dev.pekelund.reconcile.lines.CandidateLine;
import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.InvoiceLineRepository;
import dev.pekelund.reconcile.lines.LineInterpreter;
import dev.pekelund.reconcile.processor.extraction.ExtractedInvoice;
import dev.pekelund.reconcile.processor.extraction.InvoiceLineExtractor;
import dev.pekelund.reconcile.profile.ParsingProfile;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Turns extractor output into a stored invoice with interpreted lines. The invoice is stored first so
 * that a failure at any later stage leaves it in {@link InvoiceStatus#ERROR}.
 */
@Service
public class InvoiceIngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceIngestionService.class);

    private final InvoiceRepository invoiceRepository;
    private final InvoiceLineRepository lineRepository;
    private final DuplicateInvoiceDetector duplicateDetector;
    private final VendorProfileManager profileManager;
    private final LineInterpreter interpreter;
    private final InvoiceLineExtractor extractor;
    private final Clock clock;

    public InvoiceIngestionService(InvoiceRepository invoiceRepository, InvoiceLineRepository lineRepository,
        DuplicateInvoiceDetector duplicateDetector, VendorProfileManager profileManager, LineInterpreter interpreter,
        InvoiceLineExtractor extractor, Clock clock) {

        this.invoiceRepository = Objects.requireNonNull(invoiceRepository, "invoiceRepository");
        this.lineRepository = Objects.requireNonNull(lineRepository, "lineRepository");
        this.duplicateDetector = Objects.requireNonNull(duplicateDetector, "duplicateDetector");
        this.profileManager = Objects.requireNonNull(profileManager, "profileManager");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Ingests lines that were already extracted.
     */
    public IngestionResult ingest(IngestionRequest request) {
        Objects.requireNonNull(request, "request");
        requireVendor(request.vendorId(), request.vendorName());

        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forInvoice(null, request.vendorId())) {
            ReconciliationMdc.setStage("ingest");
            DuplicateCheck duplicate = duplicateDetector.check(request.vendorName(), request.invoiceNumber());
            Invoice invoice = begin(request.vendorId(), request.vendorName(), request.invoiceNumber(),
                request.invoiceDate(), request.total());
            try {
                invoice = advance(invoice, InvoiceStatus.EXTRACTING);
                ParsingProfile profile = profileManager.loadOrCreate(request.vendorId(), request.vendorName());
                return finish(invoice, profile, request.lines(), duplicate);
            } catch (RuntimeException ex) {
                throw fail(invoice, ex);
            }
        }
    }

    /**
     * Runs the extractor on the uploaded document with the vendor's prompt hints, then ingests its lines.
     * A vendor name found by the extractor is used when none was given.
     */
    public IngestionResult extractAndIngest(byte[] document, String fileName, String vendorId, String vendorName) {
        if (!StringUtils.hasText(vendorId)) {
            throw new ValidationException("Vendor id is required");
        }
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.forInvoice(null, vendorId)) {
            ReconciliationMdc.setStage("extract");
            Invoice invoice = begin(vendorId, vendorName, null, null, null);
            try {
                invoice = advance(invoice, InvoiceStatus.EXTRACTING);
                ParsingProfile existing = profileManager.load(vendorId).orElse(null);
                String hints = existing != null ? existing.promptHints() : null;
                ExtractedInvoice extracted = extractor.extract(document, fileName, hints);
                LOGGER.info("Extracted {} candidate lines from {} for invoice {}", extracted.lines().size(), fileName,
                    invoice.id());

                String name = StringUtils.hasText(vendorName) ? vendorName
                    : extracted.vendor() != null ? extracted.vendor().name() : null;
                requireVendor(vendorId, name);
                invoice = invoiceRepository.save(invoice.toBuilder()
                    .vendorName(name)
                    .invoiceNumber(extracted.invoiceNumber())
                    .invoiceDate(extracted.invoiceDate())
                    .total(extracted.total())
                    .updatedAt(clock.instant())
                    .build());
                DuplicateCheck duplicate = duplicateDetector.check(name, extracted.invoiceNumber(), invoice.id());
                ParsingProfile profile = existing != null ? existing : profileManager.loadOrCreate(vendorId, name);
                return finish(invoice, profile, extracted.lines(), duplicate);
            } catch (RuntimeException ex) {
                throw fail(invoice, ex);
            }
        }
    }

    private Invoice begin(String vendorId, String vendorName, String invoiceNumber, LocalDate invoiceDate,
        BigDecimal total) {

        Instant now = clock.instant();
        Invoice draft = invoiceRepository.save(Invoice.builder()
            .vendorId(vendorId)
            .vendorName(vendorName)
            .invoiceNumber(StringUtils.hasText(invoiceNumber) ? invoiceNumber.trim() : null)
            .invoiceDate(invoiceDate)
            .total(total)
            .status(InvoiceStatus.DRAFT)
            .createdAt(now)
            .updatedAt(now)
            .build());
        ReconciliationMdc.attachInvoice(draft.id(), vendorId);
        LOGGER.info("Created invoice {} for vendor {}", draft.id(), vendorId);
        return advance(draft, InvoiceStatus.PENDING);
    }

    private IngestionResult finish(Invoice invoice, ParsingProfile profile, List<CandidateLine> candidates,
        DuplicateCheck duplicate) {

        Instant now = clock.instant();
        List<InvoiceLineItem> interpreted = new ArrayList<>(candidates.size());
        for (int index = 0; index < candidates.size(); index++) {
            interpreted.add(interpreter.interpret(invoice.id(), index + 1, candidates.get(index), profile, now));
        }
        List<InvoiceLineItem> saved = lineRepository.saveAll(interpreted);
        long discrepancies = saved.stream().filter(InvoiceLineItem::discrepancy).count();
        long needsReview = saved.stream().filter(InvoiceLineItem::needsReview).count();
        LOGGER.info("Stored {} lines for invoice {} ({} with discrepancies, {} needing review)", saved.size(),
            invoice.id(), discrepancies, needsReview);

        Invoice extracted = advance(invoice, InvoiceStatus.EXTRACTED);
        profileManager.recordUsage(profile.vendorId(), !saved.isEmpty(), 0);
        return new IngestionResult(extracted, saved, DuplicateInvoiceWarning.from(duplicate));
    }

    private Invoice advance(Invoice invoice, InvoiceStatus target) {
        Invoice moved = invoiceRepository.save(invoice.transitionTo(target, null, clock.instant()));
        LOGGER.debug("Invoice {} is now {}", moved.id(), target.wireValue());
        return moved;
    }

    private RuntimeException fail(Invoice invoice, RuntimeException ex) {
        Invoice current = invoiceRepository.findById(invoice.id()).orElse(invoice);
        if (current.status().canTransitionTo(InvoiceStatus.ERROR)) {
            try {
                invoiceRepository.save(current.transitionTo(InvoiceStatus.ERROR, ex.getMessage(), clock.instant()));
            } catch (RuntimeException saveFailure) {
                ex.addSuppressed(saveFailure);
            }
        }
        LOGGER.error("Ingestion of invoice {} failed in status {}", invoice.id(), current.status().wireValue(), ex);
        return ex;
    }

    private static void requireVendor(String vendorId, String vendorName) {
        if (!StringUtils.hasText(vendorId)) {
            throw new ValidationException("Vendor id is required");
        }
        if (!StringUtils.hasText(vendorName)) {
            throw new ValidationException("Vendor name is required");
        }
    }
}
