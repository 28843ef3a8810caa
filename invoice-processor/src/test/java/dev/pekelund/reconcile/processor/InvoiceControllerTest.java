package dev.pekelund.reconcile.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.pekelund.reconcile.errors.NotFoundException;
import dev.pekelund.reconcile.errors.ValidationException;
import dev.pekelund.reconcile.invoices.Invoice;
import dev.pekelund.reconcile.invoices.InvoiceStatus;
import dev.pekelund.reconcile.invoices.Payment;
import dev.pekelund.reconcile.invoices.PaymentFlag;
import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.MatchCandidate;
import dev.pekelund.reconcile.lines.MatchStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class InvoiceControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:30:00Z");

    private MockMvc mockMvc;

    @Mock
    private InvoiceIngestionService ingestionService;

    @Mock
    private InvoiceLifecycleService lifecycleService;

    @Mock
    private LineMatchingService lineMatchingService;

    @InjectMocks
    private InvoiceController controller;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void ingestsExtractedLines() throws Exception {
        Invoice invoice = invoice(InvoiceStatus.EXTRACTED);
        InvoiceLineItem line = InvoiceLineItem.builder()
            .id("line-1")
            .invoiceId("inv-1")
            .lineNumber(1)
            .description("Chicken breast")
            .build();
        when(ingestionService.ingest(any())).thenReturn(new IngestionResult(invoice, List.of(line), null));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"vendorId": "sysco", "vendorName": "Sysco", "invoiceNumber": "INV-1",
                     "lines": [{"rawDescription": "Chicken breast", "rawQuantity": "2"}]}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.invoice.id").value("inv-1"))
            .andExpect(jsonPath("$.invoice.status").value("EXTRACTED"))
            .andExpect(jsonPath("$.invoice.paymentStatus").value("UNPAID"))
            .andExpect(jsonPath("$.invoice.balanceDue").value(100.0))
            .andExpect(jsonPath("$.lines[0].description").value("Chicken breast"));

        ArgumentCaptor<IngestionRequest> request = ArgumentCaptor.forClass(IngestionRequest.class);
        verify(ingestionService).ingest(request.capture());
        assertThat(request.getValue().lines()).hasSize(1);
    }

    @Test
    void rejectsIngestionWithoutVendor() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/api/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"vendorName\": \"Sysco\", \"lines\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value(containsString("vendorId")));

        verifyNoInteractions(ingestionService);
    }

    @Test
    void uploadsPdfForExtraction() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "sysco.pdf", "application/pdf", "pdf".getBytes());
        when(ingestionService.extractAndIngest(any(), eq("sysco.pdf"), eq("sysco"), isNull()))
            .thenReturn(new IngestionResult(invoice(InvoiceStatus.EXTRACTED), List.of(), null));

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/invoices/upload")
                .file(file)
                .param("vendorId", "sysco"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.invoice.vendorId").value("sysco"));
    }

    @Test
    void rejectsNonPdfUploads() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "scan.png", "image/png", "png".getBytes());

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/invoices/upload")
                .file(file)
                .param("vendorId", "sysco"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(ingestionService);
    }

    @Test
    void listingRequiresAFilter() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/api/invoices"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void listsByWireStatus() throws Exception {
        when(lifecycleService.findByStatus(InvoiceStatus.SENT_TO_ACCOUNTING))
            .thenReturn(List.of(invoice(InvoiceStatus.SENT_TO_ACCOUNTING)));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/invoices").param("status", "sent_to_qb"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].status").value("SENT_TO_ACCOUNTING"));
    }

    @Test
    void unknownInvoiceIsNotFound() throws Exception {
        when(lifecycleService.get("missing")).thenThrow(NotFoundException.of("Invoice", "missing"));

        mockMvc.perform(MockMvcRequestBuilders.get("/api/invoices/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Invoice not found: missing"));
    }

    @Test
    void listsLinesFilteredByMatchStatus() throws Exception {
        when(lifecycleService.get("inv-1")).thenReturn(invoice(InvoiceStatus.EXTRACTED));
        when(lineMatchingService.listForInvoice("inv-1", MatchStatus.UNMATCHED)).thenReturn(List.of());

        mockMvc.perform(MockMvcRequestBuilders.get("/api/invoices/inv-1/lines").param("matchStatus", "unmatched"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void illegalTransitionIsBadRequest() throws Exception {
        when(lifecycleService.transition("inv-1", InvoiceStatus.ARCHIVED, null))
            .thenThrow(new ValidationException("Invoice cannot move from extracted to archived"));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/invoices/inv-1/transitions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"archived\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invoice cannot move from extracted to archived"));
    }

    @Test
    void errorTransitionKeepsMessage() throws Exception {
        when(lifecycleService.markError("inv-1", "Unreadable scan")).thenReturn(invoice(InvoiceStatus.ERROR));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/invoices/inv-1/transitions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"error\", \"message\": \"Unreadable scan\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ERROR"));
    }

    @Test
    void recordsPayment() throws Exception {
        Invoice paid = invoice(InvoiceStatus.PROCESSED).toBuilder().amountPaid(new BigDecimal("40.00")).build();
        when(lifecycleService.recordPayment(eq("inv-1"), any(Payment.class))).thenReturn(paid);

        mockMvc.perform(MockMvcRequestBuilders.post("/api/invoices/inv-1/payments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 40.00, \"method\": \"cheque\", \"paidOn\": \"2026-03-01\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.paymentStatus").value("PARTIAL"))
            .andExpect(jsonPath("$.balanceDue").value(60.0));
    }

    @Test
    void rejectsNonPositivePayment() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/api/invoices/inv-1/payments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 0}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleService);
    }

    @Test
    void setsAndClearsPaymentFlags() throws Exception {
        Invoice voided = invoice(InvoiceStatus.PROCESSED).withFlag(PaymentFlag.VOIDED, true, NOW);
        when(lifecycleService.setFlag("inv-1", PaymentFlag.VOIDED, true)).thenReturn(voided);
        when(lifecycleService.setFlag("inv-1", PaymentFlag.VOIDED, false)).thenReturn(invoice(InvoiceStatus.PROCESSED));

        mockMvc.perform(MockMvcRequestBuilders.put("/api/invoices/inv-1/flags/voided"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.paymentStatus").value("VOIDED"));
        mockMvc.perform(MockMvcRequestBuilders.delete("/api/invoices/inv-1/flags/voided"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.paymentStatus").value("UNPAID"));
    }

    @Test
    void autoMatchReportsMatchedAndOpenLines() throws Exception {
        when(lifecycleService.get("inv-1")).thenReturn(invoice(InvoiceStatus.EXTRACTED));
        when(lineMatchingService.autoMatchInvoice("inv-1")).thenReturn(new InvoiceAutoMatchResult(
            List.of(new InvoiceAutoMatchResult.MatchedLine("line-1", 1, "item-1", "Chicken breast", 95)),
            List.of(new InvoiceAutoMatchResult.UnmatchedLine("line-2", 2, "Napkins 500ct", 40,
                List.of(new MatchCandidate("item-7", "Paper napkins", null, 40))))));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/invoices/inv-1/auto-match"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.matched[0].inventoryItemId").value("item-1"))
            .andExpect(jsonPath("$.matched[0].confidence").value(95))
            .andExpect(jsonPath("$.unmatched[0].bestConfidence").value(40))
            .andExpect(jsonPath("$.unmatched[0].candidates[0].name").value("Paper napkins"));
    }

    @Test
    void confirmLinesAdvancesInvoiceWhenNoLineFailed() throws Exception {
        when(lifecycleService.get("inv-1")).thenReturn(invoice(InvoiceStatus.REVIEWED));
        when(lineMatchingService.confirmAll("inv-1", "chef", true)).thenReturn(new BulkConfirmResult(
            List.of(new BulkConfirmResult.LineOutcome("line-1", 1, "item-1", null)),
            List.of(new BulkConfirmResult.LineOutcome("line-2", 2, null, "Not matched to an inventory item")),
            List.of()));
        when(lifecycleService.advanceIfResolved("inv-1")).thenReturn(invoice(InvoiceStatus.PROCESSED));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/invoices/inv-1/confirm-lines")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"confirmedBy\": \"chef\", \"skipUnmatched\": true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.invoice.status").value("PROCESSED"))
            .andExpect(jsonPath("$.lines.applied[0].lineId").value("line-1"))
            .andExpect(jsonPath("$.lines.skipped[0].message").value("Not matched to an inventory item"));
    }

    @Test
    void confirmLinesKeepsInvoiceWhenALineFailed() throws Exception {
        when(lifecycleService.get("inv-1")).thenReturn(invoice(InvoiceStatus.REVIEWED));
        when(lineMatchingService.confirmAll("inv-1", null, false)).thenReturn(new BulkConfirmResult(List.of(),
            List.of(), List.of(new BulkConfirmResult.LineOutcome("line-2", 2, null,
                "Line must be matched before it is confirmed"))));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/invoices/inv-1/confirm-lines"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.invoice.status").value("REVIEWED"))
            .andExpect(jsonPath("$.lines.errors[0].lineNumber").value(2));

        verify(lifecycleService, never()).advanceIfResolved("inv-1");
    }

    @Test
    void deletesInvoice() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.delete("/api/invoices/inv-1"))
            .andExpect(status().isNoContent());

        verify(lifecycleService).delete("inv-1");
    }

    private static Invoice invoice(InvoiceStatus status) {
        return Invoice.builder()
            .id("inv-1")
            .vendorId("sysco")
            .vendorName("Sysco")
            .invoiceNumber("INV-1")
            .status(status)
            .total(new BigDecimal("100.00"))
            .createdAt(NOW)
            .build();
    }
}
