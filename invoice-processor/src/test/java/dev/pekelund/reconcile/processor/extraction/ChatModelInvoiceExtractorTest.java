package dev.pekelund.reconcile.processor.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.reconcile.lines.CandidateLine;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.http.MediaType;

class ChatModelInvoiceExtractorTest {

    private static final byte[] DOCUMENT = "%PDF-1.4 invoice".getBytes(StandardCharsets.UTF_8);

    private ChatModel chatModel;
    private ChatModelInvoiceExtractor extractor;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        ChatOptions options = ChatOptions.builder().model("gemini-2.0-flash").temperature(0.0).build();
        extractor = new ChatModelInvoiceExtractor(chatModel, new ObjectMapper(), options);
    }

    @Test
    void readsHeaderAndLinesFromFencedJson() {
        respondWith("""
            ```json
            {
              "vendor": {"name": "Sysco Boston", "phone": "555-0100"},
              "invoiceNumber": "INV-7",
              "invoiceDate": "2026-02-28",
              "total": 52.00,
              "confidence": 0.9,
              "lines": [
                {"description": "Beef striploin", "quantity": "1", "weight": "2,5 kg", "unitPrice": "$20.80",
                 "total": "52.00", "sku": "BEEF-01", "columns": ["BEEF-01", "Beef striploin", "2,5 kg"]}
              ]
            }
            ```""");

        ExtractedInvoice extracted = extractor.extract(DOCUMENT, "sysco.pdf", null);

        assertThat(extracted.vendor().name()).isEqualTo("Sysco Boston");
        assertThat(extracted.vendor().phone()).isEqualTo("555-0100");
        assertThat(extracted.invoiceNumber()).isEqualTo("INV-7");
        assertThat(extracted.invoiceDate()).isEqualTo(LocalDate.of(2026, 2, 28));
        assertThat(extracted.total()).isEqualByComparingTo("52.00");
        assertThat(extracted.lines()).hasSize(1);
        CandidateLine line = extracted.lines().get(0);
        assertThat(line.rawWeight()).isEqualTo("2,5 kg");
        assertThat(line.rawUnitPrice()).isEqualTo("$20.80");
        assertThat(line.rawSku()).isEqualTo("BEEF-01");
        assertThat(line.sampleColumns()).containsExactly("BEEF-01", "Beef striploin", "2,5 kg");
    }

    @Test
    void promptCarriesVendorHintsAndAttachesDocument() {
        respondWith("{\"lines\": []}");

        extractor.extract(DOCUMENT, "sysco.pdf", "WEIGHT: Column 3 contains weight in kg.");

        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());
        SystemMessage system = (SystemMessage) prompt.getValue().getInstructions().get(0);
        assertThat(system.getText()).contains("WEIGHT: Column 3 contains weight in kg.");
        UserMessage user = (UserMessage) prompt.getValue().getInstructions().get(1);
        assertThat(user.getText()).contains("File name: sysco.pdf");
        assertThat(user.getMedia()).singleElement().satisfies(media -> {
            assertThat(media.getMimeType()).isEqualTo(MediaType.APPLICATION_PDF);
            assertThat(media.getData()).isEqualTo(DOCUMENT);
        });
        assertThat(prompt.getValue().getOptions().getModel()).isEqualTo("gemini-2.0-flash");
    }

    @Test
    void scannedImagesKeepTheirMimeType() {
        assertThat(ChatModelInvoiceExtractor.documentType("scan.png")).isEqualTo(MediaType.IMAGE_PNG);
        assertThat(ChatModelInvoiceExtractor.documentType("invoice.PDF")).isEqualTo(MediaType.APPLICATION_PDF);
        assertThat(ChatModelInvoiceExtractor.documentType("export.csv")).isEqualTo(MediaType.APPLICATION_PDF);
        assertThat(ChatModelInvoiceExtractor.documentType(null)).isEqualTo(MediaType.APPLICATION_PDF);
    }

    @Test
    void unparseableDateIsDropped() {
        respondWith("{\"invoiceDate\": \"28/02/2026\", \"lines\": []}");

        ExtractedInvoice extracted = extractor.extract(DOCUMENT, "sysco.pdf", null);

        assertThat(extracted.invoiceDate()).isNull();
        assertThat(extracted.lines()).isEmpty();
    }

    @Test
    void emptyResponseFails() {
        respondWith("   ");

        assertThatThrownBy(() -> extractor.extract(DOCUMENT, "sysco.pdf", null))
            .isInstanceOf(InvoiceExtractionException.class)
            .hasMessageContaining("empty response");
    }

    @Test
    void nonJsonResponseFails() {
        respondWith("I could not read this invoice.");

        assertThatThrownBy(() -> extractor.extract(DOCUMENT, "sysco.pdf", null))
            .isInstanceOf(InvoiceExtractionException.class)
            .hasMessageContaining("could not be parsed");
    }

    @Test
    void emptyDocumentIsRejectedWithoutCallingModel() {
        assertThatThrownBy(() -> extractor.extract(new byte[0], "empty.pdf", null))
            .isInstanceOf(InvoiceExtractionException.class);
        verifyNoInteractions(chatModel);
    }

    @Test
    void sanitiseStripsFencesAndBackticks() {
        assertThat(ChatModelInvoiceExtractor.sanitiseResponse("```json\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
        assertThat(ChatModelInvoiceExtractor.sanitiseResponse("`{\"a\":1}`")).isEqualTo("{\"a\":1}");
        assertThat(ChatModelInvoiceExtractor.sanitiseResponse("  {\"a\":1}  ")).isEqualTo("{\"a\":1}");
    }

    private void respondWith(String text) {
        when(chatModel.call(any(Prompt.class)))
            .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage(text)))));
    }
}
