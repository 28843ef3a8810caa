package dev.pekelund.reconcile.processor.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class GeminiChatModelTest {

    private static final byte[] DOCUMENT = "%PDF-1.4 invoice".getBytes(StandardCharsets.UTF_8);

    private MockRestServiceServer server;
    private GeminiChatModel model;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://gemini.test/v1beta");
        server = MockRestServiceServer.bindTo(builder).build();
        ChatOptions options = ChatOptions.builder().model("gemini-2.0-flash").temperature(0.0).build();
        model = new GeminiChatModel(builder.build(), "test-key", options,
            InvoiceResponseSchema.create(new ObjectMapper()), null);
    }

    @Test
    void sendsInstructionsDocumentAndInvoiceSchema() {
        server.expect(requestTo(containsString("/models/gemini-2.0-flash:generateContent")))
            .andExpect(method(HttpMethod.POST))
            .andExpect(queryParam("key", "test-key"))
            .andExpect(jsonPath("$.system_instruction.parts[0].text").value(containsString("vendor invoices")))
            .andExpect(jsonPath("$.contents[0].role").value("user"))
            .andExpect(jsonPath("$.contents[0].parts[0].text").value("File name: sysco.pdf"))
            .andExpect(jsonPath("$.contents[0].parts[1].inline_data.mime_type").value("application/pdf"))
            .andExpect(jsonPath("$.contents[0].parts[1].inline_data.data")
                .value(Base64.getEncoder().encodeToString(DOCUMENT)))
            .andExpect(jsonPath("$.generationConfig.responseMimeType").value("application/json"))
            .andExpect(jsonPath("$.generationConfig.responseSchema.properties.lines.items.properties.weight.type")
                .value("STRING"))
            .andExpect(jsonPath("$.generationConfig.temperature").value(0.0))
            .andRespond(withSuccess("""
                {
                  "candidates": [
                    {"content": {"role": "model", "parts": [{"text": "{\\"lines\\": []}"}]}, "finishReason": "STOP"}
                  ],
                  "usageMetadata": {"promptTokenCount": 812, "candidatesTokenCount": 9, "totalTokenCount": 821}
                }
                """, MediaType.APPLICATION_JSON));

        ChatResponse response = model.call(invoicePrompt());

        assertThat(response.getResult().getOutput().getText()).isEqualTo("{\"lines\": []}");
        server.verify();
    }

    @Test
    void truncatedAnswerFailsTheExtraction() {
        server.expect(requestTo(containsString(":generateContent")))
            .andRespond(withSuccess("""
                {"candidates": [{"content": {"parts": [{"text": "{\\"lines\\": [{\\"descr"}]},
                  "finishReason": "MAX_TOKENS"}]}
                """, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> model.call(invoicePrompt()))
            .isInstanceOf(InvoiceExtractionException.class)
            .hasMessageContaining("output token limit");
    }

    @Test
    void blockedDocumentFailsTheExtraction() {
        server.expect(requestTo(containsString(":generateContent")))
            .andRespond(withSuccess("{\"promptFeedback\": {\"blockReason\": \"SAFETY\"}}",
                MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> model.call(invoicePrompt()))
            .isInstanceOf(InvoiceExtractionException.class)
            .hasMessageContaining("SAFETY");
    }

    @Test
    void rejectedRequestIsReportedAsExtractionFailure() {
        server.expect(requestTo(containsString(":generateContent")))
            .andRespond(withBadRequest().body("{\"error\": {\"message\": \"Unsupported MIME type\"}}")
                .contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> model.call(invoicePrompt()))
            .isInstanceOf(InvoiceExtractionException.class)
            .hasMessageContaining("400");
    }

    @Test
    void modelMustBeConfigured() {
        GeminiChatModel unconfigured = new GeminiChatModel(RestClient.builder().build(), "test-key",
            ChatOptions.builder().build(), null, null);

        assertThatThrownBy(() -> unconfigured.call(invoicePrompt()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("model name");
    }

    private static Prompt invoicePrompt() {
        return new Prompt(List.of(
            new SystemMessage("You are an expert system that extracts line items from vendor invoices."),
            UserMessage.builder()
                .text("File name: sysco.pdf")
                .media(Media.builder().mimeType(MediaType.APPLICATION_PDF).data(DOCUMENT).build())
                .build()));
    }
}
