package dev.pekelund.reconcile.processor.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.http.MediaType;
import org.springframework.util.Assert;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import reactor.core.publisher.Flux;

/**
 * Invoice extraction model backed by the Google AI Studio {@code generateContent} endpoint.
 *
 * <p>System messages become the request's system instruction and user message media (the invoice
 * PDF or scan) is sent as {@code inline_data}. When a response schema is configured the model is
 * constrained to the extracted invoice document. Truncated or blocked answers are raised as
 * {@link InvoiceExtractionException} so the ingestion marks the invoice as failed instead of
 * parsing half a line table.
 */
public class GeminiChatModel implements ChatModel {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiChatModel.class);

    private static final Set<String> REJECTED_FINISH_REASONS = Set.of("SAFETY", "RECITATION", "BLOCKLIST",
        "PROHIBITED_CONTENT");

    private final RestClient restClient;
    private final String apiKey;
    private final ChatOptions defaultOptions;
    private final JsonNode responseSchema;
    private final ObservationRegistry observationRegistry;

    public GeminiChatModel(RestClient restClient, String apiKey, ChatOptions defaultOptions,
        JsonNode responseSchema, ObservationRegistry observationRegistry) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null ? defaultOptions : ChatOptions.builder().build();
        this.responseSchema = responseSchema;
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public ChatResponse call(Prompt prompt) {
        Assert.notNull(prompt, "Prompt must not be null");
        ChatOptions options = resolveOptions(prompt.getOptions());
        String model = options.getModel();
        if (!StringUtils.hasText(model)) {
            throw new IllegalStateException("Gemini model name must be configured");
        }
        GenerateContentRequest request = buildRequest(prompt.getInstructions(), options);

        Observation observation = Observation.start("invoice.extraction.gemini", observationRegistry)
            .lowCardinalityKeyValue("model", model);
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Extracting with Gemini model '{}': {} content block(s), {} inline document(s)", model,
                request.contents().size(), request.inlineDocumentCount());
            GenerateContentResponse response = execute(model, request);
            String text = readAnswer(response);
            Candidate candidate = response.candidates().get(0);
            observation.lowCardinalityKeyValue("finish-reason", String.valueOf(candidate.finishReason()));
            if (response.usageMetadata() != null) {
                LOGGER.info("Gemini usage - prompt tokens: {}, answer tokens: {}, total: {}",
                    response.usageMetadata().promptTokenCount(), response.usageMetadata().candidatesTokenCount(),
                    response.usageMetadata().totalTokenCount());
            }
            return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    @Override
    public Flux<ChatResponse> stream(Prompt prompt) {
        return Flux.error(new UnsupportedOperationException("Invoice extraction does not stream"));
    }

    @Override
    public ChatOptions getDefaultOptions() {
        return defaultOptions;
    }

    private ChatOptions resolveOptions(ChatOptions promptOptions) {
        if (promptOptions == null) {
            return defaultOptions;
        }
        return ChatOptions.builder()
            .model(firstNonNull(promptOptions.getModel(), defaultOptions.getModel()))
            .temperature(firstNonNull(promptOptions.getTemperature(), defaultOptions.getTemperature()))
            .topP(firstNonNull(promptOptions.getTopP(), defaultOptions.getTopP()))
            .topK(firstNonNull(promptOptions.getTopK(), defaultOptions.getTopK()))
            .maxTokens(firstNonNull(promptOptions.getMaxTokens(), defaultOptions.getMaxTokens()))
            .build();
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    GenerateContentRequest buildRequest(List<Message> messages, ChatOptions options) {
        if (CollectionUtils.isEmpty(messages)) {
            throw new IllegalArgumentException("Prompt must contain at least one message");
        }
        List<Part> systemParts = new ArrayList<>();
        List<Content> contents = new ArrayList<>();
        for (Message message : messages) {
            if (message instanceof SystemMessage system) {
                if (StringUtils.hasText(system.getText())) {
                    systemParts.add(Part.text(system.getText()));
                }
            } else if (message instanceof UserMessage user) {
                List<Part> parts = new ArrayList<>();
                if (StringUtils.hasText(user.getText())) {
                    parts.add(Part.text(user.getText()));
                }
                for (Media media : user.getMedia()) {
                    parts.add(Part.inline(media));
                }
                contents.add(new Content("user", parts));
            } else if (message instanceof AssistantMessage assistant) {
                contents.add(new Content("model", List.of(Part.text(assistant.getText()))));
            }
        }
        if (contents.isEmpty()) {
            throw new IllegalArgumentException("Prompt must contain a user message");
        }
        GenerationConfig generationConfig = new GenerationConfig(options.getTemperature(), options.getTopP(),
            options.getTopK(), options.getMaxTokens(), MediaType.APPLICATION_JSON_VALUE, responseSchema);
        Content systemInstruction = systemParts.isEmpty() ? null : new Content(null, systemParts);
        return new GenerateContentRequest(systemInstruction, contents, generationConfig);
    }

    private GenerateContentResponse execute(String model, GenerateContentRequest request) {
        try {
            return restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}:generateContent")
                    .queryParam("key", apiKey)
                    .build(model))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientResponseException ex) {
            LOGGER.error("Gemini call failed with status {} and body {}", ex.getStatusCode(),
                ex.getResponseBodyAsString());
            throw new InvoiceExtractionException("Gemini rejected the extraction request (" + ex.getStatusCode() + ")",
                ex);
        } catch (RestClientException ex) {
            throw new InvoiceExtractionException("Gemini request failed", ex);
        }
    }

    private static String readAnswer(GenerateContentResponse response) {
        if (response == null) {
            throw new InvoiceExtractionException("Gemini returned an empty response");
        }
        if (response.promptFeedback() != null && StringUtils.hasText(response.promptFeedback().blockReason())) {
            throw new InvoiceExtractionException(
                "Gemini blocked the invoice document: " + response.promptFeedback().blockReason());
        }
        if (CollectionUtils.isEmpty(response.candidates()) || response.candidates().get(0) == null) {
            throw new InvoiceExtractionException("Gemini response did not contain any candidates");
        }
        Candidate candidate = response.candidates().get(0);
        String finishReason = candidate.finishReason();
        if ("MAX_TOKENS".equals(finishReason)) {
            throw new InvoiceExtractionException(
                "Gemini stopped at the output token limit; the line table would be incomplete");
        }
        if (finishReason != null && REJECTED_FINISH_REASONS.contains(finishReason)) {
            throw new InvoiceExtractionException("Gemini refused to answer for the invoice document: " + finishReason);
        }
        String text = candidate.text();
        if (!StringUtils.hasText(text)) {
            throw new InvoiceExtractionException("Gemini response did not contain any text parts");
        }
        return text;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerateContentRequest(@JsonProperty("system_instruction") Content systemInstruction,
        List<Content> contents, GenerationConfig generationConfig) {

        long inlineDocumentCount() {
            return contents.stream()
                .flatMap(content -> content.parts().stream())
                .filter(part -> part.inlineData() != null)
                .count();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Content(String role, List<Part> parts) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text, @JsonProperty("inline_data") InlineData inlineData) {

        static Part text(String value) {
            return new Part(value != null ? value : "", null);
        }

        static Part inline(Media media) {
            if (!(media.getData() instanceof byte[] bytes)) {
                throw new InvoiceExtractionException(
                    "Invoice documents must be attached as bytes, got " + media.getData().getClass().getSimpleName());
            }
            return new Part(null, new InlineData(media.getMimeType().toString(),
                Base64.getEncoder().encodeToString(bytes)));
        }
    }

    record InlineData(@JsonProperty("mime_type") String mimeType, String data) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens,
        String responseMimeType, JsonNode responseSchema) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateContentResponse(List<Candidate> candidates, PromptFeedback promptFeedback,
        UsageMetadata usageMetadata) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content, String finishReason) {

        String text() {
            if (content == null || CollectionUtils.isEmpty(content.parts())) {
                return null;
            }
            return content.parts().stream()
                .map(Part::text)
                .filter(Objects::nonNull)
                .collect(Collectors.joining());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PromptFeedback(String blockReason) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UsageMetadata(Integer promptTokenCount, Integer candidatesTokenCount, Integer totalTokenCount) {
    }
}
