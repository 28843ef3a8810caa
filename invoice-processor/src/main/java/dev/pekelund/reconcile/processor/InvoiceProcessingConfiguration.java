package dev.pekelund.reconcile.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import dev.pekelund.reconcile.inventory.InventoryGateway;
import dev.pekelund.reconcile.invoices.InvoiceRepository;
import dev.pekelund.reconcile.lines.ConfirmationUnitOfWork;
import dev.pekelund.reconcile.lines.InvoiceLineRepository;
import dev.pekelund.reconcile.processor.extraction.ChatModelInvoiceExtractor;
import dev.pekelund.reconcile.processor.extraction.GeminiChatModel;
import dev.pekelund.reconcile.processor.extraction.InvoiceLineExtractor;
import dev.pekelund.reconcile.processor.extraction.InvoiceResponseSchema;
import dev.pekelund.reconcile.processor.firestore.FirestoreConfirmationUnitOfWork;
import dev.pekelund.reconcile.processor.firestore.FirestoreInventoryGateway;
import dev.pekelund.reconcile.processor.firestore.FirestoreInvoiceLineRepository;
import dev.pekelund.reconcile.processor.firestore.FirestoreInvoiceRepository;
import dev.pekelund.reconcile.processor.firestore.FirestoreParsingProfileRepository;
import dev.pekelund.reconcile.profile.ParsingProfileRepository;
import io.micrometer.observation.ObservationRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Production wiring: Firestore persistence and Gemini extraction.
 */
@Configuration
@Profile("!local")
public class InvoiceProcessingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceProcessingConfiguration.class);

    @Bean
    public InvoiceProcessingSettings invoiceProcessingSettings() {
        return InvoiceProcessingSettings.fromEnvironment();
    }

    @Bean
    public Firestore firestore(InvoiceProcessingSettings settings) {
        FirestoreOptions.Builder optionsBuilder = FirestoreOptions.getDefaultInstance().toBuilder();
        if (StringUtils.hasText(settings.projectId())) {
            optionsBuilder.setProjectId(settings.projectId());
        }
        if (StringUtils.hasText(settings.databaseId())) {
            optionsBuilder.setDatabaseId(settings.databaseId());
        }
        Firestore firestore = optionsBuilder.build().getService();
        LOGGER.info("Initialized Firestore client for project '{}' database '{}'",
            firestore.getOptions().getProjectId(), settings.databaseId());
        return firestore;
    }

    @Bean
    public InvoiceRepository invoiceRepository(Firestore firestore, InvoiceProcessingSettings settings) {
        return new FirestoreInvoiceRepository(firestore, settings.invoicesCollection());
    }

    @Bean
    public InvoiceLineRepository invoiceLineRepository(Firestore firestore, InvoiceProcessingSettings settings) {
        return new FirestoreInvoiceLineRepository(firestore, settings.lineItemsCollection());
    }

    @Bean
    public ParsingProfileRepository parsingProfileRepository(Firestore firestore,
        InvoiceProcessingSettings settings) {
        return new FirestoreParsingProfileRepository(firestore, settings.profilesCollection());
    }

    @Bean
    public InventoryGateway inventoryGateway(Firestore firestore, InvoiceProcessingSettings settings, Clock clock) {
        return new FirestoreInventoryGateway(firestore, settings.inventoryCollection(),
            settings.priceHistoryCollection(), clock);
    }

    @Bean
    public ConfirmationUnitOfWork confirmationUnitOfWork(Firestore firestore, InvoiceProcessingSettings settings,
        Clock clock) {
        return new FirestoreConfirmationUnitOfWork(firestore, settings.lineItemsCollection(),
            settings.inventoryCollection(), settings.priceHistoryCollection(), clock);
    }

    @Bean
    public ChatOptions extractionChatOptions(ReconciliationProperties properties) {
        ReconciliationProperties.Extraction extraction = properties.getExtraction();
        LOGGER.info("Configured extraction chat settings - model: {}, temperature: {}", extraction.getModel(),
            extraction.getTemperature());
        return ChatOptions.builder()
            .model(extraction.getModel())
            .temperature(extraction.getTemperature())
            .build();
    }

    @Bean
    @Primary
    public GeminiChatModel geminiChatModel(Environment environment, ChatOptions extractionChatOptions,
        ObjectMapper objectMapper, ObjectProvider<ObservationRegistry> observationRegistry) {

        String apiKey = environment.getProperty("AI_STUDIO_API_KEY");
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalStateException("Google AI Studio API key must be configured (AI_STUDIO_API_KEY)");
        }
        String baseUrl = environment.getProperty("reconciliation.extraction.base-url",
            GeminiChatModel.DEFAULT_BASE_URL);
        RestClient restClient = RestClient.builder().baseUrl(baseUrl).build();
        return new GeminiChatModel(restClient, apiKey, extractionChatOptions,
            InvoiceResponseSchema.create(objectMapper),
            observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }

    @Bean
    public InvoiceLineExtractor invoiceLineExtractor(ChatModel chatModel, ObjectMapper objectMapper,
        ChatOptions extractionChatOptions) {
        return new ChatModelInvoiceExtractor(chatModel, objectMapper, extractionChatOptions);
    }
}
