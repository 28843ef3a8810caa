package dev.pekelund.reconcile.processor.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.reconcile.invoices.InvoiceRepository;
import dev.pekelund.reconcile.lines.ConfirmationUnitOfWork;
import dev.pekelund.reconcile.lines.InvoiceLineRepository;
import dev.pekelund.reconcile.processor.extraction.ChatModelInvoiceExtractor;
import dev.pekelund.reconcile.processor.extraction.InvoiceLineExtractor;
import dev.pekelund.reconcile.profile.ParsingProfileRepository;
import java.time.Clock;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

/**
 * Wiring for the {@code local} profile: everything in memory and no extraction model.
 */
@Configuration
@Profile("local")
public class LocalInvoiceProcessingConfiguration {

    @Bean
    @Primary
    public ChatModel chatModel() {
        return new NoopChatModel();
    }

    @Bean
    public InvoiceLineExtractor invoiceLineExtractor(ChatModel chatModel, ObjectMapper objectMapper) {
        return new ChatModelInvoiceExtractor(chatModel, objectMapper, chatModel.getDefaultOptions());
    }

    @Bean
    public InvoiceRepository invoiceRepository() {
        return new InMemoryInvoiceRepository();
    }

    @Bean
    public InvoiceLineRepository invoiceLineRepository() {
        return new InMemoryInvoiceLineRepository();
    }

    @Bean
    public ParsingProfileRepository parsingProfileRepository() {
        return new InMemoryParsingProfileRepository();
    }

    @Bean
    public InMemoryInventoryStore inventoryGateway(Clock clock) {
        return new InMemoryInventoryStore(clock);
    }

    @Bean
    public ConfirmationUnitOfWork confirmationUnitOfWork(InMemoryInventoryStore inventoryGateway,
        InvoiceLineRepository invoiceLineRepository, Clock clock) {
        return new InMemoryConfirmationUnitOfWork(inventoryGateway, invoiceLineRepository, clock);
    }
}
