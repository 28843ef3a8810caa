package dev.pekelund.reconcile.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.pekelund.reconcile.invoices.DuplicateInvoiceDetector;
import dev.pekelund.reconcile.invoices.InvoiceRepository;
import dev.pekelund.reconcile.lines.InventoryMatcher;
import dev.pekelund.reconcile.lines.LineInterpreter;
import dev.pekelund.reconcile.lines.PriceChangePolicy;
import dev.pekelund.reconcile.pricing.LinePriceNormalizer;
import dev.pekelund.reconcile.pricing.PricingModelDetector;
import dev.pekelund.reconcile.profile.PromptHintGenerator;
import dev.pekelund.reconcile.units.PackFormatParser;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Domain components shared by every profile.
 */
@Configuration
@EnableConfigurationProperties(ReconciliationProperties.class)
public class ReconciliationConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PricingModelDetector pricingModelDetector(ReconciliationProperties properties) {
        ReconciliationProperties.Pricing pricing = properties.getPricing();
        LOGGER.info("Pricing detection tolerance: relative {}, absolute {}", pricing.getRelativeTolerance(),
            pricing.getAbsoluteTolerance());
        return new PricingModelDetector(pricing.toTolerance());
    }

    @Bean
    public PackFormatParser packFormatParser() {
        return new PackFormatParser();
    }

    @Bean
    public LineInterpreter lineInterpreter(PricingModelDetector pricingModelDetector,
        PackFormatParser packFormatParser) {
        return new LineInterpreter(pricingModelDetector, new LinePriceNormalizer(), packFormatParser);
    }

    @Bean
    public PromptHintGenerator promptHintGenerator() {
        return new PromptHintGenerator();
    }

    @Bean
    public DuplicateInvoiceDetector duplicateInvoiceDetector(InvoiceRepository invoiceRepository) {
        return new DuplicateInvoiceDetector(invoiceRepository);
    }

    @Bean
    public PriceChangePolicy priceChangePolicy(ReconciliationProperties properties) {
        LOGGER.info("Price change discrepancy threshold: {}", properties.getMatching().getDiscrepancyThreshold());
        return new PriceChangePolicy(properties.getMatching().getDiscrepancyThreshold());
    }

    @Bean
    public InventoryMatcher inventoryMatcher(ReconciliationProperties properties) {
        LOGGER.info("Auto match threshold: {}", properties.getMatching().getAutoMatchThreshold());
        return new InventoryMatcher(properties.getMatching().getAutoMatchThreshold());
    }
}
