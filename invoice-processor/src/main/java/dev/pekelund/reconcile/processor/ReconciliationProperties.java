package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.lines.PriceChangePolicy;
import dev.pekelund.reconcile.pricing.PricingTolerance;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    private final Pricing pricing = new Pricing();

    private final Matching matching = new Matching();

    private final Extraction extraction = new Extraction();

    public Pricing getPricing() {
        return pricing;
    }

    public Matching getMatching() {
        return matching;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public static class Pricing {

        /**
         * Allowed difference between a computed and a printed line total, as a fraction of the total.
         */
        private BigDecimal relativeTolerance = PricingTolerance.DEFAULT_RELATIVE;

        /**
         * Allowed difference between a computed and a printed line total, in currency.
         */
        private BigDecimal absoluteTolerance = PricingTolerance.DEFAULT_ABSOLUTE;

        public BigDecimal getRelativeTolerance() {
            return relativeTolerance;
        }

        public void setRelativeTolerance(BigDecimal relativeTolerance) {
            this.relativeTolerance = relativeTolerance;
        }

        public BigDecimal getAbsoluteTolerance() {
            return absoluteTolerance;
        }

        public void setAbsoluteTolerance(BigDecimal absoluteTolerance) {
            this.absoluteTolerance = absoluteTolerance;
        }

        public PricingTolerance toTolerance() {
            return new PricingTolerance(relativeTolerance, absoluteTolerance);
        }
    }

    public static class Matching {

        /**
         * Relative price change on confirmation above which a line is flagged as a discrepancy.
         */
        private BigDecimal discrepancyThreshold = PriceChangePolicy.DEFAULT_THRESHOLD;

        /**
         * Lowest match confidence, out of 100, that links a line automatically.
         */
        private int autoMatchThreshold = 80;

        public BigDecimal getDiscrepancyThreshold() {
            return discrepancyThreshold;
        }

        public void setDiscrepancyThreshold(BigDecimal discrepancyThreshold) {
            this.discrepancyThreshold = discrepancyThreshold;
        }

        public int getAutoMatchThreshold() {
            return autoMatchThreshold;
        }

        public void setAutoMatchThreshold(int autoMatchThreshold) {
            this.autoMatchThreshold = autoMatchThreshold;
        }
    }

    public static class Extraction {

        /**
         * Gemini model used to extract invoice lines.
         */
        private String model = "gemini-2.0-flash";

        private Double temperature;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }
    }
}
