package dev.pekelund.reconcile.classification;

import dev.pekelund.reconcile.profile.SemanticField;
import java.util.ArrayList;
import java.util.List;
import org.springframework.util.StringUtils;

/**
 * Steps of the column classification wizard, each with the checks that gate advancing past it.
 */
public enum ClassificationStep {

    VENDOR_IDENTITY {
        @Override
        public List<String> validate(ColumnClassificationWizard wizard) {
            if (!StringUtils.hasText(wizard.vendorName())) {
                return List.of("Vendor name is required");
            }
            return List.of();
        }
    },

    INVOICE_QUIRKS {
        @Override
        public List<String> validate(ColumnClassificationWizard wizard) {
            return List.of();
        }
    },

    COLUMN_ASSIGNMENT {
        @Override
        public List<String> validate(ColumnClassificationWizard wizard) {
            List<String> errors = new ArrayList<>();
            if (!wizard.hasColumn(SemanticField.DESCRIPTION)) {
                errors.add("At least one column must be mapped to Description");
            }
            if (!wizard.hasColumn(SemanticField.TOTAL_PRICE)) {
                errors.add("At least one column must be mapped to Line Total");
            }
            return errors;
        }
    },

    SAMPLE_VERIFICATION {
        @Override
        public List<String> validate(ColumnClassificationWizard wizard) {
            return List.of();
        }
    };

    public abstract List<String> validate(ColumnClassificationWizard wizard);

    public boolean isLast() {
        return ordinal() == values().length - 1;
    }

    public ClassificationStep next() {
        return isLast() ? this : values()[ordinal() + 1];
    }

    public ClassificationStep previous() {
        return ordinal() == 0 ? this : values()[ordinal() - 1];
    }
}
