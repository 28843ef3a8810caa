package dev.pekelund.reconcile.pricing;

import dev.pekelund.reconcile.errors.ValidationException;

/**
 * How a single invoice line is priced, as decided by {@link PricingModelDetector}.
 */
public enum PricingModel {
    WEIGHT("weight"),
    QUANTITY("quantity"),
    UNDETERMINED("undetermined");

    private final String wireValue;

    PricingModel(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static PricingModel fromWire(String value) {
        for (PricingModel model : values()) {
            if (model.wireValue.equalsIgnoreCase(value) || model.name().equalsIgnoreCase(value)) {
                return model;
            }
        }
        throw new ValidationException("Unknown pricing model: " + value);
    }
}
