package dev.pekelund.reconcile.profile;

import dev.pekelund.reconcile.errors.ValidationException;

/**
 * Meaning a vendor invoice column can be assigned.
 */
public enum SemanticField {
    SKIP("skip", "Skip"),
    SKU("sku", "SKU / Item Code"),
    DESCRIPTION("description", "Description"),
    QUANTITY("quantity", "Quantity (delivered)"),
    ORDERED_QUANTITY("orderedQuantity", "Ordered Quantity"),
    BILLING_QUANTITY("billingQuantity", "Billing Quantity (for pricing)"),
    PIECE_COUNT("pieceCount", "Piece Count"),
    UNIT("unit", "Unit of Measure"),
    QUANTITY_UNIT("quantityUnit", "U/M (kg=weight, UN=count)"),
    WEIGHT("weight", "Weight"),
    PACKAGE_FORMAT("packageFormat", "Package Format (weight embedded)"),
    PACKAGE_UNITS("packageUnits", "Package Format (units per case)"),
    PACK_FORMAT("packFormat", "Pack Format (distributor: 4/5LB)"),
    CONTAINER_FORMAT("containerFormat", "Container Format (nested: 10/100, rolls: 6/RL)"),
    UNIT_PRICE("unitPrice", "Unit Price"),
    TOTAL_PRICE("totalPrice", "Line Total"),
    IGNORE_ROW("ignoreRow", "Ignore Row");

    private final String wireValue;
    private final String label;

    SemanticField(String wireValue, String label) {
        this.wireValue = wireValue;
        this.label = label;
    }

    public String wireValue() {
        return wireValue;
    }

    public String label() {
        return label;
    }

    /**
     * Whether a column of this type ends up in a vendor's column map.
     */
    public boolean isMapped() {
        return this != SKIP && this != IGNORE_ROW;
    }

    public static SemanticField fromWire(String value) {
        for (SemanticField field : values()) {
            if (field.wireValue.equalsIgnoreCase(value) || field.name().equalsIgnoreCase(value)) {
                return field;
            }
        }
        throw new ValidationException("Unknown column type: " + value);
    }
}
