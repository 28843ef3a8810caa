package dev.pekelund.reconcile.profile;

import dev.pekelund.reconcile.errors.ValidationException;

/**
 * Layout peculiarities a vendor's invoices can have.
 */
public enum QuirkFlag {
    HAS_DEPOSITS("hasDeposits"),
    WEIGHT_IN_DESCRIPTION("weightInDescription"),
    WEIGHT_IN_PACKAGE_FORMAT("weightInPackageFormat"),
    SKU_IN_DESCRIPTION("skuInDescription"),
    MULTIPLE_PAGES("multiplePages"),
    CONTAINER_DISTRIBUTOR("isContainerDistributor"),
    NESTED_UNITS("hasNestedUnits"),
    ROLL_PRODUCTS("hasRollProducts"),
    CONTAINER_CAPACITY("hasContainerCapacity");

    private final String wireValue;

    QuirkFlag(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static QuirkFlag fromWire(String value) {
        for (QuirkFlag flag : values()) {
            if (flag.wireValue.equalsIgnoreCase(value) || flag.name().equalsIgnoreCase(value)) {
                return flag;
            }
        }
        throw new ValidationException("Unknown invoice quirk: " + value);
    }
}
