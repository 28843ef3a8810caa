package dev.pekelund.reconcile.profile;

import dev.pekelund.reconcile.errors.ValidationException;

public enum PackageFormatKind {
    DISTRIBUTOR("distributor"),
    WEIGHT("weight"),
    UNITS("units"),
    CONTAINER("container");

    private final String wireValue;

    PackageFormatKind(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static PackageFormatKind fromWire(String value) {
        for (PackageFormatKind kind : values()) {
            if (kind.wireValue.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new ValidationException("Unknown package format: " + value);
    }
}
