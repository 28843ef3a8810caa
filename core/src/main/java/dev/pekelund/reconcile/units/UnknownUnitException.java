package dev.pekelund.reconcile.units;

import dev.pekelund.reconcile.errors.ValidationException;

public class UnknownUnitException extends ValidationException {

    private final String unit;

    public UnknownUnitException(String unit) {
        super("Unknown unit: '" + unit + "'");
        this.unit = unit;
    }

    public String getUnit() {
        return unit;
    }
}
