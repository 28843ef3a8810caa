package dev.pekelund.reconcile.units;

/**
 * Canonical units every quantity is normalized to before prices are compared.
 */
public enum BaseUnit {
    GRAM("g"),
    MILLILITER("ml"),
    COUNT("count");

    private final String symbol;

    BaseUnit(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static BaseUnit fromSymbol(String symbol) {
        for (BaseUnit unit : values()) {
            if (unit.symbol.equalsIgnoreCase(symbol)) {
                return unit;
            }
        }
        throw new UnknownUnitException(symbol);
    }
}
