package dev.pekelund.reconcile.units;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Units accepted on vendor invoices together with their factor to the matching {@link BaseUnit}.
 * Aliases are matched case-insensitively and the first alias is the canonical symbol.
 */
public enum MeasurementUnit {
    MILLIGRAM(BaseUnit.GRAM, "0.001", "mg", "milligram", "milligrams"),
    GRAM(BaseUnit.GRAM, "1", "g", "gr", "gram", "grams", "gramme", "grammes"),
    KILOGRAM(BaseUnit.GRAM, "1000", "kg", "kgs", "kilo", "kilos", "kilogram", "kilograms"),
    OUNCE(BaseUnit.GRAM, "28.3495", "oz", "ounce", "ounces"),
    POUND(BaseUnit.GRAM, "453.592", "lb", "lbs", "pound", "pounds", "livre", "livres"),
    MILLILITER(BaseUnit.MILLILITER, "1", "ml", "milliliter", "milliliters", "millilitre", "millilitres"),
    CENTILITER(BaseUnit.MILLILITER, "10", "cl", "centiliter", "centilitre"),
    DECILITER(BaseUnit.MILLILITER, "100", "dl", "deciliter", "decilitre"),
    LITER(BaseUnit.MILLILITER, "1000", "l", "lt", "liter", "liters", "litre", "litres"),
    EACH(BaseUnit.COUNT, "1", "ea", "each", "unit", "units", "un", "unite", "unité", "pc", "pcs", "piece", "pieces",
        "portion", "portions", "ct", "count");

    private static final Map<String, MeasurementUnit> BY_ALIAS = new HashMap<>();

    static {
        for (MeasurementUnit unit : values()) {
            for (String alias : unit.aliases) {
                BY_ALIAS.put(alias, unit);
            }
        }
    }

    private final BaseUnit baseUnit;
    private final BigDecimal factor;
    private final List<String> aliases;

    MeasurementUnit(BaseUnit baseUnit, String factor, String... aliases) {
        this.baseUnit = baseUnit;
        this.factor = new BigDecimal(factor);
        this.aliases = List.of(aliases);
    }

    public BaseUnit baseUnit() {
        return baseUnit;
    }

    /**
     * Number of base units in one of this unit.
     */
    public BigDecimal factor() {
        return factor;
    }

    public String symbol() {
        return aliases.get(0);
    }

    public boolean isMass() {
        return baseUnit == BaseUnit.GRAM;
    }

    public boolean isVolume() {
        return baseUnit == BaseUnit.MILLILITER;
    }

    public boolean isMeasurable() {
        return baseUnit != BaseUnit.COUNT;
    }

    public static Optional<MeasurementUnit> find(String unit) {
        if (unit == null) {
            return Optional.empty();
        }
        String normalized = unit.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return Optional.ofNullable(BY_ALIAS.get(normalized));
    }

    public static MeasurementUnit of(String unit) {
        return find(unit).orElseThrow(() -> new UnknownUnitException(unit));
    }
}
