package dev.pekelund.reconcile.units;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Parsed pack or container notation from a vendor invoice line. Each implementation carries the
 * fields that are meaningful for its {@link Kind}.
 */
public interface PackFormat {

    Kind kind();

    /**
     * The notation as it appeared on the invoice.
     */
    String raw();

    /**
     * Base quantity contained in one case, when the notation resolves to one.
     */
    Optional<BaseQuantity> quantityPerCase();

    default boolean requiresReview() {
        return kind() == Kind.NEEDS_REVIEW;
    }

    enum Kind {
        PACK_WEIGHT("packWeight"),
        MULTIPLIER("multiplier"),
        NESTED_UNITS("nestedUnits"),
        SIMPLE_CASE("simpleCase"),
        ROLL_COUNT("rollCount"),
        COUNT_PACK("countPack"),
        SIMPLE_MEASURE("simpleMeasure"),
        NEEDS_REVIEW("needsReview"),
        UNRECOGNIZED("unrecognized");

        private final String wireValue;

        Kind(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }

        public static Kind fromWire(String value) {
            for (Kind kind : values()) {
                if (kind.wireValue.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                    return kind;
                }
            }
            return UNRECOGNIZED;
        }
    }

    /**
     * Distributor notation such as {@code 4/5LB} or {@code 4x5lb}: {@code packCount} packs of
     * {@code unitValue} {@code unit} each.
     */
    record PackWeight(String raw, boolean multiplier, int packCount, BigDecimal unitValue, MeasurementUnit unit)
        implements PackFormat {

        @Override
        public Kind kind() {
            return multiplier ? Kind.MULTIPLIER : Kind.PACK_WEIGHT;
        }

        @Override
        public Optional<BaseQuantity> quantityPerCase() {
            return Optional.of(UnitConverter.convert(unitValue.multiply(BigDecimal.valueOf(packCount)), unit));
        }
    }

    /**
     * Container notation {@code 10/100}: {@code outer} inner packs of {@code inner} units.
     */
    record NestedUnits(String raw, int outer, int inner) implements PackFormat {

        @Override
        public Kind kind() {
            return Kind.NESTED_UNITS;
        }

        public long totalUnits() {
            return (long) outer * inner;
        }

        @Override
        public Optional<BaseQuantity> quantityPerCase() {
            return Optional.of(BaseQuantity.count(totalUnits()));
        }
    }

    /**
     * Container notation {@code 1/500}: a single pack of {@code inner} units.
     */
    record SimpleCase(String raw, int inner) implements PackFormat {

        @Override
        public Kind kind() {
            return Kind.SIMPLE_CASE;
        }

        @Override
        public Optional<BaseQuantity> quantityPerCase() {
            return Optional.of(BaseQuantity.count(inner));
        }
    }

    record RollCount(String raw, int count) implements PackFormat {

        @Override
        public Kind kind() {
            return Kind.ROLL_COUNT;
        }

        @Override
        public Optional<BaseQuantity> quantityPerCase() {
            return Optional.of(BaseQuantity.count(count));
        }
    }

    /**
     * Count packs such as {@code 12CT}, {@code 24PK} or {@code 2DZ} (already expanded to 24).
     */
    record CountPack(String raw, int count) implements PackFormat {

        @Override
        public Kind kind() {
            return Kind.COUNT_PACK;
        }

        @Override
        public Optional<BaseQuantity> quantityPerCase() {
            return Optional.of(BaseQuantity.count(count));
        }
    }

    /**
     * A single measured package, optionally named by its container: {@code 50LB}, {@code Caisse 5lb}.
     */
    record SimpleMeasure(String raw, String container, BigDecimal value, MeasurementUnit unit) implements PackFormat {

        @Override
        public Kind kind() {
            return Kind.SIMPLE_MEASURE;
        }

        @Override
        public Optional<BaseQuantity> quantityPerCase() {
            return Optional.of(UnitConverter.convert(value, unit));
        }
    }

    /**
     * A package value without a unit, e.g. {@code Caisse 24}. It could be a count or a weight, so it is
     * never resolved automatically.
     */
    record NeedsReview(String raw, BigDecimal value, String reason) implements PackFormat {

        @Override
        public Kind kind() {
            return Kind.NEEDS_REVIEW;
        }

        @Override
        public Optional<BaseQuantity> quantityPerCase() {
            return Optional.empty();
        }
    }

    record Unrecognized(String raw) implements PackFormat {

        @Override
        public Kind kind() {
            return Kind.UNRECOGNIZED;
        }

        @Override
        public Optional<BaseQuantity> quantityPerCase() {
            return Optional.empty();
        }
    }
}
