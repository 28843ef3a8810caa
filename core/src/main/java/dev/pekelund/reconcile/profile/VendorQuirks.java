package dev.pekelund.reconcile.profile;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable set of {@link QuirkFlag}s with named accessors.
 */
public record VendorQuirks(Set<QuirkFlag> flags) {

    private static final VendorQuirks NONE = new VendorQuirks(Set.of());

    public VendorQuirks {
        flags = flags == null || flags.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(QuirkFlag.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public static VendorQuirks none() {
        return NONE;
    }

    public static VendorQuirks of(QuirkFlag... flags) {
        return new VendorQuirks(flags.length == 0 ? Set.of() : EnumSet.of(flags[0], flags));
    }

    public static VendorQuirks of(Collection<QuirkFlag> flags) {
        return new VendorQuirks(flags == null || flags.isEmpty() ? Set.of() : EnumSet.copyOf(flags));
    }

    public boolean contains(QuirkFlag flag) {
        return flags.contains(flag);
    }

    public VendorQuirks with(QuirkFlag flag) {
        EnumSet<QuirkFlag> updated = EnumSet.noneOf(QuirkFlag.class);
        updated.addAll(flags);
        updated.add(flag);
        return new VendorQuirks(updated);
    }

    public VendorQuirks without(QuirkFlag flag) {
        EnumSet<QuirkFlag> updated = EnumSet.noneOf(QuirkFlag.class);
        updated.addAll(flags);
        updated.remove(flag);
        return new VendorQuirks(updated);
    }

    public VendorQuirks toggle(QuirkFlag flag, boolean enabled) {
        return enabled ? with(flag) : without(flag);
    }

    public boolean hasDeposits() {
        return contains(QuirkFlag.HAS_DEPOSITS);
    }

    public boolean weightInDescription() {
        return contains(QuirkFlag.WEIGHT_IN_DESCRIPTION);
    }

    public boolean weightInPackageFormat() {
        return contains(QuirkFlag.WEIGHT_IN_PACKAGE_FORMAT);
    }

    public boolean skuInDescription() {
        return contains(QuirkFlag.SKU_IN_DESCRIPTION);
    }

    public boolean multiplePages() {
        return contains(QuirkFlag.MULTIPLE_PAGES);
    }

    public boolean containerDistributor() {
        return contains(QuirkFlag.CONTAINER_DISTRIBUTOR);
    }

    public boolean nestedUnits() {
        return contains(QuirkFlag.NESTED_UNITS);
    }

    public boolean rollProducts() {
        return contains(QuirkFlag.ROLL_PRODUCTS);
    }

    public boolean containerCapacity() {
        return contains(QuirkFlag.CONTAINER_CAPACITY);
    }
}
