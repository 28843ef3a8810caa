package dev.pekelund.reconcile.pricing;

import dev.pekelund.reconcile.units.MeasurementUnit;
import dev.pekelund.reconcile.units.PackFormat;

/**
 * Units attached to a line.
 *
 * @param weightUnit unit of the weight column, or null
 * @param quantityUnit unit of the quantity column when it is a recognised unit, or null
 * @param packFormat parsed pack notation, or null
 */
public record LineUnits(MeasurementUnit weightUnit, MeasurementUnit quantityUnit, PackFormat packFormat) {

    public static final LineUnits NONE = new LineUnits(null, null, null);
}
