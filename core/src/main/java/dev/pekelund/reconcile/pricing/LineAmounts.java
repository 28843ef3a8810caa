package dev.pekelund.reconcile.pricing;

import java.math.BigDecimal;

/**
 * Parsed numeric values of a line that take part in pricing detection. Any value may be null when
 * the vendor did not print it.
 */
public record LineAmounts(BigDecimal quantity, BigDecimal weight, BigDecimal unitPrice, BigDecimal totalPrice) {

    public boolean hasWeight() {
        return weight != null && weight.signum() > 0;
    }
}
