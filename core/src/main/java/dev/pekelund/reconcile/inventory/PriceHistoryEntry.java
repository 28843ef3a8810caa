package dev.pekelund.reconcile.inventory;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Audit record of a price change applied to an inventory item from an invoice line.
 */
public record PriceHistoryEntry(
    String inventoryItemId,
    String sourceInvoiceId,
    String sourceLineId,
    BigDecimal previousPrice,
    BigDecimal newPrice,
    BigDecimal pricePerG,
    BigDecimal pricePerMl,
    BigDecimal pricePerUnit,
    Instant recordedAt
) {
}
