package dev.pekelund.reconcile.lines;

import dev.pekelund.reconcile.inventory.PriceHistoryEntry;
import dev.pekelund.reconcile.pricing.NormalizedPrice;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Everything a confirmed match changes, or everything a rejection takes back from inventory.
 *
 * @param line the line to save
 * @param inventoryUpdate the price and stock change for the linked item, or null when inventory is left alone
 */
public record LineConfirmation(InvoiceLineItem line, InventoryUpdate inventoryUpdate) {

    public LineConfirmation {
        Objects.requireNonNull(line, "line");
    }

    public boolean updatesInventory() {
        return inventoryUpdate != null;
    }

    /**
     * @param history the price history entry to append, or null when the price did not change
     */
    public record InventoryUpdate(
        String inventoryItemId,
        BigDecimal newPrice,
        NormalizedPrice normalizedPrice,
        BigDecimal stockDelta,
        PriceHistoryEntry history
    ) {

        public InventoryUpdate {
            Objects.requireNonNull(inventoryItemId, "inventoryItemId");
        }
    }
}
