package dev.pekelund.reconcile.inventory;

import dev.pekelund.reconcile.pricing.NormalizedPrice;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * The inventory system invoice lines are reconciled against.
 */
public interface InventoryGateway {

    Optional<InventoryItem> findById(String inventoryItemId);

    /**
     * Creates an item and returns it with its assigned id.
     */
    InventoryItem create(InventoryItem item);

    void recordPrice(String inventoryItemId, BigDecimal newPrice, NormalizedPrice normalized, String sourceInvoiceId);

    void adjustStock(String inventoryItemId, BigDecimal delta, String sourceInvoiceId);

    /**
     * Items a line description may refer to: a word of the item's name or aliases appears in the
     * query, or the item's SKU does. Scoring the hits is left to the caller.
     *
     * @param limit the most items to return
     */
    List<InventoryItem> search(String query, int limit);
}
