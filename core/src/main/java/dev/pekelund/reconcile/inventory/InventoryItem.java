package dev.pekelund.reconcile.inventory;

import dev.pekelund.reconcile.pricing.NormalizedPrice;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Inventory record updated by confirmed invoice lines.
 *
 * @param aliases other names the item is sold under, used when matching invoice descriptions
 */
public record InventoryItem(
    String id,
    String name,
    String sku,
    String unit,
    BigDecimal currentPrice,
    BigDecimal pricePerG,
    BigDecimal pricePerMl,
    BigDecimal pricePerUnit,
    BigDecimal previousPrice,
    BigDecimal previousPricePerG,
    BigDecimal previousPricePerMl,
    BigDecimal previousPricePerUnit,
    BigDecimal currentStock,
    String lastInvoiceId,
    Instant lastPriceUpdate,
    List<String> aliases
) {

    public InventoryItem {
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
    }

    public static InventoryItem newItem(String name, String sku, String unit) {
        return new InventoryItem(null, name, sku, unit, null, null, null, null, null, null, null, null,
            BigDecimal.ZERO, null, null, List.of());
    }

    public InventoryItem withId(String newId) {
        return new InventoryItem(newId, name, sku, unit, currentPrice, pricePerG, pricePerMl, pricePerUnit,
            previousPrice, previousPricePerG, previousPricePerMl, previousPricePerUnit, currentStock, lastInvoiceId,
            lastPriceUpdate, aliases);
    }

    /**
     * Shifts the current prices to the previous ones and records the new price. Normalized prices
     * the line could not provide are left as they were.
     */
    public InventoryItem withPrice(BigDecimal newPrice, NormalizedPrice normalized, String sourceInvoiceId,
        Instant updatedAt) {

        BigDecimal perG = pricePerG;
        BigDecimal perMl = pricePerMl;
        BigDecimal perUnit = pricePerUnit;
        if (normalized != null) {
            perG = normalized.pricePerG() != null ? normalized.pricePerG() : perG;
            perMl = normalized.pricePerMl() != null ? normalized.pricePerMl() : perMl;
            perUnit = normalized.pricePerUnit() != null ? normalized.pricePerUnit() : perUnit;
        }
        return new InventoryItem(id, name, sku, unit, newPrice, perG, perMl, perUnit,
            currentPrice, pricePerG, pricePerMl, pricePerUnit, currentStock, sourceInvoiceId, updatedAt, aliases);
    }

    public InventoryItem withStockDelta(BigDecimal delta) {
        BigDecimal stock = currentStock != null ? currentStock : BigDecimal.ZERO;
        return new InventoryItem(id, name, sku, unit, currentPrice, pricePerG, pricePerMl, pricePerUnit,
            previousPrice, previousPricePerG, previousPricePerMl, previousPricePerUnit,
            delta != null ? stock.add(delta) : stock, lastInvoiceId, lastPriceUpdate, aliases);
    }

    public InventoryItem withAliases(List<String> newAliases) {
        return new InventoryItem(id, name, sku, unit, currentPrice, pricePerG, pricePerMl, pricePerUnit,
            previousPrice, previousPricePerG, previousPricePerMl, previousPricePerUnit, currentStock, lastInvoiceId,
            lastPriceUpdate, newAliases);
    }
}
