package dev.pekelund.reconcile.processor.local;

import dev.pekelund.reconcile.errors.NotFoundException;
import dev.pekelund.reconcile.inventory.InventoryGateway;
import dev.pekelund.reconcile.inventory.InventoryItem;
import dev.pekelund.reconcile.inventory.PriceHistoryEntry;
import dev.pekelund.reconcile.lines.InventoryMatcher;
import dev.pekelund.reconcile.pricing.NormalizedPrice;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Inventory items and price history held in memory. Every mutation runs under {@link #lock()} so that
 * {@link InMemoryConfirmationUnitOfWork} can make several changes look like one.
 */
public class InMemoryInventoryStore implements InventoryGateway {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, InventoryItem> items = new HashMap<>();
    private final List<PriceHistoryEntry> history = new ArrayList<>();
    private final Clock clock;

    public InMemoryInventoryStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    ReentrantLock lock() {
        return lock;
    }

    @Override
    public Optional<InventoryItem> findById(String inventoryItemId) {
        lock.lock();
        try {
            return Optional.ofNullable(items.get(inventoryItemId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public InventoryItem create(InventoryItem item) {
        InventoryItem created = item.withId(UUID.randomUUID().toString());
        put(created);
        return created;
    }

    @Override
    public void recordPrice(String inventoryItemId, BigDecimal newPrice, NormalizedPrice normalized,
        String sourceInvoiceId) {

        lock.lock();
        try {
            InventoryItem current = require(inventoryItemId);
            InventoryItem updated = current.withPrice(newPrice, normalized, sourceInvoiceId, clock.instant());
            items.put(inventoryItemId, updated);
            history.add(new PriceHistoryEntry(inventoryItemId, sourceInvoiceId, null, current.currentPrice(),
                newPrice, updated.pricePerG(), updated.pricePerMl(), updated.pricePerUnit(), clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void adjustStock(String inventoryItemId, BigDecimal delta, String sourceInvoiceId) {
        lock.lock();
        try {
            items.put(inventoryItemId, require(inventoryItemId).withStockDelta(delta));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<InventoryItem> search(String query, int limit) {
        lock.lock();
        try {
            return items.values().stream()
                .filter(item -> InventoryMatcher.isSearchHit(query, item))
                .sorted(Comparator.comparing(InventoryItem::name, Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(limit)
                .toList();
        } finally {
            lock.unlock();
        }
    }

    public List<PriceHistoryEntry> priceHistory(String inventoryItemId) {
        lock.lock();
        try {
            return history.stream().filter(entry -> entry.inventoryItemId().equals(inventoryItemId)).toList();
        } finally {
            lock.unlock();
        }
    }

    void put(InventoryItem item) {
        lock.lock();
        try {
            items.put(item.id(), item);
        } finally {
            lock.unlock();
        }
    }

    void appendHistory(PriceHistoryEntry entry) {
        lock.lock();
        try {
            history.add(entry);
        } finally {
            lock.unlock();
        }
    }

    void removeHistory(PriceHistoryEntry entry) {
        lock.lock();
        try {
            history.remove(entry);
        } finally {
            lock.unlock();
        }
    }

    InventoryItem require(String inventoryItemId) {
        InventoryItem item = items.get(inventoryItemId);
        if (item == null) {
            throw NotFoundException.of("Inventory item", inventoryItemId);
        }
        return item;
    }
}
