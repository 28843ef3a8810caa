package dev.pekelund.reconcile.processor.local;

import dev.pekelund.reconcile.inventory.InventoryItem;
import dev.pekelund.reconcile.lines.ConfirmationUnitOfWork;
import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.InvoiceLineRepository;
import dev.pekelund.reconcile.lines.LineConfirmation;
import dev.pekelund.reconcile.lines.LineConfirmation.InventoryUpdate;
import java.time.Clock;
import java.util.Objects;

/**
 * Applies a confirmation under the inventory store's lock and restores the item and its history when
 * saving the line fails.
 */
public class InMemoryConfirmationUnitOfWork implements ConfirmationUnitOfWork {

    private final InMemoryInventoryStore inventory;
    private final InvoiceLineRepository lineRepository;
    private final Clock clock;

    public InMemoryConfirmationUnitOfWork(InMemoryInventoryStore inventory, InvoiceLineRepository lineRepository,
        Clock clock) {
        this.inventory = Objects.requireNonNull(inventory, "inventory");
        this.lineRepository = Objects.requireNonNull(lineRepository, "lineRepository");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public InvoiceLineItem commit(LineConfirmation confirmation) {
        InvoiceLineItem line = confirmation.line();
        InventoryUpdate update = confirmation.inventoryUpdate();
        inventory.lock().lock();
        try {
            if (update == null) {
                return lineRepository.save(line);
            }
            InventoryItem before = inventory.require(update.inventoryItemId());
            InventoryItem after = before;
            if (update.newPrice() != null) {
                after = after.withPrice(update.newPrice(), update.normalizedPrice(), line.invoiceId(),
                    clock.instant());
            }
            after = after.withStockDelta(update.stockDelta());
            inventory.put(after);
            if (update.history() != null) {
                inventory.appendHistory(update.history());
            }
            try {
                return lineRepository.save(line);
            } catch (RuntimeException ex) {
                inventory.put(before);
                if (update.history() != null) {
                    inventory.removeHistory(update.history());
                }
                throw ex;
            }
        } finally {
            inventory.lock().unlock();
        }
    }
}
