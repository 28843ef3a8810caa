package dev.pekelund.reconcile.processor.firestore;

import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.await;

import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import dev.pekelund.reconcile.errors.InvariantViolationException;
import dev.pekelund.reconcile.inventory.InventoryItem;
import dev.pekelund.reconcile.lines.ConfirmationUnitOfWork;
import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.LineConfirmation;
import dev.pekelund.reconcile.lines.LineConfirmation.InventoryUpdate;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Writes a confirmed line, its inventory item and the price history entry in one Firestore transaction.
 * Firestore retries the transaction when the item changes concurrently.
 */
public class FirestoreConfirmationUnitOfWork implements ConfirmationUnitOfWork {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreConfirmationUnitOfWork.class);

    private final Firestore firestore;
    private final String linesCollection;
    private final String itemsCollection;
    private final String historyCollection;
    private final Clock clock;

    public FirestoreConfirmationUnitOfWork(Firestore firestore, String linesCollection, String itemsCollection,
        String historyCollection, Clock clock) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.linesCollection = Objects.requireNonNull(linesCollection, "linesCollection");
        this.itemsCollection = Objects.requireNonNull(itemsCollection, "itemsCollection");
        this.historyCollection = Objects.requireNonNull(historyCollection, "historyCollection");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public InvoiceLineItem commit(LineConfirmation confirmation) {
        InvoiceLineItem line = confirmation.line();
        if (!StringUtils.hasText(line.id())) {
            throw new InvariantViolationException("Cannot confirm a line that was never stored");
        }
        DocumentReference lineReference = firestore.collection(linesCollection).document(line.id());
        InventoryUpdate update = confirmation.inventoryUpdate();

        await(firestore.runTransaction(transaction -> {
            if (update != null) {
                DocumentReference itemReference = firestore.collection(itemsCollection)
                    .document(update.inventoryItemId());
                InventoryItem item = FirestoreInventoryGateway.read(transaction, itemReference);
                if (update.newPrice() != null) {
                    item = item.withPrice(update.newPrice(), update.normalizedPrice(), line.invoiceId(),
                        clock.instant());
                }
                item = item.withStockDelta(update.stockDelta());
                transaction.set(itemReference, FirestoreInventoryGateway.toDocument(item));
                if (update.history() != null) {
                    transaction.create(firestore.collection(historyCollection).document(),
                        FirestoreInventoryGateway.historyDocument(update.history()));
                }
            }
            transaction.set(lineReference, FirestoreInvoiceLineRepository.toDocument(line));
            return null;
        }), "confirm invoice line " + line.id());

        LOGGER.info("Committed confirmation of line {} (inventory updated: {})", line.id(),
            confirmation.updatesInventory());
        return line;
    }
}
