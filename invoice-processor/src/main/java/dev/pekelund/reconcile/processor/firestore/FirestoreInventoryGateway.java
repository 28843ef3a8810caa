package dev.pekelund.reconcile.processor.firestore;

import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.await;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.decimal;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.instant;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.string;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.strings;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.timestamp;

import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.Transaction;
import dev.pekelund.reconcile.errors.NotFoundException;
import dev.pekelund.reconcile.inventory.InventoryGateway;
import dev.pekelund.reconcile.inventory.InventoryItem;
import dev.pekelund.reconcile.inventory.PriceHistoryEntry;
import dev.pekelund.reconcile.lines.InventoryMatcher;
import dev.pekelund.reconcile.pricing.NormalizedPrice;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Inventory items and their price history kept in Firestore. Price and stock changes read and
 * write the item inside a transaction.
 */
public class FirestoreInventoryGateway implements InventoryGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreInventoryGateway.class);

    /**
     * Firestore's cap on the values of one {@code in} or {@code array-contains-any} filter.
     */
    private static final int MAX_QUERY_VALUES = 30;

    private final Firestore firestore;
    private final String itemsCollection;
    private final String historyCollection;
    private final Clock clock;

    public FirestoreInventoryGateway(Firestore firestore, String itemsCollection, String historyCollection,
        Clock clock) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.itemsCollection = Objects.requireNonNull(itemsCollection, "itemsCollection");
        this.historyCollection = Objects.requireNonNull(historyCollection, "historyCollection");
        this.clock = Objects.requireNonNull(clock, "clock");
        LOGGER.info("FirestoreInventoryGateway using collections '{}' and '{}'", itemsCollection, historyCollection);
    }

    @Override
    public Optional<InventoryItem> findById(String inventoryItemId) {
        if (!StringUtils.hasText(inventoryItemId)) {
            return Optional.empty();
        }
        DocumentSnapshot snapshot = await(firestore.collection(itemsCollection).document(inventoryItemId).get(),
            "load inventory item " + inventoryItemId);
        if (!snapshot.exists()) {
            return Optional.empty();
        }
        return Optional.of(fromDocument(snapshot.getId(), snapshot.getData()));
    }

    @Override
    public InventoryItem create(InventoryItem item) {
        DocumentReference reference = firestore.collection(itemsCollection).document();
        InventoryItem created = item.withId(reference.getId());
        await(reference.create(toDocument(created)), "create inventory item " + item.name());
        LOGGER.info("Created inventory item {} ('{}')", created.id(), created.name());
        return created;
    }

    @Override
    public void recordPrice(String inventoryItemId, BigDecimal newPrice, NormalizedPrice normalized,
        String sourceInvoiceId) {

        DocumentReference reference = firestore.collection(itemsCollection).document(inventoryItemId);
        DocumentReference historyReference = firestore.collection(historyCollection).document();
        await(firestore.runTransaction(transaction -> {
            InventoryItem current = read(transaction, reference);
            InventoryItem updated = current.withPrice(newPrice, normalized, sourceInvoiceId, clock.instant());
            transaction.set(reference, toDocument(updated));
            transaction.create(historyReference, historyDocument(new PriceHistoryEntry(inventoryItemId,
                sourceInvoiceId, null, current.currentPrice(), newPrice, updated.pricePerG(), updated.pricePerMl(),
                updated.pricePerUnit(), clock.instant())));
            return null;
        }), "record price of inventory item " + inventoryItemId);
        LOGGER.info("Recorded price {} on inventory item {} from invoice {}", newPrice, inventoryItemId,
            sourceInvoiceId);
    }

    @Override
    public void adjustStock(String inventoryItemId, BigDecimal delta, String sourceInvoiceId) {
        DocumentReference reference = firestore.collection(itemsCollection).document(inventoryItemId);
        await(firestore.runTransaction(transaction -> {
            InventoryItem current = read(transaction, reference);
            transaction.set(reference, toDocument(current.withStockDelta(delta)));
            return null;
        }), "adjust stock of inventory item " + inventoryItemId);
        LOGGER.info("Adjusted stock of inventory item {} by {} from invoice {}", inventoryItemId, delta,
            sourceInvoiceId);
    }

    /**
     * Runs one array query on the stored search words and one on the lower-cased SKU, then merges
     * the hits in that order.
     */
    @Override
    public List<InventoryItem> search(String query, int limit) {
        List<String> words = InventoryMatcher.words(query);
        List<String> skuTokens = skuTokens(query);
        Map<String, InventoryItem> hits = new LinkedHashMap<>();
        if (!words.isEmpty()) {
            collect(hits, await(firestore.collection(itemsCollection)
                .whereArrayContainsAny("searchWords", words.subList(0, Math.min(words.size(), MAX_QUERY_VALUES)))
                .limit(limit)
                .get(), "search inventory items for '" + query + "'").getDocuments());
        }
        if (!skuTokens.isEmpty() && hits.size() < limit) {
            collect(hits, await(firestore.collection(itemsCollection)
                .whereIn("skuNormalized", List.copyOf(skuTokens.subList(0, Math.min(skuTokens.size(),
                    MAX_QUERY_VALUES))))
                .limit(limit)
                .get(), "search inventory items by SKU in '" + query + "'").getDocuments());
        }
        LOGGER.debug("Inventory search '{}' found {} item(s)", query, hits.size());
        return hits.values().stream().limit(limit).toList();
    }

    private static void collect(Map<String, InventoryItem> hits, List<QueryDocumentSnapshot> documents) {
        for (QueryDocumentSnapshot document : documents) {
            hits.putIfAbsent(document.getId(), fromDocument(document.getId(), document.getData()));
        }
    }

    static List<String> skuTokens(String query) {
        if (!StringUtils.hasText(query)) {
            return List.of();
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).split("[\\s,;]+"))
            .filter(StringUtils::hasText)
            .distinct()
            .toList();
    }

    static InventoryItem read(Transaction transaction, DocumentReference reference) throws Exception {
        DocumentSnapshot snapshot = transaction.get(reference).get();
        if (!snapshot.exists()) {
            throw NotFoundException.of("Inventory item", reference.getId());
        }
        return fromDocument(snapshot.getId(), snapshot.getData());
    }

    static Map<String, Object> toDocument(InventoryItem item) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("name", item.name());
        payload.put("sku", item.sku());
        payload.put("skuNormalized", item.sku() != null ? item.sku().toLowerCase(Locale.ROOT) : null);
        payload.put("nameNormalized", InventoryMatcher.normalize(item.name()));
        payload.put("aliases", item.aliases());
        payload.put("searchWords", InventoryMatcher.searchWords(item));
        payload.put("unit", item.unit());
        payload.put("currentPrice", decimal(item.currentPrice()));
        payload.put("pricePerG", decimal(item.pricePerG()));
        payload.put("pricePerML", decimal(item.pricePerMl()));
        payload.put("pricePerUnit", decimal(item.pricePerUnit()));
        payload.put("previousPrice", decimal(item.previousPrice()));
        payload.put("previousPricePerG", decimal(item.previousPricePerG()));
        payload.put("previousPricePerML", decimal(item.previousPricePerMl()));
        payload.put("previousPricePerUnit", decimal(item.previousPricePerUnit()));
        payload.put("currentStock", decimal(item.currentStock()));
        payload.put("lastInvoiceId", item.lastInvoiceId());
        payload.put("lastPriceUpdate", timestamp(item.lastPriceUpdate()));
        return payload;
    }

    static InventoryItem fromDocument(String id, Map<String, Object> data) {
        Map<String, Object> values = data != null ? data : Map.of();
        return new InventoryItem(id,
            string(values.get("name")),
            string(values.get("sku")),
            string(values.get("unit")),
            decimal(values.get("currentPrice")),
            decimal(values.get("pricePerG")),
            decimal(values.get("pricePerML")),
            decimal(values.get("pricePerUnit")),
            decimal(values.get("previousPrice")),
            decimal(values.get("previousPricePerG")),
            decimal(values.get("previousPricePerML")),
            decimal(values.get("previousPricePerUnit")),
            decimal(values.get("currentStock")),
            string(values.get("lastInvoiceId")),
            instant(values.get("lastPriceUpdate")),
            strings(values.get("aliases")));
    }

    static Map<String, Object> historyDocument(PriceHistoryEntry entry) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("inventoryItemId", entry.inventoryItemId());
        payload.put("sourceInvoiceId", entry.sourceInvoiceId());
        payload.put("sourceLineId", entry.sourceLineId());
        payload.put("previousPrice", decimal(entry.previousPrice()));
        payload.put("newPrice", decimal(entry.newPrice()));
        payload.put("pricePerG", decimal(entry.pricePerG()));
        payload.put("pricePerML", decimal(entry.pricePerMl()));
        payload.put("pricePerUnit", decimal(entry.pricePerUnit()));
        payload.put("recordedAt", timestamp(entry.recordedAt()));
        return payload;
    }
}
