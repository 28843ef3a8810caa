package dev.pekelund.reconcile.processor.firestore;

import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.await;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.bool;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.decimal;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.instant;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.intValue;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.maps;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.string;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.timestamp;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.WriteBatch;
import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.InvoiceLineRepository;
import dev.pekelund.reconcile.lines.LineType;
import dev.pekelund.reconcile.lines.MatchCandidate;
import dev.pekelund.reconcile.lines.MatchStatus;
import dev.pekelund.reconcile.lines.RawLine;
import dev.pekelund.reconcile.pricing.NormalizedPrice;
import dev.pekelund.reconcile.pricing.PricingModel;
import dev.pekelund.reconcile.units.BaseUnit;
import dev.pekelund.reconcile.units.MeasurementUnit;
import dev.pekelund.reconcile.units.PackFormat;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Stores invoice lines as one Firestore document per line. Bulk writes and deletes go through
 * batches of at most {@value #MAX_BATCH_SIZE} operations.
 */
public class FirestoreInvoiceLineRepository implements InvoiceLineRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreInvoiceLineRepository.class);

    static final int MAX_BATCH_SIZE = 500;

    private static final Comparator<InvoiceLineItem> BY_LINE_NUMBER =
        Comparator.comparingInt(InvoiceLineItem::lineNumber);

    private final Firestore firestore;
    private final String collectionName;

    public FirestoreInvoiceLineRepository(Firestore firestore, String collectionName) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        LOGGER.info("FirestoreInvoiceLineRepository using collection '{}'", collectionName);
    }

    @Override
    public Optional<InvoiceLineItem> findById(String lineId) {
        if (!StringUtils.hasText(lineId)) {
            return Optional.empty();
        }
        DocumentSnapshot snapshot = await(collection().document(lineId).get(), "load invoice line " + lineId);
        if (!snapshot.exists()) {
            return Optional.empty();
        }
        return Optional.of(fromDocument(snapshot.getId(), snapshot.getData()));
    }

    @Override
    public List<InvoiceLineItem> findByInvoiceId(String invoiceId) {
        return query(collection().whereEqualTo("invoiceId", invoiceId), "list lines of invoice " + invoiceId);
    }

    @Override
    public List<InvoiceLineItem> findByInvoiceIdAndMatchStatus(String invoiceId, MatchStatus status) {
        Query query = collection()
            .whereEqualTo("invoiceId", invoiceId)
            .whereEqualTo("matchStatus", status.wireValue());
        return query(query, "list " + status.wireValue() + " lines of invoice " + invoiceId);
    }

    @Override
    public List<InvoiceLineItem> findByMatchStatus(MatchStatus status) {
        return query(collection().whereEqualTo("matchStatus", status.wireValue()),
            "list " + status.wireValue() + " lines");
    }

    @Override
    public InvoiceLineItem save(InvoiceLineItem line) {
        Objects.requireNonNull(line, "line");
        DocumentReference reference = reference(line);
        InvoiceLineItem stored = StringUtils.hasText(line.id()) ? line : line.withId(reference.getId());
        await(reference.set(toDocument(stored)), "store invoice line " + reference.getId());
        LOGGER.info("Stored line {} of invoice {} with match status {}", reference.getId(), stored.invoiceId(),
            stored.matchStatus().wireValue());
        return stored;
    }

    @Override
    public List<InvoiceLineItem> saveAll(List<InvoiceLineItem> lines) {
        List<InvoiceLineItem> stored = new ArrayList<>(lines.size());
        WriteBatch batch = firestore.batch();
        int pending = 0;
        for (InvoiceLineItem line : lines) {
            DocumentReference reference = reference(line);
            InvoiceLineItem withId = StringUtils.hasText(line.id()) ? line : line.withId(reference.getId());
            batch.set(reference, toDocument(withId));
            stored.add(withId);
            pending++;
            if (pending == MAX_BATCH_SIZE) {
                await(batch.commit(), "store invoice lines");
                batch = firestore.batch();
                pending = 0;
            }
        }
        if (pending > 0) {
            await(batch.commit(), "store invoice lines");
        }
        LOGGER.info("Stored {} invoice lines", stored.size());
        return stored;
    }

    @Override
    public int deleteByInvoiceId(String invoiceId) {
        List<QueryDocumentSnapshot> documents = await(collection().whereEqualTo("invoiceId", invoiceId).get(),
            "list lines of invoice " + invoiceId).getDocuments();
        WriteBatch batch = firestore.batch();
        int pending = 0;
        for (QueryDocumentSnapshot document : documents) {
            batch.delete(document.getReference());
            pending++;
            if (pending == MAX_BATCH_SIZE) {
                await(batch.commit(), "delete lines of invoice " + invoiceId);
                batch = firestore.batch();
                pending = 0;
            }
        }
        if (pending > 0) {
            await(batch.commit(), "delete lines of invoice " + invoiceId);
        }
        LOGGER.info("Deleted {} lines of invoice {}", documents.size(), invoiceId);
        return documents.size();
    }

    private List<InvoiceLineItem> query(Query query, String action) {
        return await(query.get(), action).getDocuments().stream()
            .map(document -> fromDocument(document.getId(), document.getData()))
            .sorted(BY_LINE_NUMBER)
            .toList();
    }

    private DocumentReference reference(InvoiceLineItem line) {
        return StringUtils.hasText(line.id()) ? collection().document(line.id()) : collection().document();
    }

    private CollectionReference collection() {
        return firestore.collection(collectionName);
    }

    static Map<String, Object> toDocument(InvoiceLineItem line) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("invoiceId", line.invoiceId());
        payload.put("lineNumber", line.lineNumber());
        payload.put("raw", rawDocument(line.raw()));
        payload.put("description", line.description());
        payload.put("sku", line.sku());
        payload.put("quantity", decimal(line.quantity()));
        payload.put("unit", line.unit());
        payload.put("weight", decimal(line.weight()));
        payload.put("weightUnit", line.weightUnit() != null ? line.weightUnit().symbol() : null);
        payload.put("unitPrice", decimal(line.unitPrice()));
        payload.put("totalPrice", decimal(line.totalPrice()));
        payload.put("packFormat", line.packFormat() != null ? line.packFormat().wireValue() : null);
        payload.put("pricingModel", line.pricingModel().wireValue());
        payload.put("pricingConfidence", decimal(line.pricingConfidence()));
        payload.put("pricingNote", line.pricingNote());
        NormalizedPrice normalized = line.normalizedPrice();
        payload.put("baseUnit", normalized != null ? normalized.baseUnit().symbol() : null);
        payload.put("pricePerBaseUnit", normalized != null ? decimal(normalized.pricePerBaseUnit()) : null);
        payload.put("totalBaseUnits", normalized != null ? decimal(normalized.totalBaseUnits()) : null);
        payload.put("pricePerG", decimal(line.pricePerG()));
        payload.put("pricePerML", decimal(line.pricePerMl()));
        payload.put("pricePerUnit", decimal(line.pricePerUnit()));
        payload.put("needsReview", line.needsReview());
        payload.put("reviewReason", line.reviewReason());
        payload.put("matchStatus", line.matchStatus().wireValue());
        payload.put("matchConfidence", line.matchConfidence());
        payload.put("matchedBy", line.matchedBy());
        payload.put("matchedAt", timestamp(line.matchedAt()));
        payload.put("matchNotes", line.matchNotes());
        payload.put("matchCandidates", line.matchCandidates().stream()
            .map(FirestoreInvoiceLineRepository::candidateDocument)
            .toList());
        payload.put("inventoryItemId", line.inventoryItemId());
        payload.put("previousPrice", decimal(line.previousPrice()));
        payload.put("newPrice", decimal(line.newPrice()));
        payload.put("addedToInventory", line.addedToInventory());
        payload.put("addedToInventoryAt", timestamp(line.addedToInventoryAt()));
        payload.put("addedToInventoryBy", line.addedToInventoryBy());
        payload.put("isDiscrepancy", line.discrepancy());
        payload.put("discrepancyNotes", line.discrepancyNotes());
        payload.put("lineType", line.lineType().wireValue());
        payload.put("forInventory", line.forInventory());
        payload.put("forAccounting", line.forAccounting());
        payload.put("isDeposit", line.deposit());
        payload.put("createdAt", timestamp(line.createdAt()));
        payload.put("updatedAt", timestamp(line.updatedAt()));
        return payload;
    }

    private static Map<String, Object> rawDocument(RawLine raw) {
        if (raw == null) {
            return null;
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("description", raw.description());
        payload.put("quantity", raw.quantity());
        payload.put("unitPrice", raw.unitPrice());
        payload.put("total", raw.total());
        payload.put("unit", raw.unit());
        payload.put("sku", raw.sku());
        payload.put("weight", raw.weight());
        payload.put("format", raw.format());
        return payload;
    }

    static InvoiceLineItem fromDocument(String id, Map<String, Object> data) {
        Map<String, Object> values = data != null ? data : Map.of();
        Map<String, Object> raw = FirestoreValues.map(values.get("raw"));
        String weightUnit = string(values.get("weightUnit"));
        String packFormat = string(values.get("packFormat"));
        String pricingModel = string(values.get("pricingModel"));
        String matchStatus = string(values.get("matchStatus"));
        String lineType = string(values.get("lineType"));
        String baseUnit = string(values.get("baseUnit"));

        NormalizedPrice normalized = null;
        if (baseUnit != null && values.get("pricePerBaseUnit") != null) {
            normalized = new NormalizedPrice(BaseUnit.fromSymbol(baseUnit), decimal(values.get("pricePerBaseUnit")),
                decimal(values.get("totalBaseUnits")));
        }

        return InvoiceLineItem.builder()
            .id(id)
            .invoiceId(string(values.get("invoiceId")))
            .lineNumber(FirestoreValues.intValue(values.get("lineNumber")))
            .raw(raw.isEmpty() ? null : new RawLine(string(raw.get("description")), string(raw.get("quantity")),
                string(raw.get("unitPrice")), string(raw.get("total")), string(raw.get("unit")),
                string(raw.get("sku")), string(raw.get("weight")), string(raw.get("format"))))
            .description(string(values.get("description")))
            .sku(string(values.get("sku")))
            .quantity(decimal(values.get("quantity")))
            .unit(string(values.get("unit")))
            .weight(decimal(values.get("weight")))
            .weightUnit(weightUnit != null ? MeasurementUnit.find(weightUnit).orElse(null) : null)
            .unitPrice(decimal(values.get("unitPrice")))
            .totalPrice(decimal(values.get("totalPrice")))
            .packFormat(packFormat != null ? PackFormat.Kind.fromWire(packFormat) : null)
            .pricingModel(pricingModel != null ? PricingModel.fromWire(pricingModel) : null)
            .pricingConfidence(decimal(values.get("pricingConfidence")))
            .pricingNote(string(values.get("pricingNote")))
            .normalizedPrice(normalized)
            .needsReview(bool(values.get("needsReview")))
            .reviewReason(string(values.get("reviewReason")))
            .matchStatus(matchStatus != null ? MatchStatus.fromWire(matchStatus) : null)
            .matchConfidence(FirestoreValues.integer(values.get("matchConfidence")))
            .matchedBy(string(values.get("matchedBy")))
            .matchedAt(instant(values.get("matchedAt")))
            .matchNotes(string(values.get("matchNotes")))
            .matchCandidates(maps(values.get("matchCandidates")).stream()
                .map(candidate -> new MatchCandidate(string(candidate.get("inventoryItemId")),
                    string(candidate.get("name")), string(candidate.get("sku")), intValue(candidate.get("score"))))
                .toList())
            .inventoryItemId(string(values.get("inventoryItemId")))
            .previousPrice(decimal(values.get("previousPrice")))
            .newPrice(decimal(values.get("newPrice")))
            .addedToInventory(bool(values.get("addedToInventory")))
            .addedToInventoryAt(instant(values.get("addedToInventoryAt")))
            .addedToInventoryBy(string(values.get("addedToInventoryBy")))
            .discrepancy(bool(values.get("isDiscrepancy")))
            .discrepancyNotes(string(values.get("discrepancyNotes")))
            .lineType(lineType != null ? LineType.fromWire(lineType) : LineType.PRODUCT)
            .forInventory(bool(values.get("forInventory")))
            .forAccounting(bool(values.get("forAccounting")))
            .deposit(bool(values.get("isDeposit")))
            .createdAt(instant(values.get("createdAt")))
            .updatedAt(instant(values.get("updatedAt")))
            .build();
    }

    private static Map<String, Object> candidateDocument(MatchCandidate candidate) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("inventoryItemId", candidate.inventoryItemId());
        payload.put("name", candidate.name());
        payload.put("sku", candidate.sku());
        payload.put("score", candidate.score());
        return payload;
    }
}
