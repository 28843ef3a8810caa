package dev.pekelund.reconcile.processor.firestore;

import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.await;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.date;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.decimal;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.instant;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.localDate;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.string;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.timestamp;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import dev.pekelund.reconcile.invoices.Invoice;
import dev.pekelund.reconcile.invoices.InvoiceRepository;
import dev.pekelund.reconcile.invoices.InvoiceStatus;
import dev.pekelund.reconcile.invoices.PaymentFlag;
import dev.pekelund.reconcile.invoices.PaymentStatus;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Stores invoices in a Firestore collection. The lower-cased invoice number is kept in
 * {@code invoiceNumberKey} so that duplicate lookups can use an equality index.
 */
public class FirestoreInvoiceRepository implements InvoiceRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreInvoiceRepository.class);

    static final String INVOICE_NUMBER_KEY = "invoiceNumberKey";

    private final Firestore firestore;
    private final String collectionName;

    public FirestoreInvoiceRepository(Firestore firestore, String collectionName) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        LOGGER.info("FirestoreInvoiceRepository using collection '{}'", collectionName);
    }

    @Override
    public Optional<Invoice> findById(String id) {
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        DocumentSnapshot snapshot = await(collection().document(id).get(), "load invoice " + id);
        if (!snapshot.exists()) {
            return Optional.empty();
        }
        return Optional.of(fromDocument(snapshot.getId(), snapshot.getData()));
    }

    @Override
    public Invoice save(Invoice invoice) {
        Objects.requireNonNull(invoice, "invoice");
        DocumentReference reference = StringUtils.hasText(invoice.id())
            ? collection().document(invoice.id())
            : collection().document();
        Invoice stored = StringUtils.hasText(invoice.id()) ? invoice : invoice.toBuilder().id(reference.getId()).build();
        await(reference.set(toDocument(stored)), "store invoice " + reference.getId());
        LOGGER.info("Stored invoice {} with status {}", reference.getId(), stored.status().wireValue());
        return stored;
    }

    @Override
    public void delete(String id) {
        await(collection().document(id).delete(), "delete invoice " + id);
        LOGGER.info("Deleted invoice {}", id);
    }

    @Override
    public List<Invoice> findByInvoiceNumberIgnoreCase(String invoiceNumber) {
        if (!StringUtils.hasText(invoiceNumber)) {
            return List.of();
        }
        return query(collection().whereEqualTo(INVOICE_NUMBER_KEY, invoiceNumberKey(invoiceNumber)),
            "look up invoice number " + invoiceNumber);
    }

    @Override
    public List<Invoice> findByStatus(InvoiceStatus status) {
        return query(collection().whereEqualTo("status", status.wireValue()),
            "list invoices with status " + status.wireValue());
    }

    @Override
    public List<Invoice> findByPaymentStatus(PaymentStatus paymentStatus) {
        return query(collection().whereEqualTo("paymentStatus", paymentStatus.wireValue()),
            "list invoices with payment status " + paymentStatus.wireValue());
    }

    @Override
    public List<Invoice> findByInvoiceDateBetween(LocalDate from, LocalDate to) {
        Query query = collection()
            .whereGreaterThanOrEqualTo("invoiceDate", date(from))
            .whereLessThanOrEqualTo("invoiceDate", date(to))
            .orderBy("invoiceDate");
        return query(query, "list invoices dated " + from + " to " + to);
    }

    private List<Invoice> query(Query query, String action) {
        List<QueryDocumentSnapshot> documents = await(query.get(), action).getDocuments();
        return documents.stream()
            .map(document -> fromDocument(document.getId(), document.getData()))
            .toList();
    }

    private CollectionReference collection() {
        return firestore.collection(collectionName);
    }

    static String invoiceNumberKey(String invoiceNumber) {
        return invoiceNumber != null ? invoiceNumber.trim().toLowerCase(Locale.ROOT) : null;
    }

    static Map<String, Object> toDocument(Invoice invoice) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("vendorId", invoice.vendorId());
        payload.put("vendorName", invoice.vendorName());
        payload.put("invoiceNumber", invoice.invoiceNumber());
        payload.put(INVOICE_NUMBER_KEY, invoiceNumberKey(invoice.invoiceNumber()));
        payload.put("invoiceDate", date(invoice.invoiceDate()));
        payload.put("status", invoice.status().wireValue());
        payload.put("statusMessage", invoice.statusMessage());
        payload.put("total", decimal(invoice.total()));
        payload.put("amountPaid", decimal(invoice.amountPaid()));
        payload.put("paymentStatus", invoice.paymentStatus().wireValue());
        payload.put("paymentFlags", invoice.paymentFlags().stream().map(flag -> flag.status().wireValue()).toList());
        payload.put("paymentDate", date(invoice.paymentDate()));
        payload.put("paymentMethod", invoice.paymentMethod());
        payload.put("paymentReference", invoice.paymentReference());
        payload.put("extractedAt", timestamp(invoice.extractedAt()));
        payload.put("reviewedAt", timestamp(invoice.reviewedAt()));
        payload.put("processedAt", timestamp(invoice.processedAt()));
        payload.put("sentToAccountingAt", timestamp(invoice.sentToAccountingAt()));
        payload.put("archivedAt", timestamp(invoice.archivedAt()));
        payload.put("createdAt", timestamp(invoice.createdAt()));
        payload.put("updatedAt", timestamp(invoice.updatedAt()));
        return payload;
    }

    static Invoice fromDocument(String id, Map<String, Object> data) {
        Map<String, Object> values = data != null ? data : Map.of();
        Set<PaymentFlag> flags = EnumSet.noneOf(PaymentFlag.class);
        for (String flag : FirestoreValues.strings(values.get("paymentFlags"))) {
            flags.add(PaymentFlag.fromWire(flag));
        }
        String status = string(values.get("status"));
        return Invoice.builder()
            .id(id)
            .vendorId(string(values.get("vendorId")))
            .vendorName(string(values.get("vendorName")))
            .invoiceNumber(string(values.get("invoiceNumber")))
            .invoiceDate(localDate(values.get("invoiceDate")))
            .status(status != null ? InvoiceStatus.fromWire(status) : null)
            .statusMessage(string(values.get("statusMessage")))
            .total(decimal(values.get("total")))
            .amountPaid(decimal(values.get("amountPaid")))
            .paymentFlags(flags)
            .paymentDate(localDate(values.get("paymentDate")))
            .paymentMethod(string(values.get("paymentMethod")))
            .paymentReference(string(values.get("paymentReference")))
            .extractedAt(instant(values.get("extractedAt")))
            .reviewedAt(instant(values.get("reviewedAt")))
            .processedAt(instant(values.get("processedAt")))
            .sentToAccountingAt(instant(values.get("sentToAccountingAt")))
            .archivedAt(instant(values.get("archivedAt")))
            .createdAt(instant(values.get("createdAt")))
            .updatedAt(instant(values.get("updatedAt")))
            .build();
    }
}
