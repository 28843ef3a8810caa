package dev.pekelund.reconcile.processor.local;

import dev.pekelund.reconcile.lines.InvoiceLineItem;
import dev.pekelund.reconcile.lines.InvoiceLineRepository;
import dev.pekelund.reconcile.lines.MatchStatus;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.springframework.util.StringUtils;

public class InMemoryInvoiceLineRepository implements InvoiceLineRepository {

    private final Map<String, InvoiceLineItem> lines = new ConcurrentHashMap<>();

    @Override
    public Optional<InvoiceLineItem> findById(String lineId) {
        return lineId != null ? Optional.ofNullable(lines.get(lineId)) : Optional.empty();
    }

    @Override
    public List<InvoiceLineItem> findByInvoiceId(String invoiceId) {
        return filter(line -> line.invoiceId().equals(invoiceId));
    }

    @Override
    public List<InvoiceLineItem> findByInvoiceIdAndMatchStatus(String invoiceId, MatchStatus status) {
        return filter(line -> line.invoiceId().equals(invoiceId) && line.matchStatus() == status);
    }

    @Override
    public List<InvoiceLineItem> findByMatchStatus(MatchStatus status) {
        return filter(line -> line.matchStatus() == status);
    }

    @Override
    public InvoiceLineItem save(InvoiceLineItem line) {
        Objects.requireNonNull(line, "line");
        InvoiceLineItem stored = StringUtils.hasText(line.id()) ? line : line.withId(UUID.randomUUID().toString());
        lines.put(stored.id(), stored);
        return stored;
    }

    @Override
    public List<InvoiceLineItem> saveAll(List<InvoiceLineItem> toSave) {
        return toSave.stream().map(this::save).toList();
    }

    @Override
    public int deleteByInvoiceId(String invoiceId) {
        List<String> ids = findByInvoiceId(invoiceId).stream().map(InvoiceLineItem::id).toList();
        ids.forEach(lines::remove);
        return ids.size();
    }

    private List<InvoiceLineItem> filter(Predicate<InvoiceLineItem> predicate) {
        return lines.values().stream()
            .filter(predicate)
            .sorted(Comparator.comparing(InvoiceLineItem::invoiceId).thenComparingInt(InvoiceLineItem::lineNumber))
            .toList();
    }
}
