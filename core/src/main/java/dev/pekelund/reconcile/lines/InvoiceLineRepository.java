package dev.pekelund.reconcile.lines;

import java.util.List;
import java.util.Optional;

public interface InvoiceLineRepository {

    Optional<InvoiceLineItem> findById(String lineId);

    /**
     * @return the invoice's lines ordered by line number
     */
    List<InvoiceLineItem> findByInvoiceId(String invoiceId);

    List<InvoiceLineItem> findByInvoiceIdAndMatchStatus(String invoiceId, MatchStatus status);

    List<InvoiceLineItem> findByMatchStatus(MatchStatus status);

    /**
     * Saves the line, assigning an id to new lines.
     */
    InvoiceLineItem save(InvoiceLineItem line);

    List<InvoiceLineItem> saveAll(List<InvoiceLineItem> lines);

    int deleteByInvoiceId(String invoiceId);
}
