package dev.pekelund.reconcile.processor.extraction;

import dev.pekelund.reconcile.lines.CandidateLine;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Extractor output: invoice header values and the candidate lines in document order.
 *
 * @param rawResponse the model response the values were read from
 */
public record ExtractedInvoice(
    VendorInfo vendor,
    String invoiceNumber,
    LocalDate invoiceDate,
    BigDecimal total,
    List<CandidateLine> lines,
    String rawResponse
) {

    public ExtractedInvoice {
        lines = lines != null ? List.copyOf(lines) : List.of();
    }

    public record VendorInfo(String name, String address, String phone) {
    }
}
