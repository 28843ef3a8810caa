package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.lines.CandidateLine;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Invoice header values and extractor lines to ingest for one vendor.
 */
public record IngestionRequest(
    @NotBlank String vendorId,
    @NotBlank String vendorName,
    String invoiceNumber,
    LocalDate invoiceDate,
    BigDecimal total,
    @NotNull List<CandidateLine> lines
) {

    public IngestionRequest {
        lines = lines != null ? List.copyOf(lines) : List.of();
    }
}
