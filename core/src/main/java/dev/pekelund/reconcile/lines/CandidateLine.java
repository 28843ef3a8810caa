package dev.pekelund.reconcile.lines;

import java.util.List;

/**
 * A line as proposed by the extractor, before any interpretation.
 *
 * @param sampleColumns the cell texts of the row in column order, used by column classification
 */
public record CandidateLine(
    String rawDescription,
    String rawQuantity,
    String rawUnitPrice,
    String rawTotal,
    String rawUnit,
    String rawSku,
    String rawWeight,
    String rawFormat,
    List<String> sampleColumns
) {

    public CandidateLine {
        sampleColumns = sampleColumns != null ? List.copyOf(sampleColumns) : List.of();
    }

    public RawLine toRawLine() {
        return new RawLine(rawDescription, rawQuantity, rawUnitPrice, rawTotal, rawUnit, rawSku, rawWeight,
            rawFormat);
    }
}
