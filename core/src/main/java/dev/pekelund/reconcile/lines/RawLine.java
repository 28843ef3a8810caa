package dev.pekelund.reconcile.lines;

/**
 * Line values exactly as the extractor returned them. They are stored untouched next to the parsed
 * values.
 */
public record RawLine(
    String description,
    String quantity,
    String unitPrice,
    String total,
    String unit,
    String sku,
    String weight,
    String format
) {
}
