package dev.pekelund.reconcile.processor.extraction;

/**
 * Reads an invoice document and proposes its header values and candidate lines.
 */
public interface InvoiceLineExtractor {

    /**
     * @param document the uploaded invoice
     * @param fileName original file name, used in prompts and logs
     * @param promptHints vendor-specific layout hints, may be null
     */
    ExtractedInvoice extract(byte[] document, String fileName, String promptHints);
}
