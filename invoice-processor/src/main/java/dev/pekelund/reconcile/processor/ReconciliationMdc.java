package dev.pekelund.reconcile.processor;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates MDC entries so log lines written while handling one invoice share its identifiers.
 */
final class ReconciliationMdc {

    static final String KEY_INVOICE_ID = "invoice.id";
    static final String KEY_VENDOR_ID = "invoice.vendorId";
    static final String KEY_LINE_ID = "invoice.lineId";
    static final String KEY_STAGE = "invoice.stage";

    private ReconciliationMdc() {
        // Utility class
    }

    static Context open() {
        return new Context();
    }

    static Context forInvoice(String invoiceId, String vendorId) {
        Context context = new Context();
        attachInvoice(invoiceId, vendorId);
        return context;
    }

    static Context forLine(String lineId) {
        Context context = new Context();
        putIfHasText(KEY_LINE_ID, lineId);
        return context;
    }

    static void attachInvoice(String invoiceId, String vendorId) {
        putIfHasText(KEY_INVOICE_ID, invoiceId);
        putIfHasText(KEY_VENDOR_ID, vendorId);
    }

    static void setStage(String stage) {
        if (!StringUtils.hasText(stage)) {
            MDC.remove(KEY_STAGE);
        } else {
            MDC.put(KEY_STAGE, stage);
        }
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context() {
            this.previous = MDC.getCopyOfContextMap();
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
