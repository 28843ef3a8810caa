package dev.pekelund.reconcile.processor.firestore;

import com.google.api.core.ApiFuture;
import com.google.cloud.Timestamp;
import dev.pekelund.reconcile.errors.ReconciliationException;
import dev.pekelund.reconcile.errors.ReconciliationStorageException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between domain values and the types stored in Firestore documents. Amounts are stored as
 * plain decimal strings, instants as {@link Timestamp}s and dates as ISO-8601 strings.
 */
final class FirestoreValues {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreValues.class);

    private FirestoreValues() {
        // Utility class
    }

    /**
     * Waits for a Firestore call, translating its failures into {@link ReconciliationStorageException}.
     * Domain exceptions thrown inside a transaction are rethrown as they are.
     */
    static <T> T await(ApiFuture<T> future, String action) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            LOGGER.error("Interrupted while trying to {}", action, ex);
            Thread.currentThread().interrupt();
            throw new ReconciliationStorageException("Interrupted while trying to " + action, ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof ReconciliationException domainFailure) {
                throw domainFailure;
            }
            LOGGER.error("Failed to {}", action, ex.getCause());
            throw new ReconciliationStorageException("Failed to " + action, ex.getCause() != null ? ex.getCause() : ex);
        }
    }

    static String decimal(BigDecimal value) {
        return value != null ? value.toPlainString() : null;
    }

    static BigDecimal decimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Long || value instanceof Integer) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : new BigDecimal(text);
    }

    static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano()) : null;
    }

    static Instant instant(Object value) {
        if (value instanceof Timestamp timestamp) {
            return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
        }
        if (value instanceof String text && !text.isBlank()) {
            return Instant.parse(text);
        }
        return null;
    }

    static String date(LocalDate date) {
        return date != null ? date.toString() : null;
    }

    static LocalDate localDate(Object value) {
        if (value instanceof String text && !text.isBlank()) {
            return LocalDate.parse(text);
        }
        return null;
    }

    static String string(Object value) {
        return value != null ? value.toString() : null;
    }

    static Integer integer(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }

    static int intValue(Object value) {
        return value instanceof Number number ? number.intValue() : 0;
    }

    static double doubleValue(Object value, double fallback) {
        return value instanceof Number number ? number.doubleValue() : fallback;
    }

    static boolean bool(Object value) {
        return value instanceof Boolean flag && flag;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    static List<String> strings(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null) {
                    values.add(element.toString());
                }
            }
        }
        return values;
    }

    static List<Map<String, Object>> maps(Object value) {
        List<Map<String, Object>> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element instanceof Map<?, ?>) {
                    values.add(map(element));
                }
            }
        }
        return values;
    }
}
