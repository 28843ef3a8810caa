package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.errors.InvariantViolationException;
import dev.pekelund.reconcile.errors.NotFoundException;
import dev.pekelund.reconcile.errors.ReconciliationStorageException;
import dev.pekelund.reconcile.errors.ValidationException;
import dev.pekelund.reconcile.processor.extraction.InvoiceExtractionException;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps reconciliation failures to HTTP responses with an {@code error} message body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException exception) {
        LOGGER.info("Rejected request: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidBody(MethodArgumentNotValidException exception) {
        String message = exception.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));
        return Map.of("error", message.isEmpty() ? "Invalid request body" : message);
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException exception) {
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(InvariantViolationException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleInvariantViolation(InvariantViolationException exception) {
        LOGGER.error("Invariant violated: {}", exception.getMessage(), exception);
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(InvoiceExtractionException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleExtraction(InvoiceExtractionException exception) {
        LOGGER.warn("Invoice extraction failed: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(ReconciliationStorageException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleStorage(ReconciliationStorageException exception) {
        LOGGER.error("Storage failure: {}", exception.getMessage(), exception);
        return Map.of("error", "Storage is unavailable, please retry");
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleUnsupported(UnsupportedOperationException exception) {
        LOGGER.warn("Operation not available: {}", exception.getMessage());
        return Map.of("error", exception.getMessage() != null ? exception.getMessage() : "Not available");
    }
}
