package dev.pekelund.reconcile.invoices;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Detects invoices already on file. Invoice numbers are only unique per vendor, so candidates found by
 * number are narrowed to the same vendor name.
 */
public class DuplicateInvoiceDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateInvoiceDetector.class);

    private final InvoiceRepository invoiceRepository;

    public DuplicateInvoiceDetector(InvoiceRepository invoiceRepository) {
        this.invoiceRepository = Objects.requireNonNull(invoiceRepository, "invoiceRepository");
    }

    public DuplicateCheck check(String vendorName, String invoiceNumber) {
        return check(vendorName, invoiceNumber, null);
    }

    /**
     * @param excludeInvoiceId an invoice to ignore, typically the one being checked after it was saved
     */
    public DuplicateCheck check(String vendorName, String invoiceNumber, String excludeInvoiceId) {
        if (!StringUtils.hasText(invoiceNumber)) {
            return DuplicateCheck.notDuplicate();
        }
        List<Invoice> candidates = invoiceRepository.findByInvoiceNumberIgnoreCase(invoiceNumber.trim());
        Optional<Invoice> match = candidates.stream()
            .filter(candidate -> excludeInvoiceId == null || !excludeInvoiceId.equals(candidate.id()))
            .filter(candidate -> sameVendor(candidate.vendorName(), vendorName))
            .findFirst();
        if (match.isEmpty()) {
            return DuplicateCheck.notDuplicate();
        }
        LOGGER.warn("Invoice {} from '{}' duplicates existing invoice {}", invoiceNumber, vendorName,
            match.get().id());
        return DuplicateCheck.duplicateOf(match.get());
    }

    private static boolean sameVendor(String existing, String candidate) {
        if (existing == null || candidate == null) {
            return false;
        }
        return existing.trim().equalsIgnoreCase(candidate.trim());
    }
}
