package dev.pekelund.reconcile.processor;

import dev.pekelund.reconcile.classification.ClassificationResult;
import dev.pekelund.reconcile.classification.ClassifiedColumn;
import dev.pekelund.reconcile.classification.ColumnClassificationWizard;
import dev.pekelund.reconcile.errors.NotFoundException;
import dev.pekelund.reconcile.profile.ParsingProfile;
import dev.pekelund.reconcile.profile.SampleLine;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hosts column classification wizards between requests. Sessions live in memory until they are
 * completed or cancelled; calls on one session are serialized.
 */
@Service
public class ClassificationSessionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClassificationSessionService.class);

    private final Map<String, ColumnClassificationWizard> sessions = new ConcurrentHashMap<>();
    private final VendorProfileManager profileManager;
    private final Clock clock;

    public ClassificationSessionService(VendorProfileManager profileManager, Clock clock) {
        this.profileManager = Objects.requireNonNull(profileManager, "profileManager");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String start(String vendorId, String vendorName, List<ClassifiedColumn> columns,
        List<SampleLine> sampleLines) {

        ParsingProfile existing = profileManager.load(vendorId).orElse(null);
        String name = vendorName != null ? vendorName : existing != null ? existing.vendorName() : null;
        ColumnClassificationWizard wizard = new ColumnClassificationWizard(vendorId, name, columns, sampleLines,
            existing);
        String sessionId = UUID.randomUUID().toString();
        sessions.put(sessionId, wizard);
        LOGGER.info("Started classification session {} for vendor {} with {} columns and {} sample lines", sessionId,
            vendorId, wizard.columns().size(), wizard.lines().size());
        return sessionId;
    }

    public ColumnClassificationWizard get(String vendorId, String sessionId) {
        ColumnClassificationWizard wizard = sessions.get(sessionId);
        if (wizard == null || !wizard.vendorId().equals(vendorId)) {
            throw NotFoundException.of("Classification session", sessionId);
        }
        return wizard;
    }

    /**
     * Applies a change to a session's wizard.
     */
    public ColumnClassificationWizard update(String vendorId, String sessionId,
        Consumer<ColumnClassificationWizard> change) {

        ColumnClassificationWizard wizard = get(vendorId, sessionId);
        synchronized (wizard) {
            change.accept(wizard);
        }
        return wizard;
    }

    /**
     * Completes the wizard, stores the resulting profile and closes the session.
     */
    public ClassificationOutcome complete(String vendorId, String sessionId) {
        ColumnClassificationWizard wizard = get(vendorId, sessionId);
        ClassificationResult result;
        synchronized (wizard) {
            result = wizard.complete(clock.instant());
        }
        ParsingProfile saved = profileManager.applyClassification(result);
        sessions.remove(sessionId);
        LOGGER.info("Completed classification session {} for vendor {} (correctness {})", sessionId, vendorId,
            result.correctnessRatio());
        return new ClassificationOutcome(saved, result);
    }

    public void cancel(String vendorId, String sessionId) {
        get(vendorId, sessionId);
        sessions.remove(sessionId);
        LOGGER.info("Cancelled classification session {} for vendor {}", sessionId, vendorId);
    }

    /**
     * @param profile the stored profile, including its regenerated prompt hints
     */
    public record ClassificationOutcome(ParsingProfile profile, ClassificationResult result) {
    }
}
