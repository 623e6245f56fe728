package tech.adaptivepool.warning;

import org.jboss.logging.Logger;
import tech.adaptivepool.model.Warning;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * Bounded in-memory {@link WarningService}. The oldest warning is evicted once
 * {@code maxWarnings} is reached.
 */
public class InMemoryWarningService implements WarningService {

    private static final Logger LOG = Logger.getLogger(InMemoryWarningService.class);
    private static final int DEFAULT_MAX_WARNINGS = 1000;

    private static final Comparator<Warning> NEWEST_FIRST =
        Comparator.comparing(Warning::timestamp).reversed();

    private final ConcurrentMap<String, Warning> warnings = new ConcurrentHashMap<>();
    private final int maxWarnings;

    public InMemoryWarningService() {
        this(DEFAULT_MAX_WARNINGS);
    }

    public InMemoryWarningService(int maxWarnings) {
        this.maxWarnings = maxWarnings;
    }

    @Override
    public void addWarning(String category, String severity, String message, String source) {
        if (warnings.size() >= maxWarnings) {
            warnings.values().stream()
                .min(Comparator.comparing(Warning::timestamp))
                .ifPresent(oldest -> warnings.remove(oldest.id()));
        }

        Warning warning = new Warning(
            UUID.randomUUID().toString(),
            category,
            severity,
            message,
            Instant.now(),
            source,
            false
        );
        warnings.put(warning.id(), warning);
        LOG.infof("Warning added: [%s] %s - %s - %s", severity, category, source, message);
    }

    @Override
    public List<Warning> getAllWarnings() {
        return select(w -> true);
    }

    @Override
    public List<Warning> getWarningsByCategory(String category) {
        return select(w -> w.category().equalsIgnoreCase(category));
    }

    @Override
    public List<Warning> getUnacknowledgedWarnings() {
        return select(w -> !w.acknowledged());
    }

    @Override
    public boolean acknowledgeWarning(String warningId) {
        Warning acknowledged = warnings.computeIfPresent(warningId, (id, existing) -> existing.acknowledge());
        if (acknowledged == null) {
            return false;
        }
        LOG.infof("Warning acknowledged: %s", warningId);
        return true;
    }

    @Override
    public void clearAllWarnings() {
        int count = warnings.size();
        warnings.clear();
        LOG.infof("Cleared all warnings: %d warnings removed", count);
    }

    private List<Warning> select(Predicate<Warning> filter) {
        return warnings.values().stream()
            .filter(filter)
            .sorted(NEWEST_FIRST)
            .toList();
    }
}
