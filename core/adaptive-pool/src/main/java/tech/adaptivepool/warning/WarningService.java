package tech.adaptivepool.warning;

import tech.adaptivepool.model.Warning;

import java.util.List;

/**
 * Service for recording pool warnings
 */
public interface WarningService {

    String UNIT_RESTART = "UNIT_RESTART";
    String POOL_FATAL = "POOL_FATAL";
    String POOL_LIMIT = "POOL_LIMIT";

    /**
     * Add a new warning
     */
    void addWarning(String category, String severity, String message, String source);

    /**
     * All warnings, newest first
     */
    List<Warning> getAllWarnings();

    List<Warning> getWarningsByCategory(String category);

    List<Warning> getUnacknowledgedWarnings();

    /**
     * @return false if no warning has the given id
     */
    boolean acknowledgeWarning(String warningId);

    void clearAllWarnings();
}
