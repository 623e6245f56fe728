package tech.adaptivepool.metrics;

/**
 * Per-slot statistics inside a {@link MetricsSnapshot}.
 *
 * @param id             slot id
 * @param status         IDLE, BUSY or TERMINATING
 * @param tasksCompleted tasks the slot completed successfully, across replacements
 * @param tasksFailed    tasks whose work failed on this slot
 * @param restarts       crash replacements used by this slot
 * @param uptimeMs       age of the unit currently in the slot
 */
public record UnitStats(
    int id,
    String status,
    long tasksCompleted,
    long tasksFailed,
    int restarts,
    long uptimeMs
) {}
