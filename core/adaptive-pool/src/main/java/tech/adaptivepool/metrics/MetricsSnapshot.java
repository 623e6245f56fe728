package tech.adaptivepool.metrics;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Immutable view of a pool's counters and current shape.
 * <p>
 * {@code tasksProcessed} counts tasks a unit reported on, successful or not; timeouts,
 * cancellations and rejections are counted separately.
 */
@JsonPropertyOrder({"poolName", "state", "capturedAt"})
public record MetricsSnapshot(
    String poolName,
    String state,
    long capturedAt,
    long tasksSubmitted,
    long tasksProcessed,
    long tasksSucceeded,
    long tasksFailed,
    long tasksTimedOut,
    long tasksCancelled,
    long tasksRejected,
    long scaleUpEvents,
    long scaleDownEvents,
    int peakUnits,
    int peakQueueDepth,
    long unitCrashes,
    long unitRestarts,
    long fatalErrors,
    int currentUnits,
    int busyUnits,
    int queueDepth,
    double averageProcessingTimeMs,
    List<UnitStats> perUnit
) {

    public MetricsSnapshot {
        perUnit = List.copyOf(perUnit);
    }

    /**
     * Stats for one slot, or null if the slot is not in the pool.
     */
    public UnitStats unit(int id) {
        return perUnit.stream().filter(u -> u.id() == id).findFirst().orElse(null);
    }
}
