package tech.adaptivepool.metrics;

import java.util.List;

/**
 * Pool-local counters behind {@link MetricsSnapshot}, mirrored to a {@link PoolMetricsService}.
 * <p>
 * Not thread safe: only the dispatcher writes to it. Readers get immutable snapshots.
 */
public final class MetricsCollector {

    private final String poolName;
    private final PoolMetricsService metricsService;

    private long tasksSubmitted;
    private long tasksSucceeded;
    private long tasksFailed;
    private long tasksTimedOut;
    private long tasksCancelled;
    private long tasksRejected;
    private long scaleUpEvents;
    private long scaleDownEvents;
    private int peakUnits;
    private int peakQueueDepth;
    private long unitCrashes;
    private long unitRestarts;
    private long fatalErrors;
    private long totalProcessingTimeMs;

    public MetricsCollector(String poolName, PoolMetricsService metricsService) {
        this.poolName = poolName;
        this.metricsService = metricsService;
    }

    public void initialize(int minUnits, int maxUnits, int queueCapacity) {
        metricsService.initializePool(poolName, minUnits, maxUnits, queueCapacity);
    }

    public void taskSubmitted() {
        tasksSubmitted++;
        metricsService.recordTaskSubmitted(poolName);
    }

    public void taskRejected(String reason) {
        tasksRejected++;
        metricsService.recordTaskRejected(poolName, reason);
    }

    public void taskSucceeded(long durationMs) {
        tasksSucceeded++;
        totalProcessingTimeMs += durationMs;
        metricsService.recordTaskSuccess(poolName, durationMs);
    }

    public void taskFailed(long durationMs, String errorType) {
        tasksFailed++;
        totalProcessingTimeMs += durationMs;
        metricsService.recordTaskFailure(poolName, durationMs, errorType);
    }

    public void taskTimedOut() {
        tasksTimedOut++;
        metricsService.recordTaskTimeout(poolName);
    }

    public void taskCancelled() {
        tasksCancelled++;
        metricsService.recordTaskCancelled(poolName);
    }

    public void rateLimited() {
        metricsService.recordRateLimitExceeded(poolName);
    }

    public void scaledUp(int unitsAfter) {
        scaleUpEvents++;
        observeUnits(unitsAfter);
        metricsService.recordScaleUp(poolName);
    }

    public void scaledDown() {
        scaleDownEvents++;
        metricsService.recordScaleDown(poolName);
    }

    public void unitCrashed() {
        unitCrashes++;
        metricsService.recordUnitCrash(poolName);
    }

    public void unitRestarted() {
        unitRestarts++;
        metricsService.recordUnitRestart(poolName);
    }

    public void poolFatal() {
        fatalErrors++;
        metricsService.recordPoolFatal(poolName);
    }

    public void observeUnits(int units) {
        peakUnits = Math.max(peakUnits, units);
    }

    public void observeQueueDepth(int queueDepth) {
        peakQueueDepth = Math.max(peakQueueDepth, queueDepth);
    }

    public void updateGauges(int units, int busyUnits, int idleUnits, int queueDepth) {
        metricsService.updatePoolGauges(poolName, units, busyUnits, idleUnits, queueDepth);
    }

    public void remove() {
        metricsService.removePoolMetrics(poolName);
    }

    public MetricsSnapshot snapshot(String state, int currentUnits, int busyUnits, int queueDepth,
                                    List<UnitStats> perUnit, long now) {
        long processed = tasksSucceeded + tasksFailed;
        double averageProcessingTimeMs = processed > 0 ? totalProcessingTimeMs / (double) processed : 0.0;
        return new MetricsSnapshot(
            poolName,
            state,
            now,
            tasksSubmitted,
            processed,
            tasksSucceeded,
            tasksFailed,
            tasksTimedOut,
            tasksCancelled,
            tasksRejected,
            scaleUpEvents,
            scaleDownEvents,
            peakUnits,
            peakQueueDepth,
            unitCrashes,
            unitRestarts,
            fatalErrors,
            currentUnits,
            busyUnits,
            queueDepth,
            averageProcessingTimeMs,
            perUnit
        );
    }
}
