package tech.adaptivepool.metrics;

/**
 * Service for publishing adaptive pool metrics to a monitoring backend.
 */
public interface PoolMetricsService {

    /**
     * Initialize pool sizing settings (called once when the pool starts)
     */
    void initializePool(String poolName, int minUnits, int maxUnits, int queueCapacity);

    /**
     * Record that a task was accepted into the queue
     */
    void recordTaskSubmitted(String poolName);

    /**
     * Record that a task was refused at admission or dropped from the queue
     *
     * @param reason short category, e.g. {@code QUEUE_FULL}, {@code SHUTDOWN}, {@code POOL_FATAL}
     */
    void recordTaskRejected(String poolName, String reason);

    /**
     * Record that a unit returned a result
     */
    void recordTaskSuccess(String poolName, long durationMs);

    /**
     * Record that a unit reported a failure for its task
     */
    void recordTaskFailure(String poolName, long durationMs, String errorType);

    void recordTaskTimeout(String poolName);

    void recordTaskCancelled(String poolName);

    /**
     * Record that a dispatch was held back by the rate limiter
     */
    void recordRateLimitExceeded(String poolName);

    void recordScaleUp(String poolName);

    void recordScaleDown(String poolName);

    /**
     * Record an unexpected unit exit
     */
    void recordUnitCrash(String poolName);

    /**
     * Record that a crashed unit was replaced in its slot
     */
    void recordUnitRestart(String poolName);

    /**
     * Record that a slot exhausted its restarts and the pool halted
     */
    void recordPoolFatal(String poolName);

    /**
     * Update gauge metrics for pool state
     *
     * @param poolName   the pool name
     * @param units      live units, excluding terminating ones
     * @param busyUnits  units currently running a task
     * @param idleUnits  units waiting for a task
     * @param queueDepth tasks waiting for a unit
     */
    void updatePoolGauges(String poolName, int units, int busyUnits, int idleUnits, int queueDepth);

    /**
     * Remove all metrics for a pool
     * Called when the pool terminates
     */
    void removePoolMetrics(String poolName);
}
