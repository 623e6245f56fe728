package tech.adaptivepool.unit;

/**
 * Events an execution unit reports back to its pool.
 * <p>
 * Implementations may be called from any thread; the pool serializes them onto its
 * dispatcher before touching any state.
 *
 * @param <R> result type
 */
public interface UnitEvents<R> {

    /**
     * The task completed and produced a value.
     */
    void onResult(int unitId, long taskId, R value);

    /**
     * The task's work failed. The unit stays alive and becomes idle.
     */
    void onError(int unitId, long taskId, Throwable error);

    /**
     * The unit is gone. A non-zero code that the pool did not ask for is a crash.
     *
     * @see ExecutionUnit#EXIT_NORMAL
     * @see ExecutionUnit#EXIT_CRASHED
     * @see ExecutionUnit#EXIT_KILLED
     */
    void onExit(int unitId, int exitCode);
}
