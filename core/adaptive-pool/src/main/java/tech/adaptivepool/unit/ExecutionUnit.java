package tech.adaptivepool.unit;

/**
 * Handle to one isolated concurrent context that executes at most one task at a time.
 * <p>
 * State machine:
 * <pre>
 * IDLE --assign--> BUSY --onResult/onError--> IDLE
 * BUSY --onExit(non-zero)--> removed (crash)
 * IDLE --onExit--> removed (voluntary shutdown, e.g. scale-down)
 * </pre>
 * Results and exits are reported asynchronously through the {@link UnitEvents} the unit
 * was spawned with.
 *
 * @param <P> payload type
 */
public interface ExecutionUnit<P> {

    int EXIT_NORMAL = 0;
    int EXIT_CRASHED = 1;
    int EXIT_KILLED = 137;

    /**
     * Slot id this unit occupies in its pool.
     */
    int id();

    /**
     * Hands one task to the unit.
     *
     * @throws IllegalStateException if the unit is already busy or has exited
     */
    void assign(long taskId, P payload);

    /**
     * Asks the unit to finish its current task, if any, and exit with {@link #EXIT_NORMAL}.
     */
    void shutdown();

    /**
     * Terminates the unit immediately. Reports {@link #EXIT_KILLED}; a task in progress
     * produces no result.
     */
    void kill();

    boolean isBusy();

    boolean isAlive();
}
