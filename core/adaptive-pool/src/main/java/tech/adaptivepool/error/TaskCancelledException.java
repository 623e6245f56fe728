package tech.adaptivepool.error;

/**
 * Thrown when a task was cancelled by its submitter.
 */
public class TaskCancelledException extends TaskException {

    private final boolean wasInFlight;

    public TaskCancelledException(String poolName, long taskId, boolean wasInFlight) {
        super(poolName, taskId, "CANCELLED",
            String.format("Task [%d] in pool [%s] was cancelled%s", taskId, poolName,
                wasInFlight ? " after it had been dispatched" : " while queued"));
        this.wasInFlight = wasInFlight;
    }

    /**
     * True when the cancellation took effect at a completion or crash boundary
     * rather than by removal from the queue.
     */
    public boolean wasInFlight() {
        return wasInFlight;
    }
}
