package tech.adaptivepool.error;

/**
 * The work a unit performed for a task failed.
 * <p>
 * Local to the task's future, never affects pool health.
 */
public class TaskException extends PoolException {

    private final long taskId;
    private final String errorType;

    public TaskException(String poolName, long taskId, String errorType, String message, Throwable cause) {
        super(poolName, String.format("Task [%d] failed in pool [%s]: %s", taskId, poolName, message), cause);
        this.taskId = taskId;
        this.errorType = errorType;
    }

    protected TaskException(String poolName, long taskId, String errorType, String message) {
        super(poolName, message);
        this.taskId = taskId;
        this.errorType = errorType;
    }

    public long getTaskId() {
        return taskId;
    }

    /**
     * Simple class name of the handler's exception, or a pool-defined category
     * such as {@code TIMEOUT} or {@code CANCELLED}.
     */
    public String getErrorType() {
        return errorType;
    }
}
