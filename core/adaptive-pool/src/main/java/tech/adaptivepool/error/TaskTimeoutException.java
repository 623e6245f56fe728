package tech.adaptivepool.error;

import java.time.Duration;

/**
 * Thrown when a task does not complete within the configured per-task timeout.
 */
public class TaskTimeoutException extends TaskException {

    private final Duration timeout;

    public TaskTimeoutException(String poolName, long taskId, Duration timeout) {
        super(poolName, taskId, "TIMEOUT",
            String.format("Task [%d] in pool [%s] timed out after %dms", taskId, poolName, timeout.toMillis()));
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
