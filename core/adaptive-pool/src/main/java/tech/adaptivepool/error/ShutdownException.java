package tech.adaptivepool.error;

/**
 * Returned to any task queued or submitted during or after pool termination,
 * and to in-flight tasks whose unit was force-terminated after the grace period.
 */
public class ShutdownException extends PoolException {

    public ShutdownException(String poolName, String message) {
        super(poolName, message);
    }
}
