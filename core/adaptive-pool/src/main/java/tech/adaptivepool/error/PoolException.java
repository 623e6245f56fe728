package tech.adaptivepool.error;

/**
 * Base type for every failure the pool reports through a task's future.
 * <p>
 * All pool failures are unchecked: they travel inside the {@code Future} returned by
 * {@code AdaptivePool.execute(...)} rather than being thrown from the call site.
 */
public class PoolException extends RuntimeException {

    private final String poolName;

    public PoolException(String poolName, String message) {
        super(message);
        this.poolName = poolName;
    }

    public PoolException(String poolName, String message, Throwable cause) {
        super(message, cause);
        this.poolName = poolName;
    }

    public String getPoolName() {
        return poolName;
    }
}
