package tech.adaptivepool.error;

/**
 * Thrown when a submission would exceed the pool's queue capacity.
 */
public class QueueFullException extends PoolException {

    private final int queueCapacity;

    public QueueFullException(String poolName, int queueCapacity) {
        super(poolName, String.format("Pool [%s] queue at capacity (%d)", poolName, queueCapacity));
        this.queueCapacity = queueCapacity;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }
}
