package tech.adaptivepool.pool;

/**
 * Lifecycle of a pool. Transitions only move forward; {@link #TERMINATED} is terminal.
 */
public enum PoolState {
    INITIALIZING,
    RUNNING,
    DRAINING,
    TERMINATED;

    public boolean acceptsTasks() {
        return this == INITIALIZING || this == RUNNING;
    }
}
