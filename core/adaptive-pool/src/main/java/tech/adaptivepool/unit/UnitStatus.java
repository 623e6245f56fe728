package tech.adaptivepool.unit;

/**
 * Lifecycle status of an execution unit as tracked by the dispatcher.
 */
public enum UnitStatus {
    IDLE,
    BUSY,
    TERMINATING
}
