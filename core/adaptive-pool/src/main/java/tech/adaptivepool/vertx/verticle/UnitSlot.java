package tech.adaptivepool.vertx.verticle;

import tech.adaptivepool.pool.PoolTask;
import tech.adaptivepool.unit.ExecutionUnit;
import tech.adaptivepool.unit.UnitStatus;

/**
 * Dispatcher bookkeeping for one unit slot. A replacement unit takes over the slot's id
 * and counters.
 */
final class UnitSlot<P, R> {

    private final int id;
    private ExecutionUnit<P> handle;
    private UnitStatus status = UnitStatus.IDLE;
    private PoolTask<P, R> currentTask;
    private long startedAt;
    private long tasksCompleted;
    private long tasksFailed;
    private int restarts;

    UnitSlot(int id, long startedAt) {
        this.id = id;
        this.startedAt = startedAt;
    }

    /**
     * Fresh slot for a replacement unit, carrying the crashed slot's history.
     */
    UnitSlot<P, R> successor(long now) {
        UnitSlot<P, R> next = new UnitSlot<>(id, now);
        next.tasksCompleted = tasksCompleted;
        next.tasksFailed = tasksFailed;
        next.restarts = restarts;
        return next;
    }

    int id() {
        return id;
    }

    ExecutionUnit<P> handle() {
        return handle;
    }

    void handle(ExecutionUnit<P> handle) {
        this.handle = handle;
    }

    UnitStatus status() {
        return status;
    }

    void status(UnitStatus status) {
        this.status = status;
    }

    PoolTask<P, R> currentTask() {
        return currentTask;
    }

    void currentTask(PoolTask<P, R> task) {
        this.currentTask = task;
    }

    long startedAt() {
        return startedAt;
    }

    long tasksCompleted() {
        return tasksCompleted;
    }

    void incrementCompleted() {
        tasksCompleted++;
    }

    long tasksFailed() {
        return tasksFailed;
    }

    void incrementFailed() {
        tasksFailed++;
    }

    int restarts() {
        return restarts;
    }

    void restarts(int restarts) {
        this.restarts = restarts;
    }
}
