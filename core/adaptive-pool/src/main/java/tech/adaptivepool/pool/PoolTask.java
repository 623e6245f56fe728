package tech.adaptivepool.pool;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;

/**
 * One submitted task and its write-once completion.
 * <p>
 * Settling records the outcome; {@link #publish()} hands it to the caller's future. The
 * dispatcher publishes only after its snapshot reflects the settlement.
 * Mutable fields are only touched on the dispatcher's event loop.
 */
public final class PoolTask<P, R> {

    private final long id;
    private final P payload;
    private final long submittedAt;
    private final Promise<R> completion;

    private AsyncResult<R> outcome;
    private long dispatchedAt = -1;
    private int unitId = -1;
    private boolean cancelRequested = false;
    private long timeoutTimerId = -1;

    public PoolTask(long id, P payload, long submittedAt, Promise<R> completion) {
        this.id = id;
        this.payload = payload;
        this.submittedAt = submittedAt;
        this.completion = completion;
    }

    public long id() {
        return id;
    }

    public P payload() {
        return payload;
    }

    public long submittedAt() {
        return submittedAt;
    }

    public Future<R> future() {
        return completion.future();
    }

    /**
     * @return false if the task was already settled
     */
    public boolean tryComplete(R value) {
        return settle(Future.succeededFuture(value));
    }

    /**
     * @return false if the task was already settled
     */
    public boolean tryFail(Throwable cause) {
        return settle(Future.failedFuture(cause));
    }

    private boolean settle(AsyncResult<R> result) {
        if (outcome != null) {
            return false;
        }
        outcome = result;
        return true;
    }

    /**
     * Completes the caller's future with the recorded outcome. No-op until settled.
     */
    public void publish() {
        if (outcome == null) {
            return;
        }
        if (outcome.succeeded()) {
            completion.tryComplete(outcome.result());
        } else {
            completion.tryFail(outcome.cause());
        }
    }

    /**
     * Settles and publishes at once, for rejections that never reach the dispatcher.
     */
    public void rejectNow(Throwable cause) {
        tryFail(cause);
        publish();
    }

    public boolean isSettled() {
        return outcome != null;
    }

    public void markDispatched(int unitId, long now) {
        this.unitId = unitId;
        this.dispatchedAt = now;
    }

    /**
     * Back to queued, after the owning unit crashed.
     */
    void markRequeued() {
        this.unitId = -1;
        this.dispatchedAt = -1;
        this.timeoutTimerId = -1;
    }

    public long dispatchedAt() {
        return dispatchedAt;
    }

    public int unitId() {
        return unitId;
    }

    public boolean isInFlight() {
        return unitId >= 0;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void requestCancel() {
        this.cancelRequested = true;
    }

    public long timeoutTimerId() {
        return timeoutTimerId;
    }

    public void timeoutTimerId(long timerId) {
        this.timeoutTimerId = timerId;
    }

    @Override
    public String toString() {
        return "PoolTask[" + id + "]";
    }
}
