package tech.adaptivepool.pool;

import io.vertx.core.Future;

import java.util.function.LongFunction;

/**
 * Caller's view of a submitted task.
 *
 * @param <R> result type
 */
public final class TaskHandle<R> {

    private final long id;
    private final Future<R> future;
    private final LongFunction<Future<Boolean>> canceller;

    TaskHandle(long id, Future<R> future, LongFunction<Future<Boolean>> canceller) {
        this.id = id;
        this.future = future;
        this.canceller = canceller;
    }

    public long id() {
        return id;
    }

    public Future<R> future() {
        return future;
    }

    /**
     * Cancels the task. A queued task is removed and fails with
     * {@link tech.adaptivepool.error.TaskCancelledException} right away; a running task
     * fails the same way once its unit reports back or crashes. The unit is not interrupted.
     *
     * @return true if the cancellation was registered, false if the task had already settled
     */
    public Future<Boolean> cancel() {
        if (future.isComplete()) {
            return Future.succeededFuture(false);
        }
        return canceller.apply(id);
    }
}
