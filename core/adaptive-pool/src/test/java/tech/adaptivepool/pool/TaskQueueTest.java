package tech.adaptivepool.pool;

import io.vertx.core.Promise;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueueTest {

    private final TaskQueue<String, String> queue = new TaskQueue<>();

    private PoolTask<String, String> task(long id) {
        return new PoolTask<>(id, "payload-" + id, System.currentTimeMillis(), Promise.promise());
    }

    @Test
    void pollsInSubmissionOrder() {
        queue.append(task(1));
        queue.append(task(2));
        queue.append(task(3));

        assertEquals(1, queue.poll().id());
        assertEquals(2, queue.poll().id());
        assertEquals(3, queue.poll().id());
        assertNull(queue.poll());
    }

    @Test
    void requeuedTaskGoesFirstAndIsNoLongerInFlight() {
        PoolTask<String, String> interrupted = task(1);
        interrupted.markDispatched(4, System.currentTimeMillis());
        queue.append(task(2));

        queue.requeueFront(interrupted);

        PoolTask<String, String> next = queue.poll();
        assertSame(interrupted, next);
        assertFalse(next.isInFlight());
        assertEquals(-1, next.unitId());
    }

    @Test
    void removeById() {
        queue.append(task(1));
        queue.append(task(2));
        queue.append(task(3));

        assertEquals(2, queue.remove(2).id());
        assertNull(queue.remove(2));
        assertEquals(2, queue.size());
        assertEquals(1, queue.poll().id());
        assertEquals(3, queue.poll().id());
    }

    @Test
    void drainEmptiesInOrder() {
        queue.append(task(1));
        queue.append(task(2));

        List<PoolTask<String, String>> drained = queue.drain();

        assertEquals(List.of(1L, 2L), drained.stream().map(PoolTask::id).toList());
        assertTrue(queue.isEmpty());
    }

    @Test
    void taskSettlesOnlyOnce() {
        PoolTask<String, String> task = task(1);

        assertTrue(task.tryComplete("first"));
        assertFalse(task.tryFail(new RuntimeException("late")));
        assertFalse(task.tryComplete("second"));
        assertTrue(task.isSettled());
        assertFalse(task.future().isComplete(), "outcome stays unpublished until the dispatcher releases it");

        task.publish();

        assertEquals("first", task.future().result());
    }

    @Test
    void rejectNowPublishesImmediately() {
        PoolTask<String, String> task = task(1);

        task.rejectNow(new IllegalStateException("closed"));

        assertTrue(task.future().failed());
        assertEquals("closed", task.future().cause().getMessage());
        assertFalse(task.tryComplete("late"));
    }
}
