package tech.adaptivepool.pool;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * FIFO of tasks waiting for a unit. Crash-requeued tasks go to the front.
 * <p>
 * Not thread safe; owned by the dispatcher.
 */
public final class TaskQueue<P, R> {

    private final Deque<PoolTask<P, R>> tasks = new ArrayDeque<>();

    public void append(PoolTask<P, R> task) {
        tasks.addLast(task);
    }

    public void requeueFront(PoolTask<P, R> task) {
        task.markRequeued();
        tasks.addFirst(task);
    }

    /**
     * @return the earliest task, or null if empty
     */
    public PoolTask<P, R> poll() {
        return tasks.pollFirst();
    }

    public PoolTask<P, R> remove(long taskId) {
        Iterator<PoolTask<P, R>> it = tasks.iterator();
        while (it.hasNext()) {
            PoolTask<P, R> task = it.next();
            if (task.id() == taskId) {
                it.remove();
                return task;
            }
        }
        return null;
    }

    /**
     * Removes and returns every queued task in order.
     */
    public List<PoolTask<P, R>> drain() {
        List<PoolTask<P, R>> drained = new ArrayList<>(tasks);
        tasks.clear();
        return drained;
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }
}
