package tech.adaptivepool.unit;

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import tech.adaptivepool.pool.PoolTestSupport.Job;
import tech.adaptivepool.vertx.codec.CodecRegistry;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static tech.adaptivepool.pool.PoolTestSupport.JOB_HANDLER;
import static tech.adaptivepool.pool.PoolTestSupport.TIMEOUT;

/**
 * Tests for verticle-backed execution units: results, failures, crashes, kill and shutdown.
 */
@ExtendWith(VertxExtension.class)
class VerticleUnitFactoryTest {

    private static final String POOL = "unit-test";

    private Vertx vertx;
    private RecordingEvents events;
    private VerticleUnitFactory<Job, String> factory;

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
        CodecRegistry.registerAll(vertx, CodecRegistry.defaultObjectMapper());
        this.events = new RecordingEvents();
        this.factory = new VerticleUnitFactory<>(vertx, POOL, JOB_HANDLER);
    }

    @Test
    void reportsResultFromOwnWorkerThread() {
        ExecutionUnit<Job> unit = factory.spawn(0, events);

        unit.assign(1, Job.quick("hello"));

        await().atMost(TIMEOUT).until(() -> events.all.size() == 1);
        Event event = events.all.get(0);
        assertEquals("result", event.kind());
        assertEquals(0, event.unitId());
        assertEquals(1, event.taskId());
        assertTrue(((String) event.value()).startsWith("hello@" + POOL + "-unit-0-"), event.value().toString());
        assertFalse(unit.isBusy());
        assertTrue(unit.isAlive());
    }

    @Test
    void handlerExceptionFailsOnlyTheTask() {
        ExecutionUnit<Job> unit = factory.spawn(0, events);

        unit.assign(1, Job.failing("broken"));
        await().atMost(TIMEOUT).until(() -> events.all.size() == 1);
        unit.assign(2, Job.quick("after"));
        await().atMost(TIMEOUT).until(() -> events.all.size() == 2);

        assertEquals("error", events.all.get(0).kind());
        assertInstanceOf(IOException.class, events.all.get(0).value());
        assertEquals("result", events.all.get(1).kind());
        assertTrue(unit.isAlive());
    }

    @Test
    void handlerErrorCrashesTheUnit() {
        ExecutionUnit<Job> unit = factory.spawn(3, events);

        unit.assign(1, Job.crashing("boom"));

        await().atMost(TIMEOUT).until(() -> events.all.size() == 1);
        assertEquals(new Event("exit", 3, -1, ExecutionUnit.EXIT_CRASHED), events.all.get(0));
        assertFalse(unit.isAlive());
        assertThrows(IllegalStateException.class, () -> unit.assign(2, Job.quick("late")));
    }

    @Test
    void assignWhileBusyIsRejected() {
        ExecutionUnit<Job> unit = factory.spawn(0, events);

        unit.assign(1, Job.sleeping("slow", 300));

        assertTrue(unit.isBusy());
        assertThrows(IllegalStateException.class, () -> unit.assign(2, Job.quick("second")));
        await().atMost(TIMEOUT).until(() -> events.all.size() == 1);
        assertEquals(1, events.all.get(0).taskId());
    }

    @Test
    void killReportsExitImmediatelyAndDropsResult() throws InterruptedException {
        ExecutionUnit<Job> unit = factory.spawn(0, events);
        unit.assign(1, Job.sleeping("doomed", 300));

        unit.kill();

        assertEquals(List.of(new Event("exit", 0, -1, ExecutionUnit.EXIT_KILLED)), events.all);
        assertFalse(unit.isAlive());
        Thread.sleep(600);
        assertEquals(1, events.all.size(), "killed unit must not report a result");
    }

    @Test
    void shutdownFinishesCurrentTaskBeforeExit() {
        ExecutionUnit<Job> unit = factory.spawn(0, events);
        unit.assign(1, Job.sleeping("last", 200));

        unit.shutdown();

        await().atMost(TIMEOUT).until(() -> events.all.size() == 2);
        assertEquals("result", events.all.get(0).kind());
        assertEquals(new Event("exit", 0, -1, ExecutionUnit.EXIT_NORMAL), events.all.get(1));
        assertThrows(IllegalStateException.class, () -> unit.assign(2, Job.quick("rejected")));
    }

    @Test
    void replacementsGetDistinctAddresses() {
        RecordingEvents second = new RecordingEvents();
        ExecutionUnit<Job> first = factory.spawn(0, events);
        first.kill();
        ExecutionUnit<Job> replacement = factory.spawn(0, second);

        replacement.assign(5, Job.quick("again"));

        await().atMost(TIMEOUT).until(() -> second.all.size() == 1);
        assertEquals("result", second.all.get(0).kind());
        assertTrue(((String) second.all.get(0).value()).contains(POOL + "-unit-0-1"));
        assertEquals(1, events.all.size());
    }

    record Event(String kind, int unitId, long taskId, Object value) {}

    static class RecordingEvents implements UnitEvents<String> {

        final List<Event> all = new CopyOnWriteArrayList<>();

        @Override
        public void onResult(int unitId, long taskId, String value) {
            all.add(new Event("result", unitId, taskId, value));
        }

        @Override
        public void onError(int unitId, long taskId, Throwable error) {
            all.add(new Event("error", unitId, taskId, error));
        }

        @Override
        public void onExit(int unitId, int exitCode) {
            all.add(new Event("exit", unitId, -1, exitCode));
        }
    }
}
