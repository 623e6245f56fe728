package tech.adaptivepool.pool;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import tech.adaptivepool.metrics.MetricsSnapshot;
import tech.adaptivepool.model.Warning;
import tech.adaptivepool.pool.PoolTestSupport.Job;
import tech.adaptivepool.warning.WarningService;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static tech.adaptivepool.pool.PoolTestSupport.TIMEOUT;
import static tech.adaptivepool.pool.PoolTestSupport.config;
import static tech.adaptivepool.pool.PoolTestSupport.join;
import static tech.adaptivepool.pool.PoolTestSupport.startPool;

/**
 * Load-driven scaling: light load stays at minimum, bursts scale up within bounds and back down.
 */
@ExtendWith(VertxExtension.class)
class AdaptivePoolScalingTest {

    private Vertx vertx;

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
    }

    @Test
    void lightLoadStaysAtMinimum() {
        // No tick fires during the run: with both units busy and tasks waiting, a tick would
        // scale up on starvation even below the threshold (see starvedQueueScalesUpBelowThreshold)
        AdaptivePool<Job, String> pool = startPool(vertx, config(vertx, "light").minUnits(2).maxUnits(8)
            .scaleUpThreshold(10).checkIntervalMs(5_000).build());

        List<Future<String>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(pool.execute(Job.sleeping("light-" + i, 300)));
        }
        join(Future.all(new ArrayList<>(futures)));

        await().atMost(TIMEOUT).until(() -> pool.getMetrics().busyUnits() == 0);
        MetricsSnapshot metrics = pool.getMetrics();
        assertEquals(0, metrics.scaleUpEvents());
        assertEquals(2, metrics.currentUnits());
        assertEquals(2, metrics.peakUnits());
        assertEquals(5, metrics.tasksSucceeded());
    }

    @Test
    void starvedQueueScalesUpBelowThreshold() {
        AdaptivePool<Job, String> pool = startPool(vertx, config(vertx, "starved").minUnits(2).maxUnits(8)
            .scaleUpThreshold(10).checkIntervalMs(50).coolDownMs(100).build());

        List<Future<String>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(pool.execute(Job.sleeping("starved-" + i, 500)));
        }
        join(Future.all(new ArrayList<>(futures)));

        MetricsSnapshot metrics = pool.getMetrics();
        assertTrue(metrics.peakQueueDepth() <= 10, "queue never passed the threshold");
        assertTrue(metrics.scaleUpEvents() >= 1, "waiting tasks with no idle unit add a unit");
        assertTrue(metrics.peakUnits() > 2 && metrics.peakUnits() <= 5, "peak " + metrics.peakUnits());
    }

    @Test
    void burstScalesUpWithinMaxAndBackDown() {
        AdaptivePool<Job, String> pool = startPool(vertx, config(vertx, "burst").minUnits(2).maxUnits(8)
            .scaleUpThreshold(10).scaleDownThreshold(0).checkIntervalMs(50).coolDownMs(100).build());
        AtomicInteger observedMax = new AtomicInteger();
        long sampler = vertx.setPeriodic(10, id ->
            observedMax.accumulateAndGet(pool.getMetrics().currentUnits(), Math::max));

        List<Future<String>> futures = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            futures.add(pool.execute(Job.sleeping("burst-" + i, 200)));
        }
        join(Future.all(new ArrayList<>(futures)));

        MetricsSnapshot afterBurst = pool.getMetrics();
        assertTrue(afterBurst.scaleUpEvents() >= 1, "expected at least one scale up");
        assertTrue(afterBurst.peakUnits() > 2 && afterBurst.peakUnits() <= 8, "peak " + afterBurst.peakUnits());
        assertTrue(afterBurst.peakQueueDepth() > 10, "peak queue " + afterBurst.peakQueueDepth());

        await().atMost(TIMEOUT).until(() -> pool.getMetrics().currentUnits() == 2);
        vertx.cancelTimer(sampler);

        MetricsSnapshot settled = pool.getMetrics();
        assertTrue(settled.scaleDownEvents() >= 1);
        assertEquals(0, settled.unitCrashes());
        assertEquals(0, settled.unitRestarts());
        assertTrue(observedMax.get() <= 8, "observed " + observedMax.get());
        assertEquals(30, settled.tasksSucceeded());
    }

    @Test
    void scalingActionsAreSpacedByCoolDown() throws InterruptedException {
        AdaptivePool<Job, String> pool = startPool(vertx, config(vertx, "cooldown").minUnits(1).maxUnits(8)
            .scaleUpThreshold(2).checkIntervalMs(50).coolDownMs(1_000).build());

        for (int i = 0; i < 30; i++) {
            pool.execute(Job.sleeping("c" + i, 300));
        }
        Thread.sleep(1_500);

        long scaleUps = pool.getMetrics().scaleUpEvents();
        assertTrue(scaleUps >= 1 && scaleUps <= 2, "scale ups " + scaleUps);
    }

    @Test
    void saturationAtMaxRaisesLimitWarningOnce() {
        AdaptivePool<Job, String> pool = startPool(vertx, config(vertx, "saturated").minUnits(1).maxUnits(1)
            .scaleUpThreshold(2).checkIntervalMs(50).build());

        for (int i = 0; i < 8; i++) {
            pool.execute(Job.sleeping("s" + i, 100));
        }

        await().atMost(TIMEOUT).until(() ->
            !pool.getWarningService().getWarningsByCategory(WarningService.POOL_LIMIT).isEmpty());
        await().atMost(TIMEOUT).until(() -> pool.getMetrics().tasksSucceeded() == 8);

        List<Warning> warnings = pool.getWarningService().getWarningsByCategory(WarningService.POOL_LIMIT);
        assertEquals(1, warnings.size());
        assertEquals("AdaptivePool:saturated", warnings.get(0).source());
        assertEquals(0, pool.getMetrics().scaleUpEvents());
    }
}
