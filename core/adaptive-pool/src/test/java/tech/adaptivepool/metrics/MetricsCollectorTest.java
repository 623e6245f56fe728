package tech.adaptivepool.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MetricsCollectorTest {

    private static final String POOL = "collector";

    private PoolMetricsService metricsService;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        metricsService = mock(PoolMetricsService.class);
        collector = new MetricsCollector(POOL, metricsService);
    }

    @Test
    void snapshotAggregatesOutcomes() {
        collector.taskSubmitted();
        collector.taskSubmitted();
        collector.taskSubmitted();
        collector.taskSucceeded(100);
        collector.taskFailed(300, "IOException");
        collector.taskCancelled();

        MetricsSnapshot snapshot = collector.snapshot("RUNNING", 2, 0, 0, List.of(), 42L);

        assertEquals(POOL, snapshot.poolName());
        assertEquals("RUNNING", snapshot.state());
        assertEquals(42L, snapshot.capturedAt());
        assertEquals(3, snapshot.tasksSubmitted());
        assertEquals(2, snapshot.tasksProcessed());
        assertEquals(1, snapshot.tasksSucceeded());
        assertEquals(1, snapshot.tasksFailed());
        assertEquals(1, snapshot.tasksCancelled());
        assertEquals(200.0, snapshot.averageProcessingTimeMs(), 0.001);
    }

    @Test
    void peaksOnlyGrow() {
        collector.observeUnits(3);
        collector.scaledUp(5);
        collector.observeUnits(2);
        collector.observeQueueDepth(12);
        collector.observeQueueDepth(4);

        MetricsSnapshot snapshot = collector.snapshot("RUNNING", 2, 0, 4, List.of(), 0L);

        assertEquals(5, snapshot.peakUnits());
        assertEquals(12, snapshot.peakQueueDepth());
        assertEquals(1, snapshot.scaleUpEvents());
    }

    @Test
    void mirrorsEveryEventToMetricsService() {
        collector.initialize(2, 8, 0);
        collector.taskSucceeded(10);
        collector.taskFailed(20, "TimeoutError");
        collector.taskRejected("QUEUE_FULL");
        collector.taskTimedOut();
        collector.rateLimited();
        collector.scaledUp(3);
        collector.scaledDown();
        collector.unitCrashed();
        collector.unitRestarted();
        collector.poolFatal();
        collector.updateGauges(3, 1, 2, 0);
        collector.remove();

        verify(metricsService).initializePool(POOL, 2, 8, 0);
        verify(metricsService).recordTaskSuccess(POOL, 10);
        verify(metricsService).recordTaskFailure(POOL, 20, "TimeoutError");
        verify(metricsService).recordTaskRejected(POOL, "QUEUE_FULL");
        verify(metricsService).recordTaskTimeout(POOL);
        verify(metricsService).recordRateLimitExceeded(POOL);
        verify(metricsService).recordScaleUp(POOL);
        verify(metricsService).recordScaleDown(POOL);
        verify(metricsService).recordUnitCrash(POOL);
        verify(metricsService).recordUnitRestart(POOL);
        verify(metricsService).recordPoolFatal(POOL);
        verify(metricsService).updatePoolGauges(POOL, 3, 1, 2, 0);
        verify(metricsService).removePoolMetrics(POOL);
    }

    @Test
    void emptyPoolHasZeroAverage() {
        MetricsSnapshot snapshot = collector.snapshot("INITIALIZING", 0, 0, 0, List.of(), 0L);

        assertEquals(0.0, snapshot.averageProcessingTimeMs());
        assertEquals(0, snapshot.tasksProcessed());
    }

    @Test
    void snapshotListsUnitsById() {
        List<UnitStats> units = List.of(
            new UnitStats(0, "IDLE", 4, 0, 0, 1000),
            new UnitStats(1, "BUSY", 2, 1, 1, 500));

        MetricsSnapshot snapshot = collector.snapshot("RUNNING", 2, 1, 0, units, 0L);

        assertEquals(2, snapshot.perUnit().size());
        assertEquals(1, snapshot.unit(1).restarts());
        assertNull(snapshot.unit(9));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.perUnit().add(units.get(0)));
    }
}
