package tech.adaptivepool.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link PoolMetricsService} backed by a Micrometer {@link MeterRegistry}.
 * <p>
 * Every meter is named {@code adaptivepool.pool.*} and tagged with {@code pool}.
 */
public class MicrometerPoolMetricsService implements PoolMetricsService {

    private static final Logger LOG = Logger.getLogger(MicrometerPoolMetricsService.class);

    static final String PREFIX = "adaptivepool.pool.";

    private final MeterRegistry meterRegistry;
    private final Map<String, PoolMetricsHolder> poolMetrics = new ConcurrentHashMap<>();

    public MicrometerPoolMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void initializePool(String poolName, int minUnits, int maxUnits, int queueCapacity) {
        PoolMetricsHolder metrics = getOrCreateMetrics(poolName);
        metrics.minUnits.set(minUnits);
        metrics.maxUnits.set(maxUnits);
        metrics.queueCapacity.set(queueCapacity);
    }

    @Override
    public void recordTaskSubmitted(String poolName) {
        getOrCreateMetrics(poolName).tasksSubmitted.increment();
    }

    @Override
    public void recordTaskRejected(String poolName, String reason) {
        getOrCreateMetrics(poolName);
        Counter.builder(PREFIX + "tasks.rejected")
            .tag("pool", poolName)
            .tag("reason", reason)
            .description("Tasks refused at admission or dropped from the queue")
            .register(meterRegistry)
            .increment();
    }

    @Override
    public void recordTaskSuccess(String poolName, long durationMs) {
        PoolMetricsHolder metrics = getOrCreateMetrics(poolName);
        metrics.tasksSucceeded.increment();
        metrics.processingTimer.record(Duration.ofMillis(durationMs));
    }

    @Override
    public void recordTaskFailure(String poolName, long durationMs, String errorType) {
        PoolMetricsHolder metrics = getOrCreateMetrics(poolName);
        metrics.tasksFailed.increment();
        metrics.processingTimer.record(Duration.ofMillis(durationMs));

        // Track error type
        Counter.builder(PREFIX + "errors")
            .tag("pool", poolName)
            .tag("errorType", errorType)
            .register(meterRegistry)
            .increment();
    }

    @Override
    public void recordTaskTimeout(String poolName) {
        getOrCreateMetrics(poolName).tasksTimedOut.increment();
    }

    @Override
    public void recordTaskCancelled(String poolName) {
        getOrCreateMetrics(poolName).tasksCancelled.increment();
    }

    @Override
    public void recordRateLimitExceeded(String poolName) {
        getOrCreateMetrics(poolName).tasksRateLimited.increment();
    }

    @Override
    public void recordScaleUp(String poolName) {
        getOrCreateMetrics(poolName).scaleUps.increment();
    }

    @Override
    public void recordScaleDown(String poolName) {
        getOrCreateMetrics(poolName).scaleDowns.increment();
    }

    @Override
    public void recordUnitCrash(String poolName) {
        getOrCreateMetrics(poolName).unitCrashes.increment();
    }

    @Override
    public void recordUnitRestart(String poolName) {
        getOrCreateMetrics(poolName).unitRestarts.increment();
    }

    @Override
    public void recordPoolFatal(String poolName) {
        getOrCreateMetrics(poolName).fatalErrors.increment();
    }

    @Override
    public void updatePoolGauges(String poolName, int units, int busyUnits, int idleUnits, int queueDepth) {
        PoolMetricsHolder metrics = getOrCreateMetrics(poolName);
        metrics.units.set(units);
        metrics.busyUnits.set(busyUnits);
        metrics.idleUnits.set(idleUnits);
        metrics.queueDepth.set(queueDepth);
    }

    @Override
    public void removePoolMetrics(String poolName) {
        PoolMetricsHolder metrics = poolMetrics.remove(poolName);
        if (metrics == null) {
            LOG.debugf("No metrics found for pool: %s", poolName);
            return;
        }

        LOG.infof("Removing Micrometer metrics for pool: %s", poolName);
        // Includes the per-reason and per-errorType counters registered on demand
        List<Meter> meters = meterRegistry.getMeters().stream()
            .filter(meter -> meter.getId().getName().startsWith(PREFIX))
            .filter(meter -> poolName.equals(meter.getId().getTag("pool")))
            .toList();
        meters.forEach(meterRegistry::remove);
        LOG.infof("Removed %d meters for pool: %s", meters.size(), poolName);
    }

    private PoolMetricsHolder getOrCreateMetrics(String poolName) {
        return poolMetrics.computeIfAbsent(poolName, name -> {
            LOG.infof("Creating Micrometer metrics for pool: %s", name);
            List<Tag> tags = List.of(Tag.of("pool", name));

            Timer processingTimer = Timer.builder(PREFIX + "processing.duration")
                .tags(tags)
                .description("Time from dispatch to result or failure")
                .register(meterRegistry);

            PoolMetricsHolder holder = new PoolMetricsHolder(
                counter(PREFIX + "tasks.submitted", tags, "Tasks accepted into the queue"),
                counter(PREFIX + "tasks.succeeded", tags, "Tasks that produced a result"),
                counter(PREFIX + "tasks.failed", tags, "Tasks whose unit reported a failure"),
                counter(PREFIX + "tasks.timedout", tags, "Tasks that exceeded the per-task timeout"),
                counter(PREFIX + "tasks.cancelled", tags, "Tasks cancelled by their submitter"),
                counter(PREFIX + "tasks.ratelimited", tags, "Dispatches held back by the rate limiter"),
                counter(PREFIX + "scale.up", tags, "Units added by the scaling tick"),
                counter(PREFIX + "scale.down", tags, "Units removed by the scaling tick"),
                counter(PREFIX + "units.crashed", tags, "Unexpected unit exits"),
                counter(PREFIX + "units.restarted", tags, "Crashed units replaced in their slot"),
                counter(PREFIX + "fatal", tags, "Slots that exhausted their restarts"),
                processingTimer,
                new AtomicInteger(0),
                new AtomicInteger(0),
                new AtomicInteger(0),
                new AtomicInteger(0),
                new AtomicInteger(0), // minUnits - set on init
                new AtomicInteger(0), // maxUnits - set on init
                new AtomicInteger(0)  // queueCapacity - set on init
            );

            meterRegistry.gauge(PREFIX + "units.total", tags, holder.units);
            meterRegistry.gauge(PREFIX + "units.busy", tags, holder.busyUnits);
            meterRegistry.gauge(PREFIX + "units.idle", tags, holder.idleUnits);
            meterRegistry.gauge(PREFIX + "queue.size", tags, holder.queueDepth);
            meterRegistry.gauge(PREFIX + "units.min", tags, holder.minUnits);
            meterRegistry.gauge(PREFIX + "units.max", tags, holder.maxUnits);
            meterRegistry.gauge(PREFIX + "queue.capacity", tags, holder.queueCapacity);
            return holder;
        });
    }

    private Counter counter(String name, List<Tag> tags, String description) {
        return Counter.builder(name)
            .tags(tags)
            .description(description)
            .register(meterRegistry);
    }

    /**
     * Internal holder for pool metrics
     */
    private record PoolMetricsHolder(
        Counter tasksSubmitted,
        Counter tasksSucceeded,
        Counter tasksFailed,
        Counter tasksTimedOut,
        Counter tasksCancelled,
        Counter tasksRateLimited,
        Counter scaleUps,
        Counter scaleDowns,
        Counter unitCrashes,
        Counter unitRestarts,
        Counter fatalErrors,
        Timer processingTimer,
        AtomicInteger units,
        AtomicInteger busyUnits,
        AtomicInteger idleUnits,
        AtomicInteger queueDepth,
        AtomicInteger minUnits,
        AtomicInteger maxUnits,
        AtomicInteger queueCapacity
    ) {}
}
