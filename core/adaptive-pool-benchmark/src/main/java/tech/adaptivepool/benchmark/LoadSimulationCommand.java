package tech.adaptivepool.benchmark;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.jboss.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import tech.adaptivepool.config.PoolConfig;
import tech.adaptivepool.metrics.MetricsSnapshot;
import tech.adaptivepool.metrics.MicrometerPoolMetricsService;
import tech.adaptivepool.pool.AdaptivePool;
import tech.adaptivepool.unit.VerticleUnitFactory;
import tech.adaptivepool.vertx.codec.CodecRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

@Command(name = "load-simulation", mixinStandardHelpOptions = true, version = "1.0",
    description = "Drives an adaptive pool through light load, a heavy burst and a cool down, "
        + "then prints the pool's final metrics as JSON")
public class LoadSimulationCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(LoadSimulationCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"-p", "--pool-name"}, defaultValue = "load-simulation",
        description = "Pool name used in logs and metric tags (default: load-simulation)")
    String poolName;

    @Option(names = "--min-units", defaultValue = "2",
        description = "Minimum units (default: 2)")
    int minUnits;

    @Option(names = "--max-units", defaultValue = "8",
        description = "Maximum units (default: 8)")
    int maxUnits;

    @Option(names = "--scale-up-threshold", defaultValue = "3",
        description = "Queue depth that triggers a scale-up (default: 3)")
    int scaleUpThreshold;

    @Option(names = "--scale-down-threshold", defaultValue = "1",
        description = "Idle units above which the pool scales down (default: 1)")
    int scaleDownThreshold;

    @Option(names = "--cool-down-ms", defaultValue = "1000",
        description = "Minimum time between scaling actions (default: 1000)")
    long coolDownMs;

    @Option(names = "--check-interval-ms", defaultValue = "1000",
        description = "Scaling tick period (default: 1000)")
    long checkIntervalMs;

    @Option(names = "--light-tasks", defaultValue = "10",
        description = "Tasks submitted in the light load phase (default: 10)")
    int lightTasks;

    @Option(names = "--light-interval-ms", defaultValue = "500",
        description = "Delay between light load submissions (default: 500)")
    long lightIntervalMs;

    @Option(names = "--heavy-tasks", defaultValue = "30",
        description = "Tasks submitted in the heavy load phase (default: 30)")
    int heavyTasks;

    @Option(names = "--heavy-interval-ms", defaultValue = "100",
        description = "Delay between heavy load submissions (default: 100)")
    long heavyIntervalMs;

    @Option(names = "--light-work", defaultValue = "5",
        description = "Work factor of a light task, in millions of iterations (default: 5)")
    int lightWork;

    @Option(names = "--heavy-work", defaultValue = "10",
        description = "Work factor of a heavy task, in millions of iterations (default: 10)")
    int heavyWork;

    @Option(names = "--settle-ms", defaultValue = "10000",
        description = "Cool down phase length, lets the pool scale back down (default: 10000)")
    long settleMs;

    @Option(names = "--timeout-seconds", defaultValue = "300",
        description = "Upper bound for waiting on the heavy phase (default: 300)")
    long timeoutSeconds;

    public static void main(String[] args) {
        System.exit(new CommandLine(new LoadSimulationCommand()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        LOG.infof("=== Adaptive Pool Load Simulation ===");
        LOG.infof("Pool: %s (units %d-%d, scaleUp>%d, scaleDown>%d idle, cooldown %dms, tick %dms)",
            poolName, minUnits, maxUnits, scaleUpThreshold, scaleDownThreshold, coolDownMs, checkIntervalMs);
        LOG.infof("Light phase: %d tasks every %dms, Heavy phase: %d tasks every %dms, Cool down: %dms",
            lightTasks, lightIntervalMs, heavyTasks, heavyIntervalMs, settleMs);
        LOG.info("=====================================");

        Vertx vertx = Vertx.vertx();
        try {
            PoolConfig<Integer, Double> config;
            try {
                config = PoolConfig.builder(poolName,
                        new VerticleUnitFactory<Integer, Double>(vertx, poolName, LoadSimulationCommand::simulateWork))
                    .minUnits(minUnits)
                    .maxUnits(maxUnits)
                    .scaleUpThreshold(scaleUpThreshold)
                    .scaleDownThreshold(scaleDownThreshold)
                    .coolDownMs(coolDownMs)
                    .checkIntervalMs(checkIntervalMs)
                    .build();
            } catch (IllegalArgumentException e) {
                LOG.errorf("Invalid pool configuration: %s", e.getMessage());
                return 1;
            }

            AdaptivePool<Integer, Double> pool = await(
                AdaptivePool.create(vertx, config, new MicrometerPoolMetricsService(new SimpleMeterRegistry())));

            MetricsSnapshot snapshot = simulate(pool);
            await(pool.terminate());

            ObjectMapper objectMapper = CodecRegistry.defaultObjectMapper();
            spec.commandLine().getOut().println(
                objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot));
            spec.commandLine().getOut().flush();
            return 0;
        } finally {
            vertx.close().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        }
    }

    private MetricsSnapshot simulate(AdaptivePool<Integer, Double> pool) throws Exception {
        LOG.info("--- Phase 1: Light load ---");
        for (int i = 0; i < lightTasks; i++) {
            pool.execute(lightWork)
                .onFailure(err -> LOG.warnf("Light task failed: %s", err.getMessage()));
            Thread.sleep(lightIntervalMs);
        }
        logProgress(pool);

        LOG.info("--- Phase 2: Heavy load ---");
        List<Future<Double>> heavy = new ArrayList<>();
        for (int i = 0; i < heavyTasks; i++) {
            heavy.add(pool.execute(heavyWork));
            Thread.sleep(heavyIntervalMs);
        }
        Future.join(heavy).toCompletionStage().toCompletableFuture().get(timeoutSeconds, TimeUnit.SECONDS);
        logProgress(pool);

        LOG.info("--- Phase 3: Cool down ---");
        Thread.sleep(settleMs);
        logProgress(pool);

        return pool.getMetrics();
    }

    private void logProgress(AdaptivePool<?, ?> pool) {
        MetricsSnapshot metrics = pool.getMetrics();
        LOG.infof("Units: %d/%d busy | Queue: %d | Completed: %d | Scale up/down: %d/%d",
            metrics.busyUnits(), metrics.currentUnits(), metrics.queueDepth(), metrics.tasksProcessed(),
            metrics.scaleUpEvents(), metrics.scaleDownEvents());
    }

    /**
     * CPU-bound stand-in for real work.
     */
    static Double simulateWork(Integer workFactor) {
        double result = 0;
        long iterations = workFactor * 1_000_000L;
        for (long i = 0; i < iterations; i++) {
            result += Math.sqrt(i);
        }
        return result;
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(60, TimeUnit.SECONDS);
    }
}
