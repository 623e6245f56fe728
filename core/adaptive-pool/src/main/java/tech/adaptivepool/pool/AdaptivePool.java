package tech.adaptivepool.pool;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.MessageConsumer;
import org.jboss.logging.Logger;
import tech.adaptivepool.config.PoolConfig;
import tech.adaptivepool.error.PoolException;
import tech.adaptivepool.error.PoolFatalException;
import tech.adaptivepool.error.ShutdownException;
import tech.adaptivepool.metrics.MetricsCollector;
import tech.adaptivepool.metrics.MetricsSnapshot;
import tech.adaptivepool.metrics.MicrometerPoolMetricsService;
import tech.adaptivepool.metrics.PoolMetricsService;
import tech.adaptivepool.vertx.channel.PoolChannels;
import tech.adaptivepool.vertx.codec.CodecRegistry;
import tech.adaptivepool.vertx.message.UnitMessages.PoolFatal;
import tech.adaptivepool.vertx.verticle.DispatcherVerticle;
import tech.adaptivepool.warning.InMemoryWarningService;
import tech.adaptivepool.warning.WarningService;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Adaptive worker pool: runs submitted tasks on a self-sizing set of execution units.
 * <p>
 * Usage:
 * <pre>
 * PoolConfig&lt;Image, Thumbnail&gt; config = PoolConfig.builder("thumbnails",
 *         new VerticleUnitFactory&lt;Image, Thumbnail&gt;(vertx, "thumbnails", resizer::resize))
 *     .minUnits(2)
 *     .maxUnits(8)
 *     .build();
 *
 * AdaptivePool.create(vertx, config, metricsService)
 *     .compose(pool -&gt; pool.execute(image))
 *     .onSuccess(thumbnail -&gt; ...);
 * </pre>
 * All methods are thread safe. Task futures complete on the pool's dispatcher event loop.
 *
 * @param <P> payload type
 * @param <R> result type
 */
public class AdaptivePool<P, R> {

    private static final Logger LOG = Logger.getLogger(AdaptivePool.class);

    private final Vertx vertx;
    private final PoolConfig<P, R> config;
    private final WarningService warningService;
    private final PoolChannels.Address channels;
    private final DispatcherVerticle<P, R> dispatcher;
    private final AtomicLong taskSequence = new AtomicLong();
    private final List<MessageConsumer<PoolFatal>> fatalConsumers = new CopyOnWriteArrayList<>();

    private Future<Void> startFuture;
    private Future<Void> terminateFuture;
    private volatile String deploymentId;

    public AdaptivePool(Vertx vertx, PoolConfig<P, R> config) {
        this(vertx, config, new MicrometerPoolMetricsService(new SimpleMeterRegistry()));
    }

    public AdaptivePool(Vertx vertx, PoolConfig<P, R> config, PoolMetricsService metricsService) {
        this(vertx, config, metricsService, new InMemoryWarningService());
    }

    public AdaptivePool(Vertx vertx, PoolConfig<P, R> config, PoolMetricsService metricsService,
                        WarningService warningService) {
        this.vertx = vertx;
        this.config = config;
        this.warningService = warningService;
        this.channels = PoolChannels.newInstance(config.name());
        this.dispatcher = new DispatcherVerticle<>(config, channels,
                new MetricsCollector(config.name(), metricsService), warningService);
    }

    /**
     * Creates and starts a pool.
     */
    public static <P, R> Future<AdaptivePool<P, R>> create(Vertx vertx, PoolConfig<P, R> config,
                                                           PoolMetricsService metricsService) {
        AdaptivePool<P, R> pool = new AdaptivePool<>(vertx, config, metricsService);
        return pool.start().map(v -> pool);
    }

    /**
     * Deploys the dispatcher and spawns {@code minUnits} units. Idempotent.
     */
    public synchronized Future<Void> start() {
        if (startFuture != null) {
            return startFuture;
        }
        if (terminateFuture != null) {
            return Future.failedFuture(new ShutdownException(config.name(), "Pool [" + config.name() + "] was terminated"));
        }

        CodecRegistry.registerAll(vertx, CodecRegistry.defaultObjectMapper());
        startFuture = vertx.deployVerticle(dispatcher)
                .onSuccess(id -> {
                    deploymentId = id;
                    LOG.infof("Pool [%s] started, dispatcher deployment: %s", config.name(), id);
                })
                .onFailure(err -> LOG.errorf("Failed to start pool [%s]: %s", config.name(), err.getMessage()))
                .mapEmpty();
        return startFuture;
    }

    /**
     * Submits a payload and returns the future of its result.
     */
    public Future<R> execute(P payload) {
        return submit(payload).future();
    }

    /**
     * Submits a payload and returns a handle that can also cancel the task.
     */
    public TaskHandle<R> submit(P payload) {
        long taskId = taskSequence.incrementAndGet();
        PoolTask<P, R> task = new PoolTask<>(taskId, payload, System.currentTimeMillis(), Promise.promise());
        TaskHandle<R> handle = new TaskHandle<>(taskId, task.future(), dispatcher::cancel);

        PoolState current = dispatcher.state();
        if (!dispatcher.isStarted()) {
            task.rejectNow(current == PoolState.TERMINATED
                    ? new ShutdownException(config.name(), "Pool [" + config.name() + "] was terminated")
                    : new PoolException(config.name(), "Pool [" + config.name() + "] has not been started"));
        } else if (!current.acceptsTasks()) {
            LOG.debugf("Pool [%s] is %s, rejecting task [%d]", config.name(), current, taskId);
            task.rejectNow(new ShutdownException(config.name(), "Pool [" + config.name() + "] is " + current));
        } else {
            dispatcher.submit(task);
        }
        return handle;
    }

    public MetricsSnapshot getMetrics() {
        return dispatcher.snapshot();
    }

    public PoolState getState() {
        return dispatcher.state();
    }

    public String getName() {
        return config.name();
    }

    public PoolConfig<P, R> getConfig() {
        return config;
    }

    public WarningService getWarningService() {
        return warningService;
    }

    /**
     * Registers a listener for the pool halting after a unit slot exhausted its restarts.
     * Runs on an event loop.
     *
     * @return completes once the listener is registered
     */
    public Future<Void> onFatal(Handler<PoolFatalException> listener) {
        MessageConsumer<PoolFatal> consumer = channels.fatal(vertx)
                .consumer(msg -> {
                    PoolFatal fatal = msg.body();
                    listener.handle(new PoolFatalException(fatal.poolName(), fatal.slotId(), fatal.restarts()));
                });
        fatalConsumers.add(consumer);
        Promise<Void> registered = Promise.promise();
        consumer.completionHandler(registered);
        return registered.future();
    }

    /**
     * Clears a fatal halt and respawns units up to {@code minUnits}.
     */
    public Future<Void> reset() {
        if (!dispatcher.isStarted()) {
            return Future.failedFuture(new PoolException(config.name(), "Pool [" + config.name() + "] has not been started"));
        }
        return dispatcher.reset();
    }

    /**
     * Rejects queued tasks, lets running tasks finish within the shutdown grace period and
     * kills the units still alive after it. Completes once every unit is gone. Idempotent.
     */
    public synchronized Future<Void> terminate() {
        if (terminateFuture != null) {
            return terminateFuture;
        }
        if (startFuture == null) {
            dispatcher.markTerminated();
            terminateFuture = Future.succeededFuture();
            return terminateFuture;
        }

        terminateFuture = startFuture
                .compose(v -> dispatcher.terminate())
                .compose(v -> {
                    fatalConsumers.forEach(MessageConsumer::unregister);
                    fatalConsumers.clear();
                    return vertx.undeploy(deploymentId);
                })
                .onSuccess(v -> LOG.infof("Pool [%s] terminated", config.name()));
        return terminateFuture;
    }
}
