package tech.adaptivepool.unit;

import io.vertx.core.Vertx;
import tech.adaptivepool.vertx.channel.PoolChannels;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default {@link UnitFactory}: every unit is a worker verticle with its own thread
 * running the supplied {@link TaskHandler}.
 * <p>
 * Unit addresses and worker pools are scoped to the factory instance, so pools that share a
 * name stay apart as long as each gets its own factory.
 *
 * @param <P> payload type
 * @param <R> result type
 */
public class VerticleUnitFactory<P, R> implements UnitFactory<P, R> {

    private static final long DEFAULT_REPLY_TIMEOUT_MS = TimeUnit.DAYS.toMillis(1);

    private final Vertx vertx;
    private final PoolChannels.Address channels;
    private final TaskHandler<P, R> handler;
    private final long replyTimeoutMs;
    private final AtomicLong instanceSequence = new AtomicLong();

    public VerticleUnitFactory(Vertx vertx, String poolName, TaskHandler<P, R> handler) {
        this(vertx, poolName, handler, DEFAULT_REPLY_TIMEOUT_MS);
    }

    /**
     * @param replyTimeoutMs how long a unit may stay silent on one task before it is
     *                       considered dead; the pool's own task timeout is usually shorter
     */
    public VerticleUnitFactory(Vertx vertx, String poolName, TaskHandler<P, R> handler, long replyTimeoutMs) {
        this.vertx = vertx;
        this.channels = PoolChannels.newInstance(poolName);
        this.handler = handler;
        this.replyTimeoutMs = replyTimeoutMs;
    }

    @Override
    public ExecutionUnit<P> spawn(int unitId, UnitEvents<R> events) {
        String unitKey = unitId + "-" + instanceSequence.getAndIncrement();
        VerticleExecutionUnit<P, R> unit =
                new VerticleExecutionUnit<>(vertx, channels, unitId, unitKey, handler, events, replyTimeoutMs);
        unit.deploy();
        return unit;
    }
}
