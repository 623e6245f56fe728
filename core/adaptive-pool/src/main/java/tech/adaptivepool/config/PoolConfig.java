package tech.adaptivepool.config;

import io.vertx.core.json.JsonObject;
import tech.adaptivepool.unit.UnitFactory;

import java.util.Objects;

/**
 * Immutable configuration for one adaptive pool.
 *
 * @param name               pool identifier, used in logs, metric tags and event bus addresses
 * @param minUnits           units kept alive at all times
 * @param maxUnits           hard ceiling on units
 * @param scaleUpThreshold   queue depth above which a tick adds a unit
 * @param scaleDownThreshold idle units above which a tick (with an empty queue) removes one
 * @param coolDownMs         minimum time between two scaling actions
 * @param checkIntervalMs    scaling tick period
 * @param maxRestartsPerSlot crash replacements allowed per slot before the pool halts
 * @param queueCapacity      maximum queued tasks, 0 for unbounded
 * @param taskTimeoutMs      per-task timeout measured from dispatch, 0 to disable
 * @param killOnTimeout      terminate the owning unit when a task times out (counts as a crash)
 * @param shutdownGraceMs    time units get to finish in-flight work on terminate
 * @param rateLimitPerMinute optional dispatch rate limit (null if not configured)
 * @param unitFactory        spawns the pool's execution units
 */
public record PoolConfig<P, R>(
        String name,
        int minUnits,
        int maxUnits,
        int scaleUpThreshold,
        int scaleDownThreshold,
        long coolDownMs,
        long checkIntervalMs,
        int maxRestartsPerSlot,
        int queueCapacity,
        long taskTimeoutMs,
        boolean killOnTimeout,
        long shutdownGraceMs,
        Integer rateLimitPerMinute,
        UnitFactory<P, R> unitFactory
) {

    public static final int DEFAULT_MIN_UNITS = 2;
    public static final int DEFAULT_SCALE_UP_THRESHOLD = 5;
    public static final int DEFAULT_SCALE_DOWN_THRESHOLD = 0;
    public static final long DEFAULT_COOL_DOWN_MS = 1_000;
    public static final long DEFAULT_CHECK_INTERVAL_MS = 1_000;
    public static final int DEFAULT_MAX_RESTARTS_PER_SLOT = 3;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 5_000;

    public PoolConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(unitFactory, "unitFactory");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Pool name must not be blank");
        }
        if (minUnits < 0) {
            throw new IllegalArgumentException("minUnits must be >= 0, was " + minUnits);
        }
        if (maxUnits < 1 || maxUnits < minUnits) {
            throw new IllegalArgumentException(
                    String.format("maxUnits must be >= max(1, minUnits), was %d (minUnits=%d)", maxUnits, minUnits));
        }
        if (scaleUpThreshold < 0 || scaleDownThreshold < 0) {
            throw new IllegalArgumentException("Scaling thresholds must be >= 0");
        }
        if (coolDownMs < 0) {
            throw new IllegalArgumentException("coolDownMs must be >= 0, was " + coolDownMs);
        }
        if (checkIntervalMs < 1) {
            throw new IllegalArgumentException("checkIntervalMs must be >= 1, was " + checkIntervalMs);
        }
        if (maxRestartsPerSlot < 0) {
            throw new IllegalArgumentException("maxRestartsPerSlot must be >= 0, was " + maxRestartsPerSlot);
        }
        if (queueCapacity < 0 || taskTimeoutMs < 0 || shutdownGraceMs < 0) {
            throw new IllegalArgumentException("queueCapacity, taskTimeoutMs and shutdownGraceMs must be >= 0");
        }
        if (rateLimitPerMinute != null && rateLimitPerMinute <= 0) {
            // Non-positive limit means "not configured", same as the pool verticle config
            rateLimitPerMinute = null;
        }
    }

    public boolean hasTaskTimeout() {
        return taskTimeoutMs > 0;
    }

    public boolean isQueueBounded() {
        return queueCapacity > 0;
    }

    /**
     * Builds a config from verticle-style JSON. Missing keys fall back to the defaults.
     * <pre>
     * { "name": "thumbnails", "minUnits": 2, "maxUnits": 8, "scaleUpThreshold": 10,
     *   "coolDownMs": 2000, "rateLimitPerMinute": 600 }
     * </pre>
     */
    public static <P, R> PoolConfig<P, R> fromJson(JsonObject json, UnitFactory<P, R> unitFactory) {
        Builder<P, R> defaults = builder(json.getString("name", "default"), unitFactory);
        return builder(defaults.name, unitFactory)
                .minUnits(json.getInteger("minUnits", defaults.minUnits))
                .maxUnits(json.getInteger("maxUnits", defaults.maxUnits))
                .scaleUpThreshold(json.getInteger("scaleUpThreshold", defaults.scaleUpThreshold))
                .scaleDownThreshold(json.getInteger("scaleDownThreshold", defaults.scaleDownThreshold))
                .coolDownMs(json.getLong("coolDownMs", defaults.coolDownMs))
                .checkIntervalMs(json.getLong("checkIntervalMs", defaults.checkIntervalMs))
                .maxRestartsPerSlot(json.getInteger("maxRestartsPerSlot", defaults.maxRestartsPerSlot))
                .queueCapacity(json.getInteger("queueCapacity", defaults.queueCapacity))
                .taskTimeoutMs(json.getLong("taskTimeoutMs", defaults.taskTimeoutMs))
                .killOnTimeout(json.getBoolean("killOnTimeout", defaults.killOnTimeout))
                .shutdownGraceMs(json.getLong("shutdownGraceMs", defaults.shutdownGraceMs))
                .rateLimitPerMinute(json.getInteger("rateLimitPerMinute"))
                .build();
    }

    /**
     * Config as JSON, without the unit factory.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("name", name)
                .put("minUnits", minUnits)
                .put("maxUnits", maxUnits)
                .put("scaleUpThreshold", scaleUpThreshold)
                .put("scaleDownThreshold", scaleDownThreshold)
                .put("coolDownMs", coolDownMs)
                .put("checkIntervalMs", checkIntervalMs)
                .put("maxRestartsPerSlot", maxRestartsPerSlot)
                .put("queueCapacity", queueCapacity)
                .put("taskTimeoutMs", taskTimeoutMs)
                .put("killOnTimeout", killOnTimeout)
                .put("shutdownGraceMs", shutdownGraceMs);
        if (rateLimitPerMinute != null) {
            json.put("rateLimitPerMinute", rateLimitPerMinute);
        }
        return json;
    }

    public static <P, R> Builder<P, R> builder(String name, UnitFactory<P, R> unitFactory) {
        return new Builder<>(name, unitFactory);
    }

    public Builder<P, R> toBuilder() {
        return new Builder<>(name, unitFactory)
                .minUnits(minUnits)
                .maxUnits(maxUnits)
                .scaleUpThreshold(scaleUpThreshold)
                .scaleDownThreshold(scaleDownThreshold)
                .coolDownMs(coolDownMs)
                .checkIntervalMs(checkIntervalMs)
                .maxRestartsPerSlot(maxRestartsPerSlot)
                .queueCapacity(queueCapacity)
                .taskTimeoutMs(taskTimeoutMs)
                .killOnTimeout(killOnTimeout)
                .shutdownGraceMs(shutdownGraceMs)
                .rateLimitPerMinute(rateLimitPerMinute);
    }

    public static final class Builder<P, R> {

        private final String name;
        private final UnitFactory<P, R> unitFactory;
        private int minUnits = DEFAULT_MIN_UNITS;
        private int maxUnits = Math.max(DEFAULT_MIN_UNITS, Runtime.getRuntime().availableProcessors());
        private int scaleUpThreshold = DEFAULT_SCALE_UP_THRESHOLD;
        private int scaleDownThreshold = DEFAULT_SCALE_DOWN_THRESHOLD;
        private long coolDownMs = DEFAULT_COOL_DOWN_MS;
        private long checkIntervalMs = DEFAULT_CHECK_INTERVAL_MS;
        private int maxRestartsPerSlot = DEFAULT_MAX_RESTARTS_PER_SLOT;
        private int queueCapacity = 0;
        private long taskTimeoutMs = 0;
        private boolean killOnTimeout = false;
        private long shutdownGraceMs = DEFAULT_SHUTDOWN_GRACE_MS;
        private Integer rateLimitPerMinute;

        private Builder(String name, UnitFactory<P, R> unitFactory) {
            this.name = name;
            this.unitFactory = unitFactory;
        }

        public Builder<P, R> minUnits(int minUnits) {
            this.minUnits = minUnits;
            return this;
        }

        public Builder<P, R> maxUnits(int maxUnits) {
            this.maxUnits = maxUnits;
            return this;
        }

        public Builder<P, R> scaleUpThreshold(int scaleUpThreshold) {
            this.scaleUpThreshold = scaleUpThreshold;
            return this;
        }

        public Builder<P, R> scaleDownThreshold(int scaleDownThreshold) {
            this.scaleDownThreshold = scaleDownThreshold;
            return this;
        }

        public Builder<P, R> coolDownMs(long coolDownMs) {
            this.coolDownMs = coolDownMs;
            return this;
        }

        public Builder<P, R> checkIntervalMs(long checkIntervalMs) {
            this.checkIntervalMs = checkIntervalMs;
            return this;
        }

        public Builder<P, R> maxRestartsPerSlot(int maxRestartsPerSlot) {
            this.maxRestartsPerSlot = maxRestartsPerSlot;
            return this;
        }

        public Builder<P, R> queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder<P, R> taskTimeoutMs(long taskTimeoutMs) {
            this.taskTimeoutMs = taskTimeoutMs;
            return this;
        }

        public Builder<P, R> killOnTimeout(boolean killOnTimeout) {
            this.killOnTimeout = killOnTimeout;
            return this;
        }

        public Builder<P, R> shutdownGraceMs(long shutdownGraceMs) {
            this.shutdownGraceMs = shutdownGraceMs;
            return this;
        }

        public Builder<P, R> rateLimitPerMinute(Integer rateLimitPerMinute) {
            this.rateLimitPerMinute = rateLimitPerMinute;
            return this;
        }

        public PoolConfig<P, R> build() {
            return new PoolConfig<>(name, minUnits, maxUnits, scaleUpThreshold, scaleDownThreshold,
                    coolDownMs, checkIntervalMs, maxRestartsPerSlot, queueCapacity, taskTimeoutMs,
                    killOnTimeout, shutdownGraceMs, rateLimitPerMinute, unitFactory);
        }
    }
}
