package tech.adaptivepool.scaling;

import tech.adaptivepool.config.PoolConfig;

/**
 * Decides, once per tick, whether a pool should gain or lose one unit.
 * <p>
 * Scale-up is evaluated first and wins; at most one action per tick. Both directions share
 * one cooldown, measured from the last action of either kind.
 */
public final class ScalingController {

    private final int minUnits;
    private final int maxUnits;
    private final int scaleUpThreshold;
    private final int scaleDownThreshold;
    private final long coolDownMs;

    public ScalingController(PoolConfig<?, ?> config) {
        this(config.minUnits(), config.maxUnits(), config.scaleUpThreshold(),
                config.scaleDownThreshold(), config.coolDownMs());
    }

    public ScalingController(int minUnits, int maxUnits, int scaleUpThreshold,
                             int scaleDownThreshold, long coolDownMs) {
        this.minUnits = minUnits;
        this.maxUnits = maxUnits;
        this.scaleUpThreshold = scaleUpThreshold;
        this.scaleDownThreshold = scaleDownThreshold;
        this.coolDownMs = coolDownMs;
    }

    /**
     * @param lastScaleActionAt epoch millis of the last scaling action, or 0 if none yet
     * @param now               current epoch millis
     */
    public ScalingDecision evaluate(PoolLoad load, long lastScaleActionAt, long now) {
        if (!coolDownElapsed(lastScaleActionAt, now)) {
            return ScalingDecision.NONE;
        }
        if (shouldScaleUp(load)) {
            return ScalingDecision.SCALE_UP;
        }
        if (shouldScaleDown(load)) {
            return ScalingDecision.SCALE_DOWN;
        }
        return ScalingDecision.NONE;
    }

    boolean shouldScaleUp(PoolLoad load) {
        if (load.units() >= maxUnits || load.rateLimited()) {
            return false;
        }
        boolean backlog = load.queueDepth() > scaleUpThreshold;
        boolean starved = load.queueDepth() > 0 && load.idleUnits() == 0;
        return backlog || starved;
    }

    boolean shouldScaleDown(PoolLoad load) {
        return load.units() > minUnits
                && load.queueDepth() == 0
                && load.idleUnits() > scaleDownThreshold;
    }

    boolean coolDownElapsed(long lastScaleActionAt, long now) {
        return lastScaleActionAt <= 0 || now - lastScaleActionAt >= coolDownMs;
    }
}
