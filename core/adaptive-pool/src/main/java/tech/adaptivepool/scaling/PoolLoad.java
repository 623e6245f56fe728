package tech.adaptivepool.scaling;

/**
 * Point-in-time load of a pool, as seen by the scaling tick.
 *
 * @param units       live units, excluding those already terminating
 * @param idleUnits   live units without a task
 * @param queueDepth  tasks waiting for a unit
 * @param rateLimited dispatch is currently throttled by the rate limiter
 */
public record PoolLoad(int units, int idleUnits, int queueDepth, boolean rateLimited) {
}
