package tech.adaptivepool.unit;

/**
 * Capability that spawns one execution unit for a pool.
 * <p>
 * The pool calls this at start-up, on scale-up and when replacing a crashed unit.
 * A replacement keeps the slot id of the unit it replaces.
 *
 * @param <P> payload type
 * @param <R> result type
 */
@FunctionalInterface
public interface UnitFactory<P, R> {

    ExecutionUnit<P> spawn(int unitId, UnitEvents<R> events);
}
