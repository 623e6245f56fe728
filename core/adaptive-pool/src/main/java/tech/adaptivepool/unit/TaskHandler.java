package tech.adaptivepool.unit;

/**
 * The work an execution unit performs for one task.
 * <p>
 * Runs on the unit's own thread, so blocking is fine. An {@link Exception} fails only the
 * task; an {@link Error} is treated as a crash of the unit itself.
 *
 * @param <P> payload type
 * @param <R> result type
 */
@FunctionalInterface
public interface TaskHandler<P, R> {

    R handle(P payload) throws Exception;
}
