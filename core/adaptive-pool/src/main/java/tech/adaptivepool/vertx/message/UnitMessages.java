package tech.adaptivepool.vertx.message;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Message records for event bus communication between the dispatcher and its units.
 * <p>
 * Records with Jackson codecs instead of Vert.x JsonObject keep the unit protocol typed;
 * delivery within one Vert.x instance passes the record through unchanged.
 */
public final class UnitMessages {

    private UnitMessages() {}

    // ==================== Dispatcher → Unit ====================

    /**
     * One task handed to a unit.
     * Sent to: pool.{name}.unit.{key}
     */
    public record Assignment(long taskId, Object payload) {}

    // ==================== Unit → Dispatcher ====================

    /**
     * Reply to an {@link Assignment}.
     */
    public sealed interface UnitReply permits Completed, Failed, Crashed {
        long taskId();
    }

    /**
     * The handler returned a value.
     */
    public record Completed(long taskId, Object result) implements UnitReply {}

    /**
     * The handler threw an exception. The unit stays alive.
     */
    public record Failed(
            long taskId,
            String errorType,
            String message,
            @JsonIgnore Throwable cause
    ) implements UnitReply {}

    /**
     * The handler threw an {@link Error}. The unit undeploys itself after replying.
     */
    public record Crashed(long taskId, String reason) implements UnitReply {}

    // ==================== Pool events ====================

    /**
     * A unit slot exceeded its restart cap and the pool stopped admitting tasks.
     * Published to: pool.{name}.fatal
     */
    public record PoolFatal(
            String poolName,
            int slotId,
            int restarts,
            Instant occurredAt
    ) {}
}
