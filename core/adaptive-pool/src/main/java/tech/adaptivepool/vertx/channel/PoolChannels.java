package tech.adaptivepool.vertx.channel;

import io.vertx.core.Vertx;
import tech.adaptivepool.vertx.message.UnitMessages.*;

import java.util.UUID;

/**
 * Factory for type-safe pool channels.
 * <p>
 * Addresses are scoped to one pool instance, so two pools sharing a name on the same Vert.x
 * instance never receive each other's assignments or fatal events:
 * <pre>
 * PoolChannels.Address addr = PoolChannels.newInstance("image-resize");
 * addr.unit(vertx, "3-7", timeoutMs).request(assignment);
 * addr.fatal(vertx).consumer(msg -&gt; alert(msg.body()));
 * </pre>
 */
public final class PoolChannels {

    private PoolChannels() {}

    /**
     * Address space for a new pool instance.
     *
     * @param poolName The pool identifier (e.g., "image-resize", "report-render")
     */
    public static Address newInstance(String poolName) {
        return address(poolName, UUID.randomUUID().toString().substring(0, 8));
    }

    public static Address address(String poolName, String instanceId) {
        return new Address(poolName, instanceId);
    }

    /**
     * Type-safe pool address that provides channel factories.
     */
    public record Address(String poolName, String instanceId) {

        /**
         * Address a single unit instance listens on. {@code unitKey} is unique per spawned
         * instance, so a replacement never receives traffic meant for the unit it replaced.
         */
        public String unitAddress(String unitKey) {
            return prefix() + ".unit." + unitKey;
        }

        /**
         * Name of the single-thread worker pool a unit runs on; also the prefix of its thread name.
         */
        public String workerPoolName(String unitKey) {
            return poolName + "-unit-" + unitKey + "@" + instanceId;
        }

        /**
         * Address pool-level fatal events are published to.
         */
        public String fatalAddress() {
            return prefix() + ".fatal";
        }

        /**
         * Channel for handing tasks to a unit.
         * <p>
         * Request: Assignment → Response: UnitReply
         */
        public TypedChannel<Assignment, UnitReply> unit(Vertx vertx, String unitKey, long timeoutMs) {
            return TypedChannel.requestReply(vertx, unitAddress(unitKey), timeoutMs);
        }

        /**
         * Channel for pool fatal events (publish/subscribe, no reply).
         */
        public TypedChannel<PoolFatal, Void> fatal(Vertx vertx) {
            return TypedChannel.broadcast(vertx, fatalAddress());
        }

        private String prefix() {
            return "pool." + poolName + "." + instanceId;
        }
    }
}
