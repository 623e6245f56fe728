package tech.adaptivepool.vertx.channel;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;

/**
 * Event bus address bound to the message type it carries.
 * <p>
 * Pool traffic never leaves the JVM: payloads and handler exceptions are arbitrary objects,
 * so every delivery is local-only and codecs only copy by reference.
 * <pre>
 * TypedChannel&lt;Assignment, UnitReply&gt; unit = PoolChannels.newInstance("orders").unit(vertx, "0-1", timeoutMs);
 * unit.request(new Assignment(42, payload)).onSuccess(reply -&gt; ...);
 * </pre>
 *
 * @param <Req> message type sent to the address
 * @param <Res> reply type, {@code Void} for broadcast channels
 */
public final class TypedChannel<Req, Res> {

    private final Vertx vertx;
    private final String address;
    private final DeliveryOptions deliveryOptions;

    private TypedChannel(Vertx vertx, String address, DeliveryOptions deliveryOptions) {
        this.vertx = vertx;
        this.address = address;
        this.deliveryOptions = deliveryOptions;
    }

    /**
     * Channel whose requests fail with a {@code ReplyException} after {@code replyTimeoutMs}.
     */
    static <Req, Res> TypedChannel<Req, Res> requestReply(Vertx vertx, String address, long replyTimeoutMs) {
        return new TypedChannel<>(vertx, address,
                new DeliveryOptions().setLocalOnly(true).setSendTimeout(replyTimeoutMs));
    }

    static <Req> TypedChannel<Req, Void> broadcast(Vertx vertx, String address) {
        return new TypedChannel<>(vertx, address, new DeliveryOptions().setLocalOnly(true));
    }

    public Future<Res> request(Req message) {
        return vertx.eventBus()
                .<Res>request(address, message, deliveryOptions)
                .map(Message::body);
    }

    public void publish(Req message) {
        vertx.eventBus().publish(address, message, deliveryOptions);
    }

    /**
     * Registers a local consumer; unregister it through the returned handle.
     */
    public MessageConsumer<Req> consumer(Handler<Message<Req>> handler) {
        return vertx.eventBus().localConsumer(address, handler);
    }

    public String address() {
        return address;
    }

    @Override
    public String toString() {
        return "TypedChannel[" + address + "]";
    }
}
