package tech.adaptivepool.vertx.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.EventBus;
import org.jboss.logging.Logger;
import tech.adaptivepool.vertx.message.UnitMessages.*;

/**
 * Registers Jackson codecs for all message types used on the event bus.
 * <p>
 * Call {@link #registerAll(Vertx, ObjectMapper)} once per Vert.x instance before
 * deploying a pool. Repeated calls are harmless, so every pool can call it on start.
 */
public final class CodecRegistry {

    private static final Logger LOG = Logger.getLogger(CodecRegistry.class);

    private CodecRegistry() {}

    /**
     * Mapper used when no application mapper is supplied.
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Register all message codecs on the event bus.
     *
     * @return number of codecs newly registered by this call
     */
    public static int registerAll(Vertx vertx, ObjectMapper objectMapper) {
        EventBus eventBus = vertx.eventBus();
        int registered = 0;

        // Dispatcher → unit
        registered += register(eventBus, objectMapper, Assignment.class);

        // Unit replies (sealed interface implementations)
        registered += register(eventBus, objectMapper, Completed.class);
        registered += register(eventBus, objectMapper, Failed.class);
        registered += register(eventBus, objectMapper, Crashed.class);

        // Pool events
        registered += register(eventBus, objectMapper, PoolFatal.class);

        if (registered > 0) {
            LOG.infof("Registered %d Jackson codecs for pool event bus messages", registered);
        }
        return registered;
    }

    private static <T> int register(EventBus eventBus, ObjectMapper objectMapper, Class<T> clazz) {
        try {
            eventBus.registerDefaultCodec(clazz, new JacksonMessageCodec<>(objectMapper, clazz));
            return 1;
        } catch (IllegalStateException e) {
            // Already registered by another pool on the same Vert.x instance
            LOG.debugf("Codec already registered for %s", clazz.getName());
            return 0;
        }
    }
}
