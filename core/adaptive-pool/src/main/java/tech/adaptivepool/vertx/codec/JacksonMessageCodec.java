package tech.adaptivepool.vertx.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.EncodeException;

import java.io.IOException;

/**
 * Event bus codec for pool messages.
 * <p>
 * Pool channels deliver locally, where {@link #transform} passes the instance through untouched
 * (a {@code Failed} reply keeps its live exception). The wire form, a length-prefixed JSON
 * document, exists for diagnostics and tests; fields marked {@code @JsonIgnore} do not survive it.
 *
 * @param <T> message record type
 */
public class JacksonMessageCodec<T> implements MessageCodec<T, T> {

    private final ObjectMapper objectMapper;
    private final Class<T> type;

    public JacksonMessageCodec(ObjectMapper objectMapper, Class<T> type) {
        this.objectMapper = objectMapper;
        this.type = type;
    }

    @Override
    public void encodeToWire(Buffer buffer, T message) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new EncodeException("Cannot encode " + type.getSimpleName() + ": " + e.getOriginalMessage());
        }
        buffer.appendInt(json.length).appendBytes(json);
    }

    @Override
    public T decodeFromWire(int pos, Buffer buffer) {
        int length = buffer.getInt(pos);
        int start = pos + Integer.BYTES;
        try {
            return objectMapper.readValue(buffer.getBytes(start, start + length), type);
        } catch (IOException e) {
            throw new DecodeException("Cannot decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public T transform(T message) {
        return message;
    }

    @Override
    public String name() {
        return "adaptivepool." + type.getSimpleName();
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }
}
