package io.sessionstreams.json.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.sessionstreams.json.spi.JsonCodec;
import io.sessionstreams.json.spi.JsonException;

import java.util.Objects;

/**
 * Jackson implementation of {@link JsonCodec}.
 *
 * <p>The default mapper ignores unknown properties and omits {@code null} fields.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw JsonException.cannotWrite(value, e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw JsonException.cannotWrite(value, e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Empty JSON document for " + type.getName());
        }
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw JsonException.cannotRead(type, e);
        }
    }

    @Override
    public <T> T readValue(String json, Class<T> type) throws JsonException {
        if (json == null || json.isBlank()) {
            throw new JsonException("Empty JSON document for " + type.getName());
        }
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw JsonException.cannotRead(type, e);
        }
    }
}
