package io.sessionstreams.json.spi;

/**
 * JSON binding used for event payloads, SSE frame data and request bodies.
 *
 * <p>Implementations wrap one JSON library and are found through {@link JsonCodecs}. Callers bind to records,
 * maps and lists; no tree model is exposed.
 */
public interface JsonCodec {

    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Writes {@code value} as single-line JSON, suitable for an SSE {@code data:} field.
     */
    String writeString(Object value) throws JsonException;

    /**
     * @throws JsonException if {@code data} is empty or does not bind to {@code type}
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    <T> T readValue(String json, Class<T> type) throws JsonException;
}
