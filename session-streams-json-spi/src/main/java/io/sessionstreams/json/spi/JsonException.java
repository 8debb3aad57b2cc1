package io.sessionstreams.json.spi;

/**
 * A value could not be written as JSON, or a JSON document could not be bound to the requested type.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public static JsonException cannotWrite(Object value, Throwable cause) {
        String type = value == null ? "null" : value.getClass().getName();
        return new JsonException("Cannot write " + type + " as JSON", cause);
    }

    public static JsonException cannotRead(Class<?> type, Throwable cause) {
        return new JsonException("Cannot read JSON as " + type.getName(), cause);
    }
}
