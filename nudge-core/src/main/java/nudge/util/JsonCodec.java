package nudge.util;

import java.util.List;
import java.util.Map;

/**
 * Codec between JSON text and plain Java values: {@link Map} (objects), {@link List}
 * (arrays), {@link String}, {@link Long} or {@link Double} (numbers), {@link Boolean}
 * and {@code null}.
 *
 * <p>Stores use it for the JSON columns holding conditions, segment lists, time windows
 * and personalization data. The default implementation ({@link DefaultJsonCodec}) has no
 * external dependencies; integrators who already run Jackson or Gson can supply their own.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value. Maps must have string keys; other objects are written as strings.
     *
     * @param value the value to encode (may be {@code null})
     * @return JSON text
     */
    String toJson(Object value);

    /**
     * Parses any JSON value.
     *
     * @param json the JSON text
     * @return the decoded value, or {@code null} for blank input or {@code "null"}
     * @throws IllegalArgumentException if the input is not valid JSON
     */
    Object parse(String json);

    /**
     * Parses a JSON object. Returns an empty map for {@code null}, blank or {@code "null"} input.
     *
     * @throws IllegalArgumentException if the input is not a JSON object
     */
    @SuppressWarnings("unchecked")
    default Map<String, Object> parseObject(String json) {
        Object value = parse(json);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Expected JSON object");
        }
        return (Map<String, Object>) value;
    }

    /**
     * Parses a JSON array. Returns an empty list for {@code null}, blank or {@code "null"} input.
     *
     * @throws IllegalArgumentException if the input is not a JSON array
     */
    @SuppressWarnings("unchecked")
    default List<Object> parseArray(String json) {
        Object value = parse(json);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Expected JSON array");
        }
        return (List<Object>) value;
    }
}
