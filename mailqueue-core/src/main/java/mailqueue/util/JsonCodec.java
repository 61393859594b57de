package mailqueue.util;

import java.util.List;
import java.util.Map;

/**
 * Codec for the JSON text columns of the job table: address lists (string arrays) and
 * metadata or template variables (flat string-to-string objects).
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies. Applications
 * with Jackson or Gson on the classpath can plug in their own.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a string map as a JSON object. Returns {@code null} if the map is null or empty.
     */
    String toJson(Map<String, String> values);

    /**
     * Parses a JSON object into a string map. Returns an empty map for {@code null},
     * empty, or {@code "null"} input.
     *
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, String> parseObject(String json);

    /**
     * Encodes a string list as a JSON array. An empty list encodes as {@code []}.
     */
    String toJsonArray(List<String> values);

    /**
     * Parses a JSON array of strings. Returns an empty list for {@code null}, empty, or
     * {@code "null"} input.
     *
     * @throws IllegalArgumentException if the input is not a JSON array of strings
     */
    List<String> parseArray(String json);
}
