package io.eventcore.util;

import java.util.Map;

/**
 * Codec for flat {@code Map<String, String>} event metadata to and from JSON text.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and only
 * supports flat string-to-string objects. Applications that already use Jackson or Gson
 * can implement this interface to delegate to them.
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
     * Encodes a string map as a JSON object. Returns {@code null} if the map is null or empty,
     * so that stores can keep an empty metadata column as SQL {@code NULL}.
     *
     * @param metadata the entries to encode
     * @return JSON text, or {@code null}
     * @throws io.eventcore.SerializationException if a key or value is null
     */
    String encode(Map<String, String> metadata);

    /**
     * Decodes a JSON object into a string map. Returns an empty map for {@code null},
     * blank or {@code "null"} input.
     *
     * @param json the JSON text
     * @return decoded entries in document order (never {@code null})
     * @throws io.eventcore.SerializationException if the input is not a flat JSON object of strings
     */
    Map<String, String> decode(String json);
}
