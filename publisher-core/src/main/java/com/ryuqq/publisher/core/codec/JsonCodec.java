package com.ryuqq.publisher.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON codec for values written to the durable cache.
 *
 * <p>Backed by a single Jackson {@link ObjectMapper} configured for the pipeline's model:</p>
 * <ul>
 *   <li>{@code java.time} types as ISO-8601 strings</li>
 *   <li>unknown properties ignored, so older readers tolerate newer entries</li>
 *   <li>polymorphic payloads and continuations resolved through their type discriminators</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class JsonCodec {

    private static final JsonCodec DEFAULT = new JsonCodec(defaultMapper());

    private final ObjectMapper mapper;

    public JsonCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * Returns the shared default codec.
     *
     * @return the default {@link JsonCodec}
     */
    public static JsonCodec getDefault() {
        return DEFAULT;
    }

    /**
     * Creates a mapper with the pipeline's settings.
     *
     * @return a new mapper
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Encodes a value.
     *
     * @param value value to encode
     * @return JSON string
     * @throws JsonCodecException if the value cannot be serialized
     */
    public String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decodes a JSON string.
     *
     * @param json JSON string
     * @param type target type
     * @param <T> value type
     * @return decoded value
     * @throws JsonCodecException if the input does not match the type
     */
    public <T> T decode(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Failed to decode " + type.getSimpleName(), e);
        }
    }
}
