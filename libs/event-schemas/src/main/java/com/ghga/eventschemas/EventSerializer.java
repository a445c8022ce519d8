package com.ghga.eventschemas;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;

/**
 * JSON encoding and decoding at the payload boundary.
 *
 * <p>{@code OffsetDateTime} values are written as ISO-8601 strings, the format datetime fields
 * accept.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Serializes any value (payload map, error info, validated payload) to compact JSON.
     *
     * @throws EventSerializationException if the value cannot be represented as JSON
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize value to JSON", e);
        }
    }

    /**
     * Serializes a value to JSON, falling back to {@link String#valueOf(Object)} when it holds
     * something Jackson cannot write. Used for diagnostic messages only.
     */
    public static String toJsonOrString(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    /**
     * Decodes a message body into an untyped payload.
     *
     * @param json a JSON object
     * @return the decoded key/value mapping, keys in document order
     * @throws EventSerializationException if the JSON is malformed or not an object
     */
    public static Map<String, Object> parsePayload(String json) {
        if (json == null) {
            throw new EventSerializationException("Payload JSON must not be null", null);
        }
        try {
            Map<String, Object> payload = MAPPER.readValue(json, PAYLOAD_TYPE);
            if (payload == null) {
                throw new EventSerializationException("Payload JSON must be an object, got null", null);
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to parse payload JSON", e);
        }
    }

    /**
     * Converts plain maps/lists into the given Java type (e.g. a record mirroring a schema).
     *
     * @throws EventSerializationException if the value does not fit the target type
     */
    public static <T> T convert(Object value, Class<T> type) {
        try {
            return MAPPER.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new EventSerializationException(
                    "Failed to convert value to " + type.getSimpleName(), e);
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when payload serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
