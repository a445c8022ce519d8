package com.ghga.eventschemas.validation;

import com.ghga.eventschemas.EventSerializer;
import java.util.Map;

/**
 * Thrown when an event payload does not conform to its schema.
 *
 * <p>Carries the complete {@link SchemaErrorInfo} and the offending payload. The message embeds
 * both as JSON.
 */
public class EventSchemaValidationException extends RuntimeException {

    private final transient Map<String, Object> payload;
    private final SchemaErrorInfo errorInfo;

    public EventSchemaValidationException(Map<String, ?> payload, SchemaErrorInfo errorInfo) {
        super(
                "The event payload failed validation against the corresponding event schema: %s. The complete payload is: %s"
                        .formatted(
                                EventSerializer.toJsonOrString(errorInfo),
                                EventSerializer.toJsonOrString(payload)));
        this.payload = JsonValues.immutableCopy(payload);
        this.errorInfo = errorInfo;
    }

    /** A deep, unmodifiable copy of the payload as it was passed to the validator. */
    public Map<String, Object> payload() {
        return payload;
    }

    public SchemaErrorInfo errorInfo() {
        return errorInfo;
    }
}
