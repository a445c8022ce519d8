package com.ghga.eventschemas;

/**
 * Thrown when no schema is registered for a requested event type.
 */
public class SchemaNotFoundException extends RuntimeException {

    private final String eventType;

    public SchemaNotFoundException(String eventType) {
        super("No event schema registered for event type '%s'".formatted(eventType));
        this.eventType = eventType;
    }

    public String eventType() {
        return eventType;
    }
}
