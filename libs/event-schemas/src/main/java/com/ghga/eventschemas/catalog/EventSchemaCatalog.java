package com.ghga.eventschemas.catalog;

import com.ghga.eventschemas.SchemaRegistry;

/**
 * Builds the {@link SchemaRegistry} for every {@link EventType} in the catalog.
 *
 * <p>Call {@link #createRegistry()} once during startup and hand the result to the components that
 * validate inbound events:
 *
 * <pre>{@code
 * SchemaRegistry registry = EventSchemaCatalog.createRegistry();
 * ValidatedPayload payload = registry.validate(eventType, EventSerializer.parsePayload(body));
 * }</pre>
 */
public final class EventSchemaCatalog {

    private EventSchemaCatalog() {
        // utility class
    }

    public static SchemaRegistry createRegistry() {
        SchemaRegistry.Builder builder = SchemaRegistry.builder();
        for (EventType type : EventType.values()) {
            builder.register(type.value(), type.schema());
        }
        return builder.build();
    }
}
