package com.ghga.eventschemas;

import com.ghga.eventschemas.schema.SchemaDefinition;
import com.ghga.eventschemas.validation.PayloadValidator;
import com.ghga.eventschemas.validation.ValidatedPayload;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable lookup table from event type to {@link SchemaDefinition}.
 *
 * <p>Built once at process start via {@link #builder()} and passed to whoever needs it. There is
 * no way to add or remove entries afterwards, so concurrent reads need no synchronization.
 *
 * <p>Several event types may share one schema (e.g. {@code user_id} and
 * {@code second_factor_recreated} both carry only a user ID); an event type never maps to more
 * than one schema.
 */
public final class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, SchemaDefinition> schemas;

    private SchemaRegistry(Map<String, SchemaDefinition> schemas) {
        this.schemas = Map.copyOf(schemas);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the schema an event of the given type must conform to.
     *
     * @throws SchemaNotFoundException if the event type is not registered
     */
    public SchemaDefinition schemaFor(String eventType) {
        SchemaDefinition schema = eventType == null ? null : schemas.get(eventType);
        if (schema == null) {
            throw new SchemaNotFoundException(eventType);
        }
        return schema;
    }

    public Optional<SchemaDefinition> find(String eventType) {
        return eventType == null ? Optional.empty() : Optional.ofNullable(schemas.get(eventType));
    }

    public boolean contains(String eventType) {
        return eventType != null && schemas.containsKey(eventType);
    }

    /** Registered event types in alphabetical order. */
    public SortedSet<String> eventTypes() {
        return new TreeSet<>(schemas.keySet());
    }

    public int size() {
        return schemas.size();
    }

    /**
     * Resolves the schema for {@code eventType} and validates the payload against it.
     *
     * @throws SchemaNotFoundException if the event type is not registered
     * @throws com.ghga.eventschemas.validation.EventSchemaValidationException if the payload does
     *     not conform
     */
    public ValidatedPayload validate(String eventType, Map<String, ?> payload) {
        return PayloadValidator.validate(payload, schemaFor(eventType));
    }

    /** Collects registrations. Not thread-safe; meant to be used once during startup. */
    public static final class Builder {

        private final Map<String, SchemaDefinition> schemas = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers a schema under an event type.
         *
         * @throws IllegalArgumentException if the name is blank or the schema is null
         * @throws IllegalStateException if the event type is already registered
         */
        public Builder register(String eventType, SchemaDefinition schema) {
            if (eventType == null || eventType.isBlank()) {
                throw new IllegalArgumentException("eventType must not be null or blank");
            }
            if (schema == null) {
                throw new IllegalArgumentException("schema must not be null");
            }
            SchemaDefinition existing = schemas.putIfAbsent(eventType, schema);
            if (existing != null) {
                log.error(
                        "Duplicate schema registration for event type '{}': '{}' already registered, refusing '{}'",
                        eventType,
                        existing.title(),
                        schema.title());
                throw new IllegalStateException(
                        "Event type '%s' is already registered".formatted(eventType));
            }
            return this;
        }

        public SchemaRegistry build() {
            var registry = new SchemaRegistry(schemas);
            log.info("Event schema registry initialized with {} event types", registry.size());
            log.debug("Registered event types: {}", registry.eventTypes());
            return registry;
        }
    }
}
