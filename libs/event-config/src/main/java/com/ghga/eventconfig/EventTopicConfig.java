package com.ghga.eventconfig;

/**
 * A topic/event-type pair a service publishes to or consumes from.
 *
 * <p>Every configuration record in this package implements it, so infrastructure code can treat
 * them uniformly. Not every configured event type has a registered payload schema (deletion and
 * access-request events have none), so look schemas up with {@code find}:
 *
 * <pre>{@code
 * Optional<SchemaDefinition> schema = registry.find(config.eventType());
 * }</pre>
 */
public interface EventTopicConfig {

    /** Name of the topic the events are published to. */
    String topic();

    /** Event type string carried with every event of this kind. */
    String eventType();
}
