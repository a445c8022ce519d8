package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events conveying an access request was created.
 *
 * <pre>
 * ghga:
 *   events:
 *     access-request-events-topic: access-requests
 *     access-request-created-event-type: access_request_created
 * </pre>
 *
 * @param accessRequestEventsTopic Name of the event topic used to consume access request events.
 * @param accessRequestCreatedEventType The type to use for access request created events.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record AccessRequestCreatedEventsConfig(
        @NotBlank String accessRequestEventsTopic, @NotBlank String accessRequestCreatedEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return accessRequestEventsTopic;
    }

    @Override
    public String eventType() {
        return accessRequestCreatedEventType;
    }
}
