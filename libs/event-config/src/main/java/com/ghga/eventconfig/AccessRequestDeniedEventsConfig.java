package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events conveying an access request was denied.
 *
 * <pre>
 * ghga:
 *   events:
 *     access-request-events-topic: access-requests
 *     access-request-denied-event-type: access_request_denied
 * </pre>
 *
 * @param accessRequestEventsTopic Name of the event topic used to consume access request events.
 * @param accessRequestDeniedEventType The type to use for access request denied events.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record AccessRequestDeniedEventsConfig(
        @NotBlank String accessRequestEventsTopic, @NotBlank String accessRequestDeniedEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return accessRequestEventsTopic;
    }

    @Override
    public String eventType() {
        return accessRequestDeniedEventType;
    }
}
