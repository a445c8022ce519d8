package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events conveying an access request was allowed/approved.
 *
 * <pre>
 * ghga:
 *   events:
 *     access-request-events-topic: access-requests
 *     access-request-allowed-event-type: access_request_allowed
 * </pre>
 *
 * @param accessRequestEventsTopic Name of the event topic used to consume access request events.
 * @param accessRequestAllowedEventType The type to use for access request allowed events.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record AccessRequestAllowedEventsConfig(
        @NotBlank String accessRequestEventsTopic, @NotBlank String accessRequestAllowedEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return accessRequestEventsTopic;
    }

    @Override
    public String eventType() {
        return accessRequestAllowedEventType;
    }
}
