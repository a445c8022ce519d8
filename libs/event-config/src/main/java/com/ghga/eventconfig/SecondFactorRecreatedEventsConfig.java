package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events conveying that the second authentication factor has been recreated.
 *
 * <pre>
 * ghga:
 *   events:
 *     auth-event-topic: auth-events
 *     second-factor-recreated-event-type: second_factor_recreated
 * </pre>
 *
 * @param authEventTopic The name of the topic containing auth-related events.
 * @param secondFactorRecreatedEventType The event type for recreation of the second factor for
 *     authentication.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record SecondFactorRecreatedEventsConfig(
        @NotBlank String authEventTopic, @NotBlank String secondFactorRecreatedEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return authEventTopic;
    }

    @Override
    public String eventType() {
        return secondFactorRecreatedEventType;
    }
}
