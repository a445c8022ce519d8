package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For notification events.
 *
 * <pre>
 * ghga:
 *   events:
 *     notification-event-topic: notifications
 *     notification-event-type: notification
 * </pre>
 *
 * @param notificationEventTopic Name of the topic used for notification events.
 * @param notificationEventType The type used for notification events.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record NotificationEventsConfig(
        @NotBlank String notificationEventTopic, @NotBlank String notificationEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return notificationEventTopic;
    }

    @Override
    public String eventType() {
        return notificationEventType;
    }
}
