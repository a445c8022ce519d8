package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events conveying that a file was registered in the permanent bucket.
 *
 * <pre>
 * ghga:
 *   events:
 *     file-registered-event-topic: file-registrations
 *     file-registered-event-type: file_registered
 * </pre>
 *
 * @param fileRegisteredEventTopic Name of the topic used for events indicating that a file has
 *     been registered for download.
 * @param fileRegisteredEventType The type used for events indicating that a file has been
 *     registered for download.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record FileRegisteredEventsConfig(
        @NotBlank String fileRegisteredEventTopic, @NotBlank String fileRegisteredEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return fileRegisteredEventTopic;
    }

    @Override
    public String eventType() {
        return fileRegisteredEventType;
    }
}
