package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events indicating that a file was staged to the download bucket.
 *
 * <pre>
 * ghga:
 *   events:
 *     file-staged-event-topic: file-stagings
 *     file-staged-event-type: file_staged_for_download
 * </pre>
 *
 * @param fileStagedEventTopic Name of the topic used for events indicating that a file has been
 *     staged.
 * @param fileStagedEventType The type used for events indicating that a file has been staged.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record FileStagedEventsConfig(
        @NotBlank String fileStagedEventTopic, @NotBlank String fileStagedEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return fileStagedEventTopic;
    }

    @Override
    public String eventType() {
        return fileStagedEventType;
    }
}
