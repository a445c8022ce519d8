package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events indicating that a given file has been deleted successfully.
 *
 * <pre>
 * ghga:
 *   events:
 *     file-deleted-event-topic: file-deletions
 *     file-deleted-event-type: file_deleted
 * </pre>
 *
 * @param fileDeletedEventTopic Name of the topic used for events indicating that a file has been
 *     deleted.
 * @param fileDeletedEventType The type used for events indicating that a file has been deleted.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record FileDeletedEventsConfig(
        @NotBlank String fileDeletedEventTopic, @NotBlank String fileDeletedEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return fileDeletedEventTopic;
    }

    @Override
    public String eventType() {
        return fileDeletedEventType;
    }
}
