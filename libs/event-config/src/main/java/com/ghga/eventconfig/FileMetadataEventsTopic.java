package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events related to new file metadata arrivals.
 *
 * <pre>
 * ghga:
 *   events:
 *     file-metadata-event-topic: metadata
 *     file-metadata-event-type: file_metadata_upserted
 * </pre>
 *
 * @param fileMetadataEventTopic Name of the topic to receive new or changed metadata on files that
 *     shall be registered for upload.
 * @param fileMetadataEventType The type used for events to receive new or changed metadata on
 *     files that are expected to be uploaded.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record FileMetadataEventsTopic(
        @NotBlank String fileMetadataEventTopic, @NotBlank String fileMetadataEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return fileMetadataEventTopic;
    }

    @Override
    public String eventType() {
        return fileMetadataEventType;
    }
}
