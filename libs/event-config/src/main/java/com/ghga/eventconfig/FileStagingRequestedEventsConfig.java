package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events that indicate a file was requested for download but not present in the outbox.
 *
 * <pre>
 * ghga:
 *   events:
 *     files-to-stage-event-topic: file-stage-requests
 *     files-to-stage-event-type: non_staged_file_requested
 * </pre>
 *
 * @param filesToStageEventTopic Name of the topic used for events indicating that a download was
 *     requested for a file that is not yet available in the outbox.
 * @param filesToStageEventType The type used for non-staged file request events.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record FileStagingRequestedEventsConfig(
        @NotBlank String filesToStageEventTopic, @NotBlank String filesToStageEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return filesToStageEventTopic;
    }

    @Override
    public String eventType() {
        return filesToStageEventType;
    }
}
