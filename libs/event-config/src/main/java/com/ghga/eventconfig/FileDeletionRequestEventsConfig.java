package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events that require deleting a file.
 *
 * <p>Note the property names: {@code file-deletion-request-event-topic} holds the event
 * <em>type</em>, and the topic itself is {@code files-to-delete-topic}. Deployed services already
 * set these keys, so they are kept as they are.
 *
 * <pre>
 * ghga:
 *   events:
 *     files-to-delete-topic: file-deletion-requests
 *     file-deletion-request-event-topic: file_deletion_requested
 * </pre>
 *
 * @param filesToDeleteTopic The name of the topic to receive events informing about files to
 *     delete.
 * @param fileDeletionRequestEventTopic The type used for events indicating that a request to
 *     delete a file has been received.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record FileDeletionRequestEventsConfig(
        @NotBlank String filesToDeleteTopic, @NotBlank String fileDeletionRequestEventTopic)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return filesToDeleteTopic;
    }

    @Override
    public String eventType() {
        return fileDeletionRequestEventTopic;
    }
}
