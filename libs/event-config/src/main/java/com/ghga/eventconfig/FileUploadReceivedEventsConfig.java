package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events about new file uploads.
 *
 * <pre>
 * ghga:
 *   events:
 *     file-upload-received-topic: received-file-uploads
 *     file-upload-received-event-type: file_upload_received
 * </pre>
 *
 * @param fileUploadReceivedTopic The name of the topic used for FileUploadReceived events.
 * @param fileUploadReceivedEventType The name of the type used for FileUploadReceived events.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record FileUploadReceivedEventsConfig(
        @NotBlank String fileUploadReceivedTopic, @NotBlank String fileUploadReceivedEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return fileUploadReceivedTopic;
    }

    @Override
    public String eventType() {
        return fileUploadReceivedEventType;
    }
}
