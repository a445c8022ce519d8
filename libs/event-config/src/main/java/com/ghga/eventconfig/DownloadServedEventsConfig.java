package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events indicating that a file was downloaded.
 *
 * <pre>
 * ghga:
 *   events:
 *     download-served-event-topic: file-downloads
 *     download-served-event-type: download_served
 * </pre>
 *
 * @param downloadServedEventTopic Name of the topic used for events indicating that a download of
 *     a specified file happened.
 * @param downloadServedEventType The type used for events indicating that a download of a
 *     specified file happened.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record DownloadServedEventsConfig(
        @NotBlank String downloadServedEventTopic, @NotBlank String downloadServedEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return downloadServedEventTopic;
    }

    @Override
    public String eventType() {
        return downloadServedEventType;
    }
}
