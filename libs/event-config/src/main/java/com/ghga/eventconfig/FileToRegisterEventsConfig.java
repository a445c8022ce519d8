package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events containing info about a file to register.
 *
 * <pre>
 * ghga:
 *   events:
 *     files-to-register-event-topic: files-to-register
 *     files-to-register-event-type: file_to_register
 * </pre>
 *
 * @param filesToRegisterEventTopic The name of the topic to receive events informing about new
 *     files to register.
 * @param filesToRegisterEventType The name of the type for events informing about new files to
 *     register.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record FileToRegisterEventsConfig(
        @NotBlank String filesToRegisterEventTopic, @NotBlank String filesToRegisterEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return filesToRegisterEventTopic;
    }

    @Override
    public String eventType() {
        return filesToRegisterEventType;
    }
}
