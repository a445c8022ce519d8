package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events conveying that a file interrogation was successful. Shares its topic with
 * {@link FileValidationFailureEventsConfig}.
 *
 * <pre>
 * ghga:
 *   events:
 *     file-interrogations-topic: file-interrogations
 *     interrogation-success-event-type: file_interrogation_success
 * </pre>
 *
 * @param fileInterrogationsTopic The name of the topic used to publish file interrogation outcome
 *     events.
 * @param interrogationSuccessEventType The type used for events informing about successful file
 *     validations.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record FileValidationSuccessEventsConfig(
        @NotBlank String fileInterrogationsTopic, @NotBlank String interrogationSuccessEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return fileInterrogationsTopic;
    }

    @Override
    public String eventType() {
        return interrogationSuccessEventType;
    }
}
