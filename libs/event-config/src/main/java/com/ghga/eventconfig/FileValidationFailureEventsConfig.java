package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events conveying that a file interrogation was unsuccessful. Shares its topic with
 * {@link FileValidationSuccessEventsConfig}.
 *
 * <pre>
 * ghga:
 *   events:
 *     file-interrogations-topic: file-interrogations
 *     interrogation-failure-event-type: file_interrogation_failed
 * </pre>
 *
 * @param fileInterrogationsTopic The name of the topic used to publish file interrogation outcome
 *     events.
 * @param interrogationFailureEventType The type used for events informing about failed file
 *     validations.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record FileValidationFailureEventsConfig(
        @NotBlank String fileInterrogationsTopic, @NotBlank String interrogationFailureEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return fileInterrogationsTopic;
    }

    @Override
    public String eventType() {
        return interrogationFailureEventType;
    }
}
