package com.ghga.eventconfig;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * For events communicating updates to IVA statuses.
 *
 * <pre>
 * ghga:
 *   events:
 *     iva-state-changed-event-topic: ivas
 *     iva-state-changed-event-type: iva_state_changed
 * </pre>
 *
 * @param ivaStateChangedEventTopic The name of the topic containing IVA events.
 * @param ivaStateChangedEventType The type to use for IVA state changed events.
 */
@ConfigurationProperties(prefix = "ghga.events")
@Validated
public record IvaChangeEventsConfig(
        @NotBlank String ivaStateChangedEventTopic, @NotBlank String ivaStateChangedEventType)
        implements EventTopicConfig {

    @Override
    public String topic() {
        return ivaStateChangedEventTopic;
    }

    @Override
    public String eventType() {
        return ivaStateChangedEventType;
    }
}
