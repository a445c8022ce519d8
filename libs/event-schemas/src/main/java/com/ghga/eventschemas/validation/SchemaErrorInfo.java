package com.ghga.eventschemas.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured breakdown of why a payload failed validation against its schema.
 *
 * <p>Serialized with the snake_case names consumers already log and alert on.
 *
 * @param missingFields schema fields absent from the payload, in schema declaration order
 * @param mistypedFields schema fields whose value failed type or constraint checks, with reason
 * @param unexpectedFields payload keys the schema does not declare, in payload order
 */
@JsonPropertyOrder({"missing_fields", "mistyped_fields", "unexpected_fields"})
public record SchemaErrorInfo(
        @JsonProperty("missing_fields") List<String> missingFields,
        @JsonProperty("mistyped_fields") Map<String, String> mistypedFields,
        @JsonProperty("unexpected_fields") List<String> unexpectedFields) {

    public SchemaErrorInfo {
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
        mistypedFields =
                mistypedFields == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(mistypedFields));
        unexpectedFields = unexpectedFields == null ? List.of() : List.copyOf(unexpectedFields);
    }

    /** True if at least one field is missing, mistyped or unexpected. */
    public boolean hasFaults() {
        return !missingFields.isEmpty() || !mistypedFields.isEmpty() || !unexpectedFields.isEmpty();
    }
}
