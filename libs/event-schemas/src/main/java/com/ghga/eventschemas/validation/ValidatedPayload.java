package com.ghga.eventschemas.validation;

import com.fasterxml.jackson.annotation.JsonValue;
import com.ghga.eventschemas.EventSerializer;
import com.ghga.eventschemas.schema.SchemaDefinition;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A payload that passed validation against a {@link SchemaDefinition}.
 *
 * <p>Holds exactly one value per declared field, coerced to the field's Java representation:
 *
 * <ul>
 *   <li>string, email, enum literal: {@code String}
 *   <li>integer: {@code Long}
 *   <li>boolean: {@code Boolean}
 *   <li>datetime: {@code OffsetDateTime} in UTC
 *   <li>JSON object: unmodifiable {@code Map<String, Object>}
 *   <li>list: unmodifiable {@code List} of the element representation
 *   <li>nested record: {@code ValidatedPayload}
 * </ul>
 *
 * Payload keys the schema does not declare are not part of the instance. Nullable fields may
 * hold {@code null}. Immutable and owned by the caller.
 */
public final class ValidatedPayload {

    private final SchemaDefinition schema;
    private final Map<String, Object> values;

    ValidatedPayload(SchemaDefinition schema, Map<String, Object> values) {
        this.schema = schema;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public SchemaDefinition schema() {
        return schema;
    }

    /** True if the schema declares {@code field}. */
    public boolean has(String field) {
        return values.containsKey(field);
    }

    /**
     * Returns the coerced value of a declared field.
     *
     * @throws IllegalArgumentException if the schema does not declare the field
     */
    public Object get(String field) {
        if (!values.containsKey(field)) {
            throw new IllegalArgumentException(
                    "Schema '%s' does not declare field '%s'".formatted(schema.title(), field));
        }
        return values.get(field);
    }

    public String getString(String field) {
        return typed(field, String.class);
    }

    public Long getLong(String field) {
        return typed(field, Long.class);
    }

    public Boolean getBoolean(String field) {
        return typed(field, Boolean.class);
    }

    public OffsetDateTime getDateTime(String field) {
        return typed(field, OffsetDateTime.class);
    }

    public ValidatedPayload getRecord(String field) {
        return typed(field, ValidatedPayload.class);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getJsonObject(String field) {
        return typed(field, Map.class);
    }

    @SuppressWarnings("unchecked")
    public <E> List<E> getList(String field, Class<E> elementType) {
        List<Object> list = typed(field, List.class);
        if (list == null) {
            return null;
        }
        for (Object element : list) {
            if (!elementType.isInstance(element)) {
                throw new ClassCastException(
                        "Field '%s' holds %s elements, not %s"
                                .formatted(field, element.getClass().getSimpleName(), elementType.getSimpleName()));
            }
        }
        return (List<E>) list;
    }

    /** Field values in declaration order, nested payloads kept as {@link ValidatedPayload}. */
    public Map<String, Object> values() {
        return values;
    }

    /**
     * Plain representation: nested payloads become maps, suitable for JSON encoding and for
     * {@link #toObject(Class)}.
     */
    @JsonValue
    public Map<String, Object> asMap() {
        Map<String, Object> plain = new LinkedHashMap<>();
        values.forEach((name, value) -> plain.put(name, plain(value)));
        return plain;
    }

    /**
     * Converts this payload into a caller-defined Java type, typically a record whose components
     * mirror the schema's fields (snake_case names mapped via {@code @JsonProperty}).
     *
     * @throws EventSerializer.EventSerializationException if the type does not fit
     */
    public <T> T toObject(Class<T> type) {
        return EventSerializer.convert(asMap(), type);
    }

    private <T> T typed(String field, Class<T> type) {
        Object value = get(field);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new ClassCastException(
                    "Field '%s' holds a %s, not a %s"
                            .formatted(field, value.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(value);
    }

    private static Object plain(Object value) {
        if (value instanceof ValidatedPayload nested) {
            return nested.asMap();
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>();
            for (Object element : list) {
                copy.add(plain(element));
            }
            return copy;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValidatedPayload other)) {
            return false;
        }
        return schema.title().equals(other.schema.title()) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema.title(), values);
    }

    @Override
    public String toString() {
        return schema.title() + values;
    }
}
