package com.ghga.eventschemas.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Specification of a single named field in a {@link SchemaDefinition}.
 *
 * <p>A field is <em>required</em> unless it has a default. {@code nullable} is independent of
 * that: a nullable field without a default must still be present in the payload, but may carry
 * {@code null}.
 *
 * <p>Specs are immutable; the {@code with*} methods return modified copies:
 *
 * <pre>{@code
 * FieldSpec.of("ticket_id", FieldType.string())
 *         .asNullable()
 *         .withDefault(null)
 *         .describedAs("The ID of the ticket associated with the access request");
 * }</pre>
 *
 * @param name field name as it appears in the payload
 * @param type declared type
 * @param nullable whether {@code null} is an accepted value
 * @param hasDefault whether the field may be omitted
 * @param defaultValue value used when the field is omitted (only meaningful if {@code hasDefault})
 * @param description human-readable description
 * @param constraints custom rules checked in order after type coercion
 */
public record FieldSpec(
        String name,
        FieldType type,
        boolean nullable,
        boolean hasDefault,
        Object defaultValue,
        String description,
        List<FieldConstraint> constraints) {

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        Objects.requireNonNull(type, "type");
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    /** A required, non-nullable field without constraints. */
    public static FieldSpec of(String name, FieldType type) {
        return new FieldSpec(name, type, false, false, null, null, List.of());
    }

    public FieldSpec asNullable() {
        return new FieldSpec(name, type, true, hasDefault, defaultValue, description, constraints);
    }

    public FieldSpec withDefault(Object value) {
        return new FieldSpec(name, type, nullable, true, value, description, constraints);
    }

    public FieldSpec describedAs(String text) {
        return new FieldSpec(name, type, nullable, hasDefault, defaultValue, text, constraints);
    }

    public FieldSpec withConstraint(FieldConstraint constraint) {
        var all = new ArrayList<>(constraints);
        all.add(Objects.requireNonNull(constraint, "constraint"));
        return new FieldSpec(name, type, nullable, hasDefault, defaultValue, description, all);
    }

    /** True if the payload must contain this key. */
    public boolean required() {
        return !hasDefault;
    }
}
