package com.ghga.eventschemas.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The declared shape of an event payload: a title and an ordered set of uniquely named fields.
 *
 * <p>Derived schemas are composed, not inherited. {@link Builder#include(SchemaDefinition)} copies
 * the base schema's fields into the new one when it is built, so a schema never refers back to its
 * base at validation time:
 *
 * <pre>{@code
 * SchemaDefinition registered = SchemaDefinition.builder("file_internally_registered")
 *         .include(FILE_UPLOAD_VALIDATION_SUCCESS)
 *         .field(FieldSpec.of("encrypted_size", FieldType.integer()))
 *         .build();
 * }</pre>
 *
 * Instances are immutable and safe to share across threads.
 */
public final class SchemaDefinition {

    private final String title;
    private final String description;
    private final Map<String, FieldSpec> fields;

    private SchemaDefinition(String title, String description, Map<String, FieldSpec> fields) {
        this.title = title;
        this.description = description;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder(String title) {
        return new Builder(title);
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    /** Field specs in declaration order (base fields first for composed schemas). */
    public List<FieldSpec> fields() {
        return List.copyOf(fields.values());
    }

    /** Field names in declaration order. */
    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Optional<FieldSpec> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean declares(String name) {
        return fields.containsKey(name);
    }

    public int size() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaDefinition other)) {
            return false;
        }
        return title.equals(other.title)
                && Objects.equals(description, other.description)
                && fields().equals(other.fields());
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, description, fields());
    }

    @Override
    public String toString() {
        return "SchemaDefinition[" + title + ", fields=" + fields.keySet() + "]";
    }

    /** Collects fields for a {@link SchemaDefinition}. Not thread-safe; use once. */
    public static final class Builder {

        private final String title;
        private String description;
        private final List<FieldSpec> fields = new ArrayList<>();

        private Builder(String title) {
            if (title == null || title.isBlank()) {
                throw new IllegalArgumentException("title must not be null or blank");
            }
            this.title = title;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** Flattens all fields of {@code base} into this schema, in the base's order. */
        public Builder include(SchemaDefinition base) {
            Objects.requireNonNull(base, "base");
            fields.addAll(base.fields.values());
            return this;
        }

        public Builder field(FieldSpec field) {
            fields.add(Objects.requireNonNull(field, "field"));
            return this;
        }

        public Builder field(String name, FieldType type) {
            return field(FieldSpec.of(name, type));
        }

        /**
         * Builds the immutable schema.
         *
         * @throws IllegalArgumentException if two fields share a name
         */
        public SchemaDefinition build() {
            Map<String, FieldSpec> byName = new LinkedHashMap<>();
            for (FieldSpec field : fields) {
                if (byName.putIfAbsent(field.name(), field) != null) {
                    throw new IllegalArgumentException(
                            "Schema '%s' declares field '%s' more than once"
                                    .formatted(title, field.name()));
                }
            }
            return new SchemaDefinition(title, description, byName);
        }
    }
}
