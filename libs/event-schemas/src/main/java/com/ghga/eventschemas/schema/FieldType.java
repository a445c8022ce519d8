package com.ghga.eventschemas.schema;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Declared type of a schema field: a {@link FieldKind} tag plus the data that kind needs.
 *
 * <ul>
 *   <li>{@link FieldKind#LIST}: {@code elementType} is the type of every element
 *   <li>{@link FieldKind#RECORD}: {@code recordSchema} is the nested schema
 *   <li>{@link FieldKind#ENUM}: {@code allowedValues} lists the accepted literals in order
 * </ul>
 *
 * Instances are created through the static factories, never directly.
 *
 * @param kind the field kind
 * @param elementType element type for lists, otherwise null
 * @param recordSchema nested schema for records, otherwise null
 * @param allowedValues accepted literals for enums, otherwise empty
 */
public record FieldType(
        FieldKind kind, FieldType elementType, SchemaDefinition recordSchema, List<String> allowedValues) {

    private static final FieldType STRING = new FieldType(FieldKind.STRING, null, null, List.of());
    private static final FieldType INTEGER = new FieldType(FieldKind.INTEGER, null, null, List.of());
    private static final FieldType BOOLEAN = new FieldType(FieldKind.BOOLEAN, null, null, List.of());
    private static final FieldType DATETIME = new FieldType(FieldKind.DATETIME, null, null, List.of());
    private static final FieldType EMAIL = new FieldType(FieldKind.EMAIL, null, null, List.of());
    private static final FieldType JSON_OBJECT =
            new FieldType(FieldKind.JSON_OBJECT, null, null, List.of());

    public FieldType {
        Objects.requireNonNull(kind, "kind");
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        if (kind == FieldKind.LIST && elementType == null) {
            throw new IllegalArgumentException("list type requires an element type");
        }
        if (kind == FieldKind.RECORD && recordSchema == null) {
            throw new IllegalArgumentException("record type requires a nested schema");
        }
        if (kind == FieldKind.ENUM && allowedValues.isEmpty()) {
            throw new IllegalArgumentException("enum type requires at least one allowed value");
        }
    }

    public static FieldType string() {
        return STRING;
    }

    public static FieldType integer() {
        return INTEGER;
    }

    public static FieldType bool() {
        return BOOLEAN;
    }

    /** A timezone-aware date/time, normalised to UTC. */
    public static FieldType datetime() {
        return DATETIME;
    }

    public static FieldType email() {
        return EMAIL;
    }

    /** A free-form JSON object (string keys, arbitrary values). */
    public static FieldType jsonObject() {
        return JSON_OBJECT;
    }

    public static FieldType enumOf(String... allowedValues) {
        return new FieldType(FieldKind.ENUM, null, null, Arrays.asList(allowedValues));
    }

    public static <E extends Enum<E> & LiteralEnum> FieldType enumOf(Class<E> enumClass) {
        List<String> values =
                Arrays.stream(enumClass.getEnumConstants())
                        .map(LiteralEnum::value)
                        .collect(Collectors.toList());
        return new FieldType(FieldKind.ENUM, null, null, values);
    }

    public static FieldType listOf(FieldType elementType) {
        return new FieldType(FieldKind.LIST, Objects.requireNonNull(elementType), null, List.of());
    }

    public static FieldType record(SchemaDefinition schema) {
        return new FieldType(FieldKind.RECORD, null, Objects.requireNonNull(schema), List.of());
    }

    /** Human-readable form used in error messages and logs, e.g. {@code list[string]}. */
    public String describe() {
        return switch (kind) {
            case LIST -> "list[" + elementType.describe() + "]";
            case RECORD -> recordSchema.title();
            case ENUM -> "enum" + allowedValues;
            default -> kind.name().toLowerCase(Locale.ROOT);
        };
    }
}
