package com.ghga.eventschemas.schema;

/**
 * The semantic kind of a schema field.
 */
public enum FieldKind {
    STRING("string"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    ENUM("string"),
    DATETIME("string"),
    EMAIL("string"),
    JSON_OBJECT("object"),
    LIST("array"),
    RECORD("object");

    private final String jsonType;

    FieldKind(String jsonType) {
        this.jsonType = jsonType;
    }

    /** The JSON type a value of this kind is encoded as on the wire (e.g. "string", "array"). */
    public String jsonType() {
        return jsonType;
    }
}
