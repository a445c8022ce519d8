package com.ghga.eventschemas.schema;

/**
 * An enum whose constants are carried on the wire as string literals (e.g. "allowed", "Dr.").
 *
 * <p>Implemented by the catalog enums so {@link FieldType#enumOf(Class)} can derive the allowed
 * literals.
 */
public interface LiteralEnum {

    /** The canonical string used in JSON payloads. */
    String value();
}
