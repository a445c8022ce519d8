package com.ghga.eventschemas.schema;

import java.util.Optional;

/**
 * A custom rule applied to a field value after it passed type coercion.
 *
 * <p>Implementations must be stateless and thread-safe; the same instance is shared by every
 * schema that declares it.
 */
@FunctionalInterface
public interface FieldConstraint {

    /**
     * Checks a coerced, non-null field value.
     *
     * @param value the coerced value (e.g. a {@code String} for string fields)
     * @return a human-readable violation message, or empty if the value satisfies the rule
     */
    Optional<String> check(Object value);
}
