package com.ghga.eventschemas.validation;

import com.ghga.eventschemas.schema.FieldConstraint;
import com.ghga.eventschemas.schema.FieldSpec;
import com.ghga.eventschemas.schema.SchemaDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validates untyped event payloads against a {@link SchemaDefinition}.
 *
 * <p>All declared fields are checked in one pass and every fault is reported, not only the first.
 *
 * <p>Validation is a pure function. It reads the payload without modifying it and keeps no state
 * between calls, so any number of threads may validate concurrently, even the same payload.
 */
public final class PayloadValidator {

    private PayloadValidator() {
        // utility class
    }

    /**
     * Validates a payload and returns the typed result.
     *
     * <p>On success, payload keys the schema does not declare are dropped without being reported.
     * On failure, they are listed as unexpected alongside the missing and mistyped fields.
     *
     * @param payload decoded message body
     * @param schema the schema the payload must conform to
     * @return the validated payload
     * @throws EventSchemaValidationException if any declared field is missing or mistyped
     */
    public static ValidatedPayload validate(Map<String, ?> payload, SchemaDefinition schema) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        if (schema == null) {
            throw new IllegalArgumentException("schema must not be null");
        }
        var outcome = evaluate(payload, schema);
        if (outcome.passed()) {
            return new ValidatedPayload(schema, outcome.values);
        }
        throw new EventSchemaValidationException(payload, report(payload, schema, outcome));
    }

    /**
     * Checks a payload without throwing.
     *
     * @return the report; {@link SchemaErrorInfo#hasFaults()} is false when the payload is valid
     */
    public static SchemaErrorInfo check(Map<String, ?> payload, SchemaDefinition schema) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        if (schema == null) {
            throw new IllegalArgumentException("schema must not be null");
        }
        var outcome = evaluate(payload, schema);
        if (outcome.passed()) {
            return new SchemaErrorInfo(List.of(), Map.of(), List.of());
        }
        return report(payload, schema, outcome);
    }

    private static SchemaErrorInfo report(
            Map<String, ?> payload, SchemaDefinition schema, Outcome outcome) {
        var unexpected = new ArrayList<String>();
        for (String key : payload.keySet()) {
            if (!schema.declares(key)) {
                unexpected.add(key);
            }
        }
        return new SchemaErrorInfo(outcome.missing, outcome.mistyped, unexpected);
    }

    /** Nested record validation used by {@link FieldCoercer}; faults carry a field path. */
    static Coercion coerceRecord(Map<String, Object> payload, SchemaDefinition schema) {
        var outcome = evaluate(payload, schema);
        if (outcome.passed()) {
            return Coercion.ok(new ValidatedPayload(schema, outcome.values));
        }
        var problems = new ArrayList<Coercion.Problem>();
        for (String field : schema.fieldNames()) {
            if (outcome.missing.contains(field)) {
                problems.add(new Coercion.Problem(field, FieldCoercer.FIELD_REQUIRED));
            } else if (outcome.mistyped.containsKey(field)) {
                outcome.nested.get(field).forEach(p -> problems.add(p.under(field)));
            }
        }
        return Coercion.fail(problems);
    }

    private static Outcome evaluate(Map<String, ?> payload, SchemaDefinition schema) {
        var outcome = new Outcome();
        for (FieldSpec field : schema.fields()) {
            String name = field.name();
            if (!payload.containsKey(name)) {
                if (field.hasDefault()) {
                    outcome.values.put(name, field.defaultValue());
                } else {
                    outcome.missing.add(name);
                }
                continue;
            }
            Object raw = payload.get(name);
            if (raw == null) {
                if (field.nullable()) {
                    outcome.values.put(name, null);
                } else {
                    outcome.reject(name, Coercion.fail(FieldCoercer.nullMessage(field.type())));
                }
                continue;
            }
            Coercion coerced = FieldCoercer.coerce(raw, field.type());
            if (coerced.failed()) {
                outcome.reject(name, coerced);
                continue;
            }
            Optional<String> violation = firstViolation(field, coerced.value());
            if (violation.isPresent()) {
                outcome.reject(name, Coercion.fail(violation.get()));
                continue;
            }
            outcome.values.put(name, coerced.value());
        }
        return outcome;
    }

    private static Optional<String> firstViolation(FieldSpec field, Object value) {
        for (FieldConstraint constraint : field.constraints()) {
            Optional<String> violation = constraint.check(value);
            if (violation.isPresent()) {
                return violation;
            }
        }
        return Optional.empty();
    }

    /** Accumulator for a single validation pass. */
    private static final class Outcome {
        final Map<String, Object> values = new LinkedHashMap<>();
        final List<String> missing = new ArrayList<>();
        final Map<String, String> mistyped = new LinkedHashMap<>();
        final Map<String, List<Coercion.Problem>> nested = new LinkedHashMap<>();

        boolean passed() {
            return missing.isEmpty() && mistyped.isEmpty();
        }

        void reject(String field, Coercion coercion) {
            mistyped.put(field, coercion.describe());
            nested.put(field, coercion.problems());
        }
    }
}
