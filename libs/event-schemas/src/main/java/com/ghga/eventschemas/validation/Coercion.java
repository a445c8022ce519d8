package com.ghga.eventschemas.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of coercing one raw value to its declared field type: either the coerced value or the
 * problems that rejected it. Problems of nested values (list elements, record fields) keep a path
 * relative to the field being coerced.
 */
record Coercion(Object value, List<Problem> problems) {

    /** One rejected value; {@code path} is empty for the value itself, e.g. "[0].accession". */
    record Problem(String path, String reason) {

        Problem under(String prefix) {
            if (path.isEmpty()) {
                return new Problem(prefix, reason);
            }
            return new Problem(path.startsWith("[") ? prefix + path : prefix + "." + path, reason);
        }

        @Override
        public String toString() {
            return path.isEmpty() ? reason : path + ": " + reason;
        }
    }

    static Coercion ok(Object value) {
        return new Coercion(value, List.of());
    }

    static Coercion fail(String reason) {
        return new Coercion(null, List.of(new Problem("", reason)));
    }

    static Coercion fail(List<Problem> problems) {
        return new Coercion(null, List.copyOf(problems));
    }

    boolean failed() {
        return !problems.isEmpty();
    }

    /** All problems as one message, e.g. {@code [0].accession: Field required; [1]: ...}. */
    String describe() {
        return problems.stream().map(Problem::toString).collect(Collectors.joining("; "));
    }
}
