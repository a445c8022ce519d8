package com.ghga.eventschemas.validation;

import com.ghga.eventschemas.schema.FieldType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Coerces raw payload values (as produced by a JSON decoder) to the Java representation of their
 * declared {@link FieldType}.
 *
 * <p>Coercion is lax the same way across all producers: integral numbers may arrive as strings,
 * booleans as "yes"/"no" or 0/1. Anything that cannot be represented without loss is rejected.
 */
final class FieldCoercer {

    static final String STRING_EXPECTED = "Input should be a valid string";
    static final String INTEGER_EXPECTED = "Input should be a valid integer";
    static final String INTEGER_UNPARSEABLE =
            "Input should be a valid integer, unable to parse string as an integer";
    static final String INTEGER_FRACTIONAL =
            "Input should be a valid integer, got a number with a fractional part";
    static final String BOOLEAN_EXPECTED = "Input should be a valid boolean";
    static final String DATETIME_EXPECTED = "Input should be a valid datetime";
    static final String TIMEZONE_EXPECTED = "Input should have timezone info";
    static final String DICT_EXPECTED = "Input should be a valid dictionary";
    static final String LIST_EXPECTED = "Input should be a valid list";
    static final String RECORD_EXPECTED = "Input should be a valid dictionary or object";
    static final String FIELD_REQUIRED = "Field required";

    private static final Set<String> TRUE_LITERALS = Set.of("true", "t", "yes", "y", "on", "1");
    private static final Set<String> FALSE_LITERALS = Set.of("false", "f", "no", "n", "off", "0");

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s.]+$");

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private FieldCoercer() {
        // utility class
    }

    /** Coerces a non-null value. Null handling belongs to the caller (nullable vs. not). */
    static Coercion coerce(Object raw, FieldType type) {
        return switch (type.kind()) {
            case STRING -> raw instanceof String ? Coercion.ok(raw) : Coercion.fail(STRING_EXPECTED);
            case INTEGER -> toInteger(raw);
            case BOOLEAN -> toBoolean(raw);
            case ENUM -> toEnumLiteral(raw, type.allowedValues());
            case DATETIME -> toDateTime(raw);
            case EMAIL -> toEmail(raw);
            case JSON_OBJECT -> toJsonObject(raw);
            case LIST -> toList(raw, type.elementType());
            case RECORD -> toRecord(raw, type);
        };
    }

    /** The message used when a non-nullable field carries {@code null}. */
    static String nullMessage(FieldType type) {
        return switch (type.kind()) {
            case STRING, EMAIL -> STRING_EXPECTED;
            case INTEGER -> INTEGER_EXPECTED;
            case BOOLEAN -> BOOLEAN_EXPECTED;
            case ENUM -> enumMessage(type.allowedValues());
            case DATETIME -> DATETIME_EXPECTED;
            case JSON_OBJECT -> DICT_EXPECTED;
            case LIST -> LIST_EXPECTED;
            case RECORD -> RECORD_EXPECTED;
        };
    }

    private static Coercion toInteger(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return Coercion.ok(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            return big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0
                    ? Coercion.ok(big.longValue())
                    : Coercion.fail(INTEGER_EXPECTED);
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Coercion.fail(INTEGER_EXPECTED);
            }
            return integralDecimal(BigDecimal.valueOf(d));
        }
        if (raw instanceof BigDecimal decimal) {
            return integralDecimal(decimal);
        }
        if (raw instanceof String text) {
            try {
                return Coercion.ok(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return Coercion.fail(INTEGER_UNPARSEABLE);
            }
        }
        return Coercion.fail(INTEGER_EXPECTED);
    }

    private static Coercion integralDecimal(BigDecimal decimal) {
        if (decimal.signum() != 0 && decimal.stripTrailingZeros().scale() > 0) {
            return Coercion.fail(INTEGER_FRACTIONAL);
        }
        try {
            return Coercion.ok(decimal.longValueExact());
        } catch (ArithmeticException e) {
            return Coercion.fail(INTEGER_EXPECTED);
        }
    }

    private static Coercion toBoolean(Object raw) {
        if (raw instanceof Boolean) {
            return Coercion.ok(raw);
        }
        if (raw instanceof Integer || raw instanceof Long) {
            long n = ((Number) raw).longValue();
            if (n == 0 || n == 1) {
                return Coercion.ok(n == 1);
            }
            return Coercion.fail(BOOLEAN_EXPECTED);
        }
        if (raw instanceof String text) {
            String literal = text.trim().toLowerCase(Locale.ROOT);
            if (TRUE_LITERALS.contains(literal)) {
                return Coercion.ok(Boolean.TRUE);
            }
            if (FALSE_LITERALS.contains(literal)) {
                return Coercion.ok(Boolean.FALSE);
            }
        }
        return Coercion.fail(BOOLEAN_EXPECTED);
    }

    private static Coercion toEnumLiteral(Object raw, List<String> allowed) {
        if (raw instanceof String && allowed.contains(raw)) {
            return Coercion.ok(raw);
        }
        return Coercion.fail(enumMessage(allowed));
    }

    static String enumMessage(List<String> allowed) {
        StringBuilder message = new StringBuilder("Input should be ");
        for (int i = 0; i < allowed.size(); i++) {
            if (i > 0) {
                message.append(i == allowed.size() - 1 ? " or " : ", ");
            }
            message.append('\'').append(allowed.get(i)).append('\'');
        }
        return message.toString();
    }

    private static Coercion toDateTime(Object raw) {
        if (raw instanceof OffsetDateTime offset) {
            return Coercion.ok(offset.withOffsetSameInstant(ZoneOffset.UTC));
        }
        if (raw instanceof ZonedDateTime zoned) {
            return Coercion.ok(zoned.toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC));
        }
        if (raw instanceof Instant instant) {
            return Coercion.ok(instant.atOffset(ZoneOffset.UTC));
        }
        if (raw instanceof LocalDateTime) {
            return Coercion.fail(TIMEZONE_EXPECTED);
        }
        if (!(raw instanceof String text)) {
            return Coercion.fail(DATETIME_EXPECTED);
        }
        String normalized = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        try {
            TemporalAccessor parsed =
                    DateTimeFormatter.ISO_DATE_TIME.parseBest(
                            normalized, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return Coercion.ok(offset.withOffsetSameInstant(ZoneOffset.UTC));
            }
            return Coercion.fail(TIMEZONE_EXPECTED);
        } catch (DateTimeParseException e) {
            return Coercion.fail(DATETIME_EXPECTED);
        }
    }

    private static Coercion toEmail(Object raw) {
        if (!(raw instanceof String text)) {
            return Coercion.fail(STRING_EXPECTED);
        }
        String address = text.trim();
        if (!EMAIL.matcher(address).matches()) {
            return Coercion.fail("value is not a valid email address: " + raw);
        }
        return Coercion.ok(address);
    }

    private static Coercion toJsonObject(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            return Coercion.fail(DICT_EXPECTED);
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                return Coercion.fail(DICT_EXPECTED + ", keys must be strings");
            }
        }
        return Coercion.ok(JsonValues.immutableCopy(map));
    }

    private static Coercion toList(Object raw, FieldType elementType) {
        List<?> elements;
        if (raw instanceof List<?> list) {
            elements = list;
        } else if (raw instanceof Object[] array) {
            elements = Arrays.asList(array);
        } else {
            return Coercion.fail(LIST_EXPECTED);
        }
        List<Object> values = new ArrayList<>(elements.size());
        List<Coercion.Problem> problems = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            Object element = elements.get(i);
            Coercion coerced =
                    element == null
                            ? Coercion.fail(nullMessage(elementType))
                            : coerce(element, elementType);
            if (coerced.failed()) {
                String index = "[" + i + "]";
                coerced.problems().forEach(p -> problems.add(p.under(index)));
            } else {
                values.add(coerced.value());
            }
        }
        return problems.isEmpty()
                ? Coercion.ok(Collections.unmodifiableList(values))
                : Coercion.fail(problems);
    }

    private static Coercion toRecord(Object raw, FieldType type) {
        if (!(raw instanceof Map<?, ?> map)) {
            return Coercion.fail(RECORD_EXPECTED);
        }
        Map<String, Object> nested = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                return Coercion.fail(RECORD_EXPECTED + ", keys must be strings");
            }
            nested.put(key, entry.getValue());
        }
        return PayloadValidator.coerceRecord(nested, type.recordSchema());
    }
}
