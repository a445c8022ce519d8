package com.ghga.eventschemas.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.ghga.eventschemas.schema.FieldType;
import com.ghga.eventschemas.schema.SchemaDefinition;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Per-kind coercion rules, exercised through {@link PayloadValidator} with single-field schemas.
 */
@DisplayName("Field coercion")
class FieldCoercionTest {

    private static SchemaDefinition single(FieldType type) {
        return SchemaDefinition.builder("single").field("value", type).build();
    }

    private static Object accepted(FieldType type, Object raw) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("value", raw);
        return PayloadValidator.validate(payload, single(type)).get("value");
    }

    private static String rejection(FieldType type, Object raw) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("value", raw);
        return PayloadValidator.check(payload, single(type)).mistypedFields().get("value");
    }

    @Nested
    @DisplayName("string")
    class Strings {

        @Test
        @DisplayName("numbers are not strings")
        void numberRejected() {
            assertThat(rejection(FieldType.string(), 12)).isEqualTo("Input should be a valid string");
        }
    }

    @Nested
    @DisplayName("integer")
    class Integers {

        @Test
        @DisplayName("integral numbers of any width become Long")
        void integralNumbers() {
            assertThat(accepted(FieldType.integer(), 7)).isEqualTo(7L);
            assertThat(accepted(FieldType.integer(), 7L)).isEqualTo(7L);
            assertThat(accepted(FieldType.integer(), BigInteger.TEN)).isEqualTo(10L);
            assertThat(accepted(FieldType.integer(), 3.0)).isEqualTo(3L);
        }

        @Test
        @DisplayName("numeric strings are parsed")
        void numericString() {
            assertThat(accepted(FieldType.integer(), " 1234 ")).isEqualTo(1234L);
        }

        @Test
        @DisplayName("fractional numbers, booleans and huge values are rejected")
        void rejected() {
            assertThat(rejection(FieldType.integer(), 1.5)).contains("fractional part");
            assertThat(rejection(FieldType.integer(), true)).isEqualTo("Input should be a valid integer");
            assertThat(rejection(FieldType.integer(), BigInteger.TWO.pow(70)))
                    .isEqualTo("Input should be a valid integer");
            assertThat(rejection(FieldType.integer(), "12a")).contains("unable to parse string");
        }
    }

    @Nested
    @DisplayName("boolean")
    class Booleans {

        @ParameterizedTest
        @ValueSource(strings = {"true", "YES", "on", "1", "t"})
        @DisplayName("truthy literals")
        void truthy(String literal) {
            assertThat(accepted(FieldType.bool(), literal)).isEqualTo(true);
        }

        @Test
        @DisplayName("0 and 1 are accepted, other numbers are not")
        void numbers() {
            assertThat(accepted(FieldType.bool(), 0)).isEqualTo(false);
            assertThat(rejection(FieldType.bool(), 2)).isEqualTo("Input should be a valid boolean");
        }
    }

    @Nested
    @DisplayName("enum")
    class Enums {

        @Test
        @DisplayName("only the declared literals are accepted")
        void literals() {
            var type = FieldType.enumOf("allowed", "denied", "pending");
            assertThat(accepted(type, "denied")).isEqualTo("denied");
            assertThat(rejection(type, "DENIED"))
                    .isEqualTo("Input should be 'allowed', 'denied' or 'pending'");
        }
    }

    @Nested
    @DisplayName("datetime")
    class DateTimes {

        @Test
        @DisplayName("offset strings are normalised to UTC")
        void offsetString() {
            var value = accepted(FieldType.datetime(), "2024-05-01T12:00:00+02:00");
            assertThat(value).isEqualTo(OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.UTC));
        }

        @Test
        @DisplayName("java.time values are accepted")
        void javaTime() {
            var instant = Instant.parse("2024-05-01T10:00:00Z");
            assertThat(accepted(FieldType.datetime(), instant)).isEqualTo(instant.atOffset(ZoneOffset.UTC));
        }

        @Test
        @DisplayName("numbers are not read as epoch timestamps")
        void epochNumbersRejected() {
            assertThat(rejection(FieldType.datetime(), 1704067200L))
                    .isEqualTo("Input should be a valid datetime");
        }

        @Test
        @DisplayName("strings without offset or in other formats are rejected")
        void rejected() {
            assertThat(rejection(FieldType.datetime(), "2024-05-01T12:00:00"))
                    .isEqualTo("Input should have timezone info");
            assertThat(rejection(FieldType.datetime(), "yesterday"))
                    .isEqualTo("Input should be a valid datetime");
        }
    }

    @Nested
    @DisplayName("email")
    class Emails {

        @Test
        @DisplayName("well-formed addresses pass, others name the value")
        void addresses() {
            assertThat(accepted(FieldType.email(), "user@home.org")).isEqualTo("user@home.org");
            assertThat(rejection(FieldType.email(), "user-at-home"))
                    .isEqualTo("value is not a valid email address: user-at-home");
        }
    }

    @Nested
    @DisplayName("json object")
    class JsonObjects {

        @Test
        @DisplayName("maps are copied, other values rejected")
        void maps() {
            assertThat(accepted(FieldType.jsonObject(), Map.of("k", List.of(1, 2))))
                    .isEqualTo(Map.of("k", List.of(1, 2)));
            assertThat(rejection(FieldType.jsonObject(), List.of()))
                    .isEqualTo("Input should be a valid dictionary");
        }
    }

    @Nested
    @DisplayName("list")
    class Lists {

        @Test
        @DisplayName("every failing element is reported with its index")
        void elementIndexes() {
            var type = FieldType.listOf(FieldType.integer());
            assertThat(accepted(type, List.of(1, "2"))).isEqualTo(List.of(1L, 2L));
            assertThat(rejection(type, java.util.Arrays.asList(1, "x", null)))
                    .isEqualTo(
                            "[1]: Input should be a valid integer, unable to parse string as an integer;"
                                    + " [2]: Input should be a valid integer");
        }
    }
}
