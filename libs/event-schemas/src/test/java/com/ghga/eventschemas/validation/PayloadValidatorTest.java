package com.ghga.eventschemas.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.ghga.eventschemas.schema.FieldSpec;
import com.ghga.eventschemas.schema.FieldType;
import com.ghga.eventschemas.schema.SchemaDefinition;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PayloadValidator}.
 *
 * <p>Extra keys are dropped on success and reported on failure.
 */
@DisplayName("PayloadValidator")
class PayloadValidatorTest {

    private static final SchemaDefinition EXAMPLE =
            SchemaDefinition.builder("example")
                    .field("some_param", FieldType.string())
                    .field("another_param", FieldType.integer())
                    .build();

    private static final SchemaDefinition UPLOAD =
            SchemaDefinition.builder("upload")
                    .field(UploadDates.UPLOAD_DATE_FIELD)
                    .field("file_id", FieldType.string())
                    .build();

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private static SchemaErrorInfo failure(Map<String, ?> payload, SchemaDefinition schema) {
        var error =
                catchThrowableOfType(
                        () -> PayloadValidator.validate(payload, schema),
                        EventSchemaValidationException.class);
        assertThat(error).as("validation should have failed").isNotNull();
        return error.errorInfo();
    }

    @Nested
    @DisplayName("valid payloads")
    class ValidPayloads {

        @Test
        @DisplayName("matching payload yields instance with payload values")
        void happyPath() {
            var result = PayloadValidator.validate(payload("some_param", "test", "another_param", 1234), EXAMPLE);

            assertThat(result.schema()).isEqualTo(EXAMPLE);
            assertThat(result.getString("some_param")).isEqualTo("test");
            assertThat(result.getLong("another_param")).isEqualTo(1234L);
        }

        @Test
        @DisplayName("extra keys are dropped without being reported")
        void extraKeysDropped() {
            var result =
                    PayloadValidator.validate(
                            payload("some_param", "test", "another_param", 1234, "extra_field", "x"), EXAMPLE);

            assertThat(result.values()).containsOnlyKeys("some_param", "another_param");
            assertThat(result.has("extra_field")).isFalse();
            assertThatThrownBy(() -> result.get("extra_field"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("payload is not modified")
        void payloadUntouched() {
            var input = payload("some_param", "test", "another_param", "42", "extra_field", "x");
            var copy = new HashMap<>(input);

            PayloadValidator.validate(input, EXAMPLE);

            assertThat(input).isEqualTo(copy);
        }

        @Test
        @DisplayName("check returns an empty report")
        void checkEmptyReport() {
            var report = PayloadValidator.check(payload("some_param", "a", "another_param", 1), EXAMPLE);
            assertThat(report.hasFaults()).isFalse();
        }
    }

    @Nested
    @DisplayName("mistyped fields")
    class Mistyped {

        @Test
        @DisplayName("non-integer string for integer field is mistyped")
        void stringForInteger() {
            var info = failure(payload("some_param", "test", "another_param", "test"), EXAMPLE);

            assertThat(info.mistypedFields()).containsOnlyKeys("another_param");
            assertThat(info.mistypedFields().get("another_param")).contains("valid integer");
            assertThat(info.missingFields()).isEmpty();
            assertThat(info.unexpectedFields()).isEmpty();
        }

        @Test
        @DisplayName("unparseable upload date names the offending string")
        void badUploadDate() {
            var info = failure(payload("upload_date", "not-a-date", "file_id", "f-1"), UPLOAD);

            assertThat(info.mistypedFields())
                    .containsEntry("upload_date", "Could not convert upload date to datetime: not-a-date");
        }

        @Test
        @DisplayName("null for a non-nullable field is mistyped, not missing")
        void nullForRequired() {
            var info = failure(payload("some_param", null, "another_param", 1), EXAMPLE);

            assertThat(info.missingFields()).isEmpty();
            assertThat(info.mistypedFields()).containsEntry("some_param", "Input should be a valid string");
        }
    }

    @Nested
    @DisplayName("missing fields")
    class Missing {

        @Test
        @DisplayName("absent required fields are listed in declaration order")
        void declarationOrder() {
            var info = failure(payload(), EXAMPLE);

            assertThat(info.missingFields()).containsExactly("some_param", "another_param");
            assertThat(info.mistypedFields()).isEmpty();
        }

        @Test
        @DisplayName("nullable field without default is still required")
        void nullableStillRequired() {
            var schema =
                    SchemaDefinition.builder("s")
                            .field(FieldSpec.of("description", FieldType.string()).asNullable())
                            .build();

            assertThat(failure(payload(), schema).missingFields()).containsExactly("description");
            assertThat(PayloadValidator.validate(payload("description", null), schema).get("description"))
                    .isNull();
        }

        @Test
        @DisplayName("fields with a default are optional and take the default")
        void defaultsApplied() {
            var schema =
                    SchemaDefinition.builder("s")
                            .field(FieldSpec.of("cc", FieldType.listOf(FieldType.email())).withDefault(List.of()))
                            .field(FieldSpec.of("note", FieldType.string()).asNullable().withDefault(null))
                            .build();

            var result = PayloadValidator.validate(payload(), schema);

            assertThat(result.getList("cc", String.class)).isEmpty();
            assertThat(result.has("note")).isTrue();
            assertThat(result.getString("note")).isNull();
        }
    }

    @Nested
    @DisplayName("unexpected fields")
    class Unexpected {

        @Test
        @DisplayName("extra keys are reported when validation fails")
        void reportedOnFailure() {
            var info =
                    failure(
                            payload("some_param", "test", "extra_one", 1, "another_param", "x", "extra_two", 2),
                            EXAMPLE);

            assertThat(info.unexpectedFields()).containsExactly("extra_one", "extra_two");
        }
    }

    @Nested
    @DisplayName("aggregation")
    class Aggregation {

        @Test
        @DisplayName("reports ALL faults in one pass, not just the first one")
        void reportsEverything() {
            var schema =
                    SchemaDefinition.builder("s")
                            .field("a", FieldType.string())
                            .field("b", FieldType.integer())
                            .field("c", FieldType.bool())
                            .field("d", FieldType.string())
                            .build();

            var info = failure(payload("b", "nope", "c", "maybe", "z", 1), schema);

            assertThat(info.missingFields()).containsExactly("a", "d");
            assertThat(info.mistypedFields()).containsOnlyKeys("b", "c");
            assertThat(info.unexpectedFields()).containsExactly("z");
        }

        @Test
        @DisplayName("exception carries the original payload")
        void carriesPayload() {
            var input = payload("some_param", "test", "another_param", "test");
            var error =
                    catchThrowableOfType(
                            () -> PayloadValidator.validate(input, EXAMPLE),
                            EventSchemaValidationException.class);

            assertThat(error.payload()).isEqualTo(input);
            assertThat(error.getMessage()).contains("\"another_param\":\"test\"");
        }

        @Test
        @DisplayName("check returns the same report the exception carries")
        void checkMatchesException() {
            var input = payload("another_param", "x", "extra", true);
            assertThat(PayloadValidator.check(input, EXAMPLE)).isEqualTo(failure(input, EXAMPLE));
        }
    }

    @Nested
    @DisplayName("nested records and lists")
    class NestedValues {

        private final SchemaDefinition file =
                SchemaDefinition.builder("file")
                        .field("accession", FieldType.string())
                        .field("size", FieldType.integer())
                        .build();

        private final SchemaDefinition dataset =
                SchemaDefinition.builder("dataset")
                        .field("title", FieldType.string())
                        .field("files", FieldType.listOf(FieldType.record(file)))
                        .build();

        @Test
        @DisplayName("valid nested records become ValidatedPayloads")
        void validNested() {
            var result =
                    PayloadValidator.validate(
                            payload(
                                    "title", "DS",
                                    "files", List.of(payload("accession", "F1", "size", 3, "ignored", 0))),
                            dataset);

            var files = result.getList("files", ValidatedPayload.class);
            assertThat(files).hasSize(1);
            assertThat(files.get(0).getString("accession")).isEqualTo("F1");
            assertThat(files.get(0).values()).doesNotContainKey("ignored");
        }

        @Test
        @DisplayName("nested faults are reported under the top-level field with their path")
        void nestedFaults() {
            var info =
                    failure(
                            payload(
                                    "title", "DS",
                                    "files", List.of(payload("accession", "F1"), payload("accession", 5, "size", 1))),
                            dataset);

            assertThat(info.missingFields()).isEmpty();
            assertThat(info.mistypedFields()).containsOnlyKeys("files");
            assertThat(info.mistypedFields().get("files"))
                    .isEqualTo("[0].size: Field required; [1].accession: Input should be a valid string");
        }

        @Test
        @DisplayName("non-list value for a list field is mistyped")
        void notAList() {
            var info = failure(payload("title", "DS", "files", "F1"), dataset);
            assertThat(info.mistypedFields()).containsEntry("files", "Input should be a valid list");
        }
    }

    @Nested
    @DisplayName("purity")
    class Purity {

        @Test
        @DisplayName("validating twice yields equal results")
        void idempotent() {
            var input = payload("some_param", "test", "another_param", 1234, "extra_field", "x");
            assertThat(PayloadValidator.validate(input, EXAMPLE))
                    .isEqualTo(PayloadValidator.validate(input, EXAMPLE));

            var bad = payload("another_param", "test", "extra_field", "x");
            assertThat(failure(bad, EXAMPLE)).isEqualTo(failure(bad, EXAMPLE));
        }

        @Test
        @DisplayName("concurrent validations of the same payload agree")
        void concurrent() throws Exception {
            var good = payload("some_param", "test", "another_param", 1234);
            var bad = payload("some_param", 1, "extra", "x");
            var expectedGood = PayloadValidator.validate(good, EXAMPLE);
            var expectedBad = PayloadValidator.check(bad, EXAMPLE);

            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Callable<Boolean>> tasks = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    tasks.add(
                            () ->
                                    PayloadValidator.validate(good, EXAMPLE).equals(expectedGood)
                                            && PayloadValidator.check(bad, EXAMPLE).equals(expectedBad));
                }
                for (Future<Boolean> result : pool.invokeAll(tasks, 30, TimeUnit.SECONDS)) {
                    assertThat(result.get()).isTrue();
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("argument checks")
    class Arguments {

        @Test
        @DisplayName("null payload or schema is a programming error")
        void nullArguments() {
            assertThatThrownBy(() -> PayloadValidator.validate(null, EXAMPLE))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> PayloadValidator.validate(Map.of(), null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
