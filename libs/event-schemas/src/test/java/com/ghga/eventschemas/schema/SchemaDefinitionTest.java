package com.ghga.eventschemas.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SchemaDefinitionTest {

    private static final SchemaDefinition BASE =
            SchemaDefinition.builder("UserID").field("user_id", FieldType.string()).build();

    @Test
    @DisplayName("include flattens base fields ahead of the schema's own fields")
    void includeFlattens() {
        var derived =
                SchemaDefinition.builder("User")
                        .include(BASE)
                        .field("name", FieldType.string())
                        .field(FieldSpec.of("title", FieldType.enumOf("Dr.", "Prof.")).asNullable().withDefault(null))
                        .build();

        assertThat(derived.fieldNames()).containsExactly("user_id", "name", "title");
        assertThat(derived.field("user_id")).contains(BASE.field("user_id").orElseThrow());
        assertThat(derived.declares("title")).isTrue();
        assertThat(derived.declares("email")).isFalse();
        assertThat(derived.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("redeclaring a base field is rejected")
    void duplicateField() {
        var builder = SchemaDefinition.builder("Broken").include(BASE).field("user_id", FieldType.integer());

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'user_id'");
    }

    @Test
    @DisplayName("blank title is rejected")
    void blankTitle() {
        assertThatThrownBy(() -> SchemaDefinition.builder(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fieldListIsImmutable() {
        List<FieldSpec> fields = BASE.fields();
        assertThatThrownBy(() -> fields.add(FieldSpec.of("x", FieldType.string())))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("schemas with the same title and fields are equal")
    void equality() {
        var copy = SchemaDefinition.builder("UserID").field("user_id", FieldType.string()).build();
        assertThat(copy).isEqualTo(BASE).hasSameHashCodeAs(BASE);
        assertThat(copy.toString()).contains("UserID", "user_id");
    }

    @Test
    @DisplayName("fields without a default are required, nullable or not")
    void requiredness() {
        var plain = FieldSpec.of("a", FieldType.string());
        var nullable = plain.asNullable();
        var defaulted = nullable.withDefault(null);

        assertThat(plain.required()).isTrue();
        assertThat(nullable.required()).isTrue();
        assertThat(defaulted.required()).isFalse();
        assertThat(defaulted.defaultValue()).isNull();
    }
}
