package com.ghga.eventschemas.jsonschema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ghga.eventschemas.EventSerializer;
import com.ghga.eventschemas.schema.FieldKind;
import com.ghga.eventschemas.schema.FieldSpec;
import com.ghga.eventschemas.schema.FieldType;
import com.ghga.eventschemas.schema.SchemaDefinition;

/**
 * Renders a {@link SchemaDefinition} as a JSON-Schema document.
 *
 * <p>Used to publish the catalog to producers that do not link this library. Custom field
 * constraints (such as the upload-date rule) have no JSON-Schema equivalent and are only
 * enforced by {@link com.ghga.eventschemas.validation.PayloadValidator}.
 */
public final class JsonSchemaGenerator {

    public static final String DIALECT = "https://json-schema.org/draft/2020-12/schema";

    private static final ObjectMapper MAPPER = EventSerializer.objectMapper();

    private JsonSchemaGenerator() {
        // utility class
    }

    /** Generates the top-level schema document, including the {@code $schema} dialect. */
    public static ObjectNode generate(SchemaDefinition schema) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("$schema", DIALECT);
        root.setAll(objectSchema(schema));
        return root;
    }

    /** Pretty-printed JSON of {@link #generate(SchemaDefinition)}. */
    public static String toJsonString(SchemaDefinition schema) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(generate(schema));
        } catch (JsonProcessingException e) {
            throw new EventSerializer.EventSerializationException(
                    "Failed to render JSON schema for " + schema.title(), e);
        }
    }

    private static ObjectNode objectSchema(SchemaDefinition schema) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("title", schema.title());
        if (schema.description() != null) {
            node.put("description", schema.description());
        }
        node.put("type", "object");
        ObjectNode properties = node.putObject("properties");
        ArrayNode required = MAPPER.createArrayNode();
        for (FieldSpec field : schema.fields()) {
            properties.set(field.name(), fieldSchema(field));
            if (field.required()) {
                required.add(field.name());
            }
        }
        if (!required.isEmpty()) {
            node.set("required", required);
        }
        return node;
    }

    private static ObjectNode fieldSchema(FieldSpec field) {
        ObjectNode node = typeSchema(field.type());
        if (field.nullable()) {
            String type = node.path("type").asText();
            ArrayNode types = MAPPER.createArrayNode().add(type).add("null");
            node.set("type", types);
            if (node.has("enum")) {
                ((ArrayNode) node.get("enum")).addNull();
            }
        }
        if (field.description() != null) {
            node.put("description", field.description());
        }
        if (field.hasDefault()) {
            node.set("default", MAPPER.valueToTree(field.defaultValue()));
        }
        return node;
    }

    private static ObjectNode typeSchema(FieldType type) {
        if (type.kind() == FieldKind.RECORD) {
            return objectSchema(type.recordSchema());
        }
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type.kind().jsonType());
        switch (type.kind()) {
            case DATETIME -> node.put("format", "date-time");
            case EMAIL -> node.put("format", "email");
            case ENUM -> {
                ArrayNode values = node.putArray("enum");
                type.allowedValues().forEach(values::add);
            }
            case LIST -> node.set("items", typeSchema(type.elementType()));
            default -> {
                // no keywords beyond "type"
            }
        }
        return node;
    }
}
