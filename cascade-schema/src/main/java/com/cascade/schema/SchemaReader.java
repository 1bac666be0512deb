package com.cascade.schema;

import com.cascade.dom.json.DomJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a compact JSON schema document:
 * <pre>
 * {
 *   "type": "object",
 *   "required": ["port"],
 *   "properties": {
 *     "port": { "type": "integer", "minimum": 1, "maximum": 65535 },
 *     "mode": { "type": "string", "enum": ["fast", "safe"], "default": "safe" }
 *   },
 *   "additionalProperties": { "type": "string" }
 * }
 * </pre>
 * A property may also carry {@code "required": true} itself. {@code "additionalProperties": true} accepts any
 * undeclared key.
 */
public final class SchemaReader {

    private SchemaReader() {
    }

    /**
     * @throws UncheckedIOException on malformed JSON
     * @throws IllegalArgumentException when the document is not a valid schema
     */
    public static SchemaNode read(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return read(DomJson.mapper().readTree(json));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static SchemaNode read(Path file) throws IOException {
        return read(DomJson.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8)));
    }

    public static SchemaNode read(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Schema must be a JSON object");
        }
        String type = text(node, "type");
        if (type == null) {
            type = node.has("properties") ? "object" : node.has("items") ? "array" : "any";
        }
        String description = text(node, "description");
        JsonNode defaultValue = node.get("default");
        return switch (type) {
            case "object" -> readObject(node, description, defaultValue);
            case "array" -> new ArraySchema(node.has("items") ? read(node.get("items")) : null,
                    description, defaultValue);
            default -> readValue(node, ValueType.fromName(type), description, defaultValue);
        };
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static ObjectSchema readObject(JsonNode node, String description, JsonNode defaultValue) {
        ObjectSchema.Builder builder = ObjectSchema.builder().description(description).defaultValue(defaultValue);
        Set<String> required = new HashSet<>();
        for (JsonNode name : node.path("required")) {
            required.add(name.asText());
        }
        Iterator<Map.Entry<String, JsonNode>> properties = node.path("properties").fields();
        while (properties.hasNext()) {
            Map.Entry<String, JsonNode> entry = properties.next();
            boolean isRequired = required.contains(entry.getKey())
                    || entry.getValue().path("required").asBoolean(false);
            builder.property(new SchemaProperty(entry.getKey(), read(entry.getValue()), isRequired));
        }
        JsonNode additional = node.get("additionalProperties");
        if (additional != null) {
            if (additional.isObject()) {
                builder.additionalProperties(read(additional));
            } else if (additional.asBoolean(false)) {
                builder.additionalProperties(Schemas.any().build());
            }
        }
        return builder.build();
    }

    private static ValueSchema readValue(JsonNode node, ValueType type, String description, JsonNode defaultValue) {
        ValueSchema.Builder builder = ValueSchema.builder(type)
                .description(description)
                .defaultValue(defaultValue)
                .nullable(node.path("nullable").asBoolean(false));
        if (node.hasNonNull("minimum")) {
            builder.min(node.get("minimum").decimalValue());
        }
        if (node.hasNonNull("maximum")) {
            builder.max(node.get("maximum").decimalValue());
        }
        if (node.hasNonNull("pattern")) {
            builder.pattern(node.get("pattern").asText());
        }
        for (JsonNode allowed : node.path("enum")) {
            builder.allowed(allowed.asText());
        }
        return builder.build();
    }
}
