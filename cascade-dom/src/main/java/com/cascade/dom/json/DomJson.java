package com.cascade.dom.json;

import com.cascade.dom.ArrayNode;
import com.cascade.dom.DomNode;
import com.cascade.dom.ObjectNode;
import com.cascade.dom.RefNode;
import com.cascade.dom.ValueNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Parser/serializer boundary between raw JSON (Jackson {@link JsonNode}) and the DOM.
 * <p>
 * An object whose only property is {@value #REF_KEY} with a non-empty string value is parsed as a {@link RefNode};
 * an object with any other key next to {@value #REF_KEY} stays a plain object. References export back to the same
 * single-key marker. Numeric formatting is not guaranteed to round-trip byte for byte.
 * <p>
 * Empty property names are rejected as malformed input: a node named {@code ""} would not have a path of its own.
 */
public final class DomJson {

    /** Reserved key marking a reference object. */
    public static final String REF_KEY = "$ref";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final ObjectMapper PRETTY = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private DomJson() {
    }

    /** Shared mapper configured for the DOM boundary. Do not reconfigure. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parses JSON text into a detached tree whose root is named {@value DomNode#ROOT_NAME}.
     *
     * @throws UncheckedIOException on malformed input
     */
    public static DomNode parse(String json) {
        Objects.requireNonNull(json, "json");
        if (json.isBlank()) {
            throw new UncheckedIOException(new IOException("JSON text is empty"));
        }
        try {
            return fromJsonNode(MAPPER.readTree(json), DomNode.ROOT_NAME);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Converts raw hierarchical data (maps, lists, scalars) into a tree via Jackson. */
    public static DomNode fromValue(Object raw) {
        return fromJsonNode(MAPPER.valueToTree(raw), DomNode.ROOT_NAME);
    }

    /**
     * Converts an already-parsed Jackson tree into a detached DOM node with the given name.
     *
     * @throws UncheckedIOException when an object has an empty property name
     */
    public static DomNode fromJsonNode(JsonNode json, String name) {
        Objects.requireNonNull(name, "name");
        if (json == null || json.isMissingNode()) {
            return ValueNode.ofNull(name);
        }
        if (json.isObject()) {
            if (isReference(json)) {
                return new RefNode(name, json.get(REF_KEY).textValue());
            }
            ObjectNode object = new ObjectNode(name);
            Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().isEmpty()) {
                    throw new UncheckedIOException(new IOException(
                            "Empty property name in object '" + name + "' is not supported"));
                }
                object.addChild(fromJsonNode(field.getValue(), field.getKey()));
            }
            return object;
        }
        if (json.isArray()) {
            ArrayNode array = new ArrayNode(name);
            for (int i = 0; i < json.size(); i++) {
                array.addItem(fromJsonNode(json.get(i), Integer.toString(i)));
            }
            return array;
        }
        if (json.isBinary() || json.isPojo()) {
            return new ValueNode(name, FACTORY.textNode(json.asText()));
        }
        return new ValueNode(name, json);
    }

    /** Strict single-key detection of a reference marker. */
    public static boolean isReference(JsonNode json) {
        if (json == null || !json.isObject() || json.size() != 1) {
            return false;
        }
        JsonNode ref = json.get(REF_KEY);
        return ref != null && ref.isTextual() && !ref.textValue().isBlank();
    }

    /** Exports a subtree to raw JSON. References export as {@code {"$ref": "<path>"}}, never as their target. */
    public static JsonNode toJsonNode(DomNode node) {
        Objects.requireNonNull(node, "node");
        return switch (node.getKind()) {
            case VALUE -> ((ValueNode) node).getValue();
            case REF -> {
                com.fasterxml.jackson.databind.node.ObjectNode marker = FACTORY.objectNode();
                marker.put(REF_KEY, ((RefNode) node).getReferencePath());
                yield marker;
            }
            case ARRAY -> {
                com.fasterxml.jackson.databind.node.ArrayNode array = FACTORY.arrayNode();
                for (DomNode item : ((ArrayNode) node).items()) {
                    array.add(toJsonNode(item));
                }
                yield array;
            }
            case OBJECT -> {
                com.fasterxml.jackson.databind.node.ObjectNode object = FACTORY.objectNode();
                for (DomNode child : ((ObjectNode) node).children()) {
                    object.set(child.getName(), toJsonNode(child));
                }
                yield object;
            }
        };
    }

    /**
     * Serializes a subtree to compact JSON.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(DomNode node) {
        try {
            return MAPPER.writeValueAsString(toJsonNode(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Serializes a subtree to indented JSON. */
    public static String toJsonPretty(DomNode node) {
        try {
            return PRETTY.writeValueAsString(toJsonNode(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
