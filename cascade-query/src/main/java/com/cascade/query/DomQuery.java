package com.cascade.query;

import com.cascade.dom.DomNode;
import com.cascade.dom.DomPaths;
import com.cascade.dom.DomTree;
import com.cascade.dom.json.DomJson;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed read access to a (normally resolved) tree: {@code get("/network/primary", NetworkConfig.class)}.
 * <p>
 * Decoding goes through Jackson: property names match case-insensitively and unknown properties are ignored.
 * A reference still present in the tree decodes as its {@code {"$ref": ...}} marker.
 */
public final class DomQuery {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final DomNode root;

    public DomQuery(DomNode root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public DomNode getRoot() {
        return root;
    }

    /**
     * @throws PathNotFoundException when nothing exists at {@code path}
     * @throws DecodeMismatchException when the subtree does not fit {@code type}
     */
    public <T> T get(String path, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return decode(path, MAPPER.constructType(type));
    }

    public <T> T get(String path, TypeReference<T> type) {
        Objects.requireNonNull(type, "type");
        return decode(path, MAPPER.constructType(type));
    }

    /** Like {@link #get(String, Class)} but empty when the path is missing. Decode failures still throw. */
    public <T> Optional<T> find(String path, Class<T> type) {
        if (!exists(path)) {
            return Optional.empty();
        }
        return Optional.ofNullable(get(path, type));
    }

    public boolean exists(String path) {
        return DomTree.find(root, DomPaths.normalize(path)).isPresent();
    }

    public DomNode getNode(String path) {
        String normalized = DomPaths.normalize(path);
        return DomTree.find(root, normalized).orElseThrow(() -> new PathNotFoundException(normalized));
    }

    private <T> T decode(String path, JavaType type) {
        DomNode node = getNode(path);
        JsonNode json = DomJson.toJsonNode(node);
        try {
            return MAPPER.convertValue(json, type);
        } catch (IllegalArgumentException e) {
            throw new DecodeMismatchException(node.getPath(), type.toCanonical(), e);
        }
    }
}
