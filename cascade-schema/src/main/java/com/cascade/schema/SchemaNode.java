package com.cascade.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Declarative description of the expected shape of a DOM subtree. The hierarchy is closed: object, array and
 * value schemas, dispatched by {@link #getKind()}.
 */
public abstract class SchemaNode {

    private final String description;
    private final JsonNode defaultValue;

    SchemaNode(String description, JsonNode defaultValue) {
        this.description = description;
        this.defaultValue = defaultValue;
    }

    public abstract SchemaKind getKind();

    /** Human-readable description, or null. */
    public String getDescription() {
        return description;
    }

    /** Default used by {@link SchemaDefaultInjector} when the property is absent, or null. */
    public JsonNode getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
