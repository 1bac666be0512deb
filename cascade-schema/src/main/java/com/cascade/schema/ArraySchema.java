package com.cascade.schema;

import com.fasterxml.jackson.databind.JsonNode;

/** Schema for an array node; every item is validated against {@link #getItems()} when one is set. */
public final class ArraySchema extends SchemaNode {

    private final SchemaNode items;

    public ArraySchema(SchemaNode items) {
        this(items, null, null);
    }

    public ArraySchema(SchemaNode items, String description, JsonNode defaultValue) {
        super(description, defaultValue);
        this.items = items;
    }

    @Override
    public SchemaKind getKind() {
        return SchemaKind.ARRAY;
    }

    /** Item schema, or null to accept any items. */
    public SchemaNode getItems() {
        return items;
    }
}
