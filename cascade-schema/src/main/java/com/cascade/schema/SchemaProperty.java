package com.cascade.schema;

import java.util.Objects;

/** A named member of an {@link ObjectSchema}. */
public record SchemaProperty(String name, SchemaNode schema, boolean required) {

    public SchemaProperty {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(schema, "schema");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Property name must not be empty");
        }
    }
}
