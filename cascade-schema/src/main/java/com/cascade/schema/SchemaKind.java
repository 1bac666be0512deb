package com.cascade.schema;

/** Node kind a schema node describes. */
public enum SchemaKind {
    OBJECT,
    ARRAY,
    VALUE
}
