package com.cascade.schema;

/**
 * Entry points for building schemas in code:
 * <pre>
 * ObjectSchema server = Schemas.object()
 *         .required("host", Schemas.string().build())
 *         .required("port", Schemas.integer().range(1, 65535).build())
 *         .build();
 * </pre>
 */
public final class Schemas {

    private Schemas() {
    }

    public static ObjectSchema.Builder object() {
        return ObjectSchema.builder();
    }

    public static ArraySchema arrayOf(SchemaNode items) {
        return new ArraySchema(items);
    }

    public static ValueSchema.Builder string() {
        return ValueSchema.builder(ValueType.STRING);
    }

    public static ValueSchema.Builder integer() {
        return ValueSchema.builder(ValueType.INTEGER);
    }

    public static ValueSchema.Builder number() {
        return ValueSchema.builder(ValueType.NUMBER);
    }

    public static ValueSchema.Builder bool() {
        return ValueSchema.builder(ValueType.BOOLEAN);
    }

    public static ValueSchema.Builder any() {
        return ValueSchema.builder(ValueType.ANY);
    }
}
