package com.cascade.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/** Primitive types a {@link ValueSchema} can require. {@link #ANY} accepts any node. */
public enum ValueType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    ANY;

    /** Whether a non-null scalar matches this type. Integers also accept numbers without a fractional part. */
    public boolean accepts(JsonNode value) {
        return switch (this) {
            case STRING -> value.isTextual();
            case INTEGER -> value.isIntegralNumber()
                    || (value.isNumber() && value.decimalValue().stripTrailingZeros().scale() <= 0);
            case NUMBER -> value.isNumber();
            case BOOLEAN -> value.isBoolean();
            case ANY -> true;
        };
    }

    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ValueType fromName(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "string" -> STRING;
            case "integer", "int", "long" -> INTEGER;
            case "number", "double", "decimal" -> NUMBER;
            case "boolean", "bool" -> BOOLEAN;
            case "any" -> ANY;
            default -> throw new IllegalArgumentException("Unknown value type: " + name);
        };
    }
}
