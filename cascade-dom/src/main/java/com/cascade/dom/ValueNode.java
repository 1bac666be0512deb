package com.cascade.dom;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * Leaf holding an immutable scalar: a Jackson text, number, boolean or null node.
 * Updates replace the payload wholesale via {@link #setValue(JsonNode)}.
 */
public final class ValueNode extends DomNode {

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private JsonNode value;

    public ValueNode(String name, JsonNode value) {
        super(name);
        this.value = requireScalar(value);
    }

    public ValueNode(String name, String value) {
        this(name, value != null ? FACTORY.textNode(value) : FACTORY.nullNode());
    }

    public ValueNode(String name, long value) {
        this(name, FACTORY.numberNode(value));
    }

    public ValueNode(String name, double value) {
        this(name, FACTORY.numberNode(value));
    }

    public ValueNode(String name, boolean value) {
        this(name, FACTORY.booleanNode(value));
    }

    public static ValueNode ofNull(String name) {
        return new ValueNode(name, FACTORY.nullNode());
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VALUE;
    }

    public JsonNode getValue() {
        return value;
    }

    public void setValue(JsonNode value) {
        this.value = requireScalar(value);
    }

    public boolean isNull() {
        return value.isNull();
    }

    private static JsonNode requireScalar(JsonNode value) {
        Objects.requireNonNull(value, "value");
        if (!(value.isTextual() || value.isNumber() || value.isBoolean() || value.isNull())) {
            throw new IllegalArgumentException("ValueNode payload must be a string, number, boolean or null; got "
                    + value.getNodeType());
        }
        return value;
    }
}
