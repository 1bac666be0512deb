package com.cascade.schema;

import com.cascade.dom.ArrayNode;
import com.cascade.dom.DomNode;
import com.cascade.dom.DomTree;
import com.cascade.dom.NodeKind;
import com.cascade.dom.ObjectNode;
import com.cascade.dom.json.DomJson;

import java.util.Objects;

/**
 * Fills absent optional properties from their schema defaults. Returns a new tree; the input is not modified.
 * Required properties are never defaulted so that their absence is still reported by validation.
 */
public final class SchemaDefaultInjector {

    private SchemaDefaultInjector() {
    }

    public static DomNode inject(DomNode root, SchemaNode schema) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(schema, "schema");
        DomNode copy = DomTree.clone(root);
        apply(copy, schema);
        return copy;
    }

    private static void apply(DomNode node, SchemaNode schema) {
        switch (schema.getKind()) {
            case OBJECT -> {
                if (node.getKind() != NodeKind.OBJECT) {
                    return;
                }
                ObjectNode object = (ObjectNode) node;
                for (SchemaProperty property : ((ObjectSchema) schema).getProperties()) {
                    DomNode child = object.getChild(property.name());
                    if (child == null && !property.required() && property.schema().hasDefault()) {
                        child = object.addChild(
                                DomJson.fromJsonNode(property.schema().getDefaultValue(), property.name()));
                    }
                    if (child != null) {
                        apply(child, property.schema());
                    }
                }
            }
            case ARRAY -> {
                SchemaNode items = ((ArraySchema) schema).getItems();
                if (node.getKind() == NodeKind.ARRAY && items != null) {
                    for (DomNode item : ((ArrayNode) node).items()) {
                        apply(item, items);
                    }
                }
            }
            case VALUE -> {
            }
        }
    }
}
