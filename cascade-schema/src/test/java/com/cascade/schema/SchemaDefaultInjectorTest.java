package com.cascade.schema;

import com.cascade.dom.DomNode;
import com.cascade.dom.DomTree;
import com.cascade.dom.ValueNode;
import com.cascade.dom.json.DomJson;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaDefaultInjectorTest {

    private static final ObjectSchema SCHEMA = Schemas.object()
            .required("port", Schemas.integer().defaultValue(80).build())
            .optional("mode", Schemas.string().defaultValue("safe").build())
            .optional("pool", Schemas.object()
                    .optional("size", Schemas.integer().defaultValue(4).build())
                    .build())
            .build();

    @Test
    void inject_fillsMissingOptionalPropertiesOnACopy() {
        DomNode tree = DomJson.parse("{\"pool\": {}}");

        DomNode filled = SchemaDefaultInjector.inject(tree, SCHEMA);

        assertEquals("safe", ((ValueNode) DomTree.find(filled, "/mode").orElseThrow()).getValue().textValue());
        assertEquals(4, ((ValueNode) DomTree.find(filled, "/pool/size").orElseThrow()).getValue().intValue());
        assertTrue(DomTree.find(filled, "/port").isEmpty());
        assertTrue(DomTree.find(tree, "/mode").isEmpty());
    }

    @Test
    void inject_keepsExistingValues() {
        DomNode tree = DomJson.parse("{\"mode\": \"fast\"}");

        DomNode filled = SchemaDefaultInjector.inject(tree, SCHEMA);

        assertEquals("fast", ((ValueNode) DomTree.find(filled, "/mode").orElseThrow()).getValue().textValue());
        assertTrue(DomTree.find(filled, "/pool").isEmpty());
    }
}
