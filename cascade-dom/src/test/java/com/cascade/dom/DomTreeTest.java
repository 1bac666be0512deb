package com.cascade.dom;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DomTreeTest {

    private static ObjectNode sampleTree() {
        ObjectNode root = ObjectNode.root();
        ObjectNode server = root.addChild(new ObjectNode("server"));
        server.addChild(new ValueNode("host", "a.example.com"));
        server.addChild(new ValueNode("port", 8080));
        ArrayNode tags = server.addChild(new ArrayNode("tags"));
        tags.addItem(new ValueNode("0", "blue"));
        tags.addItem(new ValueNode("x", "green"));
        root.addChild(new RefNode("alias", "/server/host"));
        return root;
    }

    @Test
    void getPath_joinsNamesFromRoot() {
        ObjectNode root = sampleTree();

        assertEquals("/", root.getPath());
        assertEquals("/server/port", DomTree.find(root, "/server/port").orElseThrow().getPath());
        assertEquals("/server/tags/1", DomTree.find(root, "/server/tags/1").orElseThrow().getPath());
    }

    @Test
    void getPath_escapesSlashAndTildeInNames() {
        ObjectNode root = ObjectNode.root();
        ValueNode odd = root.addChild(new ValueNode("a/b~c", true));

        assertEquals("/a~1b~0c", odd.getPath());
        assertSame(odd, DomTree.find(root, "/a~1b~0c").orElseThrow());
    }

    @Test
    void addItem_renamesItemToItsIndex() {
        ObjectNode root = sampleTree();
        ArrayNode tags = (ArrayNode) DomTree.find(root, "/server/tags").orElseThrow();

        assertEquals("1", tags.getItem(1).getName());
        assertEquals("green", ((ValueNode) tags.getItem(1)).getValue().textValue());
    }

    @Test
    void removeItemAt_keepsArrayDense() {
        ArrayNode array = new ArrayNode("list");
        array.addItem(new ValueNode("0", 1));
        array.addItem(new ValueNode("1", 2));
        array.addItem(new ValueNode("2", 3));

        DomNode removed = array.removeItemAt(0);

        assertNull(removed.getParent());
        assertEquals(2, array.size());
        assertEquals("0", array.getItem(0).getName());
        assertEquals(2L, ((ValueNode) array.getItem(0)).getValue().longValue());
        assertEquals("/1", array.getItem(1).getPath());
    }

    @Test
    void insertItem_shiftsFollowingItems() {
        ArrayNode array = new ArrayNode("list");
        array.addItem(new ValueNode("0", "a"));
        array.addItem(new ValueNode("1", "c"));

        array.insertItem(1, new ValueNode("tmp", "b"));

        assertEquals(List.of("0", "1", "2"), array.items().stream().map(DomNode::getName).toList());
        assertEquals("c", ((ValueNode) array.getItem(2)).getValue().textValue());
    }

    @Test
    void addChild_rejectsNodeOwnedElsewhere() {
        ObjectNode first = ObjectNode.root();
        ObjectNode second = ObjectNode.root();
        ValueNode value = first.addChild(new ValueNode("v", 1));

        assertThrows(IllegalStateException.class, () -> second.addChild(value));
        assertThrows(IllegalArgumentException.class, () -> first.addChild(new ValueNode("v", 2)));
    }

    @Test
    void removeChild_detachesSubtree() {
        ObjectNode root = sampleTree();
        DomNode server = root.removeChild("server");

        assertNull(server.getParent());
        assertEquals("/", server.getPath());
        assertEquals("/host", ((ObjectNode) server).getChild("host").getPath());
        assertFalse(root.hasChild("server"));
    }

    @Test
    void renameChild_reinsertsCloneUnderNewName() {
        ObjectNode root = sampleTree();
        DomNode original = root.getChild("server");

        DomNode renamed = root.renameChild("server", "backend");

        assertNotSame(original, renamed);
        assertFalse(root.hasChild("server"));
        assertEquals("/backend/host", DomTree.find(root, "/backend/host").orElseThrow().getPath());
    }

    @Test
    void clone_isIndependentAndRebindsParents() {
        ObjectNode root = sampleTree();
        ObjectNode copy = (ObjectNode) DomTree.clone(root);

        assertTrue(DomTree.structurallyEqual(root, copy));
        ValueNode copiedHost = (ValueNode) DomTree.find(copy, "/server/host").orElseThrow();
        assertSame(copy, copiedHost.getRoot());
        copiedHost.setValue(TextNode.valueOf("b.example.com"));

        ValueNode originalHost = (ValueNode) DomTree.find(root, "/server/host").orElseThrow();
        assertEquals("a.example.com", originalHost.getValue().textValue());
        assertFalse(DomTree.structurallyEqual(root, copy));
    }

    @Test
    void clone_copiesReferencePathVerbatim() {
        RefNode ref = new RefNode("alias", "/server/host");
        RefNode copy = (RefNode) DomTree.clone(ref);

        assertNotSame(ref, copy);
        assertEquals("/server/host", copy.getReferencePath());
    }

    @Test
    void find_returnsEmptyForMissingOrLeafTraversal() {
        ObjectNode root = sampleTree();

        assertTrue(DomTree.find(root, "/server/missing").isEmpty());
        assertTrue(DomTree.find(root, "/server/host/deeper").isEmpty());
        assertTrue(DomTree.find(root, "/server/tags/9").isEmpty());
        assertTrue(DomTree.find(root, "/server/tags/first").isEmpty());
        assertSame(root, DomTree.find(root, "/").orElseThrow());
    }

    @Test
    void flatten_listsLeavesInPathOrder() {
        Map<String, DomNode> leaves = DomTree.flatten(sampleTree());

        assertEquals(List.of("/alias", "/server/host", "/server/port", "/server/tags/0", "/server/tags/1"),
                List.copyOf(leaves.keySet()));
    }

    @Test
    void references_findsEveryRefNode() {
        ObjectNode root = sampleTree();

        assertEquals(1, DomTree.references(root).size());
        assertTrue(DomTree.containsReferences(root));
        assertFalse(DomTree.containsReferences(root.getChild("server")));
    }

    @Test
    void structurallyEqual_comparesNumbersByValue() {
        assertTrue(DomTree.structurallyEqual(new ValueNode("a", 1), new ValueNode("b", 1.0)));
        assertFalse(DomTree.structurallyEqual(new ValueNode("a", 1), new ValueNode("a", "1")));
    }

    @Test
    void valueNode_rejectsContainerPayload() {
        assertThrows(IllegalArgumentException.class,
                () -> new ValueNode("v", com.fasterxml.jackson.databind.node.JsonNodeFactory.instance.objectNode()));
    }

    @Test
    void constructor_rejectsEmptyName() {
        assertThrows(IllegalArgumentException.class, () -> new ObjectNode(""));
        assertThrows(IllegalArgumentException.class, () -> new ValueNode("", 1));
    }

    @Test
    void domPaths_normalizesAndSplits() {
        assertEquals("/a/b", DomPaths.normalize("a//b/"));
        assertEquals("/", DomPaths.normalize(""));
        assertEquals(List.of("a/b", "c"), DomPaths.split("/a~1b/c"));
        assertTrue(DomPaths.isSameOrDescendant("/a/b", "/a"));
        assertFalse(DomPaths.isSameOrDescendant("/ab", "/a"));
    }
}
