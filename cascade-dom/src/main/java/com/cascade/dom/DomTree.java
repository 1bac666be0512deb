package com.cascade.dom;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Tree operations over {@link DomNode}: cloning, path lookup, traversal and structural comparison.
 */
public final class DomTree {

    private DomTree() {
    }

    /**
     * Deep clone with the same name. The clone is detached; every descendant is re-bound to its cloned parent,
     * so nothing mutable is shared with the original.
     */
    public static DomNode clone(DomNode node) {
        Objects.requireNonNull(node, "node");
        return cloneAs(node, node.getName());
    }

    /** Deep clone under a new name (used for re-inserting under another key or index). */
    public static DomNode cloneAs(DomNode node, String name) {
        Objects.requireNonNull(node, "node");
        return switch (node.getKind()) {
            case VALUE -> new ValueNode(name, ((ValueNode) node).getValue());
            case REF -> new RefNode(name, ((RefNode) node).getReferencePath());
            case ARRAY -> {
                ArrayNode copy = new ArrayNode(name);
                for (DomNode item : ((ArrayNode) node).items()) {
                    copy.addItem(clone(item));
                }
                yield copy;
            }
            case OBJECT -> {
                ObjectNode copy = new ObjectNode(name);
                for (DomNode child : ((ObjectNode) node).children()) {
                    copy.addChild(clone(child));
                }
                yield copy;
            }
        };
    }

    /**
     * Finds the node at {@code path} below {@code root}. Object segments match child names, array segments
     * must be decimal indices. Traversal stops at value and reference nodes.
     */
    public static Optional<DomNode> find(DomNode root, String path) {
        Objects.requireNonNull(root, "root");
        DomNode current = root;
        for (String segment : DomPaths.split(path)) {
            current = child(current, segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /** Single navigation step; null when the segment does not exist or {@code node} is a leaf. */
    public static DomNode child(DomNode node, String segment) {
        return switch (node.getKind()) {
            case OBJECT -> ((ObjectNode) node).getChild(segment);
            case ARRAY -> {
                int index = parseIndex(segment);
                yield index >= 0 ? ((ArrayNode) node).getItem(index) : null;
            }
            case VALUE, REF -> null;
        };
    }

    /** Depth-first pre-order walk in child order. */
    public static void walk(DomNode node, Consumer<DomNode> visitor) {
        visitor.accept(node);
        switch (node.getKind()) {
            case OBJECT -> {
                for (DomNode child : ((ObjectNode) node).children()) {
                    walk(child, visitor);
                }
            }
            case ARRAY -> {
                for (DomNode item : ((ArrayNode) node).items()) {
                    walk(item, visitor);
                }
            }
            case VALUE, REF -> {
            }
        }
    }

    /** All reference nodes below (and including) {@code node}, in walk order. */
    public static List<RefNode> references(DomNode node) {
        List<RefNode> refs = new ArrayList<>();
        walk(node, n -> {
            if (n.getKind() == NodeKind.REF) {
                refs.add((RefNode) n);
            }
        });
        return refs;
    }

    public static boolean containsReferences(DomNode node) {
        return switch (node.getKind()) {
            case REF -> true;
            case VALUE -> false;
            case OBJECT -> ((ObjectNode) node).children().stream().anyMatch(DomTree::containsReferences);
            case ARRAY -> ((ArrayNode) node).items().stream().anyMatch(DomTree::containsReferences);
        };
    }

    /**
     * Leaves keyed by path, sorted. Values, references, and empty containers count as leaves.
     */
    public static SortedMap<String, DomNode> flatten(DomNode root) {
        SortedMap<String, DomNode> leaves = new TreeMap<>();
        walk(root, n -> {
            boolean leaf = switch (n.getKind()) {
                case VALUE, REF -> true;
                case OBJECT -> ((ObjectNode) n).isEmpty();
                case ARRAY -> ((ArrayNode) n).isEmpty();
            };
            if (leaf) {
                leaves.put(n.getPath(), n);
            }
        });
        return Collections.unmodifiableSortedMap(leaves);
    }

    /**
     * Structural equality ignoring the names of {@code a} and {@code b} themselves and object key order.
     * Numbers compare by numeric value, so {@code 1} equals {@code 1.0}.
     */
    public static boolean structurallyEqual(DomNode a, DomNode b) {
        if (a == b) return true;
        if (a == null || b == null || a.getKind() != b.getKind()) return false;
        return switch (a.getKind()) {
            case VALUE -> valuesEqual((ValueNode) a, (ValueNode) b);
            case REF -> ((RefNode) a).getReferencePath().equals(((RefNode) b).getReferencePath());
            case ARRAY -> {
                List<DomNode> left = ((ArrayNode) a).items();
                List<DomNode> right = ((ArrayNode) b).items();
                if (left.size() != right.size()) yield false;
                for (int i = 0; i < left.size(); i++) {
                    if (!structurallyEqual(left.get(i), right.get(i))) yield false;
                }
                yield true;
            }
            case OBJECT -> {
                ObjectNode left = (ObjectNode) a;
                ObjectNode right = (ObjectNode) b;
                if (!left.childNames().equals(right.childNames())) yield false;
                for (String key : left.childNames()) {
                    if (!structurallyEqual(left.getChild(key), right.getChild(key))) yield false;
                }
                yield true;
            }
        };
    }

    private static boolean valuesEqual(ValueNode a, ValueNode b) {
        if (a.getValue().isNumber() && b.getValue().isNumber()) {
            BigDecimal left = a.getValue().decimalValue();
            BigDecimal right = b.getValue().decimalValue();
            return left.compareTo(right) == 0;
        }
        return a.getValue().equals(b.getValue());
    }

    private static int parseIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(segment);
    }
}
