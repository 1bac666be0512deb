package com.cascade.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, dense sequence of items. Item {@code i} is always named {@code "i"}. Nodes handed to
 * {@link #addItem}/{@link #insertItem} under a different name, and items shifted by an insert or remove,
 * are re-inserted as clones named after their new index; callers must use the returned node.
 */
public final class ArrayNode extends DomNode {

    private final List<DomNode> items = new ArrayList<>();

    public ArrayNode(String name) {
        super(name);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARRAY;
    }

    /** Appends an item; returns the attached node (a renamed clone when the name did not match the index). */
    public DomNode addItem(DomNode item) {
        Objects.requireNonNull(item, "item");
        DomNode attached = named(item, items.size());
        attached.attachTo(this);
        items.add(attached);
        return attached;
    }

    /**
     * Inserts at {@code index} (0..size) and re-names the shifted tail.
     *
     * @throws IndexOutOfBoundsException if index is outside 0..size
     */
    public DomNode insertItem(int index, DomNode item) {
        Objects.requireNonNull(item, "item");
        if (index < 0 || index > items.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " outside 0.." + items.size() + " at " + getPath());
        }
        DomNode attached = named(item, index);
        attached.attachTo(this);
        items.add(index, attached);
        reindexFrom(index + 1);
        return attached;
    }

    /** Removes the item at {@code index}; returns the detached item or null when the index is invalid. */
    public DomNode removeItemAt(int index) {
        if (index < 0 || index >= items.size()) {
            return null;
        }
        DomNode removed = items.remove(index);
        removed.detach();
        reindexFrom(index);
        return removed;
    }

    /** Replaces the item at {@code index}; returns the detached previous item. */
    public DomNode replaceItem(int index, DomNode item) {
        Objects.requireNonNull(item, "item");
        if (index < 0 || index >= items.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " outside 0.." + (items.size() - 1) + " at " + getPath());
        }
        DomNode attached = named(item, index);
        attached.attachTo(this);
        DomNode previous = items.set(index, attached);
        previous.detach();
        return previous;
    }

    /** Item at {@code index}, or null when out of range. */
    public DomNode getItem(int index) {
        if (index < 0 || index >= items.size()) {
            return null;
        }
        return items.get(index);
    }

    public List<DomNode> items() {
        return Collections.unmodifiableList(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    private static DomNode named(DomNode item, int index) {
        String expected = Integer.toString(index);
        return expected.equals(item.getName()) ? item : DomTree.cloneAs(item, expected);
    }

    private void reindexFrom(int from) {
        for (int i = from; i < items.size(); i++) {
            DomNode current = items.get(i);
            String expected = Integer.toString(i);
            if (!expected.equals(current.getName())) {
                current.detach();
                DomNode renamed = DomTree.cloneAs(current, expected);
                renamed.attachTo(this);
                items.set(i, renamed);
            }
        }
    }
}
