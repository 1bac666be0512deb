package com.cascade.dom;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Container of named children. Names are unique; insertion order is kept for display and export only.
 */
public final class ObjectNode extends DomNode {

    private final Map<String, DomNode> children = new LinkedHashMap<>();

    public ObjectNode(String name) {
        super(name);
    }

    /** New detached root named {@value DomNode#ROOT_NAME}. */
    public static ObjectNode root() {
        return new ObjectNode(ROOT_NAME);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.OBJECT;
    }

    /**
     * Attaches a detached node under its own name.
     *
     * @throws IllegalArgumentException if a child with that name already exists
     * @throws IllegalStateException    if the node is already owned elsewhere
     */
    public <T extends DomNode> T addChild(T child) {
        Objects.requireNonNull(child, "child");
        if (children.containsKey(child.getName())) {
            throw new IllegalArgumentException("Duplicate child '" + child.getName() + "' under " + getPath());
        }
        child.attachTo(this);
        children.put(child.getName(), child);
        return child;
    }

    /**
     * Replaces the child with the same name (or adds it when absent). The previous child is detached and returned.
     */
    public DomNode putChild(DomNode child) {
        Objects.requireNonNull(child, "child");
        DomNode previous = children.get(child.getName());
        if (previous == child) {
            return previous;
        }
        child.attachTo(this);
        if (previous != null) {
            previous.detach();
        }
        children.put(child.getName(), child);
        return previous;
    }

    /** Detaches and returns the named child, or null if absent. */
    public DomNode removeChild(String name) {
        DomNode removed = children.remove(name);
        if (removed != null) {
            removed.detach();
        }
        return removed;
    }

    /**
     * Renames a child by removing it and re-inserting a clone under the new name. Returns the new node.
     *
     * @throws IllegalArgumentException if {@code oldName} is absent or {@code newName} is taken
     */
    public DomNode renameChild(String oldName, String newName) {
        DomNode existing = children.get(oldName);
        if (existing == null) {
            throw new IllegalArgumentException("No child '" + oldName + "' under " + getPath());
        }
        if (!oldName.equals(newName) && children.containsKey(newName)) {
            throw new IllegalArgumentException("Duplicate child '" + newName + "' under " + getPath());
        }
        removeChild(oldName);
        return addChild(DomTree.cloneAs(existing, newName));
    }

    public DomNode getChild(String name) {
        return children.get(name);
    }

    public boolean hasChild(String name) {
        return children.containsKey(name);
    }

    public Set<String> childNames() {
        return Collections.unmodifiableSet(children.keySet());
    }

    public Collection<DomNode> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    /** Snapshot of the children, safe to iterate while the object is being modified. */
    public List<DomNode> childrenSnapshot() {
        return new ArrayList<>(children.values());
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }
}
