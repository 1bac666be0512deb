package com.cascade.dom;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Node in the configuration DOM. One of four kinds ({@link NodeKind}); the constructor is package-private so
 * {@link ObjectNode}, {@link ArrayNode}, {@link ValueNode} and {@link RefNode} are the only variants.
 * <p>
 * The parent link is a non-owning back-reference: the owning container sets it on attach and clears it on detach.
 * It is only read for path computation. A node is created detached and can be owned by at most one container.
 */
public abstract class DomNode {

    /** Name given to tree roots by the parser and the merge engine. Not part of any path. */
    public static final String ROOT_NAME = "$root";

    private final String name;
    private DomNode parent;

    /**
     * @throws IllegalArgumentException for an empty name, which would share its path with the parent
     */
    DomNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Node name must not be empty");
        }
    }

    public String getName() {
        return name;
    }

    /** Owning container, or null for a root or a detached node. */
    public DomNode getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public abstract NodeKind getKind();

    /**
     * Absolute path from the root, e.g. {@code /server/ports/0}. The root itself is {@code /}.
     * Segments are escaped with {@link DomPaths#escape(String)}.
     */
    public String getPath() {
        if (parent == null) {
            return DomPaths.ROOT;
        }
        Deque<String> segments = new ArrayDeque<>();
        DomNode current = this;
        while (current.parent != null) {
            segments.addFirst(current.name);
            current = current.parent;
        }
        return DomPaths.join(segments);
    }

    /** Topmost ancestor (this node when it has no parent). */
    public DomNode getRoot() {
        DomNode current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    void attachTo(DomNode owner) {
        if (parent != null) {
            throw new IllegalStateException("Node '" + name + "' is already owned by " + parent.getPath());
        }
        parent = owner;
    }

    void detach() {
        parent = null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getPath() + "]";
    }
}
