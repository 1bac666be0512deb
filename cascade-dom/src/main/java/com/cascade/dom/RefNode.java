package com.cascade.dom;

import java.util.Objects;

/**
 * Symbolic reference to another location of the same tree, e.g. {@code /shared/defaultHost}.
 * Cloning copies the path verbatim; only the reference resolver turns it into a value.
 */
public final class RefNode extends DomNode {

    private final String referencePath;

    public RefNode(String name, String referencePath) {
        super(name);
        Objects.requireNonNull(referencePath, "referencePath");
        if (referencePath.isBlank()) {
            throw new IllegalArgumentException("Reference path must not be blank");
        }
        this.referencePath = referencePath;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.REF;
    }

    /** Target path exactly as written in the source. */
    public String getReferencePath() {
        return referencePath;
    }
}
