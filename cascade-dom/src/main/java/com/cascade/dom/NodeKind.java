package com.cascade.dom;

/**
 * The closed set of DOM node kinds. Merge, resolution, validation and export all switch over this enum,
 * so adding a constant here is a breaking change for every algorithm in the project.
 *
 * @see DomNode#getKind()
 */
public enum NodeKind {
    /** Named children, keyed by name. */
    OBJECT,
    /** Dense, ordered items named by index. */
    ARRAY,
    /** Immutable scalar payload (string, number, boolean, null). */
    VALUE,
    /** Symbolic pointer to another path in the same tree; not a value until resolved. */
    REF
}
