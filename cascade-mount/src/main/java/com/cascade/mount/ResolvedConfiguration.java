package com.cascade.mount;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.Diagnostics;
import com.cascade.dom.DomNode;
import com.cascade.query.DomQuery;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one refresh: the resolved master tree and every diagnostic from loading, splicing, resolving and
 * validating it, path-sorted. Treat {@link #root()} as read-only; it is shared by every reader of this snapshot.
 */
public record ResolvedConfiguration(long generation, DomNode root, List<Diagnostic> diagnostics) {

    public ResolvedConfiguration {
        Objects.requireNonNull(root, "root");
        diagnostics = Diagnostics.sorted(diagnostics);
    }

    public boolean hasErrors() {
        return Diagnostics.hasErrors(diagnostics);
    }

    public DomQuery query() {
        return new DomQuery(root);
    }
}
