package com.cascade.reference;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.Diagnostics;
import com.cascade.dom.DomNode;

import java.util.List;
import java.util.Objects;

/**
 * Resolved copy of a tree plus one diagnostic per reference that could not be resolved.
 * References that failed keep their marker in {@link #root()}.
 */
public record ResolutionResult(DomNode root, List<Diagnostic> diagnostics) {

    public ResolutionResult {
        Objects.requireNonNull(root, "root");
        diagnostics = Diagnostics.sorted(diagnostics);
    }

    public boolean isFullyResolved() {
        return diagnostics.isEmpty();
    }
}
