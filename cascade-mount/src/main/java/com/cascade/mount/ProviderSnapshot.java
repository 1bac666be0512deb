package com.cascade.mount;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.dom.DomNode;

import java.util.List;
import java.util.Objects;

/** Tree loaded by a {@link DomProvider} plus any non-fatal diagnostics raised while loading it. */
public record ProviderSnapshot(DomNode root, List<Diagnostic> diagnostics) {

    public ProviderSnapshot {
        Objects.requireNonNull(root, "root");
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public static ProviderSnapshot of(DomNode root) {
        return new ProviderSnapshot(root, List.of());
    }
}
