package com.cascade.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Helpers for diagnostic lists handed to collaborators.
 */
public final class Diagnostics {

    private Diagnostics() {
    }

    /** Immutable copy sorted by {@link Diagnostic#ORDER}. */
    public static List<Diagnostic> sorted(Collection<Diagnostic> diagnostics) {
        List<Diagnostic> copy = new ArrayList<>(diagnostics);
        copy.sort(Diagnostic.ORDER);
        return List.copyOf(copy);
    }

    public static boolean hasErrors(Collection<Diagnostic> diagnostics) {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public static List<Diagnostic> ofKind(Collection<Diagnostic> diagnostics, DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}
