package com.cascade.diagnostics;

import java.util.Comparator;
import java.util.Objects;

/**
 * One structured problem report: where, what, human-readable message, severity, and the source that produced it
 * (layer name, source unit id, or mount path; null when not applicable).
 */
public record Diagnostic(
        String path,
        DiagnosticKind kind,
        String message,
        Severity severity,
        String source
) {
    /** Deterministic order: path, then kind, then source, then message. */
    public static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::path)
            .thenComparing(Diagnostic::kind)
            .thenComparing(d -> d.source() != null ? d.source() : "")
            .thenComparing(Diagnostic::message);

    public Diagnostic {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        severity = severity != null ? severity : kind.getDefaultSeverity();
    }

    /** Diagnostic with the kind's default severity and no source. */
    public static Diagnostic of(String path, DiagnosticKind kind, String message) {
        return new Diagnostic(path, kind, message, null, null);
    }

    /** Diagnostic with the kind's default severity. */
    public static Diagnostic of(String path, DiagnosticKind kind, String message, String source) {
        return new Diagnostic(path, kind, message, null, source);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + kind + " at " + path + ": " + message + (source != null ? " [" + source + "]" : "");
    }
}
