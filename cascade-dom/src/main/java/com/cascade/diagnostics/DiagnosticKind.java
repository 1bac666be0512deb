package com.cascade.diagnostics;

/**
 * What went wrong. Each kind carries the severity used when the reporter does not choose one explicitly.
 */
public enum DiagnosticKind {
    /** Malformed raw input for one source unit, or an unreadable layer. */
    LOAD_ERROR(Severity.ERROR),
    /** Same path defined by two source units of one layer. */
    OVERLAP(Severity.ERROR),
    UNRESOLVED_REFERENCE(Severity.ERROR),
    REFERENCE_CYCLE(Severity.ERROR),
    MISSING_REQUIRED_FIELD(Severity.ERROR),
    /** Property not declared by the schema; only reported in strict mode, where it is an error. */
    UNEXPECTED_FIELD(Severity.ERROR),
    TYPE_MISMATCH(Severity.ERROR),
    RANGE_VIOLATION(Severity.ERROR),
    PATTERN_VIOLATION(Severity.ERROR),
    ENUM_VIOLATION(Severity.ERROR),
    /** Schema kind and node kind are fundamentally incompatible (e.g. array schema on an object). */
    STRUCTURAL_MISMATCH(Severity.ERROR),
    /** A mount provider failed to load; its mount path is left empty. */
    MOUNT_FAILURE(Severity.ERROR),
    CASING_MISMATCH(Severity.WARNING),
    PATH_INCONSISTENCY(Severity.WARNING);

    private final Severity defaultSeverity;

    DiagnosticKind(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }
}
