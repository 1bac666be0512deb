package com.cascade.diagnostics;

/** Advisory severity of a {@link Diagnostic}. Callers decide whether to proceed despite errors. */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
