package com.cascade.schema;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.DiagnosticKind;
import com.cascade.diagnostics.Diagnostics;

import java.util.List;

/** Path-sorted validation issues. */
public record ValidationReport(List<Diagnostic> issues) {

    public ValidationReport {
        issues = Diagnostics.sorted(issues);
    }

    /** True when no issue has ERROR severity. */
    public boolean isValid() {
        return !Diagnostics.hasErrors(issues);
    }

    public List<Diagnostic> issuesOfKind(DiagnosticKind kind) {
        return Diagnostics.ofKind(issues, kind);
    }
}
