package com.cascade.schema;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.DiagnosticKind;
import com.cascade.diagnostics.Severity;
import com.cascade.dom.DomNode;
import com.cascade.dom.json.DomJson;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaValidatorTest {

    private static final ObjectSchema SERVER = Schemas.object()
            .required("host", Schemas.string().pattern("^[a-z0-9.-]+$").build())
            .required("port", Schemas.integer().range(1, 65535).build())
            .optional("mode", Schemas.string().allowed("fast", "safe").build())
            .optional("timeout", Schemas.number().nullable().build())
            .optional("tags", Schemas.arrayOf(Schemas.string().build()))
            .build();

    private static final ObjectSchema ROOT = Schemas.object()
            .required("server", SERVER)
            .build();

    private final SchemaValidator validator = new SchemaValidator();

    @Test
    void validate_acceptsConformingTree() {
        DomNode tree = DomJson.parse("""
                { "server": { "host": "a.example.com", "port": 8080, "mode": "FAST", "timeout": null,
                              "tags": ["x"] } }
                """);

        ValidationReport report = validator.validate(tree, ROOT);

        assertTrue(report.isValid());
        assertTrue(report.issues().isEmpty());
    }

    @Test
    void validate_reportsExactlyOneRangeViolationForPortOutOfRange() {
        DomNode tree = DomJson.parse("{\"server\": {\"host\": \"a\", \"port\": 100000}}");

        ValidationReport report = validator.validate(tree, ROOT);

        assertEquals(1, report.issues().size());
        Diagnostic issue = report.issues().get(0);
        assertEquals(DiagnosticKind.RANGE_VIOLATION, issue.kind());
        assertEquals("/server/port", issue.path());
        assertFalse(report.isValid());
    }

    @Test
    void validate_reportsEachKindOfProblemAtItsPath() {
        DomNode tree = DomJson.parse("""
                { "server": { "host": "Bad Host!", "port": "80", "mode": "slow", "tags": "x", "timeout": "1" } }
                """);

        List<Diagnostic> issues = validator.validate(tree, ROOT).issues();

        assertEquals(5, issues.size());
        assertEquals(DiagnosticKind.PATTERN_VIOLATION, issues.get(0).kind());
        assertEquals("/server/host", issues.get(0).path());
        assertEquals(DiagnosticKind.ENUM_VIOLATION, issues.get(1).kind());
        assertEquals(DiagnosticKind.TYPE_MISMATCH, issues.get(2).kind());
        assertEquals("/server/port", issues.get(2).path());
        assertEquals(DiagnosticKind.STRUCTURAL_MISMATCH, issues.get(3).kind());
        assertEquals("/server/tags", issues.get(3).path());
        assertEquals(DiagnosticKind.TYPE_MISMATCH, issues.get(4).kind());
        assertEquals("/server/timeout", issues.get(4).path());
    }

    @Test
    void validate_reportsMissingRequiredField() {
        DomNode tree = DomJson.parse("{\"server\": {\"host\": \"a\"}}");

        List<Diagnostic> issues = validator.validate(tree, ROOT).issues();

        assertEquals(1, issues.size());
        assertEquals(DiagnosticKind.MISSING_REQUIRED_FIELD, issues.get(0).kind());
        assertEquals("/server/port", issues.get(0).path());
    }

    @Test
    void validate_reportsUnexpectedFieldOnlyWhenStrict() {
        DomNode tree = DomJson.parse("{\"server\": {\"host\": \"a\", \"port\": 1, \"extra\": true}}");

        assertTrue(validator.validate(tree, ROOT).issues().isEmpty());
        List<Diagnostic> strict = validator.validate(tree, ROOT, ValidationOptions.STRICT).issues();
        assertEquals(1, strict.size());
        assertEquals(DiagnosticKind.UNEXPECTED_FIELD, strict.get(0).kind());
        assertEquals("/server/extra", strict.get(0).path());
        assertEquals(Severity.ERROR, strict.get(0).severity());
        assertEquals(DiagnosticKind.UNEXPECTED_FIELD.getDefaultSeverity(), strict.get(0).severity());
    }

    @Test
    void validate_checksUndeclaredKeysAgainstAdditionalProperties() {
        ObjectSchema limits = Schemas.object()
                .additionalProperties(Schemas.integer().min(0).build())
                .build();
        DomNode tree = DomJson.parse("{\"cpu\": 2, \"memory\": -1}");

        List<Diagnostic> issues = validator.validate(tree, limits, ValidationOptions.STRICT).issues();

        assertEquals(1, issues.size());
        assertEquals("/memory", issues.get(0).path());
        assertEquals(DiagnosticKind.RANGE_VIOLATION, issues.get(0).kind());
    }

    @Test
    void validate_followsReferencesAndReportsUnresolvedOnes() {
        DomNode tree = DomJson.parse("""
                {
                  "server": { "host": { "$ref": "/shared/host" }, "port": { "$ref": "/shared/port" } },
                  "shared": { "host": "a.example.com" }
                }
                """);

        List<Diagnostic> issues = validator.validate(tree, ROOT).issues();

        assertEquals(1, issues.size());
        assertEquals(DiagnosticKind.UNRESOLVED_REFERENCE, issues.get(0).kind());
        assertEquals("/server/port", issues.get(0).path());
    }

    @Test
    void validate_acceptsIntegralDecimalsAsIntegers() {
        DomNode tree = DomJson.parse("{\"server\": {\"host\": \"a\", \"port\": 80.0}}");

        assertTrue(validator.validate(tree, ROOT).isValid());
    }

    @Test
    void validate_rejectsNullArguments() {
        assertThrows(NullPointerException.class, () -> validator.validate(null, ROOT));
        assertThrows(NullPointerException.class, () -> validator.validate(DomJson.parse("{}"), null));
    }
}
