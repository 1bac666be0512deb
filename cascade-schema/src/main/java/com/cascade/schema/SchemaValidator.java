package com.cascade.schema;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.DiagnosticKind;
import com.cascade.dom.ArrayNode;
import com.cascade.dom.DomNode;
import com.cascade.dom.DomPaths;
import com.cascade.dom.DomTree;
import com.cascade.dom.NodeKind;
import com.cascade.dom.ObjectNode;
import com.cascade.dom.RefNode;
import com.cascade.dom.ValueNode;
import com.cascade.reference.ReferenceResolver;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Checks a DOM tree against a schema and reports every problem as a diagnostic; nothing is thrown for bad data.
 * <p>
 * References are followed: validation runs on a resolved copy of the tree, so a reference is checked as the value
 * it points to. A reference that cannot be resolved is reported as UNRESOLVED_REFERENCE and its value checks are
 * skipped. The input tree is not modified.
 */
public final class SchemaValidator {

    private final ReferenceResolver resolver;

    public SchemaValidator() {
        this(new ReferenceResolver());
    }

    public SchemaValidator(ReferenceResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public ValidationReport validate(DomNode root, SchemaNode schema) {
        return validate(root, schema, ValidationOptions.DEFAULT);
    }

    public ValidationReport validate(DomNode root, SchemaNode schema, ValidationOptions options) {
        return validateAt(root, DomPaths.ROOT, schema, options);
    }

    /**
     * Validates the subtree at {@code path} of {@code root}. References are resolved against the whole tree, and
     * issue paths are absolute in {@code root}. A missing subtree is a single MISSING_REQUIRED_FIELD.
     */
    public ValidationReport validateAt(DomNode root, String path, SchemaNode schema, ValidationOptions options) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(options, "options");
        DomNode resolved = resolver.resolve(root).root();
        List<Diagnostic> issues = new ArrayList<>();
        String normalized = DomPaths.normalize(path);
        DomNode target = DomTree.find(resolved, normalized).orElse(null);
        if (target == null) {
            issues.add(Diagnostic.of(normalized, DiagnosticKind.MISSING_REQUIRED_FIELD,
                    "Required subtree '" + normalized + "' is missing"));
        } else {
            new Run(options, issues).check(target, schema);
        }
        return new ValidationReport(issues);
    }

    private static final class Run {

        private final ValidationOptions options;
        private final List<Diagnostic> issues;

        Run(ValidationOptions options, List<Diagnostic> issues) {
            this.options = options;
            this.issues = issues;
        }

        void check(DomNode node, SchemaNode schema) {
            if (node.getKind() == NodeKind.REF) {
                report(node.getPath(), DiagnosticKind.UNRESOLVED_REFERENCE,
                        "Unresolved reference to '" + ((RefNode) node).getReferencePath() + "'");
                return;
            }
            switch (schema.getKind()) {
                case OBJECT -> checkObject(node, (ObjectSchema) schema);
                case ARRAY -> checkArray(node, (ArraySchema) schema);
                case VALUE -> checkValue(node, (ValueSchema) schema);
            }
        }

        private void checkObject(DomNode node, ObjectSchema schema) {
            if (node.getKind() != NodeKind.OBJECT) {
                structural(node, "object");
                return;
            }
            ObjectNode object = (ObjectNode) node;
            for (SchemaProperty property : schema.getProperties()) {
                DomNode child = object.getChild(property.name());
                if (child != null) {
                    check(child, property.schema());
                } else if (property.required()) {
                    report(DomPaths.child(object.getPath(), property.name()), DiagnosticKind.MISSING_REQUIRED_FIELD,
                            "Missing required field '" + property.name() + "'");
                }
            }
            for (DomNode child : object.children()) {
                if (schema.getProperty(child.getName()) != null) {
                    continue;
                }
                if (schema.getAdditionalProperties() != null) {
                    check(child, schema.getAdditionalProperties());
                } else if (options.strict()) {
                    report(child.getPath(), DiagnosticKind.UNEXPECTED_FIELD,
                            "Unexpected field '" + child.getName() + "'");
                }
            }
        }

        private void checkArray(DomNode node, ArraySchema schema) {
            if (node.getKind() != NodeKind.ARRAY) {
                structural(node, "array");
                return;
            }
            if (schema.getItems() == null) {
                return;
            }
            for (DomNode item : ((ArrayNode) node).items()) {
                check(item, schema.getItems());
            }
        }

        private void checkValue(DomNode node, ValueSchema schema) {
            if (schema.getType() == ValueType.ANY && node.getKind() != NodeKind.VALUE) {
                return;
            }
            if (node.getKind() != NodeKind.VALUE) {
                structural(node, schema.getType().typeName());
                return;
            }
            String path = node.getPath();
            JsonNode value = ((ValueNode) node).getValue();
            if (value.isNull()) {
                if (!schema.isNullable()) {
                    report(path, DiagnosticKind.TYPE_MISMATCH, "Expected " + schema.getType().typeName()
                            + " but found null");
                }
                return;
            }
            if (!schema.getType().accepts(value)) {
                report(path, DiagnosticKind.TYPE_MISMATCH, "Expected " + schema.getType().typeName()
                        + " but found " + describe(value));
                return;
            }
            if (value.isNumber()) {
                BigDecimal number = value.decimalValue();
                if (schema.getMinimum() != null && number.compareTo(schema.getMinimum()) < 0) {
                    report(path, DiagnosticKind.RANGE_VIOLATION, "Value " + value.asText()
                            + " is below minimum " + schema.getMinimum().toPlainString());
                } else if (schema.getMaximum() != null && number.compareTo(schema.getMaximum()) > 0) {
                    report(path, DiagnosticKind.RANGE_VIOLATION, "Value " + value.asText()
                            + " is above maximum " + schema.getMaximum().toPlainString());
                }
            }
            if (schema.getPattern() != null && value.isTextual()
                    && !schema.getPattern().matcher(value.textValue()).find()) {
                report(path, DiagnosticKind.PATTERN_VIOLATION, "Value '" + value.textValue()
                        + "' does not match pattern " + schema.getPattern().pattern());
            }
            if (!schema.getAllowedValues().isEmpty()) {
                String text = value.asText();
                boolean allowed = schema.getAllowedValues().stream().anyMatch(text::equalsIgnoreCase);
                if (!allowed) {
                    report(path, DiagnosticKind.ENUM_VIOLATION, "Value '" + text + "' is not one of "
                            + schema.getAllowedValues());
                }
            }
        }

        private void structural(DomNode node, String expected) {
            report(node.getPath(), DiagnosticKind.STRUCTURAL_MISMATCH, "Expected " + expected + " but found "
                    + node.getKind().name().toLowerCase(Locale.ROOT));
        }

        private void report(String path, DiagnosticKind kind, String message) {
            issues.add(Diagnostic.of(path, kind, message));
        }

        private static String describe(JsonNode value) {
            return value.getNodeType().name().toLowerCase(Locale.ROOT) + " " + value;
        }
    }
}
