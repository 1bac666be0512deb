package com.cascade.schema;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.dom.DomNode;
import com.cascade.dom.DomPaths;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Schemas registered by mount path, used to validate a whole master tree in one call.
 */
public final class SchemaCatalog {

    private final Map<String, SchemaNode> schemasByMount = new ConcurrentSkipListMap<>();
    private final SchemaValidator validator;

    public SchemaCatalog() {
        this(new SchemaValidator());
    }

    public SchemaCatalog(SchemaValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /** Registers (or replaces) the schema for a mount path. */
    public SchemaCatalog register(String mountPath, SchemaNode schema) {
        Objects.requireNonNull(schema, "schema");
        schemasByMount.put(DomPaths.normalize(mountPath), schema);
        return this;
    }

    public Optional<SchemaNode> schemaFor(String mountPath) {
        return Optional.ofNullable(schemasByMount.get(DomPaths.normalize(mountPath)));
    }

    public Map<String, SchemaNode> schemas() {
        return Collections.unmodifiableMap(schemasByMount);
    }

    public boolean isEmpty() {
        return schemasByMount.isEmpty();
    }

    /** Validates each registered mount of {@code master}; a missing mounted subtree is MISSING_REQUIRED_FIELD. */
    public ValidationReport validate(DomNode master, ValidationOptions options) {
        Objects.requireNonNull(master, "master");
        List<Diagnostic> issues = new ArrayList<>();
        schemasByMount.forEach((mountPath, schema) ->
                issues.addAll(validator.validateAt(master, mountPath, schema, options).issues()));
        return new ValidationReport(issues);
    }
}
