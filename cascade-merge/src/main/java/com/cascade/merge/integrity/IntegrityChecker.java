package com.cascade.merge.integrity;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.DiagnosticKind;
import com.cascade.diagnostics.Diagnostics;
import com.cascade.dom.DomNode;
import com.cascade.dom.DomPaths;
import com.cascade.merge.CascadeLayer;
import com.cascade.merge.SourceUnitPaths;
import com.cascade.schema.ObjectSchema;
import com.cascade.schema.SchemaNode;
import com.cascade.schema.SchemaProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Advisory cross-layer checks. Nothing here blocks a merge; every finding is a WARNING.
 * <ul>
 *   <li>{@link DiagnosticKind#CASING_MISMATCH}: the same path spelled with different letter case in two layers
 *   (the merge treats them as different keys, which is rarely intended).</li>
 *   <li>{@link DiagnosticKind#PATH_INCONSISTENCY}: a top-level section kept in differently named source units
 *   in different layers.</li>
 *   <li>{@link DiagnosticKind#CASING_MISMATCH} against a schema: a source unit path segment whose casing differs
 *   from the schema property it maps to, e.g. {@code Database/primary.json} for a {@code database} property.</li>
 * </ul>
 */
public final class IntegrityChecker {

    public List<Diagnostic> check(List<CascadeLayer> layers) {
        return check(layers, null);
    }

    /**
     * @param schema schema of the cascade root, or null to skip the unit path casing check
     */
    public List<Diagnostic> check(List<CascadeLayer> layers, SchemaNode schema) {
        Objects.requireNonNull(layers, "layers");
        List<CascadeLayer> ordered = layers.stream()
                .filter(l -> !l.isFailed())
                .sorted(Comparator.comparingInt(CascadeLayer::getPrecedence))
                .toList();
        List<Diagnostic> diagnostics = new ArrayList<>();
        checkCasing(ordered, diagnostics);
        checkUnitPaths(ordered, diagnostics);
        if (schema != null) {
            checkUnitCasingAgainstSchema(ordered, schema, diagnostics);
        }
        return Diagnostics.sorted(diagnostics);
    }

    private static void checkCasing(List<CascadeLayer> layers, List<Diagnostic> diagnostics) {
        // lower-cased path -> first spelling and its layer
        Map<String, String[]> firstSeen = new HashMap<>();
        for (CascadeLayer layer : layers) {
            for (String path : layer.getUnitOrigins().keySet()) {
                String key = path.toLowerCase(Locale.ROOT);
                String[] first = firstSeen.putIfAbsent(key, new String[]{path, layer.getName()});
                if (first != null && !first[0].equals(path) && !first[1].equals(layer.getName())
                        && isReportedAt(path, first[0])) {
                    diagnostics.add(Diagnostic.of(path, DiagnosticKind.CASING_MISMATCH,
                            "'" + path + "' in layer '" + layer.getName() + "' differs only in case from '"
                                    + first[0] + "' in layer '" + first[1] + "'", layer.getName()));
                }
            }
        }
    }

    /** Report only the outermost differing segment, not every descendant below it. */
    private static boolean isReportedAt(String path, String firstSpelling) {
        int cut = path.lastIndexOf('/');
        return cut <= 0 || path.regionMatches(0, firstSpelling, 0, cut);
    }

    private static void checkUnitPaths(List<CascadeLayer> layers, List<Diagnostic> diagnostics) {
        Map<String, String[]> firstSeen = new HashMap<>();
        for (CascadeLayer layer : layers) {
            for (DomNode section : layer.getRoot().children()) {
                String path = section.getPath();
                String unit = layer.unitOrigin(path).orElse(null);
                if (unit == null) {
                    continue;
                }
                String[] first = firstSeen.putIfAbsent(path, new String[]{unit, layer.getName()});
                if (first != null && !first[0].equals(unit)) {
                    diagnostics.add(Diagnostic.of(path, DiagnosticKind.PATH_INCONSISTENCY,
                            "Section '" + path + "' comes from '" + unit + "' in layer '" + layer.getName()
                                    + "' but from '" + first[0] + "' in layer '" + first[1] + "'",
                            layer.getName()));
                }
            }
        }
    }

    private static void checkUnitCasingAgainstSchema(List<CascadeLayer> layers, SchemaNode schema,
                                                     List<Diagnostic> diagnostics) {
        // units sharing a folder report its segment once per layer
        Set<Diagnostic> found = new LinkedHashSet<>();
        for (CascadeLayer layer : layers) {
            for (String unitId : layer.getUnitIds()) {
                SchemaNode current = schema;
                List<String> walked = new ArrayList<>();
                for (String segment : SourceUnitPaths.segments(unitId)) {
                    SchemaProperty property = current instanceof ObjectSchema object
                            ? propertyIgnoringCase(object, segment) : null;
                    if (property == null) {
                        break;
                    }
                    walked.add(segment);
                    if (!property.name().equals(segment)) {
                        found.add(Diagnostic.of(DomPaths.join(walked), DiagnosticKind.CASING_MISMATCH,
                                "Unit path segment '" + segment + "' in layer '" + layer.getName()
                                        + "' should be cased '" + property.name() + "' to match the schema",
                                layer.getName()));
                    }
                    current = property.schema();
                }
            }
        }
        diagnostics.addAll(found);
    }

    private static SchemaProperty propertyIgnoringCase(ObjectSchema schema, String name) {
        SchemaProperty exact = schema.getProperty(name);
        if (exact != null) {
            return exact;
        }
        for (SchemaProperty property : schema.getProperties()) {
            if (property.name().equalsIgnoreCase(name)) {
                return property;
            }
        }
        return null;
    }
}
