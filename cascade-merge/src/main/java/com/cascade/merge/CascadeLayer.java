package com.cascade.merge;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.Diagnostics;
import com.cascade.dom.DomPaths;
import com.cascade.dom.ObjectNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Result of merging one layer's source units: the layer tree, which unit each path came from, and the
 * diagnostics raised while loading. A failed layer has an empty tree and takes no part in the inter-layer merge.
 */
public final class CascadeLayer {

    private final LayerDefinition definition;
    private final ObjectNode root;
    private final SortedMap<String, String> unitOrigins;
    private final List<String> unitIds;
    private final List<Diagnostic> diagnostics;
    private final boolean failed;

    public CascadeLayer(LayerDefinition definition, ObjectNode root, Map<String, String> unitOrigins,
                        List<String> unitIds, List<Diagnostic> diagnostics, boolean failed) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.root = Objects.requireNonNull(root, "root");
        this.unitOrigins = Collections.unmodifiableSortedMap(new TreeMap<>(unitOrigins));
        this.unitIds = List.copyOf(unitIds);
        this.diagnostics = Diagnostics.sorted(diagnostics);
        this.failed = failed;
    }

    /** A layer that could not be loaded at all. */
    public static CascadeLayer failed(LayerDefinition definition, List<Diagnostic> diagnostics) {
        return new CascadeLayer(definition, ObjectNode.root(), Map.of(), List.of(), diagnostics, true);
    }

    public LayerDefinition getDefinition() {
        return definition;
    }

    public String getName() {
        return definition.name();
    }

    public int getPrecedence() {
        return definition.precedence();
    }

    /** The layer tree. Owned by this layer; clone before handing it to code that mutates. */
    public ObjectNode getRoot() {
        return root;
    }

    /** Path to source unit id, for every node path of the layer tree. */
    public SortedMap<String, String> getUnitOrigins() {
        return unitOrigins;
    }

    public Optional<String> unitOrigin(String path) {
        return Optional.ofNullable(unitOrigins.get(DomPaths.normalize(path)));
    }

    /** Ids of the units that were merged into the tree, sorted. */
    public List<String> getUnitIds() {
        return unitIds;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean isFailed() {
        return failed;
    }

    @Override
    public String toString() {
        return "CascadeLayer{" + definition.name() + ", precedence=" + definition.precedence()
                + (failed ? ", failed" : "") + "}";
    }
}
