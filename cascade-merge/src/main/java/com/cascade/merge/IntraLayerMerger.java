package com.cascade.merge;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.DiagnosticKind;
import com.cascade.dom.DomNode;
import com.cascade.dom.DomTree;
import com.cascade.dom.NodeKind;
import com.cascade.dom.ObjectNode;
import com.cascade.dom.json.DomJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Merges the source units of one layer into a single layer tree.
 * <p>
 * Each unit is parsed and placed under the prefix derived from its id, in sorted id order. Objects from different
 * units merge; any other collision is an overlap. Overlaps are all reported, naming both units, and fail the layer:
 * its tree is returned empty so that nothing ambiguous reaches the inter-layer merge.
 */
public final class IntraLayerMerger {

    private static final Logger log = LoggerFactory.getLogger(IntraLayerMerger.class);

    public CascadeLayer merge(LayerDefinition layer, List<SourceUnit> units) {
        Objects.requireNonNull(layer, "layer");
        Objects.requireNonNull(units, "units");

        List<Diagnostic> diagnostics = new ArrayList<>();
        List<SourceUnit> ordered = new ArrayList<>(units);
        ordered.sort(Comparator.comparing(SourceUnit::id));

        if (hasConflictingIds(layer, ordered, diagnostics)) {
            log.warn("Layer {} has conflicting source unit ids; layer skipped", layer.name());
            return CascadeLayer.failed(layer, diagnostics);
        }

        ObjectNode root = ObjectNode.root();
        Map<String, String> unitOrigins = new TreeMap<>();
        List<String> merged = new ArrayList<>();
        int overlaps = 0;

        for (SourceUnit unit : ordered) {
            String prefix = SourceUnitPaths.prefix(unit.id());
            DomNode parsed;
            try {
                parsed = DomJson.parse(unit.text());
            } catch (UncheckedIOException e) {
                log.warn("Failed to parse {} in layer {}: {}", unit.id(), layer.name(), e.getMessage());
                diagnostics.add(Diagnostic.of(prefix, DiagnosticKind.LOAD_ERROR,
                        "Failed to parse source unit '" + unit.id() + "': " + e.getCause().getMessage(), unit.id()));
                continue;
            }
            if (parsed.getKind() != NodeKind.OBJECT) {
                diagnostics.add(Diagnostic.of(prefix, DiagnosticKind.LOAD_ERROR,
                        "Source unit '" + unit.id() + "' must contain a JSON object, found " + parsed.getKind(),
                        unit.id()));
                continue;
            }

            OverlapRecorder recorder = new OverlapRecorder(layer, unit.id(), unitOrigins, diagnostics);
            ObjectNode target = ensurePrefix(root, SourceUnitPaths.segments(unit.id()), recorder);
            if (target != null) {
                DomMerger.mergeInto(target, (ObjectNode) parsed, recorder);
            }
            overlaps += recorder.overlaps;
            merged.add(unit.id());
        }

        if (overlaps > 0) {
            log.warn("Layer {} has {} overlapping definition(s); layer excluded from merge", layer.name(), overlaps);
            return new CascadeLayer(layer, ObjectNode.root(), Map.of(), merged, diagnostics, true);
        }
        log.debug("Merged {} source unit(s) into layer {}", merged.size(), layer.name());
        return new CascadeLayer(layer, root, unitOrigins, merged, diagnostics, false);
    }

    /** Walks or creates the object chain for a unit prefix; null when an existing non-object blocks it. */
    private static ObjectNode ensurePrefix(ObjectNode root, List<String> segments, OverlapRecorder recorder) {
        ObjectNode current = root;
        for (String segment : segments) {
            DomNode next = current.getChild(segment);
            if (next == null) {
                next = current.addChild(new ObjectNode(segment));
                recorder.onAttached(next);
            } else if (next.getKind() != NodeKind.OBJECT) {
                recorder.onConflict(next, new ObjectNode(segment));
                return null;
            }
            current = (ObjectNode) next;
        }
        return current;
    }

    private static boolean hasConflictingIds(LayerDefinition layer, List<SourceUnit> units,
                                             List<Diagnostic> diagnostics) {
        Map<String, String> seen = new HashMap<>();
        boolean conflict = false;
        for (SourceUnit unit : units) {
            String key = SourceUnitPaths.prefix(unit.id()).toLowerCase(Locale.ROOT);
            String previous = seen.putIfAbsent(key, unit.id());
            if (previous != null) {
                conflict = true;
                diagnostics.add(Diagnostic.of(SourceUnitPaths.prefix(unit.id()), DiagnosticKind.LOAD_ERROR,
                        "Source units '" + previous + "' and '" + unit.id() + "' map to the same location",
                        layer.name()));
            }
        }
        return conflict;
    }

    /** Intra-layer conflict policy: never replace, record the overlap, track unit origins. */
    private static final class OverlapRecorder implements DomMerger.MergeHandler {

        private final LayerDefinition layer;
        private final String unitId;
        private final Map<String, String> unitOrigins;
        private final List<Diagnostic> diagnostics;
        private int overlaps;

        OverlapRecorder(LayerDefinition layer, String unitId, Map<String, String> unitOrigins,
                        List<Diagnostic> diagnostics) {
            this.layer = layer;
            this.unitId = unitId;
            this.unitOrigins = unitOrigins;
            this.diagnostics = diagnostics;
        }

        @Override
        public boolean onConflict(DomNode existing, DomNode incoming) {
            String path = existing.getPath();
            String owner = unitOrigins.getOrDefault(path, "?");
            overlaps++;
            diagnostics.add(Diagnostic.of(path, DiagnosticKind.OVERLAP,
                    "Overlap at '" + path + "' in layer '" + layer.name() + "': defined in both '" + owner
                            + "' and '" + unitId + "'", layer.name()));
            return false;
        }

        @Override
        public void onAttached(DomNode attached) {
            DomTree.walk(attached, n -> unitOrigins.putIfAbsent(n.getPath(), unitId));
        }
    }
}
