package com.cascade.merge;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.dom.ArrayNode;
import com.cascade.dom.DomNode;
import com.cascade.dom.DomTree;
import com.cascade.dom.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Merges layer trees in ascending precedence: later layers win on conflicts, objects merge recursively, arrays and
 * values are replaced wholesale.
 * <p>
 * Origins are tracked in two passes. Before merging, every node path of every layer tree is recorded as a
 * contribution of that layer. After merging, each path still present in the merged tree is assigned the highest
 * contributing precedence as its winner.
 */
public final class LayerMerger {

    private static final Logger log = LoggerFactory.getLogger(LayerMerger.class);

    /**
     * @throws IllegalArgumentException when two layers share a precedence index
     */
    public MergeResult merge(List<CascadeLayer> layers) {
        Objects.requireNonNull(layers, "layers");
        List<CascadeLayer> ordered = new ArrayList<>(layers);
        ordered.sort(Comparator.comparingInt(CascadeLayer::getPrecedence));
        Set<Integer> precedences = new HashSet<>();
        for (CascadeLayer layer : ordered) {
            if (!precedences.add(layer.getPrecedence())) {
                throw new IllegalArgumentException("Duplicate layer precedence " + layer.getPrecedence()
                        + " (layer " + layer.getName() + ")");
            }
        }

        SortedMap<String, List<Integer>> contributors = new TreeMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        ObjectNode merged = ObjectNode.root();

        for (CascadeLayer layer : ordered) {
            diagnostics.addAll(layer.getDiagnostics());
            if (layer.isFailed()) {
                log.warn("Layer {} failed to load and is excluded from the merge", layer.getName());
                continue;
            }
            recordContributions(layer.getRoot(), layer.getPrecedence(), contributors);
            DomMerger.mergeInto(merged, layer.getRoot(), DomMerger.REPLACE);
        }

        SortedMap<String, Integer> winners = new TreeMap<>();
        contributors.forEach((path, contributing) -> {
            if (DomTree.find(merged, path).isPresent()) {
                winners.put(path, contributing.get(contributing.size() - 1));
            }
        });

        log.debug("Merged {} layer(s) into {} tracked path(s)", ordered.size(), winners.size());
        return new MergeResult(merged, winners, contributors, ordered, diagnostics);
    }

    /**
     * Every node below the layer root, array items included. An array replaced by a higher layer must claim its
     * item paths, otherwise a lower layer's object member with a numeric name would keep them.
     */
    private static void recordContributions(DomNode node, int precedence,
                                            SortedMap<String, List<Integer>> contributors) {
        switch (node.getKind()) {
            case OBJECT -> {
                for (DomNode child : ((ObjectNode) node).children()) {
                    record(child, precedence, contributors);
                }
            }
            case ARRAY -> {
                for (DomNode item : ((ArrayNode) node).items()) {
                    record(item, precedence, contributors);
                }
            }
            case VALUE, REF -> {
            }
        }
    }

    private static void record(DomNode node, int precedence, SortedMap<String, List<Integer>> contributors) {
        contributors.computeIfAbsent(node.getPath(), p -> new ArrayList<>()).add(precedence);
        recordContributions(node, precedence, contributors);
    }
}
