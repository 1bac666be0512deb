package com.cascade.merge;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.Diagnostics;
import com.cascade.dom.DomPaths;
import com.cascade.dom.ObjectNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Merged tree of a cascade with its origin maps and all diagnostics raised while loading and merging it.
 */
public final class MergeResult {

    private final ObjectNode root;
    private final SortedMap<String, Integer> winners;
    private final SortedMap<String, List<Integer>> contributors;
    private final List<CascadeLayer> layers;
    private final List<Diagnostic> diagnostics;

    MergeResult(ObjectNode root, SortedMap<String, Integer> winners, SortedMap<String, List<Integer>> contributors,
                List<CascadeLayer> layers, List<Diagnostic> diagnostics) {
        this.root = root;
        this.winners = Collections.unmodifiableSortedMap(new TreeMap<>(winners));
        TreeMap<String, List<Integer>> copy = new TreeMap<>();
        contributors.forEach((path, list) -> copy.put(path, List.copyOf(list)));
        this.contributors = Collections.unmodifiableSortedMap(copy);
        this.layers = List.copyOf(layers);
        this.diagnostics = Diagnostics.sorted(diagnostics);
    }

    public ObjectNode getRoot() {
        return root;
    }

    /** Path to winning layer precedence, for every path present in the merged tree (array items included). */
    public SortedMap<String, Integer> getWinners() {
        return winners;
    }

    /** Path to the precedences of every layer that defined it, ascending. Includes overridden paths. */
    public SortedMap<String, List<Integer>> getContributors() {
        return contributors;
    }

    /** Layers in precedence order, failed ones included. */
    public List<CascadeLayer> getLayers() {
        return layers;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** Same tree and origins with {@code additional} diagnostics merged into the sorted list. */
    public MergeResult withDiagnostics(Collection<Diagnostic> additional) {
        List<Diagnostic> combined = new ArrayList<>(diagnostics);
        combined.addAll(additional);
        return new MergeResult(root, winners, contributors, layers, combined);
    }

    public boolean hasErrors() {
        return Diagnostics.hasErrors(diagnostics);
    }

    public Optional<Integer> winningLayer(String path) {
        return Optional.ofNullable(winners.get(DomPaths.normalize(path)));
    }

    public List<Integer> contributingLayers(String path) {
        return contributors.getOrDefault(DomPaths.normalize(path), List.of());
    }

    /** Origin of a path present in the merged tree; empty for missing or overridden-away paths. */
    public Optional<Origin> origin(String path) {
        String normalized = DomPaths.normalize(path);
        Integer winner = winners.get(normalized);
        if (winner == null) {
            return Optional.empty();
        }
        return Optional.of(new Origin(normalized, winner, layer(winner).map(CascadeLayer::getName).orElse(null),
                contributors.getOrDefault(normalized, List.of())));
    }

    /** Source unit of the winning layer that defined {@code path}. */
    public Optional<String> unitOrigin(String path) {
        return winningLayer(path).flatMap(this::layer).flatMap(layer -> layer.unitOrigin(path));
    }

    public Optional<CascadeLayer> layer(int precedence) {
        return layers.stream().filter(l -> l.getPrecedence() == precedence).findFirst();
    }

    /** Precedence to layer name. */
    public Map<Integer, String> layerNames() {
        Map<Integer, String> names = new TreeMap<>();
        layers.forEach(l -> names.put(l.getPrecedence(), l.getName()));
        return Collections.unmodifiableMap(names);
    }
}
