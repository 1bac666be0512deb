package com.cascade.merge;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.DiagnosticKind;
import com.cascade.dom.DomTree;
import com.cascade.dom.ValueNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntraLayerMergerTest {

    private static final LayerDefinition BASE = new LayerDefinition("Base", 0, "base");

    private final IntraLayerMerger merger = new IntraLayerMerger();

    @Test
    void merge_placesUnitsUnderTheirIdPrefix() {
        CascadeLayer layer = merger.merge(BASE, List.of(
                new SourceUnit("database/primary.json", "{\"host\": \"db1\", \"port\": 5432}"),
                new SourceUnit("app.json", "{\"name\": \"shop\"}")));

        assertFalse(layer.isFailed());
        assertEquals("db1", value(layer, "/database/primary/host"));
        assertEquals("shop", value(layer, "/app/name"));
        assertEquals(List.of("app.json", "database/primary.json"), layer.getUnitIds());
        assertEquals("database/primary.json", layer.unitOrigin("/database/primary/port").orElseThrow());
        assertEquals("database/primary.json", layer.unitOrigin("/database").orElseThrow());
    }

    @Test
    void merge_combinesObjectsFromDifferentUnits() {
        CascadeLayer layer = merger.merge(BASE, List.of(
                new SourceUnit("database.json", "{\"timeout\": 30}"),
                new SourceUnit("database/primary.json", "{\"host\": \"db1\"}")));

        assertFalse(layer.isFailed());
        assertEquals(30L, ((ValueNode) DomTree.find(layer.getRoot(), "/database/timeout").orElseThrow())
                .getValue().longValue());
        assertEquals("db1", value(layer, "/database/primary/host"));
        assertTrue(layer.getDiagnostics().isEmpty());
    }

    @Test
    void merge_reportsEveryOverlapAndFailsLayer() {
        CascadeLayer layer = merger.merge(BASE, List.of(
                new SourceUnit("a.json", "{\"shared\": {\"x\": 1, \"y\": 2}}"),
                new SourceUnit("a/shared.json", "{\"x\": 3, \"y\": [4]}")));

        assertTrue(layer.isFailed());
        assertTrue(layer.getRoot().isEmpty());
        List<Diagnostic> overlaps = layer.getDiagnostics();
        assertEquals(2, overlaps.size());
        assertEquals("/a/shared/x", overlaps.get(0).path());
        assertEquals(DiagnosticKind.OVERLAP, overlaps.get(0).kind());
        assertTrue(overlaps.get(0).message().contains("a.json"));
        assertTrue(overlaps.get(0).message().contains("a/shared.json"));
        assertEquals("/a/shared/y", overlaps.get(1).path());
    }

    @Test
    void merge_skipsUnparsableUnitButKeepsTheRest() {
        CascadeLayer layer = merger.merge(BASE, List.of(
                new SourceUnit("broken.json", "{\"a\": "),
                new SourceUnit("list.json", "[1, 2]"),
                new SourceUnit("good.json", "{\"a\": 1}")));

        assertFalse(layer.isFailed());
        assertEquals(List.of("good.json"), layer.getUnitIds());
        assertEquals(2, layer.getDiagnostics().size());
        assertTrue(layer.getDiagnostics().stream().allMatch(d -> d.kind() == DiagnosticKind.LOAD_ERROR));
        assertEquals("/broken", layer.getDiagnostics().get(0).path());
    }

    @Test
    void merge_reportsUnitWithEmptyPropertyNameAsLoadError() {
        CascadeLayer layer = merger.merge(BASE, List.of(
                new SourceUnit("app.json", "{\"\": {\"x\": 1}, \"x\": 2}"),
                new SourceUnit("db.json", "{\"x\": 3}")));

        assertFalse(layer.isFailed());
        assertEquals(List.of("db.json"), layer.getUnitIds());
        Diagnostic diagnostic = layer.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.LOAD_ERROR, diagnostic.kind());
        assertEquals("/app", diagnostic.path());
        assertTrue(DomTree.find(layer.getRoot(), "/app").isEmpty());
    }

    @Test
    void merge_failsLayerOnIdsDifferingOnlyByCase() {
        CascadeLayer layer = merger.merge(BASE, List.of(
                new SourceUnit("Server.json", "{\"a\": 1}"),
                new SourceUnit("server.json", "{\"b\": 2}")));

        assertTrue(layer.isFailed());
        assertEquals(DiagnosticKind.LOAD_ERROR, layer.getDiagnostics().get(0).kind());
    }

    private static String value(CascadeLayer layer, String path) {
        return ((ValueNode) DomTree.find(layer.getRoot(), path).orElseThrow()).getValue().textValue();
    }
}
