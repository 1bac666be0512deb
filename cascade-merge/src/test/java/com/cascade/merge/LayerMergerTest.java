package com.cascade.merge;

import com.cascade.dom.ArrayNode;
import com.cascade.dom.DomTree;
import com.cascade.dom.ObjectNode;
import com.cascade.dom.ValueNode;
import com.cascade.dom.json.DomJson;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LayerMergerTest {

    private final IntraLayerMerger intra = new IntraLayerMerger();
    private final LayerMerger merger = new LayerMerger();

    private CascadeLayer layer(String name, int precedence, String json) {
        return intra.merge(new LayerDefinition(name, precedence, name), List.of(new SourceUnit("net.json", json)));
    }

    @Test
    void merge_higherPrecedenceWinsAndOriginsAreTracked() {
        CascadeLayer base = layer("Base", 0, "{\"ip\": \"10.0.0.1\", \"host\": \"a\"}");
        CascadeLayer site = layer("Site", 1, "{\"ip\": \"10.0.0.2\"}");

        MergeResult result = merger.merge(List.of(site, base));

        assertEquals("10.0.0.2", text(result.getRoot(), "/net/ip"));
        assertEquals("a", text(result.getRoot(), "/net/host"));
        Origin ip = result.origin("/net/ip").orElseThrow();
        assertEquals("Site", ip.winnerName());
        assertEquals(List.of(0, 1), ip.contributors());
        assertTrue(ip.isOverridden());
        assertEquals("Base", result.origin("/net/host").orElseThrow().winnerName());
        assertEquals("net.json", result.unitOrigin("/net/host").orElseThrow());
    }

    @Test
    void merge_replacesArraysWholesale() {
        CascadeLayer base = layer("Base", 0, "{\"ports\": [80, 443, 8080]}");
        CascadeLayer site = layer("Site", 1, "{\"ports\": [9090]}");

        MergeResult result = merger.merge(List.of(base, site));

        ArrayNode ports = (ArrayNode) DomTree.find(result.getRoot(), "/net/ports").orElseThrow();
        assertEquals(1, ports.size());
        assertEquals(1, result.winningLayer("/net/ports").orElseThrow());
        assertEquals(1, result.winningLayer("/net/ports/0").orElseThrow());
        assertTrue(result.winningLayer("/net/ports/2").isEmpty());
        assertEquals(List.of(0), result.contributingLayers("/net/ports/2"));
    }

    @Test
    void merge_creditsArrayItemsToLayerThatReplacedNumericKeyedObject() {
        CascadeLayer base = layer("Base", 0, "{\"a\": {\"0\": \"old\"}}");
        CascadeLayer site = layer("Site", 1, "{\"a\": [\"new\"]}");

        MergeResult result = merger.merge(List.of(base, site));

        assertEquals("new", text(result.getRoot(), "/net/a/0"));
        assertEquals(1, result.winningLayer("/net/a/0").orElseThrow());
        assertEquals(List.of(0, 1), result.contributingLayers("/net/a/0"));
        assertEquals("Site", result.origin("/net/a/0").orElseThrow().winnerName());
    }

    @Test
    void merge_dropsWinnerForPathsReplacedByScalar() {
        CascadeLayer base = layer("Base", 0, "{\"tls\": {\"enabled\": true}}");
        CascadeLayer site = layer("Site", 1, "{\"tls\": false}");

        MergeResult result = merger.merge(List.of(base, site));

        assertTrue(result.origin("/net/tls/enabled").isEmpty());
        assertEquals(List.of(0), result.contributingLayers("/net/tls/enabled"));
        assertEquals(1, result.winningLayer("/net/tls").orElseThrow());
    }

    @Test
    void merge_isDeterministicAndLeavesLayersUntouched() {
        CascadeLayer base = layer("Base", 0, "{\"a\": {\"x\": 1}, \"b\": 2}");
        CascadeLayer site = layer("Site", 1, "{\"a\": {\"y\": 3}}");
        ObjectNode baseBefore = (ObjectNode) DomTree.clone(base.getRoot());

        MergeResult first = merger.merge(List.of(base, site));
        MergeResult second = merger.merge(List.of(site, base));

        assertEquals(DomJson.toJson(first.getRoot()), DomJson.toJson(second.getRoot()));
        assertEquals(first.getWinners(), second.getWinners());
        assertTrue(DomTree.structurallyEqual(baseBefore, base.getRoot()));
    }

    @Test
    void merge_excludesFailedLayerButKeepsItsDiagnostics() {
        CascadeLayer base = layer("Base", 0, "{\"a\": 1}");
        CascadeLayer broken = intra.merge(new LayerDefinition("Site", 1, "site"), List.of(
                new SourceUnit("net.json", "{\"a\": 2}"),
                new SourceUnit("net/a.json", "{}")));

        MergeResult result = merger.merge(List.of(base, broken));

        assertEquals(1L, ((ValueNode) DomTree.find(result.getRoot(), "/net/a").orElseThrow()).getValue().longValue());
        assertTrue(result.hasErrors());
        assertEquals("Site", result.getDiagnostics().get(0).source());
    }

    @Test
    void merge_rejectsDuplicatePrecedence() {
        CascadeLayer one = layer("One", 0, "{}");
        CascadeLayer two = layer("Two", 0, "{}");

        assertThrows(IllegalArgumentException.class, () -> merger.merge(List.of(one, two)));
    }

    private static String text(ObjectNode root, String path) {
        return ((ValueNode) DomTree.find(root, path).orElseThrow()).getValue().textValue();
    }
}
