package org.kappapathways.hypergraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Derived incoming/outgoing view of a hyperedge list.
 * The owner calls {@link #invalidate()} after every structural edit; the next read rebuilds.
 */
final class AdjacencyIndex {
    private final Supplier<List<HyperEdge>> hyperEdges;
    private final Map<Node, List<HyperEdge>> incoming = new HashMap<>();
    private final Map<Node, List<HyperEdge>> outgoing = new HashMap<>();
    private boolean dirty = true;

    AdjacencyIndex(Supplier<List<HyperEdge>> hyperEdges) {
        this.hyperEdges = hyperEdges;
    }

    void invalidate() {
        dirty = true;
    }

    List<HyperEdge> incoming(Node node) {
        rebuildIfDirty();
        return incoming.getOrDefault(node, List.of());
    }

    List<HyperEdge> outgoing(Node node) {
        rebuildIfDirty();
        return outgoing.getOrDefault(node, List.of());
    }

    /** Distinct targets of the non-conflict hyperedges leaving {@code node}. */
    List<Node> successors(Node node) {
        Set<Node> result = new LinkedHashSet<>();
        for (HyperEdge h : outgoing(node)) {
            if (h.relationType() != RelationType.CONFLICT) result.add(h.target());
        }
        return List.copyOf(result);
    }

    /** Distinct sources of the non-conflict hyperedges entering {@code node}. */
    List<Node> predecessors(Node node) {
        Set<Node> result = new LinkedHashSet<>();
        for (HyperEdge h : incoming(node)) {
            if (h.relationType() != RelationType.CONFLICT) result.addAll(h.sources());
        }
        return List.copyOf(result);
    }

    private void rebuildIfDirty() {
        if (!dirty) return;
        incoming.clear();
        outgoing.clear();
        for (HyperEdge h : hyperEdges.get()) {
            incoming.computeIfAbsent(h.target(), k -> new ArrayList<>()).add(h);
            for (Node source : h.sources()) outgoing.computeIfAbsent(source, k -> new ArrayList<>()).add(h);
        }
        dirty = false;
    }
}
