package org.kappapathways.hypergraph;

import java.util.List;

/**
 * Correspondence between two equivalent graphs: hyperedge {@code i} of the first matches hyperedge
 * {@code hyperEdges.get(i)} of the second, and member {@code k} of that hyperedge matches member
 * {@code subEdges.get(i).get(k)}.
 */
public record GraphMatch(List<Integer> hyperEdges, List<List<Integer>> subEdges) {
    public GraphMatch {
        hyperEdges = List.copyOf(hyperEdges);
        subEdges = List.copyOf(subEdges);
    }
}
