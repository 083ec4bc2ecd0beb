package org.kappapathways.hypergraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/** Removes nodes, together with every member edge and cover that touches them. */
public final class GraphPruner {
    private static final Logger log = LoggerFactory.getLogger(GraphPruner.class);

    private GraphPruner() {}

    /**
     * Drops the nodes matching {@code doomed}, their member edges and their covers. Hyperedges left
     * without members go too, and so do introductions that no longer feed anything.
     *
     * @return the number of nodes removed
     */
    public static int removeNodes(CausalGraph graph, Predicate<Node> doomed) {
        Set<Node> gone = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Node n : graph.nodes()) if (doomed.test(n)) gone.add(n);
        if (gone.isEmpty()) return 0;
        for (HyperEdge h : List.copyOf(graph.hyperEdges())) {
            if (gone.contains(h.target())) graph.removeHyperEdge(h);
            else graph.retainSubEdges(h, e -> !gone.contains(e.source()));
        }
        for (HyperEdge c : List.copyOf(graph.coverEdges())) {
            if (gone.contains(c.target())) graph.removeCoverEdgesIf(x -> x == c);
            else graph.retainSubEdges(c, e -> !gone.contains(e.source()));
        }
        for (Node n : gone) graph.removeNode(n);
        int removed = gone.size();
        for (Node n : List.copyOf(graph.nodes())) {
            if (n.isIntro() && graph.outgoing(n).isEmpty()) {
                graph.removeNode(n);
                removed++;
            }
        }
        return removed;
    }

    /**
     * Drops every introduction. Ranks are kept as they are: introductions sit below rank 1, so the
     * remaining nodes already start at 1. First flags are recomputed.
     */
    public static int removeIntroNodes(CausalGraph graph) {
        int removed = removeNodes(graph, Node::isIntro);
        int first = HyperEdgeBuilder.markFirstNodes(graph);
        graph.updateRankBounds();
        log.debug("Removed {} intro nodes from {}, {} first nodes remain", removed, graph.id(), first);
        return removed;
    }

    /** Drops every node whose label contains one of the {@code ignoreList} strings. */
    public static int removeIgnored(CausalGraph graph, List<String> ignoreList) {
        if (ignoreList.isEmpty()) return 0;
        int removed = removeNodes(graph, n -> ignoreList.stream().anyMatch(s -> n.label().contains(s)));
        if (removed > 0) log.debug("Removed {} ignored nodes from {}", removed, graph.id());
        return removed;
    }
}
