package org.kappapathways.hypergraph;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class HyperEdgeBuilder {
    private static final Logger log = LoggerFactory.getLogger(HyperEdgeBuilder.class);

    private HyperEdgeBuilder() {}

    /**
     * One hyperedge per distinct target (by identity), members in input order.
     * Every edge ends up in exactly one hyperedge.
     */
    public static List<HyperEdge> group(List<CausalEdge> edges) {
        Map<Node, List<CausalEdge>> byTarget = new LinkedHashMap<>();
        for (CausalEdge e : edges) byTarget.computeIfAbsent(e.target(), k -> new ArrayList<>()).add(e);
        List<HyperEdge> result = new ArrayList<>(byTarget.size());
        for (List<CausalEdge> members : byTarget.values()) result.add(new HyperEdge(members));
        return result;
    }

    /**
     * Assembles a graph from parsed nodes and a flat edge list.
     * <p>
     * Without {@code hypergraph} the edges are grouped by target. With it, grouping is already encoded:
     * the edges entering a {@link MidNode} form the hyperedge of that midnode's single successor, and any
     * other edge is a hyperedge on its own. Midnodes are dropped from the result.
     */
    public static CausalGraph buildGraph(String id, @Nullable String eoi, List<Node> nodes, List<CausalEdge> edges,
                                         boolean hypergraph) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
        CausalGraph graph = new CausalGraph(id, eoi);
        graph.setHypergraph(hypergraph);
        for (Node n : nodes) if (n.kind() != NodeKind.MID) graph.addNode(n);
        List<HyperEdge> hyperEdges = hypergraph ? groupThroughMidNodes(id, edges) : group(edges);
        for (HyperEdge h : hyperEdges) graph.addHyperEdge(h);
        log.debug("Built {} with {} nodes and {} hyperedges from {} edges (hypergraph={})",
                id, graph.nodes().size(), hyperEdges.size(), edges.size(), hypergraph);
        return graph;
    }

    private static List<HyperEdge> groupThroughMidNodes(String id, List<CausalEdge> edges) {
        Map<Node, Node> midTarget = new IdentityHashMap<>();
        for (CausalEdge e : edges) {
            if (e.source().kind() != NodeKind.MID) continue;
            Node previous = midTarget.put(e.source(), e.target());
            if (previous != null && previous != e.target()) {
                throw new StructuralViolationException("In " + id + " midnode " + e.source().id()
                        + " leads to both " + previous + " and " + e.target());
            }
        }
        // keyed by midnode, or by the edge itself for direct edges
        Map<Object, List<CausalEdge>> groups = new LinkedHashMap<>();
        for (CausalEdge e : edges) {
            if (e.source().kind() == NodeKind.MID) continue;
            if (e.target().kind() == NodeKind.MID) {
                Node target = midTarget.get(e.target());
                if (target == null) {
                    throw new StructuralViolationException("In " + id + " midnode " + e.target().id() + " has no outgoing edge");
                }
                groups.computeIfAbsent(e.target(), k -> new ArrayList<>()).add(e.copyWith(e.source(), target));
            } else {
                groups.put(e, List.of(e));
            }
        }
        List<HyperEdge> result = new ArrayList<>(groups.size());
        for (List<CausalEdge> members : groups.values()) result.add(new HyperEdge(members));
        return result;
    }

    /**
     * Flags as {@code first} every non-intro node whose non-conflict causes are all introductions,
     * including nodes with no cause at all.
     *
     * @return the number of first nodes
     */
    public static int markFirstNodes(CausalGraph graph) {
        int count = 0;
        for (Node n : graph.nodes()) {
            boolean first = !n.isIntro();
            if (first) {
                for (HyperEdge h : graph.incoming(n)) {
                    if (h.relationType() == RelationType.CONFLICT) continue;
                    if (!h.sources().stream().allMatch(Node::isIntro)) {
                        first = false;
                        break;
                    }
                }
            }
            n.setFirst(first);
            if (first) count++;
        }
        return count;
    }
}
