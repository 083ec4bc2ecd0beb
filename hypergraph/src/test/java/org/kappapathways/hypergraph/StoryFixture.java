package org.kappapathways.hypergraph;

import java.util.ArrayList;
import java.util.List;

import static java.util.Arrays.asList;

/**
 * Reusable builders for story graphs.
 * Graphs are assembled through {@link HyperEdgeBuilder}, so one hyperedge per target unless a test adds
 * hyperedges by hand.
 */
public final class StoryFixture {
    private StoryFixture() {}

    // ---------- nodes ----------

    public static EventNode event(String id, String label) {
        return new EventNode(id, label);
    }

    public static EventNode event(String id, String label, double rank) {
        EventNode n = new EventNode(id, label);
        n.setRank(rank);
        return n;
    }

    public static EventNode firstEvent(String id, String label) {
        EventNode n = new EventNode(id, label);
        n.setFirst(true);
        return n;
    }

    public static EventNode intro(String id, String label) {
        return EventNode.intro(id, label);
    }

    public static StateNode state(String id, String label) {
        return new StateNode(id, label);
    }

    // ---------- edges ----------

    public static CausalEdge edge(Node source, Node target) {
        return new CausalEdge(source, target);
    }

    public static CausalEdge edge(Node source, Node target, int weight, int number) {
        return new CausalEdge(source, target, weight, number);
    }

    public static List<Node> nodes(Node... nodes) {
        return new ArrayList<>(asList(nodes));
    }

    public static List<CausalEdge> edges(CausalEdge... edges) {
        return new ArrayList<>(asList(edges));
    }

    // ---------- graphs ----------

    public static CausalGraph story(String id, List<Node> nodes, List<CausalEdge> edges) {
        return HyperEdgeBuilder.buildGraph(id, null, nodes, edges, false);
    }

    /** A ("bind", rank 1, first) -> B ("phos", rank 2), weight 3 number 2. */
    public static CausalGraph bindPhos(String id) {
        EventNode a = event("a", "bind", 1);
        a.setFirst(true);
        EventNode b = event("b", "phos", 2);
        return story(id, nodes(a, b), edges(edge(a, b, 3, 2)));
    }

    /** A -> B, A -> C, B -> D, C -> D with A first. */
    public static CausalGraph diamond(String id) {
        EventNode a = firstEvent("a", "A");
        EventNode b = event("b", "B");
        EventNode c = event("c", "C");
        EventNode d = event("d", "D");
        return story(id, nodes(a, b, c, d), edges(edge(a, b), edge(a, c), edge(b, d), edge(c, d)));
    }

    /** A -> B, B -> C, A -> C with A first. */
    public static CausalGraph triangle(String id) {
        EventNode a = firstEvent("a", "A");
        EventNode b = event("b", "B");
        EventNode c = event("c", "C");
        return story(id, nodes(a, b, c), edges(edge(a, b), edge(b, c), edge(a, c)));
    }

    // ---------- lookups ----------

    public static Node byLabel(CausalGraph graph, String label) {
        return graph.nodes().stream().filter(n -> n.label().equals(label)).findFirst()
                .orElseThrow(() -> new AssertionError("No node labelled " + label + " in " + graph));
    }

    public static HyperEdge into(CausalGraph graph, String targetLabel) {
        return graph.hyperEdges().stream().filter(h -> h.target().label().equals(targetLabel)).findFirst()
                .orElseThrow(() -> new AssertionError("No hyperedge into " + targetLabel + " in " + graph));
    }

    public static List<String> labels(List<? extends Node> nodes) {
        return nodes.stream().map(Node::label).toList();
    }

    public static void rank(CausalGraph graph) {
        new RankingEngine(RankingPolicy.defaults()).rank(graph);
    }
}
