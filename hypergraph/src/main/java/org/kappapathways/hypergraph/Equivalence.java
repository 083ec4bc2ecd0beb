package org.kappapathways.hypergraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Structural equivalence of nodes, hyperedges and graphs. Equivalence is by label (and optionally rank);
 * node identity never matters.
 * <p>
 * List matching is greedy: each element of the first list takes the first still-unmatched equivalent
 * element of the second. Folding relies on this exact first-match order, since the correspondence decides
 * which member weights are added together.
 */
public final class Equivalence {
    private Equivalence() {}

    public static boolean equivalentNodes(Node n1, Node n2, boolean enforceRank) {
        return n1.label().equals(n2.label()) && (!enforceRank || Objects.equals(n1.rank(), n2.rank()));
    }

    /**
     * Greedy correspondence from {@code list1} indexes to {@code list2} indexes; empty when an element of
     * either list is left unmatched.
     */
    public static Optional<List<Integer>> matchNodeLists(List<? extends Node> list1, List<? extends Node> list2,
                                                         boolean enforceRank) {
        if (list1.size() != list2.size()) return Optional.empty();
        List<Integer> pool = new ArrayList<>(list2.size());
        for (int i = 0; i < list2.size(); i++) pool.add(i);
        List<Integer> matches = new ArrayList<>(list1.size());
        for (Node n1 : list1) {
            Integer found = null;
            for (Integer j : pool) {
                if (equivalentNodes(n1, list2.get(j), enforceRank)) {
                    found = j;
                    break;
                }
            }
            if (found == null) return Optional.empty();
            pool.remove(found);
            matches.add(found);
        }
        return Optional.of(matches);
    }

    public static boolean equivalentNodeLists(List<? extends Node> list1, List<? extends Node> list2, boolean enforceRank) {
        return matchNodeLists(list1, list2, enforceRank).isPresent();
    }

    /**
     * Target equivalence plus equivalence of the member sources, returning which member of {@code h2}
     * each member of {@code h1} corresponds to.
     * <p>
     * With {@code disregardDuplicates}, members whose sources share a label count once on each side; every
     * member of {@code h1} then corresponds to the first member of {@code h2} with that source label.
     */
    public static Optional<List<Integer>> matchHyperEdges(HyperEdge h1, HyperEdge h2, boolean enforceRank,
                                                          boolean disregardDuplicates) {
        if (!equivalentNodes(h1.target(), h2.target(), enforceRank)) return Optional.empty();
        if (!disregardDuplicates) return matchNodeLists(memberSources(h1), memberSources(h2), enforceRank);

        if (!equivalentNodeLists(distinctLabelSources(h1), distinctLabelSources(h2), enforceRank)) return Optional.empty();
        List<Integer> matches = new ArrayList<>(h1.edgelist().size());
        for (CausalEdge e1 : h1.edgelist()) {
            int found = -1;
            List<CausalEdge> members2 = h2.edgelist();
            for (int j = 0; j < members2.size() && found < 0; j++) {
                if (members2.get(j).source().label().equals(e1.source().label())) found = j;
            }
            if (found < 0) return Optional.empty();
            matches.add(found);
        }
        return Optional.of(matches);
    }

    public static boolean equivalentHyperedges(HyperEdge h1, HyperEdge h2, boolean enforceRank) {
        return matchHyperEdges(h1, h2, enforceRank, false).isPresent();
    }

    /**
     * Event nodes, then state nodes, then hyperedges; later comparisons are skipped once one fails.
     */
    public static Optional<GraphMatch> matchGraphs(CausalGraph g1, CausalGraph g2, boolean enforceRank) {
        if (!equivalentNodeLists(g1.eventNodes(), g2.eventNodes(), enforceRank)) return Optional.empty();
        if (!equivalentNodeLists(g1.stateNodes(), g2.stateNodes(), enforceRank)) return Optional.empty();
        List<HyperEdge> edges1 = g1.hyperEdges();
        List<HyperEdge> edges2 = g2.hyperEdges();
        if (edges1.size() != edges2.size()) return Optional.empty();
        Set<Integer> used = new HashSet<>();
        List<Integer> hyperMatches = new ArrayList<>(edges1.size());
        List<List<Integer>> subMatches = new ArrayList<>(edges1.size());
        for (HyperEdge h1 : edges1) {
            boolean matched = false;
            for (int j = 0; j < edges2.size() && !matched; j++) {
                if (used.contains(j)) continue;
                Optional<List<Integer>> sub = matchHyperEdges(h1, edges2.get(j), enforceRank, false);
                if (sub.isPresent()) {
                    used.add(j);
                    hyperMatches.add(j);
                    subMatches.add(sub.get());
                    matched = true;
                }
            }
            if (!matched) return Optional.empty();
        }
        return Optional.of(new GraphMatch(hyperMatches, subMatches));
    }

    public static boolean equivalentGraphs(CausalGraph g1, CausalGraph g2, boolean enforceRank) {
        return matchGraphs(g1, g2, enforceRank).isPresent();
    }

    private static List<Node> memberSources(HyperEdge h) {
        List<Node> sources = new ArrayList<>(h.edgelist().size());
        for (CausalEdge e : h.edgelist()) sources.add(e.source());
        return sources;
    }

    private static List<Node> distinctLabelSources(HyperEdge h) {
        Set<String> seen = new HashSet<>();
        List<Node> sources = new ArrayList<>();
        for (CausalEdge e : h.edgelist()) if (seen.add(e.source().label())) sources.add(e.source());
        return sources;
    }
}
