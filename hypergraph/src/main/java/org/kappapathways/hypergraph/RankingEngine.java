package org.kappapathways.hypergraph;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Assigns causal depth to every node reachable from the {@code first} nodes.
 * <p>
 * Ranks propagate from rank-1 seeds along hyperedges until nothing is left to place. Conflict hyperedges do
 * not constrain rank. A pass that neither ranks a node nor retires one can never make progress, so it is
 * reported as a {@link RankingStalledException} instead of looping forever.
 */
public final class RankingEngine {
    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);

    private final RankingPolicy policy;

    public RankingEngine(RankingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public RankingPolicy policy() {
        return policy;
    }

    public void rank(CausalGraph graph) {
        graph.clearRanks();
        List<Node> current = new ArrayList<>();
        for (Node n : graph.nodes()) {
            if (n.isFirst() && !n.isIntro()) {
                n.setRank(1.0);
                current.add(n);
            }
        }
        int passes = 0;
        while (!current.isEmpty()) {
            if (++passes > policy.maxIterations()) {
                throw new RankingStalledException("Ranking of " + graph.id() + " did not finish within "
                        + policy.maxIterations() + " passes");
            }
            List<Node> ranked = rankCandidates(graph, candidates(graph, current));
            List<Node> next = new ArrayList<>();
            for (Node n : current) if (!saturated(graph, n)) next.add(n);
            if (ranked.isEmpty() && next.size() == current.size()) {
                throw new RankingStalledException("Ranking of " + graph.id() + " stalled: no cause of "
                        + unrankedTargets(graph, current) + " can ever be secured");
            }
            next.addAll(ranked);
            current = next;
        }
        rankIntroNodes(graph);
        graph.updateRankBounds();
        log.debug("Ranked {} in {} passes: ranks {}..{} midranks={}",
                graph.id(), passes, graph.minRank(), graph.maxRank(), graph.hasMidranks());
    }

    private static Set<Node> candidates(CausalGraph graph, List<Node> current) {
        Set<Node> result = new LinkedHashSet<>();
        for (Node n : current) {
            for (HyperEdge h : graph.outgoing(n)) {
                if (h.relationType() == RelationType.CONFLICT) continue;
                Node t = h.target();
                if (!t.isRanked() && !t.isIntro()) result.add(t);
            }
        }
        return result;
    }

    private List<Node> rankCandidates(CausalGraph graph, Set<Node> candidates) {
        List<Node> ranked = new ArrayList<>();
        for (Node candidate : candidates) {
            Double rank = policy.rulePosition() == RulePosition.TOP
                    ? earliestRank(graph, candidate)
                    : latestRank(graph, candidate);
            if (rank != null) {
                candidate.setRank(rank);
                ranked.add(candidate);
            }
        }
        return ranked;
    }

    /** min over secured incoming hyperedges of (max source rank + 1); null while none is secured. */
    @Nullable
    private static Double earliestRank(CausalGraph graph, Node candidate) {
        Double best = null;
        for (HyperEdge h : graph.incoming(candidate)) {
            if (h.relationType() == RelationType.CONFLICT) continue;
            Double reach = securedReach(graph, h, false);
            if (reach != null && (best == null || reach + 1 < best)) best = reach + 1;
        }
        return best;
    }

    /**
     * max over secured incoming hyperedges of (max source rank + 1), but only once every incoming hyperedge
     * that does not loop back through the candidate is secured.
     */
    @Nullable
    private static Double latestRank(CausalGraph graph, Node candidate) {
        int secured = 0;
        int potential = 0;
        Double best = null;
        for (HyperEdge h : graph.incoming(candidate)) {
            if (h.relationType() == RelationType.CONFLICT) continue;
            Double reach = securedReach(graph, h, true);
            if (reach != null) {
                secured++;
                potential++;
                if (best == null || reach + 1 > best) best = reach + 1;
            } else if (!loopsBack(graph, h, candidate)) {
                potential++;
            }
        }
        return secured > 0 && secured == potential ? best : null;
    }

    /**
     * Highest rank among the non-intro sources, 0 when there are none; null while any is unranked.
     * With {@code shrinkAware} a shrunk source stands for the highest rank among its own sources.
     */
    @Nullable
    private static Double securedReach(CausalGraph graph, HyperEdge h, boolean shrinkAware) {
        double reach = 0;
        for (Node s : h.sources()) {
            if (s.isIntro()) continue;
            Double r = shrinkAware && s.isShrink() ? shrunkRank(graph, s) : s.rank();
            if (r == null) return null;
            reach = Math.max(reach, r);
        }
        return reach;
    }

    @Nullable
    private static Double shrunkRank(CausalGraph graph, Node shrunk) {
        Double max = null;
        for (HyperEdge h : graph.incoming(shrunk)) {
            for (Node s : h.sources()) {
                if (s.rank() != null && (max == null || s.rank() > max)) max = s.rank();
            }
        }
        return max != null ? max : shrunk.rank();
    }

    /** True if an unranked source of {@code h} is the candidate itself or lies downstream of it. */
    private static boolean loopsBack(CausalGraph graph, HyperEdge h, Node candidate) {
        Set<Node> downstream = null;
        for (Node s : h.sources()) {
            if (s.isIntro() || s.isRanked()) continue;
            if (s == candidate) return true;
            if (downstream == null) downstream = downstream(graph, candidate);
            if (downstream.contains(s)) return true;
        }
        return false;
    }

    private static Set<Node> downstream(CausalGraph graph, Node from) {
        Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> queue = new ArrayDeque<>(graph.successors(from));
        while (!queue.isEmpty()) {
            Node n = queue.poll();
            if (seen.add(n)) queue.addAll(graph.successors(n));
        }
        return seen;
    }

    /** All targets reached through non-conflict hyperedges are ranked (or are introductions). */
    private static boolean saturated(CausalGraph graph, Node node) {
        for (HyperEdge h : graph.outgoing(node)) {
            if (h.relationType() == RelationType.CONFLICT) continue;
            if (!h.target().isRanked() && !h.target().isIntro()) return false;
        }
        return true;
    }

    private static List<String> unrankedTargets(CausalGraph graph, List<Node> current) {
        Set<String> labels = new LinkedHashSet<>();
        for (Node n : candidates(graph, current)) labels.add(n.label());
        return List.copyOf(labels);
    }

    /**
     * Places introductions: rank 0, or one below the lowest-ranked node they feed through a non-conflict
     * hyperedge, looking one hop further through shrunk targets.
     *
     * @throws EmptyStatisticsException if a bottom-placed introduction feeds no ranked node
     */
    void rankIntroNodes(CausalGraph graph) {
        for (Node n : graph.nodes()) {
            if (!n.isIntro()) continue;
            if (policy.introPosition() == IntroPosition.TOP) {
                n.setRank(0.0);
                continue;
            }
            Double lowest = null;
            for (HyperEdge h : graph.outgoing(n)) {
                if (h.relationType() == RelationType.CONFLICT) continue;
                List<Node> reached = h.target().isShrink() ? graph.successors(h.target()) : List.of(h.target());
                for (Node t : reached) {
                    if (t.rank() != null && (lowest == null || t.rank() < lowest)) lowest = t.rank();
                }
            }
            if (lowest == null) {
                throw new EmptyStatisticsException("Intro node " + n + " in " + graph.id() + " feeds no ranked node");
            }
            n.setRank(lowest - 1);
        }
    }

    /**
     * Reranks every non-intro node by the longest loop-free upward path to a start node, counted in nodes,
     * so start nodes get rank 1. Works on graphs with loops. Nodes with no such path lose their rank.
     */
    public void rerankByLongestPath(CausalGraph graph, PathEnumerator paths) {
        List<Node> starts = graph.startNodes();
        List<Node> nodes = graph.nodes().stream().filter(n -> !n.isIntro()).toList();
        List<Double> ranks = new ArrayList<>(nodes.size());
        for (Node n : nodes) {
            int longest = 0;
            for (List<Node> path : paths.follow(graph, PathEnumerator.Direction.UP, n, starts, false)) {
                longest = Math.max(longest, path.size());
            }
            if (longest == 0) log.warn("No path from {} up to a start node in {}", n, graph.id());
            ranks.add(longest == 0 ? null : (double) longest);
        }
        for (int i = 0; i < nodes.size(); i++) nodes.get(i).setRank(ranks.get(i));
        rankIntroNodes(graph);
        graph.updateRankBounds();
    }
}
