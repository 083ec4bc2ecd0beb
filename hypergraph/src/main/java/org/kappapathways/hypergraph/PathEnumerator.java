package org.kappapathways.hypergraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Enumerates loop-free paths through the hyperedges of a graph.
 * <p>
 * Each path forks once per alternative next node; a fork that would revisit a node is discarded.
 * Conflict hyperedges are not followed. Paths still growing plus paths that already arrived are capped by
 * {@code maxPaths}; a path that dead-ends away from the targets is dropped and does not count.
 */
public final class PathEnumerator {
    public static final int DEFAULT_MAX_PATHS = 100_000;

    public enum Direction {
        /** From sources to targets. */
        DOWN,
        /** From targets back to sources. */
        UP
    }

    private final int maxPaths;

    public PathEnumerator(int maxPaths) {
        if (maxPaths < 1) throw new IllegalArgumentException("maxPaths must be >= 1 but was " + maxPaths);
        this.maxPaths = maxPaths;
    }

    public PathEnumerator() {
        this(DEFAULT_MAX_PATHS);
    }

    /**
     * Every loop-free path that starts at {@code from} and ends at a member of {@code toNodes}.
     * A path stops growing as soon as it reaches a member of {@code toNodes}.
     *
     * @param stopEarly stop extending the other paths once any path has arrived
     * @throws PathBudgetExceededException when more than {@code maxPaths} paths are growing or arrived at once
     */
    public List<List<Node>> follow(CausalGraph graph, Direction direction, Node from, Collection<Node> toNodes,
                                   boolean stopEarly) {
        Set<Node> targets = Collections.newSetFromMap(new IdentityHashMap<>());
        targets.addAll(toNodes);
        List<List<Node>> finished = new ArrayList<>();
        List<List<Node>> active = new ArrayList<>();
        active.add(List.of(from));
        boolean arrived = false;
        while (!active.isEmpty() && !(stopEarly && arrived)) {
            List<List<Node>> next = new ArrayList<>();
            for (List<Node> path : active) {
                Node last = path.get(path.size() - 1);
                if (targets.contains(last)) {
                    finished.add(path);
                    arrived = true;
                    continue;
                }
                List<Node> neighbours = direction == Direction.DOWN ? graph.successors(last) : graph.predecessors(last);
                for (Node n : neighbours) {
                    if (containsNode(path, n)) continue;
                    List<Node> extended = new ArrayList<>(path.size() + 1);
                    extended.addAll(path);
                    extended.add(n);
                    next.add(extended);
                }
            }
            if (finished.size() + next.size() > maxPaths) {
                throw new PathBudgetExceededException("More than " + maxPaths + " paths from " + from
                        + " in " + graph.id() + "; the graph is too branched or not acyclic");
            }
            active = next;
        }
        return finished;
    }

    private static boolean containsNode(List<Node> path, Node node) {
        for (Node n : path) if (n == node) return true;
        return false;
    }
}
