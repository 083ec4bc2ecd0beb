package org.kappapathways.hypergraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Restricted transitive reduction: within a hyperedge, a member is kept only if exactly one loop-free path
 * leads from its source down to the hyperedge target. Members implied by a longer path are dropped.
 * <p>
 * A loop gives every member feeding it more than one path, so cyclic graphs are refused.
 * Conflict hyperedges are left alone.
 */
public final class RedundantEdgeReducer {
    private static final Logger log = LoggerFactory.getLogger(RedundantEdgeReducer.class);

    private final PathEnumerator paths;

    public RedundantEdgeReducer(PathEnumerator paths) {
        this.paths = Objects.requireNonNull(paths, "paths");
    }

    public RedundantEdgeReducer() {
        this(new PathEnumerator());
    }

    /**
     * Hyperedges are reduced one at a time, each against the graph as the previous ones left it.
     *
     * @return the number of member edges removed
     * @throws GraphPreconditionException if the graph has a loop
     * @throws PathBudgetExceededException if the graph has too many paths to enumerate
     */
    public int reduce(CausalGraph graph) {
        if (!graph.isAcyclic()) throw new GraphPreconditionException("Cannot reduce " + graph.id() + ": it is not acyclic");
        int removed = 0;
        int emptied = 0;
        for (HyperEdge h : List.copyOf(graph.hyperEdges())) {
            if (h.relationType() == RelationType.CONFLICT || h.edgelist().size() < 2) continue;
            Set<CausalEdge> redundant = Collections.newSetFromMap(new IdentityHashMap<>());
            for (CausalEdge e : h.edgelist()) {
                int count = paths.follow(graph, PathEnumerator.Direction.DOWN, e.source(), List.of(h.target()), false).size();
                if (count != 1) redundant.add(e);
            }
            if (redundant.isEmpty()) continue;
            removed += redundant.size();
            if (!graph.retainSubEdges(h, e -> !redundant.contains(e))) emptied++;
        }
        log.debug("Reduced {}: removed {} redundant edges, dropped {} emptied hyperedges", graph.id(), removed, emptied);
        return removed;
    }
}
