package org.kappapathways.hypergraph;

import org.kappapathways.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Checks a story before it is ranked or folded. Every problem is reported, nothing is thrown. */
public interface StoryValidation {

    /**
     * The graph itself, or all of: no nodes, blank or duplicate ids, blank labels, members whose endpoints
     * are not nodes of the graph, introductions used as a target.
     */
    static ErrorsOr<CausalGraph> validate(CausalGraph graph) {
        Objects.requireNonNull(graph);
        List<String> errors = new ArrayList<>();
        if (graph.nodes().isEmpty()) errors.add("Graph " + graph.id() + " has no nodes");

        Set<String> ids = new HashSet<>();
        Set<Node> known = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Node n : graph.nodes()) {
            known.add(n);
            if (n.id().isBlank()) errors.add("Node with label \"" + n.label() + "\" has a blank id");
            else if (!ids.add(n.id())) errors.add("Duplicate node id " + n.id());
            if (n.label().isBlank()) errors.add("Node " + n.id() + " has a blank label");
        }

        List<HyperEdge> all = new ArrayList<>(graph.hyperEdges());
        all.addAll(graph.coverEdges());
        for (HyperEdge h : all) {
            for (CausalEdge e : h.edgelist()) {
                if (!known.contains(e.source())) errors.add("Edge " + e + " starts at " + e.source() + " which is not in the graph");
                if (!known.contains(e.target())) errors.add("Edge " + e + " ends at " + e.target() + " which is not in the graph");
            }
            if (h.target().isIntro() && h.relationType() != RelationType.CONFLICT) {
                errors.add("Intro node " + h.target() + " is the target of " + h);
            }
        }
        return errors.isEmpty() ? ErrorsOr.lift(graph) : ErrorsOr.errors(errors);
    }

    /** Causal or precedence members whose non-intro source is not ranked strictly below the target. */
    static List<String> rankViolations(CausalGraph graph) {
        List<String> violations = new ArrayList<>();
        for (HyperEdge h : graph.hyperEdges()) {
            if (h.relationType() == RelationType.CONFLICT) continue;
            Double t = h.target().rank();
            for (Node s : h.sources()) {
                if (s.isIntro()) continue;
                if (s.rank() == null || t == null || s.rank() >= t) {
                    violations.add(s + " is not ranked below " + h.target());
                }
            }
        }
        return violations;
    }
}
