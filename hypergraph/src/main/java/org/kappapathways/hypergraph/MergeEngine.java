package org.kappapathways.hypergraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Quotients graphs by label: same-label nodes become one node, duplicate members collapse, and equivalent
 * hyperedges are fused with their weights and numbers summed.
 */
public final class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final boolean disregardDuplicates;

    public MergeEngine(boolean disregardDuplicates) {
        this.disregardDuplicates = disregardDuplicates;
    }

    public MergeEngine() {
        this(false);
    }

    /**
     * Redirects every edge of {@code drop} to {@code keep} and removes {@code drop}. The kept node keeps
     * its own rank and position; it inherits provenance and first-eligibility.
     */
    public void mergeNodes(CausalGraph graph, Node keep, Node drop) {
        if (keep == drop) throw new IllegalArgumentException("Cannot merge " + keep + " into itself");
        graph.redirect(drop, keep);
        keep.addPrevcores(drop.prevcores());
        keep.setFirst(keep.isFirst() || drop.isFirst());
        graph.removeNode(drop);
    }

    /** Merges every group of same-label nodes onto its first occurrence; the label alone is the key. */
    public int mergeSameLabels(CausalGraph graph) {
        Map<String, Node> firstByLabel = new LinkedHashMap<>();
        int merged = 0;
        for (Node n : List.copyOf(graph.nodes())) {
            Node keep = firstByLabel.putIfAbsent(n.label(), n);
            if (keep != null) {
                mergeNodes(graph, keep, n);
                merged++;
            }
        }
        if (merged > 0) log.debug("Merged {} same-label nodes in {}", merged, graph.id());
        return merged;
    }

    /**
     * Within each hyperedge, members whose sources share a label collapse onto the first one. The weights
     * of the dropped members are discarded, not added: they record the same relation seen twice.
     */
    public int dedupeSubEdges(CausalGraph graph) {
        int dropped = 0;
        for (HyperEdge h : List.copyOf(graph.hyperEdges())) {
            int before = h.edgelist().size();
            Set<String> seen = new HashSet<>();
            graph.retainSubEdges(h, e -> seen.add(e.source().label()));
            dropped += before - h.edgelist().size();
        }
        return dropped;
    }

    /**
     * Fuses rank-agnostically equivalent hyperedges of the same relation type into the earlier one,
     * adding weight and number member by member.
     */
    public int fuseHyperEdges(CausalGraph graph) {
        List<HyperEdge> edges = new ArrayList<>(graph.hyperEdges());
        boolean[] gone = new boolean[edges.size()];
        int fused = 0;
        for (int i = 0; i < edges.size(); i++) {
            if (gone[i]) continue;
            HyperEdge keep = edges.get(i);
            for (int j = i + 1; j < edges.size(); j++) {
                if (gone[j]) continue;
                HyperEdge other = edges.get(j);
                if (other.relationType() != keep.relationType()) continue;
                Optional<List<Integer>> match = Equivalence.matchHyperEdges(other, keep, false, disregardDuplicates);
                if (match.isEmpty()) continue;
                addInto(keep, other, match.get());
                gone[j] = true;
                graph.removeHyperEdge(other);
                fused++;
            }
        }
        return fused;
    }

    /** Adds the weight and number of each member of {@code from} onto its corresponding member of {@code into}. */
    static void addInto(HyperEdge into, HyperEdge from, List<Integer> correspondence) {
        List<CausalEdge> fromMembers = from.edgelist();
        for (int k = 0; k < fromMembers.size(); k++) {
            CausalEdge target = into.edgelist().get(correspondence.get(k));
            target.setWeight(target.weight() + fromMembers.get(k).weight());
            target.setNumber(target.number() + fromMembers.get(k).number());
        }
        into.update();
    }

    /**
     * Folds several graphs into one: copies of all of them are concatenated, then same-label nodes are
     * merged, duplicate members dropped and equivalent hyperedges fused. The inputs are left untouched.
     */
    public CausalGraph fold(String id, List<CausalGraph> graphs) {
        Objects.requireNonNull(graphs, "graphs");
        if (graphs.isEmpty()) throw new IllegalArgumentException("Nothing to fold into " + id);
        CausalGraph working = new CausalGraph(id, graphs.stream().map(CausalGraph::eoi).filter(Objects::nonNull).findFirst().orElse(null));
        int occurrence = 0;
        List<String> provenance = new ArrayList<>();
        for (CausalGraph g : graphs) {
            CausalGraph copy = g.copy();
            for (Node n : copy.nodes()) n.addPrevcores(g.provenance());
            working.absorb(copy);
            occurrence += g.occurrence();
            for (String p : g.provenance()) if (!provenance.contains(p)) provenance.add(p);
            working.setHypergraph(working.isHypergraph() || g.isHypergraph());
            if (working.producedBy() == null) working.setProducedBy(g.producedBy());
        }
        working.setOccurrence(occurrence);
        working.setPrevcores(provenance);
        int merged = mergeSameLabels(working);
        int deduped = dedupeSubEdges(working);
        int fused = fuseHyperEdges(working);
        log.info("Folded {} graphs into {}: merged {} nodes, dropped {} duplicate edges, fused {} hyperedges",
                graphs.size(), id, merged, deduped, fused);
        return working;
    }
}
