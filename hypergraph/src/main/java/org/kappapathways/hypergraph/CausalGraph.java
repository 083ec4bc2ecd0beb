package org.kappapathways.hypergraph;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * One story or pathway: the owning aggregate of its nodes and hyperedges.
 * <p>
 * All structural edits go through this class so the adjacency index is invalidated with them.
 * Nodes are never shared between two graphs; use {@link #copy()} before combining graphs.
 */
public final class CausalGraph {
    private static final Comparator<Double> RANK_ORDER = Comparator.nullsLast(Comparator.naturalOrder());

    private String id;
    @Nullable
    private String eoi;
    private int occurrence = 1;
    private boolean hypergraph;
    @Nullable
    private String producedBy;
    private final List<Node> nodes = new ArrayList<>();
    private final List<HyperEdge> hyperEdges = new ArrayList<>();
    private final List<HyperEdge> coverEdges = new ArrayList<>();
    private final List<String> prevcores = new ArrayList<>();
    @Nullable
    private Double maxRank;
    @Nullable
    private Double minRank;
    private boolean midranks;
    private final AdjacencyIndex adjacency = new AdjacencyIndex(() -> hyperEdges);

    public CausalGraph(String id, @Nullable String eoi) {
        this.id = Objects.requireNonNull(id, "id");
        this.eoi = eoi;
    }

    // ---------- structure ----------

    public List<Node> nodes() { return Collections.unmodifiableList(nodes); }

    public List<Node> eventNodes() { return nodes.stream().filter(n -> n.kind() == NodeKind.EVENT).toList(); }

    public List<Node> stateNodes() { return nodes.stream().filter(n -> n.kind() == NodeKind.STATE).toList(); }

    public List<HyperEdge> hyperEdges() { return Collections.unmodifiableList(hyperEdges); }

    public List<HyperEdge> coverEdges() { return Collections.unmodifiableList(coverEdges); }

    public boolean contains(Node node) {
        for (Node n : nodes) if (n == node) return true;
        return false;
    }

    public CausalGraph addNode(Node node) {
        nodes.add(Objects.requireNonNull(node, "node"));
        adjacency.invalidate();
        return this;
    }

    /** Removes the node only; callers detach its edges first. */
    public void removeNode(Node node) {
        nodes.removeIf(n -> n == node);
        adjacency.invalidate();
    }

    public CausalGraph addHyperEdge(HyperEdge hyperEdge) {
        hyperEdges.add(Objects.requireNonNull(hyperEdge, "hyperEdge"));
        adjacency.invalidate();
        return this;
    }

    public void removeHyperEdge(HyperEdge hyperEdge) {
        hyperEdges.removeIf(h -> h == hyperEdge);
        adjacency.invalidate();
    }

    public void addSubEdge(HyperEdge hyperEdge, CausalEdge edge) {
        hyperEdge.add(edge);
        adjacency.invalidate();
    }

    /**
     * Keeps the members of {@code hyperEdge} matching {@code keep}. A hyperedge left with no member is
     * removed from the graph.
     *
     * @return true if the hyperedge is still part of the graph
     */
    public boolean retainSubEdges(HyperEdge hyperEdge, Predicate<CausalEdge> keep) {
        boolean alive = hyperEdge.retain(keep);
        if (!alive) {
            hyperEdges.removeIf(h -> h == hyperEdge);
            coverEdges.removeIf(h -> h == hyperEdge);
        }
        adjacency.invalidate();
        return alive;
    }

    /** Every member edge pointing at {@code from}, as source or target, now points at {@code to}. */
    public void redirect(Node from, Node to) {
        for (HyperEdge h : hyperEdges) h.redirect(from, to);
        for (HyperEdge h : coverEdges) h.redirect(from, to);
        adjacency.invalidate();
    }

    public void addCoverEdge(HyperEdge cover) {
        cover.setCover(true);
        coverEdges.add(cover);
    }

    public void removeCoverEdgesIf(Predicate<HyperEdge> doomed) {
        coverEdges.removeIf(doomed);
    }

    public void clearCoverEdges() {
        coverEdges.clear();
    }

    /** Moves the nodes and hyperedges of a freshly copied graph into this one. */
    void absorb(CausalGraph copy) {
        nodes.addAll(copy.nodes);
        hyperEdges.addAll(copy.hyperEdges);
        coverEdges.addAll(copy.coverEdges);
        adjacency.invalidate();
    }

    // ---------- adjacency (derived) ----------

    public List<HyperEdge> incoming(Node node) { return adjacency.incoming(node); }

    public List<HyperEdge> outgoing(Node node) { return adjacency.outgoing(node); }

    public List<Node> successors(Node node) { return adjacency.successors(node); }

    public List<Node> predecessors(Node node) { return adjacency.predecessors(node); }

    /** Kahn layering over the causal hyperedges; conflict hyperedges do not count. */
    public boolean isAcyclic() {
        Map<Node, Integer> indegree = new IdentityHashMap<>();
        for (Node n : nodes) indegree.put(n, predecessors(n).size());
        List<Node> ready = new ArrayList<>();
        for (Node n : nodes) if (indegree.get(n) == 0) ready.add(n);
        int seen = 0;
        while (!ready.isEmpty()) {
            Node n = ready.remove(ready.size() - 1);
            seen++;
            for (Node s : successors(n)) {
                int left = indegree.merge(s, -1, Integer::sum);
                if (left == 0) ready.add(s);
            }
        }
        return seen == nodes.size();
    }

    // ---------- ranks ----------

    public void clearRanks() {
        for (Node n : nodes) n.setRank(null);
        updateRankBounds();
    }

    public void updateRankBounds() {
        Double max = null;
        Double min = null;
        boolean mid = false;
        for (Node n : nodes) {
            Double r = n.rank();
            if (r == null) continue;
            if (max == null || r > max) max = r;
            if (min == null || r < min) min = r;
            if (r != Math.rint(r)) mid = true;
        }
        maxRank = max;
        minRank = min;
        midranks = mid;
    }

    /** First-flagged nodes, else rank 1 nodes, else nodes that are never a target. */
    public List<Node> startNodes() {
        List<Node> flagged = nodes.stream().filter(n -> n.isFirst() && !n.isIntro()).toList();
        if (!flagged.isEmpty()) return flagged;
        List<Node> rankOne = nodes.stream().filter(n -> Objects.equals(n.rank(), 1.0)).toList();
        if (!rankOne.isEmpty()) return rankOne;
        return nodes.stream().filter(n -> incoming(n).isEmpty()).toList();
    }

    /** Max rank nodes, else nodes that are never a source. */
    public List<Node> endNodes() {
        if (maxRank != null) {
            List<Node> top = nodes.stream().filter(n -> Objects.equals(n.rank(), maxRank)).toList();
            if (!top.isEmpty()) return top;
        }
        return nodes.stream().filter(n -> outgoing(n).isEmpty()).toList();
    }

    /** When no event of interest is known, it is the label of the last-ranked event. */
    public void resolveEoi() {
        if (eoi != null) return;
        updateRankBounds();
        if (maxRank == null) return;
        for (Node n : eventNodes()) {
            if (Objects.equals(n.rank(), maxRank) && !n.isIntro()) {
                eoi = n.label();
                return;
            }
        }
    }

    /** Ids become node1..nodeN in rank order; hyperedges are sorted by their lowest source rank. */
    public void sequentializeIds() {
        List<Node> ordered = new ArrayList<>(nodes);
        ordered.sort(Comparator.comparing(Node::rank, RANK_ORDER));
        for (int i = 0; i < ordered.size(); i++) ordered.get(i).setId("node" + (i + 1));
        hyperEdges.sort(Comparator.comparing(CausalGraph::lowestSourceRank, RANK_ORDER));
        adjacency.invalidate();
    }

    @Nullable
    private static Double lowestSourceRank(HyperEdge h) {
        Double lowest = null;
        for (Node s : h.sources()) {
            if (s.rank() != null && (lowest == null || s.rank() < lowest)) lowest = s.rank();
        }
        return lowest;
    }

    // ---------- views ----------

    public WeightStatistics weightStatistics() {
        return WeightStatistics.of(hyperEdges, id);
    }

    /** All hyperedges when introductions are shown, otherwise the non-underlying ones plus the covers. */
    public List<HyperEdge> visibleHyperEdges(boolean showIntro) {
        if (showIntro) return hyperEdges();
        List<HyperEdge> visible = new ArrayList<>();
        for (HyperEdge h : hyperEdges) if (!h.isUnderlying()) visible.add(h);
        visible.addAll(coverEdges);
        return visible;
    }

    /** Deep copy with fresh node and edge objects; the copy shares nothing with this graph. */
    public CausalGraph copy() {
        Map<Node, Node> mapping = new IdentityHashMap<>();
        CausalGraph copy = new CausalGraph(id, eoi);
        for (Node n : nodes) {
            Node c = n.copy();
            mapping.put(n, c);
            copy.nodes.add(c);
        }
        for (HyperEdge h : hyperEdges) copy.hyperEdges.add(h.copyWith(n -> mapped(mapping, n)));
        for (HyperEdge h : coverEdges) copy.coverEdges.add(h.copyWith(n -> mapped(mapping, n)));
        copy.occurrence = occurrence;
        copy.hypergraph = hypergraph;
        copy.producedBy = producedBy;
        copy.prevcores.addAll(prevcores);
        copy.maxRank = maxRank;
        copy.minRank = minRank;
        copy.midranks = midranks;
        return copy;
    }

    private Node mapped(Map<Node, Node> mapping, Node node) {
        Node n = mapping.get(node);
        if (n == null) throw new StructuralViolationException("Graph " + id + " has an edge to " + node + " which is not one of its nodes");
        return n;
    }

    // ---------- scalars ----------

    public String id() { return id; }

    public void setId(String id) { this.id = Objects.requireNonNull(id, "id"); }

    @Nullable
    public String eoi() { return eoi; }

    public void setEoi(@Nullable String eoi) { this.eoi = eoi; }

    /** Number of input stories this graph stands for. */
    public int occurrence() { return occurrence; }

    public void setOccurrence(int occurrence) {
        if (occurrence < 1) throw new IllegalArgumentException("occurrence must be >= 1 but was " + occurrence);
        this.occurrence = occurrence;
    }

    public boolean isHypergraph() { return hypergraph; }

    public void setHypergraph(boolean hypergraph) { this.hypergraph = hypergraph; }

    /** Provenance tag of the upstream tool; informational only. */
    @Nullable
    public String producedBy() { return producedBy; }

    public void setProducedBy(@Nullable String producedBy) { this.producedBy = producedBy; }

    public List<String> prevcores() { return Collections.unmodifiableList(prevcores); }

    public void setPrevcores(List<String> ids) {
        prevcores.clear();
        prevcores.addAll(ids);
    }

    /** Ids this graph traces back to: its prevcores, or its own id when it is a raw story. */
    public List<String> provenance() {
        return prevcores.isEmpty() ? List.of(id) : prevcores();
    }

    @Nullable
    public Double maxRank() { return maxRank; }

    @Nullable
    public Double minRank() { return minRank; }

    /** True when some rank is not an integer. */
    public boolean hasMidranks() { return midranks; }

    @Override
    public String toString() {
        return "CausalGraph(" + id + ", occurrence=" + occurrence + ", nodes=" + nodes.size()
                + ", hyperedges=" + hyperEdges.size() + ")";
    }
}
