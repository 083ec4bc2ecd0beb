package org.kappapathways.hypergraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A joint dependency: every member edge must be present for the target to fire.
 * <p>
 * {@code weight} and {@code number} are the minimum over the members, not the sum: the joint cause is only
 * as strong as its weakest necessary contributor. Members are allowed unequal weights so that an intro
 * source can carry zero weight. Summing happens only when distinct hyperedges are merged.
 */
public final class HyperEdge {
    private final List<CausalEdge> edgelist = new ArrayList<>();
    private Node target;
    private List<Node> sources;
    private int weight;
    private int number;
    private RelationType relationType;
    private boolean reverse;
    private boolean underlying;
    private boolean cover;

    public HyperEdge(List<CausalEdge> edges) {
        edgelist.addAll(edges);
        update();
    }

    public static HyperEdge of(CausalEdge... edges) {
        return new HyperEdge(List.of(edges));
    }

    /**
     * Recomputes target, sources, weight, number, relation type and reverse from the members.
     *
     * @throws StructuralViolationException if there are no members or they disagree on the target
     */
    public void update() {
        if (edgelist.isEmpty()) throw new StructuralViolationException("HyperEdge must have at least one member edge");
        Node t = edgelist.get(0).target();
        Set<Node> distinct = new LinkedHashSet<>();
        int minWeight = Integer.MAX_VALUE;
        int minNumber = Integer.MAX_VALUE;
        boolean allConflict = true;
        boolean allPrecedence = true;
        boolean allReverse = true;
        for (CausalEdge e : edgelist) {
            if (e.target() != t) {
                throw new StructuralViolationException("HyperEdge members disagree on target: "
                        + t + " and " + e.target());
            }
            distinct.add(e.source());
            minWeight = Math.min(minWeight, e.weight());
            minNumber = Math.min(minNumber, e.number());
            allConflict &= e.relationType() == RelationType.CONFLICT;
            allPrecedence &= e.relationType() == RelationType.PRECEDENCE;
            allReverse &= e.isReverse();
        }
        target = t;
        sources = List.copyOf(distinct);
        weight = minWeight;
        number = minNumber;
        relationType = allConflict ? RelationType.CONFLICT
                : allPrecedence ? RelationType.PRECEDENCE : RelationType.CAUSAL;
        reverse = allReverse;
    }

    /** Deep copy: members are copied with their endpoints mapped, flags are kept. */
    public HyperEdge copyWith(Function<Node, Node> nodeMap) {
        List<CausalEdge> copies = new ArrayList<>(edgelist.size());
        for (CausalEdge e : edgelist) copies.add(e.copyWith(nodeMap.apply(e.source()), nodeMap.apply(e.target())));
        HyperEdge copy = new HyperEdge(copies);
        copy.underlying = underlying;
        copy.cover = cover;
        return copy;
    }

    void add(CausalEdge edge) {
        edgelist.add(Objects.requireNonNull(edge, "edge"));
        update();
    }

    /** Keeps the matching members; returns false, without updating, if none are left. */
    boolean retain(Predicate<CausalEdge> keep) {
        edgelist.removeIf(keep.negate());
        if (edgelist.isEmpty()) return false;
        update();
        return true;
    }

    void redirect(Node from, Node to) {
        boolean changed = false;
        for (CausalEdge e : edgelist) {
            if (e.source() == from) {
                e.setSource(to);
                changed = true;
            }
            if (e.target() == from) {
                e.setTarget(to);
                changed = true;
            }
        }
        if (changed) update();
    }

    public List<CausalEdge> edgelist() { return Collections.unmodifiableList(edgelist); }

    public Node target() { return target; }

    public List<Node> sources() { return sources; }

    public int weight() { return weight; }

    public int number() { return number; }

    public RelationType relationType() { return relationType; }

    public boolean isReverse() { return reverse; }

    /** Fully explained by introductions, or folded into a cover hyperedge. */
    public boolean isUnderlying() { return underlying; }

    public void setUnderlying(boolean underlying) { this.underlying = underlying; }

    /** Synthesised to stand in for underlying hyperedges when introductions are hidden. */
    public boolean isCover() { return cover; }

    void setCover(boolean cover) { this.cover = cover; }

    @Override
    public String toString() {
        return "HyperEdge(" + sources.stream().map(Node::label).toList() + " -> " + target.label()
                + ", weight=" + weight + ", number=" + number
                + (underlying ? ", underlying" : "") + (cover ? ", cover" : "") + ")";
    }
}
