package org.kappapathways.hypergraph;

import java.util.Objects;

/** Elementary causal link; always owned by exactly one {@link HyperEdge}. */
public final class CausalEdge {
    private Node source;
    private Node target;
    private int weight;
    private int number;
    private RelationType relationType = RelationType.CAUSAL;
    private boolean essential;
    private boolean reverse;

    public CausalEdge(Node source, Node target) {
        this(source, target, 1, 1);
    }

    public CausalEdge(Node source, Node target, int weight, int number) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        setWeight(weight);
        setNumber(number);
    }

    /** Copy of every field with new endpoints. */
    public CausalEdge copyWith(Node newSource, Node newTarget) {
        CausalEdge copy = new CausalEdge(newSource, newTarget, weight, number);
        copy.relationType = relationType;
        copy.essential = essential;
        copy.reverse = reverse;
        return copy;
    }

    public Node source() { return source; }

    public Node target() { return target; }

    void setSource(Node source) { this.source = Objects.requireNonNull(source, "source"); }

    void setTarget(Node target) { this.target = Objects.requireNonNull(target, "target"); }

    public int weight() { return weight; }

    public void setWeight(int weight) {
        if (weight < 0) throw new IllegalArgumentException("weight must be >= 0 but was " + weight);
        this.weight = weight;
    }

    public int number() { return number; }

    public void setNumber(int number) {
        if (number < 0) throw new IllegalArgumentException("number must be >= 0 but was " + number);
        this.number = number;
    }

    public RelationType relationType() { return relationType; }

    public CausalEdge withRelationType(RelationType relationType) {
        this.relationType = Objects.requireNonNull(relationType, "relationType");
        return this;
    }

    /** Supplies an agent the target does not otherwise mention, so it is never hidden as underlying. */
    public boolean isEssential() { return essential; }

    public CausalEdge withEssential(boolean essential) {
        this.essential = essential;
        return this;
    }

    /** Display only: drawn from higher to lower rank. Never consulted for ranking or reachability. */
    public boolean isReverse() { return reverse; }

    public CausalEdge withReverse(boolean reverse) {
        this.reverse = reverse;
        return this;
    }

    @Override
    public String toString() {
        return "CausalEdge(" + source.label() + " -> " + target.label() + ", weight=" + weight + ", number=" + number
                + (relationType != RelationType.CAUSAL ? ", " + relationType : "") + ")";
    }
}
