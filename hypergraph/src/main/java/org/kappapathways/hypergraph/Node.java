package org.kappapathways.hypergraph;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of a causal story or pathway.
 * <p>
 * Identity is object identity: two nodes are never {@code equals} unless they are the same object.
 * The {@link #label()} is the only key used when deciding whether two nodes should merge.
 * Adjacency is not stored here; ask the owning {@link CausalGraph}.
 */
public abstract class Node {
    private String id;
    private final String label;
    @Nullable
    private Double rank;
    private boolean intro;
    private boolean first;
    private boolean shrink;
    @Nullable
    private String pos;
    private final List<String> prevcores = new ArrayList<>();

    protected Node(String id, String label) {
        this.id = Objects.requireNonNull(id, "id");
        this.label = Objects.requireNonNull(label, "label");
    }

    public abstract NodeKind kind();

    /** Same fields, new identity. */
    public abstract Node copy();

    protected <N extends Node> N copyFieldsInto(N other) {
        other.setRank(rank);
        other.setIntro(intro);
        other.setFirst(first);
        other.setShrink(shrink);
        other.setPos(pos);
        other.addPrevcores(prevcores);
        return other;
    }

    public String id() { return id; }

    void setId(String id) { this.id = Objects.requireNonNull(id, "id"); }

    public String label() { return label; }

    @Nullable
    public Double rank() { return rank; }

    public boolean isRanked() { return rank != null; }

    public void setRank(@Nullable Double rank) { this.rank = rank; }

    public boolean isIntro() { return intro; }

    public void setIntro(boolean intro) { this.intro = intro; }

    public boolean isFirst() { return first; }

    public void setFirst(boolean first) { this.first = first; }

    public boolean isShrink() { return shrink; }

    public void setShrink(boolean shrink) { this.shrink = shrink; }

    @Nullable
    public String pos() { return pos; }

    public void setPos(@Nullable String pos) { this.pos = pos; }

    /** Ids of the input stories that contributed to this node. */
    public List<String> prevcores() { return Collections.unmodifiableList(prevcores); }

    public void addPrevcores(List<String> ids) {
        for (String id : ids) if (!prevcores.contains(id)) prevcores.add(id);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + id + ", \"" + label + "\""
                + (rank != null ? ", rank=" + rank : "")
                + (intro ? ", intro" : "") + ")";
    }
}
