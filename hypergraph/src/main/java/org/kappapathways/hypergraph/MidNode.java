package org.kappapathways.hypergraph;

/**
 * Junction used by pre-grouped input: every edge into a midnode belongs to the hyperedge of the
 * midnode's single successor. Resolved away by {@link HyperEdgeBuilder#buildGraph}.
 */
public final class MidNode extends Node {

    public MidNode(String id) {
        super(id, id);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MID;
    }

    @Override
    public MidNode copy() {
        return copyFieldsInto(new MidNode(id()));
    }
}
