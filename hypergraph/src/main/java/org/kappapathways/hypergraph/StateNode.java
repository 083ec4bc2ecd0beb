package org.kappapathways.hypergraph;

/** A site state; may sit on a half-integer rank between the events that write and read it. */
public final class StateNode extends Node {

    public StateNode(String id, String label) {
        super(id, label);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STATE;
    }

    @Override
    public StateNode copy() {
        return copyFieldsInto(new StateNode(id(), label()));
    }
}
