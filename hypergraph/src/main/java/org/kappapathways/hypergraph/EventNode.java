package org.kappapathways.hypergraph;

public final class EventNode extends Node {

    public EventNode(String id, String label) {
        super(id, label);
    }

    /** An initial condition rather than a fired rule. */
    public static EventNode intro(String id, String label) {
        EventNode node = new EventNode(id, label);
        node.setIntro(true);
        return node;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EVENT;
    }

    @Override
    public EventNode copy() {
        return copyFieldsInto(new EventNode(id(), label()));
    }
}
