package org.kappapathways.hypergraph;

/** Where a rule node is placed when several incoming hyperedges could justify its rank. */
public enum RulePosition {
    /** As early as the first secured cause allows. */
    TOP,
    /** After every cause that does not loop back through the node. */
    BOTTOM
}
