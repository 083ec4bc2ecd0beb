package org.kappapathways.hypergraph;

public enum RelationType {
    CAUSAL, CONFLICT, PRECEDENCE
}
