package org.kappapathways.hypergraph;

public class RankingStalledException extends GraphPreconditionException {
    public RankingStalledException(String message) {
        super(message);
    }
}
