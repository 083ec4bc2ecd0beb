package org.kappapathways.hypergraph;

public class PathBudgetExceededException extends GraphPreconditionException {
    public PathBudgetExceededException(String message) {
        super(message);
    }
}
