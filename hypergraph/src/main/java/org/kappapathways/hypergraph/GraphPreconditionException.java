package org.kappapathways.hypergraph;

/** The graph does not satisfy the acyclicity or seeding precondition an algorithm relies on. */
public class GraphPreconditionException extends RuntimeException {
    public GraphPreconditionException(String message) {
        super(message);
    }
}
