package org.kappapathways.hypergraph;

/** A broken structural invariant. Never recoverable; indicates a programming or input error. */
public class StructuralViolationException extends IllegalStateException {
    public StructuralViolationException(String message) {
        super(message);
    }
}
