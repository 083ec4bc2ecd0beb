package org.kappapathways.hypergraph;

/** A min/max/mean was requested over nothing; there is no fallback value. */
public class EmptyStatisticsException extends IllegalStateException {
    public EmptyStatisticsException(String message) {
        super(message);
    }
}
