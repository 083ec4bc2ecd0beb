package org.kappapathways.hypergraph;

public enum IntroPosition {
    /** Rank 0. */
    TOP,
    /** One rank above the earliest node they feed. */
    BOTTOM
}
