package org.kappapathways.hypergraph;

public enum NodeKind {
    /** A rule firing. */
    EVENT,
    /** A site state positioned between two event ranks. */
    STATE,
    /** A drawing junction where the sources of one hyperedge meet before reaching the target. */
    MID
}
