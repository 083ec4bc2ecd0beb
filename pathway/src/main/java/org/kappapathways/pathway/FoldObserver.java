package org.kappapathways.pathway;

import org.kappapathways.hypergraph.CausalGraph;

import java.util.List;

/**
 * Told about the intermediate graphs of a fold as each stage finishes, so that they can be written out.
 * The graphs belong to the fold; an observer that keeps them should copy them.
 */
public interface FoldObserver {

    FoldObserver NONE = new FoldObserver() {};

    default void onCores(List<CausalGraph> cores) {}

    default void onEventPaths(List<CausalGraph> eventPaths) {}

    default void onPathway(CausalGraph pathway) {}
}
