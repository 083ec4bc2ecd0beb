package org.kappapathways.pathway;

import org.kappapathways.hypergraph.CausalGraph;

import java.util.List;

/**
 * @param cores      distinct stories, most frequent first
 * @param eventPaths distinct cores once their repeated events are merged into loops
 * @param pathway    every event path folded into one graph
 */
public record PathwayResult(List<CausalGraph> cores, List<CausalGraph> eventPaths, CausalGraph pathway) {
    public PathwayResult {
        cores = List.copyOf(cores);
        eventPaths = List.copyOf(eventPaths);
    }
}
