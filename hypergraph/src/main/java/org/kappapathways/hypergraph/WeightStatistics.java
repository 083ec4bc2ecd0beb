package org.kappapathways.hypergraph;

/** Spread of hyperedge weights, used downstream to scale pen widths. */
public record WeightStatistics(int min, int max, double mean, int count) {

    static WeightStatistics of(Iterable<HyperEdge> hyperEdges, String graphId) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        long sum = 0;
        int count = 0;
        for (HyperEdge h : hyperEdges) {
            min = Math.min(min, h.weight());
            max = Math.max(max, h.weight());
            sum += h.weight();
            count++;
        }
        if (count == 0) throw new EmptyStatisticsException("No hyperedges to compute weight statistics for in " + graphId);
        return new WeightStatistics(min, max, (double) sum / count, count);
    }
}
