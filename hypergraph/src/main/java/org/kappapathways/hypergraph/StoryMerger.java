package org.kappapathways.hypergraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/** Collapses whole stories that are equivalent into one representative with accumulated statistics. */
public final class StoryMerger {
    private static final Logger log = LoggerFactory.getLogger(StoryMerger.class);

    private StoryMerger() {}

    /**
     * Each story absorbs every later equivalent story: occurrence adds up, member weights and numbers add up
     * through the graph correspondence, provenance is concatenated. Representatives are copies, sorted by
     * occurrence (most frequent first, ties in input order) and renamed {@code idPrefix-1..k}.
     */
    public static List<CausalGraph> foldEquivalentStories(List<CausalGraph> stories, boolean enforceRank, String idPrefix) {
        List<CausalGraph> remaining = new ArrayList<>(stories.size());
        for (CausalGraph s : stories) remaining.add(s.copy());
        List<CausalGraph> merged = new ArrayList<>();
        while (!remaining.isEmpty()) {
            CausalGraph current = remaining.remove(0);
            List<String> provenance = new ArrayList<>(current.provenance());
            Iterator<CausalGraph> it = remaining.iterator();
            while (it.hasNext()) {
                CausalGraph other = it.next();
                Optional<GraphMatch> match = Equivalence.matchGraphs(current, other, enforceRank);
                if (match.isEmpty()) continue;
                absorbStatistics(current, other, match.get());
                provenance.addAll(other.provenance());
                it.remove();
            }
            current.setPrevcores(provenance);
            merged.add(current);
        }
        merged.sort(Comparator.comparingInt(CausalGraph::occurrence).reversed());
        for (int i = 0; i < merged.size(); i++) merged.get(i).setId(idPrefix + "-" + (i + 1));
        log.info("Merging equivalent graphs, {} unique {} graphs obtained from {}", merged.size(), idPrefix, stories.size());
        return merged;
    }

    private static void absorbStatistics(CausalGraph into, CausalGraph from, GraphMatch match) {
        into.setOccurrence(into.occurrence() + from.occurrence());
        List<HyperEdge> intoEdges = into.hyperEdges();
        List<HyperEdge> fromEdges = from.hyperEdges();
        for (int i = 0; i < intoEdges.size(); i++) {
            HyperEdge h = intoEdges.get(i);
            HyperEdge other = fromEdges.get(match.hyperEdges().get(i));
            List<Integer> sub = match.subEdges().get(i);
            for (int k = 0; k < h.edgelist().size(); k++) {
                CausalEdge mine = h.edgelist().get(k);
                CausalEdge theirs = other.edgelist().get(sub.get(k));
                mine.setWeight(mine.weight() + theirs.weight());
                mine.setNumber(mine.number() + theirs.number());
            }
            h.update();
        }
    }
}
