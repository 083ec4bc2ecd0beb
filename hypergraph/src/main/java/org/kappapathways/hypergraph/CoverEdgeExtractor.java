package org.kappapathways.hypergraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the hyperedges that only exist because of introductions and replaces them, in the
 * hidden-introductions view, by cover hyperedges carrying their summed statistics.
 */
public final class CoverEdgeExtractor {
    private static final Logger log = LoggerFactory.getLogger(CoverEdgeExtractor.class);

    /** Whether any, and whether every, non-essential member of a hyperedge is sourced at an introduction. */
    public record IntroCheck(boolean hasIntro, boolean allIntro) {}

    private CoverEdgeExtractor() {}

    /** {@code allIntro} is only true when there is at least one non-essential intro member. */
    public static IntroCheck checkIntro(HyperEdge h) {
        boolean any = false;
        boolean all = true;
        for (CausalEdge e : h.edgelist()) {
            if (e.isEssential()) continue;
            if (e.source().isIntro()) any = true;
            else all = false;
        }
        return new IntroCheck(any, any && all);
    }

    /**
     * A detached copy of {@code h} without its non-essential intro members; empty when nothing remains.
     * The copy shares the nodes of {@code h}, not its member edges.
     */
    public static Optional<HyperEdge> buildNoIntroHyperEdge(HyperEdge h) {
        List<CausalEdge> kept = new ArrayList<>();
        for (CausalEdge e : h.edgelist()) {
            if (e.source().isIntro() && !e.isEssential()) continue;
            kept.add(e.copyWith(e.source(), e.target()));
        }
        return kept.isEmpty() ? Optional.empty() : Optional.of(new HyperEdge(kept));
    }

    /**
     * Recomputes the underlying flags and the cover hyperedges of {@code graph}.
     * <p>
     * All-intro hyperedges become underlying. Hyperedges that are partly intro-sourced are grouped by the
     * rank-agnostic equivalence of their no-intro projections (same relation type only); each group becomes
     * underlying, and its projection, with weights and numbers summed over the group, is registered as a
     * cover when it still has a non-intro member.
     *
     * @return the number of cover hyperedges registered
     */
    public static int extract(CausalGraph graph) {
        graph.clearCoverEdges();
        List<HyperEdge> partial = new ArrayList<>();
        List<HyperEdge> projections = new ArrayList<>();
        int pureIntro = 0;
        for (HyperEdge h : graph.hyperEdges()) {
            h.setUnderlying(false);
            IntroCheck check = checkIntro(h);
            if (check.allIntro()) {
                h.setUnderlying(true);
                pureIntro++;
            } else if (check.hasIntro()) {
                partial.add(h);
                projections.add(buildNoIntroHyperEdge(h).orElseThrow());
            }
        }
        boolean[] grouped = new boolean[partial.size()];
        int covers = 0;
        for (int i = 0; i < partial.size(); i++) {
            if (grouped[i]) continue;
            grouped[i] = true;
            HyperEdge cover = projections.get(i);
            partial.get(i).setUnderlying(true);
            for (int j = i + 1; j < partial.size(); j++) {
                if (grouped[j] || partial.get(j).relationType() != partial.get(i).relationType()) continue;
                Optional<List<Integer>> match = Equivalence.matchHyperEdges(projections.get(j), cover, false, false);
                if (match.isEmpty()) continue;
                MergeEngine.addInto(cover, projections.get(j), match.get());
                partial.get(j).setUnderlying(true);
                grouped[j] = true;
            }
            if (cover.sources().stream().anyMatch(s -> !s.isIntro())) {
                graph.addCoverEdge(cover);
                covers++;
            }
        }
        log.debug("Cover extraction on {}: {} all-intro hyperedges, {} partly intro, {} covers",
                graph.id(), pureIntro, partial.size(), covers);
        return covers;
    }
}
