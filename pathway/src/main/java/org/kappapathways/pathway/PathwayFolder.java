package org.kappapathways.pathway;

import org.kappapathways.common.errorsor.ErrorsOr;
import org.kappapathways.common.function.ThrowingSupplier;
import org.kappapathways.hypergraph.CausalGraph;
import org.kappapathways.hypergraph.CoverEdgeExtractor;
import org.kappapathways.hypergraph.GraphPruner;
import org.kappapathways.hypergraph.HyperEdgeBuilder;
import org.kappapathways.hypergraph.MergeEngine;
import org.kappapathways.hypergraph.Node;
import org.kappapathways.hypergraph.PathEnumerator;
import org.kappapathways.hypergraph.RankingEngine;
import org.kappapathways.hypergraph.RedundantEdgeReducer;
import org.kappapathways.hypergraph.StoryMerger;
import org.kappapathways.hypergraph.StoryValidation;
import org.kappapathways.pathway.config.PathwayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds a batch of stories into a pathway: validate, rank, merge equivalent stories into cores, loop each
 * core and merge the results into event paths, then fold the event paths into one pathway.
 * <p>
 * The input stories are never modified. A failing stage ends the fold and is returned as errors prefixed
 * with the stage name; the observer has already seen the stages before it.
 */
public final class PathwayFolder {
    private static final Logger log = LoggerFactory.getLogger(PathwayFolder.class);

    public static final String CORE_PREFIX = "core";
    public static final String EVENT_PATH_PREFIX = "eventpath";
    public static final String PATHWAY_ID = "pathway";

    private final PathwayConfig config;
    private final FoldObserver observer;
    private final RankingEngine ranking;
    private final MergeEngine merging;
    private final PathEnumerator paths;

    public PathwayFolder(PathwayConfig config, FoldObserver observer) {
        this.config = Objects.requireNonNull(config, "config");
        this.observer = Objects.requireNonNull(observer, "observer");
        this.ranking = new RankingEngine(config.rankingPolicy());
        this.merging = new MergeEngine(config.disregardDuplicateSources());
        this.paths = config.pathEnumerator();
    }

    public PathwayFolder(PathwayConfig config) {
        this(config, FoldObserver.NONE);
    }

    public ErrorsOr<PathwayResult> fold(List<CausalGraph> stories) {
        if (stories.isEmpty()) return ErrorsOr.error("No stories to fold");
        log.info("Folding {} stories with {}", stories.size(), config);
        return validate(stories)
                .flatMap(this::rankAll)
                .flatMap(ranked -> stage("cores", () -> cores(ranked)))
                .flatMap(cores -> stage("eventpaths", () -> eventPaths(cores))
                        .flatMap(eventPaths -> stage("pathway", () -> pathway(eventPaths))
                                .map(pathway -> new PathwayResult(cores, eventPaths, pathway))));
    }

    private static ErrorsOr<List<CausalGraph>> validate(List<CausalGraph> stories) {
        List<ErrorsOr<CausalGraph>> checked = new ArrayList<>(stories.size());
        for (CausalGraph s : stories) checked.add(StoryValidation.validate(s));
        return ErrorsOr.sequence(checked).addPrefixIfError("validate: ");
    }

    /** Copies every story and ranks the copies that are not fully ranked. All failures are reported. */
    private ErrorsOr<List<CausalGraph>> rankAll(List<CausalGraph> stories) {
        List<ErrorsOr<CausalGraph>> ranked = new ArrayList<>(stories.size());
        for (CausalGraph s : stories) ranked.add(ErrorsOr.trying(() -> rankedCopy(s)));
        return ErrorsOr.sequence(ranked).addPrefixIfError("rank: ");
    }

    private CausalGraph rankedCopy(CausalGraph story) {
        CausalGraph copy = story.copy();
        if (copy.nodes().stream().allMatch(Node::isRanked)) {
            copy.updateRankBounds();
            return copy;
        }
        ensureFirstNodes(copy);
        ranking.rank(copy);
        return copy;
    }

    private List<CausalGraph> cores(List<CausalGraph> stories) {
        List<CausalGraph> cores = StoryMerger.foldEquivalentStories(stories, config.enforceRankOnStoryMerge(), CORE_PREFIX);
        for (CausalGraph core : cores) core.sequentializeIds();
        log.info("Merging equivalent stories, {} unique cores obtained", cores.size());
        observer.onCores(cores);
        return cores;
    }

    /** Each core is looped on a copy, so the cores handed to the observer stay as they were. */
    private List<CausalGraph> eventPaths(List<CausalGraph> cores) {
        List<CausalGraph> looped = new ArrayList<>(cores.size());
        for (CausalGraph core : cores) looped.add(loop(core.copy()));
        List<CausalGraph> eventPaths = StoryMerger.foldEquivalentStories(looped, config.enforceRankOnStoryMerge(), EVENT_PATH_PREFIX);
        for (CausalGraph p : eventPaths) p.sequentializeIds();
        log.info("Merging equivalent looped cores, {} event paths obtained", eventPaths.size());
        observer.onEventPaths(eventPaths);
        return eventPaths;
    }

    private CausalGraph loop(CausalGraph core) {
        if (config.dropIntroNodes()) GraphPruner.removeIntroNodes(core);
        GraphPruner.removeIgnored(core, config.ignoreList());
        merging.mergeSameLabels(core);
        merging.dedupeSubEdges(core);
        merging.fuseHyperEdges(core);
        ensureFirstNodes(core);
        ranking.rerankByLongestPath(core, paths);
        log.debug("Looped {}: {}", core.id(), core);
        return core;
    }

    private CausalGraph pathway(List<CausalGraph> eventPaths) {
        CausalGraph pathway = merging.fold(PATHWAY_ID, eventPaths);
        ensureFirstNodes(pathway);
        ranking.rerankByLongestPath(pathway, paths);
        if (config.reduceRedundantEdges() && !pathway.isAcyclic()) {
            log.warn("Pathway {} has loops, redundant edges are kept", pathway.id());
        } else if (config.reduceRedundantEdges()) {
            int removed = new RedundantEdgeReducer(paths).reduce(pathway);
            if (removed > 0) ranking.rerankByLongestPath(pathway, paths);
        }
        if (config.hideIntroductions()) CoverEdgeExtractor.extract(pathway);
        pathway.resolveEoi();
        pathway.sequentializeIds();
        log.info("Merging all event paths into one pathway: {} nodes, {} hyperedges, {} covers, eoi {}",
                pathway.nodes().size(), pathway.hyperEdges().size(), pathway.coverEdges().size(), pathway.eoi());
        observer.onPathway(pathway);
        return pathway;
    }

    private static void ensureFirstNodes(CausalGraph graph) {
        boolean seeded = graph.nodes().stream().anyMatch(n -> n.isFirst() && !n.isIntro());
        if (!seeded) {
            int first = HyperEdgeBuilder.markFirstNodes(graph);
            log.debug("No first node in {}, marked {}", graph.id(), first);
        }
    }

    private static <T> ErrorsOr<T> stage(String name, ThrowingSupplier<T> body) {
        ErrorsOr<T> result = ErrorsOr.trying(body);
        result.ifError(errors -> log.warn("Stage {} failed: {}", name, errors));
        return result.addPrefixIfError(name + ": ");
    }
}
