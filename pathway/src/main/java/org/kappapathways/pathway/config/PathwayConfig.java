package org.kappapathways.pathway.config;

import org.kappapathways.common.IEnvGetter;
import org.kappapathways.hypergraph.IntroPosition;
import org.kappapathways.hypergraph.PathEnumerator;
import org.kappapathways.hypergraph.RankingPolicy;
import org.kappapathways.hypergraph.RulePosition;

import java.util.List;

/**
 * Settings for one folding run. Any component missing from the JSON gets its default here.
 *
 * @param rulePosition              where a rule with several candidate causes is placed
 * @param introPosition             where introductions are placed
 * @param enforceRankOnStoryMerge   stories only merge into cores when their ranks agree too
 * @param ignoreList                nodes whose label contains one of these are removed from looped cores
 * @param dropIntroNodes            remove introductions from the final pathway
 * @param hideIntroductions         compute cover hyperedges for a view without introductions
 * @param reduceRedundantEdges      drop hyperedge members implied by a longer path
 * @param disregardDuplicateSources same-label sources count once when fusing hyperedges
 * @param maxRankingIterations      passes after which ranking gives up
 * @param maxPaths                  live paths after which path enumeration gives up
 */
public record PathwayConfig(RulePosition rulePosition,
                            IntroPosition introPosition,
                            Boolean enforceRankOnStoryMerge,
                            List<String> ignoreList,
                            Boolean dropIntroNodes,
                            Boolean hideIntroductions,
                            Boolean reduceRedundantEdges,
                            Boolean disregardDuplicateSources,
                            Integer maxRankingIterations,
                            Integer maxPaths) {

    public static final String ENV_PREFIX = "KAPPAPATHWAYS_";

    public PathwayConfig {
        if (rulePosition == null) rulePosition = RulePosition.TOP;
        if (introPosition == null) introPosition = IntroPosition.TOP;
        if (enforceRankOnStoryMerge == null) enforceRankOnStoryMerge = true;
        ignoreList = ignoreList == null ? List.of() : List.copyOf(ignoreList);
        if (dropIntroNodes == null) dropIntroNodes = false;
        if (hideIntroductions == null) hideIntroductions = true;
        if (reduceRedundantEdges == null) reduceRedundantEdges = true;
        if (disregardDuplicateSources == null) disregardDuplicateSources = false;
        if (maxRankingIterations == null) maxRankingIterations = RankingPolicy.DEFAULT_MAX_ITERATIONS;
        if (maxPaths == null) maxPaths = PathEnumerator.DEFAULT_MAX_PATHS;
        if (maxRankingIterations < 1) throw new IllegalArgumentException("maxRankingIterations must be >= 1 but was " + maxRankingIterations);
        if (maxPaths < 1) throw new IllegalArgumentException("maxPaths must be >= 1 but was " + maxPaths);
    }

    public static PathwayConfig defaults() {
        return new PathwayConfig(null, null, null, null, null, null, null, null, null, null);
    }

    public RankingPolicy rankingPolicy() {
        return new RankingPolicy(rulePosition, introPosition, maxRankingIterations);
    }

    public PathEnumerator pathEnumerator() {
        return new PathEnumerator(maxPaths);
    }

    /** Every component can be overridden by {@code KAPPAPATHWAYS_<UPPER_SNAKE_NAME>}. */
    public PathwayConfig withEnvOverrides(IEnvGetter env) {
        return new PathwayConfig(
                IEnvGetter.getEnumOr(env, ENV_PREFIX + "RULE_POSITION", RulePosition.class, rulePosition),
                IEnvGetter.getEnumOr(env, ENV_PREFIX + "INTRO_POSITION", IntroPosition.class, introPosition),
                IEnvGetter.getBooleanOr(env, ENV_PREFIX + "ENFORCE_RANK_ON_STORY_MERGE", enforceRankOnStoryMerge),
                IEnvGetter.getListOr(env, ENV_PREFIX + "IGNORE_LIST", ignoreList),
                IEnvGetter.getBooleanOr(env, ENV_PREFIX + "DROP_INTRO_NODES", dropIntroNodes),
                IEnvGetter.getBooleanOr(env, ENV_PREFIX + "HIDE_INTRODUCTIONS", hideIntroductions),
                IEnvGetter.getBooleanOr(env, ENV_PREFIX + "REDUCE_REDUNDANT_EDGES", reduceRedundantEdges),
                IEnvGetter.getBooleanOr(env, ENV_PREFIX + "DISREGARD_DUPLICATE_SOURCES", disregardDuplicateSources),
                IEnvGetter.getIntOr(env, ENV_PREFIX + "MAX_RANKING_ITERATIONS", maxRankingIterations),
                IEnvGetter.getIntOr(env, ENV_PREFIX + "MAX_PATHS", maxPaths));
    }
}
