package org.kappapathways.hypergraph;

import java.util.Objects;

public record RankingPolicy(RulePosition rulePosition, IntroPosition introPosition, int maxIterations) {
    public static final int DEFAULT_MAX_ITERATIONS = 10_000;

    public RankingPolicy {
        Objects.requireNonNull(rulePosition, "rulePosition");
        Objects.requireNonNull(introPosition, "introPosition");
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1 but was " + maxIterations);
    }

    public static RankingPolicy of(RulePosition rulePosition, IntroPosition introPosition) {
        return new RankingPolicy(rulePosition, introPosition, DEFAULT_MAX_ITERATIONS);
    }

    public static RankingPolicy defaults() {
        return of(RulePosition.TOP, IntroPosition.TOP);
    }
}
