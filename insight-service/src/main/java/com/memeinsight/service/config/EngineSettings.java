package com.memeinsight.service.config;

import com.memeinsight.common.exception.ConfigValidationException;
import com.memeinsight.common.model.ScoringWeights;
import com.memeinsight.common.stage.StageThresholds;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validated, immutable engine configuration. Built once from {@link InsightProperties}
 * at startup; at runtime only the weights can be swapped (see {@link RuntimeSettings}).
 *
 * @param subreddits           communities polled every cycle, at most {@value #MAX_SUBREDDITS}
 * @param postsPerSubreddit    listing size requested per community
 * @param minKarma             posts scoring below this are ignored
 * @param evictionWindowDays   completed days below {@code minPosts} before a ticker is dropped
 * @param retentionDays        daily aggregates older than this are trimmed
 * @param minHistoryDays       prior days needed before the volume z-score is trusted
 * @param trendingHalfLifeDays half-life of the decay used to rank trending tickers
 */
public record EngineSettings(
    List<String>     subreddits,
    int              postsPerSubreddit,
    Duration         updateInterval,
    int              minKarma,
    ScoringWeights   weights,
    StageThresholds  thresholds,
    int              evictionWindowDays,
    int              retentionDays,
    int              minHistoryDays,
    double           priorLikelihood,
    double           likelihoodSensitivity,
    Duration         fetchTimeout,
    Duration         cycleTimeout,
    int              maxConcurrentFetches,
    double           trendingHalfLifeDays,
    List<String>     extraSymbols
) {
    public static final int MAX_SUBREDDITS = 5;
    public static final int MIN_POSTS_PER_SUBREDDIT = 30;
    public static final int MAX_POSTS_PER_SUBREDDIT = 100;

    public EngineSettings {
        subreddits = subreddits == null ? List.of() : List.copyOf(subreddits);
        extraSymbols = extraSymbols == null ? List.of() : List.copyOf(extraSymbols);
    }

    public int minPosts() {
        return thresholds.minPosts();
    }

    public EngineSettings withWeights(ScoringWeights newWeights) {
        return new EngineSettings(subreddits, postsPerSubreddit, updateInterval, minKarma, newWeights,
            thresholds, evictionWindowDays, retentionDays, minHistoryDays, priorLikelihood,
            likelihoodSensitivity, fetchTimeout, cycleTimeout, maxConcurrentFetches,
            trendingHalfLifeDays, extraSymbols);
    }

    /**
     * Returns {@code this} when valid; otherwise throws a {@link ConfigValidationException}
     * listing every violation.
     */
    public EngineSettings validated() {
        List<String> v = new ArrayList<>();

        if (subreddits.isEmpty()) v.add("at least one subreddit is required");
        if (subreddits.size() > MAX_SUBREDDITS) {
            v.add("at most " + MAX_SUBREDDITS + " subreddits are allowed but got " + subreddits.size());
        }
        if (subreddits.stream().anyMatch(s -> s == null || !s.matches("[A-Za-z0-9_]{2,21}"))) {
            v.add("subreddit names must be 2-21 letters, digits or underscores");
        }
        if (postsPerSubreddit < MIN_POSTS_PER_SUBREDDIT || postsPerSubreddit > MAX_POSTS_PER_SUBREDDIT) {
            v.add("postsPerSubreddit must be within [" + MIN_POSTS_PER_SUBREDDIT + ", "
                + MAX_POSTS_PER_SUBREDDIT + "] but was " + postsPerSubreddit);
        }
        if (updateInterval == null || updateInterval.compareTo(Duration.ofMinutes(1)) < 0
                || updateInterval.compareTo(Duration.ofHours(24)) > 0) {
            v.add("updateInterval must be between 1 minute and 24 hours but was " + updateInterval);
        }
        if (thresholds != null && (thresholds.minPosts() < 1 || thresholds.minPosts() > 50)) {
            v.add("minPosts must be within [1, 50] but was " + thresholds.minPosts());
        }
        if (minKarma < 0 || minKarma > 10_000) v.add("minKarma must be within [0, 10000] but was " + minKarma);
        if (evictionWindowDays < 1) v.add("evictionWindowDays must be >= 1 but was " + evictionWindowDays);
        if (minHistoryDays < 1 || minHistoryDays > 30) {
            v.add("minHistoryDays must be within [1, 30] but was " + minHistoryDays);
        }
        if (retentionDays < 31 || retentionDays < evictionWindowDays + 1) {
            v.add("retentionDays must cover the 30-day volume baseline and the eviction window but was "
                + retentionDays);
        }
        if (Double.isNaN(priorLikelihood) || priorLikelihood < 0.01 || priorLikelihood > 0.99) {
            v.add("priorLikelihood must be within [0.01, 0.99] but was " + priorLikelihood);
        }
        if (!(likelihoodSensitivity > 0.0)) {
            v.add("likelihoodSensitivity must be > 0 but was " + likelihoodSensitivity);
        }
        if (fetchTimeout == null || fetchTimeout.isZero() || fetchTimeout.isNegative()) {
            v.add("fetchTimeout must be positive");
        }
        if (cycleTimeout == null || fetchTimeout == null || cycleTimeout.compareTo(fetchTimeout) < 0) {
            v.add("cycleTimeout must be at least fetchTimeout");
        }
        if (maxConcurrentFetches < 1 || maxConcurrentFetches > 32) {
            v.add("maxConcurrentFetches must be within [1, 32] but was " + maxConcurrentFetches);
        }
        if (!(trendingHalfLifeDays > 0.0)) v.add("trendingHalfLifeDays must be > 0");

        if (weights == null || thresholds == null) {
            v.add("weights and thresholds are required");
        } else {
            collect(v, weights::validated);
            collect(v, thresholds::validated);
        }

        if (!v.isEmpty()) {
            throw new ConfigValidationException(v);
        }
        return this;
    }

    private static void collect(List<String> violations, Runnable check) {
        try {
            check.run();
        } catch (ConfigValidationException e) {
            violations.addAll(e.getViolations());
        }
    }
}
