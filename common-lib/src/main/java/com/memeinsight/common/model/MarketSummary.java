package com.memeinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Market-wide figures of the last committed cycle. Sentiment distribution counts
 * individual posts: positive above 0.1, negative below -0.1, neutral otherwise.
 */
public record MarketSummary(
    @JsonProperty("totalMentions")        int totalMentions,
    @JsonProperty("averageSentiment")     double averageSentiment,
    @JsonProperty("positivePosts")        int positivePosts,
    @JsonProperty("neutralPosts")         int neutralPosts,
    @JsonProperty("negativePosts")        int negativePosts,
    @JsonProperty("trending")             List<TrendingTicker> trending,
    @JsonProperty("postsProcessed")       int postsProcessed,
    @JsonProperty("postsSkipped")         int postsSkipped,
    @JsonProperty("subredditsProcessed")  List<String> subredditsProcessed,
    @JsonProperty("status")               CycleStatus status,
    @JsonProperty("updatedAt")            Instant updatedAt
) {
    public static MarketSummary pending(Instant now) {
        return new MarketSummary(0, 0.0, 0, 0, 0, List.of(), 0, 0, List.of(), CycleStatus.PENDING, now);
    }
}
