package com.memeinsight.service.engine;

import com.memeinsight.service.store.MentionTally;

import java.util.List;
import java.util.Map;

/**
 * Read-only result of digesting one cycle's posts, computed before any state changes.
 *
 * @param newPostIds      posts counted for the first time this cycle
 * @param tallies         per-ticker mentions found in those posts, in first-seen order
 * @param postsSkipped    posts dropped for low karma
 * @param marketSymbols   tickers whose market data is fetched this cycle
 */
public record CyclePlan(
    CycleRequest              request,
    List<String>              newPostIds,
    Map<String, MentionTally> tallies,
    int                       postsProcessed,
    int                       postsSkipped,
    int                       positivePosts,
    int                       neutralPosts,
    int                       negativePosts,
    double                    sentimentSum,
    int                       sentimentCount,
    List<String>              subredditsProcessed,
    int                       subredditsFailed,
    boolean                   postsTimedOut,
    List<String>              marketSymbols
) {
    public int totalMentions() {
        return tallies.values().stream().mapToInt(MentionTally::mentions).sum();
    }

    public double averageSentiment() {
        return sentimentCount == 0 ? 0.0 : sentimentSum / sentimentCount;
    }
}
