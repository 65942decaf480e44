package com.memeinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Everything the presentation layer may read, published atomically at the end of
 * a cycle. Tickers are keyed by symbol in descending impact order.
 */
public record InsightSnapshot(
    @JsonProperty("tickers")          Map<String, TickerSnapshot> tickers,
    @JsonProperty("summary")          MarketSummary summary,
    @JsonProperty("suspendedSources") Set<String> suspendedSources,
    @JsonProperty("committedAt")      Instant committedAt,
    @JsonProperty("cycle")            long cycle
) {
    public static InsightSnapshot empty(Instant now) {
        return new InsightSnapshot(Map.of(), MarketSummary.pending(now), Set.of(), now, 0L);
    }
}
