package com.memeinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable per-ticker view handed to the presentation layer. Sub-scores are on
 * the [0, 100] scale; {@code shortInterest} is the raw percentage of float shorted.
 */
public record TickerSnapshot(
    @JsonProperty("symbol")             String symbol,
    @JsonProperty("displayName")        String displayName,
    @JsonProperty("impactScore")        double impactScore,
    @JsonProperty("memeLikelihood")     double memeLikelihood,
    @JsonProperty("stage")              Stage stage,
    @JsonProperty("shortable")          boolean shortable,
    @JsonProperty("declineFlag")        boolean declineFlag,
    @JsonProperty("daysActive")         int daysActive,
    @JsonProperty("volumeScore")        double volumeScore,
    @JsonProperty("sentimentScore")     double sentimentScore,
    @JsonProperty("momentumScore")      double momentumScore,
    @JsonProperty("shortInterest")      double shortInterest,
    @JsonProperty("mentionCount")       int mentionCount,
    @JsonProperty("priceSinceStartPct") Double priceSinceStartPct,
    @JsonProperty("lastSeen")           Instant lastSeen
) {}
