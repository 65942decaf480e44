package com.memeinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrendingTicker(
    @JsonProperty("symbol")           String symbol,
    @JsonProperty("mentions")         int mentions,
    @JsonProperty("decayedMentions")  double decayedMentions
) {}
