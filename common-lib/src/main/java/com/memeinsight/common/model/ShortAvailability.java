package com.memeinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Short-availability flag for a ticker. {@code shortInterestPct} is the percentage
 * of float sold short and is {@code null} when the provider has no figure.
 */
public record ShortAvailability(
    @JsonProperty("symbol")           String symbol,
    @JsonProperty("shortable")        boolean shortable,
    @JsonProperty("shortInterestPct") Double shortInterestPct
) {
    public static ShortAvailability unknown(String symbol) {
        return new ShortAvailability(symbol, false, null);
    }
}
