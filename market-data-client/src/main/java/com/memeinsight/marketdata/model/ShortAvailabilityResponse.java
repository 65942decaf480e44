package com.memeinsight.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ShortAvailabilityResponse(
    @JsonProperty("symbol")           String symbol,
    @JsonProperty("shortable")        Boolean shortable,
    @JsonProperty("shortInterestPct") Double shortInterestPct
) {}
