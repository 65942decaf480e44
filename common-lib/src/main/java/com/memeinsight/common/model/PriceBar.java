package com.memeinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record PriceBar(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("date")   LocalDate date,
    @JsonProperty("open")   double open,
    @JsonProperty("high")   double high,
    @JsonProperty("low")    double low,
    @JsonProperty("close")  double close,
    @JsonProperty("volume") long volume
) {}
