package com.memeinsight.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * {@code TIME_SERIES_DAILY} payload. Alpha Vantage answers throttling and key problems
 * with HTTP 200 and a {@code Note}, {@code Information} or {@code Error Message} field
 * instead of the series.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageTimeSeriesResponse(
    @JsonProperty("Meta Data")           MetaData metaData,
    @JsonProperty("Time Series (Daily)") Map<String, DailyBar> timeSeriesDaily,
    @JsonProperty("Note")                String note,
    @JsonProperty("Information")         String information,
    @JsonProperty("Error Message")       String errorMessage
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetaData(
        @JsonProperty("2. Symbol")         String symbol,
        @JsonProperty("3. Last Refreshed") String lastRefreshed
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DailyBar(
        @JsonProperty("1. open")   String open,
        @JsonProperty("2. high")   String high,
        @JsonProperty("3. low")    String low,
        @JsonProperty("4. close")  String close,
        @JsonProperty("5. volume") String volume
    ) {}
}
