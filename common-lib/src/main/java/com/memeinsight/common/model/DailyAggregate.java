package com.memeinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Mention and market figures for one ticker on one calendar day.
 *
 * <p>Same-day updates are merged additively via {@link #merge}; market fields
 * (close, volume, short interest) are last-write-wins and keep their previous value
 * when the update carries none.
 */
public record DailyAggregate(
    @JsonProperty("symbol")           String symbol,
    @JsonProperty("date")             LocalDate date,
    @JsonProperty("mentionCount")     int mentionCount,
    @JsonProperty("sentimentSum")     double sentimentSum,
    @JsonProperty("sentimentCount")   int sentimentCount,
    @JsonProperty("closingPrice")     Double closingPrice,
    @JsonProperty("volume")           Long volume,
    @JsonProperty("shortInterestPct") Double shortInterestPct
) {

    public static DailyAggregate empty(String symbol, LocalDate date) {
        return new DailyAggregate(symbol, date, 0, 0.0, 0, null, null, null);
    }

    public static DailyAggregate ofMentions(String symbol, LocalDate date,
                                            int mentionCount, double sentimentSum, int sentimentCount) {
        return new DailyAggregate(symbol, date, mentionCount, sentimentSum, sentimentCount, null, null, null);
    }

    /** Mean sentiment in [-1, 1]; 0 when nothing was scored. */
    public double sentimentMean() {
        if (sentimentCount == 0) return 0.0;
        return Math.max(-1.0, Math.min(1.0, sentimentSum / sentimentCount));
    }

    public DailyAggregate merge(DailyAggregate update) {
        if (!symbol.equals(update.symbol) || !date.equals(update.date)) {
            throw new IllegalArgumentException("cannot merge " + update.symbol + "@" + update.date
                + " into " + symbol + "@" + date);
        }
        return new DailyAggregate(
            symbol, date,
            mentionCount + update.mentionCount,
            sentimentSum + update.sentimentSum,
            sentimentCount + update.sentimentCount,
            update.closingPrice != null ? update.closingPrice : closingPrice,
            update.volume != null ? update.volume : volume,
            update.shortInterestPct != null ? update.shortInterestPct : shortInterestPct);
    }

    public DailyAggregate withMarketData(Double close, Long barVolume, Double shortPct) {
        return new DailyAggregate(symbol, date, mentionCount, sentimentSum, sentimentCount,
            close != null ? close : closingPrice,
            barVolume != null ? barVolume : volume,
            shortPct != null ? shortPct : shortInterestPct);
    }
}
