package com.memeinsight.marketdata.client;

import com.memeinsight.common.exception.DataParseException;
import com.memeinsight.common.exception.UpstreamAuthException;
import com.memeinsight.common.exception.UpstreamRateLimitedException;
import com.memeinsight.common.model.PriceBar;
import com.memeinsight.marketdata.model.AlphaVantageTimeSeriesResponse;
import com.memeinsight.marketdata.source.PriceBarSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily bars from Alpha Vantage {@code TIME_SERIES_DAILY} (compact, last 100 sessions).
 */
public class AlphaVantageBarClient implements PriceBarSource {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageBarClient.class);

    public static final String SOURCE = "alpha-vantage";

    private static final Duration THROTTLE_RETRY = Duration.ofMinutes(1);

    private final WebClient webClient;
    private final String apiKey;

    public AlphaVantageBarClient(WebClient alphaVantageWebClient, String apiKey) {
        this.webClient = alphaVantageWebClient;
        this.apiKey    = apiKey;
    }

    @Override
    public String sourceName() {
        return SOURCE;
    }

    @Override
    public Mono<List<PriceBar>> fetchDailyBars(String symbol) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/query")
                .queryParam("function", "TIME_SERIES_DAILY")
                .queryParam("symbol", symbol)
                .queryParam("outputsize", "compact")
                .queryParam("apikey", apiKey)
                .build())
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> UpstreamErrors.fromResponse(SOURCE, response))
            .bodyToMono(AlphaVantageTimeSeriesResponse.class)
            .map(response -> toBars(symbol, response))
            .onErrorMap(e -> UpstreamErrors.translate(SOURCE, e))
            .doOnSuccess(bars -> log.info("Bars fetched. source={} symbol={} count={}",
                SOURCE, symbol, bars == null ? 0 : bars.size()));
    }

    List<PriceBar> toBars(String symbol, AlphaVantageTimeSeriesResponse response) {
        if (response.errorMessage() != null) {
            throw new DataParseException(SOURCE, "rejected symbol " + symbol + ": " + response.errorMessage());
        }
        if (response.note() != null) {
            throw new UpstreamRateLimitedException(SOURCE, response.note(), THROTTLE_RETRY);
        }
        if (response.information() != null) {
            String info = response.information().toLowerCase(Locale.ROOT);
            if (info.contains("invalid") && info.contains("api")) {
                throw new UpstreamAuthException(SOURCE, response.information());
            }
            throw new UpstreamRateLimitedException(SOURCE, response.information(), THROTTLE_RETRY);
        }
        Map<String, AlphaVantageTimeSeriesResponse.DailyBar> series = response.timeSeriesDaily();
        if (series == null || series.isEmpty()) {
            throw new DataParseException(SOURCE, "empty daily series for " + symbol);
        }

        // ISO dates sort chronologically as strings
        TreeMap<String, AlphaVantageTimeSeriesResponse.DailyBar> sorted = new TreeMap<>(series);
        List<PriceBar> bars = new ArrayList<>(sorted.size());
        int skipped = 0;
        for (Map.Entry<String, AlphaVantageTimeSeriesResponse.DailyBar> e : sorted.entrySet()) {
            AlphaVantageTimeSeriesResponse.DailyBar b = e.getValue();
            if (b == null || b.open() == null || b.high() == null || b.low() == null
                    || b.close() == null || b.volume() == null) {
                skipped++;
                continue;
            }
            try {
                bars.add(new PriceBar(symbol, LocalDate.parse(e.getKey()),
                    Double.parseDouble(b.open()), Double.parseDouble(b.high()),
                    Double.parseDouble(b.low()), Double.parseDouble(b.close()),
                    Long.parseLong(b.volume())));
            } catch (DateTimeParseException | NumberFormatException ex) {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped malformed bars. source={} symbol={} skipped={}", SOURCE, symbol, skipped);
        }
        return bars;
    }
}
