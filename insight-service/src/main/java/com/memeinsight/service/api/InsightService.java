package com.memeinsight.service.api;

import com.memeinsight.common.extraction.SymbolCatalog;
import com.memeinsight.common.model.InsightSnapshot;
import com.memeinsight.common.model.MarketSummary;
import com.memeinsight.common.model.ScoringWeights;
import com.memeinsight.common.model.TickerSnapshot;
import com.memeinsight.marketdata.cache.FetchCache;
import com.memeinsight.marketdata.service.MarketDataService;
import com.memeinsight.service.config.EngineSettings;
import com.memeinsight.service.config.RuntimeSettings;
import com.memeinsight.service.engine.CycleRequest;
import com.memeinsight.service.engine.PollCoordinator;
import com.memeinsight.service.engine.SourceSuspensions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Optional;

/**
 * Operations offered to the presentation layer. Reads are served from the last
 * published snapshot and never wait for a cycle.
 */
public class InsightService {

    private static final Logger log = LoggerFactory.getLogger(InsightService.class);

    private final PollCoordinator coordinator;
    private final MarketDataService marketData;
    private final RuntimeSettings settings;
    private final SourceSuspensions suspensions;

    public InsightService(PollCoordinator coordinator, MarketDataService marketData, RuntimeSettings settings,
                          SourceSuspensions suspensions) {
        this.coordinator = coordinator;
        this.marketData  = marketData;
        this.settings    = settings;
        this.suspensions = suspensions;
    }

    public InsightSnapshot snapshot() {
        return coordinator.latestSnapshot();
    }

    public Optional<TickerSnapshot> ticker(String symbol) {
        return Optional.ofNullable(snapshot().tickers().get(normalize(symbol)));
    }

    public MarketSummary summary() {
        return snapshot().summary();
    }

    /** Runs a full cycle now, or joins the one in progress. */
    public Mono<InsightSnapshot> refreshNow() {
        return coordinator.runCycle(CycleRequest.all());
    }

    /**
     * Re-fetches market data for {@code symbol}, bypassing its cache entries, and re-scores
     * only that ticker. Posts are read as in any cycle.
     */
    public Mono<InsightSnapshot> refreshNow(String symbol) {
        return Mono.defer(() -> {
            String s = normalize(symbol);
            int dropped = marketData.invalidate(s);
            log.info("REFRESH_REQUESTED symbol={} cacheEntriesDropped={}", s, dropped);
            return coordinator.runCycle(CycleRequest.of(s));
        });
    }

    /**
     * Replaces the scoring weights from the next cycle on. Invalid weights throw
     * {@link com.memeinsight.common.exception.ConfigValidationException}; the same weights
     * twice change nothing.
     */
    public ScoringWeights setWeighting(ScoringWeights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("weights are required");
        }
        ScoringWeights before = settings.get().weights();
        EngineSettings updated = settings.updateWeights(weights);
        if (!before.equals(updated.weights())) {
            log.info("WEIGHTS_UPDATED from={} to={}", before, updated.weights());
        }
        return updated.weights();
    }

    /** Drops every cache entry so the next cycle fetches everything fresh. */
    public int forceUpdateCache() {
        return marketData.cache().forceInvalidate(FetchCache.ALL_KEYS);
    }

    /** Cancels a running cycle, then wipes history and tracked tickers. */
    public Mono<InsightSnapshot> clearHistoricalData() {
        return Mono.defer(() -> {
            coordinator.cancelRunningCycle();
            return coordinator.clearHistory();
        });
    }

    /** Lifts a credential suspension once the source has been reconfigured. */
    public boolean resumeSource(String source) {
        boolean resumed = suspensions.resume(source);
        if (resumed) {
            marketData.cache().resetSource(source);
        }
        return resumed;
    }

    private static String normalize(String symbol) {
        String s = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (!SymbolCatalog.isValidSymbol(s)) {
            throw new IllegalArgumentException("invalid ticker symbol: '" + symbol + "'");
        }
        return s;
    }
}
