package com.memeinsight.service.engine;

import com.memeinsight.common.exception.DataParseException;
import com.memeinsight.common.exception.UpstreamAuthException;
import com.memeinsight.common.exception.UpstreamUnavailableException;
import com.memeinsight.common.extraction.SymbolCatalog;
import com.memeinsight.common.extraction.TickerExtractor;
import com.memeinsight.common.model.CycleStatus;
import com.memeinsight.common.model.InsightSnapshot;
import com.memeinsight.common.model.MarketSummary;
import com.memeinsight.common.model.ScoringWeights;
import com.memeinsight.common.model.Stage;
import com.memeinsight.common.model.TickerSnapshot;
import com.memeinsight.common.model.TrendingTicker;
import com.memeinsight.common.stage.StageThresholds;
import com.memeinsight.marketdata.cache.CacheKey;
import com.memeinsight.marketdata.cache.CacheTtls;
import com.memeinsight.marketdata.cache.FetchCache;
import com.memeinsight.marketdata.cache.FetchPolicy;
import com.memeinsight.marketdata.service.MarketDataService;
import com.memeinsight.service.api.InsightService;
import com.memeinsight.service.config.EngineSettings;
import com.memeinsight.service.config.RuntimeSettings;
import com.memeinsight.service.logger.CycleFlowLogger;
import com.memeinsight.service.registry.TickerRegistry;
import com.memeinsight.service.store.HistoricalStore;
import com.memeinsight.service.support.FakeUpstreams;
import com.memeinsight.service.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.memeinsight.service.support.FakeUpstreams.bars;
import static com.memeinsight.service.support.FakeUpstreams.posts;
import static org.junit.jupiter.api.Assertions.*;

class PollCoordinatorTest {

    private static final Instant START = Instant.parse("2024-03-04T15:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);
    private static final Duration BLOCK = Duration.ofSeconds(5);

    private static final String WSB = "wallstreetbets";
    private static final String STOCKS = "stocks";

    private MutableClock clock;
    private FakeUpstreams.Posts postSource;
    private FakeUpstreams.Bars barSource;
    private FakeUpstreams.Shorts shortSource;
    private FakeUpstreams.RecordingAlertSink alerts;
    private HistoricalStore store;
    private FetchCache cache;
    private TickerRegistry registry;
    private RuntimeSettings settings;
    private PollCoordinator coordinator;
    private InsightService service;

    @BeforeEach
    void setUp() {
        build(settings(Duration.ofSeconds(2), Duration.ofSeconds(4)));
    }

    private void build(EngineSettings engineSettings) {
        clock       = new MutableClock(START);
        postSource  = new FakeUpstreams.Posts();
        barSource   = new FakeUpstreams.Bars();
        shortSource = new FakeUpstreams.Shorts();
        alerts      = new FakeUpstreams.RecordingAlertSink();
        store       = new HistoricalStore();
        registry    = new TickerRegistry();
        settings    = new RuntimeSettings(engineSettings);

        cache = new FetchCache(clock,
            new FetchPolicy(Duration.ofSeconds(5), Duration.ofSeconds(30), Duration.ofMinutes(15), Map.of()));
        MarketDataService marketData = new MarketDataService(cache,
            new CacheTtls(Duration.ZERO, Duration.ZERO, Duration.ZERO), postSource, barSource, shortSource);
        SourceSuspensions suspensions = new SourceSuspensions(alerts, clock);
        SymbolCatalog catalog = SymbolCatalog.defaults();

        coordinator = new PollCoordinator(marketData, TickerExtractor.from(catalog), catalog, store, registry,
            settings, suspensions, new CycleFlowLogger(), clock, Schedulers.immediate());
        service = new InsightService(coordinator, marketData, settings, suspensions);
    }

    private static EngineSettings settings(Duration fetchTimeout, Duration cycleTimeout) {
        return settings(fetchTimeout, cycleTimeout, 4);
    }

    private static EngineSettings settings(Duration fetchTimeout, Duration cycleTimeout, int concurrency) {
        return new EngineSettings(List.of(WSB, STOCKS), 100, Duration.ofMinutes(5), 100,
            ScoringWeights.DEFAULTS, StageThresholds.DEFAULTS, 7, 45, 7, 0.5, 2.0,
            fetchTimeout, cycleTimeout, concurrency, 3.0, List.of());
    }

    private InsightSnapshot cycle() {
        return coordinator.runCycle(CycleRequest.all()).block(BLOCK);
    }

    private InsightSnapshot nextCycle() {
        clock.advance(Duration.ofMinutes(5));
        return cycle();
    }

    private void gmeQualifies() {
        postSource.add(WSB, posts("gme", WSB, "$GME to the moon, buy calls", 5, 500));
    }

    // ── creation ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ticker creation")
    class Creation {

        @Test
        @DisplayName("a ticker is created once today's mentions reach minPosts")
        void createdAtMinPosts() {
            postSource.add(WSB, posts("a", WSB, "$GME moon", 4, 500));
            assertFalse(cycle().tickers().containsKey("GME"));

            postSource.add(STOCKS, posts("b", STOCKS, "$GME moon", 1, 500));
            TickerSnapshot gme = nextCycle().tickers().get("GME");

            assertNotNull(gme);
            assertEquals("GameStop Corp", gme.displayName());
            assertEquals(5, gme.mentionCount());
            assertEquals(Stage.START, gme.stage());
            assertEquals(0, gme.daysActive());
        }

        @Test
        @DisplayName("posts under minKarma are skipped and counted as skipped")
        void lowKarmaSkipped() {
            postSource.add(WSB, posts("low", WSB, "$GME moon", 5, 10));

            InsightSnapshot snapshot = cycle();

            assertTrue(snapshot.tickers().isEmpty());
            assertEquals(5, snapshot.summary().postsSkipped());
            assertEquals(0, snapshot.summary().postsProcessed());
        }

        @Test
        @DisplayName("re-delivered and cross-posted posts are counted once")
        void noDoubleCounting() {
            gmeQualifies();
            postSource.add(STOCKS, posts("gme", STOCKS, "$GME to the moon, buy calls", 5, 500));

            assertEquals(5, cycle().tickers().get("GME").mentionCount());
            assertEquals(5, nextCycle().tickers().get("GME").mentionCount());

            postSource.add(WSB, posts("late", WSB, "$GME again", 1, 500));
            assertEquals(6, nextCycle().tickers().get("GME").mentionCount());
        }
    }

    // ── scoring ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("scoring")
    class Scoring {

        @BeforeEach
        void gmeWithBars() {
            gmeQualifies();
            barSource.series.put("GME", bars("GME", DAY, 10.0, 10.5, 11.0));
        }

        @Test
        @DisplayName("published scores stay within their ranges")
        void boundedScores() {
            for (int i = 0; i < 5; i++) {
                TickerSnapshot gme = (i == 0 ? cycle() : nextCycle()).tickers().get("GME");
                assertTrue(gme.impactScore() >= 0.0 && gme.impactScore() <= 100.0);
                assertTrue(gme.memeLikelihood() >= 0.01 && gme.memeLikelihood() <= 0.99);
            }
        }

        @Test
        @DisplayName("setWeighting changes subsequent scores and re-applying it changes nothing")
        void weightingChangesScores() {
            // sentiment 100, momentum 100, short interest 0, volume unavailable
            assertEquals(83.333, cycle().tickers().get("GME").impactScore(), 1e-3);

            ScoringWeights custom = new ScoringWeights(0.5, 0.3, 0.1, 0.1);
            service.setWeighting(custom);
            EngineSettings applied = settings.get();
            service.setWeighting(custom);

            assertSame(applied, settings.get());
            assertEquals(80.0, nextCycle().tickers().get("GME").impactScore(), 1e-6);
            assertEquals(80.0, nextCycle().tickers().get("GME").impactScore(), 1e-6);
        }

        @Test
        @DisplayName("price since start is measured from the first close seen after creation")
        void priceSinceStart() {
            assertEquals(0.0, cycle().tickers().get("GME").priceSinceStartPct(), 1e-9);

            barSource.series.put("GME", bars("GME", DAY.plusDays(1), 10.5, 11.0, 12.1));

            assertEquals(10.0, nextCycle().tickers().get("GME").priceSinceStartPct(), 1e-9);
        }
    }

    // ── eviction ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("eviction")
    class Eviction {

        @Test
        @DisplayName("a ticker quiet for evictionWindowDays completed days is evicted")
        void evictedAfterWindow() {
            gmeQualifies();
            assertTrue(cycle().tickers().containsKey("GME"));

            clock.advance(Duration.ofDays(7));
            assertTrue(cycle().tickers().containsKey("GME"));

            clock.advance(Duration.ofDays(1));
            assertFalse(cycle().tickers().containsKey("GME"));
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("an evicted ticker leaves nothing behind in the fetch cache")
        void evictionDropsCacheEntries() {
            gmeQualifies();
            barSource.series.put("GME", bars("GME", DAY, 20.0));
            cycle();
            assertTrue(cache.contains(CacheKey.of("alpha-vantage", "GME", "daily")));

            clock.advance(Duration.ofDays(8));
            cycle();

            assertFalse(cache.contains(CacheKey.of("alpha-vantage", "GME", "daily")));
            assertFalse(cache.contains(CacheKey.of("short-availability", "GME", "current")));
        }

        @Test
        @DisplayName("a re-created ticker starts over")
        void recreatedFresh() {
            gmeQualifies();
            cycle();
            clock.advance(Duration.ofDays(8));
            cycle();

            postSource.add(WSB, posts("back", WSB, "$GME is back", 5, 500));
            clock.advance(Duration.ofHours(1));
            TickerSnapshot gme = cycle().tickers().get("GME");

            assertNotNull(gme);
            assertEquals(Stage.START, gme.stage());
            assertEquals(0, gme.daysActive());
            assertFalse(gme.declineFlag());
        }
    }

    // ── failures ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("upstream failures")
    class Failures {

        @Test
        @DisplayName("rejected credentials suspend the source, alert once, and resume on request")
        void authSuspension() {
            gmeQualifies();
            postSource.failures.put(STOCKS, new UpstreamAuthException("reddit", "HTTP 401"));

            InsightSnapshot first = cycle();
            assertTrue(first.suspendedSources().contains("reddit"));
            assertNotEquals(CycleStatus.SUCCESS, first.summary().status());

            InsightSnapshot second = nextCycle();
            assertEquals(CycleStatus.FAILED, second.summary().status());
            assertEquals(1, alerts.alerts.size());
            assertEquals("reddit", alerts.alerts.get(0).source());

            postSource.failures.clear();
            assertTrue(service.resumeSource("reddit"));

            InsightSnapshot resumed = nextCycle();
            assertEquals(CycleStatus.SUCCESS, resumed.summary().status());
            assertTrue(resumed.suspendedSources().isEmpty());
            assertTrue(resumed.tickers().containsKey("GME"));
        }

        @Test
        @DisplayName("a failing price source degrades only the ticker it failed for")
        void priceFailureIsLocal() {
            build(settings(Duration.ofSeconds(2), Duration.ofSeconds(4), 1));
            postSource.add(WSB, posts("amc", WSB, "$AMC squeeze", 5, 500));
            gmeQualifies();
            barSource.series.put("AMC", bars("AMC", DAY, 5.0, 5.0, 5.5));
            barSource.failures.put("GME", new UpstreamUnavailableException("alpha-vantage", "HTTP 503"));

            InsightSnapshot snapshot = cycle();

            assertEquals(CycleStatus.PARTIAL, snapshot.summary().status());
            assertEquals(50.0, snapshot.tickers().get("GME").momentumScore(), 1e-9);
            assertEquals(100.0, snapshot.tickers().get("AMC").momentumScore(), 1e-9);
        }

        @Test
        @DisplayName("an unknown symbol at the price source does not hold back other tickers")
        void unknownSymbolDoesNotCoolDownSource() {
            postSource.add(WSB, posts("amc", WSB, "$AMC squeeze", 5, 500));
            gmeQualifies();
            barSource.series.put("AMC", bars("AMC", DAY, 5.0, 5.0, 5.5));
            barSource.failures.put("GME", new DataParseException("alpha-vantage", "no series for GME"));

            InsightSnapshot first = cycle();
            assertEquals(100.0, first.tickers().get("AMC").momentumScore(), 1e-9);

            InsightSnapshot second = nextCycle();
            assertEquals(CycleStatus.PARTIAL, second.summary().status());
            assertEquals(100.0, second.tickers().get("AMC").momentumScore(), 1e-9);
            assertEquals(2, barSource.callsFor("AMC"));
            assertEquals(2, barSource.callsFor("GME"));
        }

        @Test
        @DisplayName("every subreddit failing with nothing cached is a FAILED cycle")
        void allSubredditsFail() {
            postSource.failures.put(WSB, new UpstreamUnavailableException("reddit", "HTTP 502"));
            postSource.failures.put(STOCKS, new UpstreamUnavailableException("reddit", "HTTP 502"));

            MarketSummary summary = cycle().summary();

            assertEquals(CycleStatus.FAILED, summary.status());
            assertTrue(summary.subredditsProcessed().isEmpty());
        }

        @Test
        @DisplayName("the cycle deadline commits what arrived and reports TIMEOUT")
        void cycleTimeout() {
            build(settings(Duration.ofMillis(100), Duration.ofMillis(300)));
            gmeQualifies();
            postSource.hanging.add(STOCKS);

            InsightSnapshot snapshot = cycle();

            assertEquals(CycleStatus.TIMEOUT, snapshot.summary().status());
            assertEquals(List.of(WSB), snapshot.summary().subredditsProcessed());
            assertTrue(snapshot.tickers().containsKey("GME"));
        }
    }

    // ── control ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("cycle control")
    class Control {

        @Test
        @DisplayName("cancelling during the fetch phase keeps the last snapshot")
        void cancelKeepsSnapshot() {
            gmeQualifies();
            InsightSnapshot first = cycle();
            postSource.hanging.add(WSB);
            postSource.hanging.add(STOCKS);
            clock.advance(Duration.ofMinutes(5));

            StepVerifier.create(coordinator.runCycle(CycleRequest.all()))
                .then(() -> assertTrue(coordinator.cancelRunningCycle()))
                .expectNext(first)
                .expectComplete()
                .verify(BLOCK);

            assertSame(first, coordinator.latestSnapshot());
        }

        @Test
        @DisplayName("a request during a running cycle joins it instead of starting another")
        void concurrentRequestsJoin() throws Exception {
            gmeQualifies();
            InsightSnapshot first = cycle();
            postSource.hanging.add(WSB);
            postSource.hanging.add(STOCKS);
            clock.advance(Duration.ofMinutes(5));
            CompletableFuture<InsightSnapshot> joined = new CompletableFuture<>();

            StepVerifier.create(coordinator.runCycle(CycleRequest.all()))
                .then(() -> coordinator.runCycle(CycleRequest.of("GME")).subscribe(joined::complete))
                .then(coordinator::cancelRunningCycle)
                .expectNext(first)
                .expectComplete()
                .verify(BLOCK);

            assertSame(first, joined.get(1, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("a single-ticker refresh fetches market data for that ticker only")
        void singleTickerRefresh() {
            gmeQualifies();
            postSource.add(WSB, posts("amc", WSB, "$AMC squeeze", 5, 500));
            InsightSnapshot first = cycle();
            assertEquals(1, barSource.callsFor("GME"));
            assertEquals(1, barSource.callsFor("AMC"));

            InsightSnapshot refreshed = service.refreshNow("gme").block(BLOCK);

            assertEquals(2, barSource.callsFor("GME"));
            assertEquals(1, barSource.callsFor("AMC"));
            assertEquals(first.tickers().get("AMC"), refreshed.tickers().get("AMC"));
        }

        @Test
        @DisplayName("clearing history drops every tracked ticker")
        void clearHistory() {
            gmeQualifies();
            assertFalse(cycle().tickers().isEmpty());

            InsightSnapshot cleared = service.clearHistoricalData().block(BLOCK);

            assertTrue(cleared.tickers().isEmpty());
            assertEquals(0, registry.size());
            assertTrue(store.symbols().isEmpty());
        }
    }

    // ── summary ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("market summary reports distribution, averages and trending tickers")
    void marketSummary() {
        gmeQualifies();
        postSource.add(STOCKS, posts("bear", STOCKS, "$AMC crash, sell now", 2, 500));
        postSource.add(STOCKS, List.of(FakeUpstreams.post("flat", STOCKS, "$AMC earnings today", 500)));

        MarketSummary summary = cycle().summary();

        assertEquals(CycleStatus.SUCCESS, summary.status());
        assertEquals(8, summary.postsProcessed());
        assertEquals(8, summary.totalMentions());
        assertEquals(5, summary.positivePosts());
        assertEquals(2, summary.negativePosts());
        assertEquals(1, summary.neutralPosts());
        assertEquals(3.0 / 7.0, summary.averageSentiment(), 1e-9);
        assertEquals(List.of("GME", "AMC"), summary.trending().stream().map(TrendingTicker::symbol).toList());
        assertEquals(5, summary.trending().get(0).mentions());
    }
}
