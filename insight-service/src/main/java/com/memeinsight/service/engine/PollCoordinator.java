package com.memeinsight.service.engine;

import com.memeinsight.common.exception.DataParseException;
import com.memeinsight.common.exception.UpstreamAuthException;
import com.memeinsight.common.exception.UpstreamRateLimitedException;
import com.memeinsight.common.exception.UpstreamTimeoutException;
import com.memeinsight.common.extraction.SymbolCatalog;
import com.memeinsight.common.extraction.TickerExtractor;
import com.memeinsight.common.likelihood.LikelihoodBaselines;
import com.memeinsight.common.likelihood.MemeLikelihoodEstimator;
import com.memeinsight.common.model.CycleStatus;
import com.memeinsight.common.model.DailyAggregate;
import com.memeinsight.common.model.InsightSnapshot;
import com.memeinsight.common.model.MarketSummary;
import com.memeinsight.common.model.Post;
import com.memeinsight.common.model.PriceBar;
import com.memeinsight.common.model.ShortAvailability;
import com.memeinsight.common.model.SubScore;
import com.memeinsight.common.model.SubScores;
import com.memeinsight.common.model.TickerSnapshot;
import com.memeinsight.common.model.TrendingTicker;
import com.memeinsight.common.scoring.CompositeScorer;
import com.memeinsight.common.sentiment.SentimentLexicon;
import com.memeinsight.common.signal.SignalCollectors;
import com.memeinsight.common.stage.StageClassifier;
import com.memeinsight.common.stage.StageInput;
import com.memeinsight.common.stage.StageState;
import com.memeinsight.common.trace.CycleTrace;
import com.memeinsight.marketdata.service.MarketDataService;
import com.memeinsight.service.config.EngineSettings;
import com.memeinsight.service.config.RuntimeSettings;
import com.memeinsight.service.logger.CycleFlowLogger;
import com.memeinsight.service.registry.TickerRecord;
import com.memeinsight.service.registry.TickerRegistry;
import com.memeinsight.service.store.HistoricalStore;
import com.memeinsight.service.store.MentionTally;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs poll cycles: fetch posts, digest them, fetch market data, commit, publish.
 *
 * <h3>Cycle pipeline</h3>
 * <pre>
 *   posts per subreddit (parallel, bounded)      ─┐ fetch phase: no state is touched,
 *   → digest into a {@link CyclePlan} (read-only) │ cancellable, cut off at the cycle
 *   → bars + short availability per ticker        ─┘ deadline
 *   → commit on the single-thread commit scheduler
 *       store update → create / score / classify / evict → summary → snapshot
 * </pre>
 *
 * <p>The {@link HistoricalStore} and {@link TickerRegistry} are touched only on
 * {@code commitScheduler}. Readers only ever see the last published {@link InsightSnapshot}.
 *
 * <p>At most one cycle runs at a time; a request arriving while one runs joins it.
 * Per-ticker or per-subreddit failures degrade that item and are counted in
 * {@link CycleStats}; only credential rejections suspend a source.
 */
public class PollCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PollCoordinator.class);

    static final double POSITIVE_POST = 0.1;
    static final double NEGATIVE_POST = -0.1;
    static final double TRENDING_MIN_DECAYED = 2.0;
    static final int TRENDING_LIMIT = 15;

    private static final Duration MIN_WINDOW = Duration.ofMillis(1);

    private final MarketDataService marketData;
    private final TickerExtractor extractor;
    private final SymbolCatalog catalog;
    private final HistoricalStore store;
    private final TickerRegistry registry;
    private final RuntimeSettings settings;
    private final SourceSuspensions suspensions;
    private final CycleFlowLogger flowLogger;
    private final Clock clock;
    private final Scheduler commitScheduler;

    private final AtomicReference<InsightSnapshot> latest;
    private final AtomicReference<RunningCycle> running = new AtomicReference<>();
    private final AtomicLong cycles = new AtomicLong();

    public PollCoordinator(MarketDataService marketData, TickerExtractor extractor, SymbolCatalog catalog,
                           HistoricalStore store, TickerRegistry registry, RuntimeSettings settings,
                           SourceSuspensions suspensions, CycleFlowLogger flowLogger, Clock clock,
                           Scheduler commitScheduler) {
        this.marketData      = marketData;
        this.extractor       = extractor;
        this.catalog         = catalog;
        this.store           = store;
        this.registry        = registry;
        this.settings        = settings;
        this.suspensions     = suspensions;
        this.flowLogger      = flowLogger;
        this.clock           = clock;
        this.commitScheduler = commitScheduler;
        this.latest          = new AtomicReference<>(InsightSnapshot.empty(clock.instant()));
    }

    // ── public surface ──────────────────────────────────────────────────────

    public InsightSnapshot latestSnapshot() {
        return latest.get();
    }

    public boolean isCycleRunning() {
        return running.get() != null;
    }

    /**
     * Runs one cycle for {@code request}, or joins the cycle already in progress. Emits the
     * snapshot the cycle published; a cancelled cycle emits the previous snapshot unchanged.
     */
    public Mono<InsightSnapshot> runCycle(CycleRequest request) {
        return Mono.defer(() -> {
            RunningCycle current = running.get();
            if (current != null) {
                log.info("CYCLE_JOINED requested={} running={} traceId={}",
                    describe(request), describe(current.request()), current.traceId());
                return current.result();
            }
            String traceId = UUID.randomUUID().toString();
            Sinks.One<Boolean> cancel = Sinks.one();
            AtomicReference<RunningCycle> self = new AtomicReference<>();
            Mono<InsightSnapshot> result = CycleTrace
                .bind(execute(request, cancel, traceId), traceId, describe(request))
                .doFinally(signal -> running.compareAndSet(self.get(), null))
                .cache();
            RunningCycle cycle = new RunningCycle(request, traceId, cancel, result);
            self.set(cycle);
            RunningCycle existing = running.compareAndExchange(null, cycle);
            return existing != null ? existing.result() : result;
        });
    }

    /** Aborts the fetch phase of the running cycle. Returns false when none is running. */
    public boolean cancelRunningCycle() {
        RunningCycle current = running.get();
        if (current == null) {
            return false;
        }
        current.cancel().tryEmitValue(Boolean.TRUE);
        log.info("CYCLE_CANCEL_REQUESTED traceId={}", current.traceId());
        return true;
    }

    /** Wipes the historical store and the registry, then publishes an empty ticker map. */
    public Mono<InsightSnapshot> clearHistory() {
        return Mono.fromCallable(() -> {
                store.clear();
                registry.clear();
                InsightSnapshot previous = latest.get();
                InsightSnapshot cleared = new InsightSnapshot(Map.of(), previous.summary(),
                    suspensions.snapshot(), clock.instant(), previous.cycle());
                latest.set(cleared);
                log.info("REGISTRY_CLEARED cycle={}", previous.cycle());
                return cleared;
            })
            .subscribeOn(commitScheduler);
    }

    // ── cycle ───────────────────────────────────────────────────────────────

    private Mono<InsightSnapshot> execute(CycleRequest request, Sinks.One<Boolean> cancel, String traceId) {
        return Mono.defer(() -> {
            EngineSettings s = settings.get();
            CycleStats stats = new CycleStats();
            Instant deadline = clock.instant().plus(s.cycleTimeout());
            flowLogger.logWithTraceId(CycleFlowLogger.CYCLE_STARTED, traceId);

            return fetchPosts(s, stats, deadline, traceId)
                .doOnEach(flowLogger.stage(CycleFlowLogger.POSTS_FETCHED))
                .publishOn(commitScheduler)
                .map(batches -> plan(request, batches, s))
                .doOnEach(flowLogger.stage(CycleFlowLogger.POSTS_DIGESTED))
                .flatMap(plan -> fetchMarketData(plan.marketSymbols(), s, stats, deadline, traceId)
                    .doOnEach(flowLogger.stage(CycleFlowLogger.MARKET_DATA_FETCHED))
                    .map(market -> new FetchedCycle(plan, market)))
                .takeUntilOther(cancel.asMono())
                .publishOn(commitScheduler)
                .map(fetched -> commit(fetched.plan(), fetched.market(), s, stats, traceId))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    flowLogger.logWithTraceId(CycleFlowLogger.CYCLE_CANCELLED, traceId);
                    return latest.get();
                }));
        });
    }

    // ── fetch phase ─────────────────────────────────────────────────────────

    private Mono<List<SubredditBatch>> fetchPosts(EngineSettings s, CycleStats stats, Instant deadline,
                                                  String traceId) {
        String source = marketData.postSourceName();
        return Flux.fromIterable(s.subreddits())
            .flatMap(sub -> Mono.defer(() -> {
                    if (suspensions.isSuspended(source)) {
                        stats.skippedSuspended();
                        log.debug("FETCH_SKIPPED_SUSPENDED source={} subject={}", source, sub);
                        return Mono.just(SubredditBatch.failed(sub));
                    }
                    return marketData.posts(sub, s.postsPerSubreddit())
                        .subscribeOn(Schedulers.boundedElastic())
                        .map(posts -> new SubredditBatch(sub, posts, true))
                        .defaultIfEmpty(new SubredditBatch(sub, List.of(), true))
                        .onErrorResume(e -> Mono.just(degrade(source, sub, e, stats, traceId,
                            SubredditBatch.failed(sub))));
                }),
                s.maxConcurrentFetches())
            .take(remaining(deadline))
            .collectList();
    }

    private Mono<Map<String, TickerMarketData>> fetchMarketData(List<String> symbols, EngineSettings s,
                                                                 CycleStats stats, Instant deadline,
                                                                 String traceId) {
        if (symbols.isEmpty()) {
            return Mono.just(Map.of());
        }
        return Flux.fromIterable(symbols)
            .flatMap(symbol -> Mono.zip(
                        optional(fetchOrSkip(marketData.priceBarSourceName(), symbol,
                            () -> marketData.dailyBars(symbol), stats, traceId)),
                        optional(fetchOrSkip(marketData.shortAvailabilitySourceName(), symbol,
                            () -> marketData.shortAvailability(symbol), stats, traceId)))
                    .map(t -> new TickerMarketData(symbol, t.getT1().orElse(null), t.getT2().orElse(null))),
                s.maxConcurrentFetches())
            .take(remaining(deadline))
            .collectMap(TickerMarketData::symbol, md -> md, LinkedHashMap::new);
    }

    private <T> Mono<T> fetchOrSkip(String source, String symbol, Supplier<Mono<T>> fetch,
                                    CycleStats stats, String traceId) {
        return Mono.defer(() -> {
            if (suspensions.isSuspended(source)) {
                stats.skippedSuspended();
                log.debug("FETCH_SKIPPED_SUSPENDED source={} subject={}", source, symbol);
                return Mono.<T>empty();
            }
            return fetch.get()
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    degrade(source, symbol, e, stats, traceId, null);
                    return Mono.empty();
                });
        });
    }

    private static <T> Mono<Optional<T>> optional(Mono<T> mono) {
        return mono.map(Optional::of).defaultIfEmpty(Optional.empty());
    }

    private <T> T degrade(String source, String subject, Throwable e, CycleStats stats, String traceId,
                          T fallback) {
        if (e instanceof UpstreamAuthException) {
            stats.authFailure();
            suspensions.suspend(source, e.getMessage(), traceId);
            return fallback;
        }
        if (e instanceof UpstreamRateLimitedException) {
            stats.rateLimited();
        } else if (e instanceof UpstreamTimeoutException) {
            stats.timeout();
        } else if (e instanceof DataParseException) {
            stats.parseFailure();
        } else {
            stats.fetchFailure();
        }
        CycleTrace.log(traceId, source, () ->
            log.warn("FETCH_DEGRADED source={} subject={} error={} reason={}",
                source, subject, e.getClass().getSimpleName(), e.getMessage()));
        return fallback;
    }

    private Duration remaining(Instant deadline) {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.compareTo(MIN_WINDOW) < 0 ? MIN_WINDOW : left;
    }

    // ── digest (read-only, on the commit scheduler) ─────────────────────────

    CyclePlan plan(CycleRequest request, List<SubredditBatch> batches, EngineSettings s) {
        LocalDate today = today(clock.instant());
        Set<String> seenThisCycle = new HashSet<>();
        List<String> newPostIds = new ArrayList<>();
        Map<String, MentionTally> tallies = new LinkedHashMap<>();
        List<String> subredditsProcessed = new ArrayList<>();
        int processed = 0, skipped = 0, positive = 0, neutral = 0, negative = 0, failed = 0;
        double sentimentSum = 0.0;
        int sentimentCount = 0;

        for (SubredditBatch batch : batches) {
            if (!batch.ok()) {
                failed++;
                continue;
            }
            subredditsProcessed.add(batch.subreddit());
            for (Post post : batch.posts()) {
                if (post.id() == null || store.isCounted(post.id()) || !seenThisCycle.add(post.id())) {
                    continue;
                }
                if (post.score() < s.minKarma()) {
                    skipped++;
                    continue;
                }
                processed++;
                newPostIds.add(post.id());

                String text = post.fullText();
                OptionalDouble polarity = SentimentLexicon.polarity(text);
                final boolean scored = polarity.isPresent();
                final double p = polarity.orElse(0.0);
                if (scored) {
                    sentimentSum += p;
                    sentimentCount++;
                }
                if (p > POSITIVE_POST) positive++;
                else if (p < NEGATIVE_POST) negative++;
                else neutral++;

                for (String symbol : extractor.extract(text)) {
                    tallies.merge(symbol, MentionTally.EMPTY.add(p, scored), (a, b) -> a.add(p, scored));
                }
            }
        }

        boolean timedOut = batches.size() < s.subreddits().size();
        List<String> marketSymbols = request.isFull()
            ? marketSymbols(tallies, today, s)
            : List.of(request.symbol());

        log.debug("CYCLE_PLANNED newPosts={} skipped={} tickers={} marketSymbols={}",
            processed, skipped, tallies.size(), marketSymbols.size());
        return new CyclePlan(request, newPostIds, tallies, processed, skipped, positive, neutral, negative,
            sentimentSum, sentimentCount, subredditsProcessed, failed, timedOut, marketSymbols);
    }

    /** Tracked tickers plus those this cycle's mentions would bring over {@code minPosts}. */
    private List<String> marketSymbols(Map<String, MentionTally> tallies, LocalDate today, EngineSettings s) {
        Set<String> symbols = new LinkedHashSet<>(registry.symbols());
        tallies.forEach((symbol, tally) -> {
            if (store.mentionsOn(symbol, today) + tally.mentions() >= s.minPosts()) {
                symbols.add(symbol);
            }
        });
        return List.copyOf(symbols);
    }

    // ── commit (single writer) ──────────────────────────────────────────────

    private InsightSnapshot commit(CyclePlan plan, Map<String, TickerMarketData> market, EngineSettings s,
                                   CycleStats stats, String traceId) {
        Instant now = clock.instant();
        LocalDate today = today(now);
        CycleRequest request = plan.request();

        store.markCounted(plan.newPostIds(), today);
        plan.tallies().forEach((symbol, tally) -> store.recordMentions(symbol, today, tally));
        market.values().forEach(md -> storeMarketData(md, today));

        createQualifying(request, today, now, s, traceId);

        for (TickerRecord record : registry.all()) {
            if (request.covers(record.symbol())) {
                registry.put(score(record, market.get(record.symbol()), plan.tallies().containsKey(record.symbol()),
                    s, now, today, traceId));
            }
        }
        if (request.isFull()) {
            evictInactive(today, s, traceId);
            marketData.purgeStale();
        }
        store.trimBefore(today.minusDays(s.retentionDays()));

        boolean marketTimedOut = market.size() < plan.marketSymbols().size();
        CycleStatus status = status(plan, marketTimedOut, stats);
        MarketSummary summary = new MarketSummary(
            plan.totalMentions(),
            plan.averageSentiment(),
            plan.positivePosts(),
            plan.neutralPosts(),
            plan.negativePosts(),
            trending(today, s),
            plan.postsProcessed(),
            plan.postsSkipped(),
            List.copyOf(plan.subredditsProcessed()),
            status,
            now);

        long cycle = cycles.incrementAndGet();
        InsightSnapshot snapshot = new InsightSnapshot(tickerSnapshots(now), summary, suspensions.snapshot(),
            now, cycle);
        latest.set(snapshot);
        flowLogger.logCommitted(cycle, summary, registry.size(), stats, traceId);
        return snapshot;
    }

    private void storeMarketData(TickerMarketData md, LocalDate today) {
        Double close = null;
        Long volume = null;
        if (md.bars() != null && !md.bars().isEmpty()) {
            store.upsertBars(md.symbol(), md.bars());
            Optional<PriceBar> last = store.latestBar(md.symbol());
            close = last.map(PriceBar::close).orElse(null);
            volume = last.map(PriceBar::volume).orElse(null);
        }
        Double shortPct = md.shortAvailability() == null ? null : md.shortAvailability().shortInterestPct();
        if (close != null || shortPct != null) {
            store.recordMarketData(md.symbol(), today, close, volume, shortPct);
        }
    }

    private void createQualifying(CycleRequest request, LocalDate today, Instant now, EngineSettings s,
                                  String traceId) {
        for (String symbol : store.symbols()) {
            if (registry.contains(symbol) || !request.covers(symbol)) continue;
            int mentions = store.mentionsOn(symbol, today);
            if (mentions >= s.minPosts()) {
                registry.put(TickerRecord.create(symbol, catalog.displayName(symbol).orElse(symbol), now, today,
                    s.priorLikelihood()));
                CycleTrace.log(traceId, () ->
                    log.info("TICKER_CREATED symbol={} mentionsToday={} prior={}",
                        symbol, mentions, s.priorLikelihood()));
            }
        }
    }

    private TickerRecord score(TickerRecord record, TickerMarketData md, boolean mentionedNow, EngineSettings s,
                               Instant now, LocalDate today, String traceId) {
        String symbol = record.symbol();
        DailyAggregate day = store.aggregate(symbol, today).orElse(DailyAggregate.empty(symbol, today));
        int mentionsToday = day.mentionCount();

        SubScore sentiment = SignalCollectors.sentiment(day.sentimentSum(), day.sentimentCount());
        SubScore volume = SignalCollectors.volume(mentionsToday,
            store.mentionHistory(symbol, today, SignalCollectors.VOLUME_BASELINE_DAYS), s.minHistoryDays());
        List<Double> closes = store.closes(symbol);
        SubScore momentum = SignalCollectors.momentum(closes);

        ShortAvailability availability = md == null ? null : md.shortAvailability();
        boolean shortable = availability != null ? availability.shortable() : record.shortable();
        Double shortPct = availability != null ? availability.shortInterestPct() : record.shortInterestPct();
        SubScore shortInterest = SignalCollectors.shortInterest(shortPct);

        SubScores scores = new SubScores(volume, sentiment, momentum, shortInterest);
        double impact = CompositeScorer.impactScore(scores, s.weights());
        double likelihood = MemeLikelihoodEstimator.update(record.memeLikelihood(), scores, record.baselines(),
            s.likelihoodSensitivity());
        LikelihoodBaselines baselines = record.baselines().update(scores);

        StageState previous = record.stageState();
        StageState next = StageClassifier.evaluate(previous,
            new StageInput(impact, mentionsToday, momentum.value(), sentiment.value(), likelihood),
            s.thresholds(), now);
        if (next.stage() != previous.stage()) {
            CycleTrace.log(traceId, () ->
                log.info("STAGE_TRANSITION symbol={} from={} to={} impact={} likelihood={} declineFlag={}",
                    symbol, previous.stage(), next.stage(), String.format("%.1f", impact),
                    String.format("%.3f", likelihood), next.declineFlag()));
        }

        Double latestClose = closes.isEmpty() ? record.latestClose() : closes.get(closes.size() - 1);
        Double firstSeenPrice = record.firstSeenPrice() != null ? record.firstSeenPrice() : latestClose;

        return new TickerRecord(
            symbol,
            record.displayName(),
            record.firstSeen(),
            mentionedNow ? now : record.lastSeen(),
            mentionsToday >= s.minPosts() ? today : record.lastQualifyingDay(),
            firstSeenPrice,
            latestClose,
            shortable,
            shortPct,
            mentionsToday,
            scores,
            impact,
            likelihood,
            baselines,
            next);
    }

    private void evictInactive(LocalDate today, EngineSettings s, String traceId) {
        for (TickerRecord record : registry.all()) {
            long quietDays = ChronoUnit.DAYS.between(record.lastQualifyingDay(), today) - 1;
            if (quietDays >= s.evictionWindowDays()) {
                registry.remove(record.symbol());
                marketData.invalidate(record.symbol());
                CycleTrace.log(traceId, () ->
                    log.info("TICKER_EVICTED symbol={} lastQualifyingDay={} quietDays={}",
                        record.symbol(), record.lastQualifyingDay(), quietDays));
            }
        }
    }

    private static CycleStatus status(CyclePlan plan, boolean marketTimedOut, CycleStats stats) {
        if (plan.subredditsProcessed().isEmpty() && !plan.postsTimedOut()) {
            return CycleStatus.FAILED;
        }
        if (plan.postsTimedOut() || marketTimedOut) {
            return CycleStatus.TIMEOUT;
        }
        if (plan.subredditsFailed() > 0 || stats.degraded()) {
            return CycleStatus.PARTIAL;
        }
        return CycleStatus.SUCCESS;
    }

    private List<TrendingTicker> trending(LocalDate today, EngineSettings s) {
        List<TrendingTicker> ranked = new ArrayList<>();
        for (String symbol : store.symbols()) {
            double decayed = store.decayedMentions(symbol, today, s.trendingHalfLifeDays());
            if (decayed >= TRENDING_MIN_DECAYED) {
                ranked.add(new TrendingTicker(symbol, store.mentionsOn(symbol, today), decayed));
            }
        }
        ranked.sort(Comparator.comparingDouble(TrendingTicker::decayedMentions).reversed()
            .thenComparing(TrendingTicker::symbol));
        return ranked.size() > TRENDING_LIMIT ? List.copyOf(ranked.subList(0, TRENDING_LIMIT)) : List.copyOf(ranked);
    }

    private Map<String, TickerSnapshot> tickerSnapshots(Instant now) {
        Map<String, TickerSnapshot> ordered = new LinkedHashMap<>();
        registry.all().stream()
            .sorted(Comparator.comparingDouble(TickerRecord::impactScore).reversed()
                .thenComparing(TickerRecord::symbol))
            .forEach(r -> ordered.put(r.symbol(), r.toSnapshot(now)));
        return Collections.unmodifiableMap(ordered);
    }

    private static LocalDate today(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC);
    }

    private static String describe(CycleRequest request) {
        return request.isFull() ? "all" : request.symbol();
    }

    private record RunningCycle(CycleRequest request, String traceId, Sinks.One<Boolean> cancel,
                                Mono<InsightSnapshot> result) {}

    private record FetchedCycle(CyclePlan plan, Map<String, TickerMarketData> market) {}
}
