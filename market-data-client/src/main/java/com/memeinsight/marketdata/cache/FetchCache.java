package com.memeinsight.marketdata.cache;

import com.memeinsight.common.exception.UpstreamAuthException;
import com.memeinsight.common.exception.UpstreamRateLimitedException;
import com.memeinsight.common.exception.UpstreamTimeoutException;
import com.memeinsight.common.exception.UpstreamUnavailableException;
import com.memeinsight.common.trace.CycleTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Reactive TTL cache and rate limiter in front of every upstream source.
 *
 * <p><strong>Fetch Once → Serve Many:</strong>
 * <ul>
 *   <li>a fresh entry ({@code now − fetchedAt < ttl}) is served without touching upstream;</li>
 *   <li>otherwise exactly one upstream call is made per key, and callers arriving while it
 *       is in flight share it;</li>
 *   <li>transient failures (rate limit, timeout, server error) fall back to the last value
 *       when one exists and push the source into an exponential cool-down
 *       ({@link SourceBackoff}); during the cool-down upstream is not called at all;</li>
 *   <li>failures tied to one key (unparseable or unknown subject) fall back the same way
 *       but leave the source's cool-down alone;</li>
 *   <li>a source's daily budget ({@link SourceQuota}) is enforced like a rate limit;</li>
 *   <li>{@link UpstreamAuthException} is never masked by stale data.</li>
 * </ul>
 *
 * <p>Time comes from the injected {@link Clock}. Map updates are single synchronous calls;
 * nothing is locked across a reactive boundary.
 */
public class FetchCache {

    private static final Logger log = LoggerFactory.getLogger(FetchCache.class);

    /** Passed to {@link #forceInvalidate(String)} to drop every entry. */
    public static final String ALL_KEYS = "*";

    private final Clock clock;
    private final FetchPolicy policy;

    private final ConcurrentHashMap<String, CacheEntry<?>> store = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Mono<?>> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SourceBackoff> backoffs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SourceQuota> quotas = new ConcurrentHashMap<>();

    public FetchCache(Clock clock, FetchPolicy policy) {
        this.clock = clock;
        this.policy = policy;
    }

    /**
     * Returns the cached value for {@code key} while it is younger than {@code ttl},
     * else fetches it through {@code fetchFn}. An empty upstream result is passed through
     * and not cached.
     */
    public <T> Mono<T> get(CacheKey key, Duration ttl, Supplier<Mono<T>> fetchFn) {
        return Mono.defer(() -> {
            String k = key.asString();
            CacheEntry<T> cached = lookup(k);
            if (cached != null && cached.isFresh(clock.instant())) {
                log.debug("CACHE_HIT key={}", k);
                return Mono.just(cached.value());
            }
            Mono<T> fresh = newFetch(key, ttl, fetchFn);
            @SuppressWarnings("unchecked")
            Mono<T> existing = (Mono<T>) inFlight.putIfAbsent(k, fresh);
            if (existing != null) {
                log.debug("CACHE_JOIN key={}", k);
                return existing;
            }
            return fresh;
        });
    }

    /** Drops one entry by its {@code source:subject:period} form, or every entry for {@value #ALL_KEYS}. */
    public int forceInvalidate(String key) {
        if (ALL_KEYS.equals(key)) {
            int size = store.size();
            store.clear();
            log.info("CACHE_INVALIDATE_ALL entries={}", size);
            return size;
        }
        boolean removed = store.remove(key) != null;
        log.info("CACHE_INVALIDATE key={} removed={}", key, removed);
        return removed ? 1 : 0;
    }

    public int forceInvalidate(CacheKey key) {
        return forceInvalidate(key.asString());
    }

    /**
     * Drops entries that expired more than {@code maxStaleAge} ago; such values are too old
     * to serve as a fallback. Returns the number of entries removed.
     */
    public int purgeExpired(Duration maxStaleAge) {
        Instant cutoff = clock.instant().minus(maxStaleAge);
        int before = store.size();
        store.values().removeIf(entry -> entry.expiresAt().isBefore(cutoff));
        int removed = before - store.size();
        if (removed > 0) {
            log.info("CACHE_PURGED entries={} remaining={} maxStaleAgeHours={}",
                removed, store.size(), maxStaleAge.toHours());
        }
        return removed;
    }

    /** Clears the cool-down of {@code source}, e.g. after it was reconfigured. */
    public void resetSource(String source) {
        backoffFor(source).recordSuccess();
        log.info("BACKOFF_RESET source={}", source);
    }

    public int consecutiveFailures(String source) {
        return backoffFor(source).consecutiveFailures();
    }

    public boolean contains(CacheKey key) {
        return store.containsKey(key.asString());
    }

    public int size() {
        return store.size();
    }

    // ── internals ───────────────────────────────────────────────────────────

    private <T> Mono<T> newFetch(CacheKey key, Duration ttl, Supplier<Mono<T>> fetchFn) {
        String k = key.asString();
        AtomicReference<Mono<T>> self = new AtomicReference<>();
        Mono<T> shared = Mono.deferContextual(ctx -> callUpstream(key, ttl, fetchFn, ctx))
            .doFinally(signal -> inFlight.remove(k, self.get()))
            .cache();
        self.set(shared);
        return shared;
    }

    private <T> Mono<T> callUpstream(CacheKey key, Duration ttl, Supplier<Mono<T>> fetchFn, ContextView ctx) {
        String k = key.asString();
        String source = key.source();
        Instant now = clock.instant();
        SourceBackoff backoff = backoffFor(source);

        if (backoff.isCoolingDown(now)) {
            Duration remaining = backoff.remaining(now);
            log.debug("BACKOFF_ACTIVE source={} key={} remainingSeconds={}", source, k, remaining.toSeconds());
            return staleOr(k, source, ctx, new UpstreamRateLimitedException(source,
                "cooling down after " + backoff.consecutiveFailures() + " failure(s)", remaining));
        }
        SourceQuota quota = quotaFor(source);
        if (!quota.tryAcquire(now)) {
            CycleTrace.log(ctx, source, () ->
                log.warn("QUOTA_EXHAUSTED source={} dailyLimit={}", source, quota.dailyLimit()));
            return staleOr(k, source, ctx, new UpstreamRateLimitedException(source,
                "daily quota of " + quota.dailyLimit() + " calls exhausted", SourceQuota.untilReset(now)));
        }

        log.debug("CACHE_MISS key={}", k);
        Duration timeout = policy.fetchTimeout();
        return Mono.defer(fetchFn)
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, e -> new UpstreamTimeoutException(source,
                "no response within " + timeout.toSeconds() + "s for " + k, e))
            .doOnNext(value -> {
                store.put(k, new CacheEntry<>(k, value, clock.instant(), ttl));
                backoff.recordSuccess();
                log.info("CACHE_REFRESH key={} ttlSeconds={}", k, ttl.toSeconds());
            })
            .onErrorResume(e -> !(e instanceof UpstreamAuthException), e -> {
                if (!isTransient(e)) {
                    CycleTrace.log(ctx, source, () ->
                        log.warn("FETCH_REJECTED key={} error={} reason={}",
                            k, e.getClass().getSimpleName(), e.getMessage()));
                    return staleOr(k, source, ctx, e);
                }
                Duration hint = e instanceof UpstreamRateLimitedException rl ? rl.getRetryAfter() : Duration.ZERO;
                Duration coolDown = backoff.recordFailure(clock.instant(), hint);
                CycleTrace.log(ctx, source, () ->
                    log.warn("FETCH_FAILED key={} failures={} coolDownSeconds={} reason={}",
                        k, backoff.consecutiveFailures(), coolDown.toSeconds(), e.getMessage()));
                return staleOr(k, source, ctx, e);
            })
            .doOnError(UpstreamAuthException.class, e -> CycleTrace.log(ctx, source, () ->
                log.error("FETCH_AUTH_FAILED key={} reason={}", k, e.getMessage())));
    }

    /** Only failures that say something about the source itself count toward its cool-down. */
    private static boolean isTransient(Throwable e) {
        return e instanceof UpstreamRateLimitedException
            || e instanceof UpstreamTimeoutException
            || e instanceof UpstreamUnavailableException;
    }

    private <T> Mono<T> staleOr(String k, String source, ContextView ctx, Throwable error) {
        CacheEntry<T> stale = lookup(k);
        if (stale != null) {
            CycleTrace.log(ctx, source, () ->
                log.info("CACHE_STALE key={} ageSeconds={} reason={}",
                    k, Duration.between(stale.fetchedAt(), clock.instant()).toSeconds(), error.getMessage()));
            return Mono.just(stale.value());
        }
        return Mono.error(error);
    }

    @SuppressWarnings("unchecked")
    private <T> CacheEntry<T> lookup(String k) {
        return (CacheEntry<T>) store.get(k);
    }

    private SourceBackoff backoffFor(String source) {
        return backoffs.computeIfAbsent(source, s -> new SourceBackoff(policy.backoffBase(), policy.backoffMax()));
    }

    private SourceQuota quotaFor(String source) {
        return quotas.computeIfAbsent(source, s -> new SourceQuota(policy.dailyLimits().getOrDefault(s, 0)));
    }
}
