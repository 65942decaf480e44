package com.memeinsight.marketdata.service;

import com.memeinsight.common.model.Post;
import com.memeinsight.common.model.PriceBar;
import com.memeinsight.common.model.ShortAvailability;
import com.memeinsight.marketdata.cache.CacheKey;
import com.memeinsight.marketdata.cache.CacheTtls;
import com.memeinsight.marketdata.cache.FetchCache;
import com.memeinsight.marketdata.source.PostSource;
import com.memeinsight.marketdata.source.PriceBarSource;
import com.memeinsight.marketdata.source.ShortAvailabilitySource;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Cached access to the three upstream collaborators. Every call goes through the
 * {@link FetchCache}, so callers get request collapsing, stale fallback, back-off and
 * quotas without knowing about them.
 */
public class MarketDataService {

    /** Expired entries older than this no longer serve as stale fallback. */
    public static final Duration MAX_STALE_AGE = Duration.ofDays(1);

    private final FetchCache cache;
    private final CacheTtls ttls;
    private final PostSource posts;
    private final PriceBarSource bars;
    private final ShortAvailabilitySource shortAvailability;

    public MarketDataService(FetchCache cache, CacheTtls ttls, PostSource posts,
                             PriceBarSource bars, ShortAvailabilitySource shortAvailability) {
        this.cache             = cache;
        this.ttls              = ttls;
        this.posts             = posts;
        this.bars              = bars;
        this.shortAvailability = shortAvailability;
    }

    public Mono<List<Post>> posts(String subreddit, int limit) {
        CacheKey key = CacheKey.of(posts.sourceName(), subreddit.toLowerCase(Locale.ROOT), "hot-" + limit);
        return cache.get(key, ttls.posts(), () -> posts.fetchPosts(subreddit, limit));
    }

    public Mono<List<PriceBar>> dailyBars(String symbol) {
        String s = symbol.toUpperCase(Locale.ROOT);
        return cache.get(CacheKey.of(bars.sourceName(), s, "daily"), ttls.priceBars(), () -> bars.fetchDailyBars(s));
    }

    public Mono<ShortAvailability> shortAvailability(String symbol) {
        String s = symbol.toUpperCase(Locale.ROOT);
        return cache.get(CacheKey.of(shortAvailability.sourceName(), s, "current"), ttls.shortAvailability(),
            () -> shortAvailability.fetchShortAvailability(s));
    }

    /** Drops the cached bars and short availability of {@code symbol}; returns the entries removed. */
    public int invalidate(String symbol) {
        String s = symbol.toUpperCase(Locale.ROOT);
        return cache.forceInvalidate(CacheKey.of(bars.sourceName(), s, "daily"))
            + cache.forceInvalidate(CacheKey.of(shortAvailability.sourceName(), s, "current"));
    }

    /** Drops cache entries that expired more than {@link #MAX_STALE_AGE} ago. */
    public int purgeStale() {
        return cache.purgeExpired(MAX_STALE_AGE);
    }

    public String postSourceName() {
        return posts.sourceName();
    }

    public String priceBarSourceName() {
        return bars.sourceName();
    }

    public String shortAvailabilitySourceName() {
        return shortAvailability.sourceName();
    }

    public FetchCache cache() {
        return cache;
    }
}
