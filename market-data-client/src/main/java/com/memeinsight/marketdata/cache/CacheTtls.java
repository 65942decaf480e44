package com.memeinsight.marketdata.cache;

import java.time.Duration;

/** Freshness window per kind of upstream data. */
public record CacheTtls(Duration posts, Duration priceBars, Duration shortAvailability) {

    public static final CacheTtls DEFAULTS = new CacheTtls(
        Duration.ofMinutes(4), Duration.ofHours(1), Duration.ofHours(6));
}
