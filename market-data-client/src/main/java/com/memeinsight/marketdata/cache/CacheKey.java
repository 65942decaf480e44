package com.memeinsight.marketdata.cache;

/**
 * Identity of a cached upstream result: which source, about what, for which period.
 * The string form {@code source:subject:period} is what {@link FetchCache#forceInvalidate}
 * matches against.
 */
public record CacheKey(String source, String subject, String period) {

    public static CacheKey of(String source, String subject, String period) {
        return new CacheKey(source, subject, period);
    }

    public String asString() {
        return source + ":" + subject + ":" + period;
    }

    @Override
    public String toString() {
        return asString();
    }
}
