package com.memeinsight.marketdata.cache;

import java.time.Duration;
import java.util.Map;

/**
 * Knobs for {@link FetchCache}.
 *
 * @param fetchTimeout upper bound for one upstream call
 * @param backoffBase  cool-down after the first consecutive failure of a source
 * @param backoffMax   cap on the cool-down
 * @param dailyLimits  per-source daily call budget; sources not listed are unlimited
 */
public record FetchPolicy(
    Duration fetchTimeout,
    Duration backoffBase,
    Duration backoffMax,
    Map<String, Integer> dailyLimits
) {
    public static final FetchPolicy DEFAULTS = new FetchPolicy(
        Duration.ofSeconds(20),
        Duration.ofSeconds(30),
        Duration.ofMinutes(15),
        Map.of("alpha-vantage", 500, "polygon", 5000));

    public FetchPolicy {
        dailyLimits = dailyLimits == null ? Map.of() : Map.copyOf(dailyLimits);
    }
}
