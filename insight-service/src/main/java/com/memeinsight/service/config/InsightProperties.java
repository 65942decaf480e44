package com.memeinsight.service.config;

import com.memeinsight.common.likelihood.MemeLikelihoodEstimator;
import com.memeinsight.common.model.ScoringWeights;
import com.memeinsight.common.stage.StageThresholds;
import com.memeinsight.marketdata.cache.CacheTtls;
import com.memeinsight.marketdata.cache.FetchPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw {@code insight.*} configuration as bound by Spring. Defaults mirror the engine's
 * documented defaults; {@link #toSettings()} turns this into a validated
 * {@link EngineSettings}.
 */
@ConfigurationProperties(prefix = "insight")
public class InsightProperties {

    private List<String> subreddits = new ArrayList<>(List.of("wallstreetbets", "stocks", "investing"));
    private int postsPerSubreddit = 100;
    private Duration updateInterval = Duration.ofMinutes(5);
    private int minPosts = 5;
    private int minKarma = 100;
    private int evictionWindowDays = 7;
    private int retentionDays = 45;
    private int minHistoryDays = 7;
    private double trendingHalfLifeDays = 3.0;
    private int maxConcurrentFetches = 4;
    private List<String> extraSymbols = new ArrayList<>();

    private final Weights weights = new Weights();
    private final Thresholds thresholds = new Thresholds();
    private final Likelihood likelihood = new Likelihood();
    private final Timeouts timeouts = new Timeouts();
    private final Cache cache = new Cache();
    private final Scheduler scheduler = new Scheduler();

    public EngineSettings toSettings() {
        ScoringWeights w = new ScoringWeights(
            weights.getVolume(), weights.getSentiment(), weights.getMomentum(), weights.getShortInterest());
        StageThresholds t = new StageThresholds(minPosts,
            thresholds.getLow(), thresholds.getMomentum(), thresholds.getHigh(), thresholds.getElevated(),
            thresholds.getNegativeSentiment(), thresholds.getLikelihood());
        return new EngineSettings(subreddits, postsPerSubreddit, updateInterval, minKarma, w, t,
            evictionWindowDays, retentionDays, minHistoryDays,
            likelihood.getPrior(), likelihood.getSensitivity(),
            timeouts.getFetch(), timeouts.getCycle(), maxConcurrentFetches,
            trendingHalfLifeDays, extraSymbols).validated();
    }

    public FetchPolicy toFetchPolicy() {
        return new FetchPolicy(timeouts.getFetch(), cache.getBackoffBase(), cache.getBackoffMax(), cache.getDailyLimits());
    }

    public CacheTtls toCacheTtls() {
        return new CacheTtls(cache.getPostsTtl(), cache.getPriceBarsTtl(), cache.getShortAvailabilityTtl());
    }

    public List<String> getSubreddits() { return subreddits; }
    public void setSubreddits(List<String> subreddits) { this.subreddits = subreddits; }

    public int getPostsPerSubreddit() { return postsPerSubreddit; }
    public void setPostsPerSubreddit(int postsPerSubreddit) { this.postsPerSubreddit = postsPerSubreddit; }

    public Duration getUpdateInterval() { return updateInterval; }
    public void setUpdateInterval(Duration updateInterval) { this.updateInterval = updateInterval; }

    public int getMinPosts() { return minPosts; }
    public void setMinPosts(int minPosts) { this.minPosts = minPosts; }

    public int getMinKarma() { return minKarma; }
    public void setMinKarma(int minKarma) { this.minKarma = minKarma; }

    public int getEvictionWindowDays() { return evictionWindowDays; }
    public void setEvictionWindowDays(int evictionWindowDays) { this.evictionWindowDays = evictionWindowDays; }

    public int getRetentionDays() { return retentionDays; }
    public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }

    public int getMinHistoryDays() { return minHistoryDays; }
    public void setMinHistoryDays(int minHistoryDays) { this.minHistoryDays = minHistoryDays; }

    public double getTrendingHalfLifeDays() { return trendingHalfLifeDays; }
    public void setTrendingHalfLifeDays(double trendingHalfLifeDays) { this.trendingHalfLifeDays = trendingHalfLifeDays; }

    public int getMaxConcurrentFetches() { return maxConcurrentFetches; }
    public void setMaxConcurrentFetches(int maxConcurrentFetches) { this.maxConcurrentFetches = maxConcurrentFetches; }

    public List<String> getExtraSymbols() { return extraSymbols; }
    public void setExtraSymbols(List<String> extraSymbols) { this.extraSymbols = extraSymbols; }

    public Weights getWeights() { return weights; }
    public Thresholds getThresholds() { return thresholds; }
    public Likelihood getLikelihood() { return likelihood; }
    public Timeouts getTimeouts() { return timeouts; }
    public Cache getCache() { return cache; }
    public Scheduler getScheduler() { return scheduler; }

    // ── nested groups ─────────────────────────────────────────────────────────

    public static class Weights {
        private double volume = ScoringWeights.DEFAULTS.volume();
        private double sentiment = ScoringWeights.DEFAULTS.sentiment();
        private double momentum = ScoringWeights.DEFAULTS.momentum();
        private double shortInterest = ScoringWeights.DEFAULTS.shortInterest();

        public double getVolume() { return volume; }
        public void setVolume(double volume) { this.volume = volume; }
        public double getSentiment() { return sentiment; }
        public void setSentiment(double sentiment) { this.sentiment = sentiment; }
        public double getMomentum() { return momentum; }
        public void setMomentum(double momentum) { this.momentum = momentum; }
        public double getShortInterest() { return shortInterest; }
        public void setShortInterest(double shortInterest) { this.shortInterest = shortInterest; }
    }

    public static class Thresholds {
        private double low = StageThresholds.DEFAULTS.lowThreshold();
        private double momentum = StageThresholds.DEFAULTS.momentumThreshold();
        private double high = StageThresholds.DEFAULTS.highThreshold();
        private double elevated = StageThresholds.DEFAULTS.elevatedThreshold();
        private double negativeSentiment = StageThresholds.DEFAULTS.negativeSentimentThreshold();
        private double likelihood = StageThresholds.DEFAULTS.likelihoodThreshold();

        public double getLow() { return low; }
        public void setLow(double low) { this.low = low; }
        public double getMomentum() { return momentum; }
        public void setMomentum(double momentum) { this.momentum = momentum; }
        public double getHigh() { return high; }
        public void setHigh(double high) { this.high = high; }
        public double getElevated() { return elevated; }
        public void setElevated(double elevated) { this.elevated = elevated; }
        public double getNegativeSentiment() { return negativeSentiment; }
        public void setNegativeSentiment(double negativeSentiment) { this.negativeSentiment = negativeSentiment; }
        public double getLikelihood() { return likelihood; }
        public void setLikelihood(double likelihood) { this.likelihood = likelihood; }
    }

    public static class Likelihood {
        private double prior = MemeLikelihoodEstimator.DEFAULT_PRIOR;
        private double sensitivity = MemeLikelihoodEstimator.DEFAULT_SENSITIVITY;

        public double getPrior() { return prior; }
        public void setPrior(double prior) { this.prior = prior; }
        public double getSensitivity() { return sensitivity; }
        public void setSensitivity(double sensitivity) { this.sensitivity = sensitivity; }
    }

    public static class Timeouts {
        private Duration fetch = Duration.ofSeconds(20);
        private Duration cycle = Duration.ofSeconds(90);

        public Duration getFetch() { return fetch; }
        public void setFetch(Duration fetch) { this.fetch = fetch; }
        public Duration getCycle() { return cycle; }
        public void setCycle(Duration cycle) { this.cycle = cycle; }
    }

    public static class Cache {
        private Duration postsTtl = CacheTtls.DEFAULTS.posts();
        private Duration priceBarsTtl = CacheTtls.DEFAULTS.priceBars();
        private Duration shortAvailabilityTtl = CacheTtls.DEFAULTS.shortAvailability();
        private Duration backoffBase = FetchPolicy.DEFAULTS.backoffBase();
        private Duration backoffMax = FetchPolicy.DEFAULTS.backoffMax();
        private Map<String, Integer> dailyLimits = new LinkedHashMap<>(FetchPolicy.DEFAULTS.dailyLimits());

        public Duration getPostsTtl() { return postsTtl; }
        public void setPostsTtl(Duration postsTtl) { this.postsTtl = postsTtl; }
        public Duration getPriceBarsTtl() { return priceBarsTtl; }
        public void setPriceBarsTtl(Duration priceBarsTtl) { this.priceBarsTtl = priceBarsTtl; }
        public Duration getShortAvailabilityTtl() { return shortAvailabilityTtl; }
        public void setShortAvailabilityTtl(Duration shortAvailabilityTtl) { this.shortAvailabilityTtl = shortAvailabilityTtl; }
        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
        public Duration getBackoffMax() { return backoffMax; }
        public void setBackoffMax(Duration backoffMax) { this.backoffMax = backoffMax; }
        public Map<String, Integer> getDailyLimits() { return dailyLimits; }
        public void setDailyLimits(Map<String, Integer> dailyLimits) { this.dailyLimits = dailyLimits; }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration initialDelay = Duration.ofSeconds(10);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
    }
}
