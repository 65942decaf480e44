package com.memeinsight.service.store;

import com.memeinsight.common.model.DailyAggregate;
import com.memeinsight.common.model.PriceBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-ticker daily history: mention aggregates keyed by calendar day, the daily price
 * series keyed by trading date, and the ids of posts already counted.
 *
 * <p>Only today's aggregate is ever merged into; earlier days are history. Price bars
 * upsert by date because upstream may revise the latest session.
 *
 * <p>Not thread-safe. Confined to the commit scheduler of the poll coordinator, which is
 * the only writer and the only reader.
 */
public class HistoricalStore {

    private static final Logger log = LoggerFactory.getLogger(HistoricalStore.class);

    private final Map<String, TreeMap<LocalDate, DailyAggregate>> aggregates = new HashMap<>();
    private final Map<String, TreeMap<LocalDate, PriceBar>> prices = new HashMap<>();
    private final Map<String, LocalDate> countedPosts = new HashMap<>();

    // ── mentions ────────────────────────────────────────────────────────────

    public DailyAggregate recordMentions(String symbol, LocalDate day, MentionTally tally) {
        DailyAggregate update = DailyAggregate.ofMentions(symbol, day,
            tally.mentions(), tally.sentimentSum(), tally.sentimentCount());
        return aggregates.computeIfAbsent(symbol, s -> new TreeMap<>())
            .merge(day, update, DailyAggregate::merge);
    }

    public DailyAggregate recordMarketData(String symbol, LocalDate day, Double close, Long volume,
                                           Double shortInterestPct) {
        return aggregates.computeIfAbsent(symbol, s -> new TreeMap<>())
            .compute(day, (d, existing) -> (existing == null ? DailyAggregate.empty(symbol, day) : existing)
                .withMarketData(close, volume, shortInterestPct));
    }

    public Optional<DailyAggregate> aggregate(String symbol, LocalDate day) {
        TreeMap<LocalDate, DailyAggregate> days = aggregates.get(symbol);
        return days == null ? Optional.empty() : Optional.ofNullable(days.get(day));
    }

    public int mentionsOn(String symbol, LocalDate day) {
        return aggregate(symbol, day).map(DailyAggregate::mentionCount).orElse(0);
    }

    /**
     * Daily mention counts for the {@code window} days before {@code day}, oldest first.
     * Starts no earlier than the first recorded day of the ticker; silent days inside the
     * range count as zero.
     */
    public List<Integer> mentionHistory(String symbol, LocalDate day, int window) {
        TreeMap<LocalDate, DailyAggregate> days = aggregates.get(symbol);
        if (days == null || days.isEmpty() || !days.firstKey().isBefore(day)) {
            return List.of();
        }
        LocalDate from = day.minusDays(window);
        if (from.isBefore(days.firstKey())) {
            from = days.firstKey();
        }
        List<Integer> history = new ArrayList<>();
        for (LocalDate d = from; d.isBefore(day); d = d.plusDays(1)) {
            DailyAggregate a = days.get(d);
            history.add(a == null ? 0 : a.mentionCount());
        }
        return history;
    }

    /** Σ mentionCount × 0.5^(age / halfLife) over every stored day up to {@code today}. */
    public double decayedMentions(String symbol, LocalDate today, double halfLifeDays) {
        TreeMap<LocalDate, DailyAggregate> days = aggregates.get(symbol);
        if (days == null) return 0.0;
        double total = 0.0;
        for (DailyAggregate a : days.headMap(today, true).values()) {
            long age = ChronoUnit.DAYS.between(a.date(), today);
            total += a.mentionCount() * Math.pow(0.5, age / halfLifeDays);
        }
        return total;
    }

    // ── prices ──────────────────────────────────────────────────────────────

    public void upsertBars(String symbol, Collection<PriceBar> bars) {
        NavigableMap<LocalDate, PriceBar> series = prices.computeIfAbsent(symbol, s -> new TreeMap<>());
        for (PriceBar bar : bars) {
            series.put(bar.date(), bar);
        }
    }

    /** Closing prices, oldest first. */
    public List<Double> closes(String symbol) {
        TreeMap<LocalDate, PriceBar> series = prices.get(symbol);
        if (series == null) return List.of();
        return series.values().stream().map(PriceBar::close).toList();
    }

    public Optional<PriceBar> latestBar(String symbol) {
        TreeMap<LocalDate, PriceBar> series = prices.get(symbol);
        return series == null || series.isEmpty() ? Optional.empty() : Optional.of(series.lastEntry().getValue());
    }

    // ── counted posts ───────────────────────────────────────────────────────

    public boolean isCounted(String postId) {
        return countedPosts.containsKey(postId);
    }

    public void markCounted(Collection<String> postIds, LocalDate day) {
        postIds.forEach(id -> countedPosts.putIfAbsent(id, day));
    }

    // ── housekeeping ────────────────────────────────────────────────────────

    public Set<String> symbols() {
        return Set.copyOf(aggregates.keySet());
    }

    /** Drops aggregates, bars and counted-post ids dated before {@code cutoff}. */
    public void trimBefore(LocalDate cutoff) {
        int before = aggregates.values().stream().mapToInt(Map::size).sum();
        aggregates.values().forEach(days -> days.headMap(cutoff, false).clear());
        aggregates.values().removeIf(Map::isEmpty);
        prices.values().forEach(series -> series.headMap(cutoff, false).clear());
        prices.values().removeIf(Map::isEmpty);
        countedPosts.values().removeIf(day -> day.isBefore(cutoff));
        int after = aggregates.values().stream().mapToInt(Map::size).sum();
        if (after < before) {
            log.info("HISTORY_TRIMMED cutoff={} aggregatesRemoved={}", cutoff, before - after);
        }
    }

    public void clear() {
        aggregates.clear();
        prices.clear();
        countedPosts.clear();
        log.info("HISTORY_CLEARED");
    }
}
