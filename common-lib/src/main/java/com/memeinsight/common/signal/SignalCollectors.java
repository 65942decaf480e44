package com.memeinsight.common.signal;

import com.memeinsight.common.model.SubScore;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Raw signal math and its normalization onto the common [0, 100] sub-score scale.
 *
 * <h3>Normalizations</h3>
 * <pre>
 *   sentiment      mean ∈ [-1, 1]          → (mean + 1) × 50
 *   volume         z ∈ [-3, 3] (clipped)    → (z + 3) / 6 × 100
 *   momentum       pct ∈ [-10, 10] (clip)  → (pct + 10) / 20 × 100
 *   short interest pct ∈ [0, 50] (clip)    → pct / 50 × 100
 * </pre>
 *
 * <p>Missing data yields {@link SubScore#neutral()} for sentiment, volume and momentum.
 * Absent short interest is a real zero, not an unknown.
 *
 * <p>No Spring dependencies, no state.
 */
public final class SignalCollectors {

    /** Trailing window for the volume baseline. */
    public static final int VOLUME_BASELINE_DAYS = 30;

    /** Clip bound for the volume z-score. */
    public static final double MAX_Z = 3.0;

    /** Trading days looked at by the momentum signal. */
    public static final int MOMENTUM_DAYS = 3;

    /** Price change (in %) that saturates the momentum sub-score. */
    public static final double MAX_MOMENTUM_PCT = 10.0;

    /** Short interest (in % of float) that saturates the short-interest sub-score. */
    public static final double SHORT_INTEREST_CEILING_PCT = 50.0;

    private SignalCollectors() {}

    // ── sentiment ─────────────────────────────────────────────────────────────

    public static double sentimentMean(double sentimentSum, int sentimentCount) {
        if (sentimentCount <= 0) return 0.0;
        return clip(sentimentSum / sentimentCount, -1.0, 1.0);
    }

    public static SubScore sentiment(double sentimentSum, int sentimentCount) {
        if (sentimentCount <= 0) {
            return SubScore.neutral();
        }
        return SubScore.of((sentimentMean(sentimentSum, sentimentCount) + 1.0) * 50.0);
    }

    // ── volume ────────────────────────────────────────────────────────────────

    /**
     * z-score of {@code current} against {@code history} (oldest first, today excluded);
     * only the last {@value #VOLUME_BASELINE_DAYS} entries are used. Empty when fewer
     * than {@code minHistoryDays} entries exist.
     *
     * <p>With zero spread the score saturates: 0 when {@code current} equals the mean,
     * otherwise ±{@value #MAX_Z}.
     */
    public static OptionalDouble volumeZScore(int current, List<Integer> history, int minHistoryDays) {
        if (history == null || history.size() < Math.max(1, minHistoryDays)) {
            return OptionalDouble.empty();
        }
        List<Integer> window = history.subList(Math.max(0, history.size() - VOLUME_BASELINE_DAYS), history.size());
        double mean = window.stream().mapToDouble(Integer::doubleValue).average().orElse(0.0);
        double variance = window.stream()
            .mapToDouble(v -> (v - mean) * (v - mean))
            .average()
            .orElse(0.0);
        double std = Math.sqrt(variance);
        double diff = current - mean;
        if (std < 1e-9) {
            if (Math.abs(diff) < 1e-9) return OptionalDouble.of(0.0);
            return OptionalDouble.of(diff > 0 ? MAX_Z : -MAX_Z);
        }
        return OptionalDouble.of(clip(diff / std, -MAX_Z, MAX_Z));
    }

    public static SubScore volume(int current, List<Integer> history, int minHistoryDays) {
        OptionalDouble z = volumeZScore(current, history, minHistoryDays);
        if (z.isEmpty()) {
            return SubScore.neutral();
        }
        return SubScore.of((z.getAsDouble() + MAX_Z) / (2 * MAX_Z) * 100.0);
    }

    // ── momentum ──────────────────────────────────────────────────────────────

    /**
     * Percentage change from the oldest to the newest of the last
     * {@value #MOMENTUM_DAYS} closes ({@code closes} oldest first).
     */
    public static OptionalDouble momentumPct(List<Double> closes) {
        if (closes == null || closes.size() < MOMENTUM_DAYS) {
            return OptionalDouble.empty();
        }
        double from = closes.get(closes.size() - MOMENTUM_DAYS);
        double to = closes.get(closes.size() - 1);
        if (from <= 0.0 || Double.isNaN(from) || Double.isNaN(to)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((to - from) / from * 100.0);
    }

    public static SubScore momentum(List<Double> closes) {
        OptionalDouble pct = momentumPct(closes);
        if (pct.isEmpty()) {
            return SubScore.neutral();
        }
        double clipped = clip(pct.getAsDouble(), -MAX_MOMENTUM_PCT, MAX_MOMENTUM_PCT);
        return SubScore.of((clipped + MAX_MOMENTUM_PCT) / (2 * MAX_MOMENTUM_PCT) * 100.0);
    }

    // ── short interest ────────────────────────────────────────────────────────

    public static SubScore shortInterest(Double shortInterestPct) {
        if (shortInterestPct == null || shortInterestPct.isNaN()) {
            return SubScore.defaultedZero();
        }
        if (shortInterestPct <= 0.0) {
            return SubScore.of(0.0);
        }
        return SubScore.of(Math.min(shortInterestPct, SHORT_INTEREST_CEILING_PCT)
            / SHORT_INTEREST_CEILING_PCT * 100.0);
    }

    static double clip(double value, double lo, double hi) {
        return Math.max(lo, Math.min(hi, value));
    }
}
