package com.memeinsight.common.sentiment;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Bounded lexicon heuristic for post polarity.
 *
 * <pre>
 *   polarity = (positiveHits - negativeHits) / (positiveHits + negativeHits)   ∈ [-1, 1]
 * </pre>
 *
 * <p>Hits are counted per whole lower-cased word, so "support" never counts as "up".
 * Text without any lexicon word has no polarity and must not be counted toward a
 * sentiment mean.
 *
 * <p>Pure static utility, no state.
 */
public final class SentimentLexicon {

    public static final Set<String> POSITIVE = Set.of(
        "buy", "bullish", "moon", "rocket", "diamond", "hands", "hold", "hodl",
        "squeeze", "gain", "gains", "profit", "up", "rise", "call", "calls", "long",
        "pump", "rally", "breakout", "momentum", "strong", "support", "bull", "tendies"
    );

    public static final Set<String> NEGATIVE = Set.of(
        "sell", "bearish", "crash", "drop", "fall", "puts", "put", "short",
        "dump", "loss", "losses", "down", "bear", "red", "baghold", "bagholder", "panic",
        "fear", "resistance", "weak", "dip", "correction", "bubble", "overvalued", "rug"
    );

    private SentimentLexicon() {}

    public static OptionalDouble polarity(String text) {
        if (text == null || text.isBlank()) {
            return OptionalDouble.empty();
        }
        int positive = 0;
        int negative = 0;
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            if (word.isEmpty()) continue;
            if (POSITIVE.contains(word)) positive++;
            else if (NEGATIVE.contains(word)) negative++;
        }
        int total = positive + negative;
        if (total == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) (positive - negative) / total);
    }
}
