package com.memeinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.memeinsight.common.exception.ConfigValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Composite weights for {volume, sentiment, momentum, shortInterest}.
 *
 * <p>Each weight must lie in [0, 1] and at least one must be positive. The four
 * weights are NOT required to sum to 1: keeping them normalized is the caller's
 * responsibility, and an over-weighted blend is simply clipped to 100 by the scorer.
 */
public record ScoringWeights(
    @JsonProperty("volume")        double volume,
    @JsonProperty("sentiment")     double sentiment,
    @JsonProperty("momentum")      double momentum,
    @JsonProperty("shortInterest") double shortInterest
) {
    public static final ScoringWeights DEFAULTS = new ScoringWeights(0.40, 0.30, 0.20, 0.10);

    public double total() {
        return volume + sentiment + momentum + shortInterest;
    }

    /**
     * Returns {@code this} when every field is valid, otherwise throws with the full
     * list of violations.
     */
    public ScoringWeights validated() {
        List<String> violations = new ArrayList<>();
        check("volume", volume, violations);
        check("sentiment", sentiment, violations);
        check("momentum", momentum, violations);
        check("shortInterest", shortInterest, violations);
        if (violations.isEmpty() && total() <= 0.0) {
            violations.add("at least one weight must be positive");
        }
        if (!violations.isEmpty()) {
            throw new ConfigValidationException(violations);
        }
        return this;
    }

    private static void check(String name, double value, List<String> violations) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            violations.add(name + " weight must be within [0, 1] but was " + value);
        }
    }
}
