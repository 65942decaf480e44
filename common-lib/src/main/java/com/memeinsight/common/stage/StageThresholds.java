package com.memeinsight.common.stage;

import com.memeinsight.common.exception.ConfigValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Threshold set driving {@link StageClassifier}. Impact thresholds are on [0, 100],
 * sentiment thresholds on the sentiment sub-score scale (50 = neutral).
 */
public record StageThresholds(
    int    minPosts,
    double lowThreshold,
    double momentumThreshold,
    double highThreshold,
    double elevatedThreshold,
    double negativeSentimentThreshold,
    double likelihoodThreshold
) {
    /** Consecutive cycles a condition must hold for trend-based transitions. */
    public static final int CONFIRMATION_CYCLES = 2;

    public static final StageThresholds DEFAULTS = new StageThresholds(5, 20.0, 40.0, 70.0, 50.0, 35.0, 0.7);

    public StageThresholds validated() {
        List<String> violations = new ArrayList<>();
        if (minPosts < 1) violations.add("minPosts must be >= 1 but was " + minPosts);
        checkScore("lowThreshold", lowThreshold, violations);
        checkScore("momentumThreshold", momentumThreshold, violations);
        checkScore("highThreshold", highThreshold, violations);
        checkScore("elevatedThreshold", elevatedThreshold, violations);
        checkScore("negativeSentimentThreshold", negativeSentimentThreshold, violations);
        if (Double.isNaN(likelihoodThreshold) || likelihoodThreshold < 0.0 || likelihoodThreshold > 1.0) {
            violations.add("likelihoodThreshold must be within [0, 1] but was " + likelihoodThreshold);
        }
        if (violations.isEmpty() && !(lowThreshold < momentumThreshold && momentumThreshold <= highThreshold)) {
            violations.add("thresholds must satisfy low < momentum <= high");
        }
        if (!violations.isEmpty()) {
            throw new ConfigValidationException(violations);
        }
        return this;
    }

    private static void checkScore(String name, double value, List<String> violations) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            violations.add(name + " must be within [0, 100] but was " + value);
        }
    }
}
