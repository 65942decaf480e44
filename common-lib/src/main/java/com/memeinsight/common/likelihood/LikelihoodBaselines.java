package com.memeinsight.common.likelihood;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.memeinsight.common.model.SubScore;
import com.memeinsight.common.model.SubScores;

/**
 * Per-ticker exponential moving averages of the sub-scores the likelihood
 * estimator measures deviation against. Seeded at the neutral midpoint.
 */
public record LikelihoodBaselines(
    @JsonProperty("volume")    double volume,
    @JsonProperty("sentiment") double sentiment,
    @JsonProperty("momentum")  double momentum
) {
    /** EMA smoothing factor. */
    public static final double ALPHA = 0.2;

    public static LikelihoodBaselines initial() {
        return new LikelihoodBaselines(SubScore.NEUTRAL, SubScore.NEUTRAL, SubScore.NEUTRAL);
    }

    /** Folds this cycle's sub-scores in; unavailable sub-scores leave their baseline untouched. */
    public LikelihoodBaselines update(SubScores scores) {
        return new LikelihoodBaselines(
            ema(volume, scores.volume()),
            ema(sentiment, scores.sentiment()),
            ema(momentum, scores.momentum()));
    }

    private static double ema(double previous, SubScore current) {
        if (current == null || !current.available()) return previous;
        return previous + ALPHA * (current.value() - previous);
    }
}
