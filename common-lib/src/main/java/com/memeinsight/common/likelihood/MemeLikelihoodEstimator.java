package com.memeinsight.common.likelihood;

import com.memeinsight.common.model.SubScore;
import com.memeinsight.common.model.SubScores;

/**
 * Bayesian estimate that a ticker has entered the meme-driven regime.
 *
 * <h3>Model</h3>
 * <pre>
 *   deviation  = Σ c_i × (s_i − b_i) / 50        i ∈ {volume 0.4, sentiment 0.3, momentum 0.3}
 *   LR         = exp(sensitivity × deviation)
 *   odds'      = odds(prior) × LR
 *   posterior  = clip(odds' / (1 + odds'), 0.01, 0.99)
 * </pre>
 *
 * <p>{@code s_i} are this cycle's sub-scores and {@code b_i} the ticker's running
 * baselines ({@link LikelihoodBaselines}). Sub-scores without data contribute zero
 * deviation. The posterior is monotone in {@code deviation}, and the clip keeps it
 * away from the absorbing states 0 and 1 so later evidence can always move it.
 *
 * <p>Pure static utility, no state.
 */
public final class MemeLikelihoodEstimator {

    public static final double MIN_POSTERIOR = 0.01;
    public static final double MAX_POSTERIOR = 0.99;

    public static final double DEFAULT_PRIOR = 0.5;
    public static final double DEFAULT_SENSITIVITY = 2.0;

    private static final double VOLUME_COEFF    = 0.4;
    private static final double SENTIMENT_COEFF = 0.3;
    private static final double MOMENTUM_COEFF  = 0.3;

    private MemeLikelihoodEstimator() {}

    /**
     * Composite deviation of the sub-scores from their baselines, in [-1, 1].
     */
    public static double deviation(SubScores scores, LikelihoodBaselines baselines) {
        return VOLUME_COEFF * delta(scores.volume(), baselines.volume())
            + SENTIMENT_COEFF * delta(scores.sentiment(), baselines.sentiment())
            + MOMENTUM_COEFF * delta(scores.momentum(), baselines.momentum());
    }

    public static double update(double prior, SubScores scores, LikelihoodBaselines baselines,
                                double sensitivity) {
        return posterior(prior, deviation(scores, baselines), sensitivity);
    }

    /**
     * One Bayesian step from {@code prior} given a composite {@code deviation}.
     * A NaN prior is treated as the default prior.
     */
    public static double posterior(double prior, double deviation, double sensitivity) {
        double p = Double.isNaN(prior) ? DEFAULT_PRIOR : clip(prior);
        double d = Double.isNaN(deviation) ? 0.0 : deviation;
        double priorOdds = p / (1.0 - p);
        double posteriorOdds = priorOdds * Math.exp(sensitivity * d);
        return clip(posteriorOdds / (1.0 + posteriorOdds));
    }

    private static double delta(SubScore score, double baseline) {
        if (score == null || !score.available()) return 0.0;
        return (score.value() - baseline) / SubScore.NEUTRAL;
    }

    private static double clip(double p) {
        return Math.max(MIN_POSTERIOR, Math.min(MAX_POSTERIOR, p));
    }
}
