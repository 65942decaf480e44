package com.memeinsight.common.scoring;

import com.memeinsight.common.model.ScoringWeights;
import com.memeinsight.common.model.SubScore;
import com.memeinsight.common.model.SubScores;

/**
 * Blends the four sub-scores into the Impact Score.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>{@code availableSum = Σ w_i × s_i} over sub-scores backed by data.</li>
 *   <li>Scale by {@code Σ w_all / Σ w_available} so a missing sub-score is replaced
 *       by the weighted mean of the others instead of dragging the blend down.</li>
 *   <li>Clip to [0, 100].</li>
 * </ol>
 *
 * <p>Weights are used as given. If they sum above 1 the result saturates at 100;
 * keeping them normalized is the caller's job. With no data at all the score is
 * the neutral {@value SubScore#NEUTRAL}; a defaulted sub-score does not count as data
 * on its own.
 *
 * <p>Pure function of (sub-scores, weights): stateless and thread-safe.
 */
public final class CompositeScorer {

    private CompositeScorer() {}

    public static double impactScore(SubScores scores, ScoringWeights weights) {
        double weightedSum = 0.0;
        double availableWeight = 0.0;
        boolean anyMeasured = false;

        SubScore[] parts = {scores.volume(), scores.sentiment(), scores.momentum(), scores.shortInterest()};
        double[] w = {weights.volume(), weights.sentiment(), weights.momentum(), weights.shortInterest()};

        for (int i = 0; i < parts.length; i++) {
            SubScore part = parts[i];
            if (part == null || !part.available()) continue;
            weightedSum += w[i] * part.value();
            availableWeight += w[i];
            anyMeasured |= !part.defaulted();
        }

        if (availableWeight <= 0.0 || !anyMeasured) {
            return SubScore.NEUTRAL;
        }
        double raw = weightedSum * (weights.total() / availableWeight);
        return Math.max(0.0, Math.min(100.0, raw));
    }
}
