package com.memeinsight.common.stage;

/**
 * One cycle's readings for a single ticker. Scores are on [0, 100], likelihood on [0, 1].
 */
public record StageInput(
    double impactScore,
    int    mentionCount,
    double momentumScore,
    double sentimentScore,
    double memeLikelihood
) {

    /** False for NaN or out-of-range readings; the classifier then holds its stage. */
    public boolean isWellFormed() {
        return inScoreRange(impactScore)
            && inScoreRange(momentumScore)
            && inScoreRange(sentimentScore)
            && !Double.isNaN(memeLikelihood) && memeLikelihood >= 0.0 && memeLikelihood <= 1.0
            && mentionCount >= 0;
    }

    private static boolean inScoreRange(double v) {
        return !Double.isNaN(v) && v >= 0.0 && v <= 100.0;
    }
}
