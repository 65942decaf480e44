package com.memeinsight.common.stage;

import com.memeinsight.common.model.Stage;

import java.time.Instant;

/**
 * Finite-state machine for the ticker lifecycle.
 *
 * <pre>
 *   START → RISING_INTEREST → STOCK_RISING → WITHIN_ESTIMATED_PEAK → DO_NOT_BUY
 *     └──────────┴───────────────┴──────────────────┴──────────────────┴──→ DROPPING
 *                                 ↑                                   │
 *                                 └──────────── recovery ─────────────┘
 * </pre>
 *
 * <h3>Rules (first match wins, at most one transition per cycle)</h3>
 * <ol>
 *   <li>Malformed input → hold.</li>
 *   <li>{@code DROPPING} is terminal for the activity window.</li>
 *   <li>Any stage → {@code DROPPING}: impact below {@code lowThreshold} for
 *       {@value StageThresholds#CONFIRMATION_CYCLES} consecutive cycles.</li>
 *   <li>{@code START → RISING_INTEREST}: mentions ≥ {@code minPosts} and impact rising
 *       for {@value StageThresholds#CONFIRMATION_CYCLES} consecutive cycles.</li>
 *   <li>{@code RISING_INTEREST → STOCK_RISING}: impact ≥ {@code momentumThreshold} and
 *       momentum sub-score above neutral.</li>
 *   <li>{@code STOCK_RISING → WITHIN_ESTIMATED_PEAK}: impact ≥ {@code highThreshold} and
 *       likelihood ≥ {@code likelihoodThreshold}.</li>
 *   <li>{@code WITHIN_ESTIMATED_PEAK → DO_NOT_BUY}: sentiment sub-score ≤
 *       {@code negativeSentimentThreshold} while impact ≥ {@code elevatedThreshold}.</li>
 *   <li>{@code DO_NOT_BUY → STOCK_RISING}: sentiment back at or above neutral, momentum
 *       above neutral and impact ≥ {@code momentumThreshold}.</li>
 * </ol>
 *
 * <p>The decline flag is raised on entry to {@code DO_NOT_BUY} or {@code DROPPING} and
 * cleared on entry to {@code RISING_INTEREST} or {@code STOCK_RISING}.
 *
 * <p>Pure static utility without side effects.
 */
public final class StageClassifier {

    private static final double NEUTRAL = 50.0;

    private StageClassifier() {}

    public static StageState evaluate(StageState previous, StageInput input,
                                      StageThresholds thresholds, Instant now) {
        if (previous == null) {
            previous = StageState.initial(now);
        }
        if (input == null || !input.isWellFormed()) {
            return previous.held();
        }

        double impact = input.impactScore();
        int trendStreak = previous.previousImpact() != null && impact > previous.previousImpact()
            ? previous.positiveTrendStreak() + 1 : 0;
        int lowStreak = impact < thresholds.lowThreshold() ? previous.lowScoreStreak() + 1 : 0;

        Stage current = previous.stage();
        Stage target = current.isTerminal() ? current : nextStage(current, input, trendStreak, lowStreak, thresholds);

        if (target == current) {
            return new StageState(current, previous.lastTransitionAt(), previous.cyclesInStage() + 1,
                trendStreak, lowStreak, impact, previous.declineFlag());
        }

        boolean declineFlag = previous.declineFlag();
        if (target.isDeclining()) {
            declineFlag = true;
        } else if (target == Stage.RISING_INTEREST || target == Stage.STOCK_RISING) {
            declineFlag = false;
        }
        return new StageState(target, now, 1, trendStreak, lowStreak, impact, declineFlag);
    }

    private static Stage nextStage(Stage current, StageInput in, int trendStreak, int lowStreak,
                                   StageThresholds t) {
        if (lowStreak >= StageThresholds.CONFIRMATION_CYCLES) {
            return Stage.DROPPING;
        }
        double impact = in.impactScore();
        return switch (current) {
            case START -> in.mentionCount() >= t.minPosts()
                    && trendStreak >= StageThresholds.CONFIRMATION_CYCLES
                ? Stage.RISING_INTEREST : current;
            case RISING_INTEREST -> impact >= t.momentumThreshold() && in.momentumScore() > NEUTRAL
                ? Stage.STOCK_RISING : current;
            case STOCK_RISING -> impact >= t.highThreshold() && in.memeLikelihood() >= t.likelihoodThreshold()
                ? Stage.WITHIN_ESTIMATED_PEAK : current;
            case WITHIN_ESTIMATED_PEAK -> in.sentimentScore() <= t.negativeSentimentThreshold()
                    && impact >= t.elevatedThreshold()
                ? Stage.DO_NOT_BUY : current;
            case DO_NOT_BUY -> in.sentimentScore() >= NEUTRAL && in.momentumScore() > NEUTRAL
                    && impact >= t.momentumThreshold()
                ? Stage.STOCK_RISING : current;
            case DROPPING -> current;
        };
    }
}
