package com.memeinsight.common.stage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.memeinsight.common.model.Stage;

import java.time.Instant;

/**
 * Classifier memory carried from one cycle to the next.
 *
 * @param cyclesInStage       consecutive cycles spent in {@code stage}, 1 on entry
 * @param positiveTrendStreak consecutive cycles with impact above the previous cycle
 * @param lowScoreStreak      consecutive cycles with impact under the low threshold
 * @param previousImpact      impact of the last evaluated cycle; null before the first
 */
public record StageState(
    @JsonProperty("stage")               Stage stage,
    @JsonProperty("lastTransitionAt")    Instant lastTransitionAt,
    @JsonProperty("cyclesInStage")       int cyclesInStage,
    @JsonProperty("positiveTrendStreak") int positiveTrendStreak,
    @JsonProperty("lowScoreStreak")      int lowScoreStreak,
    @JsonProperty("previousImpact")      Double previousImpact,
    @JsonProperty("declineFlag")         boolean declineFlag
) {
    public static StageState initial(Instant now) {
        return new StageState(Stage.START, now, 1, 0, 0, null, false);
    }

    StageState held() {
        return new StageState(stage, lastTransitionAt, cyclesInStage + 1,
            positiveTrendStreak, lowScoreStreak, previousImpact, declineFlag);
    }
}
