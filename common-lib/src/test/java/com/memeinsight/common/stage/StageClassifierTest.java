package com.memeinsight.common.stage;

import com.memeinsight.common.model.Stage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StageClassifierTest {

    private static final Instant T0 = Instant.parse("2024-03-01T14:00:00Z");
    private static final StageThresholds T = StageThresholds.DEFAULTS;

    private static StageInput input(double impact) {
        return new StageInput(impact, 10, 60.0, 60.0, 0.8);
    }

    private static StageState stateIn(Stage stage) {
        return new StageState(stage, T0, 1, 0, 0, 60.0, stage.isDeclining());
    }

    @Nested
    @DisplayName("forward progression")
    class Forward {

        @Test
        @DisplayName("impact rising 10 to 90 walks the stages one step at a time")
        void risingImpact() {
            StageState state = StageState.initial(T0);
            List<Stage> visited = new ArrayList<>();
            for (double impact : new double[]{10, 26, 42, 58, 74, 90}) {
                Stage before = state.stage();
                state = StageClassifier.evaluate(state, input(impact), T, T0);
                assertTrue(state.stage().ordinal() - before.ordinal() <= 1,
                    "skipped from " + before + " to " + state.stage());
                visited.add(state.stage());
            }
            assertEquals(List.of(Stage.START, Stage.START, Stage.RISING_INTEREST, Stage.STOCK_RISING,
                Stage.WITHIN_ESTIMATED_PEAK, Stage.WITHIN_ESTIMATED_PEAK), visited);
            assertFalse(state.declineFlag());
        }

        @Test
        @DisplayName("START needs enough mentions before leaving")
        void needsMentions() {
            StageState state = StageState.initial(T0);
            for (double impact : new double[]{30, 40, 50, 60}) {
                state = StageClassifier.evaluate(state, new StageInput(impact, 2, 60, 60, 0.5), T, T0);
            }
            assertEquals(Stage.START, state.stage());
        }

        @Test
        @DisplayName("STOCK_RISING needs momentum above neutral")
        void needsMomentum() {
            StageState next = StageClassifier.evaluate(stateIn(Stage.RISING_INTEREST),
                new StageInput(80, 10, 45, 60, 0.8), T, T0);
            assertEquals(Stage.RISING_INTEREST, next.stage());
            assertEquals(2, next.cyclesInStage());
        }

        @Test
        @DisplayName("peak needs the likelihood threshold")
        void needsLikelihood() {
            StageState next = StageClassifier.evaluate(stateIn(Stage.STOCK_RISING),
                new StageInput(90, 10, 60, 60, 0.5), T, T0);
            assertEquals(Stage.STOCK_RISING, next.stage());
        }
    }

    @Nested
    @DisplayName("decline")
    class Decline {

        @Test
        @DisplayName("souring sentiment at the peak means do-not-buy and raises the flag")
        void doNotBuy() {
            Instant later = T0.plusSeconds(300);
            StageState next = StageClassifier.evaluate(stateIn(Stage.WITHIN_ESTIMATED_PEAK),
                new StageInput(60, 10, 55, 30, 0.8), T, later);
            assertEquals(Stage.DO_NOT_BUY, next.stage());
            assertTrue(next.declineFlag());
            assertEquals(later, next.lastTransitionAt());
            assertEquals(1, next.cyclesInStage());
        }

        @Test
        @DisplayName("do-not-buy recovers to STOCK_RISING and clears the flag")
        void recovery() {
            StageState next = StageClassifier.evaluate(stateIn(Stage.DO_NOT_BUY),
                new StageInput(50, 10, 60, 55, 0.6), T, T0);
            assertEquals(Stage.STOCK_RISING, next.stage());
            assertFalse(next.declineFlag());
        }

        @Test
        @DisplayName("dropping needs two consecutive low cycles")
        void droppingHysteresis() {
            StageState state = stateIn(Stage.STOCK_RISING);
            state = StageClassifier.evaluate(state, input(15), T, T0);
            assertEquals(Stage.STOCK_RISING, state.stage());
            state = StageClassifier.evaluate(state, input(30), T, T0);
            assertEquals(0, state.lowScoreStreak());
            state = StageClassifier.evaluate(state, input(15), T, T0);
            assertEquals(Stage.STOCK_RISING, state.stage());
            state = StageClassifier.evaluate(state, input(12), T, T0);
            assertEquals(Stage.DROPPING, state.stage());
            assertTrue(state.declineFlag());
        }

        @Test
        @DisplayName("dropping is terminal")
        void terminal() {
            StageState state = stateIn(Stage.DROPPING);
            for (double impact : new double[]{60, 80, 95, 95}) {
                state = StageClassifier.evaluate(state, input(impact), T, T0);
                assertEquals(Stage.DROPPING, state.stage());
            }
            assertEquals(5, state.cyclesInStage());
        }

        @Test
        @DisplayName("a fresh ticker with no interest can drop from START")
        void dropFromStart() {
            StageState state = StageState.initial(T0);
            state = StageClassifier.evaluate(state, input(5), T, T0);
            state = StageClassifier.evaluate(state, input(5), T, T0);
            assertEquals(Stage.DROPPING, state.stage());
        }
    }

    @Nested
    @DisplayName("malformed input")
    class Malformed {

        @Test
        @DisplayName("NaN or out-of-range readings hold the stage")
        void holds() {
            StageState before = stateIn(Stage.STOCK_RISING);
            StageState nan = StageClassifier.evaluate(before, new StageInput(Double.NaN, 10, 60, 60, 0.8), T, T0);
            StageState range = StageClassifier.evaluate(before, new StageInput(140, 10, 60, 60, 0.8), T, T0);
            StageState nullInput = StageClassifier.evaluate(before, null, T, T0);

            for (StageState held : List.of(nan, range, nullInput)) {
                assertEquals(Stage.STOCK_RISING, held.stage());
                assertEquals(before.previousImpact(), held.previousImpact());
                assertEquals(2, held.cyclesInStage());
            }
        }
    }

    @Test
    @DisplayName("invalid threshold sets are rejected")
    void thresholdValidation() {
        assertThrows(RuntimeException.class,
            () -> new StageThresholds(0, 50, 40, 30, 50, 35, 1.5).validated());
        assertSame(T, T.validated());
    }
}
