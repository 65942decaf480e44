package com.memeinsight.common.likelihood;

import com.memeinsight.common.model.SubScore;
import com.memeinsight.common.model.SubScores;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemeLikelihoodEstimatorTest {

    private static final double S = MemeLikelihoodEstimator.DEFAULT_SENSITIVITY;

    @Nested
    @DisplayName("posterior")
    class Posterior {

        @Test
        @DisplayName("zero deviation leaves the prior unchanged")
        void zeroDeviation() {
            assertEquals(0.5, MemeLikelihoodEstimator.posterior(0.5, 0.0, S), 1e-12);
            assertEquals(0.3, MemeLikelihoodEstimator.posterior(0.3, 0.0, S), 1e-12);
        }

        @Test
        @DisplayName("result is clipped to [0.01, 0.99]")
        void clipped() {
            assertEquals(0.99, MemeLikelihoodEstimator.posterior(0.99, 1.0, S), 1e-12);
            assertEquals(0.01, MemeLikelihoodEstimator.posterior(0.01, -1.0, S), 1e-12);
        }

        @Test
        @DisplayName("repeated strong evidence never escapes the bounds")
        void repeatedEvidence() {
            double p = MemeLikelihoodEstimator.DEFAULT_PRIOR;
            for (int i = 0; i < 50; i++) {
                p = MemeLikelihoodEstimator.posterior(p, 1.0, S);
                assertTrue(p >= 0.01 && p <= 0.99);
            }
            assertEquals(0.99, p, 1e-12);
            p = MemeLikelihoodEstimator.posterior(p, -1.0, S);
            assertTrue(p < 0.99, "clipped posterior must still be movable");
        }

        @Test
        @DisplayName("monotone non-decreasing in deviation")
        void monotone() {
            double last = 0.0;
            for (int i = -10; i <= 10; i++) {
                double p = MemeLikelihoodEstimator.posterior(0.4, i / 10.0, S);
                assertTrue(p >= last, "deviation " + i / 10.0);
                last = p;
            }
        }

        @Test
        @DisplayName("NaN prior falls back to the default prior")
        void nanPrior() {
            assertEquals(0.5, MemeLikelihoodEstimator.posterior(Double.NaN, 0.0, S), 1e-12);
        }
    }

    @Nested
    @DisplayName("deviation against baselines")
    class Deviation {

        @Test
        @DisplayName("sub-scores above their baselines raise the likelihood")
        void aboveBaseline() {
            SubScores hot = new SubScores(SubScore.of(90.0), SubScore.of(80.0), SubScore.of(70.0), SubScore.of(0.0));
            LikelihoodBaselines base = LikelihoodBaselines.initial();
            double dev = MemeLikelihoodEstimator.deviation(hot, base);
            assertEquals(0.4 * 0.8 + 0.3 * 0.6 + 0.3 * 0.4, dev, 1e-12);
            assertTrue(MemeLikelihoodEstimator.update(0.5, hot, base, S) > 0.5);
        }

        @Test
        @DisplayName("unavailable sub-scores contribute nothing")
        void unavailable() {
            assertEquals(0.0, MemeLikelihoodEstimator.deviation(SubScores.neutral(), new LikelihoodBaselines(10, 90, 30)), 1e-12);
        }

        @Test
        @DisplayName("baselines drift toward observed scores and skip missing ones")
        void baselineUpdate() {
            SubScores s = new SubScores(SubScore.of(100.0), SubScore.neutral(), SubScore.of(0.0), SubScore.of(0.0));
            LikelihoodBaselines next = LikelihoodBaselines.initial().update(s);
            assertEquals(60.0, next.volume(), 1e-12);
            assertEquals(50.0, next.sentiment(), 1e-12);
            assertEquals(40.0, next.momentum(), 1e-12);
        }
    }
}
