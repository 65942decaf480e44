package com.memeinsight.service.config;

import com.memeinsight.common.model.ScoringWeights;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the live {@link EngineSettings}. A cycle reads the settings once at its start,
 * so a weight change applies from the next cycle on.
 */
public class RuntimeSettings {

    private final AtomicReference<EngineSettings> current;

    public RuntimeSettings(EngineSettings initial) {
        this.current = new AtomicReference<>(initial.validated());
    }

    public EngineSettings get() {
        return current.get();
    }

    /** Validates {@code weights} and swaps them in. Re-applying the same weights is a no-op. */
    public EngineSettings updateWeights(ScoringWeights weights) {
        ScoringWeights valid = weights.validated();
        return current.updateAndGet(s -> s.weights().equals(valid) ? s : s.withWeights(valid));
    }
}
