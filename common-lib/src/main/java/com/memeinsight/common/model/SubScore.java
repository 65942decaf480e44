package com.memeinsight.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A signal normalized onto [0, 100]. When the underlying data is missing the
 * sub-score is the neutral midpoint and {@code available} is false, which tells
 * the composite scorer to re-normalize over the remaining weights.
 *
 * <p>A {@code defaulted} sub-score stands in for data the provider did not report
 * and that counts as zero. It takes part in a blend but never carries one alone.
 */
public record SubScore(
    @JsonProperty("value")     double value,
    @JsonProperty("available") boolean available,
    @JsonIgnore                boolean defaulted
) {
    public static final double NEUTRAL = 50.0;

    public static SubScore of(double value) {
        return new SubScore(Math.max(0.0, Math.min(100.0, value)), true, false);
    }

    public static SubScore neutral() {
        return new SubScore(NEUTRAL, false, false);
    }

    public static SubScore defaultedZero() {
        return new SubScore(0.0, true, true);
    }
}
