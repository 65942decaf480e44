package com.memeinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SubScores(
    @JsonProperty("volume")        SubScore volume,
    @JsonProperty("sentiment")     SubScore sentiment,
    @JsonProperty("momentum")      SubScore momentum,
    @JsonProperty("shortInterest") SubScore shortInterest
) {
    public static SubScores neutral() {
        return new SubScores(SubScore.neutral(), SubScore.neutral(), SubScore.neutral(), SubScore.neutral());
    }
}
