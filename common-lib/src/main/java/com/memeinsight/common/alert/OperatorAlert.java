package com.memeinsight.common.alert;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record OperatorAlert(
    @JsonProperty("source")   String source,
    @JsonProperty("reason")   String reason,
    @JsonProperty("raisedAt") Instant raisedAt,
    @JsonProperty("traceId")  String traceId
) {}
