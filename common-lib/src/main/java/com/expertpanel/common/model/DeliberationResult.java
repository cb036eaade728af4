package com.expertpanel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record DeliberationResult(
    @JsonProperty("sessionId")         String sessionId,
    @JsonProperty("totalRounds")       int totalRounds,
    @JsonProperty("terminationReason") String terminationReason,
    @JsonProperty("finalDecision")     Decision finalDecision,
    @JsonProperty("consensusReached")  boolean consensusReached,
    @JsonProperty("rounds")            List<RoundRecord> rounds,
    @JsonProperty("completedAt")       Instant completedAt
) {
    public DeliberationResult {
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
    }
}
