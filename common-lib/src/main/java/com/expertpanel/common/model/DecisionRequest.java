package com.expertpanel.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input to the coordinator for one round: this round's full opinion set plus the rounds
 * already decided.
 */
public record DecisionRequest(
    String sessionId,
    CaseContext caseContext,
    int roundIndex,
    Map<String, Opinion> opinions,
    List<RoundRecord> previousRounds
) {
    public DecisionRequest {
        opinions       = opinions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(opinions));
        previousRounds = previousRounds == null ? List.of() : List.copyOf(previousRounds);
    }
}
