package com.expertpanel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of a completed or in-progress round. {@code decision} is null while the
 * round is still open.
 */
public record RoundRecord(
    @JsonProperty("roundIndex")       int roundIndex,
    @JsonProperty("opinions")         Map<String, Opinion> opinions,
    @JsonProperty("decision")         Decision decision,
    @JsonProperty("consensusReached") boolean consensusReached
) {
    public RoundRecord {
        opinions = opinions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(opinions));
    }
}
