package com.expertpanel.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The coordinator's synthesis of one round's opinions.
 *
 * <p>{@code terminationReason} is non-null only when the round's text declared a stop
 * (an explicit clear/complete consensus marker).
 */
public record Decision(
    @JsonProperty("consensusHypotheses") List<String> consensusHypotheses,
    @JsonProperty("prioritizedTests")    List<String> prioritizedTests,
    @JsonProperty("rationale")           String rationale,
    @JsonProperty("terminationReason")   String terminationReason,
    @JsonProperty("fallback")            boolean fallback
) {
    public Decision {
        consensusHypotheses = consensusHypotheses == null ? List.of() : List.copyOf(consensusHypotheses);
        prioritizedTests    = prioritizedTests == null ? List.of() : List.copyOf(prioritizedTests);
        rationale           = rationale == null ? "" : rationale;
    }

    public static Decision of(List<String> consensusHypotheses, List<String> prioritizedTests, String rationale) {
        return new Decision(consensusHypotheses, prioritizedTests, rationale, null, false);
    }

    @JsonIgnore
    public boolean declaresTermination() {
        return terminationReason != null && !terminationReason.isBlank();
    }
}
