package com.expertpanel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One expert's structured opinion for one round.
 *
 * <p>Both lists are in priority order, most likely first. {@code fallback} is set when the
 * opinion was substituted because generation or parsing failed.
 */
public record Opinion(
    @JsonProperty("hypotheses")       List<String> hypotheses,
    @JsonProperty("recommendedTests") List<String> recommendedTests,
    @JsonProperty("justification")    String justification,
    @JsonProperty("critique")         String critique,
    @JsonProperty("fallback")         boolean fallback
) {
    public Opinion {
        hypotheses       = hypotheses == null ? List.of() : List.copyOf(hypotheses);
        recommendedTests = recommendedTests == null ? List.of() : List.copyOf(recommendedTests);
        justification    = justification == null ? "" : justification;
        critique         = critique == null ? "" : critique;
    }

    public static Opinion of(List<String> hypotheses, List<String> recommendedTests, String justification) {
        return new Opinion(hypotheses, recommendedTests, justification, "", false);
    }
}
