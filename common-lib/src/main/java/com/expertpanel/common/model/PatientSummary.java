package com.expertpanel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Plain-language rewrite of a final {@link Decision} for the patient.
 *
 * <p>{@code fallback} is true when the text was built from the decision's lists without a
 * model call.
 */
public record PatientSummary(
    @JsonProperty("summaryText") String summaryText,
    @JsonProperty("disclaimers") List<String> disclaimers,
    @JsonProperty("fallback")    boolean fallback
) {
    public PatientSummary {
        summaryText = summaryText == null ? "" : summaryText;
        disclaimers = disclaimers == null ? List.of() : List.copyOf(disclaimers);
    }
}
