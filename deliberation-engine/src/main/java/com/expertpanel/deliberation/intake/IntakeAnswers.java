package com.expertpanel.deliberation.intake;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw answers gathered by the intake conversation, one per question stage.
 */
public record IntakeAnswers(
    @JsonProperty("demographics") String demographics,
    @JsonProperty("history")      String history,
    @JsonProperty("symptoms")     String symptoms,
    @JsonProperty("medications")  String medications,
    @JsonProperty("notes")        List<String> notes
) {
    public IntakeAnswers {
        demographics = demographics == null ? "" : demographics;
        history      = history == null ? "" : history;
        symptoms     = symptoms == null ? "" : symptoms;
        medications  = medications == null ? "" : medications;
        notes        = notes == null ? List.of() : List.copyOf(notes);
    }
}
