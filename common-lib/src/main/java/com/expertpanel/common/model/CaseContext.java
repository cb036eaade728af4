package com.expertpanel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of the case facts a deliberation reasons about.
 *
 * <p>Assembled once before the session starts and never mutated afterwards. Field maps are
 * copied on construction so later changes to the caller's maps are not observed. Value shapes
 * (String, Number, Boolean, List or nested Map) are checked by
 * {@link com.expertpanel.common.parse.ContractValidator#caseContextViolations(CaseContext)}
 * when a session is registered.
 */
public record CaseContext(
    @JsonProperty("demographics")   Map<String, Object> demographics,
    @JsonProperty("symptoms")       Map<String, Object> symptoms,
    @JsonProperty("history")        Map<String, Object> history,
    @JsonProperty("medications")    Map<String, Object> medications,
    @JsonProperty("vitals")         Map<String, Object> vitals,
    @JsonProperty("imagingFinding") ImagingFinding imagingFinding,
    @JsonProperty("freeText")       String freeText
) {
    public CaseContext {
        demographics   = copyOf(demographics);
        symptoms       = copyOf(symptoms);
        history        = copyOf(history);
        medications    = copyOf(medications);
        vitals         = copyOf(vitals);
        imagingFinding = imagingFinding == null ? ImagingFinding.none() : imagingFinding;
        freeText       = freeText == null ? "" : freeText;
    }

    /** Context carrying symptoms and free text only. */
    public static CaseContext of(Map<String, Object> symptoms, String freeText) {
        return new CaseContext(Map.of(), symptoms, Map.of(), Map.of(), Map.of(),
                               ImagingFinding.none(), freeText);
    }

    public CaseContext withImagingFinding(ImagingFinding finding) {
        return new CaseContext(demographics, symptoms, history, medications, vitals, finding, freeText);
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
