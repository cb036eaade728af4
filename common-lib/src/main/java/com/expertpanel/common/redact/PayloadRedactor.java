package com.expertpanel.common.redact;

import com.expertpanel.common.model.CaseContext;
import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.Opinion;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Strips free-text fields from session data before it reaches a log line.
 *
 * <p>Free text may carry identifying details the structured fields do not, so only
 * structured values and list contents survive. Apply at every point where session data
 * leaves the engine.
 */
public final class PayloadRedactor {

    /** Keys removed from generic payload maps, at any nesting depth. */
    public static final Set<String> FREE_TEXT_FIELDS = Set.of(
        "freeText", "free_text", "justification", "critique", "rationale", "description", "raw");

    public static final String REDACTED = "[redacted]";

    private PayloadRedactor() {}

    public static Map<String, Object> redactForLog(Map<String, Object> payload) {
        if (payload == null) return Map.of();
        Map<String, Object> copy = new LinkedHashMap<>();
        payload.forEach((key, value) -> {
            if (FREE_TEXT_FIELDS.contains(key)) return;
            copy.put(key, redactValue(value));
        });
        return copy;
    }

    public static Map<String, Object> redactForLog(CaseContext context) {
        if (context == null) return Map.of();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("demographics", redactForLog(context.demographics()));
        view.put("symptoms", redactForLog(context.symptoms()));
        view.put("history", redactForLog(context.history()));
        view.put("medications", redactForLog(context.medications()));
        view.put("vitals", redactForLog(context.vitals()));
        view.put("imagingEntities", context.imagingFinding().entities());
        view.put("freeText", context.freeText().isEmpty() ? "" : REDACTED);
        return view;
    }

    public static Map<String, Object> redactForLog(Opinion opinion) {
        if (opinion == null) return Map.of();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("hypotheses", opinion.hypotheses());
        view.put("recommendedTests", opinion.recommendedTests());
        view.put("fallback", opinion.fallback());
        return view;
    }

    public static Map<String, Object> redactForLog(Decision decision) {
        if (decision == null) return Map.of();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("consensusHypotheses", decision.consensusHypotheses());
        view.put("prioritizedTests", decision.prioritizedTests());
        view.put("terminationReason", decision.terminationReason());
        view.put("fallback", decision.fallback());
        return view;
    }

    @SuppressWarnings("unchecked")
    private static Object redactValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return redactForLog((Map<String, Object>) nested);
        }
        return value;
    }
}
