package com.expertpanel.common.redact;

import com.expertpanel.common.model.CaseContext;
import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.ImagingFinding;
import com.expertpanel.common.model.Opinion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadRedactorTest {

    @Test
    @DisplayName("nested free-text keys are removed at any depth")
    void mapPayload_nestedFreeTextRemoved() {
        Map<String, Object> payload = Map.of(
            "age", 45,
            "raw", "45 year old nurse",
            "nested", Map.of("justification", "long text", "score", 3));

        Map<String, Object> redacted = PayloadRedactor.redactForLog(payload);

        assertFalse(redacted.containsKey("raw"));
        assertEquals(45, redacted.get("age"));
        assertEquals(Map.of("score", 3), redacted.get("nested"));
    }

    @Test
    @DisplayName("case context keeps structure and masks free text")
    void caseContext_masksFreeText() {
        CaseContext context = new CaseContext(
            Map.of("raw", "I am 45", "age", 45), Map.of(), Map.of(), Map.of(), Map.of(),
            new ImagingFinding("chest x-ray with consolidation", List.of("consolidation"), "consolidation"),
            "patient reports cough for a week");

        Map<String, Object> view = PayloadRedactor.redactForLog(context);

        assertEquals(PayloadRedactor.REDACTED, view.get("freeText"));
        assertEquals(Map.of("age", 45), view.get("demographics"));
        assertEquals(List.of("consolidation"), view.get("imagingEntities"));
        assertFalse(view.toString().contains("cough for a week"));
    }

    @Test
    @DisplayName("opinion and decision views omit justification, critique and rationale")
    void opinionAndDecision_omitProse() {
        Opinion opinion = new Opinion(List.of("Pneumonia"), List.of("Chest X-ray"),
                                      "secret reasoning", "secret critique", false);
        Decision decision = Decision.of(List.of("Pneumonia"), List.of("Chest X-ray"), "secret rationale");

        assertFalse(PayloadRedactor.redactForLog(opinion).toString().contains("secret"));
        assertFalse(PayloadRedactor.redactForLog(decision).toString().contains("secret"));
        assertEquals(List.of("Pneumonia"), PayloadRedactor.redactForLog(opinion).get("hypotheses"));
    }
}
