package com.expertpanel.deliberation.summary;

import com.expertpanel.common.model.Decision;

public final class PatientSummaryPromptBuilder {

    public static final String SUMMARY_SYSTEM_PROMPT = """
        [Task]
        Rewrite the medical panel's consensus for the patient in plain language.

        [Guidelines]
        1. Avoid complex medical terms, or explain them in a few words
        2. Keep every hypothesis and recommended test from the consensus
        3. Keep safety warnings and recommendations clear
        4. Do not add diagnoses, treatments or tests the panel did not name

        [Output Format]
        **Consultation Summary**
        [What the panel found]

        **Recommendations**
        [Recommended tests and visits]

        **Precautions**
        [Warning signs to watch for]

        **Next Steps**
        [What the patient should do now]
        """;

    private PatientSummaryPromptBuilder() {}

    public static String summaryUserPrompt(Decision decision) {
        StringBuilder prompt = new StringBuilder("**Medical panel consensus**\n");
        prompt.append("Hypotheses under consideration:\n");
        decision.consensusHypotheses().forEach(h -> prompt.append("- ").append(h).append('\n'));
        prompt.append("Recommended tests:\n");
        decision.prioritizedTests().forEach(t -> prompt.append("- ").append(t).append('\n'));
        if (!decision.rationale().isBlank()) {
            prompt.append("Panel rationale:\n").append(decision.rationale()).append('\n');
        }
        return prompt.toString();
    }
}
