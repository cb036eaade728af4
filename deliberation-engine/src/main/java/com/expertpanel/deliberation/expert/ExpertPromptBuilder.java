package com.expertpanel.deliberation.expert;

import com.expertpanel.common.model.CaseContext;
import com.expertpanel.common.model.ExpertRequest;
import com.expertpanel.common.model.Opinion;

import java.util.Map;

/**
 * Prompt text for expert agents. Round 1 asks for an initial analysis; later rounds ask for
 * a critique of peers and an updated opinion.
 */
public final class ExpertPromptBuilder {

    private ExpertPromptBuilder() {}

    public static String analysisSystemPrompt(String expertId) {
        return """
            [Role]
            You are General Practitioner %s, a member of a panel of independent experts
            analysing a patient case.

            [Goals]
            1. Systematically analyse the provided case information
            2. Present possible diagnostic hypotheses
            3. Recommend appropriate diagnostic tests
            4. Explain your clinical reasoning

            [Constraints]
            - Do not provide definitive diagnoses or specific treatments
            - Prioritise patient safety and flag the need for specialist consultation
            - Keep the response under 700 words; at most 5 items per list

            [Output Format]
            **Diagnostic Hypotheses** (in priority order)
            1. [Most likely hypothesis]
            2. [Second possibility]

            **Recommended Diagnostic Tests** (in priority order)
            1. [Most important test]
            2. [Second most important test]

            **Clinical Reasoning**
            - Key Findings Analysis: [Core symptoms and findings]
            - Differential Diagnosis: [Conditions to rule out]
            - Risk Assessment: [Potential risk factors]
            """.formatted(expertId);
    }

    public static String critiqueSystemPrompt(String expertId, int roundIndex) {
        return """
            [Role]
            You are General Practitioner %s. In round %d you review your colleagues' opinions
            from the previous round and update your own.

            [Goals]
            1. Evaluate colleagues' opinions on clinical validity, evidence and safety
            2. Give constructive critique of opinions, not individuals
            3. Update your hypotheses and tests to reflect new perspectives
            4. Work towards consensus where the evidence supports it

            [Constraints]
            - Keep the response under 700 words; at most 5 items per list

            [Output Format]
            **Colleague Opinion Evaluation**
            - Agreed Points: [Opinions considered valid]
            - Concerns: [Potentially problematic aspects]

            **Updated Diagnostic Hypotheses** (in priority order)
            1. [Revised first hypothesis]

            **Updated Diagnostic Tests** (in priority order)
            1. [Revised first test]

            **Revised Clinical Reasoning**
            - Update Rationale: [Reason for revision]
            """.formatted(expertId, roundIndex);
    }

    public static String initialUserPrompt(CaseContext context) {
        return """
            Patient case analysis

            **Patient information**
            %s
            Based on the information above, provide diagnostic hypotheses and recommended tests
            in priority order, with your clinical reasoning.
            """.formatted(caseSummary(context));
    }

    public static String updateUserPrompt(String expertId, ExpertRequest request) {
        StringBuilder prompt = new StringBuilder()
            .append("Patient case (round ").append(request.roundIndex()).append(")\n\n")
            .append("**Patient information**\n")
            .append(caseSummary(request.caseContext()))
            .append('\n');

        Opinion previous = request.priorOpinions().get(expertId);
        if (previous != null) {
            prompt.append("**Your previous opinion**\n")
                  .append(opinionSummary(previous))
                  .append('\n');
        }

        Map<String, Opinion> peers = request.peerOpinions(expertId);
        prompt.append("**Colleague opinions**\n");
        if (peers.isEmpty()) {
            prompt.append("(none available)\n");
        }
        peers.forEach((peerId, opinion) ->
            prompt.append(peerId).append(":\n").append(opinionSummary(opinion)));
        prompt.append('\n');

        if (!request.priorRationale().isBlank()) {
            prompt.append("**Coordinator feedback**\n")
                  .append(request.priorRationale())
                  .append("\n\n");
        }

        prompt.append("Evaluate your colleagues' opinions, then give your updated hypotheses and tests. ")
              .append("Accept valid points from colleagues and address weaknesses in your own opinion.\n");
        return prompt.toString();
    }

    static String caseSummary(CaseContext context) {
        return """
            - Demographics: %s
            - Symptoms: %s
            - History: %s
            - Medications: %s
            - Vitals: %s
            - Imaging finding: %s
            - Additional information: %s
            """.formatted(
                context.demographics(), context.symptoms(), context.history(),
                context.medications(), context.vitals(),
                context.imagingFinding().isEmpty() ? "none" : context.imagingFinding().description(),
                context.freeText());
    }

    static String opinionSummary(Opinion opinion) {
        return "- Hypotheses: " + opinion.hypotheses() + "\n"
             + "- Tests: " + opinion.recommendedTests() + "\n"
             + "- Reasoning: " + opinion.justification() + "\n";
    }
}
