package com.expertpanel.deliberation.coordinator;

import com.expertpanel.common.model.CaseContext;
import com.expertpanel.common.model.DecisionRequest;
import com.expertpanel.common.model.RoundRecord;

public final class CoordinatorPromptBuilder {

    public static final String CONSENSUS_SYSTEM_PROMPT = """
        [Analysis Task]
        You coordinate a panel of independent experts. Analyse their opinions to derive consensus.

        [Strict Consensus Criteria]
        Consensus is recognised only when:
        1. At least 2 experts agree on identical or very similar diagnostic hypotheses
        2. At least 2 experts agree on the same priority diagnostic tests
        3. The agreed hypotheses and tests are supported by consistent evidence

        [Constraints]
        - Keep the entire response under 600 words; at most 5 items per list
        - Do not provide definitive diagnoses or treatments

        [Output Format]
        **Consensus Analysis**
        - Agreed Opinions: [Major points of agreement]
        - Conflicting Opinions: [Points of disagreement and reasons]

        **Integrated Hypothesis**
        - Main Candidates:
          - [Hypothesis with potential consensus]

        **Priority Tests**
        - Immediately Needed:
          - [Test with high urgency]

        **Consensus Status**
        - Consensus Reached: [Yes/No]
        - Consensus Rationale: [Specific reasons for consensus or non-consensus]
        - Consensus Expression: write "Clear consensus" or "Complete consensus" only when consensus is reached

        **Safety Considerations**
        - Warning Signs: [Findings requiring attention]
        """;

    private CoordinatorPromptBuilder() {}

    public static String consensusUserPrompt(DecisionRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("**Patient information**\n").append(caseSummary(request.caseContext())).append('\n');

        if (!request.previousRounds().isEmpty()) {
            prompt.append("**Previous rounds**\n");
            for (RoundRecord round : request.previousRounds()) {
                prompt.append("Round ").append(round.roundIndex()).append(":\n");
                round.opinions().forEach((expertId, opinion) ->
                    prompt.append("  ").append(expertId).append(": ")
                          .append(opinion.hypotheses()).append(" | ").append(opinion.recommendedTests()).append('\n'));
                if (round.decision() != null) {
                    prompt.append("  Coordinator: ").append(round.decision().consensusHypotheses())
                          .append(" | consensus=").append(round.consensusReached()).append('\n');
                }
            }
            prompt.append('\n');
        }

        prompt.append("**Round ").append(request.roundIndex()).append(" opinions**\n");
        request.opinions().forEach((expertId, opinion) ->
            prompt.append(expertId).append(":\n")
                  .append("- Hypotheses: ").append(opinion.hypotheses()).append('\n')
                  .append("- Tests: ").append(opinion.recommendedTests()).append('\n')
                  .append("- Reasoning: ").append(opinion.justification()).append('\n')
                  .append("- Critique of peers: ").append(opinion.critique()).append('\n'));

        prompt.append("""

            Strictly analyse the level of agreement between experts, the conflicting opinions,
            the integrated hypothesis candidates, the priority tests without duplicates, and
            whether consensus is reached. Only write "Clear consensus" or "Complete consensus"
            when at least 2 experts agree on the same hypothesis and the same test.
            """);
        return prompt.toString();
    }

    static String caseSummary(CaseContext context) {
        return "- Demographics: " + context.demographics() + "\n"
             + "- Symptoms: " + context.symptoms() + "\n"
             + "- History: " + context.history() + "\n"
             + "- Medications: " + context.medications() + "\n"
             + "- Imaging finding: " + context.imagingFinding().impression() + "\n"
             + "- Additional information: " + context.freeText() + "\n";
    }
}
