package com.expertpanel.deliberation.summary;

import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.PatientSummary;
import com.expertpanel.common.outcome.Outcome;
import com.expertpanel.common.parse.FallbackFactory;
import com.expertpanel.deliberation.generation.GenerationBackend;
import com.expertpanel.deliberation.recovery.ResponseRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Turns a session's final decision into a {@link PatientSummary}.
 *
 * <p>The model rewrite goes through {@link ResponseRecovery}. When the backend fails, times out
 * or returns blank text, the summary is built offline from the decision's hypotheses and tests.
 * Either way the same fixed disclaimers are attached, and the returned {@code Mono} never errors.
 */
@Service
public class PatientSummaryService {

    private static final Logger log = LoggerFactory.getLogger(PatientSummaryService.class);

    public static final List<String> DISCLAIMERS = List.of(
        "This consultation result is for education and reference only.",
        "It does not provide a definitive diagnosis or treatment.",
        "Please consult a physician before acting on it.",
        "In an emergency, call your local emergency number or go to the nearest emergency department.");

    static final String OFFLINE_CLOSING =
        "This result is for reference only. An accurate diagnosis requires consultation with a physician.";

    private final GenerationBackend backend;
    private final ResponseRecovery recovery;

    public PatientSummaryService(@Qualifier("summaryGenerationBackend") GenerationBackend backend,
                                 ResponseRecovery recovery) {
        this.backend = backend;
        this.recovery = recovery;
    }

    public Mono<PatientSummary> summarise(String sessionId, Decision decision) {
        log.info("[PatientSummary] Summary requested. sessionId={} hypotheses={} decisionFallback={}",
                 sessionId, decision.consensusHypotheses().size(), decision.fallback());
        return recovery.recover(
            "summary/" + sessionId,
            backend,
            PatientSummaryPromptBuilder.SUMMARY_SYSTEM_PROMPT,
            PatientSummaryPromptBuilder.summaryUserPrompt(decision),
            PatientSummaryService::parse,
            reason -> offlineSummary(decision));
    }

    static Outcome<PatientSummary> parse(String text) {
        if (text == null || text.isBlank()) {
            return Outcome.failure("empty response");
        }
        return Outcome.success(new PatientSummary(text.strip(), DISCLAIMERS, false));
    }

    /** Deterministic summary listing the decision's hypotheses and tests. */
    public static PatientSummary offlineSummary(Decision decision) {
        List<String> hypotheses = decision.consensusHypotheses().isEmpty()
            ? List.of(FallbackFactory.RECOVERY_HYPOTHESIS)
            : decision.consensusHypotheses();
        List<String> tests = decision.prioritizedTests().isEmpty()
            ? List.of(FallbackFactory.RECOVERY_TEST)
            : decision.prioritizedTests();

        StringBuilder text = new StringBuilder("Consultation Summary\n\n");
        text.append("After reviewing your case, the expert panel offers the following opinion.\n\n");
        text.append("Possibilities considered:\n");
        hypotheses.forEach(h -> text.append("- ").append(h).append('\n'));
        text.append("\nRecommended tests:\n");
        tests.forEach(t -> text.append("- ").append(t).append('\n'));
        text.append('\n').append(OFFLINE_CLOSING);
        return new PatientSummary(text.toString(), DISCLAIMERS, true);
    }
}
