package com.expertpanel.deliberation.coordinator;

import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.DecisionRequest;
import com.expertpanel.common.parse.DecisionTextParser;
import com.expertpanel.common.parse.FallbackFactory;
import com.expertpanel.deliberation.generation.GenerationBackend;
import com.expertpanel.deliberation.recovery.ResponseRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Coordinator whose decision text comes from a language model. The text is parsed by
 * {@link DecisionTextParser}; any failure yields the recovery fallback decision.
 */
public class LlmCoordinatorAgent implements CoordinatorAgent {

    private static final Logger log = LoggerFactory.getLogger(LlmCoordinatorAgent.class);

    private final GenerationBackend backend;
    private final ResponseRecovery recovery;

    public LlmCoordinatorAgent(GenerationBackend backend, ResponseRecovery recovery) {
        this.backend = backend;
        this.recovery = recovery;
    }

    @Override
    public Mono<Decision> decide(DecisionRequest request) {
        log.debug("[Coordinator] Requesting decision. sessionId={} round={} opinions={}",
                  request.sessionId(), request.roundIndex(), request.opinions().size());
        return recovery.recover(
            "coordinator/round-" + request.roundIndex(),
            backend,
            CoordinatorPromptBuilder.CONSENSUS_SYSTEM_PROMPT,
            CoordinatorPromptBuilder.consensusUserPrompt(request),
            DecisionTextParser::parse,
            FallbackFactory::recoveryDecision);
    }
}
