package com.expertpanel.deliberation.expert;

import com.expertpanel.common.model.ExpertRequest;
import com.expertpanel.common.model.Opinion;
import com.expertpanel.common.parse.FallbackFactory;
import com.expertpanel.common.parse.OpinionTextParser;
import com.expertpanel.deliberation.generation.GenerationBackend;
import com.expertpanel.deliberation.recovery.ResponseRecovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Expert whose opinion is generated by a language model and recovered into an
 * {@link Opinion}. Never errors: generation and parse failures yield the recovery fallback.
 */
public class LlmExpertAgent implements ExpertAgent {

    private static final Logger log = LoggerFactory.getLogger(LlmExpertAgent.class);

    private final String expertId;
    private final GenerationBackend backend;
    private final ResponseRecovery recovery;

    public LlmExpertAgent(String expertId, GenerationBackend backend, ResponseRecovery recovery) {
        this.expertId = expertId;
        this.backend = backend;
        this.recovery = recovery;
    }

    @Override
    public String expertId() {
        return expertId;
    }

    @Override
    public Mono<Opinion> opine(ExpertRequest request) {
        boolean followUp = !request.isInitialRound();
        String systemPrompt = followUp
            ? ExpertPromptBuilder.critiqueSystemPrompt(expertId, request.roundIndex())
            : ExpertPromptBuilder.analysisSystemPrompt(expertId);
        String userPrompt = followUp
            ? ExpertPromptBuilder.updateUserPrompt(expertId, request)
            : ExpertPromptBuilder.initialUserPrompt(request.caseContext());

        log.debug("[{}] Requesting opinion. sessionId={} round={} followUp={}",
                  expertId, request.sessionId(), request.roundIndex(), followUp);

        return recovery.recover(
            expertId + "/round-" + request.roundIndex(),
            backend,
            systemPrompt,
            userPrompt,
            text -> OpinionTextParser.parse(text, followUp),
            FallbackFactory::recoveryOpinion);
    }
}
