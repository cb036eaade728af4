package com.expertpanel.deliberation.generation;

import reactor.core.publisher.Mono;

/**
 * Text-generation service turning a prompt into free text.
 *
 * <p>Implementations may be slow, may time out, may return empty text and may truncate.
 * Callers go through {@link com.expertpanel.deliberation.recovery.ResponseRecovery}, which
 * applies the timeout and decides between retry and fallback.
 */
@FunctionalInterface
public interface GenerationBackend {

    Mono<GenerationResponse> invoke(String systemPrompt, String userPrompt);
}
