package com.expertpanel.deliberation.coordinator;

import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.DecisionRequest;
import reactor.core.publisher.Mono;

/**
 * Synthesises a round's opinions into a {@link Decision}. Called once per round, only after
 * every expert of that round has reported.
 */
public interface CoordinatorAgent {

    Mono<Decision> decide(DecisionRequest request);
}
