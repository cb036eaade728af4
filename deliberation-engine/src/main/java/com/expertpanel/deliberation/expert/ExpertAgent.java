package com.expertpanel.deliberation.expert;

import com.expertpanel.common.model.ExpertRequest;
import com.expertpanel.common.model.Opinion;
import reactor.core.publisher.Mono;

/**
 * An independent panel member asked for one opinion per round.
 *
 * <p>Implementations may error or time out; the round coordinator substitutes a fallback
 * opinion in that case, so one failing expert never aborts a round.
 */
public interface ExpertAgent {

    String expertId();

    Mono<Opinion> opine(ExpertRequest request);
}
