package com.expertpanel.common.consensus;

import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.Opinion;

import java.util.Map;

/**
 * Strategy contract for deciding whether a round reached agreement.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no generation calls, no logging, no reactive types</li>
 *   <li><b>Non-null</b>: always return a {@link ConsensusResult}</li>
 * </ul>
 *
 * <p>The result is advisory. Whether the orchestrator stops on it is a policy decision.
 * Register as a Spring {@code @Bean} in {@code DeliberationConfig} to swap strategies.
 */
public interface ConsensusEvaluator {

    /**
     * @param opinions the round's recorded opinions keyed by expert id
     * @param decision the round's decision, or {@code null} if none was recorded
     * @return a {@link ConsensusResult}, never {@code null}
     */
    ConsensusResult evaluate(Map<String, Opinion> opinions, Decision decision);
}
