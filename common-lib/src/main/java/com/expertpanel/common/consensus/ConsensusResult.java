package com.expertpanel.common.consensus;

import java.util.List;

/**
 * Output of a {@link ConsensusEvaluator} run.
 *
 * <ul>
 *   <li>{@code reached}: either signal holds</li>
 *   <li>{@code declaredByDecision}: the decision carried a termination reason</li>
 *   <li>{@code overlapReached}: a hypothesis and a test were each shared by two or more experts</li>
 *   <li>{@code sharedHypotheses} / {@code sharedTests}: the normalised strings that were shared</li>
 * </ul>
 */
public record ConsensusResult(
    boolean reached,
    boolean declaredByDecision,
    boolean overlapReached,
    List<String> sharedHypotheses,
    List<String> sharedTests
) {
    public ConsensusResult {
        sharedHypotheses = sharedHypotheses == null ? List.of() : List.copyOf(sharedHypotheses);
        sharedTests      = sharedTests == null ? List.of() : List.copyOf(sharedTests);
    }

    public static ConsensusResult none() {
        return new ConsensusResult(false, false, false, List.of(), List.of());
    }
}
