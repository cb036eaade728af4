package com.expertpanel.common.parse;

import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.Opinion;

import java.util.List;

/**
 * Conservative, always-valid substitutes used when generation or parsing fails.
 *
 * <p>Two flavours exist: the recovery fallback, produced when a generation call cannot be
 * turned into a contract value, and the expert-failure fallback, produced by the round
 * coordinator when an expert call errors or times out as a whole.
 */
public final class FallbackFactory {

    public static final String RECOVERY_HYPOTHESIS       = "requires further review";
    public static final String RECOVERY_TEST             = "specialist consultation";
    public static final String EXPERT_FAILURE_HYPOTHESIS = "needs further review";
    public static final String EXPERT_FAILURE_TEST       = "specialist referral";

    private FallbackFactory() {}

    public static Opinion recoveryOpinion(String reason) {
        return new Opinion(List.of(RECOVERY_HYPOTHESIS), List.of(RECOVERY_TEST),
                           "Opinion could not be generated: " + reason, "", true);
    }

    public static Decision recoveryDecision(String reason) {
        return new Decision(List.of(RECOVERY_HYPOTHESIS), List.of(RECOVERY_TEST),
                            "Decision could not be generated: " + reason, null, true);
    }

    public static Opinion expertFailureOpinion(String expertId, String reason) {
        return new Opinion(List.of(EXPERT_FAILURE_HYPOTHESIS), List.of(EXPERT_FAILURE_TEST),
                           "Opinion from " + expertId + " unavailable: " + reason, "", true);
    }
}
