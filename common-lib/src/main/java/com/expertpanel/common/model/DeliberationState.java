package com.expertpanel.common.model;

/**
 * Lifecycle of a deliberation session.
 *
 * <pre>
 *   IDLE → ROUND_OPEN → OPINIONS_COLLECTED → DECISION_RECORDED → (ROUND_OPEN | TERMINATED)
 * </pre>
 */
public enum DeliberationState {
    IDLE,
    ROUND_OPEN,
    OPINIONS_COLLECTED,
    DECISION_RECORDED,
    TERMINATED
}
