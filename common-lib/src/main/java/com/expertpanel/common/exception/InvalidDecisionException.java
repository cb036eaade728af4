package com.expertpanel.common.exception;

import java.util.List;

public class InvalidDecisionException extends DeliberationException {
    private final List<String> violations;

    public InvalidDecisionException(String sessionId, List<String> violations) {
        super(sessionId, "invalid decision: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
