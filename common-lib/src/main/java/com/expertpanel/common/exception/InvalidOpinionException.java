package com.expertpanel.common.exception;

import java.util.List;

public class InvalidOpinionException extends DeliberationException {
    private final String expertId;
    private final List<String> violations;

    public InvalidOpinionException(String sessionId, String expertId, List<String> violations) {
        super(sessionId, "invalid opinion from " + expertId + ": " + String.join("; ", violations));
        this.expertId = expertId;
        this.violations = List.copyOf(violations);
    }

    public String getExpertId() {
        return expertId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
