package com.expertpanel.common.exception;

import java.util.List;

public class InvalidCaseContextException extends DeliberationException {
    private final List<String> violations;

    public InvalidCaseContextException(String sessionId, List<String> violations) {
        super(sessionId, "invalid case context: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
