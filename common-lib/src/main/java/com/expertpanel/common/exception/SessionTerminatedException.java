package com.expertpanel.common.exception;

public class SessionTerminatedException extends DeliberationException {
    private final String terminationReason;

    public SessionTerminatedException(String sessionId, String terminationReason) {
        super(sessionId, "session already terminated: " + terminationReason);
        this.terminationReason = terminationReason;
    }

    public String getTerminationReason() {
        return terminationReason;
    }
}
