package com.expertpanel.common.exception;

/**
 * Base type for session-level failures surfaced by the deliberation engine.
 */
public class DeliberationException extends RuntimeException {
    private final String sessionId;

    public DeliberationException(String sessionId, String message) {
        super("[" + sessionId + "] " + message);
        this.sessionId = sessionId;
    }

    public DeliberationException(String sessionId, String message, Throwable cause) {
        super("[" + sessionId + "] " + message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
