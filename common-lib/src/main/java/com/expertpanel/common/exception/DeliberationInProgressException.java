package com.expertpanel.common.exception;

/**
 * A second run was requested for a session whose deliberation loop is still running.
 * The running deliberation is left untouched.
 */
public class DeliberationInProgressException extends DeliberationException {

    public DeliberationInProgressException(String sessionId) {
        super(sessionId, "deliberation already running");
    }
}
