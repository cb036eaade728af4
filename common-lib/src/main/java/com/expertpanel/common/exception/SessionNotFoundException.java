package com.expertpanel.common.exception;

public class SessionNotFoundException extends DeliberationException {

    public SessionNotFoundException(String sessionId) {
        super(sessionId, "session not found");
    }
}
