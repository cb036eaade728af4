package com.expertpanel.common.exception;

public class RoundInProgressException extends DeliberationException {

    public RoundInProgressException(String sessionId, int roundIndex) {
        super(sessionId, "round " + roundIndex + " has no decision yet");
    }
}
