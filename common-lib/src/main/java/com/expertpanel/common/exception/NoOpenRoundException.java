package com.expertpanel.common.exception;

public class NoOpenRoundException extends DeliberationException {

    public NoOpenRoundException(String sessionId) {
        super(sessionId, "no open round");
    }
}
