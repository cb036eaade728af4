package com.expertpanel.common.exception;

public class ExpertException extends RuntimeException {
    private final String expertId;

    public ExpertException(String expertId, String message) {
        super("[" + expertId + "] " + message);
        this.expertId = expertId;
    }

    public ExpertException(String expertId, String message, Throwable cause) {
        super("[" + expertId + "] " + message, cause);
        this.expertId = expertId;
    }

    public String getExpertId() {
        return expertId;
    }
}
