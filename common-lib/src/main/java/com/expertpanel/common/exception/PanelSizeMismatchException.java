package com.expertpanel.common.exception;

/**
 * Fatal for the session: the number of experts supplied differs from the panel size fixed
 * when the session was started.
 */
public class PanelSizeMismatchException extends DeliberationException {
    private final int expected;
    private final int actual;

    public PanelSizeMismatchException(String sessionId, int expected, int actual) {
        super(sessionId, "panel size mismatch: expected " + expected + " experts, got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
