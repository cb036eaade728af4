package com.expertpanel.common.exception;

/**
 * Raised by {@code beginRound} once the budget is spent. The session is terminated before
 * this is thrown, so retrying is pointless.
 */
public class RoundLimitReachedException extends DeliberationException {
    private final int maxRounds;

    public RoundLimitReachedException(String sessionId, int maxRounds) {
        super(sessionId, "round limit reached (maxRounds=" + maxRounds + ")");
        this.maxRounds = maxRounds;
    }

    public int getMaxRounds() {
        return maxRounds;
    }
}
