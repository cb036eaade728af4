package com.expertpanel.common.exception;

/**
 * Failure of a single generation call. Always recovered into a fallback value and never
 * propagated past the opinion or decision boundary.
 */
public class GenerationException extends RuntimeException {
    private final GenerationFailure failure;

    public GenerationException(GenerationFailure failure, String message) {
        super(failure + ": " + message);
        this.failure = failure;
    }

    public GenerationException(GenerationFailure failure, String message, Throwable cause) {
        super(failure + ": " + message, cause);
        this.failure = failure;
    }

    public GenerationFailure getFailure() {
        return failure;
    }
}
