package com.expertpanel.common.outcome;

import java.util.Objects;
import java.util.function.Function;

/**
 * Success-or-error result returned at the parse and expert-call boundaries, so substituting
 * a fallback is an explicit call instead of a catch-all.
 *
 * @param <T> the success value type
 */
public final class Outcome<T> {

    private final T value;
    private final String error;

    private Outcome(T value, String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Outcome<T> failure(String error) {
        return new Outcome<>(null, error == null || error.isBlank() ? "unknown error" : error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** @throws IllegalStateException if this outcome is a failure */
    public T value() {
        if (!isSuccess()) throw new IllegalStateException("Outcome is a failure: " + error);
        return value;
    }

    /** @return the error description, or {@code null} on success */
    public String error() {
        return error;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? Outcome.success(mapper.apply(value)) : Outcome.failure(error);
    }

    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        return isSuccess() ? mapper.apply(value) : Outcome.failure(error);
    }

    /** Returns the value, or the fallback built from the error description. */
    public T orElseGet(Function<String, ? extends T> fallback) {
        return isSuccess() ? value : fallback.apply(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome[success=" + value + "]" : "Outcome[failure=" + error + "]";
    }
}
