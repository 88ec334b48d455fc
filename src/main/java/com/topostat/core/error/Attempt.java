package com.topostat.core.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation that can fail in an expected way.
 * Holds either a value or an {@link ErrorKind} with a message, never both.
 *
 * @param <T> type of the success value
 */
public final class Attempt<T> {

    private final T value;
    private final ErrorKind error;
    private final String message;

    private Attempt(T value, ErrorKind error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> Attempt<T> ok(T value) {
        return new Attempt<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> Attempt<T> fail(ErrorKind error, String message) {
        return new Attempt<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value on failed attempt: " + error + " " + message);
        }
        return value;
    }

    public ErrorKind error() {
        return error;
    }

    public String message() {
        return message;
    }

    public <R> Attempt<R> flatMap(Function<? super T, Attempt<R>> mapper) {
        if (error != null) {
            return new Attempt<>(null, error, message);
        }
        return mapper.apply(value);
    }

    @Override
    public String toString() {
        return error == null ? "Attempt[ok=" + value + "]" : "Attempt[" + error + ": " + message + "]";
    }
}
