package org.gamma.geobatch.retry;

import org.gamma.geobatch.error.GeocoderException;

import java.util.Objects;

/**
 * Result of one logical request: either a value or the classified error that ended it.
 * Passed across worker boundaries instead of exceptions.
 */
public final class RequestOutcome<T> {

    private final T value;
    private final GeocoderException error;

    private RequestOutcome(T value, GeocoderException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> RequestOutcome<T> ok(T value) {
        return new RequestOutcome<>(value, null);
    }

    public static <T> RequestOutcome<T> err(GeocoderException error) {
        return new RequestOutcome<>(null, Objects.requireNonNull(error, "error cannot be null"));
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (error != null) throw new IllegalStateException("Outcome is an error: " + error.getMessage());
        return value;
    }

    public GeocoderException error() {
        if (error == null) throw new IllegalStateException("Outcome is not an error");
        return error;
    }

    /**
     * Returns the value or throws the classified error.
     */
    public T getOrThrow() throws GeocoderException {
        if (error != null) throw error;
        return value;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok[" + value + "]" : "Err[" + error.getMessage() + "]";
    }
}
