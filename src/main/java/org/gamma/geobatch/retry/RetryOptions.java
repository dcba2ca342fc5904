package org.gamma.geobatch.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff settings. {@code maxRetries} counts retries, so a call is attempted at most
 * {@code maxRetries + 1} times.
 */
public record RetryOptions(int maxRetries, Duration baseDelay, double factor, double jitter, Duration maxDelay) {

    public static final int DEFAULT_MAX_RETRIES = 5;

    public RetryOptions {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        Objects.requireNonNull(baseDelay, "baseDelay cannot be null");
        Objects.requireNonNull(maxDelay, "maxDelay cannot be null");
        if (factor < 1.0) throw new IllegalArgumentException("factor must be >= 1.0, got " + factor);
        if (jitter < 0.0) throw new IllegalArgumentException("jitter must be >= 0.0, got " + jitter);
    }

    public static RetryOptions defaults() {
        return new RetryOptions(DEFAULT_MAX_RETRIES, Duration.ofSeconds(1), 2.0, 0.1, Duration.ofSeconds(60));
    }

    public RetryOptions withMaxRetries(int retries) {
        return new RetryOptions(retries, baseDelay, factor, jitter, maxDelay);
    }

    /**
     * delay = min(base * factor^(attempt-1) * (1 + jitter * random), maxDelay)
     *
     * @param attempt 1-based number of the attempt that just failed
     * @param random  a value in [0, 1)
     */
    public Duration delayFor(int attempt, double random) {
        double millis = baseDelay.toMillis() * Math.pow(factor, attempt - 1) * (1.0 + jitter * random);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }
}
