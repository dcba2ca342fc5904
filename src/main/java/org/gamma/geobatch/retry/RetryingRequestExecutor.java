package org.gamma.geobatch.retry;

import org.gamma.geobatch.error.ErrorClassifier;
import org.gamma.geobatch.error.ErrorKind;
import org.gamma.geobatch.error.GeocoderException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one logical geocoding call with bounded exponential-backoff retry.
 * <p>
 * Every failure goes through the {@link ErrorClassifier}. Non-retryable errors are returned immediately,
 * retryable ones are retried until {@link RetryOptions#maxRetries()} retries have been spent.
 * Each retry is logged at WARNING with the parameters {@code {kind, delayMillis, attempt, maxRetries}}.
 * <p>
 * A cancelled call makes no further attempt; it returns the last classified error instead.
 */
public class RetryingRequestExecutor {

    private static final Logger LOGGER = Logger.getLogger(RetryingRequestExecutor.class.getName());

    private final ErrorClassifier classifier;
    private final RetryOptions options;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryingRequestExecutor(ErrorClassifier classifier, RetryOptions options) {
        this(classifier, options, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryingRequestExecutor(ErrorClassifier classifier, RetryOptions options, Sleeper sleeper, DoubleSupplier random) {
        this.classifier = Objects.requireNonNull(classifier);
        this.options = Objects.requireNonNull(options);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.random = Objects.requireNonNull(random);
    }

    public RetryOptions options() {
        return options;
    }

    public <T> RequestOutcome<T> execute(final Callable<T> requestFn) {
        return execute(requestFn, () -> false);
    }

    public <T> RequestOutcome<T> execute(final Callable<T> requestFn, final BooleanSupplier cancelled) {
        int attempt = 0;
        while (true) {
            attempt++;
            final GeocoderException error;
            try {
                return RequestOutcome.ok(requestFn.call());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RequestOutcome.err(new GeocoderException(ErrorKind.UNKNOWN,
                        "Request interrupted on attempt " + attempt, e));
            } catch (Exception e) {
                error = classifier.classify(e);
            }

            if (!classifier.isRetryable(error)) {
                LOGGER.log(Level.FINE, "Non-retryable error ({0}) on attempt {1}, giving up.", new Object[]{error.kind(), attempt});
                return RequestOutcome.err(error);
            }
            if (attempt > options.maxRetries()) {
                LOGGER.log(Level.SEVERE, String.format("Request failed after %d retries: %s", attempt - 1, error.getMessage()));
                return RequestOutcome.err(error);
            }

            if (cancelled.getAsBoolean()) {
                LOGGER.log(Level.FINE, "Call cancelled after attempt {0}, not retrying.", attempt);
                return RequestOutcome.err(error);
            }

            final Duration delay = options.delayFor(attempt, random.getAsDouble());
            LOGGER.log(Level.WARNING, "Retryable error ({0}) encountered. Retrying in {1} ms... (Attempt {2}/{3})",
                    new Object[]{error.kind(), delay.toMillis(), attempt, options.maxRetries()});
            try {
                sleeper.sleep(delay, cancelled);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return RequestOutcome.err(error);
            }
            if (cancelled.getAsBoolean()) {
                LOGGER.log(Level.FINE, "Call cancelled during backoff after attempt {0}, not retrying.", attempt);
                return RequestOutcome.err(error);
            }
        }
    }
}
