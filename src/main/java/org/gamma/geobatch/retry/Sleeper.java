package org.gamma.geobatch.retry;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Waits between attempts. Swapped out in tests so backoff does not slow them down.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps on the calling thread, waking up every {@code 100 ms} to see whether the call was cancelled.
     */
    Sleeper THREAD = new Sleeper() {
        private static final long POLL_MILLIS = 100;

        @Override
        public void sleep(final Duration delay) throws InterruptedException {
            Thread.sleep(delay.toMillis());
        }

        @Override
        public void sleep(final Duration delay, final BooleanSupplier cancelled) throws InterruptedException {
            final long deadline = System.nanoTime() + delay.toNanos();
            long remaining;
            while (!cancelled.getAsBoolean() && (remaining = deadline - System.nanoTime()) > 0) {
                Thread.sleep(Math.min(POLL_MILLIS, Math.max(1, remaining / 1_000_000)));
            }
        }
    };

    void sleep(Duration delay) throws InterruptedException;

    /**
     * Sleeps for {@code delay}; may return early once {@code cancelled} reports true.
     */
    default void sleep(final Duration delay, final BooleanSupplier cancelled) throws InterruptedException {
        sleep(delay);
    }
}
