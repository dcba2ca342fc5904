package org.gamma.geobatch.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for handling concurrency, executors, and futures.
 */
public final class ConcurrencyUtils {

    private static final Logger LOGGER = Logger.getLogger(ConcurrencyUtils.class.getName());
    private static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    } // Prevent instantiation

    /**
     * Creates a ThreadFactory for named daemon platform threads: prefix0, prefix1, ...
     */
    public static ThreadFactory createPlatformThreadFactory(final String prefix) {
        final AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Gracefully shuts down an ExecutorService.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name) {
        shutdownExecutorService(executor, name, SHUTDOWN_WAIT_TIMEOUT);
    }

    public static void shutdownExecutorService(final ExecutorService executor, final String name, final Duration timeout) {
        if (executor == null) return;
        LOGGER.fine(() -> "Attempting graceful shutdown of executor: " + name);

        executor.shutdown(); // Disable new tasks
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning(String.format("Executor %s did not terminate in %dms, attempting forceful shutdown...", name, timeout.toMillis()));
                final List<Runnable> droppedTasks = executor.shutdownNow(); // Cancel executing tasks
                LOGGER.warning(String.format("Executor %s forcing shutdown. Dropped %d waiting tasks.", name, droppedTasks.size()));

                if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS))
                    LOGGER.severe(String.format("Executor %s did not terminate even after forcing.", name));
                else
                    LOGGER.fine(() -> "Executor " + name + " terminated after forcing.");

            } else
                LOGGER.fine(() -> "Executor " + name + " terminated gracefully.");

        } catch (final InterruptedException ie) {
            LOGGER.warning(String.format("Shutdown wait for executor %s interrupted. Forcing shutdown now.", name));
            executor.shutdownNow(); // Re-cancel if interrupted
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
    }

    /**
     * Waits for every future and returns the failures, unwrapped from {@link CompletionException}.
     * An empty list means all of them completed normally.
     */
    public static List<Throwable> awaitAllAndCollectFailures(final String levelName, final List<? extends CompletableFuture<?>> futures) {
        final List<Throwable> failures = new ArrayList<>();
        if (futures.isEmpty()) {
            LOGGER.fine(() -> "No " + levelName + " task to wait for.");
            return failures;
        }
        LOGGER.fine(() -> String.format("Waiting for %d %s task(s)...", futures.size(), levelName));

        for (final CompletableFuture<?> future : futures) {
            try {
                future.join();
            } catch (final CompletionException e) {
                final Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOGGER.log(Level.FINE, String.format("%s task completed exceptionally: %s", levelName, cause.getMessage()));
                failures.add(cause);
            } catch (final CancellationException e) {
                LOGGER.log(Level.FINE, levelName + " task was cancelled.");
                failures.add(e);
            }
        }
        LOGGER.fine(() -> String.format("Finished waiting for %s. %d of %d failed.", levelName, failures.size(), futures.size()));
        return failures;
    }
}
