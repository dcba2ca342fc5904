package org.gamma.geobatch.metrics;

import org.gamma.geobatch.util.ConcurrencyUtils;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Logs the tracker's progress at a fixed interval on its own thread, and once more when stopped.
 */
public class ProgressReporter implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ProgressReporter.class.getName());
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(500);

    private final ProgressTracker tracker;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public ProgressReporter(ProgressTracker tracker) {
        this(tracker, DEFAULT_INTERVAL);
    }

    public ProgressReporter(ProgressTracker tracker, Duration interval) {
        this.tracker = tracker;
        this.interval = interval;
    }

    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(ConcurrencyUtils.createPlatformThreadFactory("Progress-"));
        scheduler.scheduleAtFixedRate(this::report, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    void report() {
        LOGGER.info(tracker.describe());
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) return;
        ConcurrencyUtils.shutdownExecutorService(scheduler, "Progress", Duration.ofSeconds(5));
        scheduler = null;
        report();
    }
}
