package org.gamma.geobatch.processing;

import org.gamma.geobatch.client.Geocoder;
import org.gamma.geobatch.error.BatchProcessingException;
import org.gamma.geobatch.error.ErrorClassifier;
import org.gamma.geobatch.metrics.BatchSummary;
import org.gamma.geobatch.metrics.ProgressReporter;
import org.gamma.geobatch.metrics.ProgressTracker;
import org.gamma.geobatch.retry.RetryOptions;
import org.gamma.geobatch.retry.RetryingRequestExecutor;
import org.gamma.geobatch.util.ConcurrencyUtils;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Geocodes a CSV input into a CSV output with one reader, {@code workers} workers and one writer connected by
 * bounded channels.
 * <p>
 * A run goes through {@link PipelineState#INIT}, {@link PipelineState#PREFLIGHTING}, {@link PipelineState#RUNNING}
 * and {@link PipelineState#DRAINING} to {@link PipelineState#COMPLETED}, or ends in {@link PipelineState#FAILED}
 * from any of them. Failures of single rows are handled by the {@link ErrorPolicy}; anything fatal (bad options,
 * failed pre-flight check, a row failing under {@link ErrorPolicy#FAIL}, an I/O error) aborts the run and is
 * reported as one {@link BatchProcessingException}. Rows already written stay in the output.
 * <p>
 * An instance runs one batch only.
 */
public class BatchGeocoder {

    private static final Logger LOGGER = Logger.getLogger(BatchGeocoder.class.getName());

    private final Geocoder geocoder;
    private final BatchOptions options;
    private final RetryingRequestExecutor requestExecutor;
    private final PreflightProbe probe;

    private final BoundedChannel<Job> jobs = new BoundedChannel<>(BoundedChannel.DEFAULT_CAPACITY);
    private final BoundedChannel<BatchResult> results = new BoundedChannel<>(BoundedChannel.DEFAULT_CAPACITY);
    private final ProgressTracker tracker = new ProgressTracker();
    private final AtomicReference<Throwable> fatalCause = new AtomicReference<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile PipelineState state = PipelineState.INIT;

    public BatchGeocoder(Geocoder geocoder, BatchOptions options) {
        this(geocoder, options, new RetryingRequestExecutor(new ErrorClassifier(),
                RetryOptions.defaults().withMaxRetries(options.retries())));
    }

    public BatchGeocoder(Geocoder geocoder, BatchOptions options, RetryingRequestExecutor requestExecutor) {
        this.geocoder = Objects.requireNonNull(geocoder, "geocoder cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.requestExecutor = Objects.requireNonNull(requestExecutor, "requestExecutor cannot be null");
        this.probe = new PreflightProbe(new ErrorClassifier());
    }

    public PipelineState getState() {
        return state;
    }

    public ProgressTracker getProgress() {
        return tracker;
    }

    /**
     * Geocodes {@code input} into {@code output}, both UTF-8 files opened and closed by this method.
     */
    public BatchSummary run(final Path input, final Path output) throws BatchProcessingException {
        final Instant start = begin();
        final CompletableFuture<PreflightResult> preflight = startPreflight();
        try (Reader in = Files.newBufferedReader(input, StandardCharsets.UTF_8);
             Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            return execute(in, input, out, preflight, start);
        } catch (IOException e) {
            throw fail(new BatchProcessingException("I/O error on batch files: " + e.getMessage(), e));
        }
    }

    /**
     * Geocodes a CSV stream into another. The streams stay open; the output is flushed.
     */
    public BatchSummary run(final Reader input, final Writer output) throws BatchProcessingException {
        final Instant start = begin();
        return execute(input, null, output, startPreflight(), start);
    }

    private Instant begin() throws BatchProcessingException {
        if (!started.compareAndSet(false, true)) {
            throw new BatchProcessingException("This batch has already been run");
        }
        if (options.errorPolicy() == null) {
            throw fail(new BatchProcessingException("Invalid on_error option: null. Must be one of log, skip, fail"));
        }
        transition(PipelineState.PREFLIGHTING);
        return Instant.now();
    }

    private CompletableFuture<PreflightResult> startPreflight() {
        final ExecutorService preflightExecutor =
                Executors.newSingleThreadExecutor(ConcurrencyUtils.createPlatformThreadFactory("Preflight-"));
        try {
            return CompletableFuture.supplyAsync(() -> probe.probe(geocoder, options.timeout()), preflightExecutor);
        } finally {
            preflightExecutor.shutdown(); // the submitted probe still runs
        }
    }

    private BatchSummary execute(final Reader in, final Path inPath, final Writer out,
                                 final CompletableFuture<PreflightResult> preflight, final Instant start)
            throws BatchProcessingException {
        final int workerCount = resolveWorkerCount(preflight);
        transition(PipelineState.RUNNING);

        final ExecutorService pool = Executors.newFixedThreadPool(workerCount + 2,
                ConcurrencyUtils.createPlatformThreadFactory("GeoBatch-"));
        final ProgressReporter reporter = options.progress() ? new ProgressReporter(tracker) : null;
        final CsvRowWriter csv = new CsvRowWriter(out, false);
        try {
            if (reporter != null) reporter.start();
            LOGGER.info(String.format("Starting batch with %d worker(s).", workerCount));

            final CompletableFuture<BatchReader.Stats> readerFuture =
                    supervise("Reader", new BatchReader(in, inPath, jobs, options, tracker), pool);
            final CompletableFuture<Long> writerFuture =
                    supervise("Writer", new BatchWriter(results, csv, options, tracker, this::isAborted), pool);
            final List<CompletableFuture<BatchWorker.Stats>> workerFutures = new ArrayList<>(workerCount);
            for (int i = 1; i <= workerCount; i++) {
                workerFutures.add(supervise("Worker " + i,
                        new BatchWorker(i, geocoder, requestExecutor, jobs, results, options, this::isAborted), pool));
            }

            ConcurrencyUtils.awaitAllAndCollectFailures("Reader", List.of(readerFuture));
            ConcurrencyUtils.awaitAllAndCollectFailures("Worker", workerFutures);
            if (!isAborted()) {
                transition(PipelineState.DRAINING);
            }
            results.close();
            ConcurrencyUtils.awaitAllAndCollectFailures("Writer", List.of(writerFuture));

            if (isAborted()) {
                throw fail(asBatchError(fatalCause.get()));
            }
            csv.close();

            final BatchReader.Stats read = readerFuture.join();
            long failed = 0;
            long skipped = read.rowsSkipped();
            for (CompletableFuture<BatchWorker.Stats> f : workerFutures) {
                failed += f.join().failed();
                skipped += f.join().skipped();
            }
            transition(PipelineState.COMPLETED);
            return new BatchSummary(state, workerCount, read.rowsRead(), read.jobsQueued(), writerFuture.join(),
                    failed, skipped, Duration.between(start, Instant.now()));
        } catch (IOException e) {
            throw fail(new BatchProcessingException("Failed to flush batch output: " + e.getMessage(), e));
        } finally {
            if (reporter != null) reporter.close();
            jobs.abort();
            results.abort();
            ConcurrencyUtils.shutdownExecutorService(pool, "GeoBatch");
        }
    }

    private int resolveWorkerCount(final CompletableFuture<PreflightResult> preflight) throws BatchProcessingException {
        final PreflightResult result;
        try {
            result = preflight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fail(new BatchProcessingException("Interrupted during API key pre-flight check", e));
        } catch (ExecutionException e) {
            throw fail(new BatchProcessingException("API key pre-flight check failed: " + e.getCause(), e.getCause()));
        }

        if (result.isConstrained() && options.workers() > 1) {
            LOGGER.warning(String.format("Free trial account detected (limit %d requests/day). "
                                         + "Reducing workers from %d to 1.", PreflightProbe.FREE_TIER_LIMIT, options.workers()));
            return 1;
        }
        if (result.hasError()) {
            throw fail(new BatchProcessingException("API key pre-flight check failed: " + result.errorMessage()));
        }
        return options.workers();
    }

    /**
     * Runs a pipeline task on the pool. Any failure of the task aborts the whole batch.
     */
    private <T> CompletableFuture<T> supervise(final String name, final Callable<T> task, final ExecutorService pool) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(name + " interrupted", e);
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, pool).whenComplete((value, ex) -> {
            if (ex != null) {
                abort(name, ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex);
            }
        });
    }

    private void abort(final String source, final Throwable cause) {
        if (!fatalCause.compareAndSet(null, cause)) {
            LOGGER.log(Level.FINE, source + " also failed after abort: " + cause.getMessage());
            return;
        }
        LOGGER.log(Level.SEVERE, String.format("%s failed, aborting batch: %s", source, cause.getMessage()), cause);
        final int droppedJobs = jobs.abort();
        final int droppedResults = results.abort();
        LOGGER.fine(() -> String.format("Dropped %d queued job(s) and %d unwritten result(s).", droppedJobs, droppedResults));
        transition(PipelineState.FAILED);
    }

    private boolean isAborted() {
        return fatalCause.get() != null;
    }

    private static BatchProcessingException asBatchError(final Throwable cause) {
        if (cause instanceof BatchProcessingException bpe) return bpe;
        return new BatchProcessingException("Batch processing failed: " + cause.getMessage(), cause);
    }

    private synchronized BatchProcessingException fail(final BatchProcessingException error) {
        // a run that throws always ends FAILED, even if closing the files failed after completion
        if (state != PipelineState.FAILED) {
            LOGGER.info(String.format("Batch state: %s -> %s", state, PipelineState.FAILED));
            state = PipelineState.FAILED;
        }
        return error;
    }

    private synchronized void transition(final PipelineState next) {
        if (state == next || state.isTerminal()) return;
        LOGGER.info(String.format("Batch state: %s -> %s", state, next));
        state = next;
    }
}
