package org.gamma.geobatch.processing;

import org.gamma.geobatch.client.Geocoder;
import org.gamma.geobatch.client.RequestParams;
import org.gamma.geobatch.error.BatchProcessingException;
import org.gamma.geobatch.error.ErrorKind;
import org.gamma.geobatch.error.GeocoderException;
import org.gamma.geobatch.model.GeocodeResponse;
import org.gamma.geobatch.retry.RequestOutcome;
import org.gamma.geobatch.retry.RetryingRequestExecutor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consumes jobs until the job channel ends, geocodes each one and emits a {@link BatchResult}, applying the
 * configured {@link ErrorPolicy} to failed rows.
 * <p>
 * With {@link ErrorPolicy#FAIL} the first failed row ends the worker with a {@link BatchProcessingException};
 * the coordinator then stops the rest of the pipeline. Once the batch is aborted a worker makes no further request,
 * not even a pending retry, and drops the row it was working on.
 */
public class BatchWorker implements Callable<BatchWorker.Stats> {

    private static final Logger LOGGER = Logger.getLogger(BatchWorker.class.getName());

    public record Stats(long processed, long succeeded, long failed, long skipped) {
    }

    private final int workerId;
    private final Geocoder geocoder;
    private final RetryingRequestExecutor executor;
    private final BoundedChannel<Job> jobs;
    private final BoundedChannel<BatchResult> results;
    private final BatchOptions options;
    private final Map<String, Object> params;
    private final BooleanSupplier aborted;

    public BatchWorker(int workerId, Geocoder geocoder, RetryingRequestExecutor executor, BoundedChannel<Job> jobs,
                       BoundedChannel<BatchResult> results, BatchOptions options, BooleanSupplier aborted) {
        this.workerId = workerId;
        this.geocoder = geocoder;
        this.executor = executor;
        this.jobs = jobs;
        this.results = results;
        this.options = options;
        this.params = requestParams(options);
        this.aborted = aborted;
    }

    /**
     * Extra parameters of the batch, with annotations always disabled and a single result requested unless an
     * output field reads several.
     */
    static Map<String, Object> requestParams(final BatchOptions options) {
        final Map<String, Object> params = new LinkedHashMap<>(options.extraParams());
        params.put(RequestParams.NO_ANNOTATIONS, true);
        if (!options.wantsMultipleResults()) {
            params.put(RequestParams.LIMIT, 1);
        }
        return Collections.unmodifiableMap(params);
    }

    @Override
    public Stats call() throws BatchProcessingException, InterruptedException {
        LOGGER.fine(() -> "Worker " + workerId + " started.");
        long processed = 0;
        long succeeded = 0;
        long failed = 0;
        long skipped = 0;

        Job job;
        while ((job = jobs.take()) != null) {
            processed++;
            final RequestOutcome<GeocodeResponse> outcome = geocodeGated(job);
            if (aborted.getAsBoolean()) {
                LOGGER.fine(String.format("Worker %d: batch aborted, dropping row %d.", workerId, job.rowId()));
                break;
            }
            final BatchResult result;

            if (outcome.isOk()) {
                final GeocodeResponse response = outcome.value();
                if (response.hasResults()) {
                    result = BatchResult.success(job, response.results().get(0));
                    succeeded++;
                } else {
                    LOGGER.info(String.format("L%d: Query successful but returned 0 results. Query: '%s'",
                            job.rowId(), job.queryOrCoords()));
                    result = BatchResult.failure(job, GeocoderException.zeroResults(job.queryOrCoords()));
                    failed++;
                }
            } else {
                final GeocoderException error = outcome.error();
                if (options.errorPolicy() == ErrorPolicy.FAIL) {
                    LOGGER.log(Level.SEVERE, String.format("L%d: Unrecoverable error (%s). Failing batch job.",
                            job.rowId(), error.kind()), error);
                    throw new BatchProcessingException(
                            String.format("Geocoding row %d failed: %s", job.rowId(), error.getMessage()), error);
                }
                if (options.errorPolicy() == ErrorPolicy.SKIP && error.kind() != ErrorKind.UNKNOWN) {
                    LOGGER.warning(String.format("L%d: Skipping row due to error: %s", job.rowId(), error.getMessage()));
                    skipped++;
                    continue;
                }
                LOGGER.warning(String.format("L%d: Error geocoding '%s': %s",
                        job.rowId(), job.queryOrCoords(), error.getMessage()));
                result = BatchResult.failure(job, error);
                failed++;
            }

            if (!results.put(result)) {
                LOGGER.fine(() -> "Worker " + workerId + ": result channel closed, stopping.");
                break;
            }
        }
        final Stats stats = new Stats(processed, succeeded, failed, skipped);
        LOGGER.fine(() -> "Worker " + workerId + " finished: " + stats);
        return stats;
    }

    private RequestOutcome<GeocodeResponse> geocodeGated(final Job job) throws InterruptedException {
        final Semaphore gate = options.admissionGate();
        if (gate == null) {
            return geocode(job);
        }
        gate.acquire();
        try {
            return geocode(job);
        } finally {
            gate.release();
        }
    }

    private RequestOutcome<GeocodeResponse> geocode(final Job job) {
        final long timeoutMillis = options.timeout().toMillis();
        return executor.execute(() -> send(job).get(timeoutMillis, TimeUnit.MILLISECONDS), aborted);
    }

    private CompletableFuture<GeocodeResponse> send(final Job job) {
        if (job.command() == GeocodeCommand.REVERSE) {
            final String[] coords = job.queryOrCoords().split(",", -1);
            if (coords.length != 2) {
                return CompletableFuture.failedFuture(
                        GeocoderException.invalidInput("Malformed coordinates: " + job.queryOrCoords()));
            }
            final double lat;
            final double lng;
            try {
                lat = Double.parseDouble(coords[0].strip());
                lng = Double.parseDouble(coords[1].strip());
            } catch (NumberFormatException e) {
                return CompletableFuture.failedFuture(
                        GeocoderException.invalidInput("Malformed coordinates: " + job.queryOrCoords()));
            }
            return geocoder.reverseGeocodeAsync(lat, lng, params);
        }
        return geocoder.geocodeAsync(job.queryOrCoords(), params);
    }
}
