package org.gamma.geobatch.processing;

import org.gamma.geobatch.client.Geocoder;
import org.gamma.geobatch.error.BatchProcessingException;
import org.gamma.geobatch.error.ErrorClassifier;
import org.gamma.geobatch.error.ErrorKind;
import org.gamma.geobatch.error.GeocoderException;
import org.gamma.geobatch.metrics.BatchSummary;
import org.gamma.geobatch.model.GeocodeResponse;
import org.gamma.geobatch.model.RateInfo;
import org.gamma.geobatch.retry.RetryOptions;
import org.gamma.geobatch.retry.RetryingRequestExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@Timeout(value = 20, unit = TimeUnit.SECONDS)
class BatchGeocoderTest {

    @Mock
    private Geocoder geocoder;

    private final RetryingRequestExecutor executor = new RetryingRequestExecutor(new ErrorClassifier(),
            RetryOptions.defaults().withMaxRetries(2), delay -> { }, () -> 0.0);

    @BeforeEach
    void setUp() {
        stubPreflight(CompletableFuture.completedFuture(GeocodeFixtures.response(GeocodeFixtures.berlin())));
    }

    private void stubPreflight(CompletableFuture<GeocodeResponse> answer) {
        lenient().when(geocoder.reverseGeocodeAsync(eq(PreflightProbe.PROBE_LAT), eq(PreflightProbe.PROBE_LNG), anyMap()))
                .thenReturn(answer);
    }

    private static BatchOptions.Builder options() {
        return BatchOptions.builder().workers(2).progress(false);
    }

    private static String csv(String header, int rows) {
        StringBuilder sb = new StringBuilder(header).append('\n');
        for (int i = 1; i <= rows; i++) sb.append("Place ").append(i).append('\n');
        return sb.toString();
    }

    private static List<String> lines(StringWriter out) {
        return List.of(out.toString().split("\n"));
    }

    private static CompletableFuture<GeocodeResponse> found() {
        return CompletableFuture.completedFuture(GeocodeFixtures.response(GeocodeFixtures.berlin()));
    }

    @Test
    void zeroResultsUnderLogPolicy_isWrittenWithStatusOnly() throws Exception {
        when(geocoder.geocodeAsync(eq("Nowhere"), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(GeocodeFixtures.response()));
        when(geocoder.geocodeAsync(eq("Berlin"), anyMap())).thenReturn(found());
        StringWriter out = new StringWriter();
        BatchGeocoder batch = new BatchGeocoder(geocoder, options().ordered(true).build(), executor);

        BatchSummary summary = batch.run(new StringReader("query\nNowhere\nBerlin\n"), out);

        assertEquals(List.of(
                "orig_col_1,formatted,geometry.lat,geometry.lng,confidence,components._type,status_message",
                "Nowhere,,,,,,ZERO_RESULTS",
                "Berlin,\"Berlin, Germany\",52.5170365,13.3888599,4,city,OK"), lines(out));
        assertEquals(PipelineState.COMPLETED, batch.getState());
        assertEquals(PipelineState.COMPLETED, summary.state());
        assertEquals(2, summary.rowsRead());
        assertEquals(2, summary.rowsWritten());
        assertEquals(1, summary.rowsFailed());
        assertEquals(0, summary.rowsSkipped());
    }

    @Test
    void requestsForceSingleResultWithoutAnnotations() throws Exception {
        when(geocoder.geocodeAsync(anyString(), anyMap())).thenReturn(found());
        BatchOptions opts = options().extraParams(Map.of("language", "de", "no_annotations", false)).build();

        new BatchGeocoder(geocoder, opts, executor).run(new StringReader("q\nBerlin\n"), new StringWriter());

        verify(geocoder).geocodeAsync("Berlin", Map.of("language", "de", "no_annotations", true, "limit", 1));
    }

    @Test
    void multiResultOutputField_doesNotForceLimit() throws Exception {
        when(geocoder.geocodeAsync(anyString(), anyMap())).thenReturn(found());
        BatchOptions opts = options().outputFields(List.of("results[1].formatted", "status_message")).build();

        new BatchGeocoder(geocoder, opts, executor).run(new StringReader("q\nBerlin\n"), new StringWriter());

        verify(geocoder).geocodeAsync("Berlin", Map.of("no_annotations", true));
    }

    @Test
    void numericColumnPair_isReverseGeocoded() throws Exception {
        when(geocoder.reverseGeocodeAsync(eq(48.8566), eq(2.3522), anyMap())).thenReturn(found());
        BatchOptions opts = options().inputColumns(List.of(1, 2)).build();
        StringWriter out = new StringWriter();

        new BatchGeocoder(geocoder, opts, executor).run(new StringReader("48.8566,2.3522\n"), out);

        assertTrue(lines(out).get(1).startsWith("48.8566,2.3522,\"Berlin, Germany\""), out.toString());
        verify(geocoder, never()).geocodeAsync(anyString(), anyMap());
    }

    @Test
    void notAuthorizedUnderFailPolicy_failsBatchAndStopsDispatching() {
        when(geocoder.geocodeAsync(anyString(), anyMap()))
                .thenReturn(CompletableFuture.failedFuture(new GeocoderException(ErrorKind.NOT_AUTHORIZED, "invalid API key")));
        BatchOptions opts = options().workers(1).errorPolicy(ErrorPolicy.FAIL).build();
        BatchGeocoder batch = new BatchGeocoder(geocoder, opts, executor);

        BatchProcessingException e = assertThrows(BatchProcessingException.class,
                () -> batch.run(new StringReader(csv("q", 1500)), new StringWriter()));

        assertEquals(ErrorKind.BATCH_PROCESSING, e.kind());
        assertInstanceOf(GeocoderException.class, e.getCause());
        assertEquals(ErrorKind.NOT_AUTHORIZED, ((GeocoderException) e.getCause()).kind());
        assertEquals(PipelineState.FAILED, batch.getState());
        verify(geocoder, times(1)).geocodeAsync(anyString(), anyMap());
    }

    @Test
    void skipPolicy_dropsFailedRows() throws Exception {
        when(geocoder.geocodeAsync(anyString(), anyMap())).thenReturn(found());
        when(geocoder.geocodeAsync(eq("Bad place"), anyMap()))
                .thenReturn(CompletableFuture.failedFuture(new GeocoderException(ErrorKind.BAD_REQUEST, "bad")));
        StringWriter out = new StringWriter();

        BatchSummary summary = new BatchGeocoder(geocoder, options().errorPolicy(ErrorPolicy.SKIP).ordered(true).build(), executor)
                .run(new StringReader("q\nBerlin\nBad place\nHamburg\n"), out);

        List<String> rows = lines(out);
        assertEquals(3, rows.size());
        assertTrue(rows.get(1).startsWith("Berlin,"));
        assertTrue(rows.get(2).startsWith("Hamburg,"));
        assertEquals(1, summary.rowsSkipped());
        assertEquals(2, summary.rowsWritten());
    }

    @Test
    void logPolicy_writesErrorKind() throws Exception {
        when(geocoder.geocodeAsync(anyString(), anyMap()))
                .thenReturn(CompletableFuture.failedFuture(new GeocoderException(ErrorKind.FORBIDDEN, "suspended")));
        StringWriter out = new StringWriter();

        BatchSummary summary = new BatchGeocoder(geocoder, options().outputFields(List.of("formatted", "status_message")).build(), executor)
                .run(new StringReader("q\nBerlin\n"), out);

        assertEquals("Berlin,,FORBIDDEN", lines(out).get(1));
        assertEquals(1, summary.rowsFailed());
    }

    @Test
    void transientErrorsAreRetried() throws Exception {
        when(geocoder.geocodeAsync(anyString(), anyMap()))
                .thenReturn(CompletableFuture.failedFuture(new GeocoderException(ErrorKind.TOO_MANY_REQUESTS, "slow down")))
                .thenReturn(found());
        StringWriter out = new StringWriter();

        new BatchGeocoder(geocoder, options().workers(1).build(), executor).run(new StringReader("q\nBerlin\n"), out);

        assertTrue(lines(out).get(1).endsWith(",OK"), out.toString());
        verify(geocoder, times(2)).geocodeAsync(anyString(), anyMap());
    }

    @Test
    void freeTierKey_clampsToOneWorker() throws Exception {
        stubPreflight(CompletableFuture.completedFuture(
                GeocodeFixtures.response(new RateInfo(PreflightProbe.FREE_TIER_LIMIT, 2400, null), GeocodeFixtures.berlin())));
        when(geocoder.geocodeAsync(anyString(), anyMap())).thenReturn(found());

        BatchSummary summary = new BatchGeocoder(geocoder, options().workers(4).build(), executor)
                .run(new StringReader(csv("q", 5)), new StringWriter());

        assertEquals(1, summary.workers());
        assertEquals(5, summary.rowsWritten());
    }

    @Test
    void failedPreflight_failsBeforeAnyRowIsSent() {
        stubPreflight(CompletableFuture.failedFuture(new GeocoderException(ErrorKind.NOT_AUTHORIZED, "invalid API key")));
        BatchGeocoder batch = new BatchGeocoder(geocoder, options().build(), executor);

        BatchProcessingException e = assertThrows(BatchProcessingException.class,
                () -> batch.run(new StringReader(csv("q", 3)), new StringWriter()));

        assertEquals("API key pre-flight check failed: API key is invalid or blocked: invalid API key", e.detail());
        assertEquals(PipelineState.FAILED, batch.getState());
        verify(geocoder, never()).geocodeAsync(anyString(), anyMap());
    }

    @Test
    void missingErrorPolicy_isConfigurationError() {
        BatchGeocoder batch = new BatchGeocoder(geocoder, options().errorPolicy(null).build(), executor);

        assertThrows(BatchProcessingException.class, () -> batch.run(new StringReader("q\nBerlin\n"), new StringWriter()));

        assertEquals(PipelineState.FAILED, batch.getState());
        verifyNoInteractions(geocoder);
    }

    @Test
    void instanceRunsOnlyOnce() throws Exception {
        when(geocoder.geocodeAsync(anyString(), anyMap())).thenReturn(found());
        BatchGeocoder batch = new BatchGeocoder(geocoder, options().build(), executor);
        batch.run(new StringReader("q\nBerlin\n"), new StringWriter());

        assertThrows(BatchProcessingException.class, () -> batch.run(new StringReader("q\nBerlin\n"), new StringWriter()));
    }

    @Test
    void admissionGate_boundsConcurrentRequests() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(geocoder.geocodeAsync(anyString(), anyMap())).thenAnswer(invocation -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            return CompletableFuture.supplyAsync(() -> {
                try {
                    Thread.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                inFlight.decrementAndGet();
                return GeocodeFixtures.response(GeocodeFixtures.berlin());
            });
        });
        Semaphore gate = new Semaphore(2);

        BatchSummary summary = new BatchGeocoder(geocoder, options().workers(6).admissionGate(gate).build(), executor)
                .run(new StringReader(csv("q", 40)), new StringWriter());

        assertEquals(40, summary.rowsWritten());
        assertTrue(maxInFlight.get() <= 2, "in-flight requests exceeded the gate: " + maxInFlight.get());
        assertEquals(2, gate.availablePermits(), "every permit is released");
    }

    @Test
    void fileToFile_orderedOutputWithManyWorkers(@TempDir Path tempDir) throws Exception {
        when(geocoder.geocodeAsync(anyString(), anyMap())).thenAnswer(invocation ->
                CompletableFuture.supplyAsync(() -> {
                    try {
                        Thread.sleep(ThreadLocalRandom.current().nextInt(5));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return GeocodeFixtures.response(GeocodeFixtures.berlin());
                }));
        Path input = tempDir.resolve("in.csv");
        Path output = tempDir.resolve("out.csv");
        Files.writeString(input, csv("place", 100), StandardCharsets.UTF_8);
        BatchOptions opts = options().workers(8).ordered(true).outputFields(List.of("status_message")).build();
        BatchGeocoder batch = new BatchGeocoder(geocoder, opts, executor);

        BatchSummary summary = batch.run(input, output);

        List<String> rows = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(101, rows.size());
        assertEquals("orig_col_1,status_message", rows.get(0));
        for (int i = 1; i <= 100; i++) {
            assertEquals("Place " + i + ",OK", rows.get(i));
        }
        assertEquals(100, summary.jobsQueued());
        assertEquals(100, batch.getProgress().total().orElseThrow());
        assertEquals(100, batch.getProgress().written());
    }

    @Test
    void missingInputFile_isBatchError(@TempDir Path tempDir) {
        BatchGeocoder batch = new BatchGeocoder(geocoder, options().build(), executor);

        assertThrows(BatchProcessingException.class,
                () -> batch.run(tempDir.resolve("missing.csv"), tempDir.resolve("out.csv")));
        assertEquals(PipelineState.FAILED, batch.getState());
    }

    @Test
    void failedBatch_stopsPendingRetries() {
        CompletableFuture<GeocodeResponse> denied = new CompletableFuture<>();
        CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS).execute(() ->
                denied.completeExceptionally(new GeocoderException(ErrorKind.NOT_AUTHORIZED, "invalid API key")));
        AtomicInteger slowCalls = new AtomicInteger();
        when(geocoder.geocodeAsync(eq("Bad"), anyMap())).thenReturn(denied);
        when(geocoder.geocodeAsync(eq("Slow"), anyMap())).thenAnswer(inv -> {
            slowCalls.incrementAndGet();
            return CompletableFuture.failedFuture(new GeocoderException(ErrorKind.TOO_MANY_REQUESTS, "slow down"));
        });
        // the full backoff schedule for "Slow" would take 5 x 300 ms
        RetryingRequestExecutor slowBackoff = new RetryingRequestExecutor(new ErrorClassifier(),
                RetryOptions.defaults().withMaxRetries(5), delay -> Thread.sleep(300), () -> 0.0);
        BatchGeocoder batch = new BatchGeocoder(geocoder, options().errorPolicy(ErrorPolicy.FAIL).build(), slowBackoff);

        long start = System.nanoTime();
        BatchProcessingException e = assertThrows(BatchProcessingException.class,
                () -> batch.run(new StringReader("q\nSlow\nBad\n"), new StringWriter()));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(ErrorKind.NOT_AUTHORIZED, ((GeocoderException) e.getCause()).kind());
        assertEquals(PipelineState.FAILED, batch.getState());
        assertTrue(slowCalls.get() <= 2, "retries continued after the batch failed: " + slowCalls.get() + " calls");
        assertTrue(elapsedMillis < 1_200, "run() waited for the backoff schedule: " + elapsedMillis + " ms");
    }

    /**
     * Accepts the first {@code capacity} characters, then fails every write.
     */
    private static final class FullDisk extends Writer {
        private final int capacity;
        private int written;

        FullDisk(int capacity) {
            this.capacity = capacity;
        }

        @Override
        public void write(char[] cbuf, int off, int len) throws IOException {
            if (written + len > capacity) {
                throw new IOException("No space left on device");
            }
            written += len;
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }

    @Test
    void outputFailingMidRun_failsBatchOnceAndStopsWorkers() {
        AtomicInteger calls = new AtomicInteger();
        when(geocoder.geocodeAsync(anyString(), anyMap())).thenAnswer(inv -> {
            calls.incrementAndGet();
            return found();
        });
        BatchGeocoder batch = new BatchGeocoder(geocoder, options().build(), executor);

        // one full 8 KiB buffer of output gets through, the next one fails
        BatchProcessingException e = assertThrows(BatchProcessingException.class,
                () -> batch.run(new StringReader(csv("q", 3000)), new FullDisk(10_000)));

        assertInstanceOf(IOException.class, e.getCause());
        assertEquals(PipelineState.FAILED, batch.getState());
        assertTrue(calls.get() < 3000, "workers kept geocoding after the output failed: " + calls.get());
    }
}
