package org.gamma.geobatch.client;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.gamma.geobatch.config.GeocoderSettings;
import org.gamma.geobatch.error.ErrorKind;
import org.gamma.geobatch.error.GeocoderException;
import org.gamma.geobatch.model.GeocodeResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class OpenCageGeocoderTest {

    private static final String KEY = "0123456789abcdef0123456789abcdef";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private static final String BERLIN = """
            {
              "documentation": "https://opencagedata.com/api",
              "rate": {"limit": 2500, "remaining": 2499, "reset": 1700000000},
              "results": [{
                "components": {"_type": "city", "city": "Berlin", "country": "Germany"},
                "confidence": 4,
                "formatted": "Berlin, Germany",
                "geometry": {"lat": 52.5170365, "lng": 13.3888599},
                "unexpected": true
              }],
              "status": {"code": 200, "message": "OK"},
              "total_results": 1
            }
            """;

    /**
     * Answers every call with one canned response and remembers the requests.
     */
    private static final class CannedResponses implements Interceptor {
        final List<Request> requests = Collections.synchronizedList(new ArrayList<>());
        private final int code;
        private final String body;
        private final Map<String, String> headers;

        CannedResponses(int code, String body, Map<String, String> headers) {
            this.code = code;
            this.body = body;
            this.headers = headers;
        }

        @Override
        public Response intercept(Chain chain) {
            requests.add(chain.request());
            Response.Builder builder = new Response.Builder()
                    .request(chain.request())
                    .protocol(Protocol.HTTP_1_1)
                    .code(code)
                    .message("canned")
                    .body(ResponseBody.create(body, JSON));
            headers.forEach(builder::header);
            return builder.build();
        }
    }

    private static final class FailingTransport implements Interceptor {
        @Override
        public Response intercept(Chain chain) throws IOException {
            throw new IOException("connection refused");
        }
    }

    private static OpenCageGeocoder geocoder(Interceptor interceptor) throws GeocoderException {
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(interceptor).build();
        return new OpenCageGeocoder(GeocoderSettings.defaults().withApiKey(KEY), client);
    }

    private static GeocoderException failure(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        return assertInstanceOf(GeocoderException.class, e.getCause());
    }

    @Test
    void successfulResponse_isParsed() throws Exception {
        CannedResponses canned = new CannedResponses(200, BERLIN, Map.of());
        GeocodeResponse response = geocoder(canned).geocodeAsync("Berlin", Map.of("no_annotations", true, "limit", 1)).get();

        assertTrue(response.hasResults());
        assertEquals("Berlin, Germany", response.results().get(0).formatted());
        assertEquals(52.5170365, response.results().get(0).geometry().lat());
        assertEquals(2500, response.rate().limit());
        assertEquals(1, response.totalResults());

        Request request = canned.requests.get(0);
        assertEquals(KEY, request.url().queryParameter("key"));
        assertEquals("Berlin", request.url().queryParameter("q"));
        assertEquals("1", request.url().queryParameter("no_annotations"));
        assertEquals("1", request.url().queryParameter("limit"));
        assertTrue(request.header("User-Agent").startsWith("geobatch/1.0.0 Java/"), request.header("User-Agent"));
    }

    @Test
    void reverseGeocode_formatsCoordinatesAndDropsLimit() throws Exception {
        CannedResponses canned = new CannedResponses(200, BERLIN, Map.of());
        geocoder(canned).reverseGeocodeAsync(51, 0, Map.of("limit", 1, "language", "de")).get();

        Request request = canned.requests.get(0);
        assertEquals("51.0,0.0", request.url().queryParameter("q"));
        assertNull(request.url().queryParameter("limit"));
        assertEquals("de", request.url().queryParameter("language"));
    }

    @Test
    void unauthorized_usesApiMessage() throws Exception {
        String body = "{\"status\": {\"code\": 401, \"message\": \"invalid API key\"}, \"results\": []}";
        GeocoderException e = failure(geocoder(new CannedResponses(401, body, Map.of())).geocodeAsync("Berlin", Map.of()));

        assertEquals(ErrorKind.NOT_AUTHORIZED, e.kind());
        assertEquals("invalid API key", e.detail());
    }

    @Test
    void quotaExceeded_readsRateInfoFromHeaders() throws Exception {
        Map<String, String> headers = Map.of("X-RateLimit-Limit", "2500", "X-RateLimit-Remaining", "0",
                "X-RateLimit-Reset", "1700006400");
        String body = "{\"status\": {\"code\": 402, \"message\": \"quota exceeded\"}}";
        GeocoderException e = failure(geocoder(new CannedResponses(402, body, headers)).geocodeAsync("Berlin", Map.of()));

        assertEquals(ErrorKind.RATE_LIMIT_EXCEEDED, e.kind());
        assertEquals(2500, e.rateInfo().limit());
        assertEquals(0, e.rateInfo().remaining());
        assertEquals(1700006400L, e.rateInfo().reset());
    }

    @Test
    void tooManyRequests_fallsBackToRateInBody() throws Exception {
        String body = "{\"rate\": {\"limit\": 15, \"remaining\": 0}, \"status\": {\"code\": 429, \"message\": \"slow down\"}}";
        GeocoderException e = failure(geocoder(new CannedResponses(429, body, Map.of())).geocodeAsync("Berlin", Map.of()));

        assertEquals(ErrorKind.TOO_MANY_REQUESTS, e.kind());
        assertEquals(15, e.rateInfo().limit());
    }

    @Test
    void serverErrorWithoutJsonBody() throws Exception {
        GeocoderException e = failure(geocoder(new CannedResponses(503, "", Map.of())).geocodeAsync("Berlin", Map.of()));

        assertEquals(ErrorKind.SERVER_ERROR, e.kind());
        assertEquals(503, e.statusCode());
    }

    @Test
    void malformedSuccessPayload_isBadResponse() throws Exception {
        assertEquals(ErrorKind.BAD_RESPONSE,
                failure(geocoder(new CannedResponses(200, "not json", Map.of())).geocodeAsync("Berlin", Map.of())).kind());
        assertEquals(ErrorKind.BAD_RESPONSE,
                failure(geocoder(new CannedResponses(200, "{\"documentation\": \"x\"}", Map.of())).geocodeAsync("Berlin", Map.of())).kind());
    }

    @Test
    void transportFailure_isNetworkError() throws Exception {
        assertEquals(ErrorKind.NETWORK_ERROR, failure(geocoder(new FailingTransport()).geocodeAsync("Berlin", Map.of())).kind());
    }

    @Test
    void blankQuery_failsWithoutRequest() throws Exception {
        CannedResponses canned = new CannedResponses(200, BERLIN, Map.of());
        assertEquals(ErrorKind.INVALID_INPUT, failure(geocoder(canned).geocodeAsync("  ", Map.of())).kind());
        assertTrue(canned.requests.isEmpty());
    }

    @Test
    void synchronousGeocode_throwsClassifiedError() throws Exception {
        String body = "{\"status\": {\"code\": 403, \"message\": \"suspended\"}}";
        OpenCageGeocoder geocoder = geocoder(new CannedResponses(403, body, Map.of()));

        GeocoderException e = assertThrows(GeocoderException.class, () -> geocoder.geocode("Berlin", Map.of()));
        assertEquals(ErrorKind.FORBIDDEN, e.kind());
        assertEquals("Berlin, Germany",
                geocoder(new CannedResponses(200, BERLIN, Map.of())).reverseGeocode(52.5, 13.4, Map.of()).results().get(0).formatted());
    }

    @Test
    void missingApiKey_isRejected() {
        GeocoderSettings settings = new GeocoderSettings(" ", null, null, null, null, null, null, null, null);
        assumeTrue(System.getenv(GeocoderSettings.API_KEY_ENV) == null, "API key set in the environment");
        GeocoderException e = assertThrows(GeocoderException.class,
                () -> new OpenCageGeocoder(settings, new OkHttpClient()));
        assertEquals(ErrorKind.INVALID_INPUT, e.kind());
    }

    @Test
    void userAgent_stripsParenthesesFromComment() {
        String ua = OpenCageGeocoder.userAgent("my app (test)");
        assertTrue(ua.startsWith("geobatch/1.0.0 Java/"), ua);
        assertTrue(ua.contains(" OkHttp/"), ua);
        assertTrue(ua.endsWith(" my app test"), ua);
    }

    @Test
    void dispatcherAllowsOneRequestPerWorkerToTheApiHost() throws Exception {
        int workers = 10;
        CountDownLatch allInFlight = new CountDownLatch(workers);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CannedResponses canned = new CannedResponses(200, BERLIN, Map.of());
        Interceptor holdUntilAllArrive = chain -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            allInFlight.countDown();
            try {
                allInFlight.await(2, TimeUnit.SECONDS);
                return canned.intercept(chain);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException(e);
            } finally {
                inFlight.decrementAndGet();
            }
        };
        GeocoderSettings settings = GeocoderSettings.defaults().withApiKey(KEY);
        OpenCageGeocoder geocoder = new OpenCageGeocoder(settings,
                OpenCageGeocoder.httpClientBuilder(settings, workers).addInterceptor(holdUntilAllArrive).build());

        List<CompletableFuture<GeocodeResponse>> calls = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            calls.add(geocoder.geocodeAsync("Berlin " + i, Map.of()));
        }
        CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        assertEquals(workers, maxInFlight.get());
        assertEquals(workers, canned.requests.size());
    }

    @Test
    void httpClientBuilder_rejectsNonPositiveConcurrency() {
        assertThrows(IllegalArgumentException.class,
                () -> OpenCageGeocoder.httpClientBuilder(GeocoderSettings.defaults(), 0));
    }
}
