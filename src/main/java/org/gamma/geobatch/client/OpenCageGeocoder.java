package org.gamma.geobatch.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Dispatcher;
import okhttp3.HttpUrl;
import okhttp3.OkHttp;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.gamma.geobatch.config.GeocoderSettings;
import org.gamma.geobatch.error.ErrorClassifier;
import org.gamma.geobatch.error.ErrorKind;
import org.gamma.geobatch.error.GeocoderException;
import org.gamma.geobatch.model.GeocodeResponse;
import org.gamma.geobatch.model.RateInfo;
import org.gamma.geobatch.retry.RetryingRequestExecutor;
import org.gamma.geobatch.util.QueryFormat;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * {@link Geocoder} backed by the OpenCage geocoding REST API.
 * <p>
 * The async methods issue exactly one HTTP request each. The blocking {@link #geocode} and
 * {@link #reverseGeocode} methods add retry with backoff on top, as configured in {@link GeocoderSettings}.
 */
public class OpenCageGeocoder implements Geocoder {

    private static final Logger LOGGER = Logger.getLogger(OpenCageGeocoder.class.getName());

    public static final String SDK_NAME = "geobatch";
    public static final String SDK_VERSION = "1.0.0";
    /** Same as OkHttp's overall default; its per-host default is 5. */
    public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 64;
    private static final Pattern API_KEY_FORMAT = Pattern.compile("[A-Za-z0-9]{32}");

    private final String apiKey;
    private final HttpUrl baseUrl;
    private final String userAgent;
    private final Duration timeout;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final ErrorClassifier classifier;
    private final RetryingRequestExecutor executor;

    public OpenCageGeocoder(final GeocoderSettings settings) throws GeocoderException {
        this(settings, DEFAULT_MAX_CONCURRENT_REQUESTS);
    }

    /**
     * @param maxConcurrentRequests how many requests may be in flight at once, usually the number of batch workers
     */
    public OpenCageGeocoder(final GeocoderSettings settings, final int maxConcurrentRequests) throws GeocoderException {
        this(settings, httpClientBuilder(settings, maxConcurrentRequests).build());
    }

    /**
     * Client builder with the configured timeouts. All requests go to one host, so the dispatcher's per-host
     * limit is raised along with the overall one.
     */
    public static OkHttpClient.Builder httpClientBuilder(final GeocoderSettings settings, final int maxConcurrentRequests) {
        if (maxConcurrentRequests < 1) {
            throw new IllegalArgumentException("maxConcurrentRequests must be at least 1, was " + maxConcurrentRequests);
        }
        final Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(Math.max(maxConcurrentRequests, DEFAULT_MAX_CONCURRENT_REQUESTS));
        dispatcher.setMaxRequestsPerHost(maxConcurrentRequests);
        return new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectTimeout(settings.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    public OpenCageGeocoder(final GeocoderSettings settings, final OkHttpClient httpClient) throws GeocoderException {
        final String key = settings.resolveApiKey();
        if (key.isBlank()) {
            throw GeocoderException.invalidInput("API key not found. Configure geocoder.apiKey or set the "
                                                 + GeocoderSettings.API_KEY_ENV + " environment variable.");
        }
        if (!API_KEY_FORMAT.matcher(key).matches()) {
            LOGGER.warning("API key format appears potentially invalid (should be 32 alphanumeric chars).");
        }
        final HttpUrl url = HttpUrl.parse(settings.resolveApiBaseUrl());
        if (url == null) {
            throw GeocoderException.invalidInput("Invalid API base URL: " + settings.resolveApiBaseUrl());
        }
        this.apiKey = key;
        this.baseUrl = url;
        this.userAgent = userAgent(settings.userAgentComment());
        this.timeout = settings.timeout();
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.classifier = new ErrorClassifier();
        this.executor = new RetryingRequestExecutor(classifier, settings.retryOptions());
    }

    static String userAgent(final String comment) {
        final String base = SDK_NAME + "/" + SDK_VERSION + " Java/" + System.getProperty("java.version") + " OkHttp/" + OkHttp.VERSION;
        if (comment == null || comment.isBlank()) return base;
        return base + " " + comment.strip().replaceAll("[()]", "");
    }

    public String userAgent() {
        return userAgent;
    }

    @Override
    public CompletableFuture<GeocodeResponse> geocodeAsync(final String query, final Map<String, Object> params) {
        if (query == null || query.isBlank()) {
            return CompletableFuture.failedFuture(GeocoderException.invalidInput("Query cannot be empty."));
        }
        try {
            return send(query, RequestParams.toQueryParameters(params));
        } catch (GeocoderException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<GeocodeResponse> reverseGeocodeAsync(final double latitude, final double longitude,
                                                                  final Map<String, Object> params) {
        try {
            final String query = QueryFormat.formatReverseQuery(latitude, longitude);
            // the API ignores limit for reverse lookups
            final Map<String, Object> filtered = new LinkedHashMap<>(params == null ? Map.of() : params);
            filtered.remove(RequestParams.LIMIT);
            return send(query, RequestParams.toQueryParameters(filtered));
        } catch (GeocoderException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public GeocodeResponse geocode(final String query, final Map<String, Object> params) throws GeocoderException {
        return executor.execute(() -> geocodeAsync(query, params).get(timeout.toMillis(), TimeUnit.MILLISECONDS))
                .getOrThrow();
    }

    public GeocodeResponse reverseGeocode(final double latitude, final double longitude, final Map<String, Object> params)
            throws GeocoderException {
        return executor.execute(() -> reverseGeocodeAsync(latitude, longitude, params).get(timeout.toMillis(), TimeUnit.MILLISECONDS))
                .getOrThrow();
    }

    private CompletableFuture<GeocodeResponse> send(final String query, final Map<String, String> params) {
        final HttpUrl.Builder url = baseUrl.newBuilder()
                .addQueryParameter("key", apiKey)
                .addQueryParameter("q", query);
        params.forEach(url::addQueryParameter);

        final Request request = new Request.Builder()
                .url(url.build())
                .header("User-Agent", userAgent)
                .get()
                .build();

        final CompletableFuture<GeocodeResponse> future = new CompletableFuture<>();
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(classifier.classify(e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    future.complete(handleResponse(response));
                } catch (GeocoderException e) {
                    future.completeExceptionally(e);
                } catch (IOException e) {
                    future.completeExceptionally(classifier.classify(e));
                }
            }
        });
        return future;
    }

    private GeocodeResponse handleResponse(final Response response) throws IOException, GeocoderException {
        final ResponseBody body = response.body();
        final String text = body == null ? "" : body.string();
        if (response.code() != 200) {
            throw statusError(response, text);
        }
        final GeocodeResponse parsed = mapper.readValue(text, GeocodeResponse.class);
        if (parsed.status() == null || parsed.results() == null) {
            throw new GeocoderException(ErrorKind.BAD_RESPONSE, "Parsed response is missing essential fields (status, results).");
        }
        return parsed;
    }

    private GeocoderException statusError(final Response response, final String body) {
        final int status = response.code();
        String msg = "API request failed with status " + status;
        JsonNode json = null;
        try {
            json = mapper.readTree(body);
            final String apiMsg = json.path("status").path("message").asText("");
            if (!apiMsg.isEmpty()) msg = apiMsg;
        } catch (IOException e) {
            msg = body.isEmpty() ? msg + " (Could not parse error details from empty response body)" : msg + ": " + body;
            LOGGER.log(Level.FINE, "Failed to parse error response body as JSON, status " + status, e);
        }

        RateInfo rate = rateFromHeaders(response);
        if (rate == null && json != null && (status == 402 || status == 429) && json.path("rate").isObject()) {
            try {
                rate = mapper.treeToValue(json.get("rate"), RateInfo.class);
            } catch (IOException e) {
                LOGGER.log(Level.FINE, "Could not read rate info from error body", e);
            }
        }
        return classifier.fromStatus(status, msg, rate);
    }

    static RateInfo rateFromHeaders(final Response response) {
        final Long limit = parseHeader(response.header("X-RateLimit-Limit"));
        final Long remaining = parseHeader(response.header("X-RateLimit-Remaining"));
        final Long reset = parseHeader(response.header("X-RateLimit-Reset"));
        if (limit == null && remaining == null && reset == null) return null;
        return new RateInfo(limit == null ? null : limit.intValue(), remaining == null ? null : remaining.intValue(), reset);
    }

    private static Long parseHeader(final String header) {
        if (header == null || header.isBlank()) return null;
        try {
            return Long.valueOf(header.trim());
        } catch (NumberFormatException e) {
            LOGGER.warning("Found rate limit header but could not parse it as an integer: " + header);
            return null;
        }
    }
}
