package org.gamma.geobatch.config;

import org.gamma.geobatch.retry.RetryOptions;

import java.time.Duration;

/**
 * Connection settings of the geocoding client, as read from the {@code geocoder:} section of the YAML config.
 * Null fields fall back to the defaults below.
 */
public record GeocoderSettings(String apiKey, String apiBaseUrl, String userAgentComment, Double timeoutSeconds,
                               Integer retries, Long baseDelayMillis, Double backoffFactor, Double jitter,
                               Long maxDelayMillis) {

    public static final String DEFAULT_API_BASE_URL = "https://api.opencagedata.com/geocode/v1/json";
    public static final String API_KEY_ENV = "OPENCAGE_API_KEY";

    public static GeocoderSettings defaults() {
        return new GeocoderSettings(null, null, null, null, null, null, null, null, null);
    }

    public GeocoderSettings withApiKey(String key) {
        return new GeocoderSettings(key, apiBaseUrl, userAgentComment, timeoutSeconds, retries, baseDelayMillis,
                backoffFactor, jitter, maxDelayMillis);
    }

    public GeocoderSettings withApiBaseUrl(String url) {
        return new GeocoderSettings(apiKey, url, userAgentComment, timeoutSeconds, retries, baseDelayMillis,
                backoffFactor, jitter, maxDelayMillis);
    }

    /**
     * The configured key, or the {@value #API_KEY_ENV} environment variable when none is configured.
     */
    public String resolveApiKey() {
        if (apiKey != null && !apiKey.isBlank()) return apiKey;
        String env = System.getenv(API_KEY_ENV);
        return env == null ? "" : env;
    }

    public String resolveApiBaseUrl() {
        return apiBaseUrl == null || apiBaseUrl.isBlank() ? DEFAULT_API_BASE_URL : apiBaseUrl;
    }

    public Duration timeout() {
        return Duration.ofMillis((long) ((timeoutSeconds != null ? timeoutSeconds : 60.0) * 1000));
    }

    public RetryOptions retryOptions() {
        RetryOptions d = RetryOptions.defaults();
        return new RetryOptions(
                retries != null ? retries : d.maxRetries(),
                baseDelayMillis != null ? Duration.ofMillis(baseDelayMillis) : d.baseDelay(),
                backoffFactor != null ? backoffFactor : d.factor(),
                jitter != null ? jitter : d.jitter(),
                maxDelayMillis != null ? Duration.ofMillis(maxDelayMillis) : d.maxDelay());
    }
}
