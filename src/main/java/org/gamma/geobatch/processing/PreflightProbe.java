package org.gamma.geobatch.processing;

import org.gamma.geobatch.client.Geocoder;
import org.gamma.geobatch.client.RequestParams;
import org.gamma.geobatch.error.ErrorClassifier;
import org.gamma.geobatch.error.ErrorKind;
import org.gamma.geobatch.error.GeocoderException;
import org.gamma.geobatch.model.GeocodeResponse;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Issues one small reverse lookup to validate the API key and detect a free-tier key, whose rate ceiling
 * is {@value #FREE_TIER_LIMIT}. Never throws: failures are reported through {@link PreflightResult#errorMessage()}.
 */
public class PreflightProbe {

    private static final Logger LOGGER = Logger.getLogger(PreflightProbe.class.getName());

    public static final int FREE_TIER_LIMIT = 2500;
    static final double PROBE_LAT = 51.5074;
    static final double PROBE_LNG = -0.1278;

    private final ErrorClassifier classifier;

    public PreflightProbe(ErrorClassifier classifier) {
        this.classifier = classifier;
    }

    public PreflightResult probe(final Geocoder geocoder, final Duration timeout) {
        final Map<String, Object> params = Map.of(RequestParams.LIMIT, 1, RequestParams.NO_ANNOTATIONS, true);
        try {
            final GeocodeResponse response = geocoder.reverseGeocodeAsync(PROBE_LAT, PROBE_LNG, params)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            final boolean constrained = response.rate() != null
                                        && response.rate().limit() != null
                                        && response.rate().limit() == FREE_TIER_LIMIT;
            LOGGER.fine(() -> "Pre-flight check passed, free tier: " + constrained);
            return PreflightResult.of(constrained);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PreflightResult.failed("API test request interrupted");
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            final GeocoderException error = classifier.classify(e);
            if (error.kind() == ErrorKind.NOT_AUTHORIZED || error.kind() == ErrorKind.FORBIDDEN) {
                return PreflightResult.failed("API key is invalid or blocked: " + error.detail());
            }
            if (error.kind() == ErrorKind.UNKNOWN) {
                return PreflightResult.failed("Unexpected error during API test request: " + error.detail());
            }
            return PreflightResult.failed("API test request failed: " + error.detail());
        }
    }
}
