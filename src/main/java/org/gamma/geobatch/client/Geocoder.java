package org.gamma.geobatch.client;

import org.gamma.geobatch.model.GeocodeResponse;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Forward and reverse geocoding calls. Each call is a single request; failures complete the future
 * exceptionally with a {@link org.gamma.geobatch.error.GeocoderException}.
 */
public interface Geocoder {

    CompletableFuture<GeocodeResponse> geocodeAsync(String query, Map<String, Object> params);

    CompletableFuture<GeocodeResponse> reverseGeocodeAsync(double latitude, double longitude, Map<String, Object> params);
}
