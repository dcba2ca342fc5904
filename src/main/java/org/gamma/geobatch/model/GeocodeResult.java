package org.gamma.geobatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One geocoding match. Components and annotations vary per place so they stay as nested maps.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeocodeResult(Map<String, Object> annotations,
                            Bounds bounds,
                            Map<String, Object> components,
                            Integer confidence,
                            @JsonProperty("distance_from_q") Map<String, Object> distanceFromQ,
                            String formatted,
                            Geometry geometry) {
}
