package org.gamma.geobatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Bounds(Geometry northeast, Geometry southwest) {
}
