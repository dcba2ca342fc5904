package org.gamma.geobatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Quota information reported by the API, either in the response body or in the X-RateLimit-* headers.
 * Any field may be null when the API did not report it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RateInfo(Integer limit, Integer remaining, Long reset) {
}
