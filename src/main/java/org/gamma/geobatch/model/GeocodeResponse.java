package org.gamma.geobatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Top level payload of a successful API call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeocodeResponse(String documentation,
                              List<Map<String, String>> licenses,
                              RateInfo rate,
                              List<GeocodeResult> results,
                              ApiStatus status,
                              @JsonProperty("stay_informed") Map<String, String> stayInformed,
                              String thanks,
                              Map<String, Object> timestamp,
                              @JsonProperty("total_results") Integer totalResults) {

    public boolean hasResults() {
        return results != null && !results.isEmpty();
    }
}
