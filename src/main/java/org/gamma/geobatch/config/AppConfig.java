package org.gamma.geobatch.config;

public record AppConfig(GeocoderSettings geocoder, BatchSettings batch) {

    public GeocoderSettings geocoderOrDefaults() {
        return geocoder != null ? geocoder : GeocoderSettings.defaults();
    }
}
