package org.gamma.geobatch.client;

import org.gamma.geobatch.error.GeocoderException;
import org.gamma.geobatch.util.QueryFormat;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts optional API parameters into URL query values.
 */
public final class RequestParams {

    public static final String NO_ANNOTATIONS = "no_annotations";
    public static final String LIMIT = "limit";

    private RequestParams() {
    }

    public static Map<String, String> toQueryParameters(final Map<String, Object> params) throws GeocoderException {
        final Map<String, String> out = new LinkedHashMap<>();
        if (params == null) return out;
        for (Map.Entry<String, Object> e : params.entrySet()) {
            final String key = e.getKey();
            final Object value = e.getValue();
            if (value == null) continue;
            out.put(key, format(key, value));
        }
        return out;
    }

    private static String format(final String key, final Object value) throws GeocoderException {
        if (value instanceof Boolean b) {
            return b ? "1" : "0";
        }
        if ("bounds".equals(key) && isNumbers(value, 4)) {
            return ((Collection<?>) value).stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        if ("proximity".equals(key) && isNumbers(value, 2)) {
            final List<?> pair = List.copyOf((Collection<?>) value);
            return QueryFormat.formatReverseQuery(((Number) pair.get(0)).doubleValue(), ((Number) pair.get(1)).doubleValue());
        }
        if ("countrycode".equals(key)) {
            if (value instanceof Collection<?> codes) {
                return codes.stream().map(c -> String.valueOf(c).toUpperCase(Locale.ROOT)).collect(Collectors.joining(","));
            }
            if (value instanceof String s) {
                return s.replace(" ", "").toUpperCase(Locale.ROOT);
            }
        }
        return String.valueOf(value);
    }

    private static boolean isNumbers(final Object value, final int size) {
        return value instanceof Collection<?> c && c.size() == size && c.stream().allMatch(Number.class::isInstance);
    }
}
