package org.gamma.geobatch.util;

import org.gamma.geobatch.error.GeocoderException;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Canonical formatting of reverse geocoding queries.
 */
public final class QueryFormat {

    // Plain decimal notation only: no hex floats, no "NaN"/"Infinity", no d/f suffixes.
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private QueryFormat() {
    }

    /**
     * Parses a finite decimal number, or returns empty for anything else.
     */
    public static OptionalDouble parseFiniteDecimal(final String s) {
        if (s == null) return OptionalDouble.empty();
        final String t = s.trim();
        if (!DECIMAL.matcher(t).matches()) return OptionalDouble.empty();
        final double v = Double.parseDouble(t);
        return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
    }

    /**
     * Formats a numeric coordinate pair. Integral values get exactly one decimal place ({@code 51 -> "51.0"}).
     */
    public static String formatReverseQuery(final double lat, final double lng) throws GeocoderException {
        if (!Double.isFinite(lat) || !Double.isFinite(lng)) {
            throw invalid(String.valueOf(lat), String.valueOf(lng));
        }
        return formatCoordinate(lat) + "," + formatCoordinate(lng);
    }

    /**
     * Validates two numeric-looking strings and joins them unchanged: {@code ("51", "0") -> "51,0"}.
     * Unlike {@link #formatReverseQuery(double, double)} no trailing ".0" is forced.
     */
    public static String formatReverseQuery(final String lat, final String lng) throws GeocoderException {
        if (parseFiniteDecimal(lat).isEmpty() || parseFiniteDecimal(lng).isEmpty()) {
            throw invalid(lat, lng);
        }
        return lat + "," + lng;
    }

    private static String formatCoordinate(final double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return (long) v + ".0";
        }
        return Double.toString(v);
    }

    private static GeocoderException invalid(final String lat, final String lng) {
        return GeocoderException.invalidInput(
                "Invalid latitude or longitude provided: must be convertible to a finite number. Got: '" + lat + "', '" + lng + "'");
    }
}
