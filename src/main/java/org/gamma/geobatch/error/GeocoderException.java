package org.gamma.geobatch.error;

import org.gamma.geobatch.model.RateInfo;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A failure normalized into the {@link ErrorKind} taxonomy.
 * <p>
 * Server errors keep their HTTP status, rate limit errors keep the quota details reported by the API
 * and network errors keep the underlying transport exception as cause.
 */
public class GeocoderException extends Exception {

    private final ErrorKind kind;
    private final String detail;
    private final Integer statusCode;
    private final RateInfo rateInfo;

    public GeocoderException(ErrorKind kind, String detail) {
        this(kind, detail, null, null, null);
    }

    public GeocoderException(ErrorKind kind, String detail, Throwable cause) {
        this(kind, detail, null, null, cause);
    }

    public GeocoderException(ErrorKind kind, String detail, Integer statusCode, RateInfo rateInfo, Throwable cause) {
        super(render(kind, detail, statusCode, rateInfo), cause);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.detail = detail == null ? "" : detail;
        this.statusCode = statusCode;
        this.rateInfo = rateInfo;
    }

    public static GeocoderException invalidInput(String detail) {
        return new GeocoderException(ErrorKind.INVALID_INPUT, detail);
    }

    public static GeocoderException serverError(String detail, int statusCode) {
        return new GeocoderException(ErrorKind.SERVER_ERROR, detail, statusCode, null, null);
    }

    public static GeocoderException rateLimitExceeded(String detail, RateInfo rateInfo) {
        return new GeocoderException(ErrorKind.RATE_LIMIT_EXCEEDED, detail, 402, rateInfo, null);
    }

    public static GeocoderException network(String detail, Throwable cause) {
        return new GeocoderException(ErrorKind.NETWORK_ERROR, detail, cause);
    }

    public static GeocoderException zeroResults(String query) {
        return new GeocoderException(ErrorKind.ZERO_RESULTS, "Query successful but returned 0 results. Query: '" + query + "'");
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * The message without the kind prefix and the status/quota suffixes.
     */
    public String detail() {
        return detail;
    }

    public Integer statusCode() {
        return statusCode;
    }

    public RateInfo rateInfo() {
        return rateInfo;
    }

    private static String render(ErrorKind kind, String detail, Integer statusCode, RateInfo rateInfo) {
        StringBuilder sb = new StringBuilder().append(kind).append(": ").append(detail == null ? "" : detail);
        if (kind == ErrorKind.SERVER_ERROR && statusCode != null) {
            sb.append(" (HTTP Status: ").append(statusCode).append(')');
        }
        if (kind == ErrorKind.RATE_LIMIT_EXCEEDED && rateInfo != null) {
            if (rateInfo.reset() != null) {
                sb.append(" (Quota resets at ").append(LocalDateTime.ofEpochSecond(rateInfo.reset(), 0, ZoneOffset.UTC)).append(" UTC)");
            }
            List<String> details = new ArrayList<>();
            if (rateInfo.limit() != null) details.add("limit=" + rateInfo.limit());
            if (rateInfo.remaining() != null) details.add("remaining=" + rateInfo.remaining());
            if (!details.isEmpty()) {
                sb.append(" [Details: ").append(String.join(", ", details)).append(']');
            }
        }
        return sb.toString();
    }
}
