package org.gamma.geobatch.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.gamma.geobatch.model.RateInfo;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw failures (transport faults, HTTP statuses, already classified errors) onto {@link ErrorKind}
 * and decides whether a failed request is worth another attempt.
 * <p>
 * Stateless; a single instance can be shared by every worker.
 */
public class ErrorClassifier {

    private static final Set<ErrorKind> RETRYABLE = EnumSet.of(
            ErrorKind.NETWORK_ERROR, ErrorKind.TIMEOUT, ErrorKind.TOO_MANY_REQUESTS, ErrorKind.SERVER_ERROR);

    public boolean isRetryable(final ErrorKind kind) {
        return kind != null && RETRYABLE.contains(kind);
    }

    public boolean isRetryable(final GeocoderException e) {
        return e != null && isRetryable(e.kind());
    }

    /**
     * Normalizes any throwable. Execution wrappers are unwrapped first so the verdict reflects the real cause.
     */
    public GeocoderException classify(final Throwable raw) {
        Throwable t = unwrap(raw);
        if (t instanceof GeocoderException ge) {
            return ge;
        }
        if (t instanceof JsonProcessingException) {
            return new GeocoderException(ErrorKind.BAD_RESPONSE, "Failed to parse successful JSON response: " + t.getMessage(), t);
        }
        if (t instanceof TimeoutException || t instanceof InterruptedIOException) {
            // SocketTimeoutException is an InterruptedIOException
            return new GeocoderException(ErrorKind.TIMEOUT, "Request timed out: " + t.getMessage(), t);
        }
        if (t instanceof IOException) {
            return GeocoderException.network("Network error during request: " + t, t);
        }
        return new GeocoderException(ErrorKind.UNKNOWN, "Unexpected error: " + t, t);
    }

    /**
     * Maps a non-200 HTTP status of the geocoding API to a classified error.
     */
    public GeocoderException fromStatus(final int status, final String message, final RateInfo rateInfo) {
        if (status == 402) {
            return GeocoderException.rateLimitExceeded(message, rateInfo);
        }
        if (status >= 500) {
            return GeocoderException.serverError(message, status);
        }
        final ErrorKind kind = switch (status) {
            case 400 -> ErrorKind.BAD_REQUEST;
            case 401 -> ErrorKind.NOT_AUTHORIZED;
            case 403 -> ErrorKind.FORBIDDEN;
            case 404 -> ErrorKind.NOT_FOUND;
            case 405 -> ErrorKind.METHOD_NOT_ALLOWED;
            case 408 -> ErrorKind.TIMEOUT;
            case 410 -> ErrorKind.REQUEST_TOO_LONG;
            case 426 -> ErrorKind.UPGRADE_REQUIRED;
            case 429 -> ErrorKind.TOO_MANY_REQUESTS;
            default -> ErrorKind.UNKNOWN;
        };
        return new GeocoderException(kind, message, status, rateInfo, null);
    }

    private static Throwable unwrap(final Throwable raw) {
        Throwable t = raw;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
