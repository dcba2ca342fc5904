package org.gamma.geobatch.error;

/**
 * Closed taxonomy of failures a geocoding call or a batch run can produce.
 */
public enum ErrorKind {
    INVALID_INPUT,
    NOT_AUTHORIZED,
    FORBIDDEN,
    BAD_REQUEST,
    NOT_FOUND,
    METHOD_NOT_ALLOWED,
    TIMEOUT,
    REQUEST_TOO_LONG,
    UPGRADE_REQUIRED,
    TOO_MANY_REQUESTS,
    RATE_LIMIT_EXCEEDED, // quota exhausted, carries rate info
    SERVER_ERROR,
    NETWORK_ERROR,
    BAD_RESPONSE,        // malformed success payload
    BATCH_PROCESSING,    // pipeline-level configuration or fatal wrapper
    ZERO_RESULTS,        // synthesized by the batch worker, never sent by the API
    UNKNOWN
}
