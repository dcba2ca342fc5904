package org.gamma.geobatch.error;

/**
 * The single terminal error of a failed batch run. Wraps the root cause when there is one.
 */
public class BatchProcessingException extends GeocoderException {

    public BatchProcessingException(String detail) {
        super(ErrorKind.BATCH_PROCESSING, detail);
    }

    public BatchProcessingException(String detail, Throwable cause) {
        super(ErrorKind.BATCH_PROCESSING, detail, cause);
    }
}
