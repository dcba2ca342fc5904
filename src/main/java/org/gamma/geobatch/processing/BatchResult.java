package org.gamma.geobatch.processing;

import org.gamma.geobatch.error.GeocoderException;
import org.gamma.geobatch.model.GeocodeResult;

import java.util.List;

/**
 * Outcome of one {@link Job}: a result when {@code success}, otherwise the classified error (which may be null
 * for an error that could not be classified).
 */
public record BatchResult(long rowId, boolean success, GeocodeResult result, GeocoderException error,
                          List<String> originalRow) {

    public BatchResult {
        originalRow = List.copyOf(originalRow);
    }

    public static BatchResult success(Job job, GeocodeResult result) {
        return new BatchResult(job.rowId(), true, result, null, job.originalRow());
    }

    public static BatchResult failure(Job job, GeocoderException error) {
        return new BatchResult(job.rowId(), false, null, error, job.originalRow());
    }
}
