package org.gamma.geobatch.metrics;

import org.gamma.geobatch.processing.PipelineState;

import java.time.Duration;

/**
 * Counters of a finished batch run.
 *
 * @param workers     number of workers actually started, after any free-tier clamp
 * @param rowsRead    input rows read (header excluded)
 * @param jobsQueued  rows turned into jobs
 * @param rowsFailed  rows written with an error status
 * @param rowsSkipped rows dropped, either unparsable or by the skip error policy
 */
public record BatchSummary(PipelineState state, int workers, long rowsRead, long jobsQueued, long rowsWritten,
                           long rowsFailed, long rowsSkipped, Duration duration) {

    @Override
    public String toString() {
        return String.format("Batch %s in %d ms: workers=%d, read=%d, queued=%d, written=%d, failed=%d, skipped=%d",
                state, duration.toMillis(), workers, rowsRead, jobsQueued, rowsWritten, rowsFailed, rowsSkipped);
    }
}
