package org.gamma.geobatch.processing;

import org.gamma.geobatch.metrics.ProgressTracker;

import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/**
 * Drains the result channel into the output CSV. The header row is derived from the first result.
 * <p>
 * In ordered mode results are held back until all lower row ids have been written; whatever is still held when
 * the channel ends is written sorted by row id, unless the batch was aborted.
 */
public class BatchWriter implements Callable<Long> {

    private static final Logger LOGGER = Logger.getLogger(BatchWriter.class.getName());

    private final BoundedChannel<BatchResult> results;
    private final CsvRowWriter out;
    private final OutputProjection projection;
    private final boolean ordered;
    private final ProgressTracker tracker;
    private final BooleanSupplier aborted;

    private final Map<Long, BatchResult> pending = new TreeMap<>();
    private long nextRowToWrite = 1L;
    private boolean headerWritten = false;

    public BatchWriter(BoundedChannel<BatchResult> results, CsvRowWriter out, BatchOptions options,
                       ProgressTracker tracker, BooleanSupplier aborted) {
        this.results = results;
        this.out = out;
        this.projection = new OutputProjection(options.outputFields());
        this.ordered = options.ordered();
        this.tracker = tracker;
        this.aborted = aborted;
    }

    /**
     * @return number of data rows written
     */
    @Override
    public Long call() throws IOException, InterruptedException {
        LOGGER.fine("Writer task started.");
        BatchResult result;
        while ((result = results.take()) != null) {
            if (!headerWritten) {
                out.writeRow(projection.header(result.originalRow().size()));
                headerWritten = true;
            }
            if (ordered) {
                pending.put(result.rowId(), result);
                BatchResult next;
                while ((next = pending.remove(nextRowToWrite)) != null) {
                    write(next);
                    nextRowToWrite++;
                }
            } else {
                write(result);
            }
        }

        if (!pending.isEmpty()) {
            if (aborted.getAsBoolean()) {
                LOGGER.warning(String.format("Batch aborted, %d buffered row(s) not written.", pending.size()));
            } else {
                LOGGER.fine(() -> "Writing remaining " + pending.size() + " buffered items.");
                for (BatchResult buffered : pending.values()) {
                    write(buffered);
                }
                pending.clear();
            }
        }
        if (!headerWritten) {
            LOGGER.warning("Batch input was empty or unreadable, output may be empty.");
        }
        out.flush();
        final long written = out.getRecordCount() - (headerWritten ? 1 : 0);
        LOGGER.fine(() -> "Writer task finished. Wrote " + written + " rows.");
        return written;
    }

    private void write(final BatchResult result) throws IOException {
        out.writeRow(projection.project(result));
        tracker.rowWritten();
    }
}
