package org.gamma.geobatch.processing;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.gamma.geobatch.metrics.ProgressTracker;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Streams CSV rows from the input, turns accepted rows into {@link Job}s and feeds them to the job channel.
 * <p>
 * Jobs are numbered 1, 2, 3... in input order, counting accepted rows only. The job channel is closed when the
 * reader finishes, whatever the reason.
 */
public class BatchReader implements Callable<BatchReader.Stats> {

    private static final Logger LOGGER = Logger.getLogger(BatchReader.class.getName());

    private static final ObjectReader CSV_ROWS = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build()
            .readerFor(String[].class)
            .without(JsonParser.Feature.AUTO_CLOSE_SOURCE);

    /**
     * @param rowsRead    data rows read from the input, header excluded
     * @param jobsQueued  rows handed to the workers
     * @param rowsSkipped rows the parser rejected
     */
    public record Stats(long rowsRead, long jobsQueued, long rowsSkipped) {
    }

    private final Reader input;
    private final Path sourcePath;
    private final BoundedChannel<Job> jobs;
    private final BatchOptions options;
    private final RowParser parser;
    private final ProgressTracker tracker;

    /**
     * @param sourcePath file behind {@code input}, used to estimate the row count up front; null for streams
     */
    public BatchReader(Reader input, Path sourcePath, BoundedChannel<Job> jobs, BatchOptions options,
                       ProgressTracker tracker) {
        this.input = input;
        this.sourcePath = sourcePath;
        this.jobs = jobs;
        this.options = options;
        this.parser = new RowParser(options);
        this.tracker = tracker;
    }

    @Override
    public Stats call() throws IOException, InterruptedException {
        LOGGER.fine("Reader task started.");
        if (sourcePath != null) {
            estimateTotal();
        }
        long rowsRead = 0;
        long queued = 0;
        long skipped = 0;
        try (MappingIterator<String[]> rows = CSV_ROWS.readValues(input)) {
            if (options.hasHeader() && rows.hasNextValue()) {
                rows.nextValue();
            }
            while (rows.hasNextValue()) {
                final String[] raw = rows.nextValue();
                final long line = rowsRead + 1;
                if (options.limit() != null && line > options.limit()) {
                    LOGGER.info(String.format("Reached input row limit (%d). Stopping reader.", options.limit()));
                    break;
                }
                rowsRead = line;

                final List<String> fields = Arrays.asList(raw);
                final ParsedRow parsed = parser.parse(fields, line);
                if (parsed.isSkip()) {
                    skipped++;
                    continue;
                }
                if (!jobs.put(new Job(queued + 1, parsed.query(), fields, parsed.command()))) {
                    LOGGER.fine("Job channel closed, reader stops early.");
                    break;
                }
                queued++;
                tracker.jobQueued();
            }
        } finally {
            jobs.close();
            final long read = rowsRead;
            LOGGER.fine(() -> "Reader task finished. Read " + read + " rows. Input channel closed.");
        }
        if (sourcePath == null) {
            tracker.setTotal(rowsRead);
        }
        return new Stats(rowsRead, queued, skipped);
    }

    private void estimateTotal() {
        try {
            long total = countDataLines(sourcePath, options.hasHeader());
            if (options.limit() != null) total = Math.min(total, options.limit());
            tracker.setTotal(total);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not estimate total lines for progress reporting: " + e.getMessage(), e);
        }
    }

    /**
     * Counts non-blank lines of a file, minus the header line when there is one.
     */
    static long countDataLines(final Path file, final boolean hasHeader) throws IOException {
        long count = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) count++;
            }
        }
        return Math.max(0, hasHeader ? count - 1 : count);
    }
}
