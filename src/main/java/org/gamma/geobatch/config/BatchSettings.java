package org.gamma.geobatch.config;

import org.gamma.geobatch.error.BatchProcessingException;
import org.gamma.geobatch.processing.BatchOptions;
import org.gamma.geobatch.processing.ErrorPolicy;
import org.gamma.geobatch.processing.GeocodeCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;

/**
 * The {@code batch:} section of the YAML config. Null fields take the {@link BatchOptions} defaults.
 *
 * @param rateLimit number of permits of an admission gate shared by all workers, or null for none
 */
public record BatchSettings(Path input, Path output, Integer workers, Integer retries, Double timeoutSeconds,
                            List<Integer> inputColumns, List<String> addColumns, String onError, Boolean ordered,
                            Boolean progress, Integer limit, Map<String, Object> optionalApiParams,
                            Integer rateLimit, String command) {

    public BatchOptions toBatchOptions() throws BatchProcessingException {
        BatchOptions.Builder builder = BatchOptions.builder()
                .errorPolicy(ErrorPolicy.parse(onError))
                .command(GeocodeCommand.parse(command))
                .inputColumns(inputColumns)
                .limit(limit)
                .extraParams(optionalApiParams);
        if (workers != null) builder.workers(workers);
        if (retries != null) builder.retries(retries);
        if (timeoutSeconds != null) builder.timeout(Duration.ofMillis((long) (timeoutSeconds * 1000)));
        if (addColumns != null && !addColumns.isEmpty()) builder.outputFields(addColumns);
        if (ordered != null) builder.ordered(ordered);
        if (progress != null) builder.progress(progress);
        if (rateLimit != null) {
            if (rateLimit < 1) throw new BatchProcessingException("rateLimit must be >= 1, got " + rateLimit);
            builder.admissionGate(new Semaphore(rateLimit));
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new BatchProcessingException("Invalid batch configuration: " + e.getMessage(), e);
        }
    }
}
