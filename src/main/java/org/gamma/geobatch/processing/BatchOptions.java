package org.gamma.geobatch.processing;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Semaphore;

/**
 * Immutable settings of one batch run.
 *
 * @param workers       number of concurrent workers, at least 1
 * @param retries       retries per request (attempts = retries + 1)
 * @param timeout       per-attempt timeout of a geocoding call
 * @param inputColumns  1-based column indices forming the query, or null for all columns (input then has a header)
 * @param outputFields  dotted result paths appended to every output row; {@code status_message} and
 *                      {@code raw_json} are synthesized
 * @param errorPolicy   handling of rows whose call failed
 * @param ordered       write rows in input order instead of completion order
 * @param progress      log progress periodically
 * @param limit         maximum number of input rows to read, or null
 * @param extraParams   additional API parameters sent with every request
 * @param admissionGate semaphore bounding in-flight requests across workers (and batches sharing it), or null
 * @param command       force forward or reverse geocoding, or null to auto-detect per row
 */
public record BatchOptions(int workers, int retries, Duration timeout, List<Integer> inputColumns,
                           List<String> outputFields, ErrorPolicy errorPolicy, boolean ordered, boolean progress,
                           Integer limit, Map<String, Object> extraParams, Semaphore admissionGate,
                           GeocodeCommand command) {

    public static final List<String> DEFAULT_OUTPUT_FIELDS = List.of(
            "formatted", "geometry.lat", "geometry.lng", "confidence", "components._type", "status_message");

    public BatchOptions {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        if (retries < 0) throw new IllegalArgumentException("retries must be >= 0, got " + retries);
        Objects.requireNonNull(timeout, "timeout cannot be null");
        if (inputColumns != null) {
            for (Integer idx : inputColumns) {
                if (idx == null || idx < 1) throw new IllegalArgumentException("input columns are 1-based, got " + idx);
            }
            inputColumns = List.copyOf(inputColumns);
        }
        outputFields = outputFields == null ? DEFAULT_OUTPUT_FIELDS : List.copyOf(outputFields);
        if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        extraParams = extraParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extraParams));
    }

    public static Builder builder() {
        return new Builder();
    }

    public BatchOptions withWorkers(int count) {
        return new BatchOptions(count, retries, timeout, inputColumns, outputFields, errorPolicy, ordered, progress,
                limit, extraParams, admissionGate, command);
    }

    /**
     * True when the input is expected to start with a header row.
     */
    public boolean hasHeader() {
        return inputColumns == null;
    }

    /**
     * True when some output field asks for data of more than the first result.
     */
    public boolean wantsMultipleResults() {
        return outputFields.stream().anyMatch(f -> f.contains("results["));
    }

    public static final class Builder {
        private int workers = 4;
        private int retries = 5;
        private Duration timeout = Duration.ofSeconds(60);
        private List<Integer> inputColumns;
        private List<String> outputFields = DEFAULT_OUTPUT_FIELDS;
        private ErrorPolicy errorPolicy = ErrorPolicy.LOG;
        private boolean ordered;
        private boolean progress = true;
        private Integer limit;
        private Map<String, Object> extraParams = Map.of();
        private Semaphore admissionGate;
        private GeocodeCommand command;

        private Builder() {
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder inputColumns(List<Integer> inputColumns) {
            this.inputColumns = inputColumns;
            return this;
        }

        public Builder outputFields(List<String> outputFields) {
            this.outputFields = outputFields;
            return this;
        }

        public Builder errorPolicy(ErrorPolicy errorPolicy) {
            this.errorPolicy = errorPolicy;
            return this;
        }

        public Builder ordered(boolean ordered) {
            this.ordered = ordered;
            return this;
        }

        public Builder progress(boolean progress) {
            this.progress = progress;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder extraParams(Map<String, Object> extraParams) {
            this.extraParams = extraParams;
            return this;
        }

        public Builder admissionGate(Semaphore admissionGate) {
            this.admissionGate = admissionGate;
            return this;
        }

        public Builder command(GeocodeCommand command) {
            this.command = command;
            return this;
        }

        public BatchOptions build() {
            return new BatchOptions(workers, retries, timeout, inputColumns, outputFields, errorPolicy, ordered,
                    progress, limit, extraParams, admissionGate, command);
        }
    }
}
