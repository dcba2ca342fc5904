package org.gamma.geobatch.processing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.gamma.geobatch.error.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds output rows: the original fields followed by one value per configured output field.
 */
public class OutputProjection {

    private static final Logger LOGGER = Logger.getLogger(OutputProjection.class.getName());

    public static final String STATUS_MESSAGE = "status_message";
    public static final String RAW_JSON = "raw_json";
    public static final String ORIGINAL_COLUMN_PREFIX = "orig_col_";

    private final List<String> outputFields;
    private final ObjectMapper mapper = new ObjectMapper();

    public OutputProjection(List<String> outputFields) {
        this.outputFields = List.copyOf(outputFields);
    }

    public List<String> header(final int originalColumns) {
        final List<String> header = new ArrayList<>(originalColumns + outputFields.size());
        for (int i = 1; i <= originalColumns; i++) {
            header.add(ORIGINAL_COLUMN_PREFIX + i);
        }
        header.addAll(outputFields);
        return header;
    }

    public List<String> project(final BatchResult result) {
        final List<String> row = new ArrayList<>(result.originalRow());
        for (String field : outputFields) {
            if (STATUS_MESSAGE.equals(field)) {
                row.add(statusMessage(result));
            } else if (!result.success() || result.result() == null) {
                row.add("");
            } else if (RAW_JSON.equals(field)) {
                row.add(toJson(result.result()));
            } else {
                row.add(ResultFields.lookup(result.result(), field).map(this::render).orElse(""));
            }
        }
        return row;
    }

    static String statusMessage(final BatchResult result) {
        if (result.success()) return "OK";
        if (result.error() == null) return "UNKNOWN_ERROR";
        if (result.error().kind() == ErrorKind.ZERO_RESULTS) return "ZERO_RESULTS";
        return result.error().kind().name();
    }

    private String render(final Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            return toJson(value);
        }
        return String.valueOf(value);
    }

    private String toJson(final Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOGGER.log(Level.WARNING, "Could not render value as JSON", e);
            return "";
        }
    }
}
