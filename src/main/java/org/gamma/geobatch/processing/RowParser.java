package org.gamma.geobatch.processing;

import org.gamma.geobatch.error.GeocoderException;
import org.gamma.geobatch.util.QueryFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Turns a raw input row into a forward query, a reverse coordinate pair or a skip.
 * <p>
 * Bad rows (missing columns, nothing to geocode, malformed coordinates, queries shorter than two characters) are
 * skipped with a warning; they never fail the batch.
 */
public class RowParser {

    private static final Logger LOGGER = Logger.getLogger(RowParser.class.getName());
    private static final int MIN_QUERY_LENGTH = 2;

    private final BatchOptions options;

    public RowParser(BatchOptions options) {
        this.options = options;
    }

    public ParsedRow parse(final List<String> rawRow, final long rowId) {
        final List<String> parts = extractParts(rawRow);
        if (parts == null) {
            LOGGER.warning(String.format("L%d: Missing input column index in row: %s. Skipping.", rowId, rawRow));
            return ParsedRow.skip(null);
        }

        final GeocodeCommand command = determineCommand(parts);

        if (parts.stream().allMatch(String::isEmpty)) {
            LOGGER.warning(String.format("L%d: Skipping row - no query data found in selected columns.", rowId));
            return ParsedRow.skip(command);
        }

        final String query;
        if (command == GeocodeCommand.REVERSE) {
            if (parts.size() != 2) {
                LOGGER.warning(String.format("L%d: Expected 2 columns/parts for reverse geocoding, found %d. Skipping row.",
                        rowId, parts.size()));
                return ParsedRow.skip(command);
            }
            try {
                query = QueryFormat.formatReverseQuery(parts.get(0), parts.get(1));
            } catch (GeocoderException e) {
                LOGGER.warning(String.format("L%d: %s. Skipping row.", rowId, e.detail()));
                return ParsedRow.skip(command);
            }
        } else {
            query = parts.stream().filter(p -> !p.isEmpty()).collect(Collectors.joining(", "));
        }

        if (query.strip().length() < MIN_QUERY_LENGTH) {
            LOGGER.warning(String.format("L%d: Query '%s' is too short (< %d chars) or empty. Skipping row.",
                    rowId, query, MIN_QUERY_LENGTH));
            return ParsedRow.skip(command);
        }
        return new ParsedRow(query, command);
    }

    /**
     * Selected (or all) fields, trimmed. Null when a selected column does not exist in the row.
     */
    private List<String> extractParts(final List<String> rawRow) {
        final List<Integer> columns = options.inputColumns();
        if (columns == null) {
            return rawRow.stream().map(RowParser::trim).collect(Collectors.toList());
        }
        final List<String> parts = new ArrayList<>(columns.size());
        for (int idx : columns) {
            if (idx > rawRow.size()) return null;
            parts.add(trim(rawRow.get(idx - 1)));
        }
        return parts;
    }

    private GeocodeCommand determineCommand(final List<String> parts) {
        if (options.command() != null) return options.command();
        final List<Integer> columns = options.inputColumns();
        if (columns != null && columns.size() == 2
            && QueryFormat.parseFiniteDecimal(parts.get(0)).isPresent()
            && QueryFormat.parseFiniteDecimal(parts.get(1)).isPresent()) {
            return GeocodeCommand.REVERSE;
        }
        return GeocodeCommand.FORWARD;
    }

    private static String trim(final String s) {
        return s == null ? "" : s.strip();
    }
}
