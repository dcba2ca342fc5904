package org.gamma.geobatch.processing;

/**
 * Result of parsing one input row: a normalized query with its command, or a skip.
 * A skipped row may still carry the command that was determined before it was rejected.
 */
public record ParsedRow(String query, GeocodeCommand command) {

    public static ParsedRow skip(GeocodeCommand command) {
        return new ParsedRow(null, command);
    }

    public boolean isSkip() {
        return query == null || command == null;
    }
}
