package org.gamma.geobatch.processing;

import org.gamma.geobatch.error.BatchProcessingException;

import java.util.Locale;

/**
 * What a worker does with a row whose geocoding call ended in a classified error.
 */
public enum ErrorPolicy {
    LOG,  // write the row with its error status and continue
    SKIP, // drop the row silently
    FAIL; // abort the whole batch

    public static ErrorPolicy parse(String value) throws BatchProcessingException {
        if (value == null) return LOG;
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith(":")) v = v.substring(1);
        return switch (v) {
            case "log" -> LOG;
            case "skip" -> SKIP;
            case "fail" -> FAIL;
            default -> throw new BatchProcessingException(
                    "Invalid 'on_error' option: '" + value + "'. Must be log, skip, or fail.");
        };
    }
}
