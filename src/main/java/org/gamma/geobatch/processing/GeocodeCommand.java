package org.gamma.geobatch.processing;

import org.gamma.geobatch.error.BatchProcessingException;

import java.util.Locale;

public enum GeocodeCommand {
    FORWARD,
    REVERSE;

    /**
     * @return the command, or null for a null/blank value (auto-detect)
     */
    public static GeocodeCommand parse(String value) throws BatchProcessingException {
        if (value == null || value.isBlank()) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith(":")) v = v.substring(1);
        return switch (v) {
            case "forward" -> FORWARD;
            case "reverse" -> REVERSE;
            default -> throw new BatchProcessingException(
                    "Invalid 'command' option: '" + value + "'. Must be forward or reverse.");
        };
    }
}
