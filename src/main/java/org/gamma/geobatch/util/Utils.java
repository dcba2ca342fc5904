package org.gamma.geobatch.util;

import java.util.List;
import java.util.stream.Collectors;

/**
 * CSV line helpers used by the output writer.
 */
public final class Utils {

    private Utils() {
    }

    public static String escapeCsvField(String field) {
        if (field == null) {
            return "";
        } else {
            boolean mustQuote = field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r");
            String escaped = field.replace("\"", "\"\"");
            return mustQuote ? "\"" + escaped + "\"" : escaped;
        }
    }

    public static String toCsvLine(List<String> fields) {
        return fields.stream().map(Utils::escapeCsvField).collect(Collectors.joining(","));
    }
}
