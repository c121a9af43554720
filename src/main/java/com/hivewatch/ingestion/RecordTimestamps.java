package com.hivewatch.ingestion;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the embedded timestamp out of a raw log line without fully parsing it.
 * JSON records carry a {@code "timestamp"} field; text records start with one.
 */
final class RecordTimestamps {

    private static final Pattern JSON_TIMESTAMP = Pattern.compile("\"timestamp\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern LEADING_TIMESTAMP = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}T\\S+)");

    private RecordTimestamps() {
    }

    static String extract(String line) {
        Matcher json = JSON_TIMESTAMP.matcher(line);
        if (json.find()) {
            return json.group(1);
        }
        Matcher leading = LEADING_TIMESTAMP.matcher(line);
        if (leading.find()) {
            return leading.group(1);
        }
        return null;
    }

    static Instant parse(String timestamp) {
        if (timestamp == null) {
            return null;
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
