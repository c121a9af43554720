package com.hivewatch.normalization.parsers;

/**
 * Exception thrown when a raw record cannot be normalized.
 * Carries the format and the offending data so the skip can be diagnosed.
 */
public class NormalizationException extends RuntimeException {

    private final String format;
    private final String rawData;

    public NormalizationException(String message, String format, String rawData) {
        super(message);
        this.format = format;
        this.rawData = rawData;
    }

    public NormalizationException(String message, Throwable cause, String format, String rawData) {
        super(message, cause);
        this.format = format;
        this.rawData = rawData;
    }

    public String getFormat() {
        return format;
    }

    public String getRawData() {
        return rawData;
    }
}
