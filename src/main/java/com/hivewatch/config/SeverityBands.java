package com.hivewatch.config;

import com.hivewatch.domain.Severity;

/**
 * Maps a risk score onto a severity band using the configured lower bounds.
 */
public final class SeverityBands {

    private final int medium;
    private final int high;
    private final int critical;

    public SeverityBands(int medium, int high, int critical) {
        if (!(medium <= high && high <= critical)) {
            throw new IllegalArgumentException(
                "Severity bands must be ascending: medium=" + medium + " high=" + high + " critical=" + critical);
        }
        this.medium = medium;
        this.high = high;
        this.critical = critical;
    }

    public static SeverityBands from(HiveWatchProperties.SeverityBandProperties bands) {
        return new SeverityBands(bands.getMedium(), bands.getHigh(), bands.getCritical());
    }

    public static SeverityBands defaults() {
        return new SeverityBands(40, 70, 90);
    }

    public Severity severityFor(int score) {
        if (score >= critical) {
            return Severity.CRITICAL;
        }
        if (score >= high) {
            return Severity.HIGH;
        }
        if (score >= medium) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
