package com.hivewatch.enrichment;

/**
 * Thrown when an enrichment source cannot answer: no database or feed snapshot is loaded.
 * Callers of {@link EnrichmentService} never see it; it degrades to Unknown.
 */
public class EnrichmentUnavailableException extends RuntimeException {

    private final String indicator;

    public EnrichmentUnavailableException(String message, String indicator) {
        super(message);
        this.indicator = indicator;
    }

    public String getIndicator() {
        return indicator;
    }
}
