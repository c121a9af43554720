package com.hivewatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reputation of one indicator according to the loaded threat-intelligence snapshot.
 */
public final class ReputationVerdict {

    public enum Status {
        /** Present on at least one feed. */
        LISTED,
        /** Looked up successfully, not on any feed. */
        NOT_LISTED,
        /** Lookup failed, timed out, or no snapshot is loaded yet. */
        UNKNOWN
    }

    public static final ReputationVerdict UNKNOWN =
        new ReputationVerdict(null, Status.UNKNOWN, 0, List.of(), List.of());

    @JsonProperty("indicator")
    private final String indicator;

    @JsonProperty("status")
    private final Status status;

    @JsonProperty("confidence")
    private final int confidence;

    @JsonProperty("source_feeds")
    private final List<String> sourceFeeds;

    @JsonProperty("labels")
    private final List<String> labels;

    public ReputationVerdict(String indicator, Status status, int confidence,
                             List<String> sourceFeeds, List<String> labels) {
        this.indicator = indicator;
        this.status = status;
        this.confidence = confidence;
        this.sourceFeeds = List.copyOf(sourceFeeds);
        this.labels = List.copyOf(labels);
    }

    public static ReputationVerdict notListed(String indicator) {
        return new ReputationVerdict(indicator, Status.NOT_LISTED, 0, List.of(), List.of());
    }

    public String getIndicator() {
        return indicator;
    }

    public Status getStatus() {
        return status;
    }

    public int getConfidence() {
        return confidence;
    }

    public List<String> getSourceFeeds() {
        return sourceFeeds;
    }

    public List<String> getLabels() {
        return labels;
    }

    @JsonIgnore
    public boolean isListed() {
        return status == Status.LISTED;
    }

    @JsonIgnore
    public boolean isKnown() {
        return status != Status.UNKNOWN;
    }

    @Override
    public String toString() {
        return status == Status.LISTED
            ? "LISTED(" + confidence + " " + sourceFeeds + ")"
            : status.name();
    }
}
