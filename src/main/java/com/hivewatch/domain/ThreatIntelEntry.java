package com.hivewatch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One indicator loaded from a threat-intelligence feed.
 */
public final class ThreatIntelEntry {

    @JsonProperty("indicator")
    private final String indicator;

    @JsonProperty("type")
    private final IndicatorType type;

    @JsonProperty("source_feed")
    private final String sourceFeed;

    @JsonProperty("confidence")
    private final int confidence; // 0-100

    @JsonProperty("labels")
    private final List<String> labels;

    @JsonProperty("expires_at")
    private final Instant expiresAt; // null = never

    public ThreatIntelEntry(String indicator, IndicatorType type, String sourceFeed, int confidence,
                            List<String> labels, Instant expiresAt) {
        this.indicator = Objects.requireNonNull(indicator, "indicator");
        this.type = Objects.requireNonNull(type, "type");
        this.sourceFeed = sourceFeed;
        this.confidence = Math.max(0, Math.min(100, confidence));
        this.labels = labels != null ? List.copyOf(labels) : List.of();
        this.expiresAt = expiresAt;
    }

    public String getIndicator() {
        return indicator;
    }

    public IndicatorType getType() {
        return type;
    }

    public String getSourceFeed() {
        return sourceFeed;
    }

    public int getConfidence() {
        return confidence;
    }

    public List<String> getLabels() {
        return labels;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "ThreatIntelEntry{" + type + " " + indicator + " feed=" + sourceFeed
            + " confidence=" + confidence + "}";
    }
}
