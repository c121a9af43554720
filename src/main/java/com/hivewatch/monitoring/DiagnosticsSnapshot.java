package com.hivewatch.monitoring;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time operator counters: skipped records, degraded lookups and alert drops.
 */
public final class DiagnosticsSnapshot {

    @JsonProperty("taken_at")
    private final Instant takenAt;

    @JsonProperty("records_read")
    private final long recordsRead;

    @JsonProperty("records_malformed")
    private final long recordsMalformed;

    @JsonProperty("records_duplicate")
    private final long recordsDuplicate;

    @JsonProperty("source_unavailable")
    private final long sourceUnavailable;

    @JsonProperty("adapter_restarts")
    private final long adapterRestarts;

    @JsonProperty("events_normalized")
    private final long eventsNormalized;

    @JsonProperty("normalization_failures")
    private final long normalizationFailures;

    @JsonProperty("sessions_total")
    private final int sessionsTotal;

    @JsonProperty("sessions_active")
    private final int sessionsActive;

    @JsonProperty("events_evaluated")
    private final long eventsEvaluated;

    @JsonProperty("rule_errors")
    private final long ruleErrors;

    @JsonProperty("alerts_emitted")
    private final long alertsEmitted;

    @JsonProperty("alert_drops")
    private final Map<String, Long> alertDrops;

    @JsonProperty("enrichment_timeouts")
    private final long enrichmentTimeouts;

    @JsonProperty("feed_refresh_failures")
    private final long feedRefreshFailures;

    @JsonProperty("rule_snapshot_version")
    private final long ruleSnapshotVersion;

    @JsonProperty("rules_loaded")
    private final int rulesLoaded;

    private DiagnosticsSnapshot(Builder b) {
        this.takenAt = b.takenAt;
        this.recordsRead = b.recordsRead;
        this.recordsMalformed = b.recordsMalformed;
        this.recordsDuplicate = b.recordsDuplicate;
        this.sourceUnavailable = b.sourceUnavailable;
        this.adapterRestarts = b.adapterRestarts;
        this.eventsNormalized = b.eventsNormalized;
        this.normalizationFailures = b.normalizationFailures;
        this.sessionsTotal = b.sessionsTotal;
        this.sessionsActive = b.sessionsActive;
        this.eventsEvaluated = b.eventsEvaluated;
        this.ruleErrors = b.ruleErrors;
        this.alertsEmitted = b.alertsEmitted;
        this.alertDrops = Map.copyOf(b.alertDrops);
        this.enrichmentTimeouts = b.enrichmentTimeouts;
        this.feedRefreshFailures = b.feedRefreshFailures;
        this.ruleSnapshotVersion = b.ruleSnapshotVersion;
        this.rulesLoaded = b.rulesLoaded;
    }

    static Builder builder() {
        return new Builder();
    }

    public Instant getTakenAt() {
        return takenAt;
    }

    public long getRecordsRead() {
        return recordsRead;
    }

    public long getRecordsMalformed() {
        return recordsMalformed;
    }

    public long getRecordsDuplicate() {
        return recordsDuplicate;
    }

    public long getSourceUnavailable() {
        return sourceUnavailable;
    }

    public long getAdapterRestarts() {
        return adapterRestarts;
    }

    public long getEventsNormalized() {
        return eventsNormalized;
    }

    public long getNormalizationFailures() {
        return normalizationFailures;
    }

    public int getSessionsTotal() {
        return sessionsTotal;
    }

    public int getSessionsActive() {
        return sessionsActive;
    }

    public long getEventsEvaluated() {
        return eventsEvaluated;
    }

    public long getRuleErrors() {
        return ruleErrors;
    }

    public long getAlertsEmitted() {
        return alertsEmitted;
    }

    /**
     * Alerts dropped per consumer.
     */
    public Map<String, Long> getAlertDrops() {
        return alertDrops;
    }

    public long getEnrichmentTimeouts() {
        return enrichmentTimeouts;
    }

    public long getFeedRefreshFailures() {
        return feedRefreshFailures;
    }

    public long getRuleSnapshotVersion() {
        return ruleSnapshotVersion;
    }

    public int getRulesLoaded() {
        return rulesLoaded;
    }

    @Override
    public String toString() {
        return "Diagnostics{read=" + recordsRead + ", malformed=" + recordsMalformed
            + ", normalizationFailures=" + normalizationFailures + ", sessions=" + sessionsTotal
            + ", alerts=" + alertsEmitted + ", drops=" + alertDrops + ", rules=v" + ruleSnapshotVersion + "}";
    }

    static final class Builder {
        private Instant takenAt;
        private long recordsRead;
        private long recordsMalformed;
        private long recordsDuplicate;
        private long sourceUnavailable;
        private long adapterRestarts;
        private long eventsNormalized;
        private long normalizationFailures;
        private int sessionsTotal;
        private int sessionsActive;
        private long eventsEvaluated;
        private long ruleErrors;
        private long alertsEmitted;
        private Map<String, Long> alertDrops = Map.of();
        private long enrichmentTimeouts;
        private long feedRefreshFailures;
        private long ruleSnapshotVersion;
        private int rulesLoaded;

        Builder takenAt(Instant takenAt) {
            this.takenAt = takenAt;
            return this;
        }

        Builder recordsRead(long recordsRead) {
            this.recordsRead = recordsRead;
            return this;
        }

        Builder recordsMalformed(long recordsMalformed) {
            this.recordsMalformed = recordsMalformed;
            return this;
        }

        Builder recordsDuplicate(long recordsDuplicate) {
            this.recordsDuplicate = recordsDuplicate;
            return this;
        }

        Builder sourceUnavailable(long sourceUnavailable) {
            this.sourceUnavailable = sourceUnavailable;
            return this;
        }

        Builder adapterRestarts(long adapterRestarts) {
            this.adapterRestarts = adapterRestarts;
            return this;
        }

        Builder eventsNormalized(long eventsNormalized) {
            this.eventsNormalized = eventsNormalized;
            return this;
        }

        Builder normalizationFailures(long normalizationFailures) {
            this.normalizationFailures = normalizationFailures;
            return this;
        }

        Builder sessionsTotal(int sessionsTotal) {
            this.sessionsTotal = sessionsTotal;
            return this;
        }

        Builder sessionsActive(int sessionsActive) {
            this.sessionsActive = sessionsActive;
            return this;
        }

        Builder eventsEvaluated(long eventsEvaluated) {
            this.eventsEvaluated = eventsEvaluated;
            return this;
        }

        Builder ruleErrors(long ruleErrors) {
            this.ruleErrors = ruleErrors;
            return this;
        }

        Builder alertsEmitted(long alertsEmitted) {
            this.alertsEmitted = alertsEmitted;
            return this;
        }

        Builder alertDrops(Map<String, Long> alertDrops) {
            this.alertDrops = alertDrops;
            return this;
        }

        Builder enrichmentTimeouts(long enrichmentTimeouts) {
            this.enrichmentTimeouts = enrichmentTimeouts;
            return this;
        }

        Builder feedRefreshFailures(long feedRefreshFailures) {
            this.feedRefreshFailures = feedRefreshFailures;
            return this;
        }

        Builder ruleSnapshotVersion(long ruleSnapshotVersion) {
            this.ruleSnapshotVersion = ruleSnapshotVersion;
            return this;
        }

        Builder rulesLoaded(int rulesLoaded) {
            this.rulesLoaded = rulesLoaded;
            return this;
        }

        DiagnosticsSnapshot build() {
            return new DiagnosticsSnapshot(this);
        }
    }
}
