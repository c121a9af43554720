package com.hivewatch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable alert produced by the correlation engine.
 *
 * Alerts are appended to the alert log and fanned out; they are never edited.
 * A later escalation of the same session produces a new alert.
 */
public final class Alert {

    @JsonProperty("alert_id")
    private final String alertId;

    @JsonProperty("session_id")
    private final String sessionId;

    @JsonProperty("source_ip")
    private final String sourceIp;

    @JsonProperty("rule_id")
    private final String ruleId;

    @JsonProperty("rule_ids")
    private final List<String> ruleIds;

    @JsonProperty("cause")
    private final AlertCause cause;

    @JsonProperty("severity")
    private final Severity severity;

    @JsonProperty("risk_score")
    private final int riskScore;

    @JsonProperty("rule_snapshot_version")
    private final long ruleSnapshotVersion;

    @JsonProperty("generated_at")
    private final Instant generatedAt;

    @JsonProperty("evidence")
    private final List<Event> evidence;

    @JsonProperty("enrichment")
    private final EnrichmentSnapshot enrichment;

    @JsonProperty("message")
    private final String message;

    private Alert(Builder b) {
        this.alertId = b.alertId != null ? b.alertId : UUID.randomUUID().toString();
        this.sessionId = Objects.requireNonNull(b.sessionId, "sessionId");
        this.sourceIp = b.sourceIp;
        this.ruleIds = List.copyOf(b.ruleIds);
        this.ruleId = ruleIds.isEmpty() ? null : ruleIds.get(0);
        this.cause = Objects.requireNonNull(b.cause, "cause");
        this.severity = Objects.requireNonNull(b.severity, "severity");
        this.riskScore = b.riskScore;
        this.ruleSnapshotVersion = b.ruleSnapshotVersion;
        this.generatedAt = Objects.requireNonNull(b.generatedAt, "generatedAt");
        this.evidence = List.copyOf(b.evidence);
        this.enrichment = b.enrichment != null ? b.enrichment : EnrichmentSnapshot.UNKNOWN;
        this.message = b.message;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getAlertId() {
        return alertId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    /**
     * Primary rule that produced the alert, or null for synthetic causes.
     */
    public String getRuleId() {
        return ruleId;
    }

    /**
     * Every rule newly matched by the evaluation that produced the alert.
     */
    public List<String> getRuleIds() {
        return ruleIds;
    }

    public AlertCause getCause() {
        return cause;
    }

    public Severity getSeverity() {
        return severity;
    }

    public int getRiskScore() {
        return riskScore;
    }

    public long getRuleSnapshotVersion() {
        return ruleSnapshotVersion;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public List<Event> getEvidence() {
        return evidence;
    }

    public EnrichmentSnapshot getEnrichment() {
        return enrichment;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "Alert{" + severity.getValue() + " session=" + sessionId + " ip=" + sourceIp
            + " cause=" + cause + " rules=" + ruleIds + " score=" + riskScore + "}";
    }

    public static final class Builder {
        private String alertId;
        private String sessionId;
        private String sourceIp;
        private List<String> ruleIds = List.of();
        private AlertCause cause = AlertCause.RULE_MATCH;
        private Severity severity;
        private int riskScore;
        private long ruleSnapshotVersion;
        private Instant generatedAt;
        private List<Event> evidence = List.of();
        private EnrichmentSnapshot enrichment;
        private String message;

        private Builder() {
        }

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder sourceIp(String sourceIp) {
            this.sourceIp = sourceIp;
            return this;
        }

        public Builder ruleIds(List<String> ruleIds) {
            this.ruleIds = ruleIds;
            return this;
        }

        public Builder cause(AlertCause cause) {
            this.cause = cause;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder riskScore(int riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder ruleSnapshotVersion(long ruleSnapshotVersion) {
            this.ruleSnapshotVersion = ruleSnapshotVersion;
            return this;
        }

        public Builder generatedAt(Instant generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        public Builder evidence(List<Event> evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder enrichment(EnrichmentSnapshot enrichment) {
            this.enrichment = enrichment;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }
}
