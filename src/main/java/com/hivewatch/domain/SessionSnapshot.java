package com.hivewatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Point-in-time, immutable copy of a session as held by the session store.
 * Readers (dashboard, export, correlation) only ever see snapshots.
 */
public final class SessionSnapshot {

    @JsonProperty("session_id")
    private final String sessionId;

    @JsonProperty("source_ip")
    private final String sourceIp;

    @JsonProperty("first_seen")
    private final Instant firstSeen;

    @JsonProperty("last_seen")
    private final Instant lastSeen;

    @JsonProperty("state")
    private final SessionState state;

    @JsonProperty("close_reason")
    private final CloseReason closeReason;

    @JsonProperty("events")
    private final List<Event> events;

    @JsonProperty("risk_score")
    private final int riskScore;

    @JsonProperty("matched_rule_ids")
    private final Set<String> matchedRuleIds;

    @JsonProperty("rule_evidence")
    private final Map<String, String> ruleEvidence;

    @JsonProperty("rule_weights")
    private final Map<String, Integer> ruleWeights;

    @JsonProperty("dst_port")
    private final Integer dstPort;

    @JsonProperty("protocol")
    private final String protocol;

    @JsonProperty("client_version")
    private final String clientVersion;

    @JsonProperty("username")
    private final String username;

    @JsonProperty("login_success")
    private final boolean loginSuccess;

    @JsonProperty("tty_log")
    private final String ttyLog;

    private SessionSnapshot(Builder b) {
        this.sessionId = b.sessionId;
        this.sourceIp = b.sourceIp;
        this.firstSeen = b.firstSeen;
        this.lastSeen = b.lastSeen;
        this.state = b.state;
        this.closeReason = b.closeReason;
        this.events = List.copyOf(b.events);
        this.riskScore = b.riskScore;
        this.matchedRuleIds = java.util.Collections.unmodifiableSet(new LinkedHashSet<>(b.matchedRuleIds));
        this.ruleEvidence = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(b.ruleEvidence));
        this.ruleWeights = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(b.ruleWeights));
        this.dstPort = b.dstPort;
        this.protocol = b.protocol;
        this.clientVersion = b.clientVersion;
        this.username = b.username;
        this.loginSuccess = b.loginSuccess;
        this.ttyLog = b.ttyLog;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public SessionState getState() {
        return state;
    }

    public CloseReason getCloseReason() {
        return closeReason;
    }

    public List<Event> getEvents() {
        return events;
    }

    public int getRiskScore() {
        return riskScore;
    }

    public Set<String> getMatchedRuleIds() {
        return matchedRuleIds;
    }

    /**
     * Rule id to the id of the event that first triggered it.
     */
    public Map<String, String> getRuleEvidence() {
        return ruleEvidence;
    }

    /**
     * Weight each matched rule contributed when it matched.
     */
    public Map<String, Integer> getRuleWeights() {
        return ruleWeights;
    }

    public Integer getDstPort() {
        return dstPort;
    }

    public String getProtocol() {
        return protocol;
    }

    public String getClientVersion() {
        return clientVersion;
    }

    public String getUsername() {
        return username;
    }

    public boolean isLoginSuccess() {
        return loginSuccess;
    }

    public String getTtyLog() {
        return ttyLog;
    }

    @JsonIgnore
    public int getEventCount() {
        return events.size();
    }

    @JsonIgnore
    public Duration getDuration() {
        return Duration.between(firstSeen, lastSeen);
    }

    @JsonIgnore
    public List<String> getCommands() {
        return events.stream()
            .filter(e -> e.getKind() == EventKind.COMMAND && e.getCommand() != null)
            .map(Event::getCommand)
            .collect(Collectors.toList());
    }

    @JsonIgnore
    public List<Event> getFileTransfers() {
        return events.stream()
            .filter(e -> e.getKind() == EventKind.FILE_DOWNLOAD || e.getKind() == EventKind.FILE_UPLOAD)
            .collect(Collectors.toList());
    }

    @JsonIgnore
    public boolean isClosed() {
        return state == SessionState.CLOSED;
    }

    @Override
    public String toString() {
        return "SessionSnapshot{" + sessionId + " ip=" + sourceIp + " state=" + state
            + " events=" + events.size() + " score=" + riskScore + "}";
    }

    public static final class Builder {
        private String sessionId;
        private String sourceIp;
        private Instant firstSeen;
        private Instant lastSeen;
        private SessionState state = SessionState.OPEN;
        private CloseReason closeReason;
        private List<Event> events = List.of();
        private int riskScore;
        private Set<String> matchedRuleIds = Set.of();
        private Map<String, String> ruleEvidence = Map.of();
        private Map<String, Integer> ruleWeights = Map.of();
        private Integer dstPort;
        private String protocol;
        private String clientVersion;
        private String username;
        private boolean loginSuccess;
        private String ttyLog;

        private Builder() {
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder sourceIp(String sourceIp) {
            this.sourceIp = sourceIp;
            return this;
        }

        public Builder firstSeen(Instant firstSeen) {
            this.firstSeen = firstSeen;
            return this;
        }

        public Builder lastSeen(Instant lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }

        public Builder state(SessionState state) {
            this.state = state;
            return this;
        }

        public Builder closeReason(CloseReason closeReason) {
            this.closeReason = closeReason;
            return this;
        }

        public Builder events(List<Event> events) {
            this.events = events;
            return this;
        }

        public Builder riskScore(int riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder matchedRuleIds(Set<String> matchedRuleIds) {
            this.matchedRuleIds = matchedRuleIds;
            return this;
        }

        public Builder ruleEvidence(Map<String, String> ruleEvidence) {
            this.ruleEvidence = ruleEvidence;
            return this;
        }

        public Builder ruleWeights(Map<String, Integer> ruleWeights) {
            this.ruleWeights = ruleWeights;
            return this;
        }

        public Builder dstPort(Integer dstPort) {
            this.dstPort = dstPort;
            return this;
        }

        public Builder protocol(String protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder clientVersion(String clientVersion) {
            this.clientVersion = clientVersion;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder loginSuccess(boolean loginSuccess) {
            this.loginSuccess = loginSuccess;
            return this;
        }

        public Builder ttyLog(String ttyLog) {
            this.ttyLog = ttyLog;
            return this;
        }

        public SessionSnapshot build() {
            return new SessionSnapshot(this);
        }
    }
}
