package com.hivewatch.monitoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hivewatch.domain.SessionSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Sessions opened by one source address, when it opened more than one.
 */
public final class Campaign {

    public static final int HIGH_RISK_SCORE = 80;

    @JsonProperty("source_ip")
    private final String sourceIp;

    @JsonProperty("sessions")
    private final List<SessionSnapshot> sessions;

    Campaign(String sourceIp, List<SessionSnapshot> sessions) {
        this.sourceIp = sourceIp;
        this.sessions = List.copyOf(sessions);
    }

    public String getSourceIp() {
        return sourceIp;
    }

    /**
     * Sessions of this source, oldest first.
     */
    public List<SessionSnapshot> getSessions() {
        return sessions;
    }

    public int getSessionCount() {
        return sessions.size();
    }

    public int getMaxRiskScore() {
        return sessions.stream().mapToInt(SessionSnapshot::getRiskScore).max().orElse(0);
    }

    public long getHighRiskSessions() {
        return sessions.stream().filter(s -> s.getRiskScore() >= HIGH_RISK_SCORE).count();
    }

    public Instant getFirstSeen() {
        return sessions.get(0).getFirstSeen();
    }

    public Instant getLastSeen() {
        return sessions.stream().map(SessionSnapshot::getLastSeen).max(Instant::compareTo).orElse(getFirstSeen());
    }
}
