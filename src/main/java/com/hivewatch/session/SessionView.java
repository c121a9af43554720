package com.hivewatch.session;

import com.hivewatch.domain.SessionState;

import java.util.Set;

/**
 * Event-free view of a session, enough for rule evaluation. Costs the same to take whatever
 * the length of the session.
 */
public final class SessionView {

    private final String sessionId;
    private final String sourceIp;
    private final SessionState state;
    private final int riskScore;
    private final Set<String> matchedRuleIds;

    SessionView(String sessionId, String sourceIp, SessionState state, int riskScore, Set<String> matchedRuleIds) {
        this.sessionId = sessionId;
        this.sourceIp = sourceIp;
        this.state = state;
        this.riskScore = riskScore;
        this.matchedRuleIds = Set.copyOf(matchedRuleIds);
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public SessionState getState() {
        return state;
    }

    public int getRiskScore() {
        return riskScore;
    }

    public Set<String> getMatchedRuleIds() {
        return matchedRuleIds;
    }
}
