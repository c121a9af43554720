package com.hivewatch.session;

import com.hivewatch.domain.CloseReason;
import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.SessionSnapshot;
import com.hivewatch.domain.SessionState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Mutable session aggregate. Only {@link SessionStore} touches instances, always
 * while holding the lock stripe for the session id.
 */
final class Session {

    private final String sessionId;
    private final List<Event> events = new ArrayList<>();
    private final Map<String, String> ruleEvidence = new LinkedHashMap<>();
    private final Map<String, Integer> ruleWeights = new LinkedHashMap<>();

    private String sourceIp;
    private Instant firstSeen;
    private Instant lastSeen;
    private Instant lastIngestedAt;
    private SessionState state = SessionState.OPEN;
    private CloseReason closeReason;
    private int riskScore;
    private int summarizedScore = -1;

    private Integer dstPort;
    private String protocol;
    private String clientVersion;
    private String username;
    private boolean loginSuccess;
    private String ttyLog;

    Session(String sessionId) {
        this.sessionId = sessionId;
    }

    /**
     * Appends the event, clamping its timestamp to {@code lastSeen} when it arrives out of order.
     * Returns the event as stored.
     */
    Event append(Event event, Instant ingestedAt) {
        Event stored = event;
        if (lastSeen != null && event.getTimestamp().isBefore(lastSeen)) {
            stored = event.withTimestamp(lastSeen);
        }
        if (firstSeen == null) {
            firstSeen = stored.getTimestamp();
        }
        lastSeen = stored.getTimestamp();
        lastIngestedAt = ingestedAt;
        if (sourceIp == null) {
            sourceIp = stored.getSourceIp();
        }
        events.add(stored);
        updateDetails(stored);
        return stored;
    }

    private void updateDetails(Event event) {
        Long port = event.getLong(Event.DST_PORT);
        if (port != null && dstPort == null) {
            dstPort = port.intValue();
            protocol = protocolFor(dstPort, protocol);
        }
        String declared = event.getString(Event.PROTOCOL);
        if (declared != null && protocol == null) {
            protocol = declared.toUpperCase(Locale.ROOT);
        }
        String version = event.getString(Event.VERSION);
        if (version != null && clientVersion == null) {
            clientVersion = version;
        }
        String ttylog = event.getString(Event.TTYLOG);
        if (ttylog != null) {
            ttyLog = ttylog;
        }

        if (event.getKind() == EventKind.LOGIN_SUCCESS) {
            username = event.getString(Event.USERNAME);
            loginSuccess = true;
        } else if (event.getKind().isLogin() && !loginSuccess) {
            String attempted = event.getString(Event.USERNAME);
            if (attempted != null) {
                username = attempted;
            }
        }
    }

    static String protocolFor(int port, String fallback) {
        switch (port) {
            case 22:
            case 2222:
                return "SSH";
            case 23:
            case 2223:
                return "Telnet";
            default:
                return fallback;
        }
    }

    /**
     * Records a rule match unless the rule already contributed. Returns true if it was new.
     */
    boolean addMatch(String ruleId, String eventId, int weight) {
        if (ruleEvidence.containsKey(ruleId)) {
            return false;
        }
        ruleEvidence.put(ruleId, eventId);
        ruleWeights.put(ruleId, weight);
        riskScore = RiskScore.compute(ruleWeights.values());
        return true;
    }

    /**
     * Records that the current score has been summarized. Returns false if a summary already
     * covered this score or a higher one.
     */
    boolean markSummarized() {
        if (riskScore <= summarizedScore) {
            return false;
        }
        summarizedScore = riskScore;
        return true;
    }

    void close(CloseReason reason) {
        state = SessionState.CLOSED;
        closeReason = reason;
    }

    void reopen() {
        state = SessionState.OPEN;
        closeReason = null;
    }

    void markIdle() {
        state = SessionState.IDLE;
    }

    void markActive() {
        if (state == SessionState.IDLE) {
            state = SessionState.OPEN;
        }
    }

    String sessionId() {
        return sessionId;
    }

    SessionState state() {
        return state;
    }

    CloseReason closeReason() {
        return closeReason;
    }

    Instant lastSeen() {
        return lastSeen;
    }

    Instant lastIngestedAt() {
        return lastIngestedAt;
    }

    int riskScore() {
        return riskScore;
    }

    SessionView view() {
        return new SessionView(sessionId, sourceIp, state, riskScore, ruleEvidence.keySet());
    }

    SessionSnapshot snapshot() {
        return SessionSnapshot.builder()
            .sessionId(sessionId)
            .sourceIp(sourceIp)
            .firstSeen(firstSeen)
            .lastSeen(lastSeen)
            .state(state)
            .closeReason(closeReason)
            .events(events)
            .riskScore(riskScore)
            .matchedRuleIds(ruleEvidence.keySet())
            .ruleEvidence(ruleEvidence)
            .ruleWeights(ruleWeights)
            .dstPort(dstPort)
            .protocol(protocol)
            .clientVersion(clientVersion)
            .username(username)
            .loginSuccess(loginSuccess)
            .ttyLog(ttyLog)
            .build();
    }
}
