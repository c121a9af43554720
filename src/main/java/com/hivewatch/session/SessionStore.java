package com.hivewatch.session;

import com.google.common.util.concurrent.Striped;
import com.hivewatch.config.HiveWatchProperties;
import com.hivewatch.domain.CloseReason;
import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.SessionSnapshot;
import com.hivewatch.domain.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;

/**
 * Authoritative, in-memory set of attacker sessions.
 *
 * Mutation is serialized per session id through a striped lock: ingests for the same
 * session never interleave, ingests for different sessions proceed in parallel. Readers
 * take the same stripe for the duration of one snapshot copy, so they never observe a
 * partially appended event and never hold a writer up for longer than that copy.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Striped<Lock> locks = Striped.lock(64);
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private final Duration idleTimeout;
    private final Duration idleThreshold;
    private final Duration retention;
    private final Clock clock;
    private final SessionMetrics metrics;

    @Autowired
    public SessionStore(HiveWatchProperties properties, Clock clock, SessionMetrics metrics) {
        this(properties.getSession().getIdleTimeout(),
            properties.getSession().getIdleThreshold(),
            properties.getSession().getLogRetentionDays(),
            clock, metrics);
    }

    public SessionStore(Duration idleTimeout, Duration idleThreshold, int retentionDays, Clock clock,
                        SessionMetrics metrics) {
        this.idleTimeout = idleTimeout;
        this.idleThreshold = idleThreshold.compareTo(idleTimeout) < 0 ? idleThreshold : idleTimeout;
        this.retention = retentionDays > 0 ? Duration.ofDays(retentionDays) : null;
        this.clock = clock;
        this.metrics = metrics;
        metrics.registerActiveGauge(this::activeCount);
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Single mutation entry point. Creates the session on its first event, appends the event
     * and advances {@code last_seen}. A session closed by the idle sweep reopens when more data
     * arrives; a session closed by disconnect keeps trailing records but stays closed.
     * Rule evaluation is not performed here.
     */
    public IngestResult ingest(Event event) {
        String sessionId = event.getSessionId();
        boolean created = false;
        SessionSnapshot closedNow = null;
        Event stored;

        Lock lock = locks.get(sessionId);
        lock.lock();
        try {
            Session session = sessions.get(sessionId);
            if (session == null) {
                session = new Session(sessionId);
                sessions.put(sessionId, session);
                created = true;
            } else if (session.state() == SessionState.CLOSED
                && session.closeReason() == CloseReason.IDLE_TIMEOUT) {
                log.debug("Session {} reopened after idle close", sessionId);
                session.reopen();
            }

            stored = session.append(event, clock.instant());

            if (event.getKind() == EventKind.DISCONNECT && session.state() != SessionState.CLOSED) {
                session.close(CloseReason.DISCONNECT);
                closedNow = session.snapshot();
            } else {
                session.markActive();
            }
        } finally {
            lock.unlock();
        }

        if (created) {
            metrics.recordCreated();
            log.debug("Session {} opened from {}", sessionId, event.getSourceIp());
        }
        if (closedNow != null) {
            metrics.recordClosed(CloseReason.DISCONNECT);
            log.debug("Session {} closed by disconnect ({} events)", sessionId, closedNow.getEventCount());
        }
        return new IngestResult(sessionId, stored, created, closedNow);
    }

    public Optional<SessionSnapshot> get(String sessionId) {
        Lock lock = locks.get(sessionId);
        lock.lock();
        try {
            Session session = sessions.get(sessionId);
            return session != null ? Optional.of(session.snapshot()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Event-free view for rule evaluation; does not copy the event list.
     */
    public Optional<SessionView> view(String sessionId) {
        Lock lock = locks.get(sessionId);
        lock.lock();
        try {
            Session session = sessions.get(sessionId);
            return session != null ? Optional.of(session.view()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claims the close summary of a session. Returns a snapshot read under the session's lock when
     * the session is still closed, its score is at least {@code minScore} and the score rose since
     * the last claimed summary. A session that reopened in the meantime is left for its next close.
     */
    public Optional<SessionSnapshot> claimSummary(String sessionId, int minScore) {
        Lock lock = locks.get(sessionId);
        lock.lock();
        try {
            Session session = sessions.get(sessionId);
            if (session == null || session.state() != SessionState.CLOSED || session.riskScore() < minScore) {
                return Optional.empty();
            }
            return session.markSummarized() ? Optional.of(session.snapshot()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of every session, oldest first.
     */
    public List<SessionSnapshot> snapshotAll() {
        List<SessionSnapshot> snapshots = new ArrayList<>(sessions.size());
        for (String sessionId : sessions.keySet()) {
            get(sessionId).ifPresent(snapshots::add);
        }
        snapshots.sort(Comparator.comparing(SessionSnapshot::getFirstSeen));
        return snapshots;
    }

    /**
     * Applies rule matches to a session. A rule already matched keeps its original weight and
     * evidence; only new rules add to the score. The full snapshot is only taken when the score
     * rose.
     *
     * @param matches rule id to the id of the event that triggered it
     * @param weights rule id to its risk weight in the snapshot that evaluated it
     */
    public ScoreUpdate recordMatches(String sessionId, Map<String, String> matches, Map<String, Integer> weights) {
        Lock lock = locks.get(sessionId);
        lock.lock();
        try {
            Session session = sessions.get(sessionId);
            if (session == null) {
                return ScoreUpdate.missing();
            }
            int previous = session.riskScore();
            List<String> added = new ArrayList<>();
            matches.forEach((ruleId, eventId) -> {
                if (session.addMatch(ruleId, eventId, weights.getOrDefault(ruleId, 0))) {
                    added.add(ruleId);
                }
            });
            int current = session.riskScore();
            return new ScoreUpdate(previous, current, added, current > previous ? session.snapshot() : null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sweeps every open session: past the idle threshold it becomes Idle, past the idle timeout
     * it is Closed and listeners are notified. Each session is re-checked under its lock, and a
     * session that took an event after {@code now} was computed is left alone.
     *
     * @return snapshots of the sessions closed by this sweep
     */
    public List<SessionSnapshot> closeIdle(Instant now) {
        List<SessionSnapshot> closed = new ArrayList<>();
        for (String sessionId : sessions.keySet()) {
            Lock lock = locks.get(sessionId);
            lock.lock();
            try {
                Session session = sessions.get(sessionId);
                if (session == null || session.state() == SessionState.CLOSED) {
                    continue;
                }
                if (session.lastIngestedAt().isAfter(now)) {
                    continue;
                }
                Duration idle = Duration.between(session.lastSeen(), now);
                if (idle.compareTo(idleTimeout) > 0) {
                    session.close(CloseReason.IDLE_TIMEOUT);
                    closed.add(session.snapshot());
                } else if (idle.compareTo(idleThreshold) > 0) {
                    session.markIdle();
                }
            } finally {
                lock.unlock();
            }
        }

        for (SessionSnapshot session : closed) {
            metrics.recordClosed(CloseReason.IDLE_TIMEOUT);
            log.debug("Session {} closed after idle timeout", session.getSessionId());
            for (SessionListener listener : listeners) {
                try {
                    listener.onSessionClosed(session);
                } catch (RuntimeException e) {
                    log.error("Session listener failed for {}", session.getSessionId(), e);
                }
            }
        }
        return closed;
    }

    /**
     * Drops closed sessions whose last event is older than the retention window.
     * No-op when retention is unlimited.
     */
    public int evictExpired(Instant now) {
        if (retention == null) {
            return 0;
        }
        Instant cutoff = now.minus(retention);
        int evicted = 0;
        for (String sessionId : sessions.keySet()) {
            Lock lock = locks.get(sessionId);
            lock.lock();
            try {
                Session session = sessions.get(sessionId);
                if (session != null && session.state() == SessionState.CLOSED
                    && session.lastSeen().isBefore(cutoff)) {
                    sessions.remove(sessionId);
                    evicted++;
                }
            } finally {
                lock.unlock();
            }
        }
        if (evicted > 0) {
            metrics.recordEvicted(evicted);
            log.info("Evicted {} sessions older than {} days", evicted, retention.toDays());
        }
        return evicted;
    }

    public int size() {
        return sessions.size();
    }

    public int activeCount() {
        int active = 0;
        for (Session session : sessions.values()) {
            if (session.state() != SessionState.CLOSED) {
                active++;
            }
        }
        return active;
    }
}
