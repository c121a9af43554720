package com.hivewatch.session;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.SessionSnapshot;

/**
 * Outcome of {@link SessionStore#ingest(Event)}.
 */
public final class IngestResult {

    private final String sessionId;
    private final Event event;
    private final boolean created;
    private final SessionSnapshot closed;

    IngestResult(String sessionId, Event event, boolean created, SessionSnapshot closed) {
        this.sessionId = sessionId;
        this.event = event;
        this.created = created;
        this.closed = closed;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * The event as stored; its timestamp may have been clamped.
     */
    public Event getEvent() {
        return event;
    }

    public boolean isCreated() {
        return created;
    }

    /**
     * Snapshot of the session if this event closed it (disconnect), otherwise null.
     */
    public SessionSnapshot getClosed() {
        return closed;
    }

    public boolean closedSession() {
        return closed != null;
    }
}
