package com.hivewatch.session;

import com.hivewatch.domain.SessionSnapshot;

/**
 * Notified when the idle sweep closes a session.
 */
@FunctionalInterface
public interface SessionListener {

    void onSessionClosed(SessionSnapshot session);
}
