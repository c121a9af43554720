package com.hivewatch.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodic idle sweep and retention eviction over the session store.
 */
@Component
public class IdleSessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(IdleSessionSweeper.class);

    private final SessionStore sessionStore;
    private final Clock clock;

    public IdleSessionSweeper(SessionStore sessionStore, Clock clock) {
        this.sessionStore = sessionStore;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${hivewatch.session.sweep-interval:PT60S}")
    public void sweep() {
        Instant now = clock.instant();
        try {
            int closed = sessionStore.closeIdle(now).size();
            int evicted = sessionStore.evictExpired(now);
            if (closed > 0 || evicted > 0) {
                log.info("Idle sweep closed {} sessions, evicted {}", closed, evicted);
            }
        } catch (RuntimeException e) {
            log.error("Idle sweep failed", e);
        }
    }
}
