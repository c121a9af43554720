package com.hivewatch.correlation.rules;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.RuleDefinition;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window counter keyed by source address or session.
 *
 * Parameters: {@code event_kind}, {@code key} ({@code source_ip} or {@code session}),
 * {@code threshold} and {@code window}. Matches once the count of qualifying events inside
 * the window exceeds the threshold; entries older than the window fall out, which resets it.
 * Windows use event timestamps, so replayed history is counted as it happened.
 */
public class RateThresholdRule extends CompiledRule {

    private final EventKind eventKind;
    private final boolean keyBySession;
    private final int threshold;
    private final Duration window;
    private final Cache<String, Deque<Instant>> windows;

    public RateThresholdRule(RuleDefinition definition) {
        super(definition);
        RuleParameters params = new RuleParameters(definition);
        this.eventKind = EventKind.fromValue(params.string("event_kind", EventKind.LOGIN_FAILED.getValue()));
        String key = params.string("key", "source_ip");
        if (!key.equals("source_ip") && !key.equals("session")) {
            throw new IllegalArgumentException("Rule " + definition.getId() + ": key must be source_ip or session");
        }
        this.keyBySession = key.equals("session");
        this.threshold = params.integer("threshold", 5);
        this.window = params.duration("window", Duration.ofSeconds(60));
        if (threshold < 0 || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Rule " + definition.getId() + ": threshold and window must be positive");
        }

        this.windows = Caffeine.newBuilder()
            .maximumSize(100_000)
            .expireAfterAccess(window.multipliedBy(2))
            .build();
    }

    @Override
    public boolean matches(EvaluationContext context) {
        Event event = context.getEvent();
        if (event.getKind() != eventKind) {
            return false;
        }
        String key = keyBySession ? event.getSessionId() : context.getSourceIp();
        if (key == null) {
            return false;
        }
        Deque<Instant> timestamps = windows.get(key, k -> new ArrayDeque<>());
        synchronized (timestamps) {
            Instant now = event.getTimestamp();
            timestamps.addLast(now);
            Instant cutoff = now.minus(window);
            timestamps.removeIf(t -> t.isBefore(cutoff));
            return timestamps.size() > threshold;
        }
    }

    int countFor(String key) {
        Deque<Instant> timestamps = windows.getIfPresent(key);
        if (timestamps == null) {
            return 0;
        }
        synchronized (timestamps) {
            return timestamps.size();
        }
    }
}
