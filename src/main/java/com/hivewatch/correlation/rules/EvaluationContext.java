package com.hivewatch.correlation.rules;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.ReputationVerdict;
import com.hivewatch.session.SessionView;

import java.util.Collections;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Everything a rule may look at while evaluating one event.
 */
public final class EvaluationContext {

    private final Event event;
    private final SessionView session;
    private final String sourceIp;
    private final Set<String> triggered;
    private final Supplier<ReputationVerdict> reputation;

    public EvaluationContext(Event event, SessionView session, String sourceIp, Set<String> triggered,
                             Supplier<ReputationVerdict> reputation) {
        this.event = event;
        this.session = session;
        this.sourceIp = sourceIp;
        this.triggered = triggered;
        this.reputation = reputation;
    }

    public Event getEvent() {
        return event;
    }

    public SessionView getSession() {
        return session;
    }

    /**
     * Source address of the event, falling back to the session's.
     */
    public String getSourceIp() {
        return sourceIp;
    }

    /**
     * Rules already matched by this session plus those matched so far in this evaluation.
     */
    public Set<String> getTriggered() {
        return Collections.unmodifiableSet(triggered);
    }

    /**
     * Reputation of the source address; looked up at most once per evaluation.
     */
    public ReputationVerdict getReputation() {
        return reputation.get();
    }
}
