package com.hivewatch.correlation;

import com.google.common.base.Suppliers;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.hivewatch.alerting.AlertFanout;
import com.hivewatch.config.HiveWatchProperties;
import com.hivewatch.config.SeverityBands;
import com.hivewatch.correlation.rules.CompiledRule;
import com.hivewatch.correlation.rules.CompositeRule;
import com.hivewatch.correlation.rules.EvaluationContext;
import com.hivewatch.domain.Alert;
import com.hivewatch.domain.AlertCause;
import com.hivewatch.domain.EnrichmentSnapshot;
import com.hivewatch.domain.Event;
import com.hivewatch.domain.ReputationVerdict;
import com.hivewatch.domain.Severity;
import com.hivewatch.domain.SessionSnapshot;
import com.hivewatch.enrichment.EnrichmentService;
import com.hivewatch.session.IngestResult;
import com.hivewatch.session.ScoreUpdate;
import com.hivewatch.session.SessionListener;
import com.hivewatch.session.SessionStore;
import com.hivewatch.session.SessionView;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Evaluates every ingested event against the active rule snapshot and turns score increases
 * into alerts.
 *
 * Evaluation runs on a fixed set of single-threaded shards keyed by session id, so events of one
 * session are evaluated in ingestion order while unrelated sessions proceed in parallel and a slow
 * rule never holds up ingestion. Each evaluation reads one {@link RuleSnapshot} from start to
 * finish; a reload only affects evaluations that start after it.
 *
 * Per event:
 * - whitelisted sources are suppressed outright
 * - non-composite rules run first, skipping stateless rules the session already matched
 * - composite rules are then re-evaluated until no further composite triggers
 * - the new matches are applied to the session; an alert is emitted when the score rose and
 *   is at or above the minimum risk score
 *
 * A rule that throws is disabled for the remainder of the run and logged once; other rules
 * continue.
 */
@Service
public class CorrelationEngine implements SessionListener {

    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

    private final SessionStore store;
    private final Supplier<RuleSnapshot> rules;
    private final EnrichmentService enrichment;
    private final AlertFanout fanout;
    private final CorrelationMetrics metrics;
    private final Clock clock;
    private final int minRiskScore;
    private final SeverityBands severityBands;
    private final boolean closeSummaryAlerts;
    private final int workers;

    private volatile ExecutorService[] shards;

    @Autowired
    public CorrelationEngine(HiveWatchProperties properties, SessionStore store, RuleRegistry registry,
                             EnrichmentService enrichment, AlertFanout fanout, CorrelationMetrics metrics,
                             Clock clock) {
        this(store, registry::current, enrichment, fanout, metrics, clock,
            properties.getRules().getMinRiskScore(),
            SeverityBands.from(properties.getRules().getSeverityBands()),
            properties.getSession().isCloseSummaryAlerts(),
            properties.getRules().getEvaluationWorkers());
    }

    public CorrelationEngine(SessionStore store, Supplier<RuleSnapshot> rules, EnrichmentService enrichment,
                             AlertFanout fanout, CorrelationMetrics metrics, Clock clock, int minRiskScore,
                             SeverityBands severityBands, boolean closeSummaryAlerts, int workers) {
        this.store = store;
        this.rules = rules;
        this.enrichment = enrichment;
        this.fanout = fanout;
        this.metrics = metrics;
        this.clock = clock;
        this.minRiskScore = minRiskScore;
        this.severityBands = severityBands;
        this.closeSummaryAlerts = closeSummaryAlerts;
        this.workers = Math.max(1, workers);
    }

    /**
     * Starts the evaluation shards and subscribes to idle-close notifications.
     */
    public synchronized void start() {
        if (shards != null) {
            return;
        }
        ThreadFactory factory = new ThreadFactoryBuilder()
            .setNameFormat("hivewatch-correlation-%d")
            .setDaemon(true)
            .build();
        ExecutorService[] created = new ExecutorService[workers];
        for (int i = 0; i < workers; i++) {
            created[i] = Executors.newSingleThreadExecutor(factory);
        }
        shards = created;
        store.addListener(this);
        log.info("Correlation engine started with {} workers (min risk score {})", workers, minRiskScore);
    }

    /**
     * Stops rule evaluation and alert emission. Session state is left untouched.
     */
    @PreDestroy
    public synchronized void stop() {
        ExecutorService[] running = shards;
        if (running == null) {
            return;
        }
        shards = null;
        store.removeListener(this);
        for (ExecutorService shard : running) {
            shard.shutdown();
        }
        for (ExecutorService shard : running) {
            try {
                if (!shard.awaitTermination(5, TimeUnit.SECONDS)) {
                    shard.shutdownNow();
                }
            } catch (InterruptedException e) {
                shard.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Correlation engine stopped");
    }

    public boolean isRunning() {
        return shards != null;
    }

    /**
     * Queues evaluation of an ingested event on its session's shard. Returns immediately. When the
     * event closed its session, the summary runs on the same shard after the evaluation, so it sees
     * every earlier event of the session scored.
     */
    public void submit(IngestResult result) {
        dispatch(result.getSessionId(), () -> {
            evaluate(result.getEvent());
            if (result.closedSession()) {
                summarize(result.getSessionId());
            }
        });
    }

    @Override
    public void onSessionClosed(SessionSnapshot session) {
        String sessionId = session.getSessionId();
        dispatch(sessionId, () -> summarize(sessionId));
    }

    /**
     * Evaluates one event synchronously.
     *
     * @return the alert emitted, or null
     */
    public Alert evaluate(Event event) {
        long start = System.nanoTime();
        RuleSnapshot snapshot = rules.get();
        try {
            SessionView session = store.view(event.getSessionId()).orElse(null);
            if (session == null) {
                log.debug("Session {} gone before evaluation", event.getSessionId());
                return null;
            }
            String sourceIp = event.getSourceIp() != null ? event.getSourceIp() : session.getSourceIp();
            if (snapshot.isWhitelisted(sourceIp)) {
                metrics.recordSuppressed();
                return null;
            }

            Set<String> triggered = new LinkedHashSet<>(session.getMatchedRuleIds());
            Supplier<ReputationVerdict> reputation = Suppliers.memoize(() -> lookupReputation(sourceIp));
            EvaluationContext context = new EvaluationContext(event, session, sourceIp, triggered, reputation);

            Map<String, String> matches = new LinkedHashMap<>();
            for (CompiledRule rule : snapshot.getEventRules()) {
                if (rule.isDisabled() || (!rule.isStateful() && triggered.contains(rule.getId()))) {
                    continue;
                }
                if (matches(rule, context) && triggered.add(rule.getId())) {
                    matches.put(rule.getId(), event.getEventId());
                }
            }

            boolean progress = true;
            while (progress) {
                progress = false;
                for (CompositeRule rule : snapshot.getCompositeRules()) {
                    if (rule.isDisabled() || triggered.contains(rule.getId())) {
                        continue;
                    }
                    if (matches(rule, context)) {
                        triggered.add(rule.getId());
                        matches.put(rule.getId(), event.getEventId());
                        progress = true;
                    }
                }
            }

            if (matches.isEmpty()) {
                return null;
            }
            matches.keySet().forEach(metrics::recordMatch);

            ScoreUpdate update = store.recordMatches(event.getSessionId(), matches, snapshot.getWeights());
            if (!update.raised() || update.getSession() == null || update.getNewScore() < minRiskScore) {
                return null;
            }
            Alert alert = buildAlert(update.getSession(), sourceIp, update.getNewlyMatched(),
                AlertCause.RULE_MATCH, snapshot.getVersion());
            emit(alert);
            return alert;
        } finally {
            metrics.recordEvaluated(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Emits the final-score alert for a closed session, read fresh from the store. Nothing is
     * emitted when summaries are disabled, the score is below the minimum, or an earlier summary
     * of the session already reported this score.
     *
     * @return the alert emitted, or null
     */
    public Alert summarize(String sessionId) {
        if (!closeSummaryAlerts) {
            return null;
        }
        SessionSnapshot session = store.claimSummary(sessionId, minRiskScore).orElse(null);
        if (session == null) {
            return null;
        }
        RuleSnapshot snapshot = rules.get();
        if (snapshot.isWhitelisted(session.getSourceIp())) {
            return null;
        }
        Alert alert = buildAlert(session, session.getSourceIp(), List.of(), AlertCause.SESSION_CLOSED,
            snapshot.getVersion());
        emit(alert);
        return alert;
    }

    private boolean matches(CompiledRule rule, EvaluationContext context) {
        try {
            return rule.matches(context);
        } catch (RuntimeException e) {
            if (rule.disable()) {
                log.warn("Disabling rule {} for the rest of the run: {}", rule.getId(), e.getMessage());
                metrics.recordRuleError(rule.getId());
            }
            return false;
        }
    }

    private ReputationVerdict lookupReputation(String ip) {
        ReputationVerdict verdict = enrichment.lookupReputation(ip).block();
        return verdict != null ? verdict : ReputationVerdict.UNKNOWN;
    }

    private Alert buildAlert(SessionSnapshot session, String sourceIp, List<String> ruleIds, AlertCause cause,
                             long snapshotVersion) {
        Severity severity = severityBands.severityFor(session.getRiskScore());
        String message = cause == AlertCause.SESSION_CLOSED
            ? String.format("Session %s from %s closed with risk score %d", session.getSessionId(), sourceIp,
                session.getRiskScore())
            : String.format("Session %s from %s reached risk score %d (%s)", session.getSessionId(), sourceIp,
                session.getRiskScore(), String.join(", ", ruleIds));
        return Alert.builder()
            .sessionId(session.getSessionId())
            .sourceIp(sourceIp)
            .ruleIds(ruleIds)
            .cause(cause)
            .severity(severity)
            .riskScore(session.getRiskScore())
            .ruleSnapshotVersion(snapshotVersion)
            .generatedAt(clock.instant())
            .evidence(evidenceOf(session))
            .enrichment(enrich(sourceIp))
            .message(message)
            .build();
    }

    /**
     * The triggering event of every matched rule, in session order.
     */
    static List<Event> evidenceOf(SessionSnapshot session) {
        Collection<String> eventIds = new HashSet<>(session.getRuleEvidence().values());
        List<Event> evidence = new ArrayList<>();
        for (Event event : session.getEvents()) {
            if (eventIds.contains(event.getEventId())) {
                evidence.add(event);
            }
        }
        return evidence;
    }

    private EnrichmentSnapshot enrich(String ip) {
        try {
            EnrichmentSnapshot snapshot = enrichment.snapshot(ip).block();
            return snapshot != null ? snapshot : EnrichmentSnapshot.UNKNOWN;
        } catch (RuntimeException e) {
            log.debug("Enrichment failed for {}: {}", ip, e.getMessage());
            return EnrichmentSnapshot.UNKNOWN;
        }
    }

    private void emit(Alert alert) {
        metrics.recordAlert(alert.getSeverity());
        fanout.publish(alert);
    }

    private void dispatch(String sessionId, Runnable task) {
        ExecutorService[] running = shards;
        if (running == null) {
            log.debug("Correlation stopped; not evaluating session {}", sessionId);
            return;
        }
        ExecutorService shard = running[Math.floorMod(sessionId.hashCode(), running.length)];
        try {
            shard.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Correlation failed for session {}", sessionId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Correlation shutting down; dropped evaluation for session {}", sessionId);
        }
    }
}
