package com.hivewatch.monitoring;

import com.hivewatch.alerting.AlertFanout;
import com.hivewatch.correlation.RuleRegistry;
import com.hivewatch.correlation.RuleSnapshot;
import com.hivewatch.domain.Alert;
import com.hivewatch.domain.SessionSnapshot;
import com.hivewatch.session.SessionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only view for dashboards and exporters: the live alert stream, session snapshots and
 * operator diagnostics. Nothing here mutates engine state.
 */
@Service
public class MonitoringService {

    private final SessionStore sessionStore;
    private final AlertFanout alertFanout;
    private final RuleRegistry ruleRegistry;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public MonitoringService(SessionStore sessionStore, AlertFanout alertFanout, RuleRegistry ruleRegistry,
                             MeterRegistry meterRegistry, Clock clock) {
        this.sessionStore = sessionStore;
        this.alertFanout = alertFanout;
        this.ruleRegistry = ruleRegistry;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Live alerts published from now on.
     */
    public Flux<Alert> alerts() {
        return alertFanout.alerts();
    }

    public List<Alert> recentAlerts(int limit) {
        return alertFanout.recentAlerts(limit);
    }

    /**
     * Every session, oldest first.
     */
    public List<SessionSnapshot> sessions() {
        return sessionStore.snapshotAll();
    }

    public Optional<SessionSnapshot> session(String sessionId) {
        return sessionStore.get(sessionId);
    }

    /**
     * Source addresses that opened more than one session, busiest first.
     */
    public List<Campaign> campaigns() {
        Map<String, List<SessionSnapshot>> byIp = new LinkedHashMap<>();
        for (SessionSnapshot session : sessionStore.snapshotAll()) {
            if (session.getSourceIp() != null) {
                byIp.computeIfAbsent(session.getSourceIp(), ip -> new ArrayList<>()).add(session);
            }
        }
        List<Campaign> campaigns = new ArrayList<>();
        byIp.forEach((ip, sessions) -> {
            if (sessions.size() > 1) {
                campaigns.add(new Campaign(ip, sessions));
            }
        });
        campaigns.sort(Comparator.comparingInt(Campaign::getSessionCount).reversed()
            .thenComparing(Campaign::getSourceIp));
        return campaigns;
    }

    public DiagnosticsSnapshot diagnostics() {
        Map<String, Long> drops = new TreeMap<>();
        for (String consumer : alertFanout.consumers()) {
            drops.put(consumer, alertFanout.droppedCount(consumer));
        }
        RuleSnapshot rules = ruleRegistry.current();

        return DiagnosticsSnapshot.builder()
            .takenAt(clock.instant())
            .recordsRead(sum("hivewatch.ingestion.records"))
            .recordsMalformed(sum("hivewatch.ingestion.malformed"))
            .recordsDuplicate(sum("hivewatch.ingestion.duplicates"))
            .sourceUnavailable(sum("hivewatch.ingestion.source.unavailable"))
            .adapterRestarts(sum("hivewatch.ingestion.adapter.restarts"))
            .eventsNormalized(sum("hivewatch.normalization.parsed"))
            .normalizationFailures(sum("hivewatch.normalization.failed"))
            .sessionsTotal(sessionStore.size())
            .sessionsActive(sessionStore.activeCount())
            .eventsEvaluated(sum("hivewatch.correlation.events"))
            .ruleErrors(sum("hivewatch.correlation.rule.errors"))
            .alertsEmitted(sum("hivewatch.correlation.alerts"))
            .alertDrops(drops)
            .enrichmentTimeouts(sum("hivewatch.enrichment.timeouts"))
            .feedRefreshFailures(sum("hivewatch.enrichment.feed.refresh.failure"))
            .ruleSnapshotVersion(rules.getVersion())
            .rulesLoaded(rules.size())
            .build();
    }

    private long sum(String counterName) {
        double total = 0;
        for (Counter counter : meterRegistry.find(counterName).counters()) {
            total += counter.count();
        }
        return (long) total;
    }
}
