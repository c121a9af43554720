package com.hivewatch.monitoring;

import com.hivewatch.MutableClock;
import com.hivewatch.alerting.AlertFanout;
import com.hivewatch.alerting.AlertSink;
import com.hivewatch.config.HiveWatchProperties;
import com.hivewatch.correlation.RuleRegistry;
import com.hivewatch.correlation.rules.RuleCompiler;
import com.hivewatch.domain.Alert;
import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.Severity;
import com.hivewatch.session.SessionMetrics;
import com.hivewatch.session.SessionStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MonitoringService Tests")
class MonitoringServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private MeterRegistry meterRegistry;
    private SessionStore store;
    private AlertFanout fanout;
    private RuleRegistry ruleRegistry;
    private MonitoringService monitoring;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        meterRegistry = new SimpleMeterRegistry();
        store = new SessionStore(Duration.ofMinutes(30), Duration.ofMinutes(5), 0, clock,
            new SessionMetrics(meterRegistry));
        fanout = new AlertFanout(8, meterRegistry);
        HiveWatchProperties properties = new HiveWatchProperties();
        properties.getRules().setLoadDefaultRules(false);
        properties.getAlerts().setOnCommands(List.of("wget"));
        ruleRegistry = new RuleRegistry(properties, new RuleCompiler(), clock);
        ruleRegistry.reload();
        monitoring = new MonitoringService(store, fanout, ruleRegistry, meterRegistry, clock);
    }

    @AfterEach
    void tearDown() {
        fanout.shutdown();
    }

    private void ingest(String sessionId, String ip, int offsetSeconds) {
        store.ingest(Event.builder()
            .sessionId(sessionId)
            .sourceIp(ip)
            .kind(EventKind.CONNECT)
            .timestamp(T0.plusSeconds(offsetSeconds))
            .build());
    }

    @Test
    @DisplayName("Should group repeat visitors into campaigns, busiest first")
    void shouldGroupCampaigns() {
        // Given
        ingest("A1", "185.156.73.54", 0);
        ingest("A2", "185.156.73.54", 60);
        ingest("A3", "185.156.73.54", 120);
        ingest("B1", "45.9.148.7", 10);
        ingest("B2", "45.9.148.7", 20);
        ingest("C1", "203.0.113.9", 30);
        store.recordMatches("A2", Map.of("wget", "e1"), Map.of("wget", 85));

        // When
        List<Campaign> campaigns = monitoring.campaigns();

        // Then
        assertThat(campaigns).extracting(Campaign::getSourceIp).containsExactly("185.156.73.54", "45.9.148.7");
        Campaign first = campaigns.get(0);
        assertThat(first.getSessionCount()).isEqualTo(3);
        assertThat(first.getMaxRiskScore()).isEqualTo(85);
        assertThat(first.getHighRiskSessions()).isEqualTo(1);
        assertThat(first.getFirstSeen()).isEqualTo(T0);
        assertThat(first.getLastSeen()).isEqualTo(T0.plusSeconds(120));
    }

    @Test
    @DisplayName("Should summarize counters from every stage")
    void shouldReportDiagnostics() {
        // Given
        meterRegistry.counter("hivewatch.ingestion.records", "source", "cowrie").increment(10);
        meterRegistry.counter("hivewatch.ingestion.records", "source", "tty").increment(5);
        meterRegistry.counter("hivewatch.ingestion.malformed", "source", "cowrie").increment(2);
        meterRegistry.counter("hivewatch.normalization.failed", "format", "audit").increment();
        meterRegistry.counter("hivewatch.enrichment.timeouts", "component", "enrichment").increment(4);
        fanout.register(new AlertSink() {
            @Override
            public String name() {
                return "log";
            }

            @Override
            public void deliver(Alert alert) {
            }
        });
        ingest("A1", "185.156.73.54", 0);
        fanout.publish(Alert.builder().sessionId("A1").severity(Severity.LOW).generatedAt(T0).build());

        // When
        DiagnosticsSnapshot diagnostics = monitoring.diagnostics();

        // Then
        assertThat(diagnostics.getTakenAt()).isEqualTo(T0);
        assertThat(diagnostics.getRecordsRead()).isEqualTo(15);
        assertThat(diagnostics.getRecordsMalformed()).isEqualTo(2);
        assertThat(diagnostics.getNormalizationFailures()).isEqualTo(1);
        assertThat(diagnostics.getEnrichmentTimeouts()).isEqualTo(4);
        assertThat(diagnostics.getSessionsTotal()).isEqualTo(1);
        assertThat(diagnostics.getSessionsActive()).isEqualTo(1);
        assertThat(diagnostics.getAlertDrops()).containsEntry("log", 0L);
        assertThat(diagnostics.getRuleSnapshotVersion()).isEqualTo(ruleRegistry.current().getVersion());
        assertThat(diagnostics.getRulesLoaded()).isEqualTo(ruleRegistry.current().size());
        assertThat(monitoring.recentAlerts(5)).hasSize(1);
        assertThat(monitoring.sessions()).hasSize(1);
        assertThat(monitoring.session("A1")).isPresent();
    }
}
