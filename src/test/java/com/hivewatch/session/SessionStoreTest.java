package com.hivewatch.session;

import com.hivewatch.MutableClock;
import com.hivewatch.domain.CloseReason;
import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.SessionSnapshot;
import com.hivewatch.domain.SessionState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SessionStore Tests")
class SessionStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private MeterRegistry meterRegistry;
    private SessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        meterRegistry = new SimpleMeterRegistry();
        store = new SessionStore(Duration.ofMinutes(30), Duration.ofMinutes(5), 0, clock,
            new SessionMetrics(meterRegistry));
    }

    private static Event event(String sessionId, EventKind kind, Instant timestamp, String command) {
        return Event.builder()
            .sessionId(sessionId)
            .sourceIp("1.2.3.4")
            .kind(kind)
            .timestamp(timestamp)
            .put(Event.COMMAND, command)
            .build();
    }

    @Test
    @DisplayName("Should keep events in ingestion order")
    void shouldPreserveIngestionOrder() {
        // Given: three events for one session
        List<String> commands = List.of("uname -a", "id", "cat /etc/passwd");

        // When: they are ingested one after another
        for (int i = 0; i < commands.size(); i++) {
            store.ingest(event("S1", EventKind.COMMAND, T0.plusSeconds(i), commands.get(i)));
        }

        // Then: the snapshot lists them in the same order
        SessionSnapshot session = store.get("S1").orElseThrow();
        assertThat(session.getEvents()).extracting(Event::getCommand).containsExactlyElementsOf(commands);
        assertThat(session.getFirstSeen()).isEqualTo(T0);
        assertThat(session.getLastSeen()).isEqualTo(T0.plusSeconds(2));
    }

    @Test
    @DisplayName("Should create a session only when an event arrives")
    void shouldCreateSessionOnFirstEvent() {
        assertThat(store.get("S1")).isEmpty();

        IngestResult first = store.ingest(event("S1", EventKind.CONNECT, T0, null));
        IngestResult second = store.ingest(event("S1", EventKind.COMMAND, T0.plusSeconds(1), "w"));

        assertThat(first.isCreated()).isTrue();
        assertThat(second.isCreated()).isFalse();
        assertThat(store.get("S1").orElseThrow().getEvents()).isNotEmpty();
        assertThat(meterRegistry.counter("hivewatch.session.created").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should clamp out-of-order timestamps to last seen")
    void shouldClampOlderTimestamps() {
        store.ingest(event("S1", EventKind.CONNECT, T0.plusSeconds(10), null));

        IngestResult late = store.ingest(event("S1", EventKind.COMMAND, T0, "ls"));

        assertThat(late.getEvent().getTimestamp()).isEqualTo(T0.plusSeconds(10));
        assertThat(store.get("S1").orElseThrow().getLastSeen()).isEqualTo(T0.plusSeconds(10));
    }

    @Test
    @DisplayName("Should close a session on disconnect and keep trailing events")
    void shouldCloseOnDisconnect() {
        store.ingest(event("S1", EventKind.CONNECT, T0, null));

        IngestResult closing = store.ingest(event("S1", EventKind.DISCONNECT, T0.plusSeconds(5), null));
        IngestResult trailing = store.ingest(event("S1", EventKind.TTY_CLOSE, T0.plusSeconds(6), null));

        assertThat(closing.closedSession()).isTrue();
        assertThat(closing.getClosed().getCloseReason()).isEqualTo(CloseReason.DISCONNECT);
        assertThat(trailing.closedSession()).isFalse();
        SessionSnapshot session = store.get("S1").orElseThrow();
        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(session.getEventCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should close idle sessions only past the idle timeout")
    void shouldCloseOnlyPastIdleTimeout() {
        // Given: a session whose last event was at T0
        store.ingest(event("S1", EventKind.CONNECT, T0, null));

        // When: sweeping exactly at the timeout
        List<SessionSnapshot> atTimeout = store.closeIdle(T0.plus(Duration.ofMinutes(30)));

        // Then: still open (needs to exceed the timeout), but idle
        assertThat(atTimeout).isEmpty();
        assertThat(store.get("S1").orElseThrow().getState()).isEqualTo(SessionState.IDLE);

        // When: sweeping one second later
        List<SessionSnapshot> past = store.closeIdle(T0.plus(Duration.ofMinutes(30)).plusSeconds(1));

        // Then: closed with the idle reason
        assertThat(past).extracting(SessionSnapshot::getSessionId).containsExactly("S1");
        assertThat(store.get("S1").orElseThrow().getCloseReason()).isEqualTo(CloseReason.IDLE_TIMEOUT);
    }

    @Test
    @DisplayName("Should not close a session that received an event after the sweep time was computed")
    void shouldNotCloseSessionIngestedAfterSweepTime() {
        // Given: an old session and a sweep instant computed before the next ingest
        store.ingest(event("S1", EventKind.CONNECT, T0, null));
        Instant sweepNow = T0.plus(Duration.ofHours(1));

        // When: an event for the session is ingested after that instant, carrying an old timestamp
        clock.set(sweepNow.plusSeconds(1));
        store.ingest(event("S1", EventKind.COMMAND, T0.plusSeconds(1), "id"));
        List<SessionSnapshot> closed = store.closeIdle(sweepNow);

        // Then: the sweep leaves it open
        assertThat(closed).isEmpty();
        assertThat(store.get("S1").orElseThrow().getState()).isNotEqualTo(SessionState.CLOSED);
    }

    @Test
    @DisplayName("Should reopen a session closed by the idle sweep when more data arrives")
    void shouldReopenIdleClosedSession() {
        store.ingest(event("S1", EventKind.CONNECT, T0, null));
        store.closeIdle(T0.plus(Duration.ofHours(1)));

        store.ingest(event("S1", EventKind.COMMAND, T0.plus(Duration.ofHours(2)), "ls"));

        assertThat(store.get("S1").orElseThrow().getState()).isEqualTo(SessionState.OPEN);
    }

    @Test
    @DisplayName("Should notify listeners of idle closes")
    void shouldNotifyListeners() {
        List<String> notified = new ArrayList<>();
        store.addListener(session -> notified.add(session.getSessionId()));
        store.ingest(event("S1", EventKind.CONNECT, T0, null));
        store.ingest(event("S2", EventKind.CONNECT, T0.plus(Duration.ofMinutes(50)), null));

        store.closeIdle(T0.plus(Duration.ofHours(1)));

        assertThat(notified).containsExactly("S1");
    }

    @Test
    @DisplayName("Should count each rule weight once per session")
    void shouldNotDoubleCountRuleWeights() {
        // Given
        store.ingest(event("S1", EventKind.COMMAND, T0, "wget http://x"));
        String eventId = store.get("S1").orElseThrow().getEvents().get(0).getEventId();

        // When: the same rule is recorded twice
        ScoreUpdate first = store.recordMatches("S1", Map.of("r1", eventId), Map.of("r1", 30));
        ScoreUpdate second = store.recordMatches("S1", Map.of("r1", eventId), Map.of("r1", 30));

        // Then
        assertThat(first.getNewScore()).isEqualTo(30);
        assertThat(first.getNewlyMatched()).containsExactly("r1");
        assertThat(second.raised()).isFalse();
        assertThat(second.getNewlyMatched()).isEmpty();
        SessionSnapshot session = store.get("S1").orElseThrow();
        assertThat(RiskScore.recompute(session)).isEqualTo(session.getRiskScore()).isEqualTo(30);
    }

    @Test
    @DisplayName("Should cap the risk score at 100 and keep it reproducible")
    void shouldCapRiskScore() {
        store.ingest(event("S1", EventKind.COMMAND, T0, "x"));

        store.recordMatches("S1", Map.of("a", "e", "b", "e", "c", "e"), Map.of("a", 50, "b", 40, "c", 30));

        SessionSnapshot session = store.get("S1").orElseThrow();
        assertThat(session.getRiskScore()).isEqualTo(RiskScore.MAX);
        assertThat(RiskScore.recompute(session)).isEqualTo(session.getRiskScore());
        assertThat(session.getMatchedRuleIds()).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    @DisplayName("Should ignore matches for unknown sessions")
    void shouldIgnoreUnknownSession() {
        ScoreUpdate update = store.recordMatches("missing", Map.of("r1", "e"), Map.of("r1", 10));

        assertThat(update.getSession()).isNull();
        assertThat(update.raised()).isFalse();
    }

    @Test
    @DisplayName("Should expose matched rules and score through the event-free view")
    void shouldProvideEvaluationView() {
        // Given
        store.ingest(event("S1", EventKind.COMMAND, T0, "wget http://x"));
        store.ingest(event("S1", EventKind.COMMAND, T0.plusSeconds(1), "id"));
        store.recordMatches("S1", Map.of("r1", "e"), Map.of("r1", 30));

        // When
        SessionView view = store.view("S1").orElseThrow();

        // Then
        assertThat(view.getSessionId()).isEqualTo("S1");
        assertThat(view.getSourceIp()).isEqualTo("1.2.3.4");
        assertThat(view.getRiskScore()).isEqualTo(30);
        assertThat(view.getMatchedRuleIds()).containsExactly("r1");
        assertThat(view.getState()).isEqualTo(SessionState.OPEN);
        assertThat(store.view("missing")).isEmpty();
    }

    @Test
    @DisplayName("Should only snapshot the session when a match raised the score")
    void shouldSnapshotOnlyOnRaise() {
        store.ingest(event("S1", EventKind.COMMAND, T0, "x"));

        ScoreUpdate raised = store.recordMatches("S1", Map.of("r1", "e"), Map.of("r1", 30));
        ScoreUpdate unchanged = store.recordMatches("S1", Map.of("r1", "e"), Map.of("r1", 30));
        ScoreUpdate weightless = store.recordMatches("S1", Map.of("helper", "e"), Map.of("helper", 0));

        assertThat(raised.getSession()).isNotNull();
        assertThat(raised.getSession().getRiskScore()).isEqualTo(30);
        assertThat(unchanged.getSession()).isNull();
        assertThat(weightless.getNewlyMatched()).containsExactly("helper");
        assertThat(weightless.getSession()).isNull();
    }

    @Test
    @DisplayName("Should hand out a close summary once per score level")
    void shouldClaimSummaryOncePerScore() {
        // Given: a scored session, still open
        store.ingest(event("S1", EventKind.COMMAND, T0, "x"));
        store.recordMatches("S1", Map.of("r1", "e"), Map.of("r1", 60));
        assertThat(store.claimSummary("S1", 50)).isEmpty();

        // When: it is closed and claimed twice
        store.ingest(event("S1", EventKind.DISCONNECT, T0.plusSeconds(1), null));
        Optional<SessionSnapshot> first = store.claimSummary("S1", 50);
        Optional<SessionSnapshot> second = store.claimSummary("S1", 50);

        // Then
        assertThat(first).isPresent();
        assertThat(first.get().getRiskScore()).isEqualTo(60);
        assertThat(first.get().getEvents()).hasSize(2);
        assertThat(second).isEmpty();

        // When: a later match raises the score of the closed session
        store.recordMatches("S1", Map.of("r2", "e"), Map.of("r2", 20));

        // Then
        assertThat(store.claimSummary("S1", 50)).get()
            .extracting(SessionSnapshot::getRiskScore).isEqualTo(80);
        assertThat(store.claimSummary("S1", 90)).isEmpty();
        assertThat(store.claimSummary("missing", 0)).isEmpty();
    }

    @Test
    @DisplayName("Should evict closed sessions past retention")
    void shouldEvictPastRetention() {
        SessionStore retaining = new SessionStore(Duration.ofMinutes(30), Duration.ofMinutes(5), 1, clock,
            new SessionMetrics(new SimpleMeterRegistry()));
        retaining.ingest(event("old", EventKind.CONNECT, T0, null));
        retaining.ingest(event("old", EventKind.DISCONNECT, T0.plusSeconds(1), null));
        retaining.ingest(event("open", EventKind.CONNECT, T0, null));

        int evicted = retaining.evictExpired(T0.plus(Duration.ofDays(2)));

        assertThat(evicted).isEqualTo(1);
        assertThat(retaining.get("old")).isEmpty();
        assertThat(retaining.get("open")).isPresent();
    }

    @Test
    @DisplayName("Should serialize concurrent ingests per session without losing events")
    void shouldSerializeConcurrentIngests() throws Exception {
        // Given: four writers, each owning two sessions
        ExecutorService pool = Executors.newFixedThreadPool(4);
        int perSession = 200;

        // When
        for (int w = 0; w < 4; w++) {
            int writer = w;
            pool.execute(() -> {
                for (int i = 0; i < perSession; i++) {
                    store.ingest(event("S" + (writer * 2), EventKind.COMMAND, T0.plusMillis(i), "c" + i));
                    store.ingest(event("S" + (writer * 2 + 1), EventKind.COMMAND, T0.plusMillis(i), "c" + i));
                }
            });
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // Then: every session has all its events, in order
        List<SessionSnapshot> all = store.snapshotAll();
        assertThat(all).hasSize(8);
        for (SessionSnapshot session : all) {
            List<String> commands = session.getEvents().stream().map(Event::getCommand).collect(Collectors.toList());
            assertThat(commands).hasSize(perSession);
            assertThat(commands.get(0)).isEqualTo("c0");
            assertThat(commands.get(perSession - 1)).isEqualTo("c" + (perSession - 1));
        }
    }
}
