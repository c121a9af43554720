package com.hivewatch.alerting;

import com.hivewatch.domain.Alert;
import com.hivewatch.domain.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@DisplayName("AlertFanout Tests")
class AlertFanoutTest {

    private SimpleMeterRegistry meterRegistry;
    private AlertFanout fanout;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        fanout = new AlertFanout(2, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        fanout.shutdown();
    }

    private static Alert alert(int n) {
        return Alert.builder()
            .sessionId("S" + n)
            .sourceIp("1.2.3.4")
            .ruleIds(List.of("on-command:wget"))
            .severity(Severity.MEDIUM)
            .riskScore(60)
            .generatedAt(Instant.parse("2024-05-01T10:00:00Z").plusSeconds(n))
            .build();
    }

    private static final class CollectingSink implements AlertSink {
        private final String name;
        private final List<Alert> received = new CopyOnWriteArrayList<>();

        CollectingSink(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void deliver(Alert alert) {
            received.add(alert);
        }
    }

    private static final class BlockingSink implements AlertSink {
        private final CountDownLatch gate = new CountDownLatch(1);
        private final List<Alert> received = new CopyOnWriteArrayList<>();

        @Override
        public String name() {
            return "siem";
        }

        @Override
        public void deliver(Alert alert) {
            try {
                gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            received.add(alert);
        }
    }

    @Test
    @DisplayName("Should drop the oldest alerts of a stalled consumer without affecting the others")
    void shouldIsolateSlowConsumer() {
        // Given
        CollectingSink dashboard = new CollectingSink("dashboard");
        BlockingSink siem = new BlockingSink();
        fanout.register(dashboard);
        fanout.register(siem);

        // When: six alerts are published while the SIEM is stuck on the first
        for (int i = 1; i <= 6; i++) {
            fanout.publish(alert(i));
            int expected = i;
            await().atMost(Duration.ofSeconds(5)).until(() -> dashboard.received.size() == expected);
            if (i == 1) {
                await().atMost(Duration.ofSeconds(5)).until(() -> fanout.queueDepth("siem") == 0);
            }
        }

        // Then
        assertThat(dashboard.received).extracting(Alert::getSessionId)
            .containsExactly("S1", "S2", "S3", "S4", "S5", "S6");
        assertThat(fanout.droppedCount("siem")).isEqualTo(3);
        assertThat(fanout.droppedCount("dashboard")).isZero();
        assertThat(fanout.queueDepth("siem")).isEqualTo(2);

        // When: the SIEM recovers
        siem.gate.countDown();

        // Then: it sees the first alert and the two newest
        await().atMost(Duration.ofSeconds(5)).until(() -> siem.received.size() == 3);
        assertThat(siem.received).extracting(Alert::getSessionId).containsExactly("S1", "S5", "S6");
        assertThat(fanout.totalDropped()).isEqualTo(3);
        assertThat(meterRegistry.get(AlertFanout.DROPPED).tag("consumer", "siem").counter().count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should count delivery failures and keep delivering")
    void shouldSurviveFailingConsumer() {
        // Given
        AlertSink flaky = new AlertSink() {
            private int calls;

            @Override
            public String name() {
                return "flaky";
            }

            @Override
            public void deliver(Alert alert) {
                if (calls++ == 0) {
                    throw new IllegalStateException("endpoint down");
                }
            }
        };
        fanout.register(flaky);

        // When
        fanout.publish(alert(1));
        fanout.publish(alert(2));

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> fanout.deliveredCount("flaky") == 1);
        assertThat(fanout.failedCount("flaky")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stream live alerts to subscribers")
    void shouldStreamLiveAlerts() {
        Alert first = alert(1);
        Alert second = alert(2);

        StepVerifier.create(fanout.alerts())
            .then(() -> fanout.publish(first))
            .expectNext(first)
            .then(() -> fanout.publish(second))
            .expectNext(second)
            .thenCancel()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should keep a bounded log of recent alerts, newest last")
    void shouldKeepRecentAlerts() {
        for (int i = 1; i <= 4; i++) {
            fanout.publish(alert(i));
        }

        assertThat(fanout.recentAlerts(2)).extracting(Alert::getSessionId).containsExactly("S3", "S4");
        assertThat(fanout.recentAlerts(10)).hasSize(4);
        assertThat(fanout.alertLogSize()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should manage consumer registration by name")
    void shouldManageRegistration() {
        fanout.register(new CollectingSink("dashboard"));

        assertThatThrownBy(() -> fanout.register(new CollectingSink("dashboard")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(fanout.consumers()).containsExactly("dashboard");
        assertThat(fanout.unregister("dashboard")).isTrue();
        assertThat(fanout.unregister("dashboard")).isFalse();
        assertThat(fanout.consumers()).isEmpty();
        assertThatThrownBy(() -> new AlertFanout(0, meterRegistry)).isInstanceOf(IllegalArgumentException.class);
    }
}
