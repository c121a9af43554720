package com.hivewatch;

import com.hivewatch.correlation.CorrelationEngine;
import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.RawRecord;
import com.hivewatch.domain.SourceType;
import com.hivewatch.ingestion.TailSubscription;
import com.hivewatch.ingestion.TailingCoordinator;
import com.hivewatch.normalization.EventNormalizer;
import com.hivewatch.session.IngestResult;
import com.hivewatch.session.SessionMetrics;
import com.hivewatch.session.SessionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("HoneypotPipeline Tests")
class HoneypotPipelineTest {

    @Mock
    private TailingCoordinator coordinator;

    @Mock
    private EventNormalizer normalizer;

    @Mock
    private SessionStore sessionStore;

    @Mock
    private CorrelationEngine engine;

    @Mock
    private TailSubscription subscription;

    private HoneypotPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new HoneypotPipeline(coordinator, normalizer, sessionStore, engine);
    }

    private static RawRecord record(String line) {
        return new RawRecord("/var/log/cowrie/cowrie.json", SourceType.JSON_LOG,
            line.getBytes(StandardCharsets.UTF_8), Instant.parse("2024-05-01T10:00:00Z"), 0);
    }

    @Test
    @DisplayName("Should pass normalized events through the session store to correlation")
    void shouldRouteEvents() {
        // Given
        RawRecord record = record("{\"eventid\":\"cowrie.command.input\"}");
        Event event = Event.builder().sessionId("S1").kind(EventKind.COMMAND)
            .timestamp(Instant.parse("2024-05-01T10:00:00Z")).build();
        SessionStore realStore = new SessionStore(Duration.ofMinutes(30), Duration.ofMinutes(5), 0,
            new MutableClock(Instant.parse("2024-05-01T10:00:00Z")), new SessionMetrics(new SimpleMeterRegistry()));
        IngestResult result = realStore.ingest(event);
        when(normalizer.normalize(record)).thenReturn(Optional.of(event));
        when(sessionStore.ingest(event)).thenReturn(result);

        // When
        pipeline.process(record);

        // Then
        verify(engine).submit(result);
    }

    @Test
    @DisplayName("Should skip records that do not normalize and survive failures")
    void shouldSkipAndSurvive() {
        // Given
        RawRecord unparsable = record("garbage");
        RawRecord exploding = record("boom");
        when(normalizer.normalize(unparsable)).thenReturn(Optional.empty());
        when(normalizer.normalize(exploding)).thenThrow(new IllegalStateException("parser bug"));

        // When / Then
        pipeline.process(unparsable);
        assertThatCode(() -> pipeline.process(exploding)).doesNotThrowAnyException();
        verify(sessionStore, never()).ingest(any());
        verify(engine, never()).submit(any());
    }

    @Test
    @DisplayName("Should start once and stop tailing and correlation together")
    @SuppressWarnings("unchecked")
    void shouldManageLifecycle() {
        // Given
        when(coordinator.subscribe(any(Consumer.class))).thenReturn(subscription);

        // When
        pipeline.start();
        pipeline.start();

        // Then
        verify(coordinator, times(1)).subscribe(any(Consumer.class));
        verify(engine, times(1)).start();
        assertThat(pipeline.isRunning()).isTrue();

        // When
        pipeline.stop();

        // Then
        verify(subscription).cancel();
        verify(engine).stop();
        assertThat(pipeline.isRunning()).isFalse();
    }
}
