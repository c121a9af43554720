package com.hivewatch.normalization;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.RawRecord;
import com.hivewatch.domain.SourceType;
import com.hivewatch.ingestion.DownloadDirectoryAdapter;
import com.hivewatch.ingestion.TtyCaptureAdapter;
import com.hivewatch.normalization.parsers.AuditLineParser;
import com.hivewatch.normalization.parsers.CowrieJsonParser;
import com.hivewatch.normalization.parsers.DownloadRecordParser;
import com.hivewatch.normalization.parsers.ParserRegistry;
import com.hivewatch.normalization.parsers.TtyRecordParser;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EventNormalizer Tests")
class EventNormalizerTest {

    private static final Instant RECEIVED = Instant.parse("2024-05-01T12:00:00Z");

    private MeterRegistry meterRegistry;
    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ParserRegistry registry = new ParserRegistry(List.of(new CowrieJsonParser(), new AuditLineParser(),
            new TtyRecordParser(), new DownloadRecordParser()));
        normalizer = new EventNormalizer(new FormatDetector(), registry, meterRegistry);
    }

    private static RawRecord text(SourceType type, String line) {
        return new RawRecord("src", type, line.getBytes(StandardCharsets.UTF_8), RECEIVED, 0);
    }

    @Test
    @DisplayName("Should route JSON and text lines to their parsers")
    void shouldDetectLineFormats() {
        Optional<Event> json = normalizer.normalize(text(SourceType.JSON_LOG,
            "{\"eventid\":\"cowrie.session.connect\",\"session\":\"s1\",\"src_ip\":\"1.2.3.4\"}"));
        Optional<Event> audit = normalizer.normalize(text(SourceType.TEXT_LOG,
            "2024-05-01T10:00:00Z [HoneyPotSSHTransport,3,1.2.3.4] CMD: id"));

        assertThat(json).map(Event::getKind).contains(EventKind.CONNECT);
        assertThat(audit).map(Event::getCommand).contains("id");
        assertThat(meterRegistry.counter(EventNormalizer.PARSED, "format", CowrieJsonParser.FORMAT).count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should normalize TTY capture records into the capture's session")
    void shouldNormalizeTtyRecords() {
        RawRecord record = new RawRecord("tty:tty", SourceType.TTY_CAPTURE, "ls\n".getBytes(StandardCharsets.UTF_8),
            RECEIVED, 0, Map.of(TtyCaptureAdapter.TTY_EVENT, "data", TtyCaptureAdapter.SESSION, "abcdef0123",
                TtyCaptureAdapter.FILE, "/tty/x.log", TtyCaptureAdapter.BYTES, 3));

        Event event = normalizer.normalize(record).orElseThrow();

        assertThat(event.getKind()).isEqualTo(EventKind.TTY_DATA);
        assertThat(event.getSessionId()).isEqualTo("abcdef0123");
        assertThat(event.getString(Event.TTYLOG)).isEqualTo("/tty/x.log");
    }

    @Test
    @DisplayName("Should group downloads under a digest-derived session")
    void shouldNormalizeDownloads() {
        String digest = "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08";
        RawRecord record = new RawRecord("downloads:dl", SourceType.DOWNLOAD_DIR,
            "bot.sh".getBytes(StandardCharsets.UTF_8), RECEIVED, 0,
            Map.of(DownloadDirectoryAdapter.SHA256, digest, DownloadDirectoryAdapter.SIZE, 4L,
                DownloadDirectoryAdapter.FILE, "/dl/bot.sh"));

        Event event = normalizer.normalize(record).orElseThrow();

        assertThat(event.getKind()).isEqualTo(EventKind.FILE_DOWNLOAD);
        assertThat(event.getSessionId()).isEqualTo(DownloadRecordParser.SESSION_PREFIX + "9f86d081884c");
        assertThat(event.getString(Event.SHASUM)).isEqualTo(digest);
        assertThat(event.getString(Event.FILENAME)).isEqualTo("bot.sh");
    }

    @Test
    @DisplayName("Should skip and count malformed records without throwing")
    void shouldSkipMalformedRecords() {
        Optional<Event> broken = normalizer.normalize(text(SourceType.JSON_LOG, "{\"eventid\":"));
        Optional<Event> unknown = normalizer.normalize(text(SourceType.TEXT_LOG, "### not a log line"));

        assertThat(broken).isEmpty();
        assertThat(unknown).isEmpty();
        double failed = meterRegistry.find(EventNormalizer.FAILED).counters().stream()
            .mapToDouble(c -> c.count()).sum();
        assertThat(failed).isEqualTo(2.0);
    }
}
