package com.hivewatch.normalization.parsers;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.RawRecord;
import com.hivewatch.domain.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuditLineParser Tests")
class AuditLineParserTest {

    private final AuditLineParser parser = new AuditLineParser();

    private static RawRecord line(String text) {
        return new RawRecord("cowrie.log", SourceType.TEXT_LOG, text.getBytes(StandardCharsets.UTF_8),
            Instant.parse("2024-05-01T12:00:00Z"), 0);
    }

    @Test
    @DisplayName("Should parse a command line and group it by address and transport")
    void shouldParseCommand() {
        Event event = parser.parse(line(
            "2024-05-01T10:00:00.000000Z [HoneyPotSSHTransport,12,1.2.3.4] CMD: uname -a"));

        assertThat(event.getKind()).isEqualTo(EventKind.COMMAND);
        assertThat(event.getCommand()).isEqualTo("uname -a");
        assertThat(event.getSourceIp()).isEqualTo("1.2.3.4");
        assertThat(event.getSessionId()).isEqualTo("1.2.3.4-12");
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Should parse successful and failed login attempts")
    void shouldParseLogins() {
        Event ok = parser.parse(line(
            "2024-05-01T10:00:01Z [HoneyPotSSHTransport,12,1.2.3.4] login attempt [b'root'/b'123456'] succeeded"));
        Event failed = parser.parse(line(
            "2024-05-01T10:00:01Z [HoneyPotSSHTransport,12,1.2.3.4] login attempt [admin/admin] failed"));

        assertThat(ok.getKind()).isEqualTo(EventKind.LOGIN_SUCCESS);
        assertThat(ok.getString(Event.USERNAME)).isEqualTo("root");
        assertThat(ok.getString(Event.PASSWORD)).isEqualTo("123456");
        assertThat(failed.getKind()).isEqualTo(EventKind.LOGIN_FAILED);
        assertThat(failed.getString(Event.USERNAME)).isEqualTo("admin");
    }

    @Test
    @DisplayName("Should take the session id from a new connection line")
    void shouldParseNewConnection() {
        Event event = parser.parse(line("2024-05-01T10:00:00Z [cowrie.ssh.factory.CowrieSSHFactory] "
            + "New connection: 1.2.3.4:50022 (10.0.0.5:2222) [session: 0a1b2c3d4e5f]"));

        assertThat(event.getKind()).isEqualTo(EventKind.CONNECT);
        assertThat(event.getSessionId()).isEqualTo("0a1b2c3d4e5f");
        assertThat(event.getSourceIp()).isEqualTo("1.2.3.4");
        assertThat(event.getLong(Event.DST_PORT)).isEqualTo(2222L);
    }

    @Test
    @DisplayName("Should map connection lost to a disconnect")
    void shouldParseDisconnect() {
        Event event = parser.parse(line(
            "2024-05-01T10:05:00Z [HoneyPotSSHTransport,12,1.2.3.4] Connection lost after 300 seconds"));

        assertThat(event.getKind()).isEqualTo(EventKind.DISCONNECT);
    }

    @Test
    @DisplayName("Should keep unrecognized messages as unclassified")
    void shouldKeepUnknownMessages() {
        Event event = parser.parse(line(
            "2024-05-01T10:00:02Z [HoneyPotSSHTransport,12,1.2.3.4] kex alg=b'curve25519-sha256'"));

        assertThat(event.getKind()).isEqualTo(EventKind.UNCLASSIFIED);
        assertThat(event.getString(Event.MESSAGE)).startsWith("kex alg");
    }

    @Test
    @DisplayName("Should reject lines without session context or timestamp")
    void shouldRejectUnattributableLines() {
        assertThatThrownBy(() -> parser.parse(line("2024-05-01T10:00:00Z [-] Ready to accept SSH connections")))
            .isInstanceOf(NormalizationException.class);
        assertThatThrownBy(() -> parser.parse(line("yesterday [HoneyPotSSHTransport,1,1.2.3.4] CMD: ls")))
            .isInstanceOf(NormalizationException.class);
        assertThatThrownBy(() -> parser.parse(line("garbage")))
            .isInstanceOf(NormalizationException.class);
    }
}
