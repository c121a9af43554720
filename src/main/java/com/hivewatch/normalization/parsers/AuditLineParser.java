package com.hivewatch.normalization.parsers;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.RawRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for Cowrie plain-text audit lines.
 *
 * Format: {@code <timestamp> [<context>] <message>} where the context of a session line is
 * {@code <Transport>,<transport-number>,<ip>}. Text logs do not repeat the session id on every
 * line, so lines are grouped by {@code <ip>-<transport-number>} unless the line names its session.
 */
@Component
public class AuditLineParser implements RecordParser {

    public static final String FORMAT = "cowrie:text";

    private static final Pattern LINE = Pattern.compile("^(\\S+)\\s+\\[([^\\]]*)\\]\\s+(.*)$");
    private static final Pattern COMMAND = Pattern.compile("^CMD:\\s*(.*)$");
    private static final Pattern LOGIN = Pattern.compile(
        "^login attempt \\[(?:b')?([^/']*)'?/(?:b')?(.*?)'?\\] (succeeded|failed)$");
    private static final Pattern CONNECTION = Pattern.compile(
        "^New connection: (\\S+):(\\d+) \\((\\S+):(\\d+)\\) \\[session: (\\w+)\\]$");
    private static final Pattern VERSION = Pattern.compile("^Remote SSH version: (?:b')?(.*?)'?$");
    private static final Pattern LOST = Pattern.compile("^Connection lost.*$");
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    @Override
    public Event parse(RawRecord record) {
        String raw = record.asText().trim();
        Matcher line = LINE.matcher(raw);
        if (!line.matches()) {
            throw new NormalizationException("Not an audit line", FORMAT, raw);
        }

        Instant timestamp;
        try {
            timestamp = Instant.parse(line.group(1));
        } catch (DateTimeParseException e) {
            throw new NormalizationException("Unparseable timestamp: " + line.group(1), e, FORMAT, raw);
        }

        String[] context = line.group(2).split(",");
        String ip = context.length == 3 && IPV4.matcher(context[2].trim()).matches() ? context[2].trim() : null;
        String sessionId = ip != null ? ip + "-" + context[1].trim() : null;
        String message = line.group(3);

        Event.Builder builder = Event.builder()
            .timestamp(timestamp)
            .sourceIp(ip)
            .source(record.getSource());

        Matcher m;
        if ((m = CONNECTION.matcher(message)).matches()) {
            builder.kind(EventKind.CONNECT)
                .sourceIp(m.group(1))
                .put(Event.SRC_PORT, Long.parseLong(m.group(2)))
                .put(Event.DST_IP, m.group(3))
                .put(Event.DST_PORT, Long.parseLong(m.group(4)));
            sessionId = m.group(5);
        } else if ((m = COMMAND.matcher(message)).matches()) {
            builder.kind(EventKind.COMMAND).put(Event.COMMAND, m.group(1));
        } else if ((m = LOGIN.matcher(message)).matches()) {
            builder.kind("succeeded".equals(m.group(3)) ? EventKind.LOGIN_SUCCESS : EventKind.LOGIN_FAILED)
                .put(Event.USERNAME, m.group(1))
                .put(Event.PASSWORD, m.group(2));
        } else if ((m = VERSION.matcher(message)).matches()) {
            builder.kind(EventKind.CONNECT).put(Event.VERSION, m.group(1));
        } else if (LOST.matcher(message).matches()) {
            builder.kind(EventKind.DISCONNECT);
        } else {
            builder.kind(EventKind.UNCLASSIFIED)
                .put(Event.RAW_KIND, "text")
                .put(Event.MESSAGE, message);
        }

        if (sessionId == null) {
            throw new NormalizationException("Line carries no session context", FORMAT, raw);
        }
        return builder.sessionId(sessionId).build();
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }
}
