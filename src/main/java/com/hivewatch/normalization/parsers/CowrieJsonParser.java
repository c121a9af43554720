package com.hivewatch.normalization.parsers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.RawRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Parser for Cowrie JSON event records, one object per line.
 *
 * Example:
 * <pre>
 * {"eventid":"cowrie.command.input","input":"uname -a","session":"a1b2c3d4",
 *  "src_ip":"1.2.3.4","timestamp":"2024-05-01T10:00:03.000000Z"}
 * </pre>
 */
@Component
public class CowrieJsonParser implements RecordParser {

    public static final String FORMAT = "cowrie:json";

    private static final Map<String, EventKind> KINDS = Map.ofEntries(
        Map.entry("cowrie.session.connect", EventKind.CONNECT),
        Map.entry("cowrie.client.version", EventKind.CONNECT),
        Map.entry("cowrie.client.kex", EventKind.CONNECT),
        Map.entry("cowrie.session.closed", EventKind.DISCONNECT),
        Map.entry("cowrie.login.success", EventKind.LOGIN_SUCCESS),
        Map.entry("cowrie.login.failed", EventKind.LOGIN_FAILED),
        Map.entry("cowrie.command.input", EventKind.COMMAND),
        Map.entry("cowrie.command.success", EventKind.COMMAND),
        Map.entry("cowrie.command.failed", EventKind.COMMAND),
        Map.entry("cowrie.session.file_download", EventKind.FILE_DOWNLOAD),
        Map.entry("cowrie.session.file_upload", EventKind.FILE_UPLOAD),
        Map.entry("cowrie.client.fingerprint", EventKind.KEY_AUTH),
        Map.entry("cowrie.log.open", EventKind.TTY_OPEN),
        Map.entry("cowrie.log.closed", EventKind.TTY_CLOSE)
    );

    private static final Set<String> ENVELOPE = Set.of("eventid", "session", "timestamp", "src_ip", "input");

    private final ObjectMapper objectMapper;

    public CowrieJsonParser() {
        this(new ObjectMapper());
    }

    public CowrieJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Event parse(RawRecord record) {
        String raw = record.asText();
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new NormalizationException("Invalid JSON: " + e.getOriginalMessage(), e, FORMAT, raw);
        }
        if (root == null || !root.isObject()) {
            throw new NormalizationException("Record is not a JSON object", FORMAT, raw);
        }

        String sessionId = text(root, "session");
        if (sessionId == null || sessionId.isBlank()) {
            throw new NormalizationException("Missing session id", FORMAT, raw);
        }

        String eventId = text(root, "eventid");
        EventKind kind = kindFor(eventId);

        Event.Builder builder = Event.builder()
            .timestamp(timestamp(root, record, raw))
            .sessionId(sessionId)
            .sourceIp(text(root, "src_ip"))
            .kind(kind)
            .source(record.getSource());

        if (kind == EventKind.UNCLASSIFIED) {
            builder.put(Event.RAW_KIND, eventId != null ? eventId : "");
        }
        if (kind == EventKind.COMMAND) {
            builder.put(Event.COMMAND, text(root, "input"));
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (ENVELOPE.contains(field.getKey())) {
                continue;
            }
            builder.put(field.getKey(), scalar(field.getValue()));
        }
        if (kind != EventKind.COMMAND && root.hasNonNull("input")) {
            builder.put(Event.COMMAND, text(root, "input"));
        }
        return builder.build();
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    static EventKind kindFor(String eventId) {
        if (eventId == null) {
            return EventKind.UNCLASSIFIED;
        }
        EventKind kind = KINDS.get(eventId);
        if (kind != null) {
            return kind;
        }
        if (eventId.startsWith("cowrie.direct-tcpip.")) {
            return EventKind.TCP_FORWARD;
        }
        return EventKind.UNCLASSIFIED;
    }

    private Instant timestamp(JsonNode root, RawRecord record, String raw) {
        String value = text(root, "timestamp");
        if (value == null) {
            return record.getReceivedAt();
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new NormalizationException("Unparseable timestamp: " + value, e, FORMAT, raw);
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && !node.isNull() ? node.asText() : null;
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isTextual()) {
            return node.asText();
        }
        // Nested structures are kept as their JSON text.
        return node.toString();
    }
}
