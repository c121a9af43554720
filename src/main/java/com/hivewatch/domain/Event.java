package com.hivewatch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One normalized honeypot occurrence.
 *
 * Events are created by the normalizer and never mutated afterwards. Kind-specific
 * fields (command text, credentials, file hash and size, protocol, ...) live in the
 * payload map under the keys defined as constants on this class.
 */
public final class Event {

    public static final String COMMAND = "command";
    public static final String USERNAME = "username";
    public static final String PASSWORD = "password";
    public static final String SRC_PORT = "src_port";
    public static final String DST_IP = "dst_ip";
    public static final String DST_PORT = "dst_port";
    public static final String PROTOCOL = "protocol";
    public static final String FILENAME = "filename";
    public static final String OUTFILE = "outfile";
    public static final String SHASUM = "shasum";
    public static final String URL = "url";
    public static final String SIZE = "size";
    public static final String VERSION = "version";
    public static final String FINGERPRINT = "fingerprint";
    public static final String TTYLOG = "ttylog";
    public static final String RAW_KIND = "raw_kind";
    public static final String MESSAGE = "message";

    @JsonProperty("event_id")
    private final String eventId;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("session_id")
    private final String sessionId;

    @JsonProperty("source_ip")
    private final String sourceIp;

    @JsonProperty("event_kind")
    private final EventKind kind;

    @JsonProperty("source")
    private final String source;

    @JsonProperty("payload")
    private final Map<String, Object> payload;

    private Event(Builder builder) {
        this.eventId = builder.eventId != null ? builder.eventId : UUID.randomUUID().toString();
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp");
        this.sessionId = Objects.requireNonNull(builder.sessionId, "sessionId");
        this.sourceIp = builder.sourceIp;
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.source = builder.source;
        this.payload = ImmutableMap.copyOf(builder.payload);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getEventId() {
        return eventId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public EventKind getKind() {
        return kind;
    }

    public String getSource() {
        return source;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    /**
     * Payload value rendered as text, or null when absent.
     */
    public String getString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Payload value as a number, or null when absent or not numeric.
     */
    public Long getLong(String key) {
        Object value = payload.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public String getCommand() {
        return getString(COMMAND);
    }

    /**
     * Copy of this event carrying a different timestamp. Used when the session store
     * clamps an out-of-order record to the session's last seen instant.
     */
    public Event withTimestamp(Instant adjusted) {
        return toBuilder().timestamp(adjusted).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .eventId(eventId)
            .timestamp(timestamp)
            .sessionId(sessionId)
            .sourceIp(sourceIp)
            .kind(kind)
            .source(source)
            .payload(payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        return eventId.equals(((Event) o).eventId);
    }

    @Override
    public int hashCode() {
        return eventId.hashCode();
    }

    @Override
    public String toString() {
        return "Event{" + kind.getValue() + " session=" + sessionId + " ip=" + sourceIp
            + " at=" + timestamp + " payload=" + payload + "}";
    }

    /**
     * Builder for {@link Event}. Null payload values are ignored.
     */
    public static final class Builder {
        private String eventId;
        private Instant timestamp;
        private String sessionId;
        private String sourceIp;
        private EventKind kind;
        private String source;
        private final Map<String, Object> payload = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder sourceIp(String sourceIp) {
            this.sourceIp = sourceIp;
            return this;
        }

        public Builder kind(EventKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder put(String key, Object value) {
            if (key != null && value != null) {
                payload.put(key, value);
            }
            return this;
        }

        public Builder payload(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::put);
            }
            return this;
        }

        public Event build() {
            return new Event(this);
        }
    }
}
