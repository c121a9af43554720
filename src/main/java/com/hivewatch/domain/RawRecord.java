package com.hivewatch.domain;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Represents one raw, unparsed record as read from a source adapter.
 * This class stores the original bytes along with where and when they were read.
 */
public class RawRecord {

    private final String source;
    private final SourceType sourceType;
    private final byte[] data;
    private final Instant receivedAt;
    private final long offset;
    private final Map<String, Object> metadata;

    /**
     * Constructor for a record without extra metadata
     */
    public RawRecord(String source, SourceType sourceType, byte[] data, Instant receivedAt, long offset) {
        this(source, sourceType, data, receivedAt, offset, Collections.emptyMap());
    }

    /**
     * Full constructor
     */
    public RawRecord(String source, SourceType sourceType, byte[] data, Instant receivedAt, long offset,
                     Map<String, Object> metadata) {
        this.source = source;
        this.sourceType = sourceType;
        this.data = data;
        this.receivedAt = receivedAt;
        this.offset = offset;
        this.metadata = Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    public String getSource() {
        return source;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    public byte[] getData() {
        return data;
    }

    /**
     * Data decoded as UTF-8 text
     */
    public String asText() {
        return new String(data, StandardCharsets.UTF_8);
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    /**
     * Byte offset of the record within its file, or -1 when not file-backed.
     */
    public long getOffset() {
        return offset;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Object getMetadata(String key) {
        return metadata.get(key);
    }

    @Override
    public String toString() {
        return "RawRecord{source=" + source + ", type=" + sourceType + ", offset=" + offset
            + ", bytes=" + data.length + "}";
    }
}
