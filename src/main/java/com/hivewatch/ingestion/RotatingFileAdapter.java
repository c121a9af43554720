package com.hivewatch.ingestion;

import com.hivewatch.domain.RawRecord;
import com.hivewatch.domain.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tails one line-oriented log file (Cowrie JSON or text log) across rotation and truncation.
 *
 * Each poll is driven by the state left behind by the previous one:
 * <ul>
 *   <li>{@code READING} - reading forward from the current offset of an open file. A changed file
 *       key or a vanished path moves to {@code ROTATION_SUSPECTED}; a size below the offset is a
 *       truncation and moves straight to {@code REOPENED}</li>
 *   <li>{@code ROTATION_SUSPECTED} - the old handle has been drained to EOF and released. The
 *       adapter stays here, reporting the source unavailable, until a file reappears at the path</li>
 *   <li>{@code REOPENED} - the replacement (or truncated) file is being read from offset zero;
 *       the next poll that finds no further rotation returns to {@code READING}</li>
 * </ul>
 * Re-reading the new file from its start can re-deliver lines that raced the swap. Those are
 * suppressed by the per-adapter {@link DedupWindow} keyed on (timestamp, line hash), so every
 * line written after the swap is emitted once and nothing written during the race is lost.
 */
public class RotatingFileAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(RotatingFileAdapter.class);

    static final int MAX_LINE_BYTES = 1 << 20;
    private static final int READ_CHUNK = 64 * 1024;

    enum ReadState {
        READING,
        ROTATION_SUSPECTED,
        REOPENED
    }

    private final String name;
    private final Path path;
    private final SourceType sourceType;
    private final Clock clock;
    private final IngestionMetrics metrics;
    private final DedupWindow dedup;
    private final Duration history;

    private FileChannel channel;
    private Object fileKey;
    private long offset;
    private long partialStart;
    private final ByteArrayOutputStream partial = new ByteArrayOutputStream();
    private boolean discardingOversized;
    private boolean firstOpen = true;
    private ReadState state = ReadState.READING;

    public RotatingFileAdapter(Path path, SourceType sourceType, int dedupWindowSize, int historyHours,
                               Clock clock, IngestionMetrics metrics) {
        this.path = Objects.requireNonNull(path, "path");
        this.name = path.getFileName().toString();
        this.sourceType = sourceType;
        this.clock = clock;
        this.metrics = metrics;
        this.dedup = new DedupWindow(dedupWindowSize);
        this.history = historyHours > 0 ? Duration.ofHours(historyHours) : null;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized List<RawRecord> poll() {
        List<RawRecord> records = new ArrayList<>();
        BasicFileAttributes attrs = stat();

        switch (state) {
            case ROTATION_SUSPECTED:
                // Old handle already drained; waiting for the replacement file.
                if (attrs == null) {
                    throw new SourceUnavailableException(name, path, "Log file not found: " + path);
                }
                open(attrs);
                state = ReadState.REOPENED;
                break;
            case READING:
            case REOPENED:
                if (channel == null) {
                    if (attrs == null) {
                        throw new SourceUnavailableException(name, path, "Log file not found: " + path);
                    }
                    open(attrs);
                    state = firstOpen ? ReadState.READING : ReadState.REOPENED;
                } else if (attrs == null || rotated(attrs)) {
                    state = ReadState.ROTATION_SUSPECTED;
                    if (attrs == null) {
                        // Rename rotation: the old handle still sees writes made before the rename.
                        drainAndRelease(records);
                        log.info("Source {} disappeared; drained {} trailing records", name, records.size());
                        return finish(records);
                    }
                    log.info("Rotation detected on {} (offset={}, size={})", name, offset, attrs.size());
                    drainAndRelease(records);
                    open(attrs);
                    state = ReadState.REOPENED;
                } else if (attrs.size() < offset) {
                    // Truncated in place (copytruncate): same file, new content from byte zero.
                    log.info("Truncation detected on {} (offset={}, size={})", name, offset, attrs.size());
                    offset = 0;
                    resetPartial();
                    state = ReadState.REOPENED;
                } else {
                    state = ReadState.READING;
                }
                break;
            default:
                throw new IllegalStateException("Unknown read state " + state);
        }

        readAvailable(records);
        firstOpen = false;
        return finish(records);
    }

    private BasicFileAttributes stat() {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new SourceUnavailableException(name, path, "Cannot stat " + path + ": " + e.getMessage(), e);
        }
    }

    private List<RawRecord> finish(List<RawRecord> records) {
        if (!records.isEmpty()) {
            metrics.recordRead(name, records.size());
        }
        return records;
    }

    @Override
    public synchronized void close() {
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                log.warn("Failed to close {}: {}", name, e.getMessage());
            }
            channel = null;
        }
    }

    ReadState state() {
        return state;
    }

    long offset() {
        return offset;
    }

    private boolean rotated(BasicFileAttributes attrs) {
        Object currentKey = attrs.fileKey();
        return fileKey != null && currentKey != null && !fileKey.equals(currentKey);
    }

    private void open(BasicFileAttributes attrs) {
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ);
        } catch (IOException e) {
            throw new SourceUnavailableException(name, path, "Cannot open " + path + ": " + e.getMessage(), e);
        }
        fileKey = attrs.fileKey();
        offset = 0;
        resetPartial();
        log.info("Opened source {} ({} bytes)", path, attrs.size());
    }

    private void drainAndRelease(List<RawRecord> records) {
        try {
            readAvailable(records);
        } catch (SourceUnavailableException e) {
            log.warn("Could not drain rotated file {}: {}", name, e.getMessage());
        }
        // A trailing fragment without newline in the old file is complete by definition.
        if (partial.size() > 0 && !discardingOversized) {
            emitLine(partial.toByteArray(), partialStart, records);
        }
        resetPartial();
        close();
        fileKey = null;
        offset = 0;
    }

    private void readAvailable(List<RawRecord> records) {
        ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK);
        try {
            while (true) {
                buffer.clear();
                int read = channel.read(buffer, offset);
                if (read <= 0) {
                    break;
                }
                buffer.flip();
                consume(buffer, records);
                offset += read;
            }
        } catch (IOException e) {
            throw new SourceUnavailableException(name, path, "Read failed on " + path + ": " + e.getMessage(), e);
        }
    }

    private void consume(ByteBuffer buffer, List<RawRecord> records) {
        long position = offset;
        while (buffer.hasRemaining()) {
            byte b = buffer.get();
            if (b == '\n') {
                if (discardingOversized) {
                    discardingOversized = false;
                } else {
                    emitLine(partial.toByteArray(), partialStart, records);
                }
                partial.reset();
                partialStart = position + 1;
            } else if (!discardingOversized) {
                if (partial.size() == 0) {
                    partialStart = position;
                }
                partial.write(b);
                if (partial.size() > MAX_LINE_BYTES) {
                    log.warn("Skipping oversized record in {} at offset {}", name, partialStart);
                    metrics.recordMalformed(name);
                    partial.reset();
                    discardingOversized = true;
                }
            }
            position++;
        }
    }

    private void emitLine(byte[] bytes, long lineOffset, List<RawRecord> records) {
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        String line;
        try {
            line = decode(bytes, length);
        } catch (CharacterCodingException e) {
            log.debug("Undecodable record in {} at offset {}", name, lineOffset);
            metrics.recordMalformed(name);
            return;
        }
        if (line.isBlank()) {
            return;
        }

        String timestamp = RecordTimestamps.extract(line);
        if (!dedup.firstSighting(timestamp, line)) {
            metrics.recordDuplicate(name);
            return;
        }
        if (firstOpen && history != null) {
            Instant embedded = RecordTimestamps.parse(timestamp);
            if (embedded != null && embedded.isBefore(clock.instant().minus(history))) {
                return;
            }
        }

        records.add(new RawRecord(name, sourceType, line.getBytes(StandardCharsets.UTF_8),
            clock.instant(), lineOffset, Map.of("path", path.toString())));
    }

    private static String decode(byte[] bytes, int length) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes, 0, length));
        return chars.toString();
    }

    private void resetPartial() {
        partial.reset();
        partialStart = 0;
        discardingOversized = false;
    }
}
