package com.hivewatch.ingestion;

import com.hivewatch.domain.RawRecord;
import com.hivewatch.domain.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Watches a directory of TTY capture files. A new file yields an {@code open} record,
 * growth yields a {@code data} record carrying the appended bytes, and removal yields
 * a {@code close} record. The session id is taken from the capture file name.
 */
public class TtyCaptureAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(TtyCaptureAdapter.class);

    public static final String TTY_EVENT = "tty_event";
    public static final String SESSION = "session";
    public static final String FILE = "file";
    public static final String BYTES = "bytes";

    static final int MAX_DATA_BYTES = 64 * 1024;

    // Cowrie names live captures <timestamp>-<session>-<n><flag>.log
    private static final Pattern SESSION_IN_NAME = Pattern.compile(".*-([0-9a-f]{8,32})-\\d+[a-z]?\\.log$");

    private final Path directory;
    private final Clock clock;
    private final IngestionMetrics metrics;
    private final Map<Path, Long> knownSizes = new HashMap<>();

    public TtyCaptureAdapter(Path directory, Clock clock, IngestionMetrics metrics) {
        this.directory = directory;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return "tty:" + directory.getFileName();
    }

    @Override
    public synchronized List<RawRecord> poll() {
        if (!Files.isDirectory(directory)) {
            throw new SourceUnavailableException(name(), directory, "TTY capture directory not found: " + directory);
        }

        List<RawRecord> records = new ArrayList<>();
        Set<Path> present = new HashSet<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                present.add(file);
                long size = Files.size(file);
                Long known = knownSizes.get(file);
                if (known == null) {
                    records.add(record(file, "open", new byte[0], 0));
                    known = 0L;
                } else if (size < known) {
                    known = 0L;
                }
                if (size > known) {
                    byte[] appended = readRange(file, known, size);
                    records.add(record(file, "data", appended, known));
                }
                knownSizes.put(file, size);
            }
        } catch (IOException e) {
            throw new SourceUnavailableException(name(), directory, "Cannot list " + directory + ": " + e.getMessage(), e);
        }

        knownSizes.keySet().removeIf(file -> {
            if (present.contains(file)) {
                return false;
            }
            records.add(record(file, "close", new byte[0], 0));
            return true;
        });

        if (!records.isEmpty()) {
            metrics.recordRead(name(), records.size());
        }
        return records;
    }

    @Override
    public synchronized void close() {
        // Files are opened per read; nothing is held between polls.
        log.debug("Closed {}", name());
    }

    static String sessionIdFor(Path file) {
        String fileName = file.getFileName().toString();
        Matcher matcher = SESSION_IN_NAME.matcher(fileName);
        if (matcher.matches()) {
            return matcher.group(1);
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private RawRecord record(Path file, String ttyEvent, byte[] data, long offset) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(TTY_EVENT, ttyEvent);
        metadata.put(SESSION, sessionIdFor(file));
        metadata.put(FILE, file.toString());
        metadata.put(BYTES, data.length);
        return new RawRecord(name(), SourceType.TTY_CAPTURE, data, clock.instant(), offset, metadata);
    }

    private byte[] readRange(Path file, long from, long to) throws IOException {
        int length = (int) Math.min(to - from, MAX_DATA_BYTES);
        ByteBuffer buffer = ByteBuffer.allocate(length);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long position = from;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read <= 0) {
                    break;
                }
                position += read;
            }
        }
        byte[] bytes = new byte[buffer.position()];
        buffer.flip();
        buffer.get(bytes);
        return bytes;
    }
}
