package com.hivewatch.ingestion;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.hivewatch.domain.RawRecord;
import com.hivewatch.domain.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Announces files captured into the honeypot download directory. A file is reported
 * once, after its size has been stable across two polls, with its SHA-256 digest.
 */
public class DownloadDirectoryAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(DownloadDirectoryAdapter.class);

    public static final String FILE = "file";
    public static final String SIZE = "size";
    public static final String SHA256 = "sha256";

    private final Path directory;
    private final Clock clock;
    private final IngestionMetrics metrics;
    private final Map<Path, Long> pendingSizes = new HashMap<>();
    private final Set<Path> announced = new HashSet<>();

    public DownloadDirectoryAdapter(Path directory, Clock clock, IngestionMetrics metrics) {
        this.directory = directory;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return "downloads:" + directory.getFileName();
    }

    @Override
    public synchronized List<RawRecord> poll() {
        if (!Files.isDirectory(directory)) {
            throw new SourceUnavailableException(name(), directory, "Download directory not found: " + directory);
        }

        List<RawRecord> records = new ArrayList<>();
        Set<Path> present = new HashSet<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                if (!Files.isRegularFile(file) || file.getFileName().toString().startsWith(".")) {
                    continue;
                }
                present.add(file);
                if (announced.contains(file)) {
                    continue;
                }
                long size = Files.size(file);
                Long previous = pendingSizes.put(file, size);
                if (previous != null && previous == size) {
                    records.add(announce(file, size));
                    pendingSizes.remove(file);
                    announced.add(file);
                }
            }
        } catch (IOException e) {
            throw new SourceUnavailableException(name(), directory, "Cannot list " + directory + ": " + e.getMessage(), e);
        }
        announced.retainAll(present);
        pendingSizes.keySet().retainAll(present);

        if (!records.isEmpty()) {
            metrics.recordRead(name(), records.size());
        }
        return records;
    }

    @Override
    public synchronized void close() {
        log.debug("Closed {}", name());
    }

    private RawRecord announce(Path file, long size) throws IOException {
        HashCode digest = com.google.common.io.Files.asByteSource(file.toFile()).hash(Hashing.sha256());
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(FILE, file.toString());
        metadata.put(SIZE, size);
        metadata.put(SHA256, digest.toString());
        log.info("Captured download {} ({} bytes, sha256={})", file.getFileName(), size, digest);
        return new RawRecord(name(), SourceType.DOWNLOAD_DIR,
            file.getFileName().toString().getBytes(StandardCharsets.UTF_8), clock.instant(), 0, metadata);
    }
}
