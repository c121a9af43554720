package com.hivewatch.ingestion;

import java.nio.file.Path;

/**
 * Thrown when a source path is missing or cannot be read.
 * The tailing coordinator retries the adapter with backoff.
 */
public class SourceUnavailableException extends RuntimeException {

    private final String source;
    private final Path path;

    public SourceUnavailableException(String source, Path path, String message) {
        super(message);
        this.source = source;
        this.path = path;
    }

    public SourceUnavailableException(String source, Path path, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.path = path;
    }

    public String getSource() {
        return source;
    }

    public Path getPath() {
        return path;
    }
}
