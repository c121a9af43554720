package com.hivewatch.enrichment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

@DisplayName("WebClientFeedFetcher Tests")
class WebClientFeedFetcherTest {

    private final WebClientFeedFetcher fetcher = new WebClientFeedFetcher();

    @Test
    @DisplayName("Should read file feeds from disk")
    void shouldReadFileFeed(@TempDir Path dir) throws IOException {
        Path feed = dir.resolve("blocklist.txt");
        Files.writeString(feed, "185.156.73.54\n45.9.148.0/24\n");

        StepVerifier.create(fetcher.fetch(feed.toUri().toString()))
            .expectNext("185.156.73.54\n45.9.148.0/24\n")
            .verifyComplete();
    }

    @Test
    @DisplayName("Should fail a missing file feed")
    void shouldFailMissingFile(@TempDir Path dir) {
        StepVerifier.create(fetcher.fetch(dir.resolve("absent.txt").toUri().toString()))
            .expectError(NoSuchFileException.class)
            .verify();
    }
}
