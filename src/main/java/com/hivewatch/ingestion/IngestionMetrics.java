package com.hivewatch.ingestion;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-source counters for the tailing layer.
 *
 * Tracks:
 * - records read
 * - malformed records skipped
 * - duplicates suppressed by the dedup window
 * - source unavailability and adapter restarts
 */
@Component
public class IngestionMetrics {

    static final String RECORDS = "hivewatch.ingestion.records";
    static final String MALFORMED = "hivewatch.ingestion.malformed";
    static final String DUPLICATES = "hivewatch.ingestion.duplicates";
    static final String UNAVAILABLE = "hivewatch.ingestion.source.unavailable";
    static final String RESTARTS = "hivewatch.ingestion.adapter.restarts";
    static final String QUEUE_DROPS = "hivewatch.ingestion.feed.dropped";

    private final MeterRegistry registry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public IngestionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRead(String source, int count) {
        counter(RECORDS, source, "Records read from a source").increment(count);
    }

    public void recordMalformed(String source) {
        counter(MALFORMED, source, "Malformed records skipped").increment();
    }

    public void recordDuplicate(String source) {
        counter(DUPLICATES, source, "Records suppressed by the dedup window").increment();
    }

    public void recordUnavailable(String source) {
        counter(UNAVAILABLE, source, "Polls that found the source unavailable").increment();
    }

    public void recordRestart(String source) {
        counter(RESTARTS, source, "Adapter restarts after a failure").increment();
    }

    public void recordFeedDrop(String source) {
        counter(QUEUE_DROPS, source, "Records dropped because the merged feed was closed").increment();
    }

    public double count(String name, String source) {
        Counter counter = counters.get(name + "|" + source);
        return counter != null ? counter.count() : 0;
    }

    private Counter counter(String name, String source, String description) {
        return counters.computeIfAbsent(name + "|" + source, key ->
            Counter.builder(name)
                .description(description)
                .tag("source", source)
                .register(registry));
    }
}
