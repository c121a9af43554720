package com.hivewatch.normalization;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.RawRecord;
import com.hivewatch.normalization.parsers.NormalizationException;
import com.hivewatch.normalization.parsers.ParserRegistry;
import com.hivewatch.normalization.parsers.RecordParser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Normalization service that maps raw records from any source to canonical events.
 * A record that cannot be normalized is logged, counted and skipped; the stream continues.
 */
@Service
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

    static final String PARSED = "hivewatch.normalization.parsed";
    static final String FAILED = "hivewatch.normalization.failed";

    private final FormatDetector formatDetector;
    private final ParserRegistry parserRegistry;
    private final MeterRegistry meterRegistry;

    // Metrics
    private final Map<String, Counter> parsedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> failedCounters = new ConcurrentHashMap<>();

    public EventNormalizer(FormatDetector formatDetector, ParserRegistry parserRegistry,
                           MeterRegistry meterRegistry) {
        this.formatDetector = formatDetector;
        this.parserRegistry = parserRegistry;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Normalizes one record, or returns empty when it had to be skipped.
     */
    public Optional<Event> normalize(RawRecord record) {
        String format = formatDetector.detect(record);
        try {
            RecordParser parser = parserRegistry.getParser(format)
                .orElseThrow(() -> new NormalizationException("No parser for format " + format, format,
                    record.asText()));
            Event event = parser.parse(record);
            incrementParsedCounter(format);
            return Optional.of(event);

        } catch (NormalizationException e) {
            log.warn("Skipping record from {} at offset {}: {}", record.getSource(), record.getOffset(),
                e.getMessage());
            log.debug("Skipped record data: {}", e.getRawData());
            incrementFailedCounter(format);
            return Optional.empty();

        } catch (RuntimeException e) {
            log.error("Unexpected error normalizing record from {} at offset {}", record.getSource(),
                record.getOffset(), e);
            incrementFailedCounter(format);
            return Optional.empty();
        }
    }

    private void incrementParsedCounter(String format) {
        parsedCounters.computeIfAbsent(format, f ->
            Counter.builder(PARSED)
                .tag("format", f)
                .description("Number of successfully normalized records by format")
                .register(meterRegistry)
        ).increment();
    }

    private void incrementFailedCounter(String format) {
        failedCounters.computeIfAbsent(format, f ->
            Counter.builder(FAILED)
                .tag("format", f)
                .description("Number of records skipped by normalization by format")
                .register(meterRegistry)
        ).increment();
    }
}
