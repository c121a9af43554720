package com.hivewatch.normalization.parsers;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for record parsers keyed by format.
 * Every {@link RecordParser} bean registers itself on construction.
 */
@Component
public class ParserRegistry {

    private final Map<String, RecordParser> parsers = new ConcurrentHashMap<>();

    public ParserRegistry(List<RecordParser> parsers) {
        parsers.forEach(this::registerParser);
    }

    /**
     * Gets the parser for the given format, if one is registered.
     */
    public Optional<RecordParser> getParser(String format) {
        return Optional.ofNullable(parsers.get(format));
    }

    public void registerParser(RecordParser parser) {
        parsers.put(parser.getFormat(), parser);
    }
}
