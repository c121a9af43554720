package com.hivewatch.enrichment;

import com.google.common.base.Splitter;
import com.hivewatch.domain.IndicatorType;
import com.hivewatch.domain.ThreatIntelEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads plain indicator lists: one indicator per line, optionally followed by
 * {@code ,confidence,label;label}. Lines starting with '#' or ';' are comments.
 */
public final class ThreatFeedParser {

    private static final Pattern HASH = Pattern.compile("^[0-9a-fA-F]{32}$|^[0-9a-fA-F]{40}$|^[0-9a-fA-F]{64}$");
    private static final Pattern DOMAIN = Pattern.compile("^(?=.{1,253}$)([a-zA-Z0-9-]{1,63}\\.)+[a-zA-Z]{2,63}$");
    private static final Splitter FIELDS = Splitter.on(',').trimResults();
    private static final Splitter LABELS = Splitter.on(';').trimResults().omitEmptyStrings();

    private ThreatFeedParser() {
    }

    public static List<ThreatIntelEntry> parse(String feedName, String body, int defaultConfidence,
                                               Instant expiresAt) {
        List<ThreatIntelEntry> entries = new ArrayList<>();
        for (String rawLine : body.split("\\r?\\n")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            List<String> fields = FIELDS.splitToList(line);
            String indicator = fields.get(0);
            IndicatorType type = typeOf(indicator);
            if (type == null) {
                continue;
            }
            int confidence = defaultConfidence;
            if (fields.size() > 1 && !fields.get(1).isEmpty()) {
                try {
                    confidence = Integer.parseInt(fields.get(1));
                } catch (NumberFormatException e) {
                    continue;
                }
            }
            List<String> labels = fields.size() > 2 ? LABELS.splitToList(fields.get(2)) : List.of();
            entries.add(new ThreatIntelEntry(indicator, type, feedName, confidence, labels, expiresAt));
        }
        return entries;
    }

    static IndicatorType typeOf(String indicator) {
        if (indicator.contains("/")) {
            try {
                CidrBlock.parse(indicator);
                return IndicatorType.CIDR;
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        if (CidrBlock.isAddress(indicator)) {
            return IndicatorType.IP;
        }
        if (HASH.matcher(indicator).matches()) {
            return IndicatorType.HASH;
        }
        if (DOMAIN.matcher(indicator).matches()) {
            return IndicatorType.DOMAIN;
        }
        return null;
    }
}
