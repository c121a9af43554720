package com.hivewatch.enrichment;

import com.hivewatch.domain.IndicatorType;
import com.hivewatch.domain.ReputationVerdict;
import com.hivewatch.domain.ThreatIntelEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory reputation index. Each refresh builds a new immutable snapshot and swaps it in
 * with one reference write, so lookups always see one complete snapshot.
 */
@Component
public class ReputationIndex {

    private static final Logger log = LoggerFactory.getLogger(ReputationIndex.class);

    private final AtomicReference<Snapshot> current = new AtomicReference<>();
    private final Clock clock;

    public ReputationIndex(Clock clock) {
        this.clock = clock;
    }

    /**
     * Replaces the whole index with the given entries.
     */
    public void replace(Collection<ThreatIntelEntry> entries) {
        Snapshot snapshot = new Snapshot(entries, clock.instant());
        current.set(snapshot);
        log.info("Reputation index replaced: {} exact indicators, {} networks",
            snapshot.exact.size(), snapshot.networks.size());
    }

    /**
     * @throws EnrichmentUnavailableException if no snapshot has been loaded yet
     */
    public ReputationVerdict lookup(String indicator) {
        Snapshot snapshot = current.get();
        if (snapshot == null) {
            throw new EnrichmentUnavailableException("No reputation snapshot loaded", indicator);
        }
        if (indicator == null || indicator.isBlank()) {
            return ReputationVerdict.notListed(indicator);
        }
        Instant now = clock.instant();
        List<ThreatIntelEntry> hits = new ArrayList<>();
        for (ThreatIntelEntry entry : snapshot.exact.getOrDefault(normalize(indicator), List.of())) {
            if (!entry.isExpired(now)) {
                hits.add(entry);
            }
        }
        if (CidrBlock.isAddress(indicator)) {
            for (Network network : snapshot.networks) {
                if (!network.entry.isExpired(now) && network.block.contains(indicator.trim())) {
                    hits.add(network.entry);
                }
            }
        }
        if (hits.isEmpty()) {
            return ReputationVerdict.notListed(indicator);
        }

        int confidence = 0;
        Set<String> feeds = new LinkedHashSet<>();
        Set<String> labels = new LinkedHashSet<>();
        for (ThreatIntelEntry hit : hits) {
            confidence = Math.max(confidence, hit.getConfidence());
            if (hit.getSourceFeed() != null) {
                feeds.add(hit.getSourceFeed());
            }
            labels.addAll(hit.getLabels());
        }
        return new ReputationVerdict(indicator, ReputationVerdict.Status.LISTED, confidence,
            new ArrayList<>(feeds), new ArrayList<>(labels));
    }

    public boolean isLoaded() {
        return current.get() != null;
    }

    public Instant loadedAt() {
        Snapshot snapshot = current.get();
        return snapshot != null ? snapshot.loadedAt : null;
    }

    public int size() {
        Snapshot snapshot = current.get();
        return snapshot != null ? snapshot.size : 0;
    }

    private static String normalize(String indicator) {
        return indicator.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Snapshot {
        private final Map<String, List<ThreatIntelEntry>> exact = new HashMap<>();
        private final List<Network> networks = new ArrayList<>();
        private final Instant loadedAt;
        private final int size;

        private Snapshot(Collection<ThreatIntelEntry> entries, Instant loadedAt) {
            this.loadedAt = loadedAt;
            int count = 0;
            for (ThreatIntelEntry entry : entries) {
                if (entry.getType() == IndicatorType.CIDR) {
                    try {
                        networks.add(new Network(CidrBlock.parse(entry.getIndicator()), entry));
                    } catch (IllegalArgumentException e) {
                        log.debug("Ignoring malformed network {}", entry.getIndicator());
                        continue;
                    }
                } else {
                    exact.computeIfAbsent(normalize(entry.getIndicator()), k -> new ArrayList<>()).add(entry);
                }
                count++;
            }
            this.size = count;
        }
    }

    private static final class Network {
        private final CidrBlock block;
        private final ThreatIntelEntry entry;

        private Network(CidrBlock block, ThreatIntelEntry entry) {
            this.block = block;
            this.entry = entry;
        }
    }
}
