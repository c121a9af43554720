package com.hivewatch.enrichment;

import com.hivewatch.config.HiveWatchProperties;
import com.hivewatch.domain.ThreatIntelEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Background bulk refresh of the reputation index.
 *
 * Each feed is fetched independently. A feed that fails keeps contributing the entries from
 * its last successful fetch; the failure is logged and counted, never raised as an alert.
 * Entries expire two refresh intervals after they were fetched.
 */
@Component
public class ThreatFeedRefresher {

    private static final Logger log = LoggerFactory.getLogger(ThreatFeedRefresher.class);

    private final List<String> feeds;
    private final FeedFetcher fetcher;
    private final ReputationIndex index;
    private final EnrichmentMetrics metrics;
    private final Clock clock;
    private final Duration fetchTimeout;
    private final Duration entryTtl;
    private final int defaultConfidence;

    private final Map<String, List<ThreatIntelEntry>> lastGood = new LinkedHashMap<>();

    @Autowired
    public ThreatFeedRefresher(HiveWatchProperties properties, FeedFetcher fetcher, ReputationIndex index,
                               EnrichmentMetrics metrics, Clock clock) {
        this(properties.getThreatIntel().getFeeds(), fetcher, index, metrics, clock,
            properties.getThreatIntel().getFetchTimeout(),
            properties.getThreatIntel().getRefreshInterval().multipliedBy(2),
            properties.getThreatIntel().getDefaultConfidence());
    }

    public ThreatFeedRefresher(List<String> feeds, FeedFetcher fetcher, ReputationIndex index,
                               EnrichmentMetrics metrics, Clock clock, Duration fetchTimeout,
                               Duration entryTtl, int defaultConfidence) {
        this.feeds = List.copyOf(feeds);
        this.fetcher = fetcher;
        this.index = index;
        this.metrics = metrics;
        this.clock = clock;
        this.fetchTimeout = fetchTimeout;
        this.entryTtl = entryTtl;
        this.defaultConfidence = defaultConfidence;
    }

    @Scheduled(fixedDelayString = "${hivewatch.threat-intel.refresh-interval:PT24H}")
    public void scheduledRefresh() {
        try {
            refresh();
        } catch (RuntimeException e) {
            log.error("Threat feed refresh failed unexpectedly", e);
        }
    }

    /**
     * Fetches every feed and swaps a new snapshot into the index.
     *
     * @return number of feeds that failed this cycle
     */
    public synchronized int refresh() {
        if (feeds.isEmpty()) {
            return 0;
        }
        int failures = 0;
        Instant now = clock.instant();
        for (String feed : feeds) {
            try {
                String body = fetcher.fetch(feed).block(fetchTimeout);
                if (body == null) {
                    throw new IllegalStateException("empty response");
                }
                List<ThreatIntelEntry> entries = ThreatFeedParser.parse(feed, body, defaultConfidence,
                    now.plus(entryTtl));
                lastGood.put(feed, entries);
                metrics.recordFeedRefreshSuccess();
                log.info("Threat feed {} refreshed: {} indicators", feed, entries.size());
            } catch (RuntimeException e) {
                failures++;
                metrics.recordFeedRefreshFailure();
                List<ThreatIntelEntry> kept = lastGood.get(feed);
                log.warn("Threat feed {} refresh failed, keeping {} indicators from last good fetch: {}",
                    feed, kept != null ? kept.size() : 0, e.getMessage());
            }
        }

        if (lastGood.isEmpty()) {
            log.warn("No threat feed has loaded successfully yet; reputation lookups stay Unknown");
            return failures;
        }
        List<ThreatIntelEntry> merged = new ArrayList<>();
        lastGood.values().forEach(merged::addAll);
        index.replace(merged);
        return failures;
    }
}
