package com.hivewatch.enrichment;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for enrichment operations.
 *
 * Tracks:
 * - geo lookups resolved, not covered, and degraded to Unknown
 * - reputation lookups listed, not listed, and degraded to Unknown
 * - lookup timeouts
 * - feed refresh success/failure
 * - lookup latency
 */
@Component
public class EnrichmentMetrics {

    private final Counter geoResolved;
    private final Counter geoMisses;
    private final Counter geoUnknown;
    private final Counter reputationListed;
    private final Counter reputationNotListed;
    private final Counter reputationUnknown;
    private final Counter timeouts;
    private final Counter feedRefreshSuccess;
    private final Counter feedRefreshFailure;
    private final Timer lookupLatency;

    public EnrichmentMetrics(MeterRegistry registry) {
        this.geoResolved = Counter.builder("hivewatch.enrichment.geo.resolved")
            .description("Geo lookups that found a location")
            .tag("component", "enrichment")
            .register(registry);

        this.geoMisses = Counter.builder("hivewatch.enrichment.geo.misses")
            .description("Geo lookups for addresses not covered by the database")
            .tag("component", "enrichment")
            .register(registry);

        this.geoUnknown = Counter.builder("hivewatch.enrichment.geo.unknown")
            .description("Geo lookups degraded to Unknown after a failure")
            .tag("component", "enrichment")
            .register(registry);

        this.reputationListed = Counter.builder("hivewatch.enrichment.reputation.listed")
            .description("Reputation lookups that hit a feed entry")
            .tag("component", "enrichment")
            .register(registry);

        this.reputationNotListed = Counter.builder("hivewatch.enrichment.reputation.not_listed")
            .description("Reputation lookups with no feed entry")
            .tag("component", "enrichment")
            .register(registry);

        this.reputationUnknown = Counter.builder("hivewatch.enrichment.reputation.unknown")
            .description("Reputation lookups degraded to Unknown after a failure")
            .tag("component", "enrichment")
            .register(registry);

        this.timeouts = Counter.builder("hivewatch.enrichment.timeouts")
            .description("Lookups that exceeded the lookup timeout")
            .tag("component", "enrichment")
            .register(registry);

        this.feedRefreshSuccess = Counter.builder("hivewatch.enrichment.feed.refresh.success")
            .description("Threat feed fetches that succeeded")
            .tag("component", "enrichment")
            .register(registry);

        this.feedRefreshFailure = Counter.builder("hivewatch.enrichment.feed.refresh.failure")
            .description("Threat feed fetches that failed")
            .tag("component", "enrichment")
            .register(registry);

        this.lookupLatency = Timer.builder("hivewatch.enrichment.lookup.latency")
            .description("Latency of enrichment lookups")
            .tag("component", "enrichment")
            .register(registry);
    }

    public void recordGeoResolved() {
        geoResolved.increment();
    }

    public void recordGeoMiss() {
        geoMisses.increment();
    }

    public void recordGeoUnknown() {
        geoUnknown.increment();
    }

    public void recordReputationListed() {
        reputationListed.increment();
    }

    public void recordReputationNotListed() {
        reputationNotListed.increment();
    }

    public void recordReputationUnknown() {
        reputationUnknown.increment();
    }

    public void recordTimeout() {
        timeouts.increment();
    }

    public void recordFeedRefreshSuccess() {
        feedRefreshSuccess.increment();
    }

    public void recordFeedRefreshFailure() {
        feedRefreshFailure.increment();
    }

    public void recordLookupLatency(long durationMs) {
        lookupLatency.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public double getTimeouts() {
        return timeouts.count();
    }

    public double getFeedRefreshFailures() {
        return feedRefreshFailure.count();
    }

    public double getDegradedLookups() {
        return geoUnknown.count() + reputationUnknown.count();
    }
}
