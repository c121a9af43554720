package com.hivewatch.enrichment;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.hivewatch.config.HiveWatchProperties;
import com.hivewatch.domain.EnrichmentSnapshot;
import com.hivewatch.domain.GeoLocation;
import com.hivewatch.domain.ReputationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Geolocation and reputation lookups for alert enrichment.
 *
 * Both lookups are cache-first and bounded by the lookup timeout. Any failure, a missing
 * database or feed snapshot, or a timeout resolves to Unknown instead of an error, so
 * callers never wait longer than the timeout and never fail because of enrichment.
 */
@Service
public class EnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final LoadingCache<String, GeoLocation> geoCache;
    private final ReputationIndex reputationIndex;
    private final EnrichmentMetrics metrics;
    private final Duration lookupTimeout;

    @Autowired
    public EnrichmentService(HiveWatchProperties properties, GeoLookup geoLookup, ReputationIndex reputationIndex,
                             EnrichmentMetrics metrics) {
        this(geoLookup, reputationIndex, metrics,
            properties.getEnrichment().getLookupTimeout(),
            properties.getEnrichment().getCacheSize(),
            properties.getEnrichment().getCacheTtl());
    }

    public EnrichmentService(GeoLookup geoLookup, ReputationIndex reputationIndex, EnrichmentMetrics metrics,
                             Duration lookupTimeout, long cacheSize, Duration cacheTtl) {
        this.reputationIndex = reputationIndex;
        this.metrics = metrics;
        this.lookupTimeout = lookupTimeout;

        // Misses are cached as UNKNOWN too; failures are not, since the loader throws
        this.geoCache = Caffeine.newBuilder()
            .maximumSize(cacheSize)
            .expireAfterWrite(cacheTtl)
            .recordStats()
            .build(ip -> {
                Optional<GeoLocation> location = geoLookup.locate(ip);
                if (location.isPresent()) {
                    metrics.recordGeoResolved();
                    return location.get();
                }
                metrics.recordGeoMiss();
                return GeoLocation.UNKNOWN;
            });
    }

    public Mono<GeoLocation> lookupGeo(String ip) {
        if (ip == null) {
            return Mono.just(GeoLocation.UNKNOWN);
        }
        long start = System.currentTimeMillis();
        return Mono.fromCallable(() -> geoCache.get(ip))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(lookupTimeout)
            .doOnSuccess(geo -> metrics.recordLookupLatency(System.currentTimeMillis() - start))
            .onErrorResume(e -> {
                recordFailure("geo", ip, e);
                metrics.recordGeoUnknown();
                return Mono.just(GeoLocation.UNKNOWN);
            });
    }

    public Mono<ReputationVerdict> lookupReputation(String indicator) {
        if (indicator == null) {
            return Mono.just(ReputationVerdict.UNKNOWN);
        }
        return Mono.fromCallable(() -> reputationIndex.lookup(indicator))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(lookupTimeout)
            .doOnSuccess(verdict -> {
                if (verdict.isListed()) {
                    metrics.recordReputationListed();
                } else {
                    metrics.recordReputationNotListed();
                }
            })
            .onErrorResume(e -> {
                recordFailure("reputation", indicator, e);
                metrics.recordReputationUnknown();
                return Mono.just(ReputationVerdict.UNKNOWN);
            });
    }

    /**
     * Geo and reputation for one address, looked up concurrently.
     */
    public Mono<EnrichmentSnapshot> snapshot(String ip) {
        if (ip == null) {
            return Mono.just(EnrichmentSnapshot.UNKNOWN);
        }
        return Mono.zip(lookupGeo(ip), lookupReputation(ip))
            .map(pair -> new EnrichmentSnapshot(pair.getT1(), pair.getT2()))
            .onErrorReturn(EnrichmentSnapshot.UNKNOWN);
    }

    public long getGeoCacheSize() {
        return geoCache.estimatedSize();
    }

    public CacheStats getGeoCacheStats() {
        return geoCache.stats();
    }

    private void recordFailure(String kind, String indicator, Throwable e) {
        if (e instanceof TimeoutException) {
            metrics.recordTimeout();
            log.debug("{} lookup for {} timed out after {}", kind, indicator, lookupTimeout);
        } else if (e instanceof EnrichmentUnavailableException) {
            log.debug("{} lookup for {} unavailable: {}", kind, indicator, e.getMessage());
        } else {
            log.warn("{} lookup for {} failed: {}", kind, indicator, e.getMessage());
        }
    }
}
