package com.hivewatch.enrichment;

import com.hivewatch.domain.GeoLocation;

import java.util.Optional;

/**
 * Local source of IP geolocation.
 */
@FunctionalInterface
public interface GeoLookup {

    /**
     * @return the location, or empty when the address is not covered
     * @throws EnrichmentUnavailableException if no database is loaded
     */
    Optional<GeoLocation> locate(String ip);
}
