package com.hivewatch.enrichment;

import com.hivewatch.config.HiveWatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Configuration for the local GeoIP database.
 */
@Configuration
public class EnrichmentConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentConfiguration.class);

    /**
     * Loads the configured database. A missing or unreadable file leaves geolocation
     * Unknown for the run rather than failing startup.
     */
    @Bean
    public GeoDatabase geoDatabase(HiveWatchProperties properties, Clock clock) {
        String databasePath = properties.getGeoip().getDatabasePath();
        if (databasePath == null || databasePath.isBlank()) {
            log.info("No GeoIP database configured; geolocation will be Unknown");
            return GeoDatabase.empty(clock);
        }
        try {
            return GeoDatabase.load(Path.of(databasePath), clock);
        } catch (IOException e) {
            log.warn("Cannot load GeoIP database {}: {}", databasePath, e.getMessage());
            return GeoDatabase.empty(clock);
        }
    }
}
