package com.hivewatch.ingestion;

import com.hivewatch.config.HiveWatchProperties;
import com.hivewatch.domain.SourceType;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds one adapter per configured source and the coordinator that supervises them.
 */
@Configuration
public class SourceConfiguration {

    @Bean
    public TailingCoordinator tailingCoordinator(HiveWatchProperties properties, IngestionMetrics metrics,
                                                 Clock clock) {
        HiveWatchProperties.Sources sources = properties.getSources();
        List<SourceAdapter> adapters = new ArrayList<>();

        for (String logPath : sources.getLogPaths()) {
            Path path = Path.of(logPath);
            SourceType type = logPath.endsWith(".json") ? SourceType.JSON_LOG : SourceType.TEXT_LOG;
            adapters.add(new RotatingFileAdapter(path, type, sources.getDedupWindowSize(),
                sources.getHistoryHours(), clock, metrics));
        }
        if (sources.getTtyLogPath() != null && !sources.getTtyLogPath().isBlank()) {
            adapters.add(new TtyCaptureAdapter(Path.of(sources.getTtyLogPath()), clock, metrics));
        }
        if (sources.getDownloadPath() != null && !sources.getDownloadPath().isBlank()) {
            adapters.add(new DownloadDirectoryAdapter(Path.of(sources.getDownloadPath()), clock, metrics));
        }

        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(
            sources.getBackoffInitial().toMillis(), 2.0, sources.getBackoffMax().toMillis());

        return new TailingCoordinator(adapters, sources.getPollInterval(), backoff,
            sources.getFeedCapacity(), metrics);
    }
}
