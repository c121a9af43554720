package com.hivewatch;

import com.hivewatch.correlation.CorrelationEngine;
import com.hivewatch.domain.RawRecord;
import com.hivewatch.ingestion.TailSubscription;
import com.hivewatch.ingestion.TailingCoordinator;
import com.hivewatch.normalization.EventNormalizer;
import com.hivewatch.session.IngestResult;
import com.hivewatch.session.SessionStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Wires the stages together: tailed records are normalized, ingested into their session and
 * handed to the correlation engine. Runs until the application shuts down.
 */
@Component
public class HoneypotPipeline {

    private static final Logger log = LoggerFactory.getLogger(HoneypotPipeline.class);

    private final TailingCoordinator coordinator;
    private final EventNormalizer normalizer;
    private final SessionStore sessionStore;
    private final CorrelationEngine engine;

    private TailSubscription subscription;

    public HoneypotPipeline(TailingCoordinator coordinator, EventNormalizer normalizer, SessionStore sessionStore,
                            CorrelationEngine engine) {
        this.coordinator = coordinator;
        this.normalizer = normalizer;
        this.sessionStore = sessionStore;
        this.engine = engine;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    public synchronized void start() {
        if (subscription != null && !subscription.isCancelled()) {
            return;
        }
        engine.start();
        subscription = coordinator.subscribe(this::process);
        log.info("Honeypot pipeline started with {} sources", coordinator.adapters().size());
    }

    /**
     * Stops tailing and correlation. Session state stays available for inspection.
     */
    @PreDestroy
    public synchronized void stop() {
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
        engine.stop();
        log.info("Honeypot pipeline stopped ({} sessions retained)", sessionStore.size());
    }

    /**
     * Stops rule evaluation and alerting only; tailing and session reconstruction continue.
     */
    public void stopCorrelation() {
        engine.stop();
    }

    public synchronized boolean isRunning() {
        return subscription != null && !subscription.isCancelled();
    }

    void process(RawRecord record) {
        try {
            normalizer.normalize(record).ifPresent(event -> {
                IngestResult result = sessionStore.ingest(event);
                engine.submit(result);
            });
        } catch (RuntimeException e) {
            log.error("Failed to process record from {} at offset {}", record.getSource(), record.getOffset(), e);
        }
    }
}
