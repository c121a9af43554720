package com.hivewatch.alerting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hivewatch.config.HiveWatchProperties;
import com.hivewatch.domain.Alert;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Forwards alerts to an external SIEM as JSON batches.
 *
 * Alerts are buffered until {@code batch-size} is reached or {@code send-interval} elapses,
 * then POSTed with a bearer token. Alerts only count as delivered once their batch was accepted;
 * a failed batch is logged and every alert in it counted as failed. Failed batches are not retried.
 */
@Component
@ConditionalOnProperty(prefix = "hivewatch.siem", name = "enabled", havingValue = "true")
public class SiemForwarderSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(SiemForwarderSink.class);

    public static final String NAME = "siem";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final int batchSize;
    private final Duration timeout;

    private final List<Alert> batch = new ArrayList<>();
    private volatile DeliveryOutcome outcome = DeliveryOutcome.NONE;

    @Autowired
    public SiemForwarderSink(HiveWatchProperties properties) {
        this(properties.getSiem().getUrl(), properties.getSiem().getAuthToken(),
            properties.getSiem().getBatchSize(), properties.getSiem().getTimeout());
    }

    public SiemForwarderSink(String url, String authToken, int batchSize, Duration timeout) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("hivewatch.siem.url is required when the SIEM forwarder is enabled");
        }
        WebClient.Builder builder = WebClient.builder()
            .baseUrl(url)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (authToken != null && !authToken.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + authToken);
        }
        this.webClient = builder.build();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.batchSize = Math.max(1, batchSize);
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isBuffered() {
        return true;
    }

    @Override
    public void bind(DeliveryOutcome outcome) {
        this.outcome = outcome;
    }

    @Override
    public void deliver(Alert alert) {
        List<Alert> ready = null;
        synchronized (batch) {
            batch.add(alert);
            if (batch.size() >= batchSize) {
                ready = drainBatch();
            }
        }
        if (ready != null) {
            send(ready);
        }
    }

    /**
     * Sends whatever is buffered, even a partial batch.
     */
    @Scheduled(fixedDelayString = "${hivewatch.siem.send-interval:PT30S}")
    public void flush() {
        List<Alert> ready;
        synchronized (batch) {
            if (batch.isEmpty()) {
                return;
            }
            ready = drainBatch();
        }
        send(ready);
    }

    @PreDestroy
    public void shutdown() {
        int buffered = pending();
        if (buffered > 0) {
            log.info("Flushing {} buffered alerts to SIEM before shutdown", buffered);
            flush();
        }
    }

    int pending() {
        synchronized (batch) {
            return batch.size();
        }
    }

    private List<Alert> drainBatch() {
        List<Alert> ready = new ArrayList<>(batch);
        batch.clear();
        return ready;
    }

    /**
     * Sends one batch and reports the outcome of each of its alerts.
     */
    private void send(List<Alert> alerts) {
        String body;
        try {
            body = objectMapper.writeValueAsString(alerts);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize {} alerts for SIEM", alerts.size(), e);
            outcome.failed(alerts.size());
            return;
        }
        try {
            post(body).block(timeout);
        } catch (RuntimeException e) {
            log.warn("SIEM forward of {} alerts failed: {}", alerts.size(), e.getMessage());
            outcome.failed(alerts.size());
            return;
        }
        log.debug("Forwarded {} alerts to SIEM", alerts.size());
        outcome.delivered(alerts.size());
    }

    /**
     * Performs the HTTP call for one serialized batch.
     */
    protected Mono<Void> post(String body) {
        return webClient.post()
            .bodyValue(body)
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .then();
    }
}
