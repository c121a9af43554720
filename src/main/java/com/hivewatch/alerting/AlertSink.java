package com.hivewatch.alerting;

import com.hivewatch.domain.Alert;

/**
 * One independently failing consumer of alerts (dashboard, SIEM forwarder, exporter).
 * Each sink is fed from its own queue by its own delivery thread.
 */
public interface AlertSink {

    /**
     * Consumer name used for its queue, thread and metric tags. Must be unique.
     */
    String name();

    /**
     * Delivers one alert. May block; a slow sink only backs up its own queue.
     *
     * @throws RuntimeException on delivery failure; counted and the alert is discarded
     */
    void deliver(Alert alert);

    /**
     * True when {@link #deliver(Alert)} only accepts the alert for a later send. The fan-out then
     * leaves the delivered and failed counts of accepted alerts to the sink.
     */
    default boolean isBuffered() {
        return false;
    }

    /**
     * Hands the sink its consumer's counters when it is registered.
     */
    default void bind(DeliveryOutcome outcome) {
    }
}
