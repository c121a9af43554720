package com.hivewatch.alerting;

/**
 * Per-alert delivery counters of one consumer. Buffering sinks report through it once the alerts
 * they accepted were actually sent or lost.
 */
public interface DeliveryOutcome {

    DeliveryOutcome NONE = new DeliveryOutcome() {
        @Override
        public void delivered(int alerts) {
        }

        @Override
        public void failed(int alerts) {
        }
    };

    void delivered(int alerts);

    void failed(int alerts);
}
