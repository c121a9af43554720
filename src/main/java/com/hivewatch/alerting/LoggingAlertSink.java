package com.hivewatch.alerting;

import com.hivewatch.domain.Alert;
import com.hivewatch.domain.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes every alert to the log at warn level.
 */
@Component
public class LoggingAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertSink.class);

    public static final String NAME = "log";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void deliver(Alert alert) {
        log.warn("ALERT [{}] session={} ip={} score={} rules={} cause={}",
                alert.getSeverity().getValue().toUpperCase(), alert.getSessionId(), alert.getSourceIp(),
                alert.getRiskScore(), alert.getRuleIds(), alert.getCause());
        if (log.isDebugEnabled()) {
            for (Event event : alert.getEvidence()) {
                log.debug("  evidence {} {} {}", event.getTimestamp(), event.getKind().getValue(), event.getPayload());
            }
        }
    }
}
