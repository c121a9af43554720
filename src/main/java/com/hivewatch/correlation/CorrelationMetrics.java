package com.hivewatch.correlation;

import com.hivewatch.domain.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class CorrelationMetrics {

    static final String EVENTS = "hivewatch.correlation.events";
    static final String MATCHES = "hivewatch.correlation.matches";
    static final String RULE_ERRORS = "hivewatch.correlation.rule.errors";
    static final String ALERTS = "hivewatch.correlation.alerts";
    static final String SUPPRESSED = "hivewatch.correlation.suppressed";

    private final MeterRegistry registry;

    private final Counter eventsCounter;
    private final Counter suppressedCounter;
    private final Timer evaluationTimer;

    private final Map<String, Counter> matchCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final Map<Severity, Counter> alertCounters = new ConcurrentHashMap<>();

    public CorrelationMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.eventsCounter = Counter.builder(EVENTS)
                .description("Events evaluated against the rule snapshot")
                .register(registry);
        this.suppressedCounter = Counter.builder(SUPPRESSED)
                .description("Events skipped because the source is whitelisted")
                .register(registry);
        this.evaluationTimer = Timer.builder("hivewatch.correlation.evaluation.latency")
                .description("Time to evaluate one event")
                .register(registry);
    }

    void recordEvaluated(Duration elapsed) {
        eventsCounter.increment();
        evaluationTimer.record(elapsed);
    }

    void recordSuppressed() {
        suppressedCounter.increment();
    }

    void recordMatch(String ruleId) {
        matchCounters.computeIfAbsent(ruleId, id -> Counter.builder(MATCHES)
                .description("Rule matches per rule")
                .tag("rule", id)
                .register(registry)).increment();
    }

    void recordRuleError(String ruleId) {
        errorCounters.computeIfAbsent(ruleId, id -> Counter.builder(RULE_ERRORS)
                .description("Rules disabled after an evaluation error")
                .tag("rule", id)
                .register(registry)).increment();
    }

    void recordAlert(Severity severity) {
        alertCounters.computeIfAbsent(severity, s -> Counter.builder(ALERTS)
                .description("Alerts emitted by severity")
                .tag("severity", s.getValue())
                .register(registry)).increment();
    }

    public double getEvaluated() {
        return eventsCounter.count();
    }

    public double getSuppressed() {
        return suppressedCounter.count();
    }

    public double getRuleErrors() {
        return errorCounters.values().stream().mapToDouble(Counter::count).sum();
    }

    public double getAlerts() {
        return alertCounters.values().stream().mapToDouble(Counter::count).sum();
    }
}
