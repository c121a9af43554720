package com.hivewatch.session;

import com.hivewatch.domain.CloseReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Session lifecycle counters.
 */
@Component
public class SessionMetrics {

    private final MeterRegistry registry;
    private final Counter created;
    private final Counter evicted;
    private final Map<CloseReason, Counter> closed = new EnumMap<>(CloseReason.class);

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.created = Counter.builder("hivewatch.session.created")
            .description("Sessions opened")
            .register(registry);
        this.evicted = Counter.builder("hivewatch.session.evicted")
            .description("Closed sessions dropped by retention")
            .register(registry);
        for (CloseReason reason : CloseReason.values()) {
            closed.put(reason, Counter.builder("hivewatch.session.closed")
                .description("Sessions closed")
                .tag("reason", reason.name().toLowerCase())
                .register(registry));
        }
    }

    void registerActiveGauge(Supplier<Number> active) {
        Gauge.builder("hivewatch.session.active", active)
            .description("Sessions not yet closed")
            .register(registry);
    }

    void recordCreated() {
        created.increment();
    }

    void recordClosed(CloseReason reason) {
        closed.get(reason).increment();
    }

    void recordEvicted(int count) {
        evicted.increment(count);
    }
}
