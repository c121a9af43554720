package com.hivewatch.alerting;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.hivewatch.config.HiveWatchProperties;
import com.hivewatch.domain.Alert;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers each published alert to every registered {@link AlertSink}.
 *
 * Each sink owns a bounded queue drained by its own daemon thread, so a slow or failing sink
 * only ever backs up its own queue. When a queue is full the oldest undelivered alert for that
 * sink is dropped and counted; {@link #publish(Alert)} never blocks.
 *
 * Published alerts are also appended to an in-memory alert log and emitted on a hot
 * {@link Flux} for live subscribers.
 */
@Component
public class AlertFanout {

    private static final Logger log = LoggerFactory.getLogger(AlertFanout.class);

    static final String DELIVERED = "hivewatch.alerts.delivered";
    static final String DROPPED = "hivewatch.alerts.dropped";
    static final String DELIVERY_FAILED = "hivewatch.alerts.delivery.failed";

    static final int ALERT_LOG_CAPACITY = 10_000;
    private static final long DROP_WARN_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(10);

    private final int queueCapacity;
    private final MeterRegistry registry;
    private final Map<String, SinkQueue> queues = new ConcurrentHashMap<>();

    private final Deque<Alert> alertLog = new ArrayDeque<>();
    private final Sinks.Many<Alert> live = Sinks.many().multicast().directBestEffort();

    @Autowired
    public AlertFanout(HiveWatchProperties properties, List<AlertSink> sinks, MeterRegistry registry) {
        this(properties.getAlerts().getQueueCapacity(), registry);
        sinks.forEach(this::register);
    }

    public AlertFanout(int queueCapacity, MeterRegistry registry) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        this.registry = registry;
    }

    /**
     * Adds a consumer and starts its delivery thread.
     *
     * @throws IllegalArgumentException if a consumer with the same name is registered
     */
    public void register(AlertSink sink) {
        SinkQueue queue = new SinkQueue(sink);
        if (queues.putIfAbsent(sink.name(), queue) != null) {
            throw new IllegalArgumentException("Alert consumer already registered: " + sink.name());
        }
        sink.bind(queue);
        queue.start();
        log.info("Registered alert consumer {} (queue capacity {})", sink.name(), queueCapacity);
    }

    /**
     * Stops a consumer. Alerts still queued for it are discarded.
     */
    public boolean unregister(String name) {
        SinkQueue queue = queues.remove(name);
        if (queue == null) {
            return false;
        }
        queue.stop();
        log.info("Unregistered alert consumer {} ({} alerts discarded)", name, queue.pending.size());
        return true;
    }

    public void publish(Alert alert) {
        synchronized (alertLog) {
            alertLog.addLast(alert);
            if (alertLog.size() > ALERT_LOG_CAPACITY) {
                alertLog.removeFirst();
            }
            // Serialized with the log append so concurrent publishers never race the sink
            live.tryEmitNext(alert);
        }
        for (SinkQueue queue : queues.values()) {
            queue.offer(alert);
        }
    }

    /**
     * Hot stream of alerts published after subscription. A subscriber that cannot keep up
     * misses alerts rather than slowing the engine.
     */
    public Flux<Alert> alerts() {
        return live.asFlux();
    }

    /**
     * The most recent alerts, newest last.
     */
    public List<Alert> recentAlerts(int limit) {
        synchronized (alertLog) {
            int skip = Math.max(0, alertLog.size() - limit);
            List<Alert> recent = new ArrayList<>(Math.min(limit, alertLog.size()));
            Iterator<Alert> it = alertLog.iterator();
            for (int i = 0; it.hasNext(); i++) {
                Alert alert = it.next();
                if (i >= skip) {
                    recent.add(alert);
                }
            }
            return recent;
        }
    }

    public int alertLogSize() {
        synchronized (alertLog) {
            return alertLog.size();
        }
    }

    public Set<String> consumers() {
        return new TreeSet<>(queues.keySet());
    }

    public long droppedCount(String consumer) {
        SinkQueue queue = queues.get(consumer);
        return queue != null ? (long) queue.dropped.count() : 0;
    }

    public long deliveredCount(String consumer) {
        SinkQueue queue = queues.get(consumer);
        return queue != null ? (long) queue.delivered.count() : 0;
    }

    public long failedCount(String consumer) {
        SinkQueue queue = queues.get(consumer);
        return queue != null ? (long) queue.failed.count() : 0;
    }

    public long totalDropped() {
        long total = 0;
        for (SinkQueue queue : queues.values()) {
            total += (long) queue.dropped.count();
        }
        return total;
    }

    public int queueDepth(String consumer) {
        SinkQueue queue = queues.get(consumer);
        return queue != null ? queue.pending.size() : 0;
    }

    @PreDestroy
    public void shutdown() {
        for (String name : new ArrayList<>(queues.keySet())) {
            unregister(name);
        }
        live.tryEmitComplete();
    }

    private final class SinkQueue implements Runnable, DeliveryOutcome {

        private final AlertSink sink;
        private final LinkedBlockingDeque<Alert> pending;
        private final Counter delivered;
        private final Counter dropped;
        private final Counter failed;
        private final AtomicLong dropsSinceWarning = new AtomicLong();
        private volatile long lastDropWarning;
        private volatile boolean running = true;
        private Thread thread;

        SinkQueue(AlertSink sink) {
            this.sink = sink;
            this.pending = new LinkedBlockingDeque<>(queueCapacity);
            this.delivered = Counter.builder(DELIVERED)
                    .description("Alerts delivered per consumer")
                    .tag("consumer", sink.name())
                    .register(registry);
            this.dropped = Counter.builder(DROPPED)
                    .description("Alerts dropped from a full consumer queue")
                    .tag("consumer", sink.name())
                    .register(registry);
            this.failed = Counter.builder(DELIVERY_FAILED)
                    .description("Alerts a consumer failed to deliver")
                    .tag("consumer", sink.name())
                    .register(registry);
        }

        void start() {
            ThreadFactory factory = new ThreadFactoryBuilder()
                    .setNameFormat("hivewatch-alerts-" + sink.name())
                    .setDaemon(true)
                    .build();
            thread = factory.newThread(this);
            thread.start();
        }

        void stop() {
            running = false;
            if (thread != null) {
                thread.interrupt();
            }
        }

        @Override
        public void delivered(int alerts) {
            delivered.increment(alerts);
        }

        @Override
        public void failed(int alerts) {
            failed.increment(alerts);
        }

        void offer(Alert alert) {
            while (!pending.offerLast(alert)) {
                Alert evicted = pending.pollFirst();
                if (evicted != null) {
                    dropped.increment();
                    warnDrop();
                }
            }
        }

        private void warnDrop() {
            long drops = dropsSinceWarning.incrementAndGet();
            long now = System.nanoTime();
            if (lastDropWarning == 0 || now - lastDropWarning > DROP_WARN_INTERVAL_NANOS) {
                lastDropWarning = now;
                dropsSinceWarning.set(0);
                log.warn("Alert consumer {} is behind; dropped {} oldest alerts (total {})",
                        sink.name(), drops, (long) dropped.count());
            }
        }

        @Override
        public void run() {
            while (running) {
                Alert alert;
                try {
                    alert = pending.pollFirst(100, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (alert == null) {
                    continue;
                }
                try {
                    sink.deliver(alert);
                    if (!sink.isBuffered()) {
                        delivered.increment();
                    }
                } catch (RuntimeException e) {
                    failed.increment();
                    log.warn("Alert consumer {} failed to deliver {}: {}", sink.name(), alert.getAlertId(),
                            e.getMessage());
                }
            }
        }
    }
}
