package com.hivewatch.ingestion;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.hivewatch.domain.RawRecord;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Supervises one worker per {@link SourceAdapter} and merges their records into a
 * single feed ordered by arrival.
 *
 * Each adapter runs on its own thread. A {@link SourceUnavailableException} or any
 * other failure is confined to that worker: the adapter is closed, the worker waits
 * out an exponential backoff and polls again, and sibling workers carry on.
 */
public class TailingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TailingCoordinator.class);

    private static final long DISPATCH_POLL_MILLIS = 100;

    private final List<SourceAdapter> adapters;
    private final Duration pollInterval;
    private final IntervalFunction backoff;
    private final IngestionMetrics metrics;
    private final int feedCapacity;

    public TailingCoordinator(List<SourceAdapter> adapters, Duration pollInterval, IntervalFunction backoff,
                              int feedCapacity, IngestionMetrics metrics) {
        this.adapters = List.copyOf(adapters);
        this.pollInterval = pollInterval;
        this.backoff = backoff;
        this.feedCapacity = feedCapacity;
        this.metrics = metrics;
    }

    public List<SourceAdapter> adapters() {
        return adapters;
    }

    /**
     * Starts every adapter and delivers merged records to {@code listener} on a single
     * dispatcher thread, in the order they were read.
     */
    public TailSubscription subscribe(Consumer<RawRecord> listener) {
        BlockingQueue<RawRecord> feed = new LinkedBlockingQueue<>(feedCapacity);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        ExecutorService executor = Executors.newFixedThreadPool(adapters.size() + 1,
            new ThreadFactoryBuilder().setNameFormat("hivewatch-tail-%d").setDaemon(true).build());

        for (SourceAdapter adapter : adapters) {
            executor.execute(() -> runAdapter(adapter, feed, cancelled));
        }
        executor.execute(() -> dispatch(feed, listener, cancelled));
        log.info("Tailing {} sources", adapters.size());

        return new Subscription(executor, cancelled);
    }

    private void runAdapter(SourceAdapter adapter, BlockingQueue<RawRecord> feed, AtomicBoolean cancelled) {
        int failures = 0;
        try {
            while (!cancelled.get()) {
                List<RawRecord> records;
                try {
                    records = adapter.poll();
                    if (failures > 0) {
                        log.info("Source {} recovered after {} failed attempts", adapter.name(), failures);
                        failures = 0;
                    }
                } catch (SourceUnavailableException e) {
                    failures++;
                    metrics.recordUnavailable(adapter.name());
                    if (failures == 1) {
                        log.warn("Source {} unavailable: {}", adapter.name(), e.getMessage());
                    }
                    sleep(backoff.apply(failures));
                    continue;
                } catch (RuntimeException e) {
                    failures++;
                    log.error("Adapter {} crashed; restarting", adapter.name(), e);
                    metrics.recordRestart(adapter.name());
                    adapter.close();
                    sleep(backoff.apply(failures));
                    continue;
                }

                for (RawRecord record : records) {
                    while (!feed.offer(record, DISPATCH_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                        if (cancelled.get()) {
                            metrics.recordFeedDrop(adapter.name());
                            return;
                        }
                    }
                }
                if (records.isEmpty()) {
                    sleep(pollInterval.toMillis());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            adapter.close();
            log.debug("Adapter {} stopped", adapter.name());
        }
    }

    private void dispatch(BlockingQueue<RawRecord> feed, Consumer<RawRecord> listener, AtomicBoolean cancelled) {
        try {
            while (!cancelled.get()) {
                RawRecord record = feed.poll(DISPATCH_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (record == null) {
                    continue;
                }
                try {
                    listener.accept(record);
                } catch (RuntimeException e) {
                    log.error("Record listener failed on {} offset {}", record.getSource(), record.getOffset(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    private final class Subscription implements TailSubscription {

        private final ExecutorService executor;
        private final AtomicBoolean cancelled;

        private Subscription(ExecutorService executor, AtomicBoolean cancelled) {
            this.executor = executor;
            this.cancelled = cancelled;
        }

        @Override
        public void cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Tail workers did not stop within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            adapters.forEach(SourceAdapter::close);
            log.info("Tailing cancelled");
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
