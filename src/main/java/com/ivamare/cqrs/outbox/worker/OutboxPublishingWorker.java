package com.ivamare.cqrs.outbox.worker;

import com.ivamare.cqrs.outbox.OutboxPublisher;
import com.ivamare.cqrs.outbox.PublishReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs {@link OutboxPublisher#publishPendingEvents(int)} on a fixed delay.
 *
 * <p>One cycle runs at a time on a single scheduler thread. A cycle that throws is logged
 * and counted in {@link #getConsecutiveErrorCount()}; the schedule keeps going. A cycle
 * that completes resets the counter, even when some messages in it failed to publish.
 */
public class OutboxPublishingWorker {

    private static final Logger log = LoggerFactory.getLogger(OutboxPublishingWorker.class);

    static final int ERROR_LOG_THRESHOLD = 5;

    private final OutboxPublisher publisher;
    private final int batchSize;
    private final long pollIntervalMs;
    private final long initialDelayMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);
    private final AtomicReference<PublishReport> lastReport = new AtomicReference<>(PublishReport.empty());

    private ScheduledExecutorService scheduler;

    /**
     * Creates a new worker.
     *
     * @param publisher the publisher to drive
     * @param batchSize messages per cycle, must be positive
     * @param pollIntervalMs delay between the end of one cycle and the start of the next
     * @param initialDelayMs delay before the first cycle
     */
    public OutboxPublishingWorker(OutboxPublisher publisher, int batchSize, long pollIntervalMs, long initialDelayMs) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, was " + batchSize);
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive, was " + pollIntervalMs);
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException("initialDelayMs must not be negative, was " + initialDelayMs);
        }
        this.batchSize = batchSize;
        this.pollIntervalMs = pollIntervalMs;
        this.initialDelayMs = initialDelayMs;
    }

    public synchronized void start() {
        if (running.getAndSet(true)) {
            log.warn("Outbox publishing worker already running");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "cqrs-outbox-publisher");
            thread.setDaemon(true);
            return thread;
        });

        log.info("Starting outbox publishing worker, batchSize={}, pollIntervalMs={}, initialDelayMs={}",
            batchSize, pollIntervalMs, initialDelayMs);

        scheduler.scheduleWithFixedDelay(this::runCycle, initialDelayMs, pollIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Stop scheduling new cycles and wait up to {@code timeout} for the current one.
     *
     * @param timeout how long to wait for a running cycle
     * @return future completing once the scheduler has terminated
     */
    public synchronized CompletableFuture<Void> stop(Duration timeout) {
        if (!running.getAndSet(false)) {
            return CompletableFuture.completedFuture(null);
        }

        ScheduledExecutorService toStop = scheduler;
        scheduler = null;
        toStop.shutdown();
        log.info("Stopping outbox publishing worker");

        return CompletableFuture.runAsync(() -> {
            try {
                if (!toStop.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Timeout waiting for outbox publishing cycle to finish, forcing shutdown");
                    toStop.shutdownNow();
                }
                log.info("Outbox publishing worker stopped");
            } catch (InterruptedException e) {
                toStop.shutdownNow();
                Thread.currentThread().interrupt();
            }
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Run one publish cycle on the calling thread.
     *
     * @return the report of the cycle
     */
    public PublishReport publishOnce() {
        PublishReport report = publisher.publishPendingEvents(batchSize);
        lastReport.set(report);
        consecutiveErrors.set(0);
        if (report.attempted() > 0) {
            log.debug("Outbox cycle: attempted={}, published={}, failed={}",
                report.attempted(), report.published(), report.failed());
        }
        return report;
    }

    public int getConsecutiveErrorCount() {
        return consecutiveErrors.get();
    }

    public PublishReport getLastReport() {
        return lastReport.get();
    }

    private void runCycle() {
        try {
            publishOnce();
        } catch (RuntimeException e) {
            int errors = consecutiveErrors.incrementAndGet();
            String message = "Outbox publishing cycle failed (consecutive errors={}): {}";
            if (errors >= ERROR_LOG_THRESHOLD) {
                log.error(message, errors, e.getMessage(), e);
            } else {
                log.warn(message, errors, e.getMessage());
            }
        }
    }
}
