package com.ivamare.cqrs.health;

import com.ivamare.cqrs.outbox.PublishReport;
import com.ivamare.cqrs.outbox.worker.OutboxPublishingWorker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.Objects;

/**
 * Health indicator for the outbox publishing worker.
 *
 * <p>Reports the worker state, the consecutive cycle error count and the counts of the
 * last completed cycle. Down when the worker is stopped or has failed
 * {@value #ERROR_THRESHOLD} or more cycles in a row.
 */
public class OutboxPublisherHealthIndicator implements HealthIndicator {

    static final int ERROR_THRESHOLD = 5;

    private final OutboxPublishingWorker worker;

    public OutboxPublisherHealthIndicator(OutboxPublishingWorker worker) {
        this.worker = Objects.requireNonNull(worker, "worker");
    }

    @Override
    public Health health() {
        int consecutiveErrors = worker.getConsecutiveErrorCount();
        PublishReport last = worker.getLastReport();

        boolean healthy = worker.isRunning() && consecutiveErrors < ERROR_THRESHOLD;
        Health.Builder builder = healthy ? Health.up() : Health.down();

        return builder
            .withDetail("running", worker.isRunning())
            .withDetail("consecutiveErrors", consecutiveErrors)
            .withDetail("lastAttempted", last.attempted())
            .withDetail("lastPublished", last.published())
            .withDetail("lastFailed", last.failed())
            .build();
    }
}
