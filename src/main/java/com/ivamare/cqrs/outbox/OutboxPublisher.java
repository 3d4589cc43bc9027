package com.ivamare.cqrs.outbox;

import com.ivamare.cqrs.event.DomainEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Pull-based delivery of pending outbox messages.
 *
 * <p>Each pass fetches one batch and handles it message by message: publish, then mark
 * published. A failed publish increments the message's retry count and the pass moves on
 * to the next message. Failed messages are only retried on a later pass.
 *
 * <p>Example:
 * <pre>
 * OutboxPublisher publisher = new OutboxPublisher(outbox, event -&gt; kafka.send(event));
 * PublishReport report = publisher.publishPendingEvents();
 * </pre>
 */
public class OutboxPublisher {

    private static final Logger log = LoggerFactory.getLogger(OutboxPublisher.class);

    private final MessageOutboxRepository outboxRepository;
    private final DomainEventPublisher eventPublisher;

    public OutboxPublisher(MessageOutboxRepository outboxRepository, DomainEventPublisher eventPublisher) {
        this.outboxRepository = Objects.requireNonNull(outboxRepository, "outboxRepository");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher");
    }

    /**
     * Publish up to {@value MessageOutboxRepository#DEFAULT_BATCH_SIZE} pending messages.
     *
     * @return counts of this pass
     */
    public PublishReport publishPendingEvents() {
        return publishPendingEvents(MessageOutboxRepository.DEFAULT_BATCH_SIZE);
    }

    /**
     * Publish up to {@code batchSize} pending messages.
     *
     * @param batchSize maximum messages in this pass, must be positive
     * @return counts of this pass
     */
    public PublishReport publishPendingEvents(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }

        List<OutboxMessage> messages = outboxRepository.findUnpublished(batchSize);
        if (messages.isEmpty()) {
            return PublishReport.empty();
        }

        int published = 0;
        int failed = 0;

        for (OutboxMessage message : messages) {
            if (deliver(message)) {
                published++;
            } else {
                failed++;
            }
        }

        log.debug("Outbox pass finished: attempted={}, published={}, failed={}",
            messages.size(), published, failed);
        return new PublishReport(messages.size(), published, failed);
    }

    private boolean deliver(OutboxMessage message) {
        try {
            eventPublisher.publish(message.event());
            outboxRepository.markAsPublished(message.id());
            return true;
        } catch (Exception e) {
            log.warn("Failed to publish outbox message {} ({}, retryCount={}): {}",
                message.id(), message.event().getClass().getSimpleName(), message.retryCount(), e.getMessage());
            recordFailure(message);
            return false;
        }
    }

    private void recordFailure(OutboxMessage message) {
        try {
            outboxRepository.incrementRetryCount(message.id());
        } catch (RuntimeException e) {
            log.error("Failed to increment retry count for outbox message {}", message.id(), e);
        }
    }
}
