package com.ivamare.cqrs.outbox;

import com.ivamare.cqrs.domain.event.DomainEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable wrapper around one event waiting for delivery.
 *
 * <p>Lifecycle: pending when saved; published exactly once on a successful delivery;
 * a failed attempt keeps it pending with {@code retryCount} incremented. The core never
 * sets {@code nextAttemptAt}; it is a hook for stores and schedulers.
 *
 * @param id message id
 * @param event the event payload
 * @param retryCount failed delivery attempts so far
 * @param nextAttemptAt earliest next attempt, or null for immediately
 * @param published whether the message has been delivered
 */
public record OutboxMessage(
    MessageId id,
    DomainEvent event,
    int retryCount,
    Instant nextAttemptAt,
    boolean published
) {
    public OutboxMessage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(event, "event");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
    }

    /**
     * Create a new pending message.
     */
    public static OutboxMessage pending(MessageId id, DomainEvent event) {
        return new OutboxMessage(id, event, 0, null, false);
    }

    public boolean isPending() {
        return !published;
    }

    /**
     * @param now current time
     * @return true if pending and not scheduled for later
     */
    public boolean isDue(Instant now) {
        return !published && (nextAttemptAt == null || !nextAttemptAt.isAfter(now));
    }

    public OutboxMessage withRetryIncremented() {
        return new OutboxMessage(id, event, retryCount + 1, nextAttemptAt, published);
    }

    public OutboxMessage withNextAttemptAt(Instant at) {
        return new OutboxMessage(id, event, retryCount, at, published);
    }

    public OutboxMessage asPublished() {
        return published ? this : new OutboxMessage(id, event, retryCount, nextAttemptAt, true);
    }
}
