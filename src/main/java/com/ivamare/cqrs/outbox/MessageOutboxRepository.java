package com.ivamare.cqrs.outbox;

import com.ivamare.cqrs.domain.event.DomainEvent;

import java.util.List;

/**
 * Persistence contract for outbox messages.
 *
 * <p>{@link #save} must join the business transaction that produced the event, which is
 * why the mediator requires the transaction interceptor to wrap the outbox interceptor.
 * Stores shared by several publisher instances must provide their own claim or lock
 * semantics; the publisher does not coordinate concurrent passes.
 */
public interface MessageOutboxRepository {

    int DEFAULT_BATCH_SIZE = 100;

    /**
     * Persist an event as a new pending message.
     *
     * @param event the event
     * @return the assigned message id
     */
    MessageId save(DomainEvent event);

    /**
     * Find pending messages, oldest first.
     *
     * @param limit maximum number of messages to return
     * @return pending messages, at most {@code limit}
     */
    List<OutboxMessage> findUnpublished(int limit);

    /**
     * Find up to {@value #DEFAULT_BATCH_SIZE} pending messages, oldest first.
     */
    default List<OutboxMessage> findUnpublished() {
        return findUnpublished(DEFAULT_BATCH_SIZE);
    }

    /**
     * Mark a message as published. Marking an already published message is a no-op.
     *
     * @param id message id
     */
    void markAsPublished(MessageId id);

    /**
     * Record a failed delivery attempt. The message stays pending.
     *
     * @param id message id
     */
    void incrementRetryCount(MessageId id);
}
