package com.ivamare.cqrs.event;

import com.ivamare.cqrs.domain.event.DomainEvent;

/**
 * Delivers an event to an external destination (broker, webhook, in-process dispatcher).
 *
 * <p>Throwing signals a failed delivery; the outbox keeps the message pending.
 */
@FunctionalInterface
public interface DomainEventPublisher {

    void publish(DomainEvent event) throws Exception;
}
