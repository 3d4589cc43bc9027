package com.ivamare.cqrs.event;

import com.ivamare.cqrs.domain.event.DomainEvent;

/**
 * Projection handler for one event type.
 *
 * <p>Delivery is at-least-once, so handlers must tolerate seeing the same event twice.
 *
 * @param <E> event type
 */
@FunctionalInterface
public interface DomainEventHandler<E extends DomainEvent> {

    void handle(E event) throws Exception;
}
