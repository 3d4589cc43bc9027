package com.ivamare.cqrs.event;

import com.ivamare.cqrs.domain.event.DomainEvent;

import java.util.Objects;

/**
 * Publisher that delivers outbox events to local projections through an {@link EventDispatcher}.
 */
public class DispatchingDomainEventPublisher implements DomainEventPublisher {

    private final EventDispatcher dispatcher;

    public DispatchingDomainEventPublisher(EventDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public void publish(DomainEvent event) {
        dispatcher.dispatch(event);
    }
}
