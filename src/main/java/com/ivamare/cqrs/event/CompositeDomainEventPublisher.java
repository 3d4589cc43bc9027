package com.ivamare.cqrs.event;

import com.ivamare.cqrs.domain.event.DomainEvent;

import java.util.List;

/**
 * Publishes each event to several publishers in order. The first failure aborts and
 * propagates, so the outbox retries the whole fan-out.
 */
public class CompositeDomainEventPublisher implements DomainEventPublisher {

    private final List<DomainEventPublisher> delegates;

    public CompositeDomainEventPublisher(List<DomainEventPublisher> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void publish(DomainEvent event) throws Exception {
        for (DomainEventPublisher delegate : delegates) {
            delegate.publish(event);
        }
    }
}
