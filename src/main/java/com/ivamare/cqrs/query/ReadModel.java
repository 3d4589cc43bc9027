package com.ivamare.cqrs.query;

import com.ivamare.cqrs.domain.event.DomainEvent;

/**
 * Projection kept up to date from domain events and read by query handlers.
 */
public interface ReadModel {

    /**
     * Apply an event to the projection. Must be idempotent, since delivery is at-least-once.
     *
     * @param event the delivered event
     */
    void apply(DomainEvent event);
}
