package com.ivamare.cqrs.outbox;

import com.ivamare.cqrs.domain.event.DomainEvent;

/**
 * Converts events to and from the payload stored by a persistent outbox.
 */
public interface OutboxEventSerializer {

    /**
     * @param event the event
     * @return type discriminator stored next to the payload
     */
    String eventType(DomainEvent event);

    String serialize(DomainEvent event);

    DomainEvent deserialize(String eventType, String payload);
}
