package com.ivamare.cqrs.domain.event;

import java.time.Instant;

/**
 * An immutable fact recorded while handling a command.
 *
 * <p>Implementations must not change after construction. The event id is unique for
 * the lifetime of the system.
 */
public interface DomainEvent {

    /**
     * @return unique event id
     */
    String getEventId();

    /**
     * @return when the fact occurred
     */
    Instant getOccurredAt();

    /**
     * @return id of the aggregate that produced the event
     */
    String getAggregateId();
}
