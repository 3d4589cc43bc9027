package com.ivamare.cqrs.domain;

import com.ivamare.cqrs.domain.event.DomainEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Consistency boundary that records domain events while enforcing its invariants.
 *
 * <p>The event buffer belongs to this instance and is not thread-safe. A command handler
 * mutates the aggregate, reads the recorded events into its result and then clears the
 * buffer (see {@link #pullEvents()}). Sharing an aggregate across concurrent commands
 * requires external synchronization.
 *
 * @param <ID> identifier type
 */
public abstract class AggregateRoot<ID> extends Entity<ID> {

    private final List<DomainEvent> domainEvents = new ArrayList<>();
    private long version;

    protected void recordEvent(DomainEvent event) {
        domainEvents.add(event);
    }

    /**
     * @return copy of the events recorded since the last clear, in record order
     */
    public List<DomainEvent> getDomainEvents() {
        return List.copyOf(domainEvents);
    }

    public void clearEvents() {
        domainEvents.clear();
    }

    /**
     * Returns the recorded events and clears the buffer.
     *
     * @return events in record order
     */
    public List<DomainEvent> pullEvents() {
        List<DomainEvent> events = List.copyOf(domainEvents);
        domainEvents.clear();
        return events;
    }

    public int eventCount() {
        return domainEvents.size();
    }

    public boolean hasEvents() {
        return !domainEvents.isEmpty();
    }

    public long getVersion() {
        return version;
    }

    protected void incrementVersion() {
        version++;
    }
}
