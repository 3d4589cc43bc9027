package com.ivamare.cqrs.domain.event;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Base class for events carrying aggregate type, schema version and tracing ids.
 *
 * <p>Subclasses declare their own final payload fields. The short constructor assigns a
 * random id and the current time; the full constructor restores an event read back
 * from storage.
 *
 * <p>Example:
 * <pre>
 * public final class MoneyDeposited extends BaseDomainEvent {
 *     private final long amount;
 *
 *     public MoneyDeposited(String accountId, long amount) {
 *         super(accountId, "Account");
 *         this.amount = amount;
 *     }
 * }
 * </pre>
 */
public abstract class BaseDomainEvent implements DomainEvent {

    private final String eventId;
    private final Instant occurredAt;
    private final String aggregateId;
    private final String aggregateType;
    private final int eventVersion;
    private final String causationId;
    private final String correlationId;

    protected BaseDomainEvent(String aggregateId, String aggregateType) {
        this(aggregateId, aggregateType, 1, null, null, null, null);
    }

    protected BaseDomainEvent(
            String aggregateId,
            String aggregateType,
            int eventVersion,
            String eventId,
            Instant occurredAt,
            String causationId,
            String correlationId) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
        this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
        this.eventVersion = eventVersion;
        this.eventId = eventId != null ? eventId : UUID.randomUUID().toString();
        this.occurredAt = occurredAt != null ? occurredAt : Instant.now();
        this.causationId = causationId;
        this.correlationId = correlationId;
    }

    @Override
    public String getEventId() {
        return eventId;
    }

    @Override
    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String getAggregateId() {
        return aggregateId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public int getEventVersion() {
        return eventVersion;
    }

    /**
     * @return id of the event or command that caused this one, or null
     */
    public String getCausationId() {
        return causationId;
    }

    /**
     * @return id shared by every event of one causal chain, or null
     */
    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * @return the event type name (simple class name)
     */
    public String eventType() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return eventType() + "(eventId=" + eventId + ", aggregateId=" + aggregateId
            + ", occurredAt=" + occurredAt + ")";
    }
}
