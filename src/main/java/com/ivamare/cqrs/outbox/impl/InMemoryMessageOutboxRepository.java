package com.ivamare.cqrs.outbox.impl;

import com.ivamare.cqrs.domain.event.DomainEvent;
import com.ivamare.cqrs.outbox.MessageId;
import com.ivamare.cqrs.outbox.MessageOutboxRepository;
import com.ivamare.cqrs.outbox.OutboxMessage;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outbox kept in memory, in save order. Intended for tests and single-process setups;
 * messages do not survive a restart.
 *
 * <p>Ids are {@code m-1}, {@code m-2}, ... Messages whose {@code nextAttemptAt} lies in
 * the future are not returned by {@link #findUnpublished(int)}.
 *
 * <p>Published messages leave the pending set. Only the most recent
 * {@link #DEFAULT_PUBLISHED_HISTORY} of them are kept for {@link #find} and
 * {@link #findAll}; older ones are dropped.
 */
public class InMemoryMessageOutboxRepository implements MessageOutboxRepository {

    public static final int DEFAULT_PUBLISHED_HISTORY = 1000;

    private final Map<MessageId, OutboxMessage> pending = new LinkedHashMap<>();
    private final Map<MessageId, OutboxMessage> published;
    private final Clock clock;
    private long sequence;

    public InMemoryMessageOutboxRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryMessageOutboxRepository(Clock clock) {
        this(clock, DEFAULT_PUBLISHED_HISTORY);
    }

    /**
     * @param clock clock used to decide whether a scheduled message is due
     * @param publishedHistory number of published messages to keep, zero to keep none
     */
    public InMemoryMessageOutboxRepository(Clock clock, int publishedHistory) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (publishedHistory < 0) {
            throw new IllegalArgumentException("publishedHistory must be >= 0");
        }
        this.published = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<MessageId, OutboxMessage> eldest) {
                return size() > publishedHistory;
            }
        };
    }

    @Override
    public synchronized MessageId save(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        MessageId id = new MessageId("m-" + (++sequence));
        pending.put(id, OutboxMessage.pending(id, event));
        return id;
    }

    @Override
    public synchronized List<OutboxMessage> findUnpublished(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        List<OutboxMessage> batch = new ArrayList<>(Math.min(limit, pending.size()));
        for (OutboxMessage message : pending.values()) {
            if (message.isDue(now)) {
                batch.add(message);
                if (batch.size() == limit) {
                    break;
                }
            }
        }
        return batch;
    }

    @Override
    public synchronized void markAsPublished(MessageId id) {
        OutboxMessage message = pending.remove(id);
        if (message != null) {
            published.put(id, message.asPublished());
        }
    }

    @Override
    public synchronized void incrementRetryCount(MessageId id) {
        pending.computeIfPresent(id, (key, m) -> m.withRetryIncremented());
    }

    /**
     * Defer a pending message until {@code at}.
     */
    public synchronized void scheduleNextAttempt(MessageId id, Instant at) {
        pending.computeIfPresent(id, (key, m) -> m.withNextAttemptAt(at));
    }

    public synchronized Optional<OutboxMessage> find(MessageId id) {
        OutboxMessage message = pending.get(id);
        return Optional.ofNullable(message != null ? message : published.get(id));
    }

    /**
     * Retained published messages in publish order, then pending messages in save order.
     */
    public synchronized List<OutboxMessage> findAll() {
        List<OutboxMessage> all = new ArrayList<>(published.size() + pending.size());
        all.addAll(published.values());
        all.addAll(pending.values());
        return List.copyOf(all);
    }

    public synchronized int size() {
        return published.size() + pending.size();
    }

    public synchronized long countUnpublished() {
        return pending.size();
    }
}
