package com.ivamare.cqrs.outbox.impl;

import com.ivamare.cqrs.domain.event.DomainEvent;
import com.ivamare.cqrs.exception.OutboxSerializationException;
import com.ivamare.cqrs.outbox.MessageId;
import com.ivamare.cqrs.outbox.MessageOutboxRepository;
import com.ivamare.cqrs.outbox.OutboxEventSerializer;
import com.ivamare.cqrs.outbox.OutboxMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * JDBC implementation of MessageOutboxRepository.
 *
 * <p>{@link #save} uses the caller's connection through {@link JdbcTemplate}, so it joins
 * any Spring-managed transaction that is active on the thread. See
 * {@code db/cqrs/outbox-schema.sql} for the table layout.
 *
 * <p>Rows are decoded one by one. A row whose payload cannot be decoded is left out of
 * the batch and its retry count is incremented, so it never blocks the rows behind it.
 */
public class JdbcMessageOutboxRepository implements MessageOutboxRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcMessageOutboxRepository.class);

    public static final String DEFAULT_TABLE_NAME = "cqrs_outbox";

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final JdbcTemplate jdbcTemplate;
    private final OutboxEventSerializer serializer;
    private final Clock clock;
    private final String insertSql;
    private final String selectPendingSql;
    private final String markPublishedSql;
    private final String incrementRetrySql;
    private final String scheduleSql;
    private final RowMapper<StoredRow> rowMapper;

    public JdbcMessageOutboxRepository(JdbcTemplate jdbcTemplate, OutboxEventSerializer serializer) {
        this(jdbcTemplate, serializer, DEFAULT_TABLE_NAME, Clock.systemUTC());
    }

    public JdbcMessageOutboxRepository(
            JdbcTemplate jdbcTemplate,
            OutboxEventSerializer serializer,
            String tableName,
            Clock clock) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid outbox table name: " + tableName);
        }

        this.insertSql = "INSERT INTO " + tableName
            + " (id, event_type, payload, retry_count, published, created_at) VALUES (?, ?, ?, 0, FALSE, ?)";
        this.selectPendingSql = """
            SELECT id, event_type, payload, retry_count, next_attempt_at, published
            FROM %s
            WHERE published = FALSE AND (next_attempt_at IS NULL OR next_attempt_at <= ?)
            ORDER BY seq
            LIMIT ?
            """.formatted(tableName);
        this.markPublishedSql = "UPDATE " + tableName
            + " SET published = TRUE, published_at = ? WHERE id = ? AND published = FALSE";
        this.incrementRetrySql = "UPDATE " + tableName
            + " SET retry_count = retry_count + 1 WHERE id = ? AND published = FALSE";
        this.scheduleSql = "UPDATE " + tableName
            + " SET next_attempt_at = ? WHERE id = ? AND published = FALSE";

        this.rowMapper = (rs, rowNum) -> {
            Timestamp nextAttempt = rs.getTimestamp("next_attempt_at");
            return new StoredRow(
                new MessageId(rs.getString("id")),
                rs.getString("event_type"),
                rs.getString("payload"),
                rs.getInt("retry_count"),
                nextAttempt != null ? nextAttempt.toInstant() : null,
                rs.getBoolean("published")
            );
        };
    }

    @Override
    public MessageId save(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        String id = UUID.randomUUID().toString();
        jdbcTemplate.update(insertSql,
            id,
            serializer.eventType(event),
            serializer.serialize(event),
            Timestamp.from(clock.instant())
        );
        return new MessageId(id);
    }

    @Override
    public List<OutboxMessage> findUnpublished(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<StoredRow> rows = jdbcTemplate.query(selectPendingSql, rowMapper, Timestamp.from(clock.instant()), limit);

        List<OutboxMessage> messages = new ArrayList<>(rows.size());
        for (StoredRow row : rows) {
            try {
                messages.add(row.decode(serializer));
            } catch (OutboxSerializationException e) {
                log.warn("Skipping undecodable outbox message {} ({}, retryCount={}): {}",
                    row.id(), row.eventType(), row.retryCount(), e.getMessage());
                incrementRetryCount(row.id());
            }
        }
        return messages;
    }

    @Override
    public void markAsPublished(MessageId id) {
        jdbcTemplate.update(markPublishedSql, Timestamp.from(clock.instant()), id.value());
    }

    @Override
    public void incrementRetryCount(MessageId id) {
        jdbcTemplate.update(incrementRetrySql, id.value());
    }

    /**
     * Defer a pending message until {@code at}.
     *
     * @return true if a pending message was updated
     */
    public boolean scheduleNextAttempt(MessageId id, Instant at) {
        return jdbcTemplate.update(scheduleSql, at != null ? Timestamp.from(at) : null, id.value()) > 0;
    }

    private record StoredRow(
        MessageId id,
        String eventType,
        String payload,
        int retryCount,
        Instant nextAttemptAt,
        boolean published
    ) {
        OutboxMessage decode(OutboxEventSerializer serializer) {
            return new OutboxMessage(id, serializer.deserialize(eventType, payload), retryCount, nextAttemptAt, published);
        }
    }
}
