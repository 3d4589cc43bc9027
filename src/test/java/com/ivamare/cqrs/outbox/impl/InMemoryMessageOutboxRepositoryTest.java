package com.ivamare.cqrs.outbox.impl;

import com.ivamare.cqrs.fixture.AccountOpened;
import com.ivamare.cqrs.fixture.MoneyDeposited;
import com.ivamare.cqrs.fixture.MoneyWithdrawn;
import com.ivamare.cqrs.outbox.MessageId;
import com.ivamare.cqrs.outbox.OutboxMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMessageOutboxRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryMessageOutboxRepository outbox;

    @BeforeEach
    void setUp() {
        outbox = new InMemoryMessageOutboxRepository(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    class SaveTests {

        @Test
        void shouldAssignSequentialIds() {
            MessageId first = outbox.save(new AccountOpened("a", 1));
            MessageId second = outbox.save(new MoneyDeposited("a", 1, 2));

            assertEquals("m-1", first.value());
            assertEquals("m-2", second.value());
        }

        @Test
        void shouldSaveAsPendingWithZeroRetries() {
            MessageId id = outbox.save(new AccountOpened("a", 1));

            OutboxMessage message = outbox.find(id).orElseThrow();
            assertTrue(message.isPending());
            assertEquals(0, message.retryCount());
            assertNull(message.nextAttemptAt());
        }
    }

    @Nested
    class FindUnpublishedTests {

        @Test
        void shouldReturnOldestFirstUpToLimit() {
            AccountOpened opened = new AccountOpened("a", 1);
            MoneyDeposited deposited = new MoneyDeposited("a", 1, 2);
            outbox.save(opened);
            outbox.save(deposited);
            outbox.save(new MoneyWithdrawn("a", 1, 1));

            List<OutboxMessage> batch = outbox.findUnpublished(2);

            assertEquals(2, batch.size());
            assertSame(opened, batch.get(0).event());
            assertSame(deposited, batch.get(1).event());
        }

        @Test
        void shouldSkipPublishedMessages() {
            MessageId id = outbox.save(new AccountOpened("a", 1));
            outbox.save(new MoneyDeposited("a", 1, 2));

            outbox.markAsPublished(id);

            assertEquals(1, outbox.findUnpublished().size());
            assertEquals(1, outbox.countUnpublished());
            assertEquals(2, outbox.size());
        }

        @Test
        void shouldReturnEmptyForNonPositiveLimit() {
            outbox.save(new AccountOpened("a", 1));

            assertTrue(outbox.findUnpublished(0).isEmpty());
        }

        @Test
        void shouldHoldBackMessagesScheduledForLater() {
            MessageId later = outbox.save(new AccountOpened("a", 1));
            MessageId due = outbox.save(new MoneyDeposited("a", 1, 2));
            outbox.scheduleNextAttempt(later, NOW.plusSeconds(60));
            outbox.scheduleNextAttempt(due, NOW);

            List<OutboxMessage> batch = outbox.findUnpublished();

            assertEquals(1, batch.size());
            assertEquals(due, batch.get(0).id());
        }
    }

    @Nested
    class LifecycleTests {

        @Test
        void shouldMarkPublishedIdempotently() {
            MessageId id = outbox.save(new AccountOpened("a", 1));

            outbox.markAsPublished(id);
            outbox.markAsPublished(id);

            assertTrue(outbox.find(id).orElseThrow().published());
        }

        @Test
        void shouldIncrementRetryCountOfPendingMessages() {
            MessageId id = outbox.save(new AccountOpened("a", 1));

            outbox.incrementRetryCount(id);
            outbox.incrementRetryCount(id);

            assertEquals(2, outbox.find(id).orElseThrow().retryCount());
        }

        @Test
        void shouldNotIncrementRetryCountOfPublishedMessages() {
            MessageId id = outbox.save(new AccountOpened("a", 1));
            outbox.markAsPublished(id);

            outbox.incrementRetryCount(id);

            assertEquals(0, outbox.find(id).orElseThrow().retryCount());
        }

        @Test
        void shouldRemovePublishedMessagesFromThePendingSet() {
            MessageId first = outbox.save(new AccountOpened("a", 1));
            MessageId second = outbox.save(new MoneyDeposited("a", 1, 2));

            outbox.markAsPublished(first);

            assertEquals(1, outbox.countUnpublished());
            assertEquals(List.of(second), outbox.findUnpublished().stream().map(OutboxMessage::id).toList());
        }

        @Test
        void shouldKeepOnlyTheMostRecentPublishedMessages() {
            outbox = new InMemoryMessageOutboxRepository(Clock.fixed(NOW, ZoneOffset.UTC), 2);
            MessageId oldest = outbox.save(new AccountOpened("a", 1));
            MessageId middle = outbox.save(new MoneyDeposited("a", 1, 2));
            MessageId newest = outbox.save(new MoneyWithdrawn("a", 1, 1));
            MessageId waiting = outbox.save(new MoneyDeposited("a", 5, 6));

            outbox.markAsPublished(oldest);
            outbox.markAsPublished(middle);
            outbox.markAsPublished(newest);

            assertTrue(outbox.find(oldest).isEmpty());
            assertTrue(outbox.find(middle).orElseThrow().published());
            assertTrue(outbox.find(newest).orElseThrow().published());
            assertEquals(3, outbox.size());
            assertEquals(List.of(middle, newest, waiting), outbox.findAll().stream().map(OutboxMessage::id).toList());
        }

        @Test
        void shouldRejectNegativeHistory() {
            assertThrows(IllegalArgumentException.class,
                () -> new InMemoryMessageOutboxRepository(Clock.systemUTC(), -1));
        }

        @Test
        void shouldIgnoreUnknownIds() {
            outbox.markAsPublished(new MessageId("missing"));
            outbox.incrementRetryCount(new MessageId("missing"));

            assertEquals(0, outbox.size());
        }
    }
}
