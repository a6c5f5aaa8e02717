package com.guicedee.rabbitbus.outbox;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryOutboxStoreTest
{
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private InMemoryOutboxStore store;

    @BeforeEach
    void setUp()
    {
        store = new InMemoryOutboxStore();
    }

    static OutboxMessage message(String id)
    {
        return new OutboxMessage()
                .setId(id)
                .setExchange("orders")
                .setRoutingKey("orders.created")
                .setPayload(id.getBytes(StandardCharsets.UTF_8))
                .setCreatedAt(NOW);
    }

    @Test
    void fetchKeepsInsertionOrderAndLimit()
    {
        store.add(message("c"));
        store.add(message("a"));
        store.add(message("b"));

        List<OutboxMessage> due = store.fetchDue(2, NOW);

        assertEquals(List.of("c", "a"), List.of(due.get(0).getId(), due.get(1).getId()));
        assertTrue(due.get(0).getSequence() < due.get(1).getSequence());
    }

    @Test
    void addAssignsTheSequenceToTheCaller()
    {
        OutboxMessage first = message("first");
        store.add(first);
        assertEquals(1, first.getSequence());
    }

    @Test
    void fetchedMessagesAreCopies()
    {
        store.add(message("a"));
        store.fetchDue(10, NOW).get(0).setStatus(OutboxStatus.Failed);

        assertEquals(1, store.count(OutboxStatus.Pending));
    }

    @Test
    void retryScheduleHidesTheMessageUntilDue()
    {
        store.add(message("a"));
        store.markRetry("a", "nack", NOW.plusSeconds(30));

        assertTrue(store.fetchDue(10, NOW).isEmpty());
        OutboxMessage due = store.fetchDue(10, NOW.plusSeconds(30)).get(0);
        assertEquals(1, due.getAttempts());
        assertEquals("nack", due.getLastError());
    }

    @Test
    void pendingFetchIncludesMessagesWaitingForRetry()
    {
        store.add(message("a"));
        store.add(message("b"));
        store.add(message("c"));
        store.markRetry("a", "nack", NOW.plusSeconds(30));
        store.markPublished("b", NOW);

        List<OutboxMessage> pending = store.fetchPending(10);

        assertEquals(List.of("a", "c"), List.of(pending.get(0).getId(), pending.get(1).getId()));
        assertEquals(1, store.fetchPending(1).size());
        assertEquals("c", store.fetchDue(10, NOW).get(0).getId());
    }

    @Test
    void publishedAndFailedMessagesAreNotDue()
    {
        store.add(message("a"));
        store.add(message("b"));
        store.markPublished("a", NOW);
        store.markFailed("b", "unroutable");

        assertTrue(store.fetchDue(10, NOW).isEmpty());
        assertEquals(1, store.count(OutboxStatus.Published));
        assertEquals(1, store.count(OutboxStatus.Failed));
    }

    @Test
    void unknownIdsAreIgnored()
    {
        assertDoesNotThrow(() -> store.markPublished("missing", NOW));
        assertDoesNotThrow(() -> store.markFailed("missing", "error"));
    }

    @Test
    void deduplicationKeyLookupRespectsTheWindow()
    {
        store.add(message("a").setDeduplicationKey("order-1"));

        assertTrue(store.containsDeduplicationKey("order-1", NOW.minus(Duration.ofMinutes(10))));
        assertFalse(store.containsDeduplicationKey("order-1", NOW.plusSeconds(1)));
        assertFalse(store.containsDeduplicationKey("order-2", NOW.minus(Duration.ofMinutes(10))));
        assertFalse(store.containsDeduplicationKey(null, NOW));
    }

    @Test
    void purgeRemovesExpiredPublishedAndFailed()
    {
        store.add(message("old-published"));
        store.add(message("new-published"));
        store.add(message("old-failed"));
        store.add(message("pending"));
        store.markPublished("old-published", NOW.minus(Duration.ofDays(8)));
        store.markPublished("new-published", NOW);
        store.markFailed("old-failed", "error");

        int removed = store.purge(NOW.minus(Duration.ofDays(7)), NOW.plusSeconds(1));

        assertEquals(2, removed);
        assertEquals(1, store.count(OutboxStatus.Published));
        assertEquals(0, store.count(OutboxStatus.Failed));
        assertEquals(1, store.count(OutboxStatus.Pending));
    }

    @Test
    void messageWithoutIdIsRejected()
    {
        assertThrows(NullPointerException.class, () -> store.add(new OutboxMessage()));
    }
}
