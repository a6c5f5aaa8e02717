package com.guicedee.rabbitbus.outbox;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A process local outbox, lost on restart. Meant for development and tests.
 */
public class InMemoryOutboxStore implements OutboxStore
{
    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentNavigableMap<Long, OutboxMessage> messages = new ConcurrentSkipListMap<>();
    private final Map<String, Long> sequenceById = new ConcurrentHashMap<>();

    @Override
    public void add(OutboxMessage message)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(message.getId(), "message.id");
        OutboxMessage stored = message.copy();
        long next = sequence.incrementAndGet();
        stored.setSequence(next);
        message.setSequence(next);
        messages.put(next, stored);
        sequenceById.put(stored.getId(), next);
    }

    @Override
    public List<OutboxMessage> fetchDue(int limit, Instant now)
    {
        List<OutboxMessage> due = new ArrayList<>();
        for (OutboxMessage message : messages.values())
        {
            if (due.size() >= limit)
            {
                break;
            }
            if (message.getStatus() == OutboxStatus.Pending
                    && (message.getNextAttemptAt() == null || !message.getNextAttemptAt().isAfter(now)))
            {
                due.add(message.copy());
            }
        }
        return due;
    }

    @Override
    public List<OutboxMessage> fetchPending(int limit)
    {
        List<OutboxMessage> pending = new ArrayList<>();
        for (OutboxMessage message : messages.values())
        {
            if (pending.size() >= limit)
            {
                break;
            }
            if (message.getStatus() == OutboxStatus.Pending)
            {
                pending.add(message.copy());
            }
        }
        return pending;
    }

    @Override
    public void markPublished(String id, Instant publishedAt)
    {
        find(id).ifPresent(message -> message.setStatus(OutboxStatus.Published)
                .setPublishedAt(publishedAt)
                .setLastError(null));
    }

    @Override
    public void markRetry(String id, String error, Instant nextAttemptAt)
    {
        find(id).ifPresent(message -> message.setAttempts(message.getAttempts() + 1)
                .setLastError(error)
                .setNextAttemptAt(nextAttemptAt));
    }

    @Override
    public void markFailed(String id, String error)
    {
        find(id).ifPresent(message -> message.setAttempts(message.getAttempts() + 1)
                .setLastError(error)
                .setStatus(OutboxStatus.Failed));
    }

    @Override
    public boolean containsDeduplicationKey(String deduplicationKey, Instant since)
    {
        if (deduplicationKey == null)
        {
            return false;
        }
        for (OutboxMessage message : messages.values())
        {
            if (deduplicationKey.equals(message.getDeduplicationKey())
                    && message.getCreatedAt() != null && !message.getCreatedAt().isBefore(since))
            {
                return true;
            }
        }
        return false;
    }

    @Override
    public int purge(Instant publishedBefore, Instant failedBefore)
    {
        int removed = 0;
        Iterator<OutboxMessage> iterator = messages.values().iterator();
        while (iterator.hasNext())
        {
            OutboxMessage message = iterator.next();
            boolean expired = (message.getStatus() == OutboxStatus.Published && message.getPublishedAt() != null
                               && message.getPublishedAt().isBefore(publishedBefore))
                              || (message.getStatus() == OutboxStatus.Failed && message.getCreatedAt() != null
                                  && message.getCreatedAt().isBefore(failedBefore));
            if (expired)
            {
                iterator.remove();
                sequenceById.remove(message.getId());
                removed++;
            }
        }
        return removed;
    }

    @Override
    public long count(OutboxStatus status)
    {
        return messages.values().stream().filter(message -> message.getStatus() == status).count();
    }

    private Optional<OutboxMessage> find(String id)
    {
        Long key = sequenceById.get(id);
        return Optional.ofNullable(key == null ? null : messages.get(key));
    }
}
