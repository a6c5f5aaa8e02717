package com.guicedee.rabbitbus.outbox;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Durable storage behind the outbox. Implementations must keep insertion order through {@link OutboxMessage#getSequence()}.
 */
public interface OutboxStore
{
    /**
     * Stores a pending message and assigns its sequence
     */
    void add(OutboxMessage message);

    default void addAll(Collection<OutboxMessage> messages)
    {
        for (OutboxMessage message : messages)
        {
            add(message);
        }
    }

    /**
     * Pending messages due at the given time, in insertion order
     */
    List<OutboxMessage> fetchDue(int limit, Instant now);

    /**
     * Pending messages in insertion order, including those waiting for a retry
     */
    List<OutboxMessage> fetchPending(int limit);

    void markPublished(String id, Instant publishedAt);

    /**
     * Counts a failed attempt and schedules the next one
     */
    void markRetry(String id, String error, Instant nextAttemptAt);

    /**
     * Counts a failed attempt and stops retrying the message
     */
    void markFailed(String id, String error);

    /**
     * @return true when a message with the key was stored at or after the given time
     */
    boolean containsDeduplicationKey(String deduplicationKey, Instant since);

    /**
     * Removes published messages older than the first cut off and failed messages older than the second
     *
     * @return the number removed
     */
    int purge(Instant publishedBefore, Instant failedBefore);

    long count(OutboxStatus status);
}
