package com.guicedee.rabbitbus.outbox;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Objects;

/**
 * Outbox polling, retry and retention settings. Instances are immutable and safe to share with the publishing loop.
 */
@Value
@Builder(toBuilder = true)
public class OutboxOptions
{
    /**
     * Many messages per cycle on a fast poll, no ordering or deduplication
     */
    public static final OutboxOptions HIGH_THROUGHPUT = OutboxOptions.builder()
            .publishInterval(Duration.ofMillis(100))
            .batchSize(500)
            .maxRetries(3)
            .enableOrdering(false)
            .enableDeduplication(false)
            .compressionThreshold(4096)
            .build();

    /**
     * Small ordered batches on a slow poll, deduplicated and kept for a long time
     */
    public static final OutboxOptions HIGH_RELIABILITY = OutboxOptions.builder()
            .publishInterval(Duration.ofSeconds(5))
            .batchSize(20)
            .maxRetries(10)
            .retryDelay(Duration.ofSeconds(10))
            .maxRetryDelay(Duration.ofHours(1))
            .enableOrdering(true)
            .enableDeduplication(true)
            .deduplicationWindow(Duration.ofHours(24))
            .processedRetention(Duration.ofDays(30))
            .failedRetention(Duration.ofDays(90))
            .build();

    /**
     * A very fast poll with small batches, one retry and no backoff
     */
    public static final OutboxOptions LOW_LATENCY = OutboxOptions.builder()
            .publishInterval(Duration.ofMillis(10))
            .batchSize(10)
            .maxRetries(1)
            .retryDelay(Duration.ZERO)
            .useExponentialBackoff(false)
            .enableDeduplication(false)
            .build();

    @Builder.Default
    Duration publishInterval = Duration.ofSeconds(1);
    @Builder.Default
    int batchSize = 100;
    @Builder.Default
    int maxRetries = 5;
    @Builder.Default
    Duration retryDelay = Duration.ofSeconds(5);
    @Builder.Default
    boolean useExponentialBackoff = true;
    @Builder.Default
    Duration maxRetryDelay = Duration.ofMinutes(5);
    @Builder.Default
    Duration processedRetention = Duration.ofDays(7);
    @Builder.Default
    Duration failedRetention = Duration.ofDays(30);
    @Builder.Default
    Duration cleanupInterval = Duration.ofHours(1);
    @Builder.Default
    boolean enableDeduplication = true;
    @Builder.Default
    Duration deduplicationWindow = Duration.ofMinutes(10);
    boolean enableOrdering;
    /**
     * Payloads larger than this many bytes are gzipped, 0 never compresses
     */
    int compressionThreshold;

    public static OutboxOptions defaults()
    {
        return OutboxOptions.builder().build();
    }

    /**
     * @return this instance
     * @throws IllegalArgumentException when a value is out of range
     */
    public OutboxOptions validate()
    {
        requirePositive(publishInterval, "publishInterval");
        requirePositive(cleanupInterval, "cleanupInterval");
        requireNonNegative(retryDelay, "retryDelay");
        requireNonNegative(maxRetryDelay, "maxRetryDelay");
        requireNonNegative(processedRetention, "processedRetention");
        requireNonNegative(failedRetention, "failedRetention");
        requireNonNegative(deduplicationWindow, "deduplicationWindow");
        if (batchSize < 1)
        {
            throw new IllegalArgumentException("batchSize must be at least 1 but was " + batchSize);
        }
        if (maxRetries < 0)
        {
            throw new IllegalArgumentException("maxRetries cannot be negative but was " + maxRetries);
        }
        if (compressionThreshold < 0)
        {
            throw new IllegalArgumentException("compressionThreshold cannot be negative but was " + compressionThreshold);
        }
        return this;
    }

    private static void requirePositive(Duration duration, String name)
    {
        requireNonNegative(duration, name);
        if (duration.isZero())
        {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static void requireNonNegative(Duration duration, String name)
    {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative())
        {
            throw new IllegalArgumentException(name + " cannot be negative");
        }
    }
}
