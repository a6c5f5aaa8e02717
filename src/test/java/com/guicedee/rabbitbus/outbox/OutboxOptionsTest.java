package com.guicedee.rabbitbus.outbox;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OutboxOptionsTest
{
    @Test
    void defaults()
    {
        OutboxOptions options = OutboxOptions.defaults();

        assertEquals(Duration.ofSeconds(1), options.getPublishInterval());
        assertEquals(100, options.getBatchSize());
        assertEquals(5, options.getMaxRetries());
        assertTrue(options.isUseExponentialBackoff());
        assertTrue(options.isEnableDeduplication());
        assertFalse(options.isEnableOrdering());
        assertEquals(0, options.getCompressionThreshold());
        assertSame(options, options.validate());
    }

    @Test
    void presetsAreValid()
    {
        assertSame(OutboxOptions.HIGH_THROUGHPUT, OutboxOptions.HIGH_THROUGHPUT.validate());
        assertSame(OutboxOptions.HIGH_RELIABILITY, OutboxOptions.HIGH_RELIABILITY.validate());
        assertSame(OutboxOptions.LOW_LATENCY, OutboxOptions.LOW_LATENCY.validate());
        assertTrue(OutboxOptions.HIGH_RELIABILITY.isEnableOrdering());
        assertEquals(Duration.ZERO, OutboxOptions.LOW_LATENCY.getRetryDelay());
    }

    @Test
    void toBuilderKeepsTheOtherValues()
    {
        OutboxOptions options = OutboxOptions.HIGH_RELIABILITY.toBuilder().batchSize(5).build();

        assertEquals(5, options.getBatchSize());
        assertEquals(10, options.getMaxRetries());
        assertEquals(20, OutboxOptions.HIGH_RELIABILITY.getBatchSize());
    }

    @Test
    void outOfRangeValuesAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> OutboxOptions.builder().batchSize(0).build().validate());
        assertThrows(IllegalArgumentException.class, () -> OutboxOptions.builder().maxRetries(-1).build().validate());
        assertThrows(IllegalArgumentException.class, () -> OutboxOptions.builder().publishInterval(Duration.ZERO).build().validate());
        assertThrows(IllegalArgumentException.class, () -> OutboxOptions.builder().retryDelay(Duration.ofSeconds(-1)).build().validate());
        assertThrows(IllegalArgumentException.class, () -> OutboxOptions.builder().compressionThreshold(-5).build().validate());
        assertThrows(NullPointerException.class, () -> OutboxOptions.builder().cleanupInterval(null).build().validate());
    }
}
