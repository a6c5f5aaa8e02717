package com.guicedee.rabbitbus.resilience;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyBuilderTest
{
    @Test
    void exponentialDoublesUpToTheCap()
    {
        RetryPolicyConfiguration policy = RetryPolicyBuilder.exponential(5, Duration.ofSeconds(1), Duration.ofSeconds(10)).build();

        assertEquals(RetryType.Exponential, policy.getRetryType());
        assertEquals(Duration.ofSeconds(1), policy.getDelay(1));
        assertEquals(Duration.ofSeconds(2), policy.getDelay(2));
        assertEquals(Duration.ofSeconds(4), policy.getDelay(3));
        assertEquals(Duration.ofSeconds(8), policy.getDelay(4));
        assertEquals(Duration.ofSeconds(10), policy.getDelay(5));
    }

    @Test
    void attemptsAreClampedToTheRetryCount()
    {
        RetryPolicyConfiguration policy = RetryPolicyBuilder.exponential(3, Duration.ofMillis(100)).build();

        assertEquals(Duration.ofMillis(100), policy.getDelay(0));
        assertEquals(Duration.ofMillis(100), policy.getDelay(-4));
        assertEquals(Duration.ofMillis(400), policy.getDelay(3));
        assertEquals(Duration.ofMillis(400), policy.getDelay(50));
    }

    @Test
    void customBaseIsValidated()
    {
        RetryPolicyConfiguration policy = RetryPolicyBuilder.exponential(3, Duration.ofMillis(100), Duration.ofMinutes(1), 3).build();
        assertEquals(Duration.ofMillis(900), policy.getDelay(3));
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicyBuilder.exponential(3, Duration.ofMillis(100), Duration.ofMinutes(1), 0.5));
    }

    @Test
    void intervalsAreUsedInOrder()
    {
        RetryPolicyConfiguration policy = RetryPolicyBuilder.intervals(Duration.ofMillis(50), Duration.ofMillis(500), Duration.ofSeconds(5)).build();

        assertEquals(3, policy.getRetryCount());
        assertEquals(Duration.ofMillis(50), policy.getDelay(1));
        assertEquals(Duration.ofMillis(500), policy.getDelay(2));
        assertEquals(Duration.ofSeconds(5), policy.getDelay(3));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicyBuilder.intervals());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicyBuilder.intervals(Duration.ofMillis(-1)));
    }

    @Test
    void incrementalAddsTheIncrementPerAttempt()
    {
        RetryPolicyConfiguration policy = RetryPolicyBuilder.incremental(4, Duration.ofMillis(200), Duration.ofMillis(300)).build();

        assertEquals(Duration.ofMillis(200), policy.getDelay(1));
        assertEquals(Duration.ofMillis(500), policy.getDelay(2));
        assertEquals(Duration.ofMillis(1100), policy.getDelay(4));
    }

    @Test
    void immediateAndFixedInterval()
    {
        assertEquals(Duration.ZERO, RetryPolicyBuilder.immediate(3).build().getDelay(2));
        assertEquals(Duration.ofSeconds(2), RetryPolicyBuilder.interval(3, Duration.ofSeconds(2)).build().getDelay(3));
    }

    @Test
    void jitterStaysWithinHalfThePercentEitherWay()
    {
        RetryPolicyConfiguration policy = RetryPolicyBuilder.interval(3, Duration.ofSeconds(1))
                .withJitter(20)
                .build();
        for (int i = 0; i < 500; i++)
        {
            long delay = policy.getDelay(1).toMillis();
            assertTrue(delay >= 900 && delay <= 1100, "delay " + delay);
        }
    }

    @Test
    void jitterNeverExceedsTheMaximum()
    {
        RetryPolicyConfiguration policy = RetryPolicyBuilder.exponential(4, Duration.ofSeconds(1), Duration.ofSeconds(2))
                .withJitter(100)
                .build();
        for (int i = 0; i < 500; i++)
        {
            assertTrue(policy.getDelay(4).toMillis() <= 2000);
        }
    }

    @Test
    void jitterOutsideRangeIsRejected()
    {
        RetryPolicyBuilder builder = new RetryPolicyBuilder();
        assertThrows(IllegalArgumentException.class, () -> builder.withJitter(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.withJitter(100.5));
        assertThrows(IllegalArgumentException.class, () -> builder.retryCount(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.initialInterval(Duration.ofMillis(-5)));
    }

    @Test
    void defaultPolicyRetriesEverything()
    {
        RetryPolicyConfiguration policy = new RetryPolicyBuilder().build();

        assertEquals(RetryPolicyBuilder.DEFAULT_RETRY_COUNT, policy.getRetryCount());
        assertTrue(policy.shouldRetry(new IllegalStateException()));
        assertFalse(policy.shouldRetry(null));
        assertSame(ExceptionFilter.all(), policy.getExceptionFilter());
    }

    @Test
    void ignoredExceptionsWinOverHandled()
    {
        RetryPolicyConfiguration policy = new RetryPolicyBuilder()
                .handle(IOException.class)
                .handle(failure -> failure instanceof TimeoutException)
                .ignore(failure -> "fatal".equals(failure.getMessage()))
                .build();

        assertTrue(policy.shouldRetry(new IOException("connection reset")));
        assertTrue(policy.shouldRetry(new TimeoutException()));
        assertFalse(policy.shouldRetry(new IOException("fatal")));
        assertFalse(policy.shouldRetry(new IllegalArgumentException()));
    }

    @Test
    void ignoreOnlyAcceptsEverythingElse()
    {
        RetryPolicyConfiguration policy = new RetryPolicyBuilder()
                .ignore(IllegalArgumentException.class)
                .build();

        assertFalse(policy.shouldRetry(new NumberFormatException()));
        assertTrue(policy.shouldRetry(new IllegalStateException()));
    }
}
