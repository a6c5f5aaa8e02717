package com.guicedee.rabbitbus.resilience;

import lombok.Getter;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * An immutable retry policy, created by {@link RetryPolicyBuilder}.
 * <p>
 * Delays are computed per attempt, the policy holds no state between calls.
 */
@Getter
public class RetryPolicyConfiguration
{
    private final RetryType retryType;
    private final int retryCount;
    private final Duration initialInterval;
    private final Duration maxInterval;
    private final double exponentialBase;
    private final Duration intervalIncrement;
    private final List<Duration> customIntervals;
    private final boolean jitterEnabled;
    private final double jitterPercent;
    private final ExceptionFilter exceptionFilter;

    RetryPolicyConfiguration(RetryType retryType, int retryCount, Duration initialInterval, Duration maxInterval, double exponentialBase,
                             Duration intervalIncrement, List<Duration> customIntervals, boolean jitterEnabled, double jitterPercent,
                             ExceptionFilter exceptionFilter)
    {
        this.retryType = retryType;
        this.retryCount = retryCount;
        this.initialInterval = initialInterval;
        this.maxInterval = maxInterval;
        this.exponentialBase = exponentialBase;
        this.intervalIncrement = intervalIncrement;
        this.customIntervals = List.copyOf(customIntervals);
        this.jitterEnabled = jitterEnabled;
        this.jitterPercent = jitterPercent;
        this.exceptionFilter = exceptionFilter;
    }

    /**
     * The wait before the given retry attempt, never negative and never above the maximum interval.
     *
     * @param attempt the retry attempt starting at 1, clamped to the retry count
     */
    public Duration getDelay(int attempt)
    {
        int clamped = Math.min(Math.max(attempt, 1), Math.max(retryCount, 1));
        double maxMs = maxInterval.toMillis();
        double delayMs;
        switch (retryType)
        {
            case Immediate:
                delayMs = 0;
                break;
            case CustomIntervals:
                delayMs = clamped <= customIntervals.size()
                          ? customIntervals.get(clamped - 1).toMillis()
                          : initialInterval.toMillis();
                break;
            case Exponential:
                delayMs = initialInterval.toMillis() * Math.pow(exponentialBase, clamped - 1);
                break;
            case Incremental:
                delayMs = initialInterval.toMillis() + (double) intervalIncrement.toMillis() * (clamped - 1);
                break;
            case FixedInterval:
            default:
                delayMs = initialInterval.toMillis();
                break;
        }
        delayMs = Math.min(delayMs, maxMs);
        if (jitterEnabled && delayMs > 0)
        {
            double range = delayMs * jitterPercent / 100d;
            delayMs += (ThreadLocalRandom.current().nextDouble() * 2d - 1d) * range / 2d;
            delayMs = Math.max(0d, Math.min(delayMs, maxMs));
        }
        return Duration.ofMillis(Math.round(delayMs));
    }

    /**
     * @return true when the failure should be retried
     */
    public boolean shouldRetry(Throwable failure)
    {
        return exceptionFilter.matches(failure);
    }
}
