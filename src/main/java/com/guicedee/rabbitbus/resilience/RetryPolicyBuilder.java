package com.guicedee.rabbitbus.resilience;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Builds a {@link RetryPolicyConfiguration}, starting from one of the named retry shapes
 * <pre>{@code
 * RetryPolicyConfiguration policy = RetryPolicyBuilder.exponential(4, Duration.ofSeconds(1), Duration.ofSeconds(10))
 *         .withJitter(10)
 *         .ignore(IllegalArgumentException.class)
 *         .build();
 * }</pre>
 */
public class RetryPolicyBuilder
{
    public static final int DEFAULT_RETRY_COUNT = 3;
    public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofMinutes(5);
    public static final double DEFAULT_EXPONENTIAL_BASE = 2.0;
    public static final double DEFAULT_JITTER_PERCENT = 20;

    private RetryType retryType = RetryType.Exponential;
    private int retryCount = DEFAULT_RETRY_COUNT;
    private Duration initialInterval = DEFAULT_INITIAL_INTERVAL;
    private Duration maxInterval = DEFAULT_MAX_INTERVAL;
    private double exponentialBase = DEFAULT_EXPONENTIAL_BASE;
    private Duration intervalIncrement = Duration.ofSeconds(1);
    private List<Duration> customIntervals = new ArrayList<>();
    private boolean jitterEnabled;
    private double jitterPercent = DEFAULT_JITTER_PERCENT;
    private final ExceptionFilter.Builder exceptionFilter = ExceptionFilter.builder();

    /**
     * Exponential backoff with the default count and intervals
     */
    public RetryPolicyBuilder()
    {
    }

    public static RetryPolicyBuilder immediate(int retryCount)
    {
        return new RetryPolicyBuilder()
                .type(RetryType.Immediate)
                .retryCount(retryCount)
                .initialInterval(Duration.ZERO);
    }

    public static RetryPolicyBuilder interval(int retryCount, Duration interval)
    {
        return new RetryPolicyBuilder()
                .type(RetryType.FixedInterval)
                .retryCount(retryCount)
                .initialInterval(interval);
    }

    /**
     * One retry per interval, in order
     */
    public static RetryPolicyBuilder intervals(Duration... intervals)
    {
        Objects.requireNonNull(intervals, "intervals");
        if (intervals.length == 0)
        {
            throw new IllegalArgumentException("At least one interval is required");
        }
        RetryPolicyBuilder builder = new RetryPolicyBuilder()
                .type(RetryType.CustomIntervals)
                .retryCount(intervals.length)
                .initialInterval(intervals[0]);
        for (Duration interval : intervals)
        {
            requireNonNegative(interval, "interval");
        }
        builder.customIntervals = new ArrayList<>(Arrays.asList(intervals));
        return builder;
    }

    public static RetryPolicyBuilder exponential(int retryCount, Duration initialInterval)
    {
        return exponential(retryCount, initialInterval, DEFAULT_MAX_INTERVAL);
    }

    public static RetryPolicyBuilder exponential(int retryCount, Duration initialInterval, Duration maxInterval)
    {
        return exponential(retryCount, initialInterval, maxInterval, DEFAULT_EXPONENTIAL_BASE);
    }

    public static RetryPolicyBuilder exponential(int retryCount, Duration initialInterval, Duration maxInterval, double base)
    {
        if (!(base >= 1.0))
        {
            throw new IllegalArgumentException("Exponential base must be at least 1 but was " + base);
        }
        RetryPolicyBuilder builder = new RetryPolicyBuilder()
                .type(RetryType.Exponential)
                .retryCount(retryCount)
                .initialInterval(initialInterval)
                .maxInterval(maxInterval);
        builder.exponentialBase = base;
        return builder;
    }

    public static RetryPolicyBuilder incremental(int retryCount, Duration initialInterval, Duration increment)
    {
        RetryPolicyBuilder builder = new RetryPolicyBuilder()
                .type(RetryType.Incremental)
                .retryCount(retryCount)
                .initialInterval(initialInterval);
        builder.intervalIncrement = requireNonNegative(increment, "increment");
        return builder;
    }

    public RetryPolicyBuilder retryCount(int retryCount)
    {
        if (retryCount < 0)
        {
            throw new IllegalArgumentException("retryCount cannot be negative but was " + retryCount);
        }
        this.retryCount = retryCount;
        return this;
    }

    public RetryPolicyBuilder initialInterval(Duration initialInterval)
    {
        this.initialInterval = requireNonNegative(initialInterval, "initialInterval");
        return this;
    }

    public RetryPolicyBuilder maxInterval(Duration maxInterval)
    {
        this.maxInterval = requireNonNegative(maxInterval, "maxInterval");
        return this;
    }

    public RetryPolicyBuilder withJitter()
    {
        return withJitter(DEFAULT_JITTER_PERCENT);
    }

    /**
     * Spreads each delay by up to half the percentage either way
     *
     * @param percent 0 to 100
     */
    public RetryPolicyBuilder withJitter(double percent)
    {
        if (!(percent >= 0 && percent <= 100))
        {
            throw new IllegalArgumentException("Jitter percent must be between 0 and 100 but was " + percent);
        }
        this.jitterEnabled = true;
        this.jitterPercent = percent;
        return this;
    }

    public RetryPolicyBuilder handle(Class<? extends Throwable> type)
    {
        exceptionFilter.handle(type);
        return this;
    }

    public RetryPolicyBuilder handle(Predicate<Throwable> predicate)
    {
        exceptionFilter.handle(predicate);
        return this;
    }

    public RetryPolicyBuilder ignore(Class<? extends Throwable> type)
    {
        exceptionFilter.ignore(type);
        return this;
    }

    public RetryPolicyBuilder ignore(Predicate<Throwable> predicate)
    {
        exceptionFilter.ignore(predicate);
        return this;
    }

    public RetryPolicyConfiguration build()
    {
        return new RetryPolicyConfiguration(retryType, retryCount, initialInterval, maxInterval, exponentialBase, intervalIncrement,
                customIntervals, jitterEnabled, jitterPercent, exceptionFilter.build());
    }

    private RetryPolicyBuilder type(RetryType retryType)
    {
        this.retryType = retryType;
        return this;
    }

    private static Duration requireNonNegative(Duration duration, String name)
    {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative())
        {
            throw new IllegalArgumentException(name + " cannot be negative");
        }
        return duration;
    }
}
