package com.guicedee.rabbitbus.resilience;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

public class CircuitBreakerPolicyBuilder
{
    private Duration trackingPeriod = Duration.ofMinutes(1);
    private int tripThreshold = 15;
    private int activeThreshold = 10;
    private Duration resetInterval = Duration.ofMinutes(5);
    private double failureRateThreshold = 50;
    private Duration halfOpenDuration = Duration.ofSeconds(30);
    private int successThreshold = 3;
    private final ExceptionFilter.Builder exceptionFilter = ExceptionFilter.builder();
    private BiConsumer<Throwable, Duration> onBreak = (failure, interval) -> {};
    private Runnable onReset = () -> {};
    private Runnable onHalfOpen = () -> {};

    public CircuitBreakerPolicyBuilder trackingPeriod(Duration trackingPeriod)
    {
        this.trackingPeriod = requirePositive(trackingPeriod, "trackingPeriod");
        return this;
    }

    public CircuitBreakerPolicyBuilder tripThreshold(int tripThreshold)
    {
        this.tripThreshold = requireAtLeastOne(tripThreshold, "tripThreshold");
        return this;
    }

    public CircuitBreakerPolicyBuilder activeThreshold(int activeThreshold)
    {
        this.activeThreshold = requireAtLeastOne(activeThreshold, "activeThreshold");
        return this;
    }

    public CircuitBreakerPolicyBuilder resetInterval(Duration resetInterval)
    {
        this.resetInterval = requirePositive(resetInterval, "resetInterval");
        return this;
    }

    /**
     * @param percent 0 to 100, 0 leaves only the failure count check
     */
    public CircuitBreakerPolicyBuilder failureRateThreshold(double percent)
    {
        if (!(percent >= 0 && percent <= 100))
        {
            throw new IllegalArgumentException("Failure rate threshold must be between 0 and 100 but was " + percent);
        }
        this.failureRateThreshold = percent;
        return this;
    }

    public CircuitBreakerPolicyBuilder halfOpenDuration(Duration halfOpenDuration)
    {
        this.halfOpenDuration = requirePositive(halfOpenDuration, "halfOpenDuration");
        return this;
    }

    public CircuitBreakerPolicyBuilder successThreshold(int successThreshold)
    {
        this.successThreshold = requireAtLeastOne(successThreshold, "successThreshold");
        return this;
    }

    public CircuitBreakerPolicyBuilder handle(Class<? extends Throwable> type)
    {
        exceptionFilter.handle(type);
        return this;
    }

    public CircuitBreakerPolicyBuilder handle(Predicate<Throwable> predicate)
    {
        exceptionFilter.handle(predicate);
        return this;
    }

    public CircuitBreakerPolicyBuilder ignore(Class<? extends Throwable> type)
    {
        exceptionFilter.ignore(type);
        return this;
    }

    public CircuitBreakerPolicyBuilder ignore(Predicate<Throwable> predicate)
    {
        exceptionFilter.ignore(predicate);
        return this;
    }

    /**
     * @param onBreak receives the failure that opened the circuit and the time until the circuit half opens
     */
    public CircuitBreakerPolicyBuilder onBreak(BiConsumer<Throwable, Duration> onBreak)
    {
        this.onBreak = Objects.requireNonNull(onBreak, "onBreak");
        return this;
    }

    public CircuitBreakerPolicyBuilder onReset(Runnable onReset)
    {
        this.onReset = Objects.requireNonNull(onReset, "onReset");
        return this;
    }

    public CircuitBreakerPolicyBuilder onHalfOpen(Runnable onHalfOpen)
    {
        this.onHalfOpen = Objects.requireNonNull(onHalfOpen, "onHalfOpen");
        return this;
    }

    public CircuitBreakerPolicyConfiguration build()
    {
        return new CircuitBreakerPolicyConfiguration(trackingPeriod, tripThreshold, activeThreshold, resetInterval, failureRateThreshold,
                halfOpenDuration, successThreshold, exceptionFilter.build(), onBreak, onReset, onHalfOpen);
    }

    private static int requireAtLeastOne(int value, String name)
    {
        if (value < 1)
        {
            throw new IllegalArgumentException(name + " must be at least 1 but was " + value);
        }
        return value;
    }

    private static Duration requirePositive(Duration duration, String name)
    {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative() || duration.isZero())
        {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return duration;
    }
}
