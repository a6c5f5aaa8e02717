package com.guicedee.rabbitbus.resilience;

import lombok.Getter;

import java.time.Duration;
import java.util.function.BiConsumer;

/**
 * Immutable circuit breaker thresholds and transition callbacks, created by {@link CircuitBreakerPolicyBuilder}
 */
@Getter
public class CircuitBreakerPolicyConfiguration
{
    private final Duration trackingPeriod;
    private final int tripThreshold;
    private final int activeThreshold;
    private final Duration resetInterval;
    /**
     * Percentage of failed requests in the tracking period that opens the circuit, 0 turns the rate check off
     */
    private final double failureRateThreshold;
    private final Duration halfOpenDuration;
    private final int successThreshold;
    private final ExceptionFilter exceptionFilter;
    private final BiConsumer<Throwable, Duration> onBreak;
    private final Runnable onReset;
    private final Runnable onHalfOpen;

    CircuitBreakerPolicyConfiguration(Duration trackingPeriod, int tripThreshold, int activeThreshold, Duration resetInterval,
                                      double failureRateThreshold, Duration halfOpenDuration, int successThreshold,
                                      ExceptionFilter exceptionFilter, BiConsumer<Throwable, Duration> onBreak, Runnable onReset,
                                      Runnable onHalfOpen)
    {
        this.trackingPeriod = trackingPeriod;
        this.tripThreshold = tripThreshold;
        this.activeThreshold = activeThreshold;
        this.resetInterval = resetInterval;
        this.failureRateThreshold = failureRateThreshold;
        this.halfOpenDuration = halfOpenDuration;
        this.successThreshold = successThreshold;
        this.exceptionFilter = exceptionFilter;
        this.onBreak = onBreak;
        this.onReset = onReset;
        this.onHalfOpen = onHalfOpen;
    }

    /**
     * @return true when the failure counts toward opening the circuit
     */
    public boolean shouldCount(Throwable failure)
    {
        return exceptionFilter.matches(failure);
    }

    /**
     * Either trip condition is enough, both need the minimum request volume
     */
    public boolean shouldTrip(int requests, int failures)
    {
        if (requests < activeThreshold)
        {
            return false;
        }
        if (failures >= tripThreshold)
        {
            return true;
        }
        return failureRateThreshold > 0 && requests > 0 && failures * 100d / requests >= failureRateThreshold;
    }
}
