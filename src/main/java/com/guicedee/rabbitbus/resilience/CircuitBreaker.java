package com.guicedee.rabbitbus.resilience;

import io.vertx.core.Future;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One logical circuit driven by a {@link CircuitBreakerPolicyConfiguration}.
 * <p>
 * Requests and counted failures are kept for the tracking period. All counters sit behind one lock per circuit,
 * transition callbacks run after the lock is released.
 */
@Log4j2
public class CircuitBreaker
{
    @Getter
    private final String name;
    @Getter
    private final CircuitBreakerPolicyConfiguration policy;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Deque<Instant> requests = new ArrayDeque<>();
    private final Deque<Instant> failures = new ArrayDeque<>();
    private CircuitBreakerState state = CircuitBreakerState.Closed;
    private Instant openedAt;
    private Instant halfOpenedAt;
    private int halfOpenSuccesses;

    public CircuitBreaker(String name, CircuitBreakerPolicyConfiguration policy)
    {
        this(name, policy, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerPolicyConfiguration policy, Clock clock)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CircuitBreakerState getState()
    {
        Runnable notification;
        CircuitBreakerState current;
        lock.lock();
        try
        {
            notification = advance(clock.instant());
            current = state;
        }
        finally
        {
            lock.unlock();
        }
        run(notification);
        return current;
    }

    /**
     * @return false while the circuit is open
     */
    public boolean allowRequest()
    {
        return getState() != CircuitBreakerState.Open;
    }

    public void recordSuccess()
    {
        Runnable notification;
        lock.lock();
        try
        {
            Instant now = clock.instant();
            notification = advance(now);
            if (state == CircuitBreakerState.HalfOpen)
            {
                halfOpenSuccesses++;
                if (halfOpenSuccesses >= policy.getSuccessThreshold())
                {
                    notification = chain(notification, close());
                }
            }
            else if (state == CircuitBreakerState.Closed)
            {
                requests.addLast(now);
                prune(now);
            }
        }
        finally
        {
            lock.unlock();
        }
        run(notification);
    }

    /**
     * Records a failed request. Failures the policy does not count are ignored.
     */
    public void recordFailure(Throwable failure)
    {
        if (!policy.shouldCount(failure))
        {
            return;
        }
        Runnable notification;
        lock.lock();
        try
        {
            Instant now = clock.instant();
            notification = advance(now);
            if (state == CircuitBreakerState.HalfOpen)
            {
                notification = chain(notification, open(now, failure));
            }
            else if (state == CircuitBreakerState.Closed)
            {
                requests.addLast(now);
                failures.addLast(now);
                prune(now);
                if (policy.shouldTrip(requests.size(), failures.size()))
                {
                    notification = chain(notification, open(now, failure));
                }
            }
        }
        finally
        {
            lock.unlock();
        }
        run(notification);
    }

    /**
     * @throws CircuitBreakerOpenException when the circuit is open
     */
    public <T> T execute(Callable<T> action) throws Exception
    {
        Objects.requireNonNull(action, "action");
        if (!allowRequest())
        {
            throw new CircuitBreakerOpenException("Circuit '" + name + "' is open");
        }
        try
        {
            T result = action.call();
            recordSuccess();
            return result;
        }
        catch (Exception e)
        {
            recordFailure(e);
            throw e;
        }
    }

    public <T> Future<T> executeAsync(Supplier<Future<T>> action)
    {
        Objects.requireNonNull(action, "action");
        if (!allowRequest())
        {
            return Future.failedFuture(new CircuitBreakerOpenException("Circuit '" + name + "' is open"));
        }
        Future<T> future = action.get();
        future.onComplete(result -> {
            if (result.succeeded())
            {
                recordSuccess();
            }
            else
            {
                recordFailure(result.cause());
            }
        });
        return future;
    }

    /**
     * Closes the circuit and forgets the tracked requests
     */
    public void reset()
    {
        Runnable notification;
        lock.lock();
        try
        {
            notification = state == CircuitBreakerState.Closed ? null : close();
            requests.clear();
            failures.clear();
        }
        finally
        {
            lock.unlock();
        }
        run(notification);
    }

    private Runnable advance(Instant now)
    {
        if (state == CircuitBreakerState.Open && !now.isBefore(openedAt.plus(policy.getResetInterval())))
        {
            state = CircuitBreakerState.HalfOpen;
            halfOpenedAt = now;
            halfOpenSuccesses = 0;
            log.info("Circuit '{}' half open", name);
            return policy.getOnHalfOpen();
        }
        if (state == CircuitBreakerState.HalfOpen && !now.isBefore(halfOpenedAt.plus(policy.getHalfOpenDuration())))
        {
            return open(now, new TimeoutException("Circuit '" + name + "' did not recover within " + policy.getHalfOpenDuration()));
        }
        return null;
    }

    private Runnable open(Instant now, Throwable failure)
    {
        state = CircuitBreakerState.Open;
        openedAt = now;
        halfOpenSuccesses = 0;
        requests.clear();
        failures.clear();
        Duration resetInterval = policy.getResetInterval();
        log.warn("Circuit '{}' opened for {} - {}", name, resetInterval, failure.getMessage());
        return () -> policy.getOnBreak().accept(failure, resetInterval);
    }

    private Runnable close()
    {
        state = CircuitBreakerState.Closed;
        halfOpenSuccesses = 0;
        openedAt = null;
        halfOpenedAt = null;
        log.info("Circuit '{}' closed", name);
        return policy.getOnReset();
    }

    private void prune(Instant now)
    {
        Instant cutoff = now.minus(policy.getTrackingPeriod());
        while (!requests.isEmpty() && requests.peekFirst().isBefore(cutoff))
        {
            requests.pollFirst();
        }
        while (!failures.isEmpty() && failures.peekFirst().isBefore(cutoff))
        {
            failures.pollFirst();
        }
    }

    private static Runnable chain(Runnable first, Runnable second)
    {
        if (first == null)
        {
            return second;
        }
        if (second == null)
        {
            return first;
        }
        return () -> {
            first.run();
            second.run();
        };
    }

    private static void run(Runnable notification)
    {
        if (notification != null)
        {
            notification.run();
        }
    }
}
