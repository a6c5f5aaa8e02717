package com.guicedee.rabbitbus.saga;

import io.vertx.core.Vertx;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Polls a saga repository on a Vert.x periodic timer, delivering timeouts and purging expired instances
 */
@Log4j2
public class SagaTimeoutScheduler<I extends SagaInstance>
{
    private final Vertx vertx;
    private final SagaStateMachine<I> stateMachine;
    private final SagaRepository<I> repository;
    private final SagaConfiguration<I> configuration;
    private final Clock clock;

    private Long timerId;

    public SagaTimeoutScheduler(Vertx vertx, SagaStateMachine<I> stateMachine, SagaRepository<I> repository,
                                SagaConfiguration<I> configuration)
    {
        this(vertx, stateMachine, repository, configuration, Clock.systemUTC());
    }

    public SagaTimeoutScheduler(Vertx vertx, SagaStateMachine<I> stateMachine, SagaRepository<I> repository,
                                SagaConfiguration<I> configuration, Clock clock)
    {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return false when timeouts are disabled for this saga
     */
    public synchronized boolean start()
    {
        if (!configuration.isEnableTimeouts())
        {
            log.debug("Timeouts disabled for saga '{}'", stateMachine.getName());
            return false;
        }
        if (timerId != null)
        {
            return true;
        }
        long interval = Math.max(1L, configuration.getTimeoutCheckInterval()
                                                  .toMillis());
        timerId = vertx.setPeriodic(interval, id -> checkTimeouts());
        log.info("Saga '{}' timeout checks every {}ms", stateMachine.getName(), interval);
        return true;
    }

    public synchronized void stop()
    {
        if (timerId != null)
        {
            vertx.cancelTimer(timerId);
            timerId = null;
        }
    }

    public synchronized boolean isRunning()
    {
        return timerId != null;
    }

    /**
     * @return the number of instances whose timeout was handled
     */
    public int checkTimeouts()
    {
        Instant now = clock.instant();
        int handled = 0;
        for (I instance : repository.findTimedOut(now))
        {
            try
            {
                stateMachine.onTimeout(instance);
                instance.setTimeoutAt(null);
                repository.save(instance);
                handled++;
            }
            catch (Exception e)
            {
                log.error("Saga '{}' instance '{}' failed handling its timeout", stateMachine.getName(), instance.getCorrelationId(), e);
            }
        }
        repository.purgeExpired(now);
        return handled;
    }
}
