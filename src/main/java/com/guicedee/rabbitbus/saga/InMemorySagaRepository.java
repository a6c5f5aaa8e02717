package com.guicedee.rabbitbus.saga;

import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps saga instances in process, expiring running and completed instances on their own windows
 */
@Log4j2
public class InMemorySagaRepository<I extends SagaInstance> implements SagaRepository<I>
{
    private final Map<UUID, I> instances = new ConcurrentHashMap<>();
    private final SagaConfiguration<I> configuration;
    private final Clock clock;

    public InMemorySagaRepository(SagaConfiguration<I> configuration)
    {
        this(configuration, Clock.systemUTC());
    }

    public InMemorySagaRepository(SagaConfiguration<I> configuration, Clock clock)
    {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void save(I instance)
    {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(instance.getCorrelationId(), "correlationId");
        Instant now = clock.instant();
        if (instance.getCreatedAt() == null)
        {
            instance.setCreatedAt(now);
        }
        instance.setUpdatedAt(now);
        if (instance.isCompleted())
        {
            instance.setExpiresAt(instance.getCompletedAt()
                                          .plus(configuration.getCompletedExpiration()));
        }
        else
        {
            instance.setExpiresAt(now.plus(configuration.getDefaultExpiration()));
        }
        instance.setVersion(instance.getVersion() + 1);
        instances.put(instance.getCorrelationId(), instance);
        log.trace("Saga '{}' saved in state '{}'", instance.getCorrelationId(), instance.getCurrentState());
    }

    @Override
    public Optional<I> find(UUID correlationId)
    {
        I instance = instances.get(correlationId);
        if (instance == null)
        {
            return Optional.empty();
        }
        if (isExpired(instance, clock.instant()))
        {
            instances.remove(correlationId, instance);
            return Optional.empty();
        }
        return Optional.of(instance);
    }

    @Override
    public boolean delete(UUID correlationId)
    {
        return instances.remove(correlationId) != null;
    }

    @Override
    public List<I> findTimedOut(Instant now)
    {
        List<I> timedOut = new ArrayList<>();
        for (I instance : instances.values())
        {
            if (!instance.isCompleted() && instance.getTimeoutAt() != null && !instance.getTimeoutAt()
                                                                                     .isAfter(now))
            {
                timedOut.add(instance);
            }
        }
        timedOut.sort(Comparator.comparing(SagaInstance::getTimeoutAt));
        return timedOut;
    }

    @Override
    public int purgeExpired(Instant now)
    {
        int purged = 0;
        for (Map.Entry<UUID, I> entry : instances.entrySet())
        {
            if (isExpired(entry.getValue(), now) && instances.remove(entry.getKey(), entry.getValue()))
            {
                purged++;
            }
        }
        if (purged > 0)
        {
            log.debug("Purged {} expired '{}' saga instances", purged, configuration.getInstanceType()
                                                                                    .getSimpleName());
        }
        return purged;
    }

    @Override
    public long count()
    {
        return instances.size();
    }

    private static boolean isExpired(SagaInstance instance, Instant now)
    {
        return instance.getExpiresAt() != null && !instance.getExpiresAt()
                                                           .isAfter(now);
    }
}
