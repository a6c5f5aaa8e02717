package com.guicedee.rabbitbus.saga;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SagaRepository<I extends SagaInstance>
{
    void save(I instance);

    Optional<I> find(UUID correlationId);

    boolean delete(UUID correlationId);

    /**
     * Instances whose timeout is at or before the given time
     */
    List<I> findTimedOut(Instant now);

    /**
     * @return the number of expired instances removed
     */
    int purgeExpired(Instant now);

    long count();
}
