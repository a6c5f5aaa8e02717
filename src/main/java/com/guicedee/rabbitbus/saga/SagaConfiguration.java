package com.guicedee.rabbitbus.saga;

import lombok.Value;

import java.time.Duration;

/**
 * How the instances of one saga type are stored, expired and checked for timeouts
 */
@Value
public class SagaConfiguration<I extends SagaInstance>
{
    Class<I> instanceType;
    SagaPersistence persistence;
    String connectionString;
    String databaseName;
    String keyPrefix;
    @SuppressWarnings("rawtypes")
    Class<? extends SagaRepository> repositoryType;
    Duration defaultExpiration;
    Duration completedExpiration;
    boolean enableTimeouts;
    Duration timeoutCheckInterval;
}
