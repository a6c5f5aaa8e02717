package com.guicedee.rabbitbus.saga;

public enum SagaPersistence
{
    /**
     * Process local, lost on restart
     */
    InMemory,
    Redis,
    /**
     * A relational store through an application supplied {@link SagaRepository}
     */
    Relational,
    MongoDb
}
