package com.guicedee.rabbitbus.outbox;

public enum OutboxMode
{
    None,
    InMemory,
    /**
     * Backed by an {@link OutboxStore} implementation supplied by the application
     */
    Persistent
}
