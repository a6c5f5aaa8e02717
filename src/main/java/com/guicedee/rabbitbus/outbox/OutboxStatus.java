package com.guicedee.rabbitbus.outbox;

public enum OutboxStatus
{
    Pending,
    Published,
    Failed
}
