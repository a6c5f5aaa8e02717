package com.guicedee.rabbitbus.resilience;

public enum CircuitBreakerState
{
    Closed,
    Open,
    HalfOpen
}
