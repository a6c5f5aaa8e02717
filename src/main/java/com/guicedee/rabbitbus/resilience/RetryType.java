package com.guicedee.rabbitbus.resilience;

public enum RetryType
{
    Immediate,
    FixedInterval,
    CustomIntervals,
    Exponential,
    Incremental
}
