package com.guicedee.rabbitbus;

/**
 * The broker exchange kinds. The string form is the wire name the broker expects.
 */
public enum ExchangeType
{
    Direct,
    Fanout,
    Topic,
    Headers
    ;

    @Override
    public String toString()
    {
        return name().toLowerCase();
    }
}
