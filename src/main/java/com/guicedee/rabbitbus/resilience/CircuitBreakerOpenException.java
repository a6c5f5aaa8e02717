package com.guicedee.rabbitbus.resilience;

/**
 * Thrown instead of calling through an open circuit
 */
public class CircuitBreakerOpenException extends RuntimeException
{
    public CircuitBreakerOpenException(String message)
    {
        super(message);
    }
}
