package com.guicedee.rabbitbus.topology;

/**
 * A declare, bind, delete or purge call rejected by the broker or lost with its channel
 */
public class TopologyException extends RuntimeException
{
    public TopologyException(String message)
    {
        super(message);
    }

    public TopologyException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
