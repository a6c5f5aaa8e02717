package com.guicedee.rabbitbus.topology;

/**
 * Broker queue argument names
 */
public final class QueueArguments
{
    public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    public static final String MESSAGE_TTL = "x-message-ttl";
    public static final String MAX_PRIORITY = "x-max-priority";

    private QueueArguments()
    {
    }
}
