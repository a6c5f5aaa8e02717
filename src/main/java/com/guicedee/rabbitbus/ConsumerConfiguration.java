package com.guicedee.rabbitbus;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.time.Duration;

/**
 * Per consumer overrides, set while configuring the bus and read when topology is declared and messages are dispatched.
 * <p>
 * Any name left {@code null} falls back to the endpoint conventions.
 */
@Getter
@Setter
@Accessors(chain = true)
public class ConsumerConfiguration
{
    private int concurrencyLimit = 1;
    private int prefetchCount = 16;
    private int retryAttempts = 3;
    private Duration retryDelay = Duration.ofSeconds(1);
    private boolean useExponentialBackoff = true;

    private String queueName;
    private String exchangeName;
    private String routingKey;

    private boolean durable = true;
    private boolean exclusive;
    private boolean autoDelete;

    private Duration messageTtl;
    private String deadLetterExchange;
    /**
     * Only applied with an explicit {@link #deadLetterExchange}. A generated dead letter pair routes by the dead letter queue name.
     */
    private String deadLetterRoutingKey;

    private boolean priorityQueue;
    private int maxPriority = 10;

    private String consumerTag;
    private boolean requeueOnFailure;
    private Duration processingTimeout = Duration.ofSeconds(30);

    /**
     * Checks the values that cannot be corrected later
     *
     * @throws IllegalArgumentException when a value is out of range
     */
    public void validate()
    {
        if (concurrencyLimit < 1)
        {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1 but was " + concurrencyLimit);
        }
        if (prefetchCount < 0)
        {
            throw new IllegalArgumentException("prefetchCount cannot be negative but was " + prefetchCount);
        }
        if (retryAttempts < 0)
        {
            throw new IllegalArgumentException("retryAttempts cannot be negative but was " + retryAttempts);
        }
        if (maxPriority < 1 || maxPriority > 255)
        {
            throw new IllegalArgumentException("maxPriority must be between 1 and 255 but was " + maxPriority);
        }
        if (messageTtl != null && messageTtl.isNegative())
        {
            throw new IllegalArgumentException("messageTtl cannot be negative");
        }
        if (retryDelay != null && retryDelay.isNegative())
        {
            throw new IllegalArgumentException("retryDelay cannot be negative");
        }
    }
}
