package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ExchangeType;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
public class AutoBindingOptions
{
    private boolean durable = true;
    private boolean autoDelete;
    private boolean configureDeadLetter = true;
    private boolean createDefaultQueue = true;
    private ExchangeType defaultExchangeType = ExchangeType.Direct;
    /**
     * Queue TTL used when neither the topology nor the consumer sets one, 0 for none
     */
    private long defaultMessageTtlMs;
    private boolean enablePriorityQueue;
    private int maxPriority = 10;
    /**
     * Keep binding the remaining consumers of a batch when one fails
     */
    private boolean continueOnError = true;

    public AutoBindingOptions copy()
    {
        return new AutoBindingOptions()
                .setDurable(durable)
                .setAutoDelete(autoDelete)
                .setConfigureDeadLetter(configureDeadLetter)
                .setCreateDefaultQueue(createDefaultQueue)
                .setDefaultExchangeType(defaultExchangeType)
                .setDefaultMessageTtlMs(defaultMessageTtlMs)
                .setEnablePriorityQueue(enablePriorityQueue)
                .setMaxPriority(maxPriority)
                .setContinueOnError(continueOnError);
    }
}
