package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ExchangeType;
import lombok.Value;

/**
 * What was declared for one message type. The queue name is null when no default queue was created.
 */
@Value
public class MessageBindingInfo
{
    Class<?> messageType;
    String exchangeName;
    ExchangeType exchangeType;
    String queueName;
    String routingKey;
}
