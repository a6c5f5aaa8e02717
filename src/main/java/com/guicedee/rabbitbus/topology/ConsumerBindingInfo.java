package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ExchangeType;
import lombok.Value;

/**
 * What was declared and bound for one consumer
 */
@Value
public class ConsumerBindingInfo
{
    Class<?> consumerType;
    Class<?> messageType;
    String queueName;
    String exchangeName;
    ExchangeType exchangeType;
    String routingKey;
}
