package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ConsumerConfiguration;
import com.guicedee.rabbitbus.MessageConsumer;
import lombok.Value;

/**
 * A consumer type, the message type it consumes and its overrides
 *
 * @param <M> the message type
 */
@Value
public class ConsumerRegistration<M>
{
    Class<? extends MessageConsumer<M>> consumerType;
    Class<M> messageType;
    ConsumerConfiguration configuration;
}
