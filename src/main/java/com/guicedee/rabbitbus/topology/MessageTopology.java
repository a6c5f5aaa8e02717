package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ExchangeType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Exchange and delivery attributes for one message type. Any {@code null} value falls back to convention.
 *
 * @param <T> the message type
 */
@Value
@Builder(toBuilder = true)
public class MessageTopology<T>
{
    Class<T> messageType;
    String exchangeName;
    @Builder.Default
    ExchangeType exchangeType = ExchangeType.Direct;
    String routingKey;
    @Builder.Default
    boolean durable = true;
    boolean autoDelete;
    @Builder.Default
    Map<String, Object> exchangeArguments = Map.of();
    Integer defaultPriority;
    Long messageTtlMs;
    @Builder.Default
    boolean requireAck = true;
    @Builder.Default
    Map<String, Object> defaultHeaders = Map.of();

    public static <T> MessageTopologyBuilder<T> forType(Class<T> messageType)
    {
        return MessageTopology.<T>builder().messageType(messageType);
    }
}
