package com.guicedee.rabbitbus.topology;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.HashMap;
import java.util.Map;

/**
 * Explicit endpoint overrides for one message type. Unset values fall through to the topology registry and then to convention.
 */
@Getter
@Setter
@ToString
@Accessors(chain = true)
public class EndpointInfo
{
    private String exchangeName;
    private String queueName;
    private String routingKey;
    private Map<String, Object> bindingArguments = new HashMap<>();
    private Boolean durable;
    private Boolean autoDelete;
    private Integer prefetchCount;

    public EndpointInfo copy()
    {
        return new EndpointInfo()
                .setExchangeName(exchangeName)
                .setQueueName(queueName)
                .setRoutingKey(routingKey)
                .setBindingArguments(bindingArguments == null ? new HashMap<>() : new HashMap<>(bindingArguments))
                .setDurable(durable)
                .setAutoDelete(autoDelete)
                .setPrefetchCount(prefetchCount);
    }
}
