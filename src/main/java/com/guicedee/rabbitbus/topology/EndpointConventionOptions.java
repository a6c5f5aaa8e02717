package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ExchangeType;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
public class EndpointConventionOptions
{
    private EndpointNamingOptions namingOptions = new EndpointNamingOptions();
    private RoutingKeyOptions routingKeyOptions = new RoutingKeyOptions();
    private ExchangeType defaultExchangeType = ExchangeType.Direct;
    private boolean defaultDurable = true;
    private boolean defaultAutoDelete;
    private int defaultPrefetchCount = 16;
    private boolean autoCreateExchanges = true;
    private boolean autoCreateQueues = true;
    private boolean autoBindQueues = true;

    public EndpointConventionOptions copy()
    {
        return new EndpointConventionOptions()
                .setNamingOptions(namingOptions.copy())
                .setRoutingKeyOptions(routingKeyOptions.copy())
                .setDefaultExchangeType(defaultExchangeType)
                .setDefaultDurable(defaultDurable)
                .setDefaultAutoDelete(defaultAutoDelete)
                .setDefaultPrefetchCount(defaultPrefetchCount)
                .setAutoCreateExchanges(autoCreateExchanges)
                .setAutoCreateQueues(autoCreateQueues)
                .setAutoBindQueues(autoBindQueues);
    }
}
