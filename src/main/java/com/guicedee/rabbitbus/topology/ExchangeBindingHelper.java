package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ExchangeType;
import com.rabbitmq.client.Channel;
import lombok.extern.log4j.Log4j2;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Exchange to exchange layouts: hierarchies, fan out, aggregation and content based routing
 */
@Log4j2
public class ExchangeBindingHelper
{
    private final TopologyBuilder topologyBuilder;

    public ExchangeBindingHelper(TopologyBuilder topologyBuilder)
    {
        this.topologyBuilder = Objects.requireNonNull(topologyBuilder, "topologyBuilder");
    }

    /**
     * Routes messages from the source exchange to the destination exchange
     */
    public void bindExchanges(Channel channel, String destination, String source, String routingKey)
    {
        topologyBuilder.bindExchange(channel, destination, source, routingKey, null);
    }

    public void unbindExchanges(Channel channel, String destination, String source, String routingKey)
    {
        topologyBuilder.unbindExchange(channel, destination, source, routingKey, null);
    }

    /**
     * Declares a parent and its children with one type, each child receiving everything the parent routes
     */
    public void createExchangeHierarchy(Channel channel, String parentExchange, Collection<String> childExchanges,
                                        ExchangeType exchangeType, boolean durable)
    {
        Objects.requireNonNull(parentExchange, "parentExchange");
        Objects.requireNonNull(childExchanges, "childExchanges");
        Objects.requireNonNull(exchangeType, "exchangeType");
        topologyBuilder.declareExchange(channel, parentExchange, exchangeType, durable, false, null);
        String routingKey = catchAll(exchangeType);
        for (String child : childExchanges)
        {
            topologyBuilder.declareExchange(channel, child, exchangeType, durable, false, null);
            bindExchanges(channel, child, parentExchange, routingKey);
        }
        log.info("Created exchange hierarchy '{}' with {} children", parentExchange, childExchanges.size());
    }

    /**
     * A fanout source copying every message to direct destination exchanges
     */
    public void createFanOutTopology(Channel channel, String sourceExchange, Collection<String> destinationExchanges, boolean durable)
    {
        Objects.requireNonNull(sourceExchange, "sourceExchange");
        Objects.requireNonNull(destinationExchanges, "destinationExchanges");
        topologyBuilder.declareExchange(channel, sourceExchange, ExchangeType.Fanout, durable, false, null);
        for (String destination : destinationExchanges)
        {
            topologyBuilder.declareExchange(channel, destination, ExchangeType.Direct, durable, false, null);
            bindExchanges(channel, destination, sourceExchange, "");
        }
        log.info("Created fan out topology from '{}' to {} exchanges", sourceExchange, destinationExchanges.size());
    }

    /**
     * Many sources feeding one destination exchange
     */
    public void createAggregationTopology(Channel channel, Collection<String> sourceExchanges, String destinationExchange,
                                          ExchangeType exchangeType, boolean durable)
    {
        Objects.requireNonNull(sourceExchanges, "sourceExchanges");
        Objects.requireNonNull(destinationExchange, "destinationExchange");
        Objects.requireNonNull(exchangeType, "exchangeType");
        topologyBuilder.declareExchange(channel, destinationExchange, exchangeType, durable, false, null);
        String routingKey = catchAll(exchangeType);
        for (String source : sourceExchanges)
        {
            topologyBuilder.declareExchange(channel, source, exchangeType, durable, false, null);
            bindExchanges(channel, destinationExchange, source, routingKey);
        }
        log.info("Created aggregation topology of {} exchanges into '{}'", sourceExchanges.size(), destinationExchange);
    }

    /**
     * A topic source routing to direct destinations by pattern
     *
     * @param routingRules destination exchange to routing key pattern
     */
    public void createContentBasedRouter(Channel channel, String sourceExchange, Map<String, String> routingRules, boolean durable)
    {
        Objects.requireNonNull(sourceExchange, "sourceExchange");
        Objects.requireNonNull(routingRules, "routingRules");
        topologyBuilder.declareExchange(channel, sourceExchange, ExchangeType.Topic, durable, false, null);
        routingRules.forEach((destination, pattern) -> {
            topologyBuilder.declareExchange(channel, destination, ExchangeType.Direct, durable, false, null);
            bindExchanges(channel, destination, sourceExchange, pattern);
        });
        log.info("Created content based router '{}' with {} rules", sourceExchange, routingRules.size());
    }

    private static String catchAll(ExchangeType exchangeType)
    {
        return exchangeType == ExchangeType.Topic ? "#" : "";
    }
}
