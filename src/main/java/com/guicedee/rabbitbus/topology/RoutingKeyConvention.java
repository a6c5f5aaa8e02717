package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ExchangeType;

import java.util.List;
import java.util.Objects;

/**
 * Routing keys and topic subscription patterns, configured apart from queue naming
 */
public class RoutingKeyConvention
{
    private final RoutingKeyOptions options;

    public RoutingKeyConvention()
    {
        this(new RoutingKeyOptions());
    }

    public RoutingKeyConvention(RoutingKeyOptions options)
    {
        this.options = Objects.requireNonNull(options, "options").copy();
    }

    public RoutingKeyOptions getOptions()
    {
        return options.copy();
    }

    /**
     * {@code com.acme.orders.events.OrderCreatedEvent} gives {@code orders.events.order-created}
     */
    public String getRoutingKey(Class<?> messageType)
    {
        Objects.requireNonNull(messageType, "messageType");
        String key = NameTransforms.applyCasing(typeName(messageType), options.getCasing(), "-");
        String namespace = namespace(messageType);
        return namespace.isEmpty() ? key : namespace + options.getSeparator() + key;
    }

    /**
     * The routing key for a message published to an exchange of the given type, always empty for fanout exchanges
     */
    public String getRoutingKey(Class<?> messageType, ExchangeType exchangeType)
    {
        if (exchangeType == ExchangeType.Fanout)
        {
            return "";
        }
        return getRoutingKey(messageType);
    }

    /**
     * The binding pattern a consumer subscribes with
     */
    public String getSubscriptionPattern(Class<?> consumerType, Class<?> messageType)
    {
        Objects.requireNonNull(consumerType, "consumerType");
        Objects.requireNonNull(messageType, "messageType");
        switch (options.getSubscriptionWildcard())
        {
            case SingleWord:
                return wildcard(messageType, "*");
            case MultiWord:
                return wildcard(messageType, "#");
            case Exact:
            default:
                return getRoutingKey(messageType);
        }
    }

    private String wildcard(Class<?> messageType, String token)
    {
        String namespace = namespace(messageType);
        return namespace.isEmpty() ? token : namespace + options.getSeparator() + token;
    }

    private String namespace(Class<?> messageType)
    {
        if (!options.isIncludeNamespace())
        {
            return "";
        }
        String namespace = NameTransforms.namespaceTail(messageType, options.getNamespaceDepth());
        return namespace.toLowerCase().replace(".", options.getSeparator());
    }

    private String typeName(Class<?> type)
    {
        String name = NameTransforms.typeName(type);
        if (options.isStripSuffixes())
        {
            List<String> suffixes = options.getSuffixesToStrip();
            name = NameTransforms.stripSuffix(name, suffixes == null ? List.of() : suffixes);
        }
        return name;
    }
}
