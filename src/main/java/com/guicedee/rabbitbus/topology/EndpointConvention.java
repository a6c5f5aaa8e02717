package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ExchangeType;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Resolves endpoint names per message type.
 * <p>
 * An explicit mapping wins over the registered {@link MessageTopology}, which wins over the naming conventions.
 * Lookups and mappings are safe from any thread.
 */
@Log4j2
public class EndpointConvention
{
    private final ConcurrentMap<Class<?>, EndpointInfo> mappings = new ConcurrentHashMap<>();
    private final MessageTopologyRegistry topologyRegistry;

    private volatile EndpointConventionOptions options;
    private volatile EndpointNameFormatter formatter;
    private volatile RoutingKeyConvention routingKeyConvention;

    public EndpointConvention(MessageTopologyRegistry topologyRegistry)
    {
        this(topologyRegistry, new EndpointConventionOptions());
    }

    public EndpointConvention(MessageTopologyRegistry topologyRegistry, EndpointConventionOptions options)
    {
        this.topologyRegistry = Objects.requireNonNull(topologyRegistry, "topologyRegistry");
        configure(options);
    }

    /**
     * Replaces the options and the formatter and routing convention derived from them
     */
    public void configure(EndpointConventionOptions options)
    {
        Objects.requireNonNull(options, "options");
        EndpointConventionOptions snapshot = options.copy();
        this.formatter = new EndpointNameFormatter(snapshot.getNamingOptions());
        this.routingKeyConvention = new RoutingKeyConvention(snapshot.getRoutingKeyOptions());
        this.options = snapshot;
    }

    /**
     * Creates or updates the mapping of a message type
     */
    public EndpointConvention map(Class<?> messageType, Consumer<EndpointInfo> configure)
    {
        Objects.requireNonNull(messageType, "messageType");
        Objects.requireNonNull(configure, "configure");
        mappings.compute(messageType, (type, existing) -> {
            EndpointInfo info = existing == null ? new EndpointInfo() : existing.copy();
            configure.accept(info);
            return info;
        });
        log.debug("Mapped endpoint for '{}'", messageType.getName());
        return this;
    }

    public EndpointConvention mapToExchange(Class<?> messageType, String exchangeName)
    {
        return mapToExchange(messageType, exchangeName, null);
    }

    public EndpointConvention mapToExchange(Class<?> messageType, String exchangeName, String routingKey)
    {
        requireName(exchangeName, "exchangeName");
        return map(messageType, info -> {
            info.setExchangeName(exchangeName);
            if (routingKey != null)
            {
                info.setRoutingKey(routingKey);
            }
        });
    }

    public EndpointConvention mapToQueue(Class<?> messageType, String queueName)
    {
        requireName(queueName, "queueName");
        return map(messageType, info -> info.setQueueName(queueName));
    }

    public Optional<EndpointInfo> getEndpoint(Class<?> messageType)
    {
        Objects.requireNonNull(messageType, "messageType");
        EndpointInfo info = mappings.get(messageType);
        return info == null ? Optional.empty() : Optional.of(info.copy());
    }

    public String getExchangeName(Class<?> messageType)
    {
        Objects.requireNonNull(messageType, "messageType");
        EndpointInfo info = mappings.get(messageType);
        if (info != null && StringUtils.isNotBlank(info.getExchangeName()))
        {
            return info.getExchangeName();
        }
        Optional<? extends MessageTopology<?>> topology = topologyRegistry.getTopology(messageType);
        if (topology.isPresent() && StringUtils.isNotBlank(topology.get().getExchangeName()))
        {
            return topology.get().getExchangeName();
        }
        return formatter.formatExchangeName(messageType);
    }

    public ExchangeType getExchangeType(Class<?> messageType)
    {
        Objects.requireNonNull(messageType, "messageType");
        return topologyRegistry.getTopology(messageType)
                .map(MessageTopology::getExchangeType)
                .orElse(options.getDefaultExchangeType());
    }

    /**
     * The publish routing key, always empty when the message goes through a fanout exchange
     */
    public String getRoutingKey(Class<?> messageType)
    {
        Objects.requireNonNull(messageType, "messageType");
        if (getExchangeType(messageType) == ExchangeType.Fanout)
        {
            return "";
        }
        EndpointInfo info = mappings.get(messageType);
        if (info != null && info.getRoutingKey() != null)
        {
            return info.getRoutingKey();
        }
        Optional<? extends MessageTopology<?>> topology = topologyRegistry.getTopology(messageType);
        if (topology.isPresent() && topology.get().getRoutingKey() != null)
        {
            return topology.get().getRoutingKey();
        }
        return routingKeyConvention.getRoutingKey(messageType);
    }

    public String getQueueName(Class<?> messageType)
    {
        Objects.requireNonNull(messageType, "messageType");
        EndpointInfo info = mappings.get(messageType);
        if (info != null && StringUtils.isNotBlank(info.getQueueName()))
        {
            return info.getQueueName();
        }
        return formatter.formatQueueName(messageType);
    }

    public boolean isDurable(Class<?> messageType)
    {
        EndpointInfo info = mappings.get(messageType);
        if (info != null && info.getDurable() != null)
        {
            return info.getDurable();
        }
        return topologyRegistry.getTopology(messageType)
                .map(MessageTopology::isDurable)
                .orElse(options.isDefaultDurable());
    }

    public boolean isAutoDelete(Class<?> messageType)
    {
        EndpointInfo info = mappings.get(messageType);
        if (info != null && info.getAutoDelete() != null)
        {
            return info.getAutoDelete();
        }
        return topologyRegistry.getTopology(messageType)
                .map(MessageTopology::isAutoDelete)
                .orElse(options.isDefaultAutoDelete());
    }

    public boolean unmap(Class<?> messageType)
    {
        return mappings.remove(messageType) != null;
    }

    public void clearMappings()
    {
        mappings.clear();
    }

    /**
     * Clears every mapping and restores the default options, formatter and routing convention
     */
    public void reset()
    {
        mappings.clear();
        configure(new EndpointConventionOptions());
        log.debug("Endpoint conventions reset to defaults");
    }

    public Map<Class<?>, EndpointInfo> getAllMappings()
    {
        Map<Class<?>, EndpointInfo> copy = new HashMap<>();
        mappings.forEach((type, info) -> copy.put(type, info.copy()));
        return Collections.unmodifiableMap(copy);
    }

    public EndpointNameFormatter getFormatter()
    {
        return formatter;
    }

    public RoutingKeyConvention getRoutingKeyConvention()
    {
        return routingKeyConvention;
    }

    public EndpointConventionOptions getOptions()
    {
        return options.copy();
    }

    public MessageTopologyRegistry getTopologyRegistry()
    {
        return topologyRegistry;
    }

    private static void requireName(String name, String argument)
    {
        Objects.requireNonNull(name, argument);
        if (StringUtils.isBlank(name))
        {
            throw new IllegalArgumentException(argument + " cannot be blank");
        }
    }
}
