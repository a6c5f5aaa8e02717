package com.guicedee.rabbitbus.topology;

import lombok.extern.log4j.Log4j2;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * The topology attributes registered per message type. Registering a type again replaces its entry.
 */
@Log4j2
public class MessageTopologyRegistry
{
    private final ConcurrentMap<Class<?>, MessageTopology<?>> topologies = new ConcurrentHashMap<>();

    public <T> MessageTopologyRegistry register(MessageTopology<T> topology)
    {
        Objects.requireNonNull(topology, "topology");
        Objects.requireNonNull(topology.getMessageType(), "topology.messageType");
        topologies.put(topology.getMessageType(), topology);
        log.debug("Registered topology for message '{}' on exchange '{}' ({})", topology.getMessageType().getName(),
                topology.getExchangeName(), topology.getExchangeType());
        return this;
    }

    public <T> MessageTopologyRegistry register(Class<T> messageType, UnaryOperator<MessageTopology.MessageTopologyBuilder<T>> configure)
    {
        Objects.requireNonNull(messageType, "messageType");
        Objects.requireNonNull(configure, "configure");
        return register(configure.apply(MessageTopology.forType(messageType)).messageType(messageType).build());
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<MessageTopology<T>> getTopology(Class<T> messageType)
    {
        Objects.requireNonNull(messageType, "messageType");
        return Optional.ofNullable((MessageTopology<T>) topologies.get(messageType));
    }

    public boolean hasTopology(Class<?> messageType)
    {
        return topologies.containsKey(messageType);
    }

    public boolean unregister(Class<?> messageType)
    {
        return topologies.remove(messageType) != null;
    }

    public void clear()
    {
        topologies.clear();
    }

    public Map<Class<?>, MessageTopology<?>> getAll()
    {
        return Collections.unmodifiableMap(new HashMap<>(topologies));
    }
}
