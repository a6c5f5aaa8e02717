package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ExchangeType;
import com.guicedee.rabbitbus.fixtures.orders.OrderCreatedEvent;
import com.guicedee.rabbitbus.fixtures.orders.OrderShipped;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageTopologyRegistryTest
{
    @Test
    void registerThroughTheBuilderKeepsDefaults()
    {
        MessageTopologyRegistry registry = new MessageTopologyRegistry();
        registry.register(OrderCreatedEvent.class, builder -> builder
                .exchangeName("orders")
                .exchangeType(ExchangeType.Topic));

        MessageTopology<OrderCreatedEvent> topology = registry.getTopology(OrderCreatedEvent.class).orElseThrow();
        assertEquals(OrderCreatedEvent.class, topology.getMessageType());
        assertEquals("orders", topology.getExchangeName());
        assertEquals(ExchangeType.Topic, topology.getExchangeType());
        assertTrue(topology.isDurable());
        assertTrue(topology.isRequireAck());
        assertFalse(topology.isAutoDelete());
        assertTrue(topology.getExchangeArguments().isEmpty());
        assertNull(topology.getRoutingKey());
        assertTrue(registry.hasTopology(OrderCreatedEvent.class));
        assertFalse(registry.hasTopology(OrderShipped.class));
    }

    @Test
    void registeringAgainReplaces()
    {
        MessageTopologyRegistry registry = new MessageTopologyRegistry();
        registry.register(MessageTopology.forType(OrderShipped.class).exchangeName("first").build());
        registry.register(MessageTopology.forType(OrderShipped.class)
                .exchangeName("second")
                .defaultHeaders(Map.of("source", "warehouse"))
                .build());

        assertEquals("second", registry.getTopology(OrderShipped.class).orElseThrow().getExchangeName());
        assertEquals(1, registry.getAll().size());
    }

    @Test
    void unregisterAndClear()
    {
        MessageTopologyRegistry registry = new MessageTopologyRegistry();
        registry.register(MessageTopology.forType(OrderShipped.class).build());
        registry.register(MessageTopology.forType(OrderCreatedEvent.class).build());

        assertTrue(registry.unregister(OrderShipped.class));
        assertFalse(registry.unregister(OrderShipped.class));
        registry.clear();
        assertTrue(registry.getAll().isEmpty());
        assertTrue(registry.getTopology(OrderCreatedEvent.class).isEmpty());
    }

    @Test
    void topologyWithoutMessageTypeIsRejected()
    {
        MessageTopologyRegistry registry = new MessageTopologyRegistry();
        assertThrows(NullPointerException.class, () -> registry.register(MessageTopology.<OrderShipped>builder().build()));
    }
}
