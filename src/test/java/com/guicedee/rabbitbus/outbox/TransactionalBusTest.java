package com.guicedee.rabbitbus.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guicedee.rabbitbus.fixtures.MutableClock;
import com.guicedee.rabbitbus.fixtures.orders.HTTPRequestMessage;
import com.guicedee.rabbitbus.fixtures.orders.OrderCreatedEvent;
import com.guicedee.rabbitbus.fixtures.orders.OrderShipped;
import com.guicedee.rabbitbus.topology.EndpointConvention;
import com.guicedee.rabbitbus.topology.MessageTopologyRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.zip.GZIPInputStream;

import static org.junit.jupiter.api.Assertions.*;

class TransactionalBusTest
{
    private final ObjectMapper objectMapper = new ObjectMapper();

    private MutableClock clock;
    private InMemoryOutboxStore store;
    private MessageTopologyRegistry topologies;
    private TransactionalBus bus;

    @BeforeEach
    void setUp()
    {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        store = new InMemoryOutboxStore();
        topologies = new MessageTopologyRegistry();
        bus = bus(OutboxOptions.defaults());
    }

    @AfterEach
    void tearDown()
    {
        bus.clearPending();
    }

    private TransactionalBus bus(OutboxOptions options)
    {
        return new TransactionalBus(store, options, new EndpointConvention(topologies), objectMapper, clock);
    }

    @Test
    void messagesAreStoredOnlyOnFlush() throws Exception
    {
        OutboxMessage staged = bus.publish(new OrderCreatedEvent("order-1", 3));

        assertEquals(1, bus.getPendingCount());
        assertEquals(0, store.count(OutboxStatus.Pending));

        assertEquals(1, bus.flush());
        assertEquals(0, bus.getPendingCount());
        OutboxMessage stored = store.fetchDue(10, clock.instant()).get(0);
        assertEquals(staged.getId(), stored.getId());
        assertEquals(OrderCreatedEvent.class.getName(), stored.getMessageType());
        assertEquals("order-created-exchange", stored.getExchange());
        assertEquals("fixtures.orders.order-created", stored.getRoutingKey());
        assertEquals(clock.instant(), stored.getCreatedAt());
        JsonNode payload = objectMapper.readTree(stored.getPayload());
        assertEquals("order-1", payload.get("orderId").asText());
        assertEquals(3, payload.get("quantity").asInt());
    }

    @Test
    void explicitRoutingKeyWins()
    {
        OutboxMessage staged = bus.publish(new OrderShipped("track-1"), Map.of(), "shipping.express");
        assertEquals("shipping.express", staged.getRoutingKey());
    }

    @Test
    void correlationIdHeaderPrecedence()
    {
        OutboxMessage primary = bus.publish(new OrderShipped("a"), Map.of(
                TransactionalBus.CORRELATION_ID_HEADER, "primary",
                TransactionalBus.CORRELATION_ID_ALT_HEADER, "secondary"));
        OutboxMessage alternate = bus.publish(new OrderShipped("b"), Map.of(TransactionalBus.CORRELATION_ID_ALT_HEADER, "secondary"));
        OutboxMessage fallback = bus.publish(new OrderShipped("c"));

        assertEquals("primary", primary.getCorrelationId());
        assertEquals("secondary", alternate.getCorrelationId());
        assertEquals(fallback.getId(), fallback.getCorrelationId());
    }

    @Test
    void metadataHeadersAreCopied()
    {
        OutboxMessage staged = bus.publish(new OrderShipped("a"), Map.of(
                TransactionalBus.CAUSATION_ID_HEADER, "cause-1",
                TransactionalBus.TENANT_ID_HEADER, "tenant-7"));

        assertEquals("cause-1", staged.getCausationId());
        assertEquals("tenant-7", staged.getTenantId());
        assertEquals("tenant-7", staged.getHeaders().get(TransactionalBus.TENANT_ID_HEADER));
    }

    @Test
    void priorityFromHeaderThenTopology()
    {
        topologies.register(OrderShipped.class, topology -> topology.defaultPriority(4));

        assertEquals(9, bus.publish(new OrderShipped("a"), Map.of(TransactionalBus.PRIORITY_HEADER, 9)).getPriority());
        assertEquals(6, bus.publish(new OrderShipped("b"), Map.of(TransactionalBus.PRIORITY_HEADER, "6")).getPriority());
        assertEquals(4, bus.publish(new OrderShipped("c")).getPriority());
        assertNull(bus.publish(new OrderCreatedEvent("d", 1)).getPriority());
    }

    @Test
    void duplicatesAreDroppedWithinTheWindow()
    {
        Map<String, Object> headers = Map.of(TransactionalBus.DEDUPLICATION_HEADER, "order-1");
        bus.publish(new OrderShipped("a"), headers);
        bus.publish(new OrderShipped("a"), headers);
        assertEquals(1, bus.flush());

        bus.publish(new OrderShipped("a"), headers);
        assertEquals(0, bus.flush());

        clock.advance(Duration.ofMinutes(11));
        bus.publish(new OrderShipped("a"), headers);
        assertEquals(1, bus.flush());
        assertEquals(2, store.count(OutboxStatus.Pending));
    }

    @Test
    void deduplicationCanBeTurnedOff()
    {
        TransactionalBus plain = bus(OutboxOptions.builder().enableDeduplication(false).build());
        Map<String, Object> headers = Map.of(TransactionalBus.DEDUPLICATION_HEADER, "order-1");
        plain.publish(new OrderShipped("a"), headers);
        plain.publish(new OrderShipped("a"), headers);

        assertEquals(2, plain.flush());
    }

    @Test
    void largePayloadsAreGzipped() throws Exception
    {
        TransactionalBus compressing = bus(OutboxOptions.builder().compressionThreshold(10).build());

        OutboxMessage staged = compressing.publish(new OrderCreatedEvent("a-rather-long-order-identifier", 12));
        compressing.clearPending();

        assertTrue(staged.isCompressed());
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(staged.getPayload())))
        {
            assertEquals("a-rather-long-order-identifier", objectMapper.readTree(gzip).get("orderId").asText());
        }
        assertFalse(bus.publish(new OrderShipped("x")).isCompressed());
    }

    @Test
    void stagingIsPerThread() throws Exception
    {
        bus.publish(new OrderShipped("main"));

        Integer otherThreadCount = CompletableFuture.supplyAsync(() -> {
            bus.publish(new OrderShipped("other"));
            int count = bus.getPendingCount();
            bus.clearPending();
            return count;
        }).get();

        assertEquals(1, otherThreadCount);
        assertEquals(1, bus.getPendingCount());
    }

    @Test
    void batchAndClear()
    {
        List<OutboxMessage> staged = bus.publishBatch(List.of(new OrderShipped("a"), new OrderShipped("b")));

        assertEquals(2, staged.size());
        assertEquals(2, bus.getPending().size());
        bus.clearPending();
        assertEquals(0, bus.flush());
    }

    @Test
    void unserializableMessageIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> bus.publish(new HTTPRequestMessage()));
        assertEquals(0, bus.getPendingCount());
    }
}
