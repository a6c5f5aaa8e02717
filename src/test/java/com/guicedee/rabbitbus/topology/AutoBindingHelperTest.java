package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ConsumerConfiguration;
import com.guicedee.rabbitbus.ExchangeType;
import com.guicedee.rabbitbus.fixtures.orders.OrderCreatedConsumer;
import com.guicedee.rabbitbus.fixtures.orders.OrderCreatedEvent;
import com.guicedee.rabbitbus.fixtures.orders.OrderShipped;
import com.guicedee.rabbitbus.fixtures.orders.ShipmentAuditConsumer;
import com.guicedee.rabbitbus.fixtures.scan.PaymentReceivedConsumer;
import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutoBindingHelperTest
{
    private static final String SCAN_PACKAGE = "com.guicedee.rabbitbus.fixtures.scan";

    @Mock
    private Channel channel;

    private MessageTopologyRegistry topologies;
    private ConsumerRegistry consumers;
    private TopologyBuilder topologyBuilder;

    @BeforeEach
    void setUp()
    {
        topologies = new MessageTopologyRegistry();
        consumers = new ConsumerRegistry();
        topologyBuilder = new TopologyBuilder(new EndpointConvention(topologies), consumers);
    }

    @Test
    void bindsAnUnregisteredConsumerFromItsSignature() throws IOException
    {
        AutoBindingHelper helper = new AutoBindingHelper(topologyBuilder);

        ConsumerBindingInfo info = helper.autoBindConsumer(channel, OrderCreatedConsumer.class);

        assertEquals(OrderCreatedConsumer.class, info.getConsumerType());
        assertEquals(OrderCreatedEvent.class, info.getMessageType());
        assertEquals("order-created-queue", info.getQueueName());
        assertEquals("order-created-exchange", info.getExchangeName());
        assertEquals(ExchangeType.Direct, info.getExchangeType());
        assertEquals("fixtures.orders.order-created", info.getRoutingKey());
        assertTrue(consumers.find(OrderCreatedConsumer.class).isPresent());

        verify(channel).exchangeDeclare("order-created-exchange", "direct", true, false, null);
        verify(channel).queueBind("order-created-queue", "order-created-exchange", "fixtures.orders.order-created", null);
    }

    @Test
    @SuppressWarnings("unchecked")
    void generatedDeadLetterKeyMatchesTheTopologyBuilder() throws IOException
    {
        consumers.register(OrderCreatedConsumer.class, OrderCreatedEvent.class,
                new ConsumerConfiguration().setDeadLetterRoutingKey("orders.dead"));

        new AutoBindingHelper(topologyBuilder).autoBindConsumer(channel, OrderCreatedConsumer.class);

        ArgumentCaptor<Map<String, Object>> arguments = ArgumentCaptor.forClass(Map.class);
        verify(channel).queueDeclare(eq("order-created-queue"), eq(true), eq(false), eq(false), arguments.capture());
        assertEquals("order-created-queue-dlq", arguments.getValue().get(QueueArguments.DEAD_LETTER_ROUTING_KEY));
        verify(channel).queueBind("order-created-queue-dlq", "order-created-exchange-dlx", "order-created-queue-dlq", null);
    }

    @Test
    void fanoutMessageGivesAnEmptyRoutingKey()
    {
        topologies.register(OrderShipped.class, topology -> topology.exchangeType(ExchangeType.Fanout));

        ConsumerBindingInfo info = new AutoBindingHelper(topologyBuilder).autoBindConsumer(channel, ShipmentAuditConsumer.class);

        assertEquals(ExchangeType.Fanout, info.getExchangeType());
        assertEquals("", info.getRoutingKey());
    }

    @Test
    void singleConsumerWithoutMessageTypeFails()
    {
        AutoBindingHelper helper = new AutoBindingHelper(topologyBuilder);
        assertThrows(IllegalStateException.class,
                () -> helper.autoBindConsumer(channel, com.guicedee.rabbitbus.fixtures.scan.UntypedConsumer.class));
    }

    @Test
    void packageBindingSkipsFailingConsumers()
    {
        List<ConsumerBindingInfo> bindings = new AutoBindingHelper(topologyBuilder).autoBindConsumersFromPackage(channel, SCAN_PACKAGE);

        assertEquals(1, bindings.size());
        assertEquals(PaymentReceivedConsumer.class, bindings.get(0).getConsumerType());
        assertEquals("payment-received-queue", bindings.get(0).getQueueName());
    }

    @Test
    void packageBindingStopsWhenErrorsAreNotTolerated()
    {
        AutoBindingHelper strict = new AutoBindingHelper(topologyBuilder, new AutoBindingOptions().setContinueOnError(false));
        assertThrows(IllegalStateException.class, () -> strict.autoBindConsumersFromPackage(channel, SCAN_PACKAGE));
    }

    @Test
    void registeredConsumersAreAllBound()
    {
        consumers.register(OrderCreatedConsumer.class, OrderCreatedEvent.class);
        consumers.register(ShipmentAuditConsumer.class, OrderShipped.class);

        List<ConsumerBindingInfo> bindings = new AutoBindingHelper(topologyBuilder).autoBindRegisteredConsumers(channel);

        assertEquals(2, bindings.size());
        assertEquals("order-shipped-queue", bindings.get(1).getQueueName());
    }

    @Test
    @SuppressWarnings("unchecked")
    void messageBindingDeclaresDefaultQueueWithOptions() throws IOException
    {
        AutoBindingHelper helper = new AutoBindingHelper(topologyBuilder, new AutoBindingOptions()
                .setConfigureDeadLetter(false)
                .setDefaultMessageTtlMs(60000)
                .setEnablePriorityQueue(true)
                .setMaxPriority(4));

        MessageBindingInfo info = helper.autoBindMessage(channel, OrderShipped.class);

        assertEquals("order-shipped-exchange", info.getExchangeName());
        assertEquals("order-shipped-queue", info.getQueueName());
        assertEquals("fixtures.orders.order-shipped", info.getRoutingKey());
        ArgumentCaptor<Map<String, Object>> arguments = ArgumentCaptor.forClass(Map.class);
        verify(channel).queueDeclare(eq("order-shipped-queue"), eq(true), eq(false), eq(false), arguments.capture());
        assertEquals(Map.of(QueueArguments.MESSAGE_TTL, 60000L, QueueArguments.MAX_PRIORITY, 4), arguments.getValue());
    }

    @Test
    void messageBindingWithoutDefaultQueueOnlyDeclaresTheExchange() throws IOException
    {
        AutoBindingHelper helper = new AutoBindingHelper(topologyBuilder, new AutoBindingOptions().setCreateDefaultQueue(false));

        MessageBindingInfo info = helper.autoBindMessage(channel, OrderShipped.class);

        assertNull(info.getQueueName());
        verify(channel).exchangeDeclare("order-shipped-exchange", "direct", true, false, null);
        verify(channel, never()).queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), any());
    }

    @Test
    void optionsAreCopied()
    {
        AutoBindingOptions options = new AutoBindingOptions();
        AutoBindingHelper helper = new AutoBindingHelper(topologyBuilder, options);
        options.setDurable(false);
        assertTrue(helper.getOptions().isDurable());
    }
}
