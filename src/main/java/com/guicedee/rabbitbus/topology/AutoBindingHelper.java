package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ConsumerConfiguration;
import com.guicedee.rabbitbus.ExchangeType;
import com.rabbitmq.client.Channel;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declares and binds whole consumers and message types in one call, reporting what was bound.
 */
@Log4j2
public class AutoBindingHelper
{
    private final TopologyBuilder topologyBuilder;
    private final AutoBindingOptions options;

    public AutoBindingHelper(TopologyBuilder topologyBuilder)
    {
        this(topologyBuilder, new AutoBindingOptions());
    }

    public AutoBindingHelper(TopologyBuilder topologyBuilder, AutoBindingOptions options)
    {
        this.topologyBuilder = Objects.requireNonNull(topologyBuilder, "topologyBuilder");
        this.options = Objects.requireNonNull(options, "options").copy();
    }

    public AutoBindingOptions getOptions()
    {
        return options.copy();
    }

    /**
     * Binds one consumer, registering it from its generic signature when it was not registered explicitly
     *
     * @throws IllegalStateException when the consumer message type cannot be resolved
     * @throws TopologyException     when the broker rejects a declaration
     */
    public ConsumerBindingInfo autoBindConsumer(Channel channel, Class<?> consumerType)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(consumerType, "consumerType");
        ConsumerRegistry registry = topologyBuilder.getConsumerRegistry();
        ConsumerRegistration<?> registration = registry.find(consumerType)
                .orElseGet(() -> registry.registerScanned(consumerType));
        return autoBindConsumer(channel, registration);
    }

    public ConsumerBindingInfo autoBindConsumer(Channel channel, ConsumerRegistration<?> registration)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(registration, "registration");
        Class<?> messageType = registration.getMessageType();
        ConsumerConfiguration configuration = registration.getConfiguration();

        ExchangeType exchangeType = exchangeType(messageType);
        String exchangeName = topologyBuilder.resolveExchangeName(registration);
        String queueName = topologyBuilder.resolveQueueName(registration);
        String routingKey = exchangeType == ExchangeType.Fanout ? "" : topologyBuilder.resolveRoutingKey(registration);

        topologyBuilder.declareExchange(channel, exchangeName, exchangeType, exchangeDurable(messageType), exchangeAutoDelete(messageType), null);

        Map<String, Object> arguments = queueArguments(channel, messageType, exchangeName, queueName, configuration);
        topologyBuilder.declareQueue(channel, queueName, options.isDurable() && configuration.isDurable(), configuration.isExclusive(),
                options.isAutoDelete() || configuration.isAutoDelete(), arguments);
        topologyBuilder.bindQueue(channel, queueName, exchangeName, routingKey, topologyBuilder.bindingArguments(messageType));

        log.info("Bound consumer '{}' queue '{}' to exchange '{}' ({}) with routing key '{}'",
                registration.getConsumerType().getName(), queueName, exchangeName, exchangeType, routingKey);
        return new ConsumerBindingInfo(registration.getConsumerType(), messageType, queueName, exchangeName, exchangeType, routingKey);
    }

    /**
     * Scans the packages for consumers and binds each one.
     * A failing consumer is logged and skipped unless {@code continueOnError} is off, in which case the failure ends the batch.
     */
    public List<ConsumerBindingInfo> autoBindConsumersFromPackage(Channel channel, String... packages)
    {
        Objects.requireNonNull(channel, "channel");
        List<ConsumerBindingInfo> bindings = new ArrayList<>();
        for (Class<?> consumerType : topologyBuilder.getConsumerRegistry().scan(packages))
        {
            try
            {
                bindings.add(autoBindConsumer(channel, consumerType));
            }
            catch (RuntimeException e)
            {
                if (!options.isContinueOnError())
                {
                    throw e;
                }
                log.warn("Failed to bind consumer '{}', continuing with the next consumer", consumerType.getName(), e);
            }
        }
        return bindings;
    }

    /**
     * Binds the given registrations with the same failure handling as a package scan
     */
    public List<ConsumerBindingInfo> autoBindConsumers(Channel channel, Collection<ConsumerRegistration<?>> registrations)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(registrations, "registrations");
        List<ConsumerBindingInfo> bindings = new ArrayList<>();
        for (ConsumerRegistration<?> registration : registrations)
        {
            try
            {
                bindings.add(autoBindConsumer(channel, registration));
            }
            catch (RuntimeException e)
            {
                if (!options.isContinueOnError())
                {
                    throw e;
                }
                log.warn("Failed to bind consumer '{}', continuing with the next consumer", registration.getConsumerType().getName(), e);
            }
        }
        return bindings;
    }

    public List<ConsumerBindingInfo> autoBindRegisteredConsumers(Channel channel)
    {
        return autoBindConsumers(channel, topologyBuilder.getConsumerRegistry().getRegistrations());
    }

    /**
     * Declares the exchange of a message type and, when {@code createDefaultQueue} is set, its queue and binding
     */
    public MessageBindingInfo autoBindMessage(Channel channel, Class<?> messageType)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(messageType, "messageType");
        EndpointConvention endpoints = topologyBuilder.getEndpointConvention();
        ExchangeType exchangeType = exchangeType(messageType);
        String exchangeName = endpoints.getExchangeName(messageType);
        String routingKey = exchangeType == ExchangeType.Fanout ? "" : endpoints.getRoutingKey(messageType);

        topologyBuilder.declareExchange(channel, exchangeName, exchangeType, exchangeDurable(messageType), exchangeAutoDelete(messageType), null);

        String queueName = null;
        if (options.isCreateDefaultQueue())
        {
            queueName = endpoints.getQueueName(messageType);
            Map<String, Object> arguments = queueArguments(channel, messageType, exchangeName, queueName, null);
            topologyBuilder.declareQueue(channel, queueName, options.isDurable(), false, options.isAutoDelete(), arguments);
            topologyBuilder.bindQueue(channel, queueName, exchangeName, routingKey, topologyBuilder.bindingArguments(messageType));
        }
        log.info("Bound message '{}' to exchange '{}' ({}) queue '{}'", messageType.getName(), exchangeName, exchangeType, queueName);
        return new MessageBindingInfo(messageType, exchangeName, exchangeType, queueName, routingKey);
    }

    private Map<String, Object> queueArguments(Channel channel, Class<?> messageType, String exchangeName, String queueName,
                                               ConsumerConfiguration configuration)
    {
        EndpointNameFormatter formatter = topologyBuilder.getEndpointConvention().getFormatter();
        Map<String, Object> arguments = new HashMap<>();
        if (configuration != null && StringUtils.isNotBlank(configuration.getDeadLetterExchange()))
        {
            arguments.put(QueueArguments.DEAD_LETTER_EXCHANGE, configuration.getDeadLetterExchange());
            if (StringUtils.isNotBlank(configuration.getDeadLetterRoutingKey()))
            {
                arguments.put(QueueArguments.DEAD_LETTER_ROUTING_KEY, configuration.getDeadLetterRoutingKey());
            }
        }
        else if (options.isConfigureDeadLetter())
        {
            String deadLetterExchange = formatter.formatDeadLetterExchangeName(exchangeName);
            String deadLetterQueue = formatter.formatDeadLetterQueueName(queueName);
            topologyBuilder.declareDeadLetter(channel, deadLetterExchange, deadLetterQueue);
            arguments.put(QueueArguments.DEAD_LETTER_EXCHANGE, deadLetterExchange);
            arguments.put(QueueArguments.DEAD_LETTER_ROUTING_KEY, deadLetterQueue);
        }
        Long ttl = topologyBuilder.resolveMessageTtl(messageType, configuration, options.getDefaultMessageTtlMs());
        if (ttl != null)
        {
            arguments.put(QueueArguments.MESSAGE_TTL, ttl);
        }
        if (configuration != null && configuration.isPriorityQueue())
        {
            arguments.put(QueueArguments.MAX_PRIORITY, configuration.getMaxPriority());
        }
        else if (options.isEnablePriorityQueue())
        {
            arguments.put(QueueArguments.MAX_PRIORITY, options.getMaxPriority());
        }
        return arguments;
    }

    private ExchangeType exchangeType(Class<?> messageType)
    {
        return topologyBuilder.getEndpointConvention().getTopologyRegistry()
                .getTopology(messageType)
                .map(MessageTopology::getExchangeType)
                .orElse(options.getDefaultExchangeType());
    }

    private boolean exchangeDurable(Class<?> messageType)
    {
        return topologyBuilder.getEndpointConvention().getTopologyRegistry()
                .getTopology(messageType)
                .map(MessageTopology::isDurable)
                .orElse(options.isDurable());
    }

    private boolean exchangeAutoDelete(Class<?> messageType)
    {
        return topologyBuilder.getEndpointConvention().getTopologyRegistry()
                .getTopology(messageType)
                .map(MessageTopology::isAutoDelete)
                .orElse(options.isAutoDelete());
    }
}
