package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ConsumerConfiguration;
import com.guicedee.rabbitbus.ExchangeType;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Declares exchanges, queues and bindings on a channel.
 * <p>
 * Broker failures surface as {@link TopologyException} and are never retried here.
 */
@Log4j2
public class TopologyBuilder
{
    private final EndpointConvention endpointConvention;
    private final ConsumerRegistry consumerRegistry;
    private final TopologyOptions options;
    private final List<OnExchangeDeclared> exchangeListeners = new ArrayList<>();

    public TopologyBuilder(EndpointConvention endpointConvention, ConsumerRegistry consumerRegistry)
    {
        this(endpointConvention, consumerRegistry, new TopologyOptions());
    }

    public TopologyBuilder(EndpointConvention endpointConvention, ConsumerRegistry consumerRegistry, TopologyOptions options)
    {
        this.endpointConvention = Objects.requireNonNull(endpointConvention, "endpointConvention");
        this.consumerRegistry = Objects.requireNonNull(consumerRegistry, "consumerRegistry");
        this.options = Objects.requireNonNull(options, "options").copy();
        ServiceLoader.load(OnExchangeDeclared.class).forEach(exchangeListeners::add);
    }

    public TopologyBuilder addExchangeListener(OnExchangeDeclared listener)
    {
        exchangeListeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    public TopologyOptions getOptions()
    {
        return options.copy();
    }

    public void declareExchange(Channel channel, String exchangeName, ExchangeType exchangeType)
    {
        declareExchange(channel, exchangeName, exchangeType, true, false, null);
    }

    public void declareExchange(Channel channel, String exchangeName, ExchangeType exchangeType, boolean durable, boolean autoDelete,
                                Map<String, Object> arguments)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(exchangeName, "exchangeName");
        Objects.requireNonNull(exchangeType, "exchangeType");
        log.debug("Declaring exchange '{}' type={} durable={} autoDelete={}", exchangeName, exchangeType, durable, autoDelete);
        try
        {
            channel.exchangeDeclare(exchangeName, exchangeType.toString(), durable, autoDelete, arguments);
        }
        catch (IOException e)
        {
            throw new TopologyException("Failed to declare exchange '" + exchangeName + "'", e);
        }
        for (OnExchangeDeclared listener : exchangeListeners)
        {
            listener.onExchangeDeclared(exchangeName, exchangeType);
        }
    }

    public void declareQueue(Channel channel, String queueName, boolean durable, boolean exclusive, boolean autoDelete,
                             Map<String, Object> arguments)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(queueName, "queueName");
        log.debug("Declaring queue '{}' durable={} exclusive={} autoDelete={} arguments={}", queueName, durable, exclusive, autoDelete, arguments);
        try
        {
            channel.queueDeclare(queueName, durable, exclusive, autoDelete, arguments);
        }
        catch (IOException e)
        {
            throw new TopologyException("Failed to declare queue '" + queueName + "'", e);
        }
    }

    public void bindQueue(Channel channel, String queueName, String exchangeName, String routingKey, Map<String, Object> arguments)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(exchangeName, "exchangeName");
        String key = routingKey == null ? "" : routingKey;
        log.debug("Binding queue '{}' to exchange '{}' with routing key '{}'", queueName, exchangeName, key);
        try
        {
            channel.queueBind(queueName, exchangeName, key, arguments);
        }
        catch (IOException e)
        {
            throw new TopologyException("Failed to bind queue '" + queueName + "' to exchange '" + exchangeName + "'", e);
        }
    }

    public void bindExchange(Channel channel, String destination, String source, String routingKey, Map<String, Object> arguments)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(source, "source");
        String key = routingKey == null ? "" : routingKey;
        log.debug("Binding exchange '{}' to exchange '{}' with routing key '{}'", destination, source, key);
        try
        {
            channel.exchangeBind(destination, source, key, arguments);
        }
        catch (IOException e)
        {
            throw new TopologyException("Failed to bind exchange '" + destination + "' to exchange '" + source + "'", e);
        }
    }

    public void unbindQueue(Channel channel, String queueName, String exchangeName, String routingKey, Map<String, Object> arguments)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(exchangeName, "exchangeName");
        String key = routingKey == null ? "" : routingKey;
        log.debug("Unbinding queue '{}' from exchange '{}' with routing key '{}'", queueName, exchangeName, key);
        try
        {
            channel.queueUnbind(queueName, exchangeName, key, arguments);
        }
        catch (IOException e)
        {
            throw new TopologyException("Failed to unbind queue '" + queueName + "' from exchange '" + exchangeName + "'", e);
        }
    }

    public void unbindExchange(Channel channel, String destination, String source, String routingKey, Map<String, Object> arguments)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(source, "source");
        String key = routingKey == null ? "" : routingKey;
        log.debug("Unbinding exchange '{}' from exchange '{}' with routing key '{}'", destination, source, key);
        try
        {
            channel.exchangeUnbind(destination, source, key, arguments);
        }
        catch (IOException e)
        {
            throw new TopologyException("Failed to unbind exchange '" + destination + "' from exchange '" + source + "'", e);
        }
    }

    public void deleteExchange(Channel channel, String exchangeName, boolean ifUnused)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(exchangeName, "exchangeName");
        log.debug("Deleting exchange '{}' ifUnused={}", exchangeName, ifUnused);
        try
        {
            channel.exchangeDelete(exchangeName, ifUnused);
        }
        catch (IOException e)
        {
            throw new TopologyException("Failed to delete exchange '" + exchangeName + "'", e);
        }
    }

    /**
     * @return the number of messages deleted with the queue
     */
    public int deleteQueue(Channel channel, String queueName, boolean ifUnused, boolean ifEmpty)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(queueName, "queueName");
        log.debug("Deleting queue '{}' ifUnused={} ifEmpty={}", queueName, ifUnused, ifEmpty);
        try
        {
            AMQP.Queue.DeleteOk deleteOk = channel.queueDelete(queueName, ifUnused, ifEmpty);
            return deleteOk == null ? 0 : deleteOk.getMessageCount();
        }
        catch (IOException e)
        {
            throw new TopologyException("Failed to delete queue '" + queueName + "'", e);
        }
    }

    /**
     * @return the number of messages purged
     */
    public int purgeQueue(Channel channel, String queueName)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(queueName, "queueName");
        log.debug("Purging queue '{}'", queueName);
        try
        {
            AMQP.Queue.PurgeOk purgeOk = channel.queuePurge(queueName);
            return purgeOk == null ? 0 : purgeOk.getMessageCount();
        }
        catch (IOException e)
        {
            throw new TopologyException("Failed to purge queue '" + queueName + "'", e);
        }
    }

    /**
     * Declares the exchange of a message type and, when enabled, its direct dead letter exchange and queue
     *
     * @return the exchange name
     */
    public String configureTopologyForMessage(Channel channel, Class<?> messageType)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(messageType, "messageType");
        String exchangeName = endpointConvention.getExchangeName(messageType);
        ExchangeType exchangeType = endpointConvention.getExchangeType(messageType);
        Map<String, Object> exchangeArguments = endpointConvention.getTopologyRegistry()
                .getTopology(messageType)
                .map(topology -> topology.getExchangeArguments() == null || topology.getExchangeArguments().isEmpty()
                        ? null : (Map<String, Object>) new HashMap<>(topology.getExchangeArguments()))
                .orElse(null);
        declareExchange(channel, exchangeName, exchangeType, endpointConvention.isDurable(messageType),
                endpointConvention.isAutoDelete(messageType), exchangeArguments);

        if (options.isAutoConfigureDeadLetter())
        {
            String deadLetterQueue = getFormatter().formatDeadLetterQueueName(endpointConvention.getQueueName(messageType));
            declareDeadLetter(channel, getFormatter().formatDeadLetterExchangeName(exchangeName), deadLetterQueue);
        }
        log.info("Configured topology for message '{}' on exchange '{}' ({})", messageType.getName(), exchangeName, exchangeType);
        return exchangeName;
    }

    /**
     * Declares and binds the queue of a registered consumer.
     * An unregistered consumer is skipped with a warning.
     *
     * @return true when the consumer topology was declared
     */
    public boolean configureTopologyForConsumer(Channel channel, Class<?> consumerType)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(consumerType, "consumerType");
        Optional<ConsumerRegistration<?>> registration = consumerRegistry.find(consumerType);
        if (registration.isEmpty())
        {
            log.warn("Consumer '{}' has no registered message type, skipping its topology", consumerType.getName());
            return false;
        }
        configureTopologyForConsumer(channel, registration.get());
        return true;
    }

    /**
     * @return the declared queue name
     */
    public String configureTopologyForConsumer(Channel channel, ConsumerRegistration<?> registration)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(registration, "registration");
        Class<?> messageType = registration.getMessageType();
        ConsumerConfiguration configuration = registration.getConfiguration();

        String messageExchange = configureTopologyForMessage(channel, messageType);
        String exchangeName = resolveExchangeName(registration);
        if (!exchangeName.equals(messageExchange))
        {
            declareExchange(channel, exchangeName, endpointConvention.getExchangeType(messageType),
                    endpointConvention.isDurable(messageType), endpointConvention.isAutoDelete(messageType), null);
        }
        String queueName = resolveQueueName(registration);
        String routingKey = resolveRoutingKey(registration);

        Map<String, Object> arguments = new HashMap<>();
        if (StringUtils.isNotBlank(configuration.getDeadLetterExchange()))
        {
            arguments.put(QueueArguments.DEAD_LETTER_EXCHANGE, configuration.getDeadLetterExchange());
            if (StringUtils.isNotBlank(configuration.getDeadLetterRoutingKey()))
            {
                arguments.put(QueueArguments.DEAD_LETTER_ROUTING_KEY, configuration.getDeadLetterRoutingKey());
            }
        }
        else if (options.isAutoConfigureDeadLetter())
        {
            String deadLetterExchange = getFormatter().formatDeadLetterExchangeName(exchangeName);
            String deadLetterQueue = getFormatter().formatDeadLetterQueueName(queueName);
            declareDeadLetter(channel, deadLetterExchange, deadLetterQueue);
            arguments.put(QueueArguments.DEAD_LETTER_EXCHANGE, deadLetterExchange);
            arguments.put(QueueArguments.DEAD_LETTER_ROUTING_KEY, deadLetterQueue);
        }
        Long ttl = resolveMessageTtl(messageType, configuration, 0L);
        if (ttl != null)
        {
            arguments.put(QueueArguments.MESSAGE_TTL, ttl);
        }
        if (configuration.isPriorityQueue())
        {
            arguments.put(QueueArguments.MAX_PRIORITY, configuration.getMaxPriority());
        }

        declareQueue(channel, queueName, configuration.isDurable(), configuration.isExclusive(), configuration.isAutoDelete(), arguments);
        bindQueue(channel, queueName, exchangeName, routingKey, bindingArguments(messageType));

        if (options.isAutoConfigureRetryQueues())
        {
            configureRetryTopology(channel, queueName, retryDelays(configuration));
        }
        log.info("Configured consumer '{}' queue '{}' on exchange '{}' with routing key '{}'",
                registration.getConsumerType().getName(), queueName, exchangeName, routingKey);
        return queueName;
    }

    /**
     * Declares one delay queue per level. Each holds messages for its delay, then dead letters them back to the
     * work queue through the default exchange.
     *
     * @return the retry queue names, level 1 first
     */
    public List<String> configureRetryTopology(Channel channel, String queueName, List<Duration> delays)
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(delays, "delays");
        List<String> retryQueues = new ArrayList<>();
        for (int level = 1; level <= delays.size(); level++)
        {
            String retryQueue = getFormatter().formatRetryQueueName(queueName, level);
            Map<String, Object> arguments = new HashMap<>();
            arguments.put(QueueArguments.MESSAGE_TTL, delays.get(level - 1).toMillis());
            arguments.put(QueueArguments.DEAD_LETTER_EXCHANGE, "");
            arguments.put(QueueArguments.DEAD_LETTER_ROUTING_KEY, queueName);
            declareQueue(channel, retryQueue, true, false, false, arguments);
            retryQueues.add(retryQueue);
        }
        return retryQueues;
    }

    /**
     * Queue name of a consumer: endpoint mapping, then consumer configuration, then convention
     */
    public String resolveQueueName(ConsumerRegistration<?> registration)
    {
        Class<?> messageType = registration.getMessageType();
        Optional<EndpointInfo> endpoint = endpointConvention.getEndpoint(messageType);
        if (endpoint.isPresent() && StringUtils.isNotBlank(endpoint.get().getQueueName()))
        {
            return endpoint.get().getQueueName();
        }
        if (StringUtils.isNotBlank(registration.getConfiguration().getQueueName()))
        {
            return registration.getConfiguration().getQueueName();
        }
        return getFormatter().formatQueueName(registration.getConsumerType(), messageType);
    }

    /**
     * Exchange name of a consumer: endpoint mapping, then consumer configuration, then topology and convention
     */
    public String resolveExchangeName(ConsumerRegistration<?> registration)
    {
        Class<?> messageType = registration.getMessageType();
        Optional<EndpointInfo> endpoint = endpointConvention.getEndpoint(messageType);
        if (endpoint.isPresent() && StringUtils.isNotBlank(endpoint.get().getExchangeName()))
        {
            return endpoint.get().getExchangeName();
        }
        if (StringUtils.isNotBlank(registration.getConfiguration().getExchangeName()))
        {
            return registration.getConfiguration().getExchangeName();
        }
        return endpointConvention.getExchangeName(messageType);
    }

    /**
     * Binding key of a consumer. Fanout exchanges always bind with an empty key.
     */
    public String resolveRoutingKey(ConsumerRegistration<?> registration)
    {
        Class<?> messageType = registration.getMessageType();
        if (endpointConvention.getExchangeType(messageType) == ExchangeType.Fanout)
        {
            return "";
        }
        Optional<EndpointInfo> endpoint = endpointConvention.getEndpoint(messageType);
        if (endpoint.isPresent() && endpoint.get().getRoutingKey() != null)
        {
            return endpoint.get().getRoutingKey();
        }
        if (registration.getConfiguration().getRoutingKey() != null)
        {
            return registration.getConfiguration().getRoutingKey();
        }
        Optional<? extends MessageTopology<?>> topology = endpointConvention.getTopologyRegistry().getTopology(messageType);
        if (topology.isPresent() && topology.get().getRoutingKey() != null)
        {
            return topology.get().getRoutingKey();
        }
        return endpointConvention.getRoutingKeyConvention().getSubscriptionPattern(registration.getConsumerType(), messageType);
    }

    /**
     * Queue message TTL: topology value, then consumer configuration, then the given default
     *
     * @return the TTL in milliseconds or null when none applies
     */
    Long resolveMessageTtl(Class<?> messageType, ConsumerConfiguration configuration, long defaultTtlMs)
    {
        Optional<? extends MessageTopology<?>> topology = endpointConvention.getTopologyRegistry().getTopology(messageType);
        if (topology.isPresent() && topology.get().getMessageTtlMs() != null && topology.get().getMessageTtlMs() > 0)
        {
            return topology.get().getMessageTtlMs();
        }
        if (configuration != null && configuration.getMessageTtl() != null && configuration.getMessageTtl().toMillis() > 0)
        {
            return configuration.getMessageTtl().toMillis();
        }
        return defaultTtlMs > 0 ? defaultTtlMs : null;
    }

    Map<String, Object> bindingArguments(Class<?> messageType)
    {
        return endpointConvention.getEndpoint(messageType)
                .map(EndpointInfo::getBindingArguments)
                .filter(arguments -> !arguments.isEmpty())
                .orElse(null);
    }

    EndpointConvention getEndpointConvention()
    {
        return endpointConvention;
    }

    ConsumerRegistry getConsumerRegistry()
    {
        return consumerRegistry;
    }

    private EndpointNameFormatter getFormatter()
    {
        return endpointConvention.getFormatter();
    }

    void declareDeadLetter(Channel channel, String deadLetterExchange, String deadLetterQueue)
    {
        declareExchange(channel, deadLetterExchange, ExchangeType.Direct, true, false, null);
        declareQueue(channel, deadLetterQueue, true, false, false, null);
        bindQueue(channel, deadLetterQueue, deadLetterExchange, deadLetterQueue, null);
    }

    private List<Duration> retryDelays(ConsumerConfiguration configuration)
    {
        Duration base = configuration.getRetryDelay() == null ? Duration.ofSeconds(1) : configuration.getRetryDelay();
        List<Duration> delays = new ArrayList<>();
        for (int level = 1; level <= options.getRetryLevels(); level++)
        {
            delays.add(configuration.isUseExponentialBackoff() ? base.multipliedBy(1L << (level - 1)) : base);
        }
        return delays;
    }
}
