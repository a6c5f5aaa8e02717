package com.guicedee.rabbitbus;

import com.guicedee.rabbitbus.outbox.OutboxMode;
import com.guicedee.rabbitbus.outbox.OutboxOptions;
import com.guicedee.rabbitbus.outbox.OutboxStore;
import com.guicedee.rabbitbus.resilience.CircuitBreakerPolicyConfiguration;
import com.guicedee.rabbitbus.resilience.RetryPolicyConfiguration;
import com.guicedee.rabbitbus.saga.SagaRegistration;
import com.guicedee.rabbitbus.topology.ConsumerRegistration;
import com.guicedee.rabbitbus.topology.EndpointConfiguration;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the bus was configured with, captured once by {@link RabbitMQConfigurationBuilder#build()}
 */
@Value
public class RabbitMQBusConfiguration
{
    RabbitMQConnectionOptions connectionOptions;
    RabbitMQClientOptions clientOptions;
    List<ConsumerRegistration<?>> consumers;
    List<RequestClientRegistration<?, ?>> requestClients;
    @Getter(AccessLevel.NONE)
    RetryPolicyConfiguration retryPolicy;
    @Getter(AccessLevel.NONE)
    CircuitBreakerPolicyConfiguration circuitBreakerPolicy;
    OutboxMode outboxMode;
    OutboxOptions outboxOptions;
    Class<? extends OutboxStore> outboxStoreType;
    List<SagaRegistration<?, ?>> sagas;
    EndpointConfiguration endpointConfiguration;
    boolean autoConfigureEndpoints;

    public Optional<RetryPolicyConfiguration> getRetryPolicy()
    {
        return Optional.ofNullable(retryPolicy);
    }

    public Optional<CircuitBreakerPolicyConfiguration> getCircuitBreakerPolicy()
    {
        return Optional.ofNullable(circuitBreakerPolicy);
    }

    public boolean isOutboxEnabled()
    {
        return outboxMode != OutboxMode.None;
    }

    /**
     * The consumer configurations keyed by consumer class name
     */
    public Map<String, ConsumerConfiguration> getConsumerConfigurations()
    {
        Map<String, ConsumerConfiguration> configurations = new LinkedHashMap<>();
        for (ConsumerRegistration<?> consumer : consumers)
        {
            configurations.put(consumer.getConsumerType()
                                       .getName(), consumer.getConfiguration());
        }
        return configurations;
    }
}
