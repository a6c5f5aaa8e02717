package com.guicedee.rabbitbus;

import com.google.inject.Binder;
import com.guicedee.rabbitbus.implementations.RabbitMQBusModule;
import com.guicedee.rabbitbus.outbox.OutboxMode;
import com.guicedee.rabbitbus.outbox.OutboxOptions;
import com.guicedee.rabbitbus.outbox.OutboxStore;
import com.guicedee.rabbitbus.resilience.CircuitBreakerPolicyBuilder;
import com.guicedee.rabbitbus.resilience.CircuitBreakerPolicyConfiguration;
import com.guicedee.rabbitbus.resilience.RetryPolicyBuilder;
import com.guicedee.rabbitbus.resilience.RetryPolicyConfiguration;
import com.guicedee.rabbitbus.saga.SagaConfiguration;
import com.guicedee.rabbitbus.saga.SagaConfigurationBuilder;
import com.guicedee.rabbitbus.saga.SagaInstance;
import com.guicedee.rabbitbus.saga.SagaRegistration;
import com.guicedee.rabbitbus.saga.SagaStateMachine;
import com.guicedee.rabbitbus.topology.ConsumerRegistration;
import com.guicedee.rabbitbus.topology.ConsumerRegistry;
import com.guicedee.rabbitbus.topology.EndpointConfiguration;
import com.guicedee.rabbitbus.topology.EndpointConfigurationBuilder;
import com.guicedee.rabbitbus.topology.MessageTopology;
import com.guicedee.rabbitbus.topology.MessageTopologyRegistry;
import io.vertx.core.Vertx;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Fluent configuration of the bus.
 * <pre>
 * Module module = new RabbitMQConfigurationBuilder()
 *         .host("rabbit", 5672, host -&gt; host.setUser("app").setPassword("secret"))
 *         .addConsumer(OrderConsumer.class, OrderPlaced.class, c -&gt; c.setPrefetchCount(32))
 *         .useRetry(r -&gt; r.retryCount(5).withJitter())
 *         .useInMemoryOutbox()
 *         .build();
 * </pre>
 * Not thread safe, meant for a single configuration pass.
 */
@Log4j2
public class RabbitMQConfigurationBuilder
{
    private final RabbitMQConnectionOptions connectionOptions = new RabbitMQConnectionOptions();
    private final RabbitMQClientOptions clientOptions = new RabbitMQClientOptions();
    private final ConsumerRegistry consumerRegistry = new ConsumerRegistry();
    private final MessageTopologyRegistry topologyRegistry = new MessageTopologyRegistry();
    private final List<RequestClientRegistration<?, ?>> requestClients = new ArrayList<>();
    private final List<SagaRegistration<?, ?>> sagas = new ArrayList<>();
    private final List<Consumer<Binder>> deferredRegistrations = new ArrayList<>();

    private RetryPolicyConfiguration retryPolicy;
    private CircuitBreakerPolicyConfiguration circuitBreakerPolicy;
    private OutboxMode outboxMode = OutboxMode.None;
    private OutboxOptions outboxOptions = OutboxOptions.defaults();
    private Class<? extends OutboxStore> outboxStoreType;
    private EndpointConfiguration endpointConfiguration = EndpointConfiguration.defaults();
    private boolean autoConfigureEndpoints;
    private Vertx vertx;
    private boolean built;

    public RabbitMQConfigurationBuilder host(String uri)
    {
        connectionOptions.setUri(Objects.requireNonNull(uri, "uri"));
        return this;
    }

    public RabbitMQConfigurationBuilder host(String host, int port)
    {
        return host(host, port, options -> {
        });
    }

    public RabbitMQConfigurationBuilder host(String host, int port, Consumer<RabbitMQConnectionOptions> configure)
    {
        if (port < 1 || port > 65535)
        {
            throw new IllegalArgumentException("port must be between 1 and 65535 but was " + port);
        }
        connectionOptions.setHost(Objects.requireNonNull(host, "host"))
                         .setPort(port);
        Objects.requireNonNull(configure, "configure")
               .accept(connectionOptions);
        return this;
    }

    public RabbitMQConfigurationBuilder host(Consumer<RabbitMQConnectionOptions> configure)
    {
        Objects.requireNonNull(configure, "configure")
               .accept(connectionOptions);
        return this;
    }

    public <M, C extends MessageConsumer<M>> RabbitMQConfigurationBuilder addConsumer(Class<C> consumerType, Class<M> messageType)
    {
        return addConsumer(consumerType, messageType, configuration -> {
        });
    }

    public <M, C extends MessageConsumer<M>> RabbitMQConfigurationBuilder addConsumer(Class<C> consumerType, Class<M> messageType,
                                                                                     Consumer<ConsumerConfiguration> configure)
    {
        ConsumerConfiguration configuration = new ConsumerConfiguration();
        Objects.requireNonNull(configure, "configure")
               .accept(configuration);
        configuration.validate();
        consumerRegistry.register(consumerType, messageType, configuration);
        return this;
    }

    /**
     * Registers a consumer, its message type read from the {@link MessageConsumer} it implements
     *
     * @throws IllegalStateException when the message type cannot be resolved
     */
    public RabbitMQConfigurationBuilder addConsumer(Class<?> consumerType)
    {
        consumerRegistry.registerScanned(consumerType);
        return this;
    }

    /**
     * Registers every concrete consumer found in the packages. Consumers whose message type cannot be resolved are skipped.
     */
    public RabbitMQConfigurationBuilder addConsumersFromPackage(String... packages)
    {
        for (Class<?> consumerType : consumerRegistry.scan(packages))
        {
            if (consumerRegistry.find(consumerType)
                                .isPresent())
            {
                continue;
            }
            try
            {
                consumerRegistry.registerScanned(consumerType);
            }
            catch (IllegalStateException e)
            {
                log.warn("Skipping consumer '{}': {}", consumerType.getName(), e.getMessage());
            }
        }
        return this;
    }

    public <T> RabbitMQConfigurationBuilder addMessageTopology(Class<T> messageType, UnaryOperator<MessageTopology.MessageTopologyBuilder<T>> configure)
    {
        topologyRegistry.register(messageType, configure);
        return this;
    }

    public <Q, R> RabbitMQConfigurationBuilder addRequestClient(Class<Q> requestType, Class<R> responseType)
    {
        return addRequestClient(requestType, responseType, options -> {
        });
    }

    public <Q, R> RabbitMQConfigurationBuilder addRequestClient(Class<Q> requestType, Class<R> responseType, Consumer<RequestClientOptions> configure)
    {
        Objects.requireNonNull(requestType, "requestType");
        Objects.requireNonNull(responseType, "responseType");
        RequestClientOptions options = new RequestClientOptions();
        Objects.requireNonNull(configure, "configure")
               .accept(options);
        if (options.getTimeout() == null || options.getTimeout()
                                                   .isNegative() || options.getTimeout()
                                                                           .isZero())
        {
            throw new IllegalArgumentException("Request client timeout must be positive");
        }
        requestClients.add(new RequestClientRegistration<>(requestType, responseType, options));
        return this;
    }

    public RabbitMQConfigurationBuilder useRetry(Consumer<RetryPolicyBuilder> configure)
    {
        RetryPolicyBuilder builder = new RetryPolicyBuilder();
        Objects.requireNonNull(configure, "configure")
               .accept(builder);
        retryPolicy = builder.build();
        return this;
    }

    /**
     * Uses a policy started from one of the {@link RetryPolicyBuilder} presets
     */
    public RabbitMQConfigurationBuilder useRetry(RetryPolicyBuilder builder)
    {
        retryPolicy = Objects.requireNonNull(builder, "builder")
                             .build();
        return this;
    }

    public RabbitMQConfigurationBuilder useCircuitBreaker(Consumer<CircuitBreakerPolicyBuilder> configure)
    {
        CircuitBreakerPolicyBuilder builder = new CircuitBreakerPolicyBuilder();
        Objects.requireNonNull(configure, "configure")
               .accept(builder);
        circuitBreakerPolicy = builder.build();
        return this;
    }

    public RabbitMQConfigurationBuilder useInMemoryOutbox()
    {
        return useInMemoryOutbox(OutboxOptions.defaults());
    }

    public RabbitMQConfigurationBuilder useInMemoryOutbox(OutboxOptions options)
    {
        outboxMode = OutboxMode.InMemory;
        outboxOptions = Objects.requireNonNull(options, "options")
                               .validate();
        return this;
    }

    public RabbitMQConfigurationBuilder useInMemoryOutbox(Consumer<OutboxOptions.OutboxOptionsBuilder> configure)
    {
        return useInMemoryOutbox(configureOutbox(configure));
    }

    /**
     * A durable outbox, the store bound as a Guice singleton of the given type
     */
    public RabbitMQConfigurationBuilder usePersistentOutbox(Class<? extends OutboxStore> storeType)
    {
        return usePersistentOutbox(storeType, OutboxOptions.defaults());
    }

    public RabbitMQConfigurationBuilder usePersistentOutbox(Class<? extends OutboxStore> storeType, OutboxOptions options)
    {
        outboxMode = OutboxMode.Persistent;
        outboxStoreType = storeType;
        outboxOptions = Objects.requireNonNull(options, "options")
                               .validate();
        return this;
    }

    public RabbitMQConfigurationBuilder usePersistentOutbox(Class<? extends OutboxStore> storeType,
                                                            Consumer<OutboxOptions.OutboxOptionsBuilder> configure)
    {
        return usePersistentOutbox(storeType, configureOutbox(configure));
    }

    public <S extends SagaStateMachine<I>, I extends SagaInstance> RabbitMQConfigurationBuilder addSaga(Class<S> sagaType, Class<I> instanceType)
    {
        return addSaga(sagaType, instanceType, saga -> {
        });
    }

    public <S extends SagaStateMachine<I>, I extends SagaInstance> RabbitMQConfigurationBuilder addSaga(Class<S> sagaType, Class<I> instanceType,
                                                                                                       Consumer<SagaConfigurationBuilder<I>> configure)
    {
        SagaConfigurationBuilder<I> builder = new SagaConfigurationBuilder<>(instanceType);
        Objects.requireNonNull(configure, "configure")
               .accept(builder);
        SagaConfiguration<I> configuration = builder.build();
        SagaRegistration<S, I> registration = new SagaRegistration<>(sagaType, instanceType, configuration);
        sagas.add(registration);
        deferredRegistrations.add(binder -> registration.register(binder, RabbitMQBusModule.BUS_VERTX));
        return this;
    }

    /**
     * Marks the bus for endpoint auto configuration with the default conventions.
     * Only the {@link RabbitMQBusConfiguration#isAutoConfigureEndpoints()} flag is set, startup code that owns a channel reads it
     * and declares the endpoints through {@link com.guicedee.rabbitbus.topology.AutoBindingHelper}.
     */
    public RabbitMQConfigurationBuilder configureEndpoints()
    {
        autoConfigureEndpoints = true;
        return this;
    }

    /**
     * Replaces the endpoint conventions and sets the same auto configuration flag as {@link #configureEndpoints()}
     */
    public RabbitMQConfigurationBuilder configureEndpoints(Consumer<EndpointConfigurationBuilder> configure)
    {
        EndpointConfigurationBuilder builder = new EndpointConfigurationBuilder();
        Objects.requireNonNull(configure, "configure")
               .accept(builder);
        endpointConfiguration = builder.build();
        autoConfigureEndpoints = true;
        return this;
    }

    public RabbitMQConfigurationBuilder configureClient(Consumer<RabbitMQClientOptions> configure)
    {
        Objects.requireNonNull(configure, "configure")
               .accept(clientOptions);
        return this;
    }

    /**
     * The Vert.x instance to use when none is bound in the injector
     */
    public RabbitMQConfigurationBuilder useVertx(Vertx vertx)
    {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        return this;
    }

    /**
     * Captures the configuration and returns the module that binds it
     *
     * @throws IllegalStateException when called twice, or when a persistent outbox has no store type
     */
    public RabbitMQBusModule build()
    {
        if (built)
        {
            throw new IllegalStateException("The RabbitMQ bus configuration has already been built");
        }
        if (outboxMode == OutboxMode.Persistent && outboxStoreType == null)
        {
            throw new IllegalStateException("A persistent outbox needs an OutboxStore type");
        }
        built = true;

        List<ConsumerRegistration<?>> consumers = consumerRegistry.getRegistrations();
        RabbitMQBusConfiguration configuration = new RabbitMQBusConfiguration(connectionOptions, clientOptions, consumers,
                List.copyOf(requestClients), retryPolicy, circuitBreakerPolicy, outboxMode, outboxOptions, outboxStoreType,
                List.copyOf(sagas), endpointConfiguration, autoConfigureEndpoints);
        log.info("RabbitMQ bus configured with {} consumers, outbox {}", consumers.size(), outboxMode);
        return new RabbitMQBusModule(configuration, consumerRegistry, topologyRegistry, deferredRegistrations, vertx);
    }

    private static OutboxOptions configureOutbox(Consumer<OutboxOptions.OutboxOptionsBuilder> configure)
    {
        OutboxOptions.OutboxOptionsBuilder builder = OutboxOptions.defaults()
                                                                  .toBuilder();
        Objects.requireNonNull(configure, "configure")
               .accept(builder);
        return builder.build();
    }
}
