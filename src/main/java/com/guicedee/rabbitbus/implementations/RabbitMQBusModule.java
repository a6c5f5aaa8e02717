package com.guicedee.rabbitbus.implementations;

import com.google.inject.AbstractModule;
import com.google.inject.Binder;
import com.google.inject.Key;
import com.google.inject.Provider;
import com.google.inject.name.Names;
import com.google.inject.util.Types;
import com.guicedee.rabbitbus.ConsumerConfiguration;
import com.guicedee.rabbitbus.RabbitMQBusConfiguration;
import com.guicedee.rabbitbus.RabbitMQClientOptions;
import com.guicedee.rabbitbus.RabbitMQConnectionOptions;
import com.guicedee.rabbitbus.RequestClientRegistration;
import com.guicedee.rabbitbus.outbox.InMemoryOutboxStore;
import com.guicedee.rabbitbus.outbox.OutboxMode;
import com.guicedee.rabbitbus.outbox.OutboxOptions;
import com.guicedee.rabbitbus.outbox.OutboxPublisher;
import com.guicedee.rabbitbus.outbox.OutboxStore;
import com.guicedee.rabbitbus.outbox.TransactionalBus;
import com.guicedee.rabbitbus.resilience.CircuitBreaker;
import com.guicedee.rabbitbus.resilience.CircuitBreakerPolicyConfiguration;
import com.guicedee.rabbitbus.resilience.RetryExecutor;
import com.guicedee.rabbitbus.resilience.RetryPolicyConfiguration;
import com.guicedee.rabbitbus.topology.AutoBindingHelper;
import com.guicedee.rabbitbus.topology.ConsumerRegistration;
import com.guicedee.rabbitbus.topology.ConsumerRegistry;
import com.guicedee.rabbitbus.topology.EndpointConfiguration;
import com.guicedee.rabbitbus.topology.EndpointConvention;
import com.guicedee.rabbitbus.topology.EndpointNameFormatter;
import com.guicedee.rabbitbus.topology.ExchangeBindingHelper;
import com.guicedee.rabbitbus.topology.MessageTopologyRegistry;
import com.guicedee.rabbitbus.topology.RoutingKeyConvention;
import com.guicedee.rabbitbus.topology.TopologyBuilder;
import io.vertx.core.Vertx;
import io.vertx.rabbitmq.RabbitMQClient;
import jakarta.inject.Singleton;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.function.Consumer;

/**
 * Binds the configured bus into Guice. Created by {@link com.guicedee.rabbitbus.RabbitMQConfigurationBuilder#build()}.
 */
@Log4j2
public class RabbitMQBusModule extends AbstractModule
{
    public static final String BUS_VERTX_NAME = "rabbitmq-bus";
    /**
     * The Vert.x instance the client, retries, outbox publisher and saga timeouts run on
     */
    public static final Key<Vertx> BUS_VERTX = Key.get(Vertx.class, Names.named(BUS_VERTX_NAME));
    public static final String CIRCUIT_BREAKER_NAME = "rabbitmq";

    @Getter
    private final RabbitMQBusConfiguration configuration;
    @Getter
    private final ConsumerRegistry consumerRegistry;
    @Getter
    private final MessageTopologyRegistry topologyRegistry;
    private final List<Consumer<Binder>> deferredRegistrations;
    private final Vertx vertx;

    public RabbitMQBusModule(RabbitMQBusConfiguration configuration, ConsumerRegistry consumerRegistry,
                             MessageTopologyRegistry topologyRegistry, List<Consumer<Binder>> deferredRegistrations, Vertx vertx)
    {
        this.configuration = configuration;
        this.consumerRegistry = consumerRegistry;
        this.topologyRegistry = topologyRegistry;
        this.deferredRegistrations = List.copyOf(deferredRegistrations);
        this.vertx = vertx;
    }

    @Override
    protected void configure()
    {
        bind(RabbitMQBusConfiguration.class).toInstance(configuration);
        bind(RabbitMQConnectionOptions.class).toInstance(configuration.getConnectionOptions());
        bind(RabbitMQClientOptions.class).toInstance(configuration.getClientOptions());
        bind(ConsumerRegistry.class).toInstance(consumerRegistry);
        bind(MessageTopologyRegistry.class).toInstance(topologyRegistry);

        bind(BUS_VERTX).toProvider(new BusVertxProvider(vertx))
                       .in(Singleton.class);
        bind(RabbitMQClient.class).toProvider(new RabbitMQClientProvider(configuration.getConnectionOptions()
                                                                                      .toOptions()))
                                  .in(Singleton.class);

        configureEndpoints();
        configureConsumers();
        configureResilience();
        configureOutbox();

        for (Consumer<Binder> registration : deferredRegistrations)
        {
            registration.accept(binder());
        }
        log.debug("RabbitMQ bus bound with {} consumers, {} request clients and {} sagas", configuration.getConsumers()
                                                                                                       .size(),
                configuration.getRequestClients()
                             .size(), configuration.getSagas()
                                                   .size());
    }

    private void configureEndpoints()
    {
        EndpointConfiguration endpoints = configuration.getEndpointConfiguration();
        EndpointConvention convention = endpoints.createEndpointConvention(topologyRegistry);
        TopologyBuilder topologyBuilder = new TopologyBuilder(convention, consumerRegistry, endpoints.getTopologyOptions());

        bind(EndpointConfiguration.class).toInstance(endpoints);
        bind(EndpointConvention.class).toInstance(convention);
        // unscoped, the convention swaps both on configure and reset
        Provider<EndpointNameFormatter> formatter = convention::getFormatter;
        Provider<RoutingKeyConvention> routingKeys = convention::getRoutingKeyConvention;
        bind(EndpointNameFormatter.class).toProvider(formatter);
        bind(RoutingKeyConvention.class).toProvider(routingKeys);
        bind(TopologyBuilder.class).toInstance(topologyBuilder);
        bind(AutoBindingHelper.class).toInstance(new AutoBindingHelper(topologyBuilder, endpoints.getAutoBindingOptions()));
        bind(ExchangeBindingHelper.class).toInstance(new ExchangeBindingHelper(topologyBuilder));
    }

    @SuppressWarnings("unchecked")
    private void configureConsumers()
    {
        for (ConsumerRegistration<?> consumer : configuration.getConsumers())
        {
            bind(Key.get(ConsumerConfiguration.class, Names.named(consumer.getConsumerType()
                                                                          .getName())))
                    .toInstance(consumer.getConfiguration());
        }
        for (RequestClientRegistration<?, ?> requestClient : configuration.getRequestClients())
        {
            Key<RequestClientRegistration<?, ?>> key = (Key<RequestClientRegistration<?, ?>>) Key.get(
                    Types.newParameterizedType(RequestClientRegistration.class, requestClient.getRequestType(), requestClient.getResponseType()));
            bind(key).toInstance(requestClient);
        }
    }

    private void configureResilience()
    {
        if (configuration.getRetryPolicy()
                         .isPresent())
        {
            bind(RetryPolicyConfiguration.class).toInstance(configuration.getRetryPolicy()
                                                                         .get());
            bind(RetryExecutor.class).toProvider(new RetryExecutorProvider())
                                     .in(Singleton.class);
        }
        if (configuration.getCircuitBreakerPolicy()
                         .isPresent())
        {
            CircuitBreakerPolicyConfiguration policy = configuration.getCircuitBreakerPolicy()
                                                                    .get();
            bind(CircuitBreakerPolicyConfiguration.class).toInstance(policy);
            bind(CircuitBreaker.class).toInstance(new CircuitBreaker(CIRCUIT_BREAKER_NAME, policy));
        }
    }

    private void configureOutbox()
    {
        if (configuration.getOutboxMode() == OutboxMode.None)
        {
            return;
        }
        OutboxOptions options = configuration.getOutboxOptions();
        bind(OutboxOptions.class).toInstance(options);
        if (configuration.getOutboxMode() == OutboxMode.InMemory)
        {
            log.warn("The in memory outbox loses unpublished messages on restart");
            bind(OutboxStore.class).toInstance(new InMemoryOutboxStore());
        }
        else
        {
            bind(OutboxStore.class).to(configuration.getOutboxStoreType())
                                   .in(Singleton.class);
        }
        bind(TransactionalBus.class).toProvider(new TransactionalBusProvider())
                                    .in(Singleton.class);
        bind(OutboxPublisher.class).toProvider(new OutboxPublisherProvider())
                                   .in(Singleton.class);
    }
}
