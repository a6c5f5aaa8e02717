package com.guicedee.rabbitbus.saga;

import com.google.inject.Binder;
import com.google.inject.Key;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import com.google.inject.util.Types;
import io.vertx.core.Vertx;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.util.Objects;

/**
 * A saga state machine with its instance type and store settings, bound into Guice when the bus module is installed
 */
@Getter
@Log4j2
public class SagaRegistration<S extends SagaStateMachine<I>, I extends SagaInstance>
{
    private final Class<S> sagaType;
    private final Class<I> instanceType;
    private final SagaConfiguration<I> configuration;

    public SagaRegistration(Class<S> sagaType, Class<I> instanceType, SagaConfiguration<I> configuration)
    {
        this.sagaType = Objects.requireNonNull(sagaType, "sagaType");
        this.instanceType = Objects.requireNonNull(instanceType, "instanceType");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    /**
     * Binds the saga, its configuration, its repository where this layer owns one, and its timeout scheduler
     *
     * @param vertxKey the Vert.x instance the timeout scheduler polls on
     */
    @SuppressWarnings("unchecked")
    public void register(Binder binder, Key<Vertx> vertxKey)
    {
        binder.bind(sagaType)
              .in(Scopes.SINGLETON);
        Key<SagaConfiguration<I>> configurationKey = (Key<SagaConfiguration<I>>) Key.get(Types.newParameterizedType(SagaConfiguration.class, instanceType));
        binder.bind(configurationKey)
              .toInstance(configuration);

        Key<SagaRepository<I>> repositoryKey = (Key<SagaRepository<I>>) Key.get(Types.newParameterizedType(SagaRepository.class, instanceType));
        switch (configuration.getPersistence())
        {
            case InMemory:
                binder.bind(repositoryKey)
                      .toInstance(new InMemorySagaRepository<>(configuration));
                break;
            case Relational:
                binder.bind(repositoryKey)
                      .to((Class<? extends SagaRepository<I>>) (Class<?>) configuration.getRepositoryType())
                      .in(Scopes.SINGLETON);
                break;
            default:
                log.info("Saga '{}' uses {} persistence, the repository binding is left to its store module", sagaType.getSimpleName(),
                        configuration.getPersistence());
                break;
        }

        Key<SagaTimeoutScheduler<I>> schedulerKey = (Key<SagaTimeoutScheduler<I>>) Key.get(Types.newParameterizedType(SagaTimeoutScheduler.class, instanceType));
        Provider<Vertx> vertx = binder.getProvider(vertxKey);
        Provider<S> saga = binder.getProvider(sagaType);
        Provider<SagaRepository<I>> repository = binder.getProvider(repositoryKey);
        binder.bind(schedulerKey)
              .toProvider(() -> new SagaTimeoutScheduler<>(vertx.get(), saga.get(), repository.get(), configuration))
              .in(Scopes.SINGLETON);
        log.debug("Saga '{}' registered for instance '{}'", sagaType.getName(), instanceType.getName());
    }
}
