package com.guicedee.rabbitbus.saga;

import com.guicedee.rabbitbus.fixtures.saga.OrderSagaInstance;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SagaConfigurationBuilderTest
{
    @Test
    void defaults()
    {
        SagaConfiguration<OrderSagaInstance> configuration = new SagaConfigurationBuilder<>(OrderSagaInstance.class).build();

        assertEquals(SagaPersistence.InMemory, configuration.getPersistence());
        assertEquals("saga:OrderSagaInstance:", configuration.getKeyPrefix());
        assertEquals(Duration.ofHours(24), configuration.getDefaultExpiration());
        assertEquals(Duration.ofHours(1), configuration.getCompletedExpiration());
        assertTrue(configuration.isEnableTimeouts());
        assertEquals(Duration.ofMinutes(1), configuration.getTimeoutCheckInterval());
    }

    @Test
    void presets()
    {
        SagaConfiguration<OrderSagaInstance> highAvailability = new SagaConfigurationBuilder<>(OrderSagaInstance.class)
                .highAvailability()
                .build();
        assertEquals(Duration.ofDays(7), highAvailability.getDefaultExpiration());
        assertEquals(Duration.ofDays(7), highAvailability.getCompletedExpiration());
        assertEquals(Duration.ofSeconds(30), highAvailability.getTimeoutCheckInterval());

        SagaConfiguration<OrderSagaInstance> shortLived = new SagaConfigurationBuilder<>(OrderSagaInstance.class)
                .disableTimeouts()
                .shortLived()
                .build();
        assertEquals(Duration.ofHours(1), shortLived.getDefaultExpiration());
        assertEquals(Duration.ofMinutes(5), shortLived.getCompletedExpiration());
        assertTrue(shortLived.isEnableTimeouts());
        assertEquals(Duration.ofSeconds(10), shortLived.getTimeoutCheckInterval());
    }

    @Test
    void externalStoresNeedTheirSettings()
    {
        assertThrows(IllegalStateException.class, () -> new SagaConfigurationBuilder<>(OrderSagaInstance.class).useRedis(" ").build());
        assertThrows(IllegalStateException.class,
                () -> new SagaConfigurationBuilder<>(OrderSagaInstance.class).useMongoDb("mongodb://localhost", null).build());
        assertThrows(IllegalStateException.class, () -> new SagaConfigurationBuilder<>(OrderSagaInstance.class).useRelational(null).build());
    }

    @Test
    void redisKeepsConnectionAndPrefix()
    {
        SagaConfiguration<OrderSagaInstance> configuration = new SagaConfigurationBuilder<>(OrderSagaInstance.class)
                .useRedis("redis://localhost:6379", "orders:")
                .disableTimeouts()
                .build();

        assertEquals(SagaPersistence.Redis, configuration.getPersistence());
        assertEquals("redis://localhost:6379", configuration.getConnectionString());
        assertEquals("orders:", configuration.getKeyPrefix());
        assertFalse(configuration.isEnableTimeouts());
    }

    @Test
    void relationalKeepsTheRepositoryType()
    {
        SagaConfiguration<OrderSagaInstance> configuration = new SagaConfigurationBuilder<>(OrderSagaInstance.class)
                .useRelational(InMemorySagaRepository.class)
                .build();

        assertEquals(SagaPersistence.Relational, configuration.getPersistence());
        assertEquals(InMemorySagaRepository.class, configuration.getRepositoryType());
    }

    @Test
    void durationsMustBePositive()
    {
        SagaConfigurationBuilder<OrderSagaInstance> builder = new SagaConfigurationBuilder<>(OrderSagaInstance.class);
        assertThrows(IllegalArgumentException.class, () -> builder.defaultExpiration(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.completedExpiration(Duration.ofMinutes(-1)));
        assertThrows(IllegalArgumentException.class, () -> builder.enableTimeouts(Duration.ZERO));
        assertThrows(NullPointerException.class, () -> builder.defaultExpiration(null));
    }
}
