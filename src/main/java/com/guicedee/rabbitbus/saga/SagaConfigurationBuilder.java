package com.guicedee.rabbitbus.saga;

import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.Objects;

/**
 * Selects the saga store and its expiration and timeout settings
 */
public class SagaConfigurationBuilder<I extends SagaInstance>
{
    public static final Duration DEFAULT_EXPIRATION = Duration.ofHours(24);
    public static final Duration DEFAULT_COMPLETED_EXPIRATION = Duration.ofHours(1);
    public static final Duration DEFAULT_TIMEOUT_CHECK_INTERVAL = Duration.ofMinutes(1);

    private final Class<I> instanceType;
    private SagaPersistence persistence = SagaPersistence.InMemory;
    private String connectionString;
    private String databaseName;
    private String keyPrefix;
    @SuppressWarnings("rawtypes")
    private Class<? extends SagaRepository> repositoryType;
    private Duration defaultExpiration = DEFAULT_EXPIRATION;
    private Duration completedExpiration = DEFAULT_COMPLETED_EXPIRATION;
    private boolean enableTimeouts = true;
    private Duration timeoutCheckInterval = DEFAULT_TIMEOUT_CHECK_INTERVAL;

    public SagaConfigurationBuilder(Class<I> instanceType)
    {
        this.instanceType = Objects.requireNonNull(instanceType, "instanceType");
        this.keyPrefix = "saga:" + instanceType.getSimpleName() + ":";
    }

    public SagaConfigurationBuilder<I> useInMemory()
    {
        persistence = SagaPersistence.InMemory;
        return this;
    }

    public SagaConfigurationBuilder<I> useRedis(String connectionString)
    {
        persistence = SagaPersistence.Redis;
        this.connectionString = connectionString;
        return this;
    }

    public SagaConfigurationBuilder<I> useRedis(String connectionString, String keyPrefix)
    {
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
        return useRedis(connectionString);
    }

    @SuppressWarnings("rawtypes")
    public SagaConfigurationBuilder<I> useRelational(Class<? extends SagaRepository> repositoryType)
    {
        persistence = SagaPersistence.Relational;
        this.repositoryType = repositoryType;
        return this;
    }

    public SagaConfigurationBuilder<I> useMongoDb(String connectionString, String databaseName)
    {
        persistence = SagaPersistence.MongoDb;
        this.connectionString = connectionString;
        this.databaseName = databaseName;
        return this;
    }

    public SagaConfigurationBuilder<I> defaultExpiration(Duration expiration)
    {
        this.defaultExpiration = requirePositive(expiration, "defaultExpiration");
        return this;
    }

    public SagaConfigurationBuilder<I> completedExpiration(Duration expiration)
    {
        this.completedExpiration = requirePositive(expiration, "completedExpiration");
        return this;
    }

    public SagaConfigurationBuilder<I> enableTimeouts(Duration checkInterval)
    {
        this.enableTimeouts = true;
        this.timeoutCheckInterval = requirePositive(checkInterval, "checkInterval");
        return this;
    }

    public SagaConfigurationBuilder<I> disableTimeouts()
    {
        this.enableTimeouts = false;
        return this;
    }

    /**
     * Week long retention, timeouts checked every 30 seconds
     */
    public SagaConfigurationBuilder<I> highAvailability()
    {
        return defaultExpiration(Duration.ofDays(7))
                .completedExpiration(Duration.ofDays(7))
                .enableTimeouts(Duration.ofSeconds(30));
    }

    /**
     * An hour for running sagas, five minutes for completed ones, timeouts checked every 10 seconds
     */
    public SagaConfigurationBuilder<I> shortLived()
    {
        return defaultExpiration(Duration.ofHours(1))
                .completedExpiration(Duration.ofMinutes(5))
                .enableTimeouts(Duration.ofSeconds(10));
    }

    /**
     * @throws IllegalStateException when the selected store is missing its settings
     */
    public SagaConfiguration<I> build()
    {
        switch (persistence)
        {
            case Redis:
                if (StringUtils.isBlank(connectionString))
                {
                    throw new IllegalStateException("Redis saga persistence for " + instanceType.getName() + " needs a connection string");
                }
                break;
            case MongoDb:
                if (StringUtils.isBlank(connectionString) || StringUtils.isBlank(databaseName))
                {
                    throw new IllegalStateException("MongoDB saga persistence for " + instanceType.getName() + " needs a connection string and database");
                }
                break;
            case Relational:
                if (repositoryType == null)
                {
                    throw new IllegalStateException("Relational saga persistence for " + instanceType.getName() + " needs a repository type");
                }
                break;
            case InMemory:
            default:
                break;
        }
        return new SagaConfiguration<>(instanceType, persistence, connectionString, databaseName, keyPrefix, repositoryType,
                defaultExpiration, completedExpiration, enableTimeouts, timeoutCheckInterval);
    }

    private static Duration requirePositive(Duration duration, String name)
    {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative() || duration.isZero())
        {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return duration;
    }
}
