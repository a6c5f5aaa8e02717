package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ExchangeType;

import java.time.Duration;
import java.util.Objects;

/**
 * Fluent endpoint naming and declaration defaults
 */
public class EndpointConfigurationBuilder
{
    private EndpointNamingOptions naming = new EndpointNamingOptions();
    private final RoutingKeyOptions routing = new RoutingKeyOptions();
    private final EndpointConventionOptions convention = new EndpointConventionOptions();
    private final TopologyOptions topology = new TopologyOptions();
    private final AutoBindingOptions binding = new AutoBindingOptions();

    /**
     * Restores the default kebab case naming
     */
    public EndpointConfigurationBuilder useConventionalNaming()
    {
        naming = new EndpointNamingOptions();
        return this;
    }

    public EndpointConfigurationBuilder prefix(String prefix)
    {
        naming.setPrefix(prefix);
        return this;
    }

    public EndpointConfigurationBuilder suffix(String suffix)
    {
        naming.setSuffix(suffix);
        return this;
    }

    public EndpointConfigurationBuilder separator(String separator)
    {
        Objects.requireNonNull(separator, "separator");
        naming.setSeparator(separator);
        return this;
    }

    public EndpointConfigurationBuilder useLowerCase()
    {
        naming.setCasing(CasingStyle.LowerCase);
        return this;
    }

    public EndpointConfigurationBuilder useOriginalCasing()
    {
        naming.setCasing(CasingStyle.Preserve);
        return this;
    }

    public EndpointConfigurationBuilder useKebabCase()
    {
        naming.setCasing(CasingStyle.KebabCase).setSeparator("-");
        return this;
    }

    public EndpointConfigurationBuilder useSnakeCase()
    {
        naming.setCasing(CasingStyle.SnakeCase).setSeparator("_");
        return this;
    }

    public EndpointConfigurationBuilder useDotCase()
    {
        naming.setCasing(CasingStyle.LowerCase).setSeparator(".");
        return this;
    }

    public EndpointConfigurationBuilder usePascalCase()
    {
        naming.setCasing(CasingStyle.PascalCase);
        return this;
    }

    public EndpointConfigurationBuilder useCamelCase()
    {
        naming.setCasing(CasingStyle.CamelCase);
        return this;
    }

    public EndpointConfigurationBuilder includeNamespace(boolean includeNamespace)
    {
        naming.setIncludeNamespaceInRoutingKey(includeNamespace);
        routing.setIncludeNamespace(includeNamespace);
        return this;
    }

    public EndpointConfigurationBuilder stripCommonSuffixes(boolean strip)
    {
        naming.setStripSuffixes(strip);
        routing.setStripSuffixes(strip);
        return this;
    }

    public EndpointConfigurationBuilder addSuffixToStrip(String suffix)
    {
        Objects.requireNonNull(suffix, "suffix");
        naming.getSuffixesToStrip().add(suffix);
        routing.getSuffixesToStrip().add(suffix);
        return this;
    }

    public EndpointConfigurationBuilder temporaryQueuePrefix(String prefix)
    {
        Objects.requireNonNull(prefix, "prefix");
        naming.setTemporaryQueuePrefix(prefix);
        return this;
    }

    public EndpointConfigurationBuilder routingKeySeparator(String separator)
    {
        Objects.requireNonNull(separator, "separator");
        naming.setRoutingKeySeparator(separator);
        routing.setSeparator(separator);
        return this;
    }

    public EndpointConfigurationBuilder subscriptionWildcard(SubscriptionWildcard wildcard)
    {
        routing.setSubscriptionWildcard(Objects.requireNonNull(wildcard, "wildcard"));
        return this;
    }

    public EndpointConfigurationBuilder defaultExchangeType(ExchangeType exchangeType)
    {
        Objects.requireNonNull(exchangeType, "exchangeType");
        convention.setDefaultExchangeType(exchangeType);
        binding.setDefaultExchangeType(exchangeType);
        return this;
    }

    public EndpointConfigurationBuilder durable(boolean durable)
    {
        convention.setDefaultDurable(durable);
        binding.setDurable(durable);
        return this;
    }

    public EndpointConfigurationBuilder autoDelete(boolean autoDelete)
    {
        convention.setDefaultAutoDelete(autoDelete);
        binding.setAutoDelete(autoDelete);
        return this;
    }

    public EndpointConfigurationBuilder defaultPrefetchCount(int prefetchCount)
    {
        if (prefetchCount < 0)
        {
            throw new IllegalArgumentException("prefetchCount cannot be negative but was " + prefetchCount);
        }
        convention.setDefaultPrefetchCount(prefetchCount);
        return this;
    }

    public EndpointConfigurationBuilder autoCreateQueues(boolean autoCreate)
    {
        convention.setAutoCreateQueues(autoCreate);
        binding.setCreateDefaultQueue(autoCreate);
        return this;
    }

    public EndpointConfigurationBuilder autoCreateExchanges(boolean autoCreate)
    {
        convention.setAutoCreateExchanges(autoCreate);
        return this;
    }

    public EndpointConfigurationBuilder deadLetter(boolean configure)
    {
        topology.setAutoConfigureDeadLetter(configure);
        binding.setConfigureDeadLetter(configure);
        return this;
    }

    public EndpointConfigurationBuilder retryQueues(int levels)
    {
        if (levels < 1)
        {
            throw new IllegalArgumentException("Retry levels must be at least 1 but was " + levels);
        }
        topology.setAutoConfigureRetryQueues(true).setRetryLevels(levels);
        return this;
    }

    public EndpointConfigurationBuilder defaultMessageTtl(Duration ttl)
    {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative())
        {
            throw new IllegalArgumentException("ttl cannot be negative");
        }
        binding.setDefaultMessageTtlMs(ttl.toMillis());
        return this;
    }

    public EndpointConfigurationBuilder priorityQueues(int maxPriority)
    {
        if (maxPriority < 1 || maxPriority > 255)
        {
            throw new IllegalArgumentException("maxPriority must be between 1 and 255 but was " + maxPriority);
        }
        binding.setEnablePriorityQueue(true).setMaxPriority(maxPriority);
        return this;
    }

    public EndpointConfigurationBuilder continueOnError(boolean continueOnError)
    {
        binding.setContinueOnError(continueOnError);
        return this;
    }

    public EndpointConfiguration build()
    {
        EndpointConventionOptions options = convention.copy()
                .setNamingOptions(naming.copy())
                .setRoutingKeyOptions(routing.copy());
        return new EndpointConfiguration(options, topology.copy(), binding.copy());
    }
}
