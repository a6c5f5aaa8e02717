package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.MessageConsumer;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Derives queue, exchange and routing key names from types.
 * <p>
 * The formatter keeps a private copy of its options, every method is a pure function of the arguments and that copy.
 */
public class EndpointNameFormatter
{
    private final EndpointNamingOptions options;

    public EndpointNameFormatter()
    {
        this(new EndpointNamingOptions());
    }

    public EndpointNameFormatter(EndpointNamingOptions options)
    {
        this.options = Objects.requireNonNull(options, "options").copy();
    }

    /**
     * @return a copy of the options in use
     */
    public EndpointNamingOptions getOptions()
    {
        return options.copy();
    }

    /**
     * The queue name of a consumer or message type, {@code OrderCreatedConsumer} and {@code OrderCreated} give {@code order-created-queue}.
     * A {@link MessageConsumer} is named after the message type it consumes when that type can be resolved.
     */
    public String formatQueueName(Class<?> type)
    {
        Objects.requireNonNull(type, "type");
        Class<?> named = type;
        if (MessageConsumer.class.isAssignableFrom(type))
        {
            Class<?> messageType = ConsumerRegistry.resolveMessageType(type);
            if (messageType != null)
            {
                named = messageType;
            }
        }
        return format(baseName(named), options.getQueueSuffix());
    }

    /**
     * The queue name of a consumer registered for a message type. The message type names the queue when known.
     */
    public String formatQueueName(Class<?> consumerType, Class<?> messageType)
    {
        Objects.requireNonNull(consumerType, "consumerType");
        return formatQueueName(messageType != null ? messageType : consumerType);
    }

    public String formatExchangeName(Class<?> messageType)
    {
        Objects.requireNonNull(messageType, "messageType");
        return format(baseName(messageType), options.getExchangeSuffix());
    }

    public String formatRoutingKey(Class<?> messageType)
    {
        Objects.requireNonNull(messageType, "messageType");
        String separator = options.getRoutingKeySeparator();
        String key = NameTransforms.applyCasing(baseName(messageType), options.getCasing(), options.getSeparator());
        if (options.isIncludeNamespaceInRoutingKey())
        {
            String namespace = NameTransforms.namespaceTail(messageType, options.getNamespaceDepth());
            if (!namespace.isEmpty())
            {
                key = namespace.toLowerCase().replace(".", separator) + separator + key;
            }
        }
        return key;
    }

    public String formatDeadLetterQueueName(String queueName)
    {
        requireName(queueName, "queueName");
        return queueName + options.getSeparator() + options.getDeadLetterQueueSuffix();
    }

    public String formatDeadLetterExchangeName(String exchangeName)
    {
        requireName(exchangeName, "exchangeName");
        return exchangeName + options.getSeparator() + options.getDeadLetterExchangeSuffix();
    }

    /**
     * @param level the retry level, starting at 1
     * @throws IllegalArgumentException when the level is below 1
     */
    public String formatRetryQueueName(String queueName, int level)
    {
        requireName(queueName, "queueName");
        if (level < 1)
        {
            throw new IllegalArgumentException("Retry level must be at least 1 but was " + level);
        }
        String separator = options.getSeparator();
        return queueName + separator + options.getRetrySuffix() + separator + level;
    }

    public String formatRetryExchangeName(String exchangeName)
    {
        requireName(exchangeName, "exchangeName");
        return exchangeName + options.getSeparator() + options.getRetrySuffix();
    }

    /**
     * A unique name for a server named style temporary queue
     */
    public String formatTemporaryQueueName()
    {
        String unique = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return applyPrefix(options.getTemporaryQueuePrefix() + options.getSeparator() + unique);
    }

    public String sanitizeName(String raw)
    {
        return NameTransforms.sanitize(raw);
    }

    private String baseName(Class<?> type)
    {
        String name = NameTransforms.typeName(type);
        if (options.isStripSuffixes())
        {
            List<String> suffixes = options.getSuffixesToStrip();
            name = NameTransforms.stripSuffix(name, suffixes == null ? List.of() : suffixes);
        }
        return name;
    }

    private String format(String baseName, String artifactSuffix)
    {
        String separator = options.getSeparator();
        String name = StringUtils.isBlank(artifactSuffix) ? baseName : baseName + separator + artifactSuffix;
        name = NameTransforms.applyCasing(name, options.getCasing(), separator);
        name = applyPrefix(name);
        if (StringUtils.isNotBlank(options.getSuffix()))
        {
            name = name + separator + options.getSuffix();
        }
        return name;
    }

    private String applyPrefix(String name)
    {
        if (StringUtils.isNotBlank(options.getPrefix()))
        {
            return options.getPrefix() + options.getSeparator() + name;
        }
        return name;
    }

    private static void requireName(String name, String argument)
    {
        Objects.requireNonNull(name, argument);
        if (StringUtils.isBlank(name))
        {
            throw new IllegalArgumentException(argument + " cannot be blank");
        }
    }
}
