package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ConsumerConfiguration;
import com.guicedee.rabbitbus.MessageConsumer;
import io.github.classgraph.ClassGraph;
import io.github.classgraph.ScanResult;
import lombok.extern.log4j.Log4j2;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Consumer types paired with the message type they consume
 */
@Log4j2
public class ConsumerRegistry
{
    private final ConcurrentMap<Class<?>, ConsumerRegistration<?>> registrations = new ConcurrentHashMap<>();

    public <M, C extends MessageConsumer<M>> ConsumerRegistration<M> register(Class<C> consumerType, Class<M> messageType)
    {
        return register(consumerType, messageType, new ConsumerConfiguration());
    }

    public <M, C extends MessageConsumer<M>> ConsumerRegistration<M> register(Class<C> consumerType, Class<M> messageType, ConsumerConfiguration configuration)
    {
        Objects.requireNonNull(consumerType, "consumerType");
        Objects.requireNonNull(messageType, "messageType");
        Objects.requireNonNull(configuration, "configuration");
        ConsumerRegistration<M> registration = new ConsumerRegistration<>(consumerType, messageType, configuration);
        registrations.put(consumerType, registration);
        log.debug("Registered consumer '{}' for message '{}'", consumerType.getName(), messageType.getName());
        return registration;
    }

    /**
     * Registers a consumer found by a package scan, reading the message type from its {@code MessageConsumer} signature once
     *
     * @throws IllegalStateException when the type is not a consumer or its message type cannot be resolved
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public ConsumerRegistration<?> registerScanned(Class<?> consumerType)
    {
        Objects.requireNonNull(consumerType, "consumerType");
        ConsumerRegistration<?> existing = registrations.get(consumerType);
        if (existing != null)
        {
            return existing;
        }
        if (!MessageConsumer.class.isAssignableFrom(consumerType))
        {
            throw new IllegalStateException("Type " + consumerType.getName() + " does not implement " + MessageConsumer.class.getName());
        }
        Class<?> messageType = resolveMessageType(consumerType);
        if (messageType == null)
        {
            throw new IllegalStateException("Cannot resolve the message type of consumer " + consumerType.getName());
        }
        return register((Class) consumerType, (Class) messageType);
    }

    public Optional<ConsumerRegistration<?>> find(Class<?> consumerType)
    {
        Objects.requireNonNull(consumerType, "consumerType");
        return Optional.ofNullable(registrations.get(consumerType));
    }

    public boolean unregister(Class<?> consumerType)
    {
        return registrations.remove(consumerType) != null;
    }

    public List<ConsumerRegistration<?>> getRegistrations()
    {
        List<ConsumerRegistration<?>> list = new ArrayList<>(registrations.values());
        list.sort(Comparator.comparing((ConsumerRegistration<?> r) -> r.getConsumerType().getName()));
        return list;
    }

    /**
     * Lists the concrete {@link MessageConsumer} implementations in the given packages, sorted by name
     */
    public List<Class<?>> scan(String... packages)
    {
        Objects.requireNonNull(packages, "packages");
        List<Class<?>> found = new ArrayList<>();
        try (ScanResult scanResult = new ClassGraph()
                .enableClassInfo()
                .acceptPackages(packages)
                .scan())
        {
            found.addAll(scanResult.getClassesImplementing(MessageConsumer.class.getName())
                    .filter(classInfo -> !classInfo.isAbstract() && !classInfo.isInterface())
                    .loadClasses());
        }
        found.sort(Comparator.comparing(Class::getName));
        log.debug("Found {} consumers in {}", found.size(), String.join(", ", packages));
        return found;
    }

    /**
     * Follows the generic interfaces and superclasses of a type to the argument bound to {@code MessageConsumer<M>}
     *
     * @return the message class or null when it is not bound to a concrete type
     */
    static Class<?> resolveMessageType(Class<?> consumerType)
    {
        return resolve(consumerType, new HashMap<>());
    }

    private static Class<?> resolve(Type type, Map<TypeVariable<?>, Type> bindings)
    {
        Class<?> raw;
        Map<TypeVariable<?>, Type> scope = bindings;
        if (type instanceof ParameterizedType)
        {
            ParameterizedType parameterized = (ParameterizedType) type;
            raw = (Class<?>) parameterized.getRawType();
            TypeVariable<?>[] variables = raw.getTypeParameters();
            Type[] arguments = parameterized.getActualTypeArguments();
            scope = new HashMap<>(bindings);
            for (int i = 0; i < variables.length; i++)
            {
                Type argument = arguments[i];
                if (argument instanceof TypeVariable && bindings.containsKey(argument))
                {
                    argument = bindings.get(argument);
                }
                scope.put(variables[i], argument);
            }
            if (raw == MessageConsumer.class)
            {
                return toClass(scope.get(variables[0]));
            }
        }
        else if (type instanceof Class)
        {
            raw = (Class<?>) type;
        }
        else
        {
            return null;
        }
        for (Type generic : raw.getGenericInterfaces())
        {
            Class<?> resolved = resolve(generic, scope);
            if (resolved != null)
            {
                return resolved;
            }
        }
        Type superType = raw.getGenericSuperclass();
        return superType == null ? null : resolve(superType, scope);
    }

    private static Class<?> toClass(Type type)
    {
        if (type instanceof Class)
        {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType)
        {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }
        return null;
    }
}
