package com.guicedee.rabbitbus.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guicedee.rabbitbus.topology.EndpointConvention;
import com.guicedee.rabbitbus.topology.MessageTopology;
import lombok.extern.log4j.Log4j2;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.zip.GZIPOutputStream;

/**
 * Stages outgoing messages on the calling thread and writes them to the outbox in one step,
 * so they are stored with the unit of work that produced them.
 */
@Log4j2
public class TransactionalBus
{
    public static final String CORRELATION_ID_HEADER = "x-correlation-id";
    public static final String CORRELATION_ID_ALT_HEADER = "correlationId";
    public static final String CAUSATION_ID_HEADER = "x-causation-id";
    public static final String TENANT_ID_HEADER = "x-tenant-id";
    public static final String PRIORITY_HEADER = "x-priority";
    public static final String DEDUPLICATION_HEADER = "x-deduplication-id";

    private final OutboxStore store;
    private final OutboxOptions options;
    private final EndpointConvention endpointConvention;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ThreadLocal<List<OutboxMessage>> pending = ThreadLocal.withInitial(ArrayList::new);

    public TransactionalBus(OutboxStore store, OutboxOptions options, EndpointConvention endpointConvention)
    {
        this(store, options, endpointConvention, new ObjectMapper().findAndRegisterModules(), Clock.systemUTC());
    }

    public TransactionalBus(OutboxStore store, OutboxOptions options, EndpointConvention endpointConvention, ObjectMapper objectMapper,
                            Clock clock)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.options = Objects.requireNonNull(options, "options");
        this.endpointConvention = Objects.requireNonNull(endpointConvention, "endpointConvention");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public OutboxMessage publish(Object message)
    {
        return publish(message, Map.of(), null);
    }

    public OutboxMessage publish(Object message, Map<String, Object> headers)
    {
        return publish(message, headers, null);
    }

    /**
     * Stages a message for the current thread
     *
     * @param routingKey overrides the routing key derived for the message type, may be null
     */
    public OutboxMessage publish(Object message, Map<String, Object> headers, String routingKey)
    {
        Objects.requireNonNull(message, "message");
        Map<String, Object> messageHeaders = headers == null ? new HashMap<>() : new HashMap<>(headers);
        Class<?> messageType = message.getClass();
        String id = UUID.randomUUID().toString();

        byte[] payload = serialize(message);
        boolean compressed = false;
        if (options.getCompressionThreshold() > 0 && payload.length > options.getCompressionThreshold())
        {
            payload = gzip(payload);
            compressed = true;
        }
        OutboxMessage outboxMessage = new OutboxMessage()
                .setId(id)
                .setMessageType(messageType.getName())
                .setExchange(endpointConvention.getExchangeName(messageType))
                .setRoutingKey(routingKey != null ? routingKey : endpointConvention.getRoutingKey(messageType))
                .setPayload(payload)
                .setCompressed(compressed)
                .setHeaders(messageHeaders)
                .setCorrelationId(header(messageHeaders, CORRELATION_ID_HEADER, header(messageHeaders, CORRELATION_ID_ALT_HEADER, id)))
                .setCausationId(header(messageHeaders, CAUSATION_ID_HEADER, null))
                .setTenantId(header(messageHeaders, TENANT_ID_HEADER, null))
                .setPriority(priority(messageType, messageHeaders))
                .setDeduplicationKey(header(messageHeaders, DEDUPLICATION_HEADER, null))
                .setCreatedAt(clock.instant());
        pending.get().add(outboxMessage);
        log.trace("Staged outbox message '{}' of type '{}'", id, messageType.getName());
        return outboxMessage;
    }

    public List<OutboxMessage> publishBatch(Collection<?> messages)
    {
        Objects.requireNonNull(messages, "messages");
        List<OutboxMessage> staged = new ArrayList<>();
        for (Object message : messages)
        {
            staged.add(publish(message));
        }
        return staged;
    }

    public int getPendingCount()
    {
        return pending.get().size();
    }

    public List<OutboxMessage> getPending()
    {
        return List.copyOf(pending.get());
    }

    public void clearPending()
    {
        pending.remove();
    }

    /**
     * Writes the staged messages of this thread to the store. Duplicates inside the deduplication window are dropped.
     *
     * @return the number of messages stored
     */
    public int flush()
    {
        List<OutboxMessage> staged = pending.get();
        if (staged.isEmpty())
        {
            return 0;
        }
        Instant since = clock.instant().minus(options.getDeduplicationWindow());
        List<OutboxMessage> accepted = new ArrayList<>();
        for (OutboxMessage message : staged)
        {
            if (options.isEnableDeduplication() && message.getDeduplicationKey() != null
                    && (store.containsDeduplicationKey(message.getDeduplicationKey(), since) || containsKey(accepted, message.getDeduplicationKey())))
            {
                log.debug("Dropping duplicate outbox message with key '{}'", message.getDeduplicationKey());
                continue;
            }
            accepted.add(message);
        }
        store.addAll(accepted);
        pending.remove();
        log.debug("Flushed {} messages to the outbox", accepted.size());
        return accepted.size();
    }

    private static boolean containsKey(List<OutboxMessage> messages, String deduplicationKey)
    {
        for (OutboxMessage message : messages)
        {
            if (deduplicationKey.equals(message.getDeduplicationKey()))
            {
                return true;
            }
        }
        return false;
    }

    private Integer priority(Class<?> messageType, Map<String, Object> headers)
    {
        Object value = headers.get(PRIORITY_HEADER);
        if (value instanceof Number)
        {
            return ((Number) value).intValue();
        }
        if (value != null)
        {
            return Integer.valueOf(value.toString());
        }
        return endpointConvention.getTopologyRegistry()
                .getTopology(messageType)
                .map(MessageTopology::getDefaultPriority)
                .orElse(null);
    }

    private static String header(Map<String, Object> headers, String name, String defaultValue)
    {
        Object value = headers.get(name);
        return value == null ? defaultValue : value.toString();
    }

    private byte[] serialize(Object message)
    {
        try
        {
            return objectMapper.writeValueAsBytes(message);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalArgumentException("Cannot serialize message of type " + message.getClass().getName(), e);
        }
    }

    private static byte[] gzip(byte[] payload)
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(payload.length / 2);
        try (GZIPOutputStream gzip = new GZIPOutputStream(bytes))
        {
            gzip.write(payload);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }
}
