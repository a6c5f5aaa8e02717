package com.guicedee.rabbitbus.outbox;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A message waiting in the outbox
 */
@Getter
@Setter
@ToString(exclude = "payload")
@Accessors(chain = true)
public class OutboxMessage
{
    private String id;
    /**
     * Insertion order, assigned by the store
     */
    private long sequence;
    private String messageType;
    private String exchange;
    private String routingKey;
    private byte[] payload;
    private String contentType = "application/json";
    private boolean compressed;
    private Map<String, Object> headers = new HashMap<>();
    private String correlationId;
    private String causationId;
    private String tenantId;
    private Integer priority;
    private String deduplicationKey;
    private Instant createdAt;

    private OutboxStatus status = OutboxStatus.Pending;
    private int attempts;
    private Instant nextAttemptAt;
    private Instant publishedAt;
    private String lastError;

    public OutboxMessage copy()
    {
        return new OutboxMessage()
                .setId(id)
                .setSequence(sequence)
                .setMessageType(messageType)
                .setExchange(exchange)
                .setRoutingKey(routingKey)
                .setPayload(payload == null ? null : payload.clone())
                .setContentType(contentType)
                .setCompressed(compressed)
                .setHeaders(headers == null ? new HashMap<>() : new HashMap<>(headers))
                .setCorrelationId(correlationId)
                .setCausationId(causationId)
                .setTenantId(tenantId)
                .setPriority(priority)
                .setDeduplicationKey(deduplicationKey)
                .setCreatedAt(createdAt)
                .setStatus(status)
                .setAttempts(attempts)
                .setNextAttemptAt(nextAttemptAt)
                .setPublishedAt(publishedAt)
                .setLastError(lastError);
    }
}
