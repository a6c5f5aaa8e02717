package com.guicedee.rabbitbus.saga;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * The persisted state of one running saga
 */
@Getter
@Setter
public abstract class SagaInstance
{
    private UUID correlationId;
    private String currentState;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
    /**
     * When set, the saga is handed to its state machine as timed out once this passes
     */
    private Instant timeoutAt;
    private Instant expiresAt;
    private int version;

    public boolean isCompleted()
    {
        return completedAt != null;
    }
}
