package com.guicedee.rabbitbus;

/**
 * A consumer of one message type.
 * <p>
 * Implementations are registered together with their message type, so naming and topology never
 * need to look at the generic signature at dispatch time.
 *
 * @param <M> the message type consumed
 */
@FunctionalInterface
public interface MessageConsumer<M>
{
    /**
     * Handles one delivered message
     *
     * @param message the decoded message
     * @throws Exception to signal a failed delivery, classified by the configured retry policy
     */
    void consume(M message) throws Exception;
}
