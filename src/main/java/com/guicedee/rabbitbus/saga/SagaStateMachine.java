package com.guicedee.rabbitbus.saga;

/**
 * The application side of a saga. Event handling lives in the implementation, this layer only delivers timeouts.
 *
 * @param <I> the saga instance type
 */
public abstract class SagaStateMachine<I extends SagaInstance>
{
    public String getName()
    {
        return getClass().getSimpleName();
    }

    /**
     * Called when the instance timeout passes. The instance is saved again afterwards with its timeout cleared.
     */
    public abstract void onTimeout(I instance) throws Exception;
}
