package com.guicedee.rabbitbus.fixtures.saga;

import com.guicedee.rabbitbus.saga.SagaStateMachine;

import java.util.ArrayList;
import java.util.List;

public class OrderSaga extends SagaStateMachine<OrderSagaInstance>
{
    private final List<OrderSagaInstance> timedOut = new ArrayList<>();

    @Override
    public void onTimeout(OrderSagaInstance instance) throws Exception
    {
        if ("Poisoned".equals(instance.getCurrentState()))
        {
            throw new IllegalStateException("Cannot time out a poisoned saga");
        }
        instance.setCurrentState("TimedOut");
        timedOut.add(instance);
    }

    public List<OrderSagaInstance> getTimedOut()
    {
        return timedOut;
    }
}
