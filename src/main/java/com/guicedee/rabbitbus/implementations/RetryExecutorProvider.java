package com.guicedee.rabbitbus.implementations;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.guicedee.rabbitbus.resilience.RetryExecutor;
import com.guicedee.rabbitbus.resilience.RetryPolicyConfiguration;
import io.vertx.core.Vertx;
import jakarta.inject.Named;

public class RetryExecutorProvider implements Provider<RetryExecutor>
{
    @Inject
    @Named(RabbitMQBusModule.BUS_VERTX_NAME)
    private Provider<Vertx> vertx;

    @Inject
    private RetryPolicyConfiguration policy;

    @Override
    public RetryExecutor get()
    {
        return new RetryExecutor(vertx.get(), policy);
    }
}
