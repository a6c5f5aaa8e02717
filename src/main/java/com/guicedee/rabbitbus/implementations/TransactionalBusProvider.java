package com.guicedee.rabbitbus.implementations;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.guicedee.rabbitbus.outbox.OutboxOptions;
import com.guicedee.rabbitbus.outbox.OutboxStore;
import com.guicedee.rabbitbus.outbox.TransactionalBus;
import com.guicedee.rabbitbus.topology.EndpointConvention;

public class TransactionalBusProvider implements Provider<TransactionalBus>
{
    @Inject
    private OutboxStore store;

    @Inject
    private OutboxOptions options;

    @Inject
    private EndpointConvention endpointConvention;

    @Override
    public TransactionalBus get()
    {
        return new TransactionalBus(store, options, endpointConvention);
    }
}
