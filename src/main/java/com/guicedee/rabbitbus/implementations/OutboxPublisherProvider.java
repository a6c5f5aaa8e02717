package com.guicedee.rabbitbus.implementations;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.guicedee.rabbitbus.outbox.OutboxOptions;
import com.guicedee.rabbitbus.outbox.OutboxPublisher;
import com.guicedee.rabbitbus.outbox.OutboxStore;
import io.vertx.core.Vertx;
import io.vertx.rabbitmq.RabbitMQClient;
import jakarta.inject.Named;

/**
 * Builds the outbox publisher. It is not started here, {@link OutboxPublisher#start()} belongs to the application lifecycle.
 */
public class OutboxPublisherProvider implements Provider<OutboxPublisher>
{
    @Inject
    @Named(RabbitMQBusModule.BUS_VERTX_NAME)
    private Provider<Vertx> vertx;

    @Inject
    private Provider<RabbitMQClient> client;

    @Inject
    private OutboxStore store;

    @Inject
    private OutboxOptions options;

    @Override
    public OutboxPublisher get()
    {
        return new OutboxPublisher(vertx.get(), client.get(), store, options);
    }
}
