package com.guicedee.rabbitbus.implementations;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.vertx.core.Vertx;
import io.vertx.rabbitmq.RabbitMQClient;
import io.vertx.rabbitmq.RabbitMQOptions;
import jakarta.inject.Named;
import lombok.extern.log4j.Log4j2;

/**
 * Creates and starts the Vert.x RabbitMQ client on the bus Vert.x instance
 */
@Log4j2
public class RabbitMQClientProvider implements Provider<RabbitMQClient>
{
    @Inject
    @Named(RabbitMQBusModule.BUS_VERTX_NAME)
    private Provider<Vertx> vertx;

    private final RabbitMQOptions options;

    public RabbitMQClientProvider(RabbitMQOptions options)
    {
        this.options = options;
    }

    @Override
    public RabbitMQClient get()
    {
        RabbitMQClient client = RabbitMQClient.create(vertx.get(), options);
        client.start()
              .onComplete(result -> {
                  if (result.succeeded())
                  {
                      log.info("RabbitMQ connected to '{}:{}'", options.getHost(), options.getPort());
                  }
                  else
                  {
                      log.error("Failed to connect to RabbitMQ '{}:{}'", options.getHost(), options.getPort(), result.cause());
                  }
              });
        return client;
    }
}
