package com.guicedee.rabbitbus.implementations;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.vertx.core.Vertx;
import lombok.extern.log4j.Log4j2;

/**
 * The Vert.x instance the bus runs its client and timers on.
 * <p>
 * An application bound {@link Vertx} wins, then the one handed to the configuration builder, then a new instance.
 */
@Log4j2
public class BusVertxProvider implements Provider<Vertx>
{
    @Inject(optional = true)
    private Vertx vertx;

    private final Vertx configured;

    public BusVertxProvider(Vertx configured)
    {
        this.configured = configured;
    }

    @Override
    public synchronized Vertx get()
    {
        if (vertx == null)
        {
            if (configured != null)
            {
                vertx = configured;
            }
            else
            {
                log.info("No Vert.x instance bound, creating one for the RabbitMQ bus");
                vertx = Vertx.vertx();
            }
        }
        return vertx;
    }
}
