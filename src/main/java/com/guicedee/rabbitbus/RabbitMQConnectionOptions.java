package com.guicedee.rabbitbus;

import com.google.common.base.Strings;
import io.vertx.rabbitmq.RabbitMQOptions;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Broker connection settings, converted to Vert.x {@link RabbitMQOptions} when the client is created
 */
@Getter
@Setter
@Accessors(chain = true)
public class RabbitMQConnectionOptions
{
    /**
     * A full amqp:// uri, wins over the discrete host settings when set
     */
    private String uri;
    private String host = "localhost";
    private int port = 5672;
    private String user = "guest";
    private String password = "guest";
    private String virtualHost = "/";
    private String connectionName;
    private int connectionTimeout;
    private int handshakeTimeout;
    private int requestedHeartbeat;
    private int requestedChannelMax;
    private long networkRecoveryInterval;
    private boolean automaticRecoveryEnabled;
    private int reconnectAttempts;
    private long reconnectInterval;
    private boolean useNio;
    private boolean confirmPublishes;

    public RabbitMQOptions toOptions()
    {
        RabbitMQOptions opt = new RabbitMQOptions();
        if (reconnectAttempts != 0)
        {
            opt.setReconnectAttempts(reconnectAttempts);
        }
        if (reconnectInterval != 0L)
        {
            opt.setReconnectInterval(reconnectInterval);
        }
        opt.setHost(RabbitMQEnvironment.getProperty(RabbitMQEnvironment.RABBIT_MQ_HOST, host));
        opt.setPort(Integer.parseInt(RabbitMQEnvironment.getProperty(RabbitMQEnvironment.RABBIT_MQ_PORT, String.valueOf(port))));
        String resolvedUser = RabbitMQEnvironment.getProperty(RabbitMQEnvironment.RABBIT_MQ_USER, user);
        if (!Strings.isNullOrEmpty(resolvedUser))
        {
            opt.setUser(resolvedUser);
        }
        String resolvedPassword = RabbitMQEnvironment.getProperty(RabbitMQEnvironment.RABBIT_MQ_PASSWORD, password);
        if (!Strings.isNullOrEmpty(resolvedPassword))
        {
            opt.setPassword(resolvedPassword);
        }
        String resolvedVirtualHost = RabbitMQEnvironment.getProperty(RabbitMQEnvironment.RABBIT_MQ_VHOST, virtualHost);
        if (!Strings.isNullOrEmpty(resolvedVirtualHost))
        {
            opt.setVirtualHost(resolvedVirtualHost);
        }
        if (!Strings.isNullOrEmpty(connectionName))
        {
            opt.setConnectionName(connectionName);
        }
        opt.setAutomaticRecoveryEnabled(automaticRecoveryEnabled);
        if (!Strings.isNullOrEmpty(uri))
        {
            opt.setUri(uri);
        }
        if (connectionTimeout != 0)
        {
            opt.setConnectionTimeout(connectionTimeout);
        }
        if (handshakeTimeout != 0)
        {
            opt.setHandshakeTimeout(handshakeTimeout);
        }
        if (requestedHeartbeat != 0)
        {
            opt.setRequestedHeartbeat(requestedHeartbeat);
        }
        if (useNio)
        {
            opt.setUseNio(true);
        }
        if (requestedChannelMax != 0)
        {
            opt.setRequestedChannelMax(requestedChannelMax);
        }
        if (networkRecoveryInterval != 0L)
        {
            opt.setNetworkRecoveryInterval(networkRecoveryInterval);
        }
        return opt;
    }
}
