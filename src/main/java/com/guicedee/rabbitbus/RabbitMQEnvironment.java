package com.guicedee.rabbitbus;

import com.google.common.base.Strings;

/**
 * Reads deployment overrides, system properties first, then environment variables
 */
public final class RabbitMQEnvironment
{
    public static final String RABBIT_MQ_HOST = "RABBIT_MQ_HOST";
    public static final String RABBIT_MQ_PORT = "RABBIT_MQ_PORT";
    public static final String RABBIT_MQ_USER = "RABBIT_MQ_USER";
    public static final String RABBIT_MQ_PASSWORD = "RABBIT_MQ_PASSWORD";
    public static final String RABBIT_MQ_VHOST = "RABBIT_MQ_VHOST";

    private RabbitMQEnvironment()
    {
    }

    public static String getProperty(String name, String defaultValue)
    {
        String value = System.getProperty(name);
        if (Strings.isNullOrEmpty(value))
        {
            value = System.getenv(name);
        }
        return Strings.isNullOrEmpty(value) ? defaultValue : value;
    }
}
