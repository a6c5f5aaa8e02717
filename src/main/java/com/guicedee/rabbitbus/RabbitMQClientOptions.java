package com.guicedee.rabbitbus;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Client wide publish and consume defaults
 */
@Getter
@Setter
@Accessors(chain = true)
public class RabbitMQClientOptions
{
    private String defaultExchange = "";
    private ExchangeType defaultExchangeType = ExchangeType.Direct;
    private int defaultPrefetchCount = 16;
    private boolean confirmPublishes;
    private boolean persistentMessages = true;
    private int maxRedeliveryCount = 5;
    private String clientProvidedName;
}
