package com.guicedee.rabbitbus.topology;

import com.guicedee.rabbitbus.ExchangeType;

/**
 * Service loaded listener notified after the {@link TopologyBuilder} declares an exchange
 */
@FunctionalInterface
public interface OnExchangeDeclared
{
    void onExchangeDeclared(String exchangeName, ExchangeType exchangeType);
}
