package com.guicedee.rabbitbus.fixtures.orders;

import com.guicedee.rabbitbus.MessageConsumer;

public class OrderCreatedConsumer implements MessageConsumer<OrderCreatedEvent>
{
    @Override
    public void consume(OrderCreatedEvent message)
    {
    }
}
