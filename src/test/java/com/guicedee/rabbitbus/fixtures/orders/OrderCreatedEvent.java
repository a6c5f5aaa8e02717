package com.guicedee.rabbitbus.fixtures.orders;

public class OrderCreatedEvent
{
    private String orderId;
    private int quantity;

    public OrderCreatedEvent()
    {
    }

    public OrderCreatedEvent(String orderId, int quantity)
    {
        this.orderId = orderId;
        this.quantity = quantity;
    }

    public String getOrderId()
    {
        return orderId;
    }

    public int getQuantity()
    {
        return quantity;
    }
}
