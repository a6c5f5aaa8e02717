package com.guicedee.rabbitbus.fixtures.orders;

public class OrderShipped
{
    private String trackingNumber;

    public OrderShipped()
    {
    }

    public OrderShipped(String trackingNumber)
    {
        this.trackingNumber = trackingNumber;
    }

    public String getTrackingNumber()
    {
        return trackingNumber;
    }
}
