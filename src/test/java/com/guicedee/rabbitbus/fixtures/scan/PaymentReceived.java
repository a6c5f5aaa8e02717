package com.guicedee.rabbitbus.fixtures.scan;

public class PaymentReceived
{
}
