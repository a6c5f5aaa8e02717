package com.guicedee.rabbitbus.fixtures.orders;

public class HTTPRequestMessage
{
}
